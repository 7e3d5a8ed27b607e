/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.sling.auth.feishu;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Provider independent view of the token obtained for a user.
 */
public final class Credentials {

    private final @Nullable String token;
    private final @Nullable String refreshToken;
    private final @Nullable Long expiresAt;
    private final @NotNull String tokenType;
    private final Set<String> scopes;
    private final Map<String, Object> other;

    public Credentials(@Nullable String token, @Nullable String refreshToken, @Nullable Long expiresAt,
                       @NotNull String tokenType, @NotNull Set<String> scopes, @NotNull Map<String, Object> other) {
        this.token = token;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
        this.tokenType = tokenType;
        this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
        this.other = Collections.unmodifiableMap(new LinkedHashMap<>(other));
    }

    public @Nullable String token() {
        return token;
    }

    public @Nullable String refreshToken() {
        return refreshToken;
    }

    public @Nullable Long expiresAt() {
        return expiresAt;
    }

    public @NotNull String tokenType() {
        return tokenType;
    }

    /**
     * @return true if the token carries an expiry, false if it has none
     */
    public boolean expires() {
        return expiresAt != null;
    }

    /**
     * @return the granted scopes, in the order the provider listed them
     */
    public @NotNull Set<String> scopes() {
        return scopes;
    }

    public @NotNull Map<String, Object> other() {
        return other;
    }
}
