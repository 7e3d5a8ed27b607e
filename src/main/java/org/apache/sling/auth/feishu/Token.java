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
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of an authorization code exchange.
 *
 * <p>Parameters the provider sent which are not part of the standard token response are kept
 * in {@link #otherParams()}. Instances are immutable.</p>
 */
public final class Token {

    private final @Nullable String accessToken;
    private final @Nullable String refreshToken;
    private final @Nullable Long expiresAt;
    private final @Nullable String tokenType;
    private final Map<String, Object> otherParams;

    public Token(@Nullable String accessToken, @Nullable String refreshToken, @Nullable Long expiresAt,
                 @Nullable String tokenType, @NotNull Map<String, Object> otherParams) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
        this.tokenType = tokenType;
        this.otherParams = Collections.unmodifiableMap(new LinkedHashMap<>(otherParams));
    }

    public @Nullable String accessToken() {
        return accessToken;
    }

    public @Nullable String refreshToken() {
        return refreshToken;
    }

    /**
     * @return the expiry as seconds since the epoch, or {@code null} if the token does not expire
     */
    public @Nullable Long expiresAt() {
        return expiresAt;
    }

    public @Nullable String tokenType() {
        return tokenType;
    }

    public @NotNull Map<String, Object> otherParams() {
        return otherParams;
    }

    public @Nullable String otherParam(@NotNull String name) {
        Object value = otherParams.get(name);
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        // never print the token values
        return "Token[type=" + tokenType + ", expiresAt=" + expiresAt + ", otherParams=" + otherParams.keySet() + "]";
    }
}
