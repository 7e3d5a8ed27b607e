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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Everything the host needs after a successful callback.
 */
public final class AuthResult {

    private final String provider;
    private final @Nullable String uid;
    private final Credentials credentials;
    private final Profile info;
    private final RawInfo extra;

    public AuthResult(@NotNull String provider, @Nullable String uid, @NotNull Credentials credentials,
                      @NotNull Profile info, @NotNull RawInfo extra) {
        this.provider = provider;
        this.uid = uid;
        this.credentials = credentials;
        this.info = info;
        this.extra = extra;
    }

    /**
     * @return the name of the connection that authenticated the user
     */
    public @NotNull String provider() {
        return provider;
    }

    public @Nullable String uid() {
        return uid;
    }

    public @NotNull Credentials credentials() {
        return credentials;
    }

    public @NotNull Profile info() {
        return info;
    }

    public @NotNull RawInfo extra() {
        return extra;
    }
}
