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

/**
 * How the user profile is obtained once the authorization code has been exchanged.
 */
public enum UserInfoVariant {

    /** A bearer token call to the user info endpoint. */
    DIRECT("open_id"),

    /** Signed and AES encrypted user data sent along with the callback, decrypted with the session key. */
    MINIAPP("openId");

    private final String defaultUidField;

    UserInfoVariant(String defaultUidField) {
        this.defaultUidField = defaultUidField;
    }

    /**
     * @return the profile field holding the provider-unique user id when none is configured
     */
    public @NotNull String defaultUidField() {
        return defaultUidField;
    }
}
