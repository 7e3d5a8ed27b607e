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
package org.apache.sling.auth.feishu.spi;

import org.apache.sling.auth.feishu.UserInfoVariant;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Names of the provider fields that populate the normalized profile.
 *
 * <p>A {@code null} field name means the provider never sends that value.</p>
 */
public final class ProfileFieldMapping {

    /** Field names of the user info endpoint response. */
    public static final ProfileFieldMapping DIRECT = new ProfileFieldMapping("name", "name", "avatar_url", "email");

    /** Field names of the decrypted miniapp user data. */
    public static final ProfileFieldMapping MINIAPP = new ProfileFieldMapping("nickName", "nickName", "avatarUrl", null);

    private final @Nullable String nickname;
    private final @Nullable String name;
    private final @Nullable String image;
    private final @Nullable String email;

    public ProfileFieldMapping(@Nullable String nickname, @Nullable String name, @Nullable String image,
                               @Nullable String email) {
        this.nickname = nickname;
        this.name = name;
        this.image = image;
        this.email = email;
    }

    public static @NotNull ProfileFieldMapping forVariant(@NotNull UserInfoVariant variant) {
        return variant == UserInfoVariant.DIRECT ? DIRECT : MINIAPP;
    }

    public @Nullable String nickname() {
        return nickname;
    }

    public @Nullable String name() {
        return name;
    }

    public @Nullable String image() {
        return image;
    }

    public @Nullable String email() {
        return email;
    }
}
