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
package org.apache.sling.auth.feishu.impl;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.apache.sling.auth.feishu.Credentials;
import org.apache.sling.auth.feishu.Profile;
import org.apache.sling.auth.feishu.RawInfo;
import org.apache.sling.auth.feishu.Token;
import org.apache.sling.auth.feishu.spi.ProfileFieldMapping;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Maps the provider specific token and user data to the provider independent result types.
 */
public class ResultNormalizer {

    static final String SCOPE = "scope";
    private static final String SCOPE_SEPARATOR = ",";

    private final ProfileFieldMapping mapping;
    private final String defaultTokenType;

    public ResultNormalizer(@NotNull ProfileFieldMapping mapping, @NotNull String defaultTokenType) {
        this.mapping = mapping;
        this.defaultTokenType = defaultTokenType;
    }

    public @NotNull Credentials credentials(@NotNull Token token) {
        String tokenType = token.tokenType();
        return new Credentials(
                token.accessToken(),
                token.refreshToken(),
                token.expiresAt(),
                tokenType == null || tokenType.isBlank() ? defaultTokenType : tokenType,
                scopes(token.otherParam(SCOPE)),
                token.otherParams());
    }

    public @NotNull Profile profile(@NotNull Map<String, Object> user) {
        return new Profile(
                field(user, mapping.nickname()),
                field(user, mapping.name()),
                field(user, mapping.image()),
                field(user, mapping.email()));
    }

    public @NotNull RawInfo rawInfo(@NotNull Token token, @NotNull Map<String, Object> user) {
        return new RawInfo(token, user);
    }

    public @Nullable String uid(@NotNull Map<String, Object> user, @NotNull String uidField) {
        return field(user, uidField);
    }

    /**
     * Splits a comma separated scope list. Blank entries are dropped, so an empty list yields an empty set.
     */
    static @NotNull Set<String> scopes(@Nullable String scope) {
        Set<String> scopes = new LinkedHashSet<>();
        if (scope == null) {
            return scopes;
        }
        for (String s : scope.split(SCOPE_SEPARATOR)) {
            String trimmed = s.trim();
            if (!trimmed.isEmpty()) {
                scopes.add(trimmed);
            }
        }
        return scopes;
    }

    private static @Nullable String field(@NotNull Map<String, Object> user, @Nullable String name) {
        if (name == null) {
            return null;
        }
        Object value = user.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isEmpty() ? null : text;
    }
}
