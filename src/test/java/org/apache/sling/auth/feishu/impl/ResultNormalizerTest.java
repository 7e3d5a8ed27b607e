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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.apache.sling.auth.feishu.Credentials;
import org.apache.sling.auth.feishu.Profile;
import org.apache.sling.auth.feishu.RawInfo;
import org.apache.sling.auth.feishu.Token;
import org.apache.sling.auth.feishu.spi.ProfileFieldMapping;
import org.junit.jupiter.api.Test;

class ResultNormalizerTest {

    private final ResultNormalizer direct = new ResultNormalizer(ProfileFieldMapping.DIRECT, "feishu");
    private final ResultNormalizer miniapp = new ResultNormalizer(ProfileFieldMapping.MINIAPP, "feishu");

    @Test
    void scopesAreSplitOnCommas() {
        assertThat(ResultNormalizer.scopes("read,write")).containsExactly("read", "write");
        assertThat(ResultNormalizer.scopes(" read , ,write,")).containsExactly("read", "write");
    }

    @Test
    void emptyScopeYieldsNoScopes() {
        assertThat(ResultNormalizer.scopes("")).isEmpty();
        assertThat(ResultNormalizer.scopes(null)).isEmpty();
    }

    @Test
    void credentialsFromToken() {
        Map<String, Object> other = new HashMap<>();
        other.put("scope", "read,write");
        other.put("open_id", "ou_1");
        Token token = new Token("at", "rt", 1700000000L, "Bearer", other);

        Credentials credentials = direct.credentials(token);

        assertThat(credentials.token()).isEqualTo("at");
        assertThat(credentials.refreshToken()).isEqualTo("rt");
        assertThat(credentials.expiresAt()).isEqualTo(1700000000L);
        assertThat(credentials.expires()).isTrue();
        assertThat(credentials.tokenType()).isEqualTo("Bearer");
        assertThat(credentials.scopes()).containsExactly("read", "write");
        assertThat(credentials.other()).containsEntry("open_id", "ou_1");
    }

    @Test
    void credentialsFallBackToConfiguredTokenType() {
        Credentials credentials = direct.credentials(new Token("at", null, null, null, Collections.emptyMap()));

        assertThat(credentials.tokenType()).isEqualTo("feishu");
        assertThat(credentials.expires()).isFalse();
        assertThat(credentials.scopes()).isEmpty();
    }

    @Test
    void directProfile() {
        Map<String, Object> user = Map.of(
                "name", "Zhang San",
                "avatar_url", "https://img.example.com/z.png",
                "email", "zhang@example.com");

        Profile profile = direct.profile(user);

        assertThat(profile.nickname()).isEqualTo("Zhang San");
        assertThat(profile.name()).isEqualTo("Zhang San");
        assertThat(profile.image()).isEqualTo("https://img.example.com/z.png");
        assertThat(profile.email()).isEqualTo("zhang@example.com");
    }

    @Test
    void miniappProfileHasNoEmail() {
        Map<String, Object> user = Map.of(
                "nickName", "Band",
                "avatarUrl", "https://img.example.com/b.png",
                "email", "ignored@example.com");

        Profile profile = miniapp.profile(user);

        assertThat(profile.nickname()).isEqualTo("Band");
        assertThat(profile.name()).isEqualTo("Band");
        assertThat(profile.image()).isEqualTo("https://img.example.com/b.png");
        assertThat(profile.email()).isNull();
    }

    @Test
    void absentAndEmptyFieldsAreNull() {
        Profile profile = direct.profile(Map.of("name", ""));

        assertThat(profile.name()).isNull();
        assertThat(profile.image()).isNull();
    }

    @Test
    void uidFromConfiguredField() {
        Map<String, Object> user = Map.of("open_id", "ou_1", "union_id", "on_2");

        assertThat(direct.uid(user, "open_id")).isEqualTo("ou_1");
        assertThat(direct.uid(user, "union_id")).isEqualTo("on_2");
        assertThat(direct.uid(user, "user_id")).isNull();
    }

    @Test
    void rawInfoKeepsTokenAndUser() {
        Token token = new Token("at", null, null, null, Collections.emptyMap());

        RawInfo info = direct.rawInfo(token, Map.of("name", "Zhang San"));

        assertThat(info.token()).isSameAs(token);
        assertThat(info.user()).containsEntry("name", "Zhang San");
    }
}
