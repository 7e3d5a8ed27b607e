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

import java.net.URI;

import org.apache.sling.auth.feishu.ClientConnection;
import org.apache.sling.auth.feishu.UserInfoVariant;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.AttributeType;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Component(service = {ClientConnection.class, FeishuConnection.class})
@Designate(ocd = FeishuConnection.Config.class, factory = true)
public class FeishuConnection implements ClientConnection {

    /**
     * Names of the client credential parameters sent to the provider.
     */
    public enum CredentialParameterStyle {
        /** {@code app_id} and {@code app_secret} */
        APP,
        /** {@code client_id} and {@code client_secret} */
        CLIENT
    }

    /**
     * Encoding of the token request body.
     */
    public enum TokenRequestFormat {
        JSON,
        FORM
    }

    @ObjectClassDefinition(
            name = "Apache Sling Feishu Connection",
            description = "Client credentials and endpoints of a Feishu application")
    public @interface Config {

        @AttributeDefinition(name = "Name", description = "Unique name of this connection")
        String name() default "feishu";

        @AttributeDefinition(name = "Authorization Endpoint")
        String authorizationEndpoint() default "https://open.feishu.cn/connect/qrconnect/page/sso";

        @AttributeDefinition(name = "Token Endpoint")
        String tokenEndpoint() default "https://open.feishu.cn/connect/qrconnect/oauth2/access_token/";

        @AttributeDefinition(name = "User Info URL", description = "Only used by the DIRECT user info variant")
        String userInfoUrl() default "https://open.feishu.cn/connect/qrconnect/oauth2/user_info/";

        @AttributeDefinition(name = "Client ID", description = "The App ID issued by Feishu")
        String clientId();

        @AttributeDefinition(name = "Client Secret", description = "The App Secret issued by Feishu",
                type = AttributeType.PASSWORD)
        String clientSecret();

        @AttributeDefinition(name = "Default Scope",
                description = "Scope requested when the request does not carry a 'scope' parameter")
        String defaultScope() default "snsapi_userinfo";

        @AttributeDefinition(name = "Send Redirect URI",
                description = "Disable when the redirect URI is registered with the provider and must not be sent")
        boolean sendRedirectUri() default true;

        @AttributeDefinition(name = "UID Field",
                description = "Profile field holding the unique user id. Empty selects the default of the user info variant")
        String uidField() default "";

        @AttributeDefinition(name = "User Info Variant",
                description = "DIRECT calls the user info endpoint, MINIAPP decrypts the user data sent with the callback")
        UserInfoVariant userInfoVariant() default UserInfoVariant.MINIAPP;

        @AttributeDefinition(name = "Credential Parameter Style",
                description = "APP sends app_id/app_secret, CLIENT sends client_id/client_secret")
        CredentialParameterStyle credentialParameterStyle() default CredentialParameterStyle.APP;

        @AttributeDefinition(name = "Token Request Format")
        TokenRequestFormat tokenRequestFormat() default TokenRequestFormat.JSON;

        @AttributeDefinition(name = "Token Type", description = "Token type reported when the provider sends none")
        String tokenType() default "feishu";

        @AttributeDefinition(name = "Connect Timeout", description = "Connect timeout in milliseconds, 0 means none")
        int connectTimeout() default 5000;

        @AttributeDefinition(name = "Read Timeout", description = "Read timeout in milliseconds, 0 means none")
        int readTimeout() default 10000;

        @AttributeDefinition(name = "Test Code Enabled",
                description = "Accept the code 'test_code' as a successful callback without contacting Feishu")
        boolean testCodeEnabled() default true;

        String webconsole_configurationFactory_nameHint() default
                "Name: {name}, clientId: {clientId}, variant: {userInfoVariant}";
    }

    private static final Logger logger = LoggerFactory.getLogger(FeishuConnection.class);

    private final Config cfg;
    private final URI authorizationEndpoint;
    private final URI tokenEndpoint;
    private final @Nullable URI userInfoUrl;
    private final UserInfoVariant userInfoVariant;

    /**
     * @throws IllegalArgumentException if the configuration is incomplete or invalid
     */
    @Activate
    public FeishuConnection(@NotNull Config cfg) {
        this.cfg = cfg;

        requireValue("name", cfg.name());
        requireValue("clientId", cfg.clientId());
        requireValue("clientSecret", cfg.clientSecret());
        this.authorizationEndpoint = requireEndpoint("authorizationEndpoint", cfg.authorizationEndpoint());
        this.tokenEndpoint = requireEndpoint("tokenEndpoint", cfg.tokenEndpoint());
        this.userInfoVariant = cfg.userInfoVariant() == null ? UserInfoVariant.MINIAPP : cfg.userInfoVariant();
        if (userInfoVariant == UserInfoVariant.DIRECT) {
            this.userInfoUrl = requireEndpoint("userInfoUrl", cfg.userInfoUrl());
        } else {
            this.userInfoUrl = isNullOrEmpty(cfg.userInfoUrl()) ? null : requireEndpoint("userInfoUrl", cfg.userInfoUrl());
        }
        if (cfg.connectTimeout() < 0 || cfg.readTimeout() < 0) {
            throw new IllegalArgumentException("Timeouts must not be negative");
        }

        logger.info("Feishu connection '{}' activated, user info variant {}", cfg.name(), userInfoVariant);
    }

    private static void requireValue(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format("%s missing from Feishu connection configuration", key));
        }
    }

    private static URI requireEndpoint(String key, String value) {
        requireValue(key, value);
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("%s is not a valid URI: %s", key, value), e);
        }
        if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
            throw new IllegalArgumentException(String.format("%s must be an absolute http(s) URI: %s", key, value));
        }
        return uri;
    }

    private static boolean isNullOrEmpty(String str) {
        return str == null || str.isEmpty();
    }

    @Override
    public @NotNull String name() {
        return cfg.name();
    }

    @Override
    public @NotNull UserInfoVariant userInfoVariant() {
        return userInfoVariant;
    }

    public @NotNull URI authorizationEndpoint() {
        return authorizationEndpoint;
    }

    public @NotNull URI tokenEndpoint() {
        return tokenEndpoint;
    }

    /**
     * @throws IllegalStateException if no user info URL is configured
     */
    public @NotNull URI userInfoUrl() {
        if (userInfoUrl == null) {
            throw new IllegalStateException("No user info URL configured for connection " + cfg.name());
        }
        return userInfoUrl;
    }

    public @NotNull String clientId() {
        return cfg.clientId();
    }

    public @NotNull String clientSecret() {
        return cfg.clientSecret();
    }

    public @NotNull String defaultScope() {
        return cfg.defaultScope() == null ? "" : cfg.defaultScope();
    }

    public boolean sendRedirectUri() {
        return cfg.sendRedirectUri();
    }

    public @NotNull String uidField() {
        if (isNullOrEmpty(cfg.uidField())) {
            return userInfoVariant.defaultUidField();
        }
        return cfg.uidField();
    }

    public @NotNull CredentialParameterStyle credentialParameterStyle() {
        return cfg.credentialParameterStyle() == null ? CredentialParameterStyle.APP : cfg.credentialParameterStyle();
    }

    public @NotNull TokenRequestFormat tokenRequestFormat() {
        return cfg.tokenRequestFormat() == null ? TokenRequestFormat.JSON : cfg.tokenRequestFormat();
    }

    public @NotNull String tokenType() {
        return isNullOrEmpty(cfg.tokenType()) ? "feishu" : cfg.tokenType();
    }

    public int connectTimeout() {
        return cfg.connectTimeout();
    }

    public int readTimeout() {
        return cfg.readTimeout();
    }

    public boolean testCodeEnabled() {
        return cfg.testCodeEnabled();
    }
}
