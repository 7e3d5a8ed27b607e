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

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.nimbusds.common.contenttype.ContentType;
import com.nimbusds.oauth2.sdk.AuthorizationRequest;
import com.nimbusds.oauth2.sdk.GrantType;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.ResponseType;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import com.nimbusds.oauth2.sdk.util.URLUtils;
import net.minidev.json.JSONObject;
import org.apache.sling.auth.feishu.DataInvalidException;
import org.apache.sling.auth.feishu.FeishuAuthException;
import org.apache.sling.auth.feishu.MissingCodeException;
import org.apache.sling.auth.feishu.ProviderErrorException;
import org.apache.sling.auth.feishu.Token;
import org.apache.sling.auth.feishu.TransportException;
import org.apache.sling.auth.feishu.impl.FeishuConnection.CredentialParameterStyle;
import org.apache.sling.auth.feishu.impl.FeishuConnection.TokenRequestFormat;
import org.apache.sling.auth.feishu.spi.HttpTransport;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OAuth 2.0 client for a single {@link FeishuConnection}.
 *
 * <p>Builds authorization URLs, exchanges authorization codes for tokens and reads the user info
 * endpoint. The client holds no per-request state and may be shared between threads.</p>
 */
public class FeishuOAuthClient {

    static final String PARAM_APP_ID = "app_id";
    static final String PARAM_APP_SECRET = "app_secret";
    static final String PARAM_CLIENT_ID = "client_id";
    static final String PARAM_CLIENT_SECRET = "client_secret";
    static final String PARAM_CODE = "code";
    static final String PARAM_GRANT_TYPE = "grant_type";

    static final String ACCESS_TOKEN = "access_token";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String TOKEN_TYPE = "token_type";
    static final String EXPIRES_IN = "expires_in";
    static final String EXPIRES_AT = "expires_at";
    static final String ERROR = "error";
    static final String ERROR_DESCRIPTION = "error_description";
    static final String ERRCODE = "errcode";
    static final String ERRMSG = "errmsg";

    private static final String APPLICATION_JSON = "application/json";

    private static final Logger logger = LoggerFactory.getLogger(FeishuOAuthClient.class);

    private final FeishuConnection connection;
    private final HttpTransport transport;
    private final Clock clock;

    public FeishuOAuthClient(@NotNull FeishuConnection connection, @NotNull HttpTransport transport) {
        this(connection, transport, Clock.systemUTC());
    }

    FeishuOAuthClient(@NotNull FeishuConnection connection, @NotNull HttpTransport transport, @NotNull Clock clock) {
        this.connection = connection;
        this.transport = transport;
        this.clock = clock;
    }

    /**
     * Builds the URL the user agent is redirected to. No request is sent.
     *
     * @param scope the requested scope, may be null or blank to request none
     * @param redirectUri the callback URI, null when the provider has it pre-registered
     * @param state the opaque value the provider echoes back, may be null
     * @return the authorization URL
     */
    public @NotNull URI buildAuthorizationUrl(@Nullable String scope, @Nullable URI redirectUri, @Nullable String state) {
        String clientId = connection.clientId();
        AuthorizationRequest.Builder builder = new AuthorizationRequest.Builder(ResponseType.CODE, new ClientID(clientId))
                .endpointURI(connection.authorizationEndpoint());

        if (!isBlank(scope)) {
            builder.scope(new Scope(scope.trim().split("\\s+")));
        }
        if (redirectUri != null) {
            builder.redirectionURI(redirectUri);
        }
        if (!isBlank(state)) {
            builder.state(new State(state));
        }
        if (connection.credentialParameterStyle() == CredentialParameterStyle.APP) {
            builder.customParameter(PARAM_APP_ID, clientId);
        }
        return builder.build().toURI();
    }

    /**
     * Exchanges an authorization code for a token.
     *
     * <p>A token without an access token value is returned as-is when the provider sent neither a token
     * nor an error.</p>
     *
     * @param code the authorization code received with the callback
     * @return the token
     * @throws MissingCodeException if no code is given
     * @throws ProviderErrorException if the provider answered with an error
     * @throws TransportException if the provider could not be reached or answered with an unusable status
     * @throws DataInvalidException if the provider answered with malformed JSON or a body that is not a token response
     */
    public @NotNull Token exchangeCode(@Nullable String code) throws FeishuAuthException {
        if (isBlank(code)) {
            throw new MissingCodeException("Missing required parameter 'code'");
        }

        boolean appStyle = connection.credentialParameterStyle() == CredentialParameterStyle.APP;
        Map<String, String> params = new LinkedHashMap<>();
        params.put(appStyle ? PARAM_APP_ID : PARAM_CLIENT_ID, connection.clientId());
        params.put(appStyle ? PARAM_APP_SECRET : PARAM_CLIENT_SECRET, connection.clientSecret());
        params.put(PARAM_CODE, code);
        params.put(PARAM_GRANT_TYPE, GrantType.AUTHORIZATION_CODE.getValue());

        HTTPRequest request = new HTTPRequest(HTTPRequest.Method.POST, connection.tokenEndpoint());
        request.setAccept(APPLICATION_JSON);
        if (connection.tokenRequestFormat() == TokenRequestFormat.FORM) {
            request.setEntityContentType(ContentType.APPLICATION_URLENCODED);
            Map<String, List<String>> form = new LinkedHashMap<>();
            params.forEach((key, value) -> form.put(key, Collections.singletonList(value)));
            request.setBody(URLUtils.serializeParameters(form));
        } else {
            request.setEntityContentType(ContentType.APPLICATION_JSON);
            request.setBody(new JSONObject(params).toJSONString());
        }

        HTTPResponse response = send(request, "Token exchange");
        Token token = parseTokenResponse(response);
        logger.debug("Token exchange with '{}' completed, access token present: {}",
                connection.name(), token.accessToken() != null);
        return token;
    }

    /**
     * Reads the user profile from the user info endpoint.
     *
     * @param token the token obtained by {@link #exchangeCode(String)}
     * @param endpoint the user info endpoint
     * @return the {@code data} object of the response, merged over the token's other parameters
     * @throws TransportException if the endpoint could not be reached or answered with a non-2xx status
     * @throws DataInvalidException if the response does not carry a {@code data} object
     */
    public @NotNull Map<String, Object> fetchUserInfo(@NotNull Token token, @NotNull URI endpoint)
            throws FeishuAuthException {
        String accessToken = token.accessToken();
        if (isBlank(accessToken)) {
            throw new DataInvalidException("Token carries no access token");
        }

        HTTPRequest request = new HTTPRequest(HTTPRequest.Method.GET, endpoint);
        request.setAuthorization(new BearerAccessToken(accessToken).toAuthorizationHeader());
        request.setEntityContentType(ContentType.APPLICATION_JSON);
        request.setAccept(APPLICATION_JSON);

        HTTPResponse response = send(request, "User info request");
        if (!response.indicatesSuccess()) {
            throw new TransportException(
                    String.format("User info endpoint responded with status %d", response.getStatusCode()),
                    response.getStatusCode());
        }

        String content = response.getBody();
        if (isBlank(content)) {
            throw new DataInvalidException("User info response is empty");
        }
        JSONObject body;
        try {
            body = JSONObjectUtils.parse(content);
        } catch (ParseException e) {
            throw new DataInvalidException("User info response is not a JSON object", e);
        }

        Object data = body.get("data");
        if (!(data instanceof Map)) {
            Object msg = body.get("msg");
            throw new DataInvalidException("User info response has no 'data' object" + (msg == null ? "" : ": " + msg));
        }

        Map<String, Object> user = new LinkedHashMap<>(token.otherParams());
        ((Map<?, ?>) data).forEach((key, value) -> user.put(String.valueOf(key), value));
        return user;
    }

    @NotNull Token parseTokenResponse(@NotNull HTTPResponse response) throws FeishuAuthException {
        String content = response.getBody();
        Map<String, Object> params = parseParameters(response);

        Map<String, Object> errorCandidate = params != null ? params : tryParseJsonObject(content);
        if (errorCandidate != null) {
            ProviderErrorException error = toProviderError(errorCandidate);
            if (error != null) {
                logger.debug("Token exchange rejected by '{}' with error '{}'", connection.name(), error.getCode());
                throw error;
            }
        }

        if (!response.indicatesSuccess()) {
            throw new TransportException(
                    String.format("Token endpoint responded with status %d", response.getStatusCode()),
                    response.getStatusCode());
        }

        if (params == null) {
            if (isBlank(content)) {
                return new Token(null, null, null, null, Collections.emptyMap());
            }
            if (errorCandidate == null) {
                throw new DataInvalidException(String.format(
                        "Token response of type '%s' is neither JSON nor form encoded", response.getEntityContentType()));
            }
            // the miniapp session endpoint answers with a text/plain JSON document, which is kept whole
            return new Token(content.trim(), null, null, null, Collections.emptyMap());
        }
        return toToken(params);
    }

    private @Nullable Map<String, Object> parseParameters(@NotNull HTTPResponse response) throws DataInvalidException {
        String content = response.getBody();
        ContentType contentType = response.getEntityContentType();
        if (isBlank(content) || contentType == null) {
            return null;
        }

        if (contentType.matches(ContentType.APPLICATION_URLENCODED)) {
            Map<String, Object> params = new LinkedHashMap<>();
            URLUtils.parseParameters(content).forEach((key, values) -> params.put(key, values.isEmpty() ? null : values.get(0)));
            return params;
        }

        if (contentType.matches(ContentType.APPLICATION_JSON)) {
            try {
                return JSONObjectUtils.parse(content);
            } catch (ParseException e) {
                if (response.indicatesSuccess()) {
                    throw new DataInvalidException("Token response is not a JSON object", e);
                }
                logger.debug("Unparseable error body from token endpoint: {}", e.getMessage());
                return null;
            }
        }
        return null;
    }

    private static @Nullable Map<String, Object> tryParseJsonObject(@Nullable String content) {
        if (isBlank(content) || !content.trim().startsWith("{")) {
            return null;
        }
        try {
            return JSONObjectUtils.parse(content);
        } catch (ParseException e) {
            logger.debug("Token response body is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private static @Nullable ProviderErrorException toProviderError(@NotNull Map<String, Object> params) {
        if (!isBlank(stringValue(params.get(ACCESS_TOKEN)))) {
            return null;
        }
        String error = stringValue(params.get(ERROR));
        if (!isBlank(error)) {
            return new ProviderErrorException(error, stringValue(params.get(ERROR_DESCRIPTION)));
        }
        String errcode = stringValue(params.get(ERRCODE));
        if (!isBlank(errcode) && !"0".equals(errcode)) {
            return new ProviderErrorException(errcode, stringValue(params.get(ERRMSG)));
        }
        return null;
    }

    private @NotNull Token toToken(@NotNull Map<String, Object> params) {
        Map<String, Object> other = new LinkedHashMap<>(params);
        String accessToken = stringValue(other.remove(ACCESS_TOKEN));
        String refreshToken = stringValue(other.remove(REFRESH_TOKEN));
        String tokenType = stringValue(other.remove(TOKEN_TYPE));

        Long expiresAt = toLong(EXPIRES_AT, other.remove(EXPIRES_AT));
        Long expiresIn = toLong(EXPIRES_IN, other.remove(EXPIRES_IN));
        if (expiresAt == null && expiresIn != null) {
            expiresAt = expiryFromNow(expiresIn);
        }

        return new Token(isBlank(accessToken) ? null : accessToken, refreshToken, expiresAt, tokenType, other);
    }

    private @NotNull Long expiryFromNow(long expiresIn) {
        try {
            return Math.addExact(clock.instant().getEpochSecond(), expiresIn);
        } catch (ArithmeticException e) {
            logger.debug("'{}' of {} seconds overflows, capping the expiry", EXPIRES_IN, expiresIn);
            return expiresIn > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    private @NotNull HTTPResponse send(@NotNull HTTPRequest request, @NotNull String context) throws TransportException {
        try {
            return transport.send(request);
        } catch (IOException e) {
            logger.debug("{} to {} failed: {}", context, request.getURI(), e.getMessage());
            throw new TransportException(context + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // HttpURLConnection rejects malformed header values with an IllegalArgumentException
            logger.debug("{} to {} was rejected: {}", context, request.getURI(), e.toString());
            throw new TransportException(context + " failed: " + e, e);
        }
    }

    private static @Nullable Long toLong(@NotNull String name, @Nullable Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric '{}' in token response: {}", name, value);
            }
        }
        return null;
    }

    private static @Nullable String stringValue(@Nullable Object value) {
        return value == null ? null : value.toString();
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }
}
