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
import static org.junit.jupiter.api.Assertions.assertThrowsExactly;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import com.nimbusds.oauth2.sdk.util.URLUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.sling.auth.feishu.DataInvalidException;
import org.apache.sling.auth.feishu.ErrorKind;
import org.apache.sling.auth.feishu.FeishuAuthException;
import org.apache.sling.auth.feishu.MissingCodeException;
import org.apache.sling.auth.feishu.ProviderErrorException;
import org.apache.sling.auth.feishu.Token;
import org.apache.sling.auth.feishu.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FeishuOAuthClientTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> requestContentType = new AtomicReference<>();
    private final AtomicReference<String> requestAuthorization = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private FeishuOAuthClient client(Map<String, Object> props) {
        FeishuConnection connection = FeishuConnectionSupport.connection(props);
        return new FeishuOAuthClient(connection, new NimbusHttpTransport(1000, 1000),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private FeishuOAuthClient client() {
        return client(FeishuConnectionSupport.properties(baseUrl));
    }

    private void respondWith(String path, int status, String contentType, String body) {
        server.createContext(path, exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            requestContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            requestAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            write(exchange, status, contentType, body);
        });
    }

    private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        if (contentType != null) {
            exchange.getResponseHeaders().add("Content-Type", contentType);
        }
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            exchange.getResponseBody().write(bytes);
        }
        exchange.close();
    }

    @Test
    void authorizationUrl() {
        URI url = client().buildAuthorizationUrl("snsapi_userinfo", URI.create("https://app.example.com/callback"), "xyz");

        assertThat(url.toString()).startsWith(baseUrl + "/authorize?");
        Map<String, List<String>> params = URLUtils.parseParameters(url.getRawQuery());
        assertThat(params)
                .containsEntry("response_type", List.of("code"))
                .containsEntry("client_id", List.of(FeishuConnectionSupport.CLIENT_ID))
                .containsEntry("app_id", List.of(FeishuConnectionSupport.CLIENT_ID))
                .containsEntry("scope", List.of("snsapi_userinfo"))
                .containsEntry("redirect_uri", List.of("https://app.example.com/callback"))
                .containsEntry("state", List.of("xyz"));
    }

    @Test
    void authorizationUrlWithoutOptionalParameters() {
        Map<String, Object> props = FeishuConnectionSupport.properties(baseUrl);
        props.put("credentialParameterStyle", "CLIENT");

        URI url = client(props).buildAuthorizationUrl(null, null, null);

        Map<String, List<String>> params = URLUtils.parseParameters(url.getRawQuery());
        assertThat(params)
                .containsOnlyKeys("response_type", "client_id");
    }

    @Test
    void exchangeCodeSendsJsonBody() throws Exception {
        respondWith("/token", 200, "application/json",
                "{\"access_token\":\"u-abc\",\"refresh_token\":\"ur-1\",\"token_type\":\"Bearer\","
                        + "\"expires_in\":7200,\"scope\":\"read,write\",\"open_id\":\"ou_1\"}");

        Token token = client().exchangeCode("the-code");

        assertThat(requestContentType.get()).startsWith("application/json");
        Map<String, Object> sent = JSONObjectUtils.parse(requestBody.get());
        assertThat(sent)
                .containsEntry("app_id", FeishuConnectionSupport.CLIENT_ID)
                .containsEntry("app_secret", FeishuConnectionSupport.CLIENT_SECRET)
                .containsEntry("code", "the-code")
                .containsEntry("grant_type", "authorization_code");

        assertThat(token.accessToken()).isEqualTo("u-abc");
        assertThat(token.refreshToken()).isEqualTo("ur-1");
        assertThat(token.tokenType()).isEqualTo("Bearer");
        assertThat(token.expiresAt()).isEqualTo(NOW.getEpochSecond() + 7200);
        assertThat(token.otherParams())
                .containsEntry("scope", "read,write")
                .containsEntry("open_id", "ou_1")
                .doesNotContainKeys("access_token", "refresh_token", "token_type", "expires_in");
    }

    @Test
    void exchangeCodeSendsFormBody() throws Exception {
        respondWith("/token", 200, "application/x-www-form-urlencoded", "access_token=u-abc&expires_at=1800000000");
        Map<String, Object> props = FeishuConnectionSupport.properties(baseUrl);
        props.put("tokenRequestFormat", "FORM");
        props.put("credentialParameterStyle", "CLIENT");

        Token token = client(props).exchangeCode("the-code");

        assertThat(requestContentType.get()).startsWith("application/x-www-form-urlencoded");
        assertThat(URLUtils.parseParameters(requestBody.get()))
                .containsEntry("client_id", List.of(FeishuConnectionSupport.CLIENT_ID))
                .containsEntry("client_secret", List.of(FeishuConnectionSupport.CLIENT_SECRET))
                .containsEntry("code", List.of("the-code"))
                .containsEntry("grant_type", List.of("authorization_code"));
        assertThat(token.accessToken()).isEqualTo("u-abc");
        assertThat(token.expiresAt()).isEqualTo(1_800_000_000L);
    }

    @Test
    void exchangeCodeRequiresCode() {
        MissingCodeException thrown = assertThrowsExactly(MissingCodeException.class,
                () -> client().exchangeCode(" "));

        assertThat(thrown).hasMessage("Missing required parameter 'code'");
    }

    @Test
    void providerErrorWithOAuthFields() {
        respondWith("/token", 400, "application/json",
                "{\"error\":\"invalid_grant\",\"error_description\":\"code expired\"}");

        ProviderErrorException thrown = assertThrowsExactly(ProviderErrorException.class,
                () -> client().exchangeCode("the-code"));

        assertThat(thrown.getKind()).isEqualTo(ErrorKind.PROVIDER);
        assertThat(thrown.getCode()).isEqualTo("invalid_grant");
        assertThat(thrown).hasMessage("code expired");
    }

    @Test
    void providerErrorWithErrcode() {
        respondWith("/token", 200, "application/json", "{\"errcode\":10012,\"errmsg\":\"invalid code\"}");

        ProviderErrorException thrown = assertThrowsExactly(ProviderErrorException.class,
                () -> client().exchangeCode("the-code"));

        assertThat(thrown.getCode()).isEqualTo("10012");
        assertThat(thrown).hasMessage("invalid code");
    }

    @Test
    void zeroErrcodeIsNotAnError() throws FeishuAuthException {
        respondWith("/token", 200, "application/json", "{\"errcode\":0,\"access_token\":\"u-abc\"}");

        assertThat(client().exchangeCode("the-code").accessToken()).isEqualTo("u-abc");
    }

    @Test
    void serverErrorWithoutErrorBody() {
        respondWith("/token", 500, "text/html", "<html>oops</html>");

        TransportException thrown = assertThrowsExactly(TransportException.class,
                () -> client().exchangeCode("the-code"));

        assertThat(thrown).hasMessage("Token endpoint responded with status 500");
        assertThat(thrown.getStatusCode()).isEqualTo(500);
    }

    @Test
    void malformedJsonWithSuccessStatus() {
        respondWith("/token", 200, "application/json", "{\"access_token\":");

        DataInvalidException thrown = assertThrowsExactly(DataInvalidException.class,
                () -> client().exchangeCode("the-code"));

        assertThat(thrown).hasMessage("Token response is not a JSON object");
    }

    @Test
    void unreachableTokenEndpoint() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        TransportException thrown = assertThrowsExactly(TransportException.class,
                () -> client(FeishuConnectionSupport.properties("http://localhost:" + port)).exchangeCode("the-code"));

        assertThat(thrown).hasMessageStartingWith("Token exchange failed");
        assertThat(thrown.getCause()).isInstanceOf(IOException.class);
        assertThat(thrown.getStatusCode()).isEqualTo(-1);
    }

    @Test
    void plainTextResponseIsKeptAsAccessToken() throws FeishuAuthException {
        respondWith("/token", 200, "text/plain", " {\"session_key\":\"abc\",\"openid\":\"ou_1\"}\n");

        Token token = client().exchangeCode("the-code");

        assertThat(token.accessToken()).isEqualTo("{\"session_key\":\"abc\",\"openid\":\"ou_1\"}");
        assertThat(token.otherParams()).isEmpty();
    }

    @Test
    void htmlResponseIsRejected() {
        respondWith("/token", 200, "text/html", "<html>\n<body>maintenance</body>\n</html>");

        DataInvalidException thrown = assertThrowsExactly(DataInvalidException.class,
                () -> client().exchangeCode("the-code"));

        assertThat(thrown).hasMessageContaining("neither JSON nor form encoded");
    }

    @Test
    void emptySuccessResponseHasNoAccessToken() throws FeishuAuthException {
        respondWith("/token", 200, "text/plain", "");

        assertThat(client().exchangeCode("the-code").accessToken()).isNull();
    }

    @Test
    void hugeExpiresInIsCapped() throws FeishuAuthException {
        respondWith("/token", 200, "application/json",
                "{\"access_token\":\"u-abc\",\"expires_in\":9223372036854775807}");

        Token token = client().exchangeCode("the-code");

        assertThat(token.expiresAt()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void headerRejectedByTheHttpClient() {
        Token token = new Token("u-abc\n<html>", null, null, null, Collections.emptyMap());

        TransportException thrown = assertThrowsExactly(TransportException.class,
                () -> client().fetchUserInfo(token, URI.create(baseUrl + "/user_info")));

        assertThat(thrown).hasMessageStartingWith("User info request failed");
        assertThat(thrown.getCause()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void responseWithoutAccessToken() throws FeishuAuthException {
        respondWith("/token", 200, "application/json", "{\"open_id\":\"ou_1\"}");

        Token token = client().exchangeCode("the-code");

        assertThat(token.accessToken()).isNull();
        assertThat(token.otherParams()).containsEntry("open_id", "ou_1");
    }

    @Test
    void fetchUserInfoMergesDataOverTokenParameters() throws FeishuAuthException {
        respondWith("/user_info", 200, "application/json",
                "{\"code\":0,\"msg\":\"success\",\"data\":{\"name\":\"Zhang San\",\"open_id\":\"ou_2\"}}");
        Token token = new Token("u-abc", null, null, null, Map.of("open_id", "ou_1", "scope", "read"));

        Map<String, Object> user = client().fetchUserInfo(token, URI.create(baseUrl + "/user_info"));

        assertThat(requestAuthorization.get()).isEqualTo("Bearer u-abc");
        assertThat(user)
                .containsEntry("name", "Zhang San")
                .containsEntry("open_id", "ou_2")
                .containsEntry("scope", "read");
    }

    @Test
    void fetchUserInfoWithoutData() {
        respondWith("/user_info", 200, "application/json", "{\"code\":99991663,\"msg\":\"token invalid\"}");
        Token token = new Token("u-abc", null, null, null, Collections.emptyMap());

        DataInvalidException thrown = assertThrowsExactly(DataInvalidException.class,
                () -> client().fetchUserInfo(token, URI.create(baseUrl + "/user_info")));

        assertThat(thrown).hasMessage("User info response has no 'data' object: token invalid");
    }

    @Test
    void fetchUserInfoNotJson() {
        respondWith("/user_info", 200, "application/json", "not json");
        Token token = new Token("u-abc", null, null, null, Collections.emptyMap());

        DataInvalidException thrown = assertThrowsExactly(DataInvalidException.class,
                () -> client().fetchUserInfo(token, URI.create(baseUrl + "/user_info")));

        assertThat(thrown).hasMessage("User info response is not a JSON object");
    }

    @Test
    void fetchUserInfoErrorStatus() {
        respondWith("/user_info", 401, "application/json", "{}");
        Token token = new Token("u-abc", null, null, null, Collections.emptyMap());

        TransportException thrown = assertThrowsExactly(TransportException.class,
                () -> client().fetchUserInfo(token, URI.create(baseUrl + "/user_info")));

        assertThat(thrown.getStatusCode()).isEqualTo(401);
    }

    @Test
    void fetchUserInfoWithoutAccessToken() {
        Token token = new Token(null, null, null, null, Collections.emptyMap());

        DataInvalidException thrown = assertThrowsExactly(DataInvalidException.class,
                () -> client().fetchUserInfo(token, URI.create(baseUrl + "/user_info")));

        assertThat(thrown).hasMessage("Token carries no access token");
    }
}
