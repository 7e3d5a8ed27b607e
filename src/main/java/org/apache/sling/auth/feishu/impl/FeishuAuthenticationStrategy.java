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

import static org.osgi.service.component.annotations.ConfigurationPolicy.REQUIRE;
import static org.osgi.service.component.annotations.ReferenceCardinality.OPTIONAL;
import static org.osgi.service.component.annotations.ReferencePolicyOption.GREEDY;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import org.apache.sling.auth.feishu.AuthAttempt;
import org.apache.sling.auth.feishu.AuthError;
import org.apache.sling.auth.feishu.AuthResult;
import org.apache.sling.auth.feishu.Credentials;
import org.apache.sling.auth.feishu.DataInvalidException;
import org.apache.sling.auth.feishu.ErrorKind;
import org.apache.sling.auth.feishu.FeishuAuthException;
import org.apache.sling.auth.feishu.MissingCodeException;
import org.apache.sling.auth.feishu.Profile;
import org.apache.sling.auth.feishu.RawInfo;
import org.apache.sling.auth.feishu.SignatureMismatchException;
import org.apache.sling.auth.feishu.Token;
import org.apache.sling.auth.feishu.UserInfoVariant;
import org.apache.sling.auth.feishu.spi.HttpTransport;
import org.apache.sling.auth.feishu.spi.ProfileFieldMapping;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Reference;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a Feishu login from the authorization redirect to the normalized user profile.
 *
 * <p>The strategy itself is stateless; everything that belongs to a login is kept in the
 * {@link AuthAttempt} passed between the phases. The host calls, in order:</p>
 * <ol>
 *  <li>{@link #handleRequest(Map, URI)} and redirects the user agent to {@link AuthAttempt#redirectUri()}</li>
 *  <li>{@link #handleCallback(AuthAttempt, Map)} with the parameters of the callback request</li>
 *  <li>{@link #result(AuthAttempt)} if the attempt {@link AuthAttempt#isAuthenticated() is authenticated}
 *      and not a {@link AuthAttempt#testBypass() test bypass}, or {@link AuthAttempt#errors()} otherwise</li>
 *  <li>{@link #handleCleanup(AuthAttempt)}</li>
 * </ol>
 *
 * <p>Failures of the callback phase never escape as exceptions; they are recorded on the attempt.</p>
 */
@Component(service = FeishuAuthenticationStrategy.class, configurationPolicy = REQUIRE)
@Designate(ocd = FeishuAuthenticationStrategy.Config.class, factory = true)
public class FeishuAuthenticationStrategy {

    @ObjectClassDefinition(
            name = "Apache Sling Feishu Authentication Strategy",
            description = "Runs the Feishu login flow for one configured Feishu connection")
    @interface Config {

        @AttributeDefinition(name = "Connection Name",
                description = "Name of the Feishu connection this strategy authenticates against")
        String connectionName() default "feishu";

        String webconsole_configurationFactory_nameHint() default "Connection: {connectionName}";
    }

    /** Authorization code accepted without contacting the provider, see {@link FeishuConnection.Config#testCodeEnabled()}. */
    public static final String TEST_CODE = "test_code";

    public static final String PARAMETER_SCOPE = "scope";
    public static final String PARAMETER_STATE = "state";
    public static final String PARAMETER_CODE = "code";
    public static final String PARAMETER_SIGNATURE = "signature";
    public static final String PARAMETER_RAW_DATA = "raw_data";
    public static final String PARAMETER_IV = "iv";
    public static final String PARAMETER_ENCRYPTED_DATA = "encrypted_data";

    static final String SESSION_KEY = "session_key";
    static final String MISSING_ACCESS_TOKEN = "missing_access_token";

    private static final Logger logger = LoggerFactory.getLogger(FeishuAuthenticationStrategy.class);

    private final FeishuConnection connection;
    private final FeishuOAuthClient client;
    private final SignatureVerifier signatureVerifier;
    private final PayloadDecryptor payloadDecryptor;
    private final ResultNormalizer normalizer;

    /**
     * @throws IllegalArgumentException if no connection with the configured name is available
     */
    @Activate
    public FeishuAuthenticationStrategy(@Reference(policyOption = GREEDY) @NotNull List<FeishuConnection> connections,
                                        @NotNull Config config,
                                        @Reference(cardinality = OPTIONAL, policyOption = GREEDY) @Nullable HttpTransport transport) {
        this(selectConnection(connections, config.connectionName()), transport);
        logger.info("Feishu authentication strategy activated for connection '{}'", connection.name());
    }

    /**
     * @param connection the connection to authenticate against
     * @param transport the transport to send requests with, or {@code null} to use the built-in HTTP client
     */
    public FeishuAuthenticationStrategy(@NotNull FeishuConnection connection, @Nullable HttpTransport transport) {
        this.connection = connection;
        this.client = new FeishuOAuthClient(connection, transport != null ? transport
                : new NimbusHttpTransport(connection.connectTimeout(), connection.readTimeout()));
        this.signatureVerifier = new SignatureVerifier();
        this.payloadDecryptor = new PayloadDecryptor();
        this.normalizer = new ResultNormalizer(
                ProfileFieldMapping.forVariant(connection.userInfoVariant()), connection.tokenType());
    }

    static @NotNull FeishuConnection selectConnection(@NotNull List<FeishuConnection> connections,
                                                      @Nullable String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("connectionName missing from Feishu authentication strategy configuration");
        }
        return connections.stream()
                .filter(c -> name.equals(c.name()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                        "No Feishu connection named '%s', available: %s", name,
                        connections.stream().map(FeishuConnection::name).collect(Collectors.toList()))));
    }

    /**
     * @return the name of the connection this strategy authenticates against
     */
    public @NotNull String connectionName() {
        return connection.name();
    }

    /**
     * Starts a login.
     *
     * <p>The scope is read from the {@code scope} parameter and falls back to the configured default. A
     * {@code state} parameter is passed on to the provider, which echoes it with the callback.</p>
     *
     * @param params the decoded request parameters
     * @param callbackUri the URI the provider redirects back to; not sent if the connection disables it
     * @return a new attempt carrying the authorization URL to redirect to
     */
    public @NotNull AuthAttempt handleRequest(@NotNull Map<String, String> params, @NotNull URI callbackUri) {
        String scope = params.get(PARAMETER_SCOPE);
        if (scope == null || scope.isBlank()) {
            scope = connection.defaultScope();
        }
        String state = params.get(PARAMETER_STATE);
        URI redirectUri = connection.sendRedirectUri() ? callbackUri : null;

        URI authorizationUrl = client.buildAuthorizationUrl(scope, redirectUri, state);

        AuthAttempt attempt = new AuthAttempt();
        attempt.issueRequest(scope, state, authorizationUrl);
        logger.debug("Redirecting to '{}' authorization endpoint with scope '{}'", connection.name(), scope);
        return attempt;
    }

    /**
     * Runs the callback phase on a fresh attempt.
     *
     * @see #handleCallback(AuthAttempt, Map)
     */
    public @NotNull AuthAttempt handleCallback(@NotNull Map<String, String> params) {
        AuthAttempt attempt = new AuthAttempt();
        handleCallback(attempt, params);
        return attempt;
    }

    /**
     * Completes a login with the parameters the provider redirected back with.
     *
     * <p>Leaves the attempt either {@link org.apache.sling.auth.feishu.AttemptState#AUTHENTICATED} or
     * {@link org.apache.sling.auth.feishu.AttemptState#FAILED}, with the cause recorded in
     * {@link AuthAttempt#errors()}.</p>
     *
     * @param attempt an idle attempt or the one returned by {@link #handleRequest(Map, URI)}
     * @param params the decoded callback parameters
     * @throws IllegalStateException if the attempt already went through a callback
     */
    public void handleCallback(@NotNull AuthAttempt attempt, @NotNull Map<String, String> params) {
        attempt.receiveCallback(params.get(PARAMETER_STATE));

        String code = params.get(PARAMETER_CODE);
        if (connection.testCodeEnabled() && TEST_CODE.equals(code)) {
            logger.debug("Test code received for '{}', skipping the token exchange", connection.name());
            attempt.bypass();
            return;
        }

        try {
            if (code == null || code.isBlank()) {
                throw new MissingCodeException("No code received");
            }

            Token token = client.exchangeCode(code);
            if (token.accessToken() == null) {
                String error = token.otherParam(FeishuOAuthClient.ERROR);
                AuthError providerError = new AuthError(ErrorKind.PROVIDER,
                        error == null || error.isBlank() ? MISSING_ACCESS_TOKEN : error,
                        token.otherParam(FeishuOAuthClient.ERROR_DESCRIPTION));
                logger.debug("Token response of '{}' carries no access token: {}", connection.name(), providerError);
                attempt.fail(providerError);
                return;
            }

            Map<String, Object> user = fetchUser(token, params);
            attempt.authenticate(token, user);
            logger.debug("User authenticated with '{}'", connection.name());
        } catch (FeishuAuthException e) {
            logger.debug("Callback for '{}' failed with {} '{}': {}", connection.name(), e.getKind(), e.getCode(),
                    e.getMessage());
            attempt.fail(e.toAuthError());
        }
    }

    /**
     * Drops the token and the user data of the attempt. Safe to call more than once.
     */
    public void handleCleanup(@NotNull AuthAttempt attempt) {
        attempt.cleanUp();
        logger.debug("Attempt for '{}' cleaned up", connection.name());
    }

    public @Nullable String uid(@NotNull AuthAttempt attempt) {
        return normalizer.uid(requireUser(attempt), connection.uidField());
    }

    public @NotNull Credentials credentials(@NotNull AuthAttempt attempt) {
        return normalizer.credentials(requireToken(attempt));
    }

    public @NotNull Profile info(@NotNull AuthAttempt attempt) {
        return normalizer.profile(requireUser(attempt));
    }

    public @NotNull RawInfo extra(@NotNull AuthAttempt attempt) {
        return normalizer.rawInfo(requireToken(attempt), requireUser(attempt));
    }

    /**
     * @throws IllegalStateException if the attempt is not authenticated, was a test bypass or was cleaned up
     */
    public @NotNull AuthResult result(@NotNull AuthAttempt attempt) {
        return new AuthResult(connection.name(), uid(attempt), credentials(attempt), info(attempt), extra(attempt));
    }

    private @NotNull Map<String, Object> fetchUser(@NotNull Token token, @NotNull Map<String, String> params)
            throws FeishuAuthException {
        if (connection.userInfoVariant() == UserInfoVariant.DIRECT) {
            return client.fetchUserInfo(token, connection.userInfoUrl());
        }
        return decryptUser(token, params);
    }

    private @NotNull Map<String, Object> decryptUser(@NotNull Token token, @NotNull Map<String, String> params)
            throws FeishuAuthException {
        String signature = requireParameter(params, PARAMETER_SIGNATURE);
        String rawData = requireParameter(params, PARAMETER_RAW_DATA);
        String iv = requireParameter(params, PARAMETER_IV);
        String encryptedData = requireParameter(params, PARAMETER_ENCRYPTED_DATA);

        String sessionKey = sessionKey(token);
        if (sessionKey == null) {
            throw new DataInvalidException("Token response carries no session key");
        }

        if (!signatureVerifier.verify(rawData, sessionKey, signature)) {
            logger.debug("Signature mismatch for user data received by '{}'", connection.name());
            throw new SignatureMismatchException();
        }

        return payloadDecryptor.decrypt(DecryptionContext.decode(sessionKey, iv, encryptedData, rawData));
    }

    /**
     * Finds the session key either among the token's parameters or, when the provider answered with a plain
     * text JSON document, inside the access token value.
     */
    static @Nullable String sessionKey(@NotNull Token token) {
        String sessionKey = token.otherParam(SESSION_KEY);
        if (sessionKey != null) {
            return sessionKey;
        }

        String accessToken = token.accessToken();
        if (accessToken == null || !accessToken.trim().startsWith("{")) {
            return null;
        }
        try {
            Object value = JSONObjectUtils.parse(accessToken).get(SESSION_KEY);
            return value == null ? null : value.toString();
        } catch (ParseException e) {
            logger.debug("Access token is not a JSON document: {}", e.getMessage());
            return null;
        }
    }

    private static @NotNull String requireParameter(@NotNull Map<String, String> params, @NotNull String name)
            throws DataInvalidException {
        String value = params.get(name);
        if (value == null || value.isEmpty()) {
            throw new DataInvalidException(String.format("Missing callback parameter '%s'", name));
        }
        return value;
    }

    private static @NotNull Token requireToken(@NotNull AuthAttempt attempt) {
        requireAuthenticated(attempt);
        Token token = attempt.token();
        if (token == null) {
            throw new IllegalStateException("Attempt carries no token");
        }
        return token;
    }

    private static @NotNull Map<String, Object> requireUser(@NotNull AuthAttempt attempt) {
        requireAuthenticated(attempt);
        Map<String, Object> user = attempt.user();
        if (user == null) {
            throw new IllegalStateException("Attempt carries no user data");
        }
        return user;
    }

    private static void requireAuthenticated(@NotNull AuthAttempt attempt) {
        if (!attempt.isAuthenticated()) {
            throw new IllegalStateException("Attempt is not authenticated, state is " + attempt.state());
        }
        if (attempt.testBypass()) {
            throw new IllegalStateException("Attempt was authenticated with the test code and carries no user data");
        }
    }
}
