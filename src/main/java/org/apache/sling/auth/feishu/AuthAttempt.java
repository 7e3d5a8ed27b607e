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

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Holds everything that belongs to one request/callback cycle.
 *
 * <p>An attempt is owned by the request that drives it and is not thread-safe. The transition methods
 * are called by the authentication strategy; hosts normally only read from it.</p>
 */
public final class AuthAttempt {

    private AttemptState state = AttemptState.IDLE;
    private @Nullable String scope;
    private @Nullable String requestState;
    private @Nullable String callbackState;
    private @Nullable URI redirectUri;
    private @Nullable Token token;
    private @Nullable Map<String, Object> user;
    private boolean testBypass;
    private final List<AuthError> errors = new ArrayList<>();

    public @NotNull AttemptState state() {
        return state;
    }

    /**
     * @return the requested scope exactly as sent to the provider
     */
    public @Nullable String scope() {
        return scope;
    }

    /**
     * @return the individual requested scopes, in request order
     */
    public @NotNull List<String> scopes() {
        if (scope == null || scope.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(scope.split("[,\\s]+"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return the opaque {@code state} value sent to the provider with the authorization request, if any
     */
    public @Nullable String requestState() {
        return requestState;
    }

    /**
     * @return the {@code state} value the provider sent back with the callback, if any
     */
    public @Nullable String callbackState() {
        return callbackState;
    }

    /**
     * @return the authorization URL the user agent must be redirected to, once the request phase ran
     */
    public @Nullable URI redirectUri() {
        return redirectUri;
    }

    public @Nullable Token token() {
        return token;
    }

    public @Nullable Map<String, Object> user() {
        return user;
    }

    /**
     * @return true if the callback used the test code and no exchange took place
     */
    public boolean testBypass() {
        return testBypass;
    }

    public @NotNull List<AuthError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isAuthenticated() {
        return state == AttemptState.AUTHENTICATED;
    }

    public boolean isFailed() {
        return state == AttemptState.FAILED;
    }

    public void issueRequest(@Nullable String scope, @Nullable String requestState, @NotNull URI redirectUri) {
        transition(EnumSet.of(AttemptState.IDLE), AttemptState.REQUEST_ISSUED);
        this.scope = scope;
        this.requestState = requestState;
        this.redirectUri = redirectUri;
    }

    /**
     * Marks the start of the callback phase. The request phase may have run on another attempt
     * instance, so an idle attempt is accepted as well.
     */
    public void receiveCallback(@Nullable String callbackState) {
        transition(EnumSet.of(AttemptState.IDLE, AttemptState.REQUEST_ISSUED), AttemptState.CALLBACK_RECEIVED);
        this.callbackState = callbackState;
    }

    public void authenticate(@NotNull Token token, @NotNull Map<String, Object> user) {
        transition(EnumSet.of(AttemptState.CALLBACK_RECEIVED), AttemptState.AUTHENTICATED);
        this.token = token;
        this.user = Collections.unmodifiableMap(new LinkedHashMap<>(user));
    }

    public void bypass() {
        transition(EnumSet.of(AttemptState.CALLBACK_RECEIVED), AttemptState.AUTHENTICATED);
        this.testBypass = true;
    }

    public void fail(@NotNull AuthError error) {
        transition(EnumSet.of(AttemptState.CALLBACK_RECEIVED, AttemptState.FAILED), AttemptState.FAILED);
        errors.add(error);
    }

    /**
     * Drops the token and the user data. Errors are kept. Calling this more than once has no further effect.
     */
    public void cleanUp() {
        token = null;
        user = null;
        state = AttemptState.CLEANED_UP;
    }

    private void transition(Set<AttemptState> from, AttemptState to) {
        if (!from.contains(state)) {
            throw new IllegalStateException(String.format("Can't move from %s to %s", state, to));
        }
        state = to;
    }
}
