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

import org.junit.jupiter.api.Test;

class SignatureVerifierTest {

    private final SignatureVerifier verifier = new SignatureVerifier();

    @Test
    void signIsSha1OfRawDataFollowedBySessionKey() {
        // SHA-1("abc")
        assertThat(SignatureVerifier.sign("ab", "c")).isEqualTo("a9993e364706816aba3e25717850c26c9cd0d89d");
    }

    @Test
    void matchingSignature() {
        String rawData = "{\"nickName\":\"Band\",\"gender\":1}";
        String signature = SignatureVerifier.sign(rawData, "HyVFkGl5F5OQWJZZaNzBBg==");

        assertThat(verifier.verify(rawData, "HyVFkGl5F5OQWJZZaNzBBg==", signature)).isTrue();
    }

    @Test
    void tamperedRawData() {
        String signature = SignatureVerifier.sign("{\"nickName\":\"Band\"}", "key");

        assertThat(verifier.verify("{\"nickName\":\"Bond\"}", "key", signature)).isFalse();
    }

    @Test
    void alteredSessionKey() {
        String rawData = "{\"nickName\":\"Band\"}";
        String signature = SignatureVerifier.sign(rawData, "HyVFkGl5F5OQWJZZaNzBBg==");

        assertThat(verifier.verify(rawData, "HyVFkGl5F5OQWJZZaNzBBh==", signature)).isFalse();
    }

    @Test
    void alteredSignatureDigit() {
        String rawData = "{\"nickName\":\"Band\"}";
        String signature = SignatureVerifier.sign(rawData, "HyVFkGl5F5OQWJZZaNzBBg==");
        char last = signature.charAt(signature.length() - 1);
        String altered = signature.substring(0, signature.length() - 1) + (last == '0' ? '1' : '0');

        assertThat(verifier.verify(rawData, "HyVFkGl5F5OQWJZZaNzBBg==", altered)).isFalse();
    }

    @Test
    void truncatedSignature() {
        String signature = SignatureVerifier.sign("ab", "c");

        assertThat(verifier.verify("ab", "c", signature.substring(1))).isFalse();
    }

    @Test
    void signatureIsCaseSensitive() {
        String signature = SignatureVerifier.sign("ab", "c").toUpperCase();

        assertThat(verifier.verify("ab", "c", signature)).isFalse();
    }

    @Test
    void nullArgumentsNeverMatch() {
        String signature = SignatureVerifier.sign("ab", "c");

        assertThat(verifier.verify(null, "c", signature)).isFalse();
        assertThat(verifier.verify("ab", null, signature)).isFalse();
        assertThat(verifier.verify("ab", "c", null)).isFalse();
    }
}
