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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Checks the signature the miniapp sends along with the user data.
 *
 * <p>The signature is the lowercase hex encoded SHA-1 digest of the raw data immediately followed by the
 * session key. This is the scheme the provider mandates; it is not an HMAC.</p>
 */
public class SignatureVerifier {

    private static final String DIGEST_ALGORITHM = "SHA-1";

    /**
     * @param rawData the raw user data, as sent by the client
     * @param sessionKey the Base64 encoded session key, as issued by the provider
     * @param signature the signature sent by the client
     * @return true if the signature matches, false otherwise or if any argument is null
     */
    public boolean verify(@Nullable String rawData, @Nullable String sessionKey, @Nullable String signature) {
        if (rawData == null || sessionKey == null || signature == null) {
            return false;
        }
        String expected = sign(rawData, sessionKey);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), signature.getBytes(StandardCharsets.UTF_8));
    }

    static @NotNull String sign(@NotNull String rawData, @NotNull String sessionKey) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE must provide SHA-1
            throw new IllegalStateException(e);
        }
        byte[] hash = digest.digest((rawData + sessionKey).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(hash);
    }
}
