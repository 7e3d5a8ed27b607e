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

import java.util.Base64;

import org.apache.sling.auth.feishu.DataCorruptedException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Decoded inputs of a single user data decryption. Never stored beyond the callback that created it.
 */
public final class DecryptionContext {

    static final String FIELD_SESSION_KEY = "session_key";
    static final String FIELD_IV = "iv";
    static final String FIELD_ENCRYPTED_DATA = "encrypted_data";

    private final byte[] sessionKey;
    private final byte[] iv;
    private final byte[] encryptedData;
    private final @Nullable String rawData;

    public DecryptionContext(@NotNull byte[] sessionKey, @NotNull byte[] iv, @NotNull byte[] encryptedData,
                             @Nullable String rawData) {
        this.sessionKey = sessionKey.clone();
        this.iv = iv.clone();
        this.encryptedData = encryptedData.clone();
        this.rawData = rawData;
    }

    /**
     * Decodes the Base64 encoded values sent by the provider and the client.
     *
     * @throws DataCorruptedException naming the first value that is missing or not valid Base64
     */
    public static @NotNull DecryptionContext decode(@Nullable String sessionKey, @Nullable String iv,
                                                    @Nullable String encryptedData, @Nullable String rawData)
            throws DataCorruptedException {
        return new DecryptionContext(
                decodeField(FIELD_SESSION_KEY, sessionKey),
                decodeField(FIELD_IV, iv),
                decodeField(FIELD_ENCRYPTED_DATA, encryptedData),
                rawData);
    }

    private static byte[] decodeField(String field, @Nullable String value) throws DataCorruptedException {
        if (value == null || value.isEmpty()) {
            throw new DataCorruptedException(String.format("Missing '%s'", field));
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new DataCorruptedException(String.format("'%s' is not valid Base64", field), e);
        }
    }

    public @NotNull byte[] sessionKey() {
        return sessionKey.clone();
    }

    public @NotNull byte[] iv() {
        return iv.clone();
    }

    public @NotNull byte[] encryptedData() {
        return encryptedData.clone();
    }

    /**
     * @return the signed raw data, kept alongside for diagnostics
     */
    public @Nullable String rawData() {
        return rawData;
    }
}
