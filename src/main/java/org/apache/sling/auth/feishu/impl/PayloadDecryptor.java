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
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import org.apache.sling.auth.feishu.DataCorruptedException;
import org.jetbrains.annotations.NotNull;

/**
 * Decrypts the miniapp user data.
 *
 * <p>The data is AES-128-CBC encrypted with the session key and padded PKCS#7 style. The cipher runs
 * without padding; the last byte of the plain text gives the number of bytes to strip.</p>
 */
public class PayloadDecryptor {

    static final String UNION_ID = "unionId";
    static final String UNION_ID_LOWERCASE = "unionid";

    private static final String TRANSFORMATION = "AES/CBC/NoPadding";
    private static final int KEY_LENGTH = 16;

    /**
     * @return the decrypted user data. Contains {@code unionid} whenever it contains {@code unionId}
     * @throws DataCorruptedException if the data can not be decrypted or is not a JSON object
     */
    public @NotNull Map<String, Object> decrypt(@NotNull DecryptionContext context) throws DataCorruptedException {
        byte[] decrypted = decipher(context);
        byte[] payload = unpad(decrypted);

        Map<String, Object> data;
        try {
            data = new LinkedHashMap<>(JSONObjectUtils.parse(new String(payload, StandardCharsets.UTF_8)));
        } catch (ParseException e) {
            throw new DataCorruptedException("Decrypted user data is not a JSON object", e);
        }

        if (data.containsKey(UNION_ID)) {
            data.put(UNION_ID_LOWERCASE, data.get(UNION_ID));
        }
        return data;
    }

    private static byte[] decipher(DecryptionContext context) throws DataCorruptedException {
        byte[] key = context.sessionKey();
        if (key.length != KEY_LENGTH) {
            throw new DataCorruptedException(
                    String.format("Session key must be %d bytes long, got %d", KEY_LENGTH, key.length));
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(context.iv()));
            return cipher.doFinal(context.encryptedData());
        } catch (GeneralSecurityException e) {
            throw new DataCorruptedException("Failed to decrypt user data: " + e.getMessage(), e);
        }
    }

    /**
     * Drops as many trailing bytes as the last byte says.
     *
     * @throws DataCorruptedException if the padding is longer than the buffer
     */
    static @NotNull byte[] unpad(@NotNull byte[] buffer) throws DataCorruptedException {
        if (buffer.length == 0) {
            return buffer;
        }
        int padding = buffer[buffer.length - 1] & 0xff;
        if (padding > buffer.length) {
            throw new DataCorruptedException(
                    String.format("Padding of %d bytes exceeds the %d bytes of decrypted data", padding, buffer.length));
        }
        return Arrays.copyOf(buffer, buffer.length - padding);
    }
}
