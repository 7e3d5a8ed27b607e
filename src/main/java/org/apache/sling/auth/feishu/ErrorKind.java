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

/**
 * Classifies why an authentication attempt failed.
 *
 * <p>Callers are expected to treat {@link #SIGNATURE_MISMATCH} as a possible tampering signal
 * and {@link #TRANSPORT} as a transient fault.</p>
 */
public enum ErrorKind {

    /** The callback carried no authorization code. Restarting the request phase may help. */
    MISSING_CODE,

    /** The identity provider rejected the token exchange. */
    PROVIDER,

    /** The identity provider could not be reached or answered with an unusable status. */
    TRANSPORT,

    /** The user info response or the callback parameters were malformed. */
    DATA_INVALID,

    /** The encrypted user data could not be decoded or decrypted. */
    DATA_CORRUPTED,

    /** The user data signature did not match. */
    SIGNATURE_MISMATCH
}
