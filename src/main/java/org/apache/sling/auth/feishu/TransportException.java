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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A call to the identity provider failed at the network level or returned an unusable status.
 *
 * <p>Requests are never retried.</p>
 */
public class TransportException extends FeishuAuthException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "transport_error";

    private final int statusCode;

    public TransportException(@NotNull String message, int statusCode) {
        super(ErrorKind.TRANSPORT, CODE, message);
        this.statusCode = statusCode;
    }

    public TransportException(@NotNull String message, @Nullable Throwable cause) {
        super(ErrorKind.TRANSPORT, CODE, message, cause);
        this.statusCode = -1;
    }

    /**
     * @return the HTTP status code received, or {@code -1} if no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
