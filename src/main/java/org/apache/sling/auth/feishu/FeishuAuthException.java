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
 * Base class for all failures of a single authentication attempt.
 *
 * <p>Every failure carries an {@link ErrorKind} and a short, machine readable code. The message
 * is the human readable description.</p>
 */
public abstract class FeishuAuthException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String code;

    protected FeishuAuthException(@NotNull ErrorKind kind, @NotNull String code, @Nullable String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    protected FeishuAuthException(@NotNull ErrorKind kind, @NotNull String code, @Nullable String message,
                                  @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public @NotNull ErrorKind getKind() {
        return kind;
    }

    public @NotNull String getCode() {
        return code;
    }

    /**
     * @return an {@link AuthError} describing this failure
     */
    public @NotNull AuthError toAuthError() {
        return new AuthError(kind, code, getMessage());
    }
}
