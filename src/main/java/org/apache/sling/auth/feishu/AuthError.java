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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class AuthError {

    private final ErrorKind kind;
    private final String code;
    private final @Nullable String description;

    public AuthError(@NotNull ErrorKind kind, @NotNull String code, @Nullable String description) {
        this.kind = kind;
        this.code = code;
        this.description = description;
    }

    public @NotNull ErrorKind kind() {
        return kind;
    }

    public @NotNull String code() {
        return code;
    }

    public @Nullable String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuthError)) return false;

        AuthError that = (AuthError) o;
        return kind == that.kind && code.equals(that.code) && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, code, description);
    }

    @Override
    public String toString() {
        return kind + "[" + code + (description == null ? "" : ": " + description) + "]";
    }
}
