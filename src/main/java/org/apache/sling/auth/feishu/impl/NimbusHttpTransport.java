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

import java.io.IOException;

import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import org.apache.sling.auth.feishu.spi.HttpTransport;
import org.jetbrains.annotations.NotNull;

/**
 * Sends requests with the HTTP client built into the OAuth 2.0 SDK.
 */
class NimbusHttpTransport implements HttpTransport {

    private final int connectTimeout;
    private final int readTimeout;

    NimbusHttpTransport(int connectTimeout, int readTimeout) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    @Override
    public @NotNull HTTPResponse send(@NotNull HTTPRequest request) throws IOException {
        request.setConnectTimeout(connectTimeout);
        request.setReadTimeout(readTimeout);
        return request.send();
    }
}
