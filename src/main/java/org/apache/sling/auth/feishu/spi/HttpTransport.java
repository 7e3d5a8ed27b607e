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
package org.apache.sling.auth.feishu.spi;

import java.io.IOException;

import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import org.jetbrains.annotations.NotNull;

/**
 * Sends the HTTP requests issued towards the identity provider.
 *
 * <p>Implementations own timeouts, proxies and TLS settings. They must return non-2xx responses as
 * regular {@link HTTPResponse responses} and only throw when no response was received at all. Requests
 * must not be retried by the implementation.</p>
 *
 * <p>The default implementation sends the request with the connection and read timeouts of the
 * configured connection. Register a service of this type to replace it.</p>
 */
public interface HttpTransport {

    /**
     * Sends the request and returns the response.
     *
     * @param request the request, must not be null
     * @return the response, whatever its status code
     * @throws IOException if the request could not be sent or no response was received
     */
    @NotNull HTTPResponse send(@NotNull HTTPRequest request) throws IOException;
}
