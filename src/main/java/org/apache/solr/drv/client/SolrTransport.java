/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.solr.drv.client;

import java.util.concurrent.CompletableFuture;

/**
 * HTTP collaborator used by {@link CommitExecutor}.
 *
 * <p>
 * An implementation sends exactly one request and completes the returned
 * future with the raw status and body, whatever the status is. Connection
 * failures and timeouts complete it exceptionally. Connection management, TLS
 * and timeouts are the implementation's concern.
 *
 * @see SolrClientTransport
 */
@FunctionalInterface
public interface SolrTransport {

	/**
	 * Sends one request.
	 *
	 * @param request
	 *            method, path below the Solr root, parameters and optional body
	 * @return the status and body bytes of the response
	 */
	CompletableFuture<TransportResponse> send(SolrHttpRequest request);
}
