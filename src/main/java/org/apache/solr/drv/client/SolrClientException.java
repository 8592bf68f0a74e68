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

/**
 * Base type of every failure reported by this client.
 *
 * <p>
 * Failures on the I/O path (transport, decoding, server-reported errors)
 * complete the future returned by a builder's {@code commit()} exceptionally,
 * so callers usually see them as the cause of a
 * {@link java.util.concurrent.CompletionException} or
 * {@link java.util.concurrent.ExecutionException}. Usage failures are thrown
 * directly, before any request is sent.
 *
 * @see SolrTransportException
 * @see SolrDecodeException
 * @see SolrErrorResponseException
 * @see SolrUsageException
 */
public abstract class SolrClientException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	protected SolrClientException(String message) {
		super(message);
	}

	protected SolrClientException(String message, Throwable cause) {
		super(message, cause);
	}
}
