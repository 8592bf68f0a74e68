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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes one assembled {@link SolrHttpRequest} and interprets Solr's response
 * envelope. Every builder's {@code commit()} ends here.
 *
 * <p>
 * <strong>Envelope rules:</strong>
 *
 * <ul>
 * <li>The body must be a JSON object, otherwise the future fails with
 * {@link SolrDecodeException}
 * <li>A non-zero {@code responseHeader.status}, an {@code error} section or
 * an HTTP status of 400 or above fails the future with
 * {@link SolrErrorResponseException}
 * <li>Otherwise the result is the envelope without {@code responseHeader}
 * </ul>
 *
 * <p>
 * Transport failures fail the future with {@link SolrTransportException}. No
 * request is retried and nothing is cached; each call issues exactly one HTTP
 * request.
 */
public class CommitExecutor {

	private static final Logger log = LoggerFactory.getLogger(CommitExecutor.class);

	// ========================================
	// Constants for Response Parsing
	// ========================================

	static final String RESPONSE_HEADER_KEY = "responseHeader";

	private static final String STATUS_KEY = "status";

	private static final String ERROR_KEY = "error";

	private static final String MSG_KEY = "msg";

	private static final String CODE_KEY = "code";

	private final String baseUrl;

	private final SolrTransport transport;

	private final ObjectMapper objectMapper;

	/**
	 * @param baseUrl
	 *            Solr root URL without trailing slash, e.g.
	 *            {@code http://localhost:8983/solr}
	 * @param transport
	 *            HTTP collaborator
	 * @param objectMapper
	 *            JSON codec for response bodies
	 */
	public CommitExecutor(String baseUrl, SolrTransport transport, ObjectMapper objectMapper) {
		this.baseUrl = baseUrl;
		this.transport = transport;
		this.objectMapper = objectMapper;
	}

	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	/**
	 * Sends the request and completes with the decoded success envelope.
	 *
	 * @param request
	 *            the assembled request
	 * @return a future completed with the response, or failed with a
	 *         {@link SolrClientException}
	 */
	public CompletableFuture<SolrResponse> execute(SolrHttpRequest request) {
		URI uri;
		try {
			uri = request.toUri(baseUrl);
		} catch (IllegalArgumentException e) {
			return CompletableFuture
					.failedFuture(new SolrUsageException("Invalid request path '" + request.path() + "': " + e.getMessage()));
		}

		log.debug("{}: {}", request.method(), uri);

		CompletableFuture<TransportResponse> sent;
		try {
			sent = transport.send(request);
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(new SolrTransportException(uri, e));
		}

		return sent.handle((response, failure) -> {
			if (failure != null) {
				throw toTransportException(uri, failure);
			}
			return interpret(response);
		});
	}

	/**
	 * Applies the envelope rules to a raw response.
	 */
	SolrResponse interpret(TransportResponse response) {
		JsonNode json;
		try {
			json = objectMapper.readTree(response.body());
		} catch (IOException e) {
			throw new SolrDecodeException(response.status(),
					"Response body is not valid JSON (HTTP " + response.status() + ")", e);
		}
		if (json == null || !json.isObject()) {
			throw new SolrDecodeException(response.status(),
					"Response body is not a JSON object (HTTP " + response.status() + ")");
		}

		ObjectNode envelope = (ObjectNode) json;
		JsonNode header = envelope.path(RESPONSE_HEADER_KEY);
		int status = header.path(STATUS_KEY).asInt(0);
		JsonNode error = envelope.get(ERROR_KEY);

		if (error != null || status != 0 || response.status() >= 400) {
			SolrErrorResponseException exception = toErrorResponse(error, status, response.status());
			log.debug("Solr reported error {}: {}", exception.getCode(), exception.getMessage());
			throw exception;
		}

		ObjectNode body = envelope.deepCopy();
		body.remove(RESPONSE_HEADER_KEY);
		return new SolrResponse(response.status(), header, body);
	}

	private static SolrErrorResponseException toErrorResponse(JsonNode error, int status, int httpStatus) {
		int fallbackCode = status != 0 ? status : httpStatus;
		if (error == null) {
			return new SolrErrorResponseException(fallbackCode, "Solr returned status " + fallbackCode, null);
		}
		if (error.isTextual()) {
			return new SolrErrorResponseException(fallbackCode, error.asText(), error);
		}
		int code = error.path(CODE_KEY).asInt(fallbackCode);
		String message = error.hasNonNull(MSG_KEY) ? error.get(MSG_KEY).asText() : "Solr returned status " + code;
		return new SolrErrorResponseException(code, message, error);
	}

	private static RuntimeException toTransportException(URI uri, Throwable failure) {
		Throwable cause = failure instanceof CompletionException && failure.getCause() != null
				? failure.getCause()
				: failure;
		if (cause instanceof SolrClientException solrClientException) {
			return solrClientException;
		}
		return new SolrTransportException(uri, cause);
	}
}
