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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.apache.solr.client.solrj.impl.Http2SolrClient;
import org.apache.solr.client.solrj.impl.HttpJdkSolrClient;
import org.apache.solr.client.solrj.impl.HttpSolrClientBase;
import org.apache.solr.client.solrj.impl.InputStreamResponseParser;
import org.apache.solr.client.solrj.request.GenericSolrRequest;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.util.NamedList;

/**
 * {@link SolrTransport} backed by a SolrJ HTTP client.
 *
 * <p>
 * Requests go out as {@link GenericSolrRequest}s with an
 * {@link InputStreamResponseParser}, so SolrJ performs the HTTP exchange but
 * leaves the response unparsed: the raw JSON bytes and the HTTP status are
 * handed to {@link CommitExecutor}, which applies Solr's envelope rules
 * itself.
 *
 * <p>
 * <strong>Protocol selection:</strong>
 *
 * <ul>
 * <li>{@code 1.1} uses {@link HttpJdkSolrClient}
 * <li>anything else uses {@link Http2SolrClient}
 * </ul>
 *
 * <p>
 * Both are built with a 10 second connection timeout and a 60 second idle
 * timeout.
 */
public class SolrClientTransport implements SolrTransport, AutoCloseable {

	static final long CONNECTION_TIMEOUT_MILLIS = 10000;

	static final long IDLE_TIMEOUT_MILLIS = 60000;

	static final String HTTP_1_1 = "1.1";

	private static final String JSON_WRITER_TYPE = "json";

	private final HttpSolrClientBase solrClient;

	/**
	 * @param solrClient
	 *            client whose base URL is the Solr root, e.g.
	 *            {@code http://localhost:8983/solr}
	 */
	public SolrClientTransport(HttpSolrClientBase solrClient) {
		this.solrClient = solrClient;
	}

	/**
	 * Builds the SolrJ client for {@code httpVersion}.
	 *
	 * @param baseUrl
	 *            Solr root URL
	 * @param httpVersion
	 *            {@code "1.1"} for HTTP/1.1, anything else (including
	 *            {@code null}) for HTTP/2
	 */
	public static SolrClientTransport create(String baseUrl, String httpVersion) {
		if (HTTP_1_1.equals(httpVersion)) {
			return new SolrClientTransport(new HttpJdkSolrClient.Builder(baseUrl)
					.withConnectionTimeout(CONNECTION_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
					.withIdleTimeout(IDLE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
					.build());
		}
		return new SolrClientTransport(new Http2SolrClient.Builder(baseUrl)
				.withConnectionTimeout(CONNECTION_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
				.withIdleTimeout(IDLE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
				.build());
	}

	public HttpSolrClientBase getSolrClient() {
		return solrClient;
	}

	@Override
	public CompletableFuture<TransportResponse> send(SolrHttpRequest request) {
		return solrClient.requestAsync(toSolrRequest(request), null).handle((response, failure) -> {
			if (failure == null) {
				return toTransportResponse(response);
			}
			Throwable cause = failure instanceof CompletionException && failure.getCause() != null
					? failure.getCause()
					: failure;
			// SolrJ rejects some error statuses before handing out the stream
			if (cause instanceof SolrException solrException && solrException.code() > 0) {
				return TransportResponse.of(solrException.code(), String.valueOf(solrException.getMessage()));
			}
			throw failure instanceof CompletionException completion ? completion : new CompletionException(failure);
		});
	}

	static GenericSolrRequest toSolrRequest(SolrHttpRequest request) {
		GenericSolrRequest solrRequest = new GenericSolrRequest(request.method(), "/" + request.path(),
				request.params());
		if (request.body() != null) {
			solrRequest.withContent(request.body(), request.contentType() + "; charset=UTF-8");
		}
		solrRequest.setResponseParser(new InputStreamResponseParser(JSON_WRITER_TYPE));
		return solrRequest;
	}

	static TransportResponse toTransportResponse(NamedList<Object> response) {
		Object status = response.get(InputStreamResponseParser.HTTP_STATUS_KEY);
		try (InputStream stream = (InputStream) response.get(InputStreamResponseParser.STREAM_KEY)) {
			byte[] body = stream == null ? new byte[0] : stream.readAllBytes();
			return new TransportResponse(status instanceof Integer code ? code : 200, body);
		} catch (IOException e) {
			throw new CompletionException(new UncheckedIOException(e));
		}
	}

	@Override
	public void close() throws IOException {
		solrClient.close();
	}
}
