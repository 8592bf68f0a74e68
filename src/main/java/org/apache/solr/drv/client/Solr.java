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
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import org.apache.solr.common.params.CommonParams;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.apache.solr.drv.metadata.CollectionsApi;

/**
 * Entry point of the driver: the location of a Solr node plus the
 * collaborators every request goes through.
 *
 * <p>
 * A {@code Solr} instance is immutable and thread-safe. Constructing one does
 * no I/O; requests are only sent when a builder is committed.
 *
 * <p>
 * <strong>Example Usage:</strong>
 *
 * <pre>{@code
 * Solr solr = Solr.client("http", "localhost", 8983);
 *
 * SolrCollection users = solr.collections().create("users").routerField("id").numShards(16)
 * 		.maxShardsPerNode(16).commit().join();
 *
 * users.schema().addField(FieldBuilder.string("name")).addField(FieldBuilder.numeric("age")).commit().join();
 *
 * users.add(json).commit().join();
 *
 * SearchResponse found = users.search().query("age:21").fl("name,age").sort("name asc").commit().join();
 * }</pre>
 *
 * @see CollectionsApi
 * @see SolrCollection
 */
public class Solr implements AutoCloseable {

	/** Context path of a stock Solr install. */
	public static final String DEFAULT_BASE_PATH = "/solr";

	private static final String SYSTEM_INFO_PATH = "admin/info/system";

	private static final String JSON_FORMAT = "json";

	private final String scheme;

	private final String host;

	private final int port;

	private final String basePath;

	private final CommitExecutor executor;

	private final SolrClientTransport ownedTransport;

	/**
	 * Creates a client for a node serving Solr under {@value #DEFAULT_BASE_PATH}.
	 *
	 * @see #Solr(String, String, int, String, SolrTransport, ObjectMapper)
	 */
	public Solr(String scheme, String host, int port, SolrTransport transport, ObjectMapper objectMapper) {
		this(scheme, host, port, DEFAULT_BASE_PATH, transport, objectMapper);
	}

	/**
	 * Creates a client with explicit collaborators.
	 *
	 * @param scheme
	 *            {@code http} or {@code https}
	 * @param host
	 *            host name of a Solr node
	 * @param port
	 *            port of the Solr node
	 * @param basePath
	 *            context path Solr is served under, e.g. {@code /solr} or
	 *            {@code /custom/solr}; surrounding slashes are optional
	 * @param transport
	 *            HTTP collaborator
	 * @param objectMapper
	 *            JSON codec used for request and response bodies
	 * @throws IllegalArgumentException
	 *             if scheme or host is blank or the port is out of range
	 */
	public Solr(String scheme, String host, int port, String basePath, SolrTransport transport,
			ObjectMapper objectMapper) {
		this(scheme, host, port, basePath, transport, objectMapper, null);
	}

	private Solr(String scheme, String host, int port, String basePath, SolrTransport transport,
			ObjectMapper objectMapper, SolrClientTransport ownedTransport) {
		if (scheme == null || scheme.isBlank()) {
			throw new IllegalArgumentException("Scheme must not be blank");
		}
		if (host == null || host.isBlank()) {
			throw new IllegalArgumentException("Host must not be blank");
		}
		if (port < 1 || port > 65535) {
			throw new IllegalArgumentException("Port out of range: " + port);
		}
		this.scheme = scheme;
		this.host = host;
		this.port = port;
		this.basePath = normalizeBasePath(basePath);
		this.executor = new CommitExecutor(baseUrl(), transport, objectMapper);
		this.ownedTransport = ownedTransport;
	}

	/**
	 * Creates a client over an HTTP/2 {@link SolrClientTransport} and a default
	 * {@link ObjectMapper}. The transport is released by {@link #close()}.
	 */
	public static Solr client(String scheme, String host, int port) {
		String baseUrl = scheme + "://" + host + ":" + port + DEFAULT_BASE_PATH;
		SolrClientTransport transport = SolrClientTransport.create(baseUrl, null);
		return new Solr(scheme, host, port, DEFAULT_BASE_PATH, transport, new ObjectMapper(), transport);
	}

	// "/custom/solr/" -> "/custom/solr", "" -> ""
	static String normalizeBasePath(String basePath) {
		if (basePath == null) {
			return DEFAULT_BASE_PATH;
		}
		String trimmed = basePath.strip();
		while (trimmed.startsWith("/")) {
			trimmed = trimmed.substring(1);
		}
		while (trimmed.endsWith("/")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1);
		}
		return trimmed.isEmpty() ? "" : "/" + trimmed;
	}

	public String getScheme() {
		return scheme;
	}

	public String getHost() {
		return host;
	}

	public int getPort() {
		return port;
	}

	public String getBasePath() {
		return basePath;
	}

	/**
	 * Root of the Solr API, e.g. {@code http://localhost:8983/solr}; never ends
	 * with a slash.
	 */
	public String baseUrl() {
		return scheme + "://" + host + ":" + port + basePath;
	}

	public CommitExecutor executor() {
		return executor;
	}

	/**
	 * Returns the API for creating, listing and deleting collections.
	 */
	public CollectionsApi collections() {
		return new CollectionsApi(this);
	}

	/**
	 * Returns a handle to an already existing collection. No request is sent;
	 * a missing collection surfaces as an error on the first commit.
	 */
	public SolrCollection collection(String name) {
		return new SolrCollection(this, name);
	}

	/**
	 * Fetches node and JVM information from {@code admin/info/system}.
	 */
	public CompletableFuture<JsonNode> systemInfo() {
		ModifiableSolrParams params = new ModifiableSolrParams();
		params.set(CommonParams.WT, JSON_FORMAT);
		return executor.execute(SolrHttpRequest.get(SYSTEM_INFO_PATH, params)).thenApply(SolrResponse::body);
	}

	/**
	 * Closes the transport created by {@link #client(String, String, int)}.
	 * Injected transports are left to their owner.
	 */
	@Override
	public void close() throws IOException {
		if (ownedTransport != null) {
			ownedTransport.close();
		}
	}

	@Override
	public String toString() {
		return "Solr[" + baseUrl() + "]";
	}
}
