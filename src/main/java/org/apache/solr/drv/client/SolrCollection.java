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
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.apache.solr.client.solrj.util.SolrIdentifierValidator;
import org.apache.solr.drv.indexing.DocumentsBuilder;
import org.apache.solr.drv.metadata.SchemaBuilder;
import org.apache.solr.drv.search.SearchBuilder;

/**
 * Handle to one named collection.
 *
 * <p>
 * The handle is immutable and may be shared between threads. Each call to
 * {@link #schema()}, {@link #documents()} or {@link #search()} returns a new,
 * independent single-use builder; committing one builder never affects
 * another.
 */
public final class SolrCollection {

	private static final String SCHEMA_PATH = "/schema";

	private static final String SCHEMA_KEY = "schema";

	private final Solr solr;

	private final String name;

	/**
	 * @throws SolrUsageException
	 *             if the name is not a valid collection name
	 * @see #validateName(String)
	 */
	public SolrCollection(Solr solr, String name) {
		validateName(name);
		this.solr = Objects.requireNonNull(solr, "solr");
		this.name = name;
	}

	/**
	 * Checks {@code name} against Solr's identifier rules: letters, digits,
	 * {@code .}, {@code _} and {@code -}, not starting with {@code -}.
	 *
	 * @throws SolrUsageException
	 *             if the name is blank or contains other characters
	 */
	public static void validateName(String name) {
		if (name == null || name.isBlank()) {
			throw new SolrUsageException("Collection name must not be blank");
		}
		if (!SolrIdentifierValidator.validateCollectionName(name)) {
			throw new SolrUsageException("Invalid collection name '" + name
					+ "': only letters, digits, '.', '_' and '-' are allowed, and it must not start with '-'");
		}
	}

	public String name() {
		return name;
	}

	public Solr solr() {
		return solr;
	}

	/**
	 * Starts a batch of schema changes.
	 */
	public SchemaBuilder schema() {
		return new SchemaBuilder(this);
	}

	/**
	 * Starts a batch of document updates.
	 */
	public DocumentsBuilder documents() {
		return new DocumentsBuilder(this);
	}

	/**
	 * Shortcut for {@code documents().add(document)}.
	 */
	public DocumentsBuilder add(JsonNode document) {
		return documents().add(document);
	}

	/**
	 * Starts a query against the {@code select} handler.
	 */
	public SearchBuilder search() {
		return new SearchBuilder(this);
	}

	/**
	 * Retrieves the current schema definition (fields, field types, dynamic
	 * fields, copy fields).
	 *
	 * @return the {@code schema} section of the response
	 */
	public CompletableFuture<JsonNode> getSchema() {
		return solr.executor().execute(SolrHttpRequest.get(name + SCHEMA_PATH, null)).thenApply(response -> {
			JsonNode schema = response.body().get(SCHEMA_KEY);
			if (schema == null) {
				throw new SolrDecodeException(response.httpStatus(), "Schema response has no schema section");
			}
			return schema;
		});
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SolrCollection other)) {
			return false;
		}
		return name.equals(other.name) && solr.baseUrl().equals(other.solr.baseUrl());
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, solr.baseUrl());
	}

	@Override
	public String toString() {
		return "SolrCollection[" + name + "]";
	}
}
