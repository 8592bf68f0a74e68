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
package org.apache.solr.drv.indexing;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.apache.solr.common.params.UpdateParams;
import org.apache.solr.drv.client.CommitExecutor;
import org.apache.solr.drv.client.SingleUseBuilder;
import org.apache.solr.drv.client.SolrCollection;
import org.apache.solr.drv.client.SolrHttpRequest;
import org.apache.solr.drv.client.SolrUsageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Batch of document updates for one collection, posted to the JSON update
 * handler in a single request.
 *
 * <p>
 * <strong>Accumulation:</strong> every {@code add} call appends to the pending
 * batch. A JSON object is one document; a JSON array contributes each of its
 * elements, which must all be objects. These two calls are equivalent:
 *
 * <pre>{@code
 * users.documents().add(json("{\"name\": \"Some\", \"age\": 19}")).add(json("{\"name\": \"Dude\", \"age\": 21}"));
 *
 * users.documents().add(json("[{\"name\": \"Some\", \"age\": 19}, {\"name\": \"Dude\", \"age\": 21}]"));
 * }</pre>
 *
 * <p>
 * <strong>Wire format:</strong> with only documents pending the body is a
 * plain JSON array. Once deletes are enqueued the body becomes Solr's command
 * object, adds first, then deletes by id, then deletes by query.
 *
 * <p>
 * <strong>Commit:</strong> the request carries {@code commit=true} so the
 * changes are searchable when the future completes, unless
 * {@link #commitWithin(int)} asks Solr to commit later.
 *
 * @see <a href=
 *      "https://solr.apache.org/guide/solr/latest/indexing-guide/indexing-with-update-handlers.html#json-formatted-index-updates">JSON
 *      updates</a>
 */
public class DocumentsBuilder extends SingleUseBuilder {

	private static final Logger log = LoggerFactory.getLogger(DocumentsBuilder.class);

	private static final String UPDATE_PATH = "/update";

	private static final String ADD_COMMAND = "add";

	private static final String DELETE_COMMAND = "delete";

	private static final String DOC_KEY = "doc";

	private static final String QUERY_KEY = "query";

	private final SolrCollection collection;

	private final ObjectMapper objectMapper;

	private final List<ObjectNode> documents = new ArrayList<>();

	private final List<String> deleteIds = new ArrayList<>();

	private final List<String> deleteQueries = new ArrayList<>();

	private Integer commitWithin;

	private Boolean overwrite;

	public DocumentsBuilder(SolrCollection collection) {
		super("Documents builder for '" + collection.name() + "'");
		this.collection = collection;
		this.objectMapper = collection.solr().executor().getObjectMapper();
	}

	/**
	 * Enqueues one document (a JSON object) or several (a JSON array of
	 * objects).
	 *
	 * @throws SolrUsageException
	 *             if the payload is neither an object nor an array of objects;
	 *             nothing is enqueued in that case
	 */
	public DocumentsBuilder add(JsonNode payload) {
		ensureOpen();
		if (payload == null) {
			throw new SolrUsageException("Document payload must not be null");
		}
		switch (payload.getNodeType()) {
			case OBJECT -> documents.add(((ObjectNode) payload).deepCopy());
			case ARRAY -> {
				for (JsonNode element : payload) {
					if (!element.isObject()) {
						throw new SolrUsageException(
								"Every element of a document array must be a JSON object, got " + element.getNodeType());
					}
				}
				payload.forEach(element -> documents.add(((ObjectNode) element).deepCopy()));
			}
			default -> throw new SolrUsageException(
					"Document payload must be a JSON object or an array of objects, got " + payload.getNodeType());
		}
		return this;
	}

	/**
	 * Parses {@code json} and enqueues it like {@link #add(JsonNode)}.
	 *
	 * @throws SolrUsageException
	 *             if the string is not valid JSON
	 */
	public DocumentsBuilder add(String json) {
		ensureOpen();
		JsonNode payload;
		try {
			payload = objectMapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new SolrUsageException("Document payload is not valid JSON: " + e.getOriginalMessage());
		}
		return add(payload);
	}

	/**
	 * Converts a {@code Map}, bean or record with Jackson and enqueues it like
	 * {@link #add(JsonNode)}.
	 */
	public DocumentsBuilder add(Object document) {
		ensureOpen();
		return add((JsonNode) objectMapper.valueToTree(document));
	}

	/**
	 * Enqueues deletion of documents by unique key.
	 *
	 * @throws SolrUsageException
	 *             if any id is null or blank; nothing is enqueued in that case
	 */
	public DocumentsBuilder deleteById(String... ids) {
		ensureOpen();
		if (ids == null) {
			throw new SolrUsageException("Ids to delete must not be null");
		}
		for (String id : ids) {
			if (!StringUtils.hasText(id)) {
				throw new SolrUsageException("Id to delete must not be blank");
			}
		}
		deleteIds.addAll(Arrays.asList(ids));
		return this;
	}

	/**
	 * Enqueues deletion of every document matching {@code query}.
	 *
	 * @throws SolrUsageException
	 *             if the query is null or blank
	 */
	public DocumentsBuilder deleteByQuery(String query) {
		ensureOpen();
		if (!StringUtils.hasText(query)) {
			throw new SolrUsageException("Delete query must not be blank");
		}
		deleteQueries.add(query);
		return this;
	}

	/**
	 * Lets Solr commit within the given time instead of committing immediately.
	 */
	public DocumentsBuilder commitWithin(int milliseconds) {
		ensureOpen();
		this.commitWithin = milliseconds;
		return this;
	}

	/**
	 * When {@code false}, documents are added without checking for an existing
	 * document with the same unique key.
	 */
	public DocumentsBuilder overwrite(boolean overwrite) {
		ensureOpen();
		this.overwrite = overwrite;
		return this;
	}

	/**
	 * Number of documents enqueued for adding.
	 */
	public int size() {
		return documents.size();
	}

	ModifiableSolrParams toParams() {
		ModifiableSolrParams params = new ModifiableSolrParams();
		if (commitWithin != null) {
			params.set(UpdateParams.COMMIT_WITHIN, commitWithin);
		} else {
			params.set(UpdateParams.COMMIT, true);
		}
		if (overwrite != null) {
			params.set(UpdateParams.OVERWRITE, overwrite);
		}
		return params;
	}

	byte[] toBody() {
		try {
			if (deleteIds.isEmpty() && deleteQueries.isEmpty()) {
				ArrayNode array = objectMapper.createArrayNode();
				array.addAll(documents);
				return objectMapper.writeValueAsBytes(array);
			}
			return writeCommands();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	// repeated "add"/"delete" keys are valid in Solr's command format
	private byte[] writeCommands() throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (JsonGenerator generator = objectMapper.getFactory().createGenerator(out)) {
			generator.writeStartObject();
			for (ObjectNode document : documents) {
				generator.writeFieldName(ADD_COMMAND);
				generator.writeStartObject();
				generator.writeFieldName(DOC_KEY);
				objectMapper.writeTree(generator, document);
				generator.writeEndObject();
			}
			if (!deleteIds.isEmpty()) {
				generator.writeFieldName(DELETE_COMMAND);
				generator.writeStartArray();
				for (String id : deleteIds) {
					generator.writeString(id);
				}
				generator.writeEndArray();
			}
			for (String query : deleteQueries) {
				generator.writeFieldName(DELETE_COMMAND);
				generator.writeStartObject();
				generator.writeStringField(QUERY_KEY, query);
				generator.writeEndObject();
			}
			generator.writeEndObject();
		}
		return out.toByteArray();
	}

	/**
	 * Posts the pending batch.
	 *
	 * @return a future completed with the update outcome, or failed with the
	 *         transport, decode or server error; nothing is retried
	 * @throws SolrUsageException
	 *             if the builder was already committed
	 */
	public CompletableFuture<UpdateResponse> commit() {
		consume();
		if (documents.isEmpty() && deleteIds.isEmpty() && deleteQueries.isEmpty()) {
			log.debug("No documents to commit for {}, skipping", collection.name());
			return CompletableFuture.completedFuture(UpdateResponse.empty());
		}

		CommitExecutor executor = collection.solr().executor();
		SolrHttpRequest request = SolrHttpRequest.postJson(collection.name() + UPDATE_PATH, toParams(), toBody());
		return executor.execute(request).thenApply(UpdateResponse::from);
	}
}
