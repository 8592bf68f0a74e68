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
package org.apache.solr.drv.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.apache.solr.drv.client.CommitExecutor;
import org.apache.solr.drv.client.SingleUseBuilder;
import org.apache.solr.drv.client.SolrCollection;
import org.apache.solr.drv.client.SolrErrorResponseException;
import org.apache.solr.drv.client.SolrHttpRequest;
import org.apache.solr.drv.client.SolrUsageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Batch of field changes for one collection's schema, sent to the Schema API
 * in a single request.
 *
 * <p>
 * Operations are sent in the order they were added, one JSON object per
 * command:
 *
 * <pre>{@code
 * [{"add-field": {"name": "name", "type": "string", ...}}, {"delete-field": {"name": "age"}}]
 * }</pre>
 *
 * <p>
 * Conflicting operations on the same field are not checked locally; Solr
 * applies the commands in request order.
 *
 * @see <a href=
 *      "https://solr.apache.org/guide/solr/latest/indexing-guide/schema-api.html">Schema
 *      API</a>
 */
public class SchemaBuilder extends SingleUseBuilder {

	private static final Logger log = LoggerFactory.getLogger(SchemaBuilder.class);

	private static final String SCHEMA_PATH = "/schema";

	private static final String DETAILS_KEY = "details";

	private static final String ERROR_MESSAGES_KEY = "errorMessages";

	private final SolrCollection collection;

	private final List<SchemaOperation> operations = new ArrayList<>();

	public SchemaBuilder(SolrCollection collection) {
		super("Schema builder for '" + collection.name() + "'");
		this.collection = collection;
	}

	/**
	 * Enqueues an {@code add-field} command.
	 */
	public SchemaBuilder addField(FieldDescriptor field) {
		ensureOpen();
		requireField(field);
		operations.add(SchemaOperation.add(field));
		return this;
	}

	/**
	 * Enqueues a {@code replace-field} command; the new definition replaces the
	 * existing one completely.
	 */
	public SchemaBuilder replaceField(FieldDescriptor field) {
		ensureOpen();
		requireField(field);
		operations.add(SchemaOperation.replace(field));
		return this;
	}

	/**
	 * Enqueues a {@code delete-field} command.
	 */
	public SchemaBuilder deleteField(String name) {
		ensureOpen();
		if (!StringUtils.hasText(name)) {
			throw new SolrUsageException("Field name to delete must not be blank");
		}
		operations.add(SchemaOperation.delete(name));
		return this;
	}

	private static void requireField(FieldDescriptor field) {
		if (field == null) {
			throw new SolrUsageException("Field definition must not be null");
		}
	}

	public List<SchemaOperation> getOperations() {
		return List.copyOf(operations);
	}

	/**
	 * Sends all enqueued commands as one batch.
	 *
	 * @return a future completed with the applied operations, in order, or failed
	 *         with {@link SchemaUpdateException} when Solr rejected the batch
	 * @throws SolrUsageException
	 *             if the builder was already committed
	 */
	public CompletableFuture<List<SchemaOperation>> commit() {
		consume();
		List<SchemaOperation> batch = List.copyOf(operations);
		if (batch.isEmpty()) {
			log.debug("No schema changes to commit for {}, skipping", collection.name());
			return CompletableFuture.completedFuture(batch);
		}

		CommitExecutor executor = collection.solr().executor();
		ObjectMapper objectMapper = executor.getObjectMapper();
		ArrayNode body = objectMapper.createArrayNode();
		batch.forEach(operation -> body.add(operation.toJson(objectMapper)));

		SolrHttpRequest request = SolrHttpRequest.postJson(collection.name() + SCHEMA_PATH, null,
				toBytes(objectMapper, body));
		return executor.execute(request).handle((response, failure) -> {
			if (failure != null) {
				throw toSchemaFailure(failure, batch, objectMapper);
			}
			return batch;
		});
	}

	private static byte[] toBytes(ObjectMapper objectMapper, JsonNode body) {
		try {
			return objectMapper.writeValueAsBytes(body);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

	private static RuntimeException toSchemaFailure(Throwable failure, List<SchemaOperation> batch,
			ObjectMapper objectMapper) {
		Throwable cause = failure instanceof CompletionException && failure.getCause() != null
				? failure.getCause()
				: failure;
		if (cause instanceof SolrErrorResponseException errorResponse) {
			return new SchemaUpdateException(errorResponse,
					matchFailedOperations(errorResponse.getError(), batch, objectMapper));
		}
		if (cause instanceof RuntimeException runtimeException) {
			return runtimeException;
		}
		return new CompletionException(cause);
	}

	/**
	 * Maps the entries of {@code error.details} back to positions in the batch.
	 * Each entry echoes one failed command next to its {@code errorMessages}.
	 */
	static List<SchemaUpdateException.FailedOperation> matchFailedOperations(JsonNode error,
			List<SchemaOperation> batch, ObjectMapper objectMapper) {
		List<SchemaUpdateException.FailedOperation> failed = new ArrayList<>();
		JsonNode details = error.path(DETAILS_KEY);
		if (!details.isArray()) {
			return failed;
		}

		List<JsonNode> payloads = new ArrayList<>(batch.size());
		batch.forEach(operation -> payloads.add(operation.payload(objectMapper)));
		boolean[] matched = new boolean[batch.size()];

		for (JsonNode detail : details) {
			String command = null;
			for (Iterator<String> names = detail.fieldNames(); names.hasNext();) {
				String name = names.next();
				if (!ERROR_MESSAGES_KEY.equals(name)) {
					command = name;
					break;
				}
			}
			List<String> messages = new ArrayList<>();
			detail.path(ERROR_MESSAGES_KEY).forEach(message -> messages.add(message.asText()));
			if (command == null) {
				failed.add(new SchemaUpdateException.FailedOperation(-1, null, messages));
				continue;
			}

			int index = findOperation(command, detail.get(command), batch, payloads, matched);
			failed.add(new SchemaUpdateException.FailedOperation(index, command, messages));
		}
		return failed;
	}

	private static int findOperation(String command, JsonNode payload, List<SchemaOperation> batch,
			List<JsonNode> payloads, boolean[] matched) {
		// exact payload first, then the first unmatched command on the same field
		for (int i = 0; i < batch.size(); i++) {
			if (!matched[i] && batch.get(i).action().command().equals(command) && payloads.get(i).equals(payload)) {
				matched[i] = true;
				return i;
			}
		}
		String fieldName = payload.path(FieldDescriptor.NAME_KEY).asText(null);
		for (int i = 0; i < batch.size(); i++) {
			if (!matched[i] && batch.get(i).action().command().equals(command)
					&& batch.get(i).fieldName().equals(fieldName)) {
				matched[i] = true;
				return i;
			}
		}
		return -1;
	}
}
