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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.apache.solr.drv.client.SolrResponse;

/**
 * Outcome of a document update commit.
 *
 * <p>
 * {@code errors} is only populated when the collection's update chain is
 * tolerant of per-document failures; Solr then accepts the batch and lists the
 * rejected documents in {@code responseHeader.errors}. Those entries are passed
 * through as reported.
 *
 * @param status
 *            the {@code responseHeader.status}, {@code 0} on success
 * @param qTime
 *            server-side processing time in milliseconds
 * @param errors
 *            per-document failures reported by the server
 */
public record UpdateResponse(int status, int qTime, List<UpdateError> errors) {

	/**
	 * One document Solr rejected while accepting the rest of the batch.
	 *
	 * @param type
	 *            the failed command, {@code ADD} or {@code DELID}/{@code DELQ}
	 * @param id
	 *            id of the document or the delete query
	 * @param message
	 *            the server's message
	 */
	public record UpdateError(String type, String id, String message) {
	}

	private static final String ERRORS_KEY = "errors";

	public UpdateResponse {
		errors = List.copyOf(errors);
	}

	static UpdateResponse empty() {
		return new UpdateResponse(0, 0, List.of());
	}

	static UpdateResponse from(SolrResponse response) {
		List<UpdateError> errors = new ArrayList<>();
		JsonNode reported = response.header().path(ERRORS_KEY);
		if (reported.isArray()) {
			for (JsonNode error : reported) {
				errors.add(new UpdateError(error.path("type").asText(null), error.path("id").asText(null),
						error.path("message").asText(null)));
			}
		}
		return new UpdateResponse(response.status(), response.qTime(), errors);
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
