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
package org.apache.solr.drv.search;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.solr.common.params.CommonParams;
import org.apache.solr.common.params.FacetParams;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.apache.solr.drv.client.CommitExecutor;
import org.apache.solr.drv.client.SingleUseBuilder;
import org.apache.solr.drv.client.SolrCollection;
import org.apache.solr.drv.client.SolrDecodeException;
import org.apache.solr.drv.client.SolrHttpRequest;
import org.apache.solr.drv.client.SolrResponse;
import org.apache.solr.drv.client.SolrUsageException;
import org.springframework.util.StringUtils;

/**
 * Query against a collection's {@code select} handler.
 *
 * <p>
 * Parameters are form-URL-encoded into the query string, {@code q} first and
 * {@code wt=json} last:
 *
 * <pre>{@code
 * users.search().query("age:21").fl("name,age").sort("name asc").commit();
 * // GET /solr/users/select?q=age%3A21&fl=name%2Cage&sort=name+asc&wt=json
 * }</pre>
 *
 * <p>
 * A query string longer than {@value #MAX_GET_QUERY_LENGTH} characters is sent
 * as a form POST instead, so large filter lists do not hit URL length limits.
 */
public class SearchBuilder extends SingleUseBuilder {

	static final int MAX_GET_QUERY_LENGTH = 4096;

	static final String MATCH_ALL_QUERY = "*:*";

	private static final String SELECT_PATH = "/select";

	private static final String JSON_FORMAT = "json";

	private static final String CACHE_PARAM = "cache";

	// ========================================
	// Constants for Response Parsing
	// ========================================

	private static final String RESPONSE_KEY = "response";

	private static final String NUM_FOUND_KEY = "numFound";

	private static final String START_KEY = "start";

	private static final String MAX_SCORE_KEY = "maxScore";

	private static final String DOCS_KEY = "docs";

	private static final String FACET_COUNTS_KEY = "facet_counts";

	private static final String FACET_FIELDS_KEY = "facet_fields";

	private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
	};

	private final SolrCollection collection;

	private final ModifiableSolrParams params = new ModifiableSolrParams();

	private String query;

	public SearchBuilder(SolrCollection collection) {
		super("Search builder for '" + collection.name() + "'");
		this.collection = collection;
	}

	/** Sets {@code q}; defaults to {@code *:*}. */
	public SearchBuilder query(String query) {
		ensureOpen();
		this.query = query;
		return this;
	}

	/** Sets {@code fl}, a comma separated list of fields to return. */
	public SearchBuilder fl(String fields) {
		return set(CommonParams.FL, fields);
	}

	/** Sets {@code sort}, e.g. {@code name asc, age desc}. */
	public SearchBuilder sort(String sort) {
		return set(CommonParams.SORT, sort);
	}

	public SearchBuilder rows(int rows) {
		return set(CommonParams.ROWS, Integer.toString(rows));
	}

	public SearchBuilder start(int start) {
		return set(CommonParams.START, Integer.toString(start));
	}

	/** Adds a filter query; may be called repeatedly. */
	public SearchBuilder filterQuery(String filterQuery) {
		ensureOpen();
		params.add(CommonParams.FQ, filterQuery);
		return this;
	}

	public SearchBuilder defType(String defType) {
		return set("defType", defType);
	}

	/**
	 * Enables field faceting on the given fields, counting only values that
	 * occur at least once.
	 */
	public SearchBuilder facetField(String... fields) {
		ensureOpen();
		params.set(FacetParams.FACET, true);
		params.add(FacetParams.FACET_FIELD, fields);
		params.set(FacetParams.FACET_MINCOUNT, 1);
		return this;
	}

	/** Sets {@code debug}: {@code query}, {@code timing}, {@code results} or {@code all}. */
	public SearchBuilder debug(String debug) {
		return set(CommonParams.DEBUG, debug);
	}

	public SearchBuilder explainOther(String query) {
		return set(CommonParams.EXPLAIN_OTHER, query);
	}

	public SearchBuilder timeAllowed(long milliseconds) {
		return set(CommonParams.TIME_ALLOWED, Long.toString(milliseconds));
	}

	public SearchBuilder segmentTerminateEarly(boolean terminateEarly) {
		return set(CommonParams.SEGMENT_TERMINATE_EARLY, Boolean.toString(terminateEarly));
	}

	public SearchBuilder omitHeader(boolean omitHeader) {
		return set(CommonParams.OMIT_HEADER, Boolean.toString(omitHeader));
	}

	public SearchBuilder cache(boolean cache) {
		return set(CACHE_PARAM, Boolean.toString(cache));
	}

	public SearchBuilder logParamsList(String params) {
		return set(CommonParams.LOG_PARAMS_LIST, params);
	}

	/** Sets {@code echoParams}: {@code none}, {@code explicit} or {@code all}. */
	public SearchBuilder echoParams(String echoParams) {
		return set(CommonParams.HEADER_ECHO_PARAMS, echoParams);
	}

	/**
	 * Sets an arbitrary request parameter, replacing any previous value.
	 */
	public SearchBuilder param(String key, String value) {
		if (!StringUtils.hasText(key)) {
			throw new SolrUsageException("Parameter name must not be blank");
		}
		if (CommonParams.Q.equals(key)) {
			return query(value);
		}
		return set(key, value);
	}

	private SearchBuilder set(String key, String value) {
		ensureOpen();
		params.set(key, value);
		return this;
	}

	ModifiableSolrParams toParams() {
		ModifiableSolrParams request = new ModifiableSolrParams();
		request.set(CommonParams.Q, StringUtils.hasText(query) ? query : MATCH_ALL_QUERY);
		request.add(params);
		request.set(CommonParams.WT, JSON_FORMAT);
		return request;
	}

	/**
	 * Runs the query.
	 *
	 * @return a future completed with the matching page of documents
	 * @throws SolrUsageException
	 *             if the builder was already committed
	 */
	public CompletableFuture<SearchResponse> commit() {
		consume();
		ModifiableSolrParams request = toParams();
		String path = collection.name() + SELECT_PATH;
		SolrHttpRequest httpRequest = SolrHttpRequest.toQueryString(request).length() > MAX_GET_QUERY_LENGTH
				? SolrHttpRequest.postForm(path, request)
				: SolrHttpRequest.get(path, request);

		CommitExecutor executor = collection.solr().executor();
		return executor.execute(httpRequest).thenApply(response -> toSearchResponse(response, executor.getObjectMapper()));
	}

	static SearchResponse toSearchResponse(SolrResponse response, ObjectMapper objectMapper) {
		JsonNode result = response.body().get(RESPONSE_KEY);
		if (result == null || !result.isObject()) {
			throw new SolrDecodeException(response.httpStatus(), "Search response has no response section");
		}

		List<Map<String, Object>> documents = new ArrayList<>();
		for (JsonNode document : result.path(DOCS_KEY)) {
			documents.add(objectMapper.convertValue(document, DOCUMENT_TYPE));
		}

		JsonNode maxScore = result.get(MAX_SCORE_KEY);
		return new SearchResponse(result.path(NUM_FOUND_KEY).asLong(), result.path(START_KEY).asLong(),
				maxScore != null && maxScore.isNumber() ? maxScore.floatValue() : null, documents,
				getFacets(response.body()));
	}

	/**
	 * Reads {@code facet_counts.facet_fields}, accepting both the default flat
	 * {@code [value, count, ...]} list and the {@code json.nl=map} object form.
	 */
	private static Map<String, Map<String, Long>> getFacets(JsonNode body) {
		Map<String, Map<String, Long>> facets = new LinkedHashMap<>();
		JsonNode facetFields = body.path(FACET_COUNTS_KEY).path(FACET_FIELDS_KEY);
		for (Iterator<Map.Entry<String, JsonNode>> fields = facetFields.fields(); fields.hasNext();) {
			Map.Entry<String, JsonNode> field = fields.next();
			Map<String, Long> facetValues = new LinkedHashMap<>();
			JsonNode counts = field.getValue();
			if (counts.isArray()) {
				for (int i = 0; i + 1 < counts.size(); i += 2) {
					facetValues.put(counts.get(i).asText(), counts.get(i + 1).asLong());
				}
			} else {
				counts.fields().forEachRemaining(count -> facetValues.put(count.getKey(), count.getValue().asLong()));
			}
			facets.put(field.getKey(), facetValues);
		}
		return facets;
	}
}
