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

import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.apache.solr.common.params.SolrParams;

/**
 * A fully assembled request, ready for {@link CommitExecutor#execute}.
 *
 * @param method
 *            HTTP method
 * @param path
 *            path below the {@code /solr/} root, without leading slash (e.g.
 *            {@code admin/collections}, {@code users/select})
 * @param params
 *            query-string parameters, form-URL-encoded on the wire
 * @param body
 *            request body or {@code null}
 * @param contentType
 *            content type of {@code body}, or {@code null} when there is no
 *            body
 */
public record SolrHttpRequest(SolrRequest.METHOD method, String path, SolrParams params, byte[] body,
		String contentType) {

	public static final String JSON_CONTENT_TYPE = "application/json";

	public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

	public SolrHttpRequest {
		params = params != null ? params : new ModifiableSolrParams();
	}

	public static SolrHttpRequest get(String path, SolrParams params) {
		return new SolrHttpRequest(SolrRequest.METHOD.GET, path, params, null, null);
	}

	public static SolrHttpRequest post(String path, SolrParams params) {
		return new SolrHttpRequest(SolrRequest.METHOD.POST, path, params, null, null);
	}

	public static SolrHttpRequest postJson(String path, SolrParams params, byte[] json) {
		return new SolrHttpRequest(SolrRequest.METHOD.POST, path, params, json, JSON_CONTENT_TYPE);
	}

	/**
	 * POST with the parameters moved from the query string into a form body.
	 */
	public static SolrHttpRequest postForm(String path, SolrParams params) {
		return new SolrHttpRequest(SolrRequest.METHOD.POST, path, null,
				toQueryString(params).getBytes(StandardCharsets.UTF_8), FORM_CONTENT_TYPE);
	}

	/**
	 * The absolute request URI below {@code baseUrl}, parameters included.
	 *
	 * @throws IllegalArgumentException
	 *             if the path contains characters not allowed in a URI
	 */
	public URI toUri(String baseUrl) {
		return URI.create(baseUrl + "/" + path + params.toQueryString());
	}

	/**
	 * Form-URL-encoded parameters without the leading {@code ?}. Values are
	 * encoded with {@link java.net.URLEncoder}, so a space becomes {@code +} and
	 * {@code :} {@code ,} {@code &} {@code =} are percent-encoded.
	 */
	public static String toQueryString(SolrParams params) {
		String queryString = params.toQueryString();
		return queryString.startsWith("?") ? queryString.substring(1) : queryString;
	}
}
