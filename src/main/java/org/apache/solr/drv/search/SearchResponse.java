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

import java.util.List;
import java.util.Map;

/**
 * Immutable container for a page of search results.
 *
 * <p>
 * Documents keep the field order Solr returned them in. Field values are the
 * plain Jackson conversions of the JSON values: strings, numbers, booleans,
 * lists for multi-valued fields.
 *
 * <p>
 * <strong>Facets:</strong> each requested facet field maps to its values and
 * their counts, in the order Solr sorted them.
 *
 * <pre>{@code
 * {
 *   "genre_s": {"fantasy": 12, "scifi": 4},
 *   "cat": {"book": 16}
 * }
 * }</pre>
 *
 * @param numFound
 *            total number of documents matching the query
 * @param start
 *            offset of the first returned document
 * @param maxScore
 *            highest relevance score, {@code null} unless scores were requested
 * @param documents
 *            the returned documents
 * @param facets
 *            facet counts per field, empty when faceting was not requested
 */
public record SearchResponse(long numFound, long start, Float maxScore, List<Map<String, Object>> documents,
		Map<String, Map<String, Long>> facets) {
}
