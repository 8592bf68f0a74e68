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
package org.apache.solr.drv.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized connection settings for the Solr client, bound from the
 * {@code solr.*} properties.
 *
 * <pre>{@code
 * # application.properties
 * solr.url=http://localhost:8983/solr/
 * solr.http-version=1.1
 * }</pre>
 *
 * <p>
 * Environment variables work through Spring Boot's relaxed binding, e.g.
 * {@code SOLR_URL=http://solr:8983}.
 *
 * @param url
 *            Solr server URL; a missing {@code /solr/} path is added
 * @param httpVersion
 *            {@code 1.1} forces HTTP/1.1, anything else negotiates HTTP/2
 * @see SolrConfig
 */
@ConfigurationProperties(prefix = "solr")
public record SolrConfigurationProperties(String url, String httpVersion) {
}
