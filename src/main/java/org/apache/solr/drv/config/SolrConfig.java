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

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URISyntaxException;
import org.apache.solr.drv.client.Solr;
import org.apache.solr.drv.client.SolrClientTransport;
import org.apache.solr.drv.client.SolrTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the Solr client.
 *
 * <p>
 * <strong>URL Processing:</strong>
 *
 * <ul>
 * <li>{@code http://localhost:8983} → {@code http://localhost:8983/solr/}
 * <li>{@code http://localhost:8983/} → {@code http://localhost:8983/solr/}
 * <li>{@code http://localhost:8983/solr} → {@code http://localhost:8983/solr/}
 * <li>{@code http://localhost:8983/solr/} → {@code http://localhost:8983/solr/}
 * (unchanged)
 * <li>{@code http://localhost:8983/custom/solr/} →
 * {@code http://localhost:8983/custom/solr/} (unchanged)
 * <li>{@code localhost:8983} → {@code http://localhost:8983/solr/}
 * </ul>
 *
 * <p>
 * The normalized URL is then split into scheme, host, port and context path. A
 * URL without a port uses {@value #DEFAULT_SOLR_PORT} for {@code http} and
 * {@value #DEFAULT_HTTPS_PORT} for {@code https}.
 *
 * <p>
 * <strong>Connection Parameters:</strong> connection timeout 10 s and idle
 * timeout 60 s, applied by the SolrJ client inside
 * {@link SolrClientTransport}.
 *
 * <p>
 * Both beans back off when the application defines its own.
 *
 * @see SolrConfigurationProperties
 */
@AutoConfiguration
@EnableConfigurationProperties(SolrConfigurationProperties.class)
public class SolrConfig {

	private static final Logger log = LoggerFactory.getLogger(SolrConfig.class);

	static final String DEFAULT_URL = "http://localhost:8983/solr/";

	static final int DEFAULT_SOLR_PORT = 8983;

	static final int DEFAULT_HTTPS_PORT = 443;

	private static final String SOLR_PATH = "solr/";

	private static final String DEFAULT_SCHEME = "http";

	/**
	 * SolrJ {@code HttpJdkSolrClient} when {@code solr.http-version=1.1},
	 * {@code Http2SolrClient} otherwise, rooted at the same base URL as the
	 * {@link Solr} bean.
	 */
	@Bean
	@ConditionalOnMissingBean
	SolrTransport solrTransport(SolrConfigurationProperties properties) {
		return SolrClientTransport.create(toBaseUri(properties.url()).toString(), properties.httpVersion());
	}

	@Bean
	@ConditionalOnMissingBean
	Solr solr(SolrConfigurationProperties properties, SolrTransport transport,
			ObjectProvider<ObjectMapper> objectMapper) {
		URI uri = toBaseUri(properties.url());
		log.info("Connecting to Solr at {}", uri);
		return new Solr(uri.getScheme(), uri.getHost(), uri.getPort(), uri.getPath(), transport,
				objectMapper.getIfAvailable(ObjectMapper::new));
	}

	/**
	 * Normalizes {@code url} and fills in the default scheme and port.
	 *
	 * @return the Solr root without trailing slash, e.g.
	 *         {@code http://localhost:8983/custom/solr}
	 * @throws IllegalArgumentException
	 *             if the URL cannot be parsed or names no host
	 */
	static URI toBaseUri(String url) {
		String normalized = normalizeUrl(url);
		URI uri = URI.create(normalized);
		if (uri.getHost() == null) {
			throw new IllegalArgumentException("Solr URL has no host: " + url);
		}
		String scheme = uri.getScheme() != null ? uri.getScheme() : DEFAULT_SCHEME;
		int port = uri.getPort() != -1 ? uri.getPort() : defaultPort(scheme);
		String path = uri.getPath().substring(0, uri.getPath().length() - 1);
		try {
			return new URI(scheme, null, uri.getHost(), port, path, null, null);
		} catch (URISyntaxException e) {
			throw new IllegalArgumentException("Invalid Solr URL: " + url, e);
		}
	}

	/**
	 * Ensures the URL has a scheme and ends with {@code /solr/}.
	 */
	static String normalizeUrl(String url) {
		if (url == null || url.isBlank()) {
			return DEFAULT_URL;
		}
		url = url.strip();

		if (!url.contains("://")) {
			url = DEFAULT_SCHEME + "://" + url;
		}

		// The URL should end with /solr/ for proper path construction
		if (!url.endsWith("/")) {
			url = url + "/";
		}

		// If URL doesn't contain /solr/ path, add it
		if (!url.contains("/" + SOLR_PATH)) {
			url = url + SOLR_PATH;
		}
		return url;
	}

	static int defaultPort(String scheme) {
		return "https".equalsIgnoreCase(scheme) ? DEFAULT_HTTPS_PORT : DEFAULT_SOLR_PORT;
	}
}
