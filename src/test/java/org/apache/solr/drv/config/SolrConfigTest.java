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

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import org.apache.solr.client.solrj.impl.Http2SolrClient;
import org.apache.solr.client.solrj.impl.HttpJdkSolrClient;
import org.apache.solr.drv.client.Solr;
import org.apache.solr.drv.client.SolrClientTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class SolrConfigTest {

	private final SolrConfig solrConfig = new SolrConfig();

	private Solr solrFor(String url) {
		SolrConfigurationProperties properties = new SolrConfigurationProperties(url, null);
		return solrConfig.solr(properties, request -> new CompletableFuture<>(),
				new StaticListableBeanFactory().getBeanProvider(ObjectMapper.class));
	}

	@ParameterizedTest
	@CsvSource({"http://localhost:8983, http://localhost:8983/solr/",
			"http://localhost:8983/, http://localhost:8983/solr/",
			"http://localhost:8983/solr, http://localhost:8983/solr/",
			"http://localhost:8983/solr/, http://localhost:8983/solr/",
			"http://localhost:8983/custom/solr/, http://localhost:8983/custom/solr/",
			"localhost:8983, http://localhost:8983/solr/"})
	void testUrlNormalization(String inputUrl, String expectedUrl) {
		assertEquals(expectedUrl, SolrConfig.normalizeUrl(inputUrl));
	}

	@Test
	void testMissingUrlUsesDefault() {
		assertEquals(SolrConfig.DEFAULT_URL, SolrConfig.normalizeUrl(null));
		assertEquals("http://localhost:8983/solr", solrFor(null).baseUrl());
	}

	@ParameterizedTest
	@CsvSource({"http://localhost:8983, http://localhost:8983/solr", "http://solr, http://solr:8983/solr",
			"https://search.example.com/solr/, https://search.example.com:443/solr",
			"http://10.0.0.5:9000/solr, http://10.0.0.5:9000/solr",
			"http://localhost:8983/custom/solr/, http://localhost:8983/custom/solr",
			"localhost:8983, http://localhost:8983/solr", "solr.internal, http://solr.internal:8983/solr"})
	void testSolrBean(String inputUrl, String expectedBaseUrl) {
		assertEquals(expectedBaseUrl, solrFor(inputUrl).baseUrl());
	}

	@Test
	void testDefaultObjectMapperWhenNoneDefined() {
		assertNotNull(solrFor("http://localhost:8983").executor().getObjectMapper());
	}

	@Test
	void testUrlWithoutHostIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> SolrConfig.toBaseUri("http:///solr"));
	}

	@Test
	void testHttpVersionSelection() throws IOException {
		try (SolrClientTransport http11 = (SolrClientTransport) solrConfig
				.solrTransport(new SolrConfigurationProperties(null, "1.1"));
				SolrClientTransport http2 = (SolrClientTransport) solrConfig
						.solrTransport(new SolrConfigurationProperties(null, null))) {
			assertInstanceOf(HttpJdkSolrClient.class, http11.getSolrClient());
			assertInstanceOf(Http2SolrClient.class, http2.getSolrClient());
		}
	}

	@Test
	void testTransportSharesBaseUrlWithSolrBean() throws IOException {
		SolrConfigurationProperties properties = new SolrConfigurationProperties("localhost:8983/custom/solr", "1.1");
		try (SolrClientTransport transport = (SolrClientTransport) solrConfig.solrTransport(properties)) {
			Solr solr = solrConfig.solr(properties, transport,
					new StaticListableBeanFactory().getBeanProvider(ObjectMapper.class));

			assertEquals("http://localhost:8983/custom/solr", transport.getSolrClient().getBaseURL());
			assertEquals(transport.getSolrClient().getBaseURL(), solr.baseUrl());
			assertEquals(URI.create(solr.baseUrl()), SolrConfig.toBaseUri(properties.url()));
		}
	}
}
