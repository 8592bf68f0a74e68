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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.apache.solr.client.solrj.SolrRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SolrTest {

	@Mock
	private SolrTransport transport;

	private Solr solr;

	@BeforeEach
	void setUp() {
		solr = new Solr("http", "localhost", 8983, transport, new ObjectMapper());
	}

	private SolrHttpRequest sentRequest() {
		ArgumentCaptor<SolrHttpRequest> request = ArgumentCaptor.forClass(SolrHttpRequest.class);
		verify(transport).send(request.capture());
		return request.getValue();
	}

	@Test
	void testBaseUrl() {
		assertEquals("http://localhost:8983/solr", solr.baseUrl());
		assertEquals("http", solr.getScheme());
		assertEquals("localhost", solr.getHost());
		assertEquals(8983, solr.getPort());
	}

	@Test
	void testClientFactoryUsesDefaults() throws IOException {
		try (Solr client = Solr.client("https", "solr.example.com", 443)) {
			assertEquals("https://solr.example.com:443/solr", client.baseUrl());
			assertEquals("/solr", client.getBasePath());
			assertNotNull(client.executor().getObjectMapper());
		}
	}

	@ParameterizedTest
	@CsvSource({"/custom/solr, http://localhost:8983/custom/solr",
			"/custom/solr/, http://localhost:8983/custom/solr", "custom/solr, http://localhost:8983/custom/solr",
			"/, http://localhost:8983", "'', http://localhost:8983"})
	void testBasePath(String basePath, String expectedBaseUrl) {
		Solr custom = new Solr("http", "localhost", 8983, basePath, transport, new ObjectMapper());

		assertEquals(expectedBaseUrl, custom.baseUrl());
	}

	@Test
	void testRequestsUseBasePath() {
		when(transport.send(any())).thenReturn(
				CompletableFuture.completedFuture(TransportResponse.of(200, "{\"responseHeader\": {\"status\": 0}}")));
		Solr custom = new Solr("http", "localhost", 8983, "/custom/solr", transport, new ObjectMapper());

		custom.systemInfo().join();

		assertEquals(URI.create("http://localhost:8983/custom/solr/admin/info/system?wt=json"),
				sentRequest().toUri(custom.baseUrl()));
	}

	@Test
	void testInvalidConnectionSettings() {
		ObjectMapper objectMapper = new ObjectMapper();
		assertThrows(IllegalArgumentException.class, () -> new Solr("", "localhost", 8983, transport, objectMapper));
		assertThrows(IllegalArgumentException.class, () -> new Solr("http", " ", 8983, transport, objectMapper));
		assertThrows(IllegalArgumentException.class, () -> new Solr("http", "localhost", 0, transport, objectMapper));
		assertThrows(IllegalArgumentException.class,
				() -> new Solr("http", "localhost", 70000, transport, objectMapper));
	}

	@Test
	void testBuildersAreFreshAndPure() {
		// Test
		var first = solr.collections().create("users");
		var second = solr.collections().create("users");
		SolrCollection users = solr.collection("users");

		// Verify
		assertNotSame(first, second);
		assertNotSame(users.schema(), users.schema());
		assertNotSame(users.documents(), users.documents());
		assertNotSame(users.search(), users.search());
		verifyNoInteractions(transport);
	}

	@Test
	void testCollectionHandleRequiresName() {
		assertThrows(SolrUsageException.class, () -> solr.collection(""));
		assertThrows(SolrUsageException.class, () -> solr.collection(null));
	}

	@ParameterizedTest
	@ValueSource(strings = {"my users", "users/select", "users?x=1", "-users", "users#1"})
	void testCollectionHandleRejectsInvalidName(String name) {
		assertThrows(SolrUsageException.class, () -> solr.collection(name));
		verifyNoInteractions(transport);
	}

	@ParameterizedTest
	@ValueSource(strings = {"users", "users_2024", "users.v2", "Users-Archive"})
	void testCollectionHandleAcceptsValidName(String name) {
		assertEquals(name, solr.collection(name).name());
	}

	@Test
	void testCollectionHandleEquality() {
		assertEquals(solr.collection("users"), solr.collection("users"));
		assertEquals(solr.collection("users").hashCode(), solr.collection("users").hashCode());
		assertNotEquals(solr.collection("users"), solr.collection("books"));
		assertEquals("users", solr.collection("users").name());
		assertSame(solr, solr.collection("users").solr());
	}

	@Test
	void testSystemInfo() {
		// Setup mock response
		when(transport.send(any())).thenReturn(CompletableFuture.completedFuture(
				TransportResponse.of(200, """
						{"responseHeader": {"status": 0, "QTime": 3},
						 "mode": "solrcloud",
						 "lucene": {"solr-spec-version": "9.9.0"}}
						""")));

		// Test
		JsonNode info = solr.systemInfo().join();

		// Verify
		assertEquals("solrcloud", info.get("mode").asText());
		assertEquals("9.9.0", info.path("lucene").path("solr-spec-version").asText());
		SolrHttpRequest request = sentRequest();
		assertEquals(SolrRequest.METHOD.GET, request.method());
		assertEquals(URI.create("http://localhost:8983/solr/admin/info/system?wt=json"), request.toUri(solr.baseUrl()));
	}

	@Test
	void testGetSchema() {
		when(transport.send(any())).thenReturn(CompletableFuture.completedFuture(
				TransportResponse.of(200, """
						{"responseHeader": {"status": 0},
						 "schema": {"name": "default-config", "fields": [{"name": "id", "type": "string"}]}}
						""")));

		JsonNode schema = solr.collection("users").getSchema().join();

		assertEquals("default-config", schema.get("name").asText());
		assertEquals("id", schema.get("fields").get(0).get("name").asText());
		SolrHttpRequest request = sentRequest();
		assertEquals(SolrRequest.METHOD.GET, request.method());
		assertEquals(URI.create("http://localhost:8983/solr/users/schema"), request.toUri(solr.baseUrl()));
	}

	@Test
	void testGetSchemaWithoutSchemaSection() {
		when(transport.send(any())).thenReturn(
				CompletableFuture.completedFuture(TransportResponse.of(200, "{\"responseHeader\": {\"status\": 0}}")));

		CompletionException exception = assertThrows(CompletionException.class,
				() -> solr.collection("users").getSchema().join());

		assertInstanceOf(SolrDecodeException.class, exception.getCause());
	}
}
