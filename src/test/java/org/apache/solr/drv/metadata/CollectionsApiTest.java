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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.drv.client.Solr;
import org.apache.solr.drv.client.SolrCollection;
import org.apache.solr.drv.client.SolrDecodeException;
import org.apache.solr.drv.client.SolrHttpRequest;
import org.apache.solr.drv.client.SolrTransport;
import org.apache.solr.drv.client.TransportResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CollectionsApiTest {

	private static final String LIST_RESPONSE = """
			{"responseHeader": {"status": 0, "QTime": 1}, "collections": ["users", "books"]}
			""";

	@Mock
	private SolrTransport transport;

	private Solr solr;

	@BeforeEach
	void setUp() {
		solr = new Solr("http", "localhost", 8983, transport, new ObjectMapper());
	}

	private void respond(String body) {
		when(transport.send(any()))
				.thenReturn(CompletableFuture.completedFuture(TransportResponse.of(200, body)));
	}

	private void assertSent(SolrRequest.METHOD method, String uri) {
		ArgumentCaptor<SolrHttpRequest> request = ArgumentCaptor.forClass(SolrHttpRequest.class);
		verify(transport).send(request.capture());
		assertEquals(method, request.getValue().method());
		assertEquals(URI.create(uri), request.getValue().toUri(solr.baseUrl()));
	}

	@Test
	void testList() {
		// Setup mock response
		respond(LIST_RESPONSE);

		// Test
		List<SolrCollection> collections = solr.collections().list().join();

		// Verify
		assertEquals(List.of(solr.collection("users"), solr.collection("books")), collections);
		assertSent(SolrRequest.METHOD.GET, "http://localhost:8983/solr/admin/collections?action=LIST&wt=json");
	}

	@Test
	void testListWithoutCollectionsArray() {
		respond("{\"responseHeader\": {\"status\": 0}}");

		CompletionException exception = assertThrows(CompletionException.class,
				() -> solr.collections().list().join());

		assertInstanceOf(SolrDecodeException.class, exception.getCause());
	}

	@Test
	void testGetExisting() {
		respond(LIST_RESPONSE);

		Optional<SolrCollection> books = solr.collections().get("books").join();

		assertTrue(books.isPresent());
		assertEquals("books", books.get().name());
	}

	@Test
	void testGetMissing() {
		respond(LIST_RESPONSE);

		assertTrue(solr.collections().get("orders").join().isEmpty());
	}

	@Test
	void testDelete() {
		respond("{\"responseHeader\": {\"status\": 0, \"QTime\": 90}, \"success\": {}}");

		assertNull(solr.collections().delete("users").join());

		assertSent(SolrRequest.METHOD.GET,
				"http://localhost:8983/solr/admin/collections?action=DELETE&name=users&wt=json");
	}
}
