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
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.drv.client.Solr;
import org.apache.solr.drv.client.SolrCollection;
import org.apache.solr.drv.client.SolrErrorResponseException;
import org.apache.solr.drv.client.SolrHttpRequest;
import org.apache.solr.drv.client.SolrTransport;
import org.apache.solr.drv.client.SolrUsageException;
import org.apache.solr.drv.client.TransportResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CollectionBuilderTest {

	private static final String CREATED = """
			{"responseHeader": {"status": 0, "QTime": 2100},
			 "success": {"localhost:8983_solr": {"responseHeader": {"status": 0, "QTime": 1500}, "core": "users_shard1_replica_n1"}}}
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

	private URI sentUri() {
		ArgumentCaptor<SolrHttpRequest> request = ArgumentCaptor.forClass(SolrHttpRequest.class);
		verify(transport).send(request.capture());
		assertEquals(SolrRequest.METHOD.POST, request.getValue().method());
		assertNull(request.getValue().body());
		return request.getValue().toUri(solr.baseUrl());
	}

	@Test
	void testCreateWithShards() {
		// Setup mock response
		respond(CREATED);

		// Test
		SolrCollection users = solr.collections().create("users").numShards(16).maxShardsPerNode(16).commit().join();

		// Verify
		assertEquals("users", users.name());
		URI uri = sentUri();
		assertEquals("/solr/admin/collections", uri.getPath());
		assertEquals("action=CREATE&name=users&numShards=16&maxShardsPerNode=16&wt=json", uri.getRawQuery());
		assertTrue(uri.getRawQuery().contains("name=users&numShards=16&maxShardsPerNode=16"));
	}

	@Test
	void testOnlySetParametersAreSent() {
		respond(CREATED);

		solr.collections().create("users").commit().join();

		String query = sentUri().getRawQuery();
		assertEquals("action=CREATE&name=users&wt=json", query);
		assertFalse(query.contains("numShards"));
		assertFalse(query.contains("router.field"));
	}

	@Test
	void testParameterOrder() {
		// Test
		CollectionBuilder builder = solr.collections().create("books").configName("_default").routerField("author")
				.maxShardsPerNode(2).replicationFactor(2).numShards(4).property("team", "search");

		// Verify
		assertEquals(
				"action=CREATE&name=books&router.field=author&numShards=4&maxShardsPerNode=2"
						+ "&collection.configName=_default&replicationFactor=2&property.team=search&wt=json",
				SolrHttpRequest.toQueryString(builder.toParams()));
	}

	@Test
	void testReplicaAndPlacementParameters() {
		CollectionBuilder builder = solr.collections().create("logs").routerName("implicit").shards("a,b")
				.nrtReplicas(1).tlogReplicas(1).pullReplicas(2).createNodeSet("node1:8983_solr");

		assertEquals(
				"action=CREATE&name=logs&router.name=implicit&shards=a%2Cb&nrtReplicas=1&tlogReplicas=1"
						+ "&pullReplicas=2&createNodeSet=node1%3A8983_solr&wt=json",
				SolrHttpRequest.toQueryString(builder.toParams()));
	}

	@Test
	void testCommitTwiceFailsWithoutSecondRequest() {
		// Setup mock response
		respond(CREATED);
		CollectionBuilder builder = solr.collections().create("users").numShards(1);

		// Test
		builder.commit().join();

		// Verify
		assertThrows(SolrUsageException.class, builder::commit);
		assertThrows(SolrUsageException.class, () -> builder.numShards(2));
		verify(transport, times(1)).send(any());
	}

	@Test
	void testBlankNameFailsBeforeRequest() {
		CollectionBuilder builder = solr.collections().create(" ");

		assertThrows(SolrUsageException.class, builder::commit);
		verifyNoInteractions(transport);
	}

	@Test
	void testInvalidNameFailsBeforeRequest() {
		CollectionBuilder builder = solr.collections().create("my users");

		assertThrows(SolrUsageException.class, builder::commit);
		verifyNoInteractions(transport);
	}

	@Test
	void testServerErrorIsReported() {
		// Setup mock response
		respond("""
				{"responseHeader": {"status": 400, "QTime": 4},
				 "error": {"msg": "collection already exists: users", "code": 400}}
				""");

		// Test
		CompletionException exception = assertThrows(CompletionException.class,
				() -> solr.collections().create("users").commit().join());

		// Verify
		SolrErrorResponseException error = assertInstanceOf(SolrErrorResponseException.class, exception.getCause());
		assertEquals(400, error.getCode());
		assertEquals("collection already exists: users", error.getMessage());
	}

	@Test
	void testFailureSectionIsReported() {
		respond("""
				{"responseHeader": {"status": 0, "QTime": 40},
				 "failure": {"localhost:8983_solr": "org.apache.solr.common.SolrException: Error CREATEing SolrCore"}}
				""");

		CompletionException exception = assertThrows(CompletionException.class,
				() -> solr.collections().create("users").commit().join());

		SolrErrorResponseException error = assertInstanceOf(SolrErrorResponseException.class, exception.getCause());
		assertEquals(500, error.getCode());
		assertTrue(error.getMessage().contains("Error CREATEing SolrCore"));
		assertTrue(error.getError().has("localhost:8983_solr"));
	}
}
