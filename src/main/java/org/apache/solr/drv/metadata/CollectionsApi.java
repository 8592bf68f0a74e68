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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.apache.solr.common.params.CollectionParams;
import org.apache.solr.common.params.CommonParams;
import org.apache.solr.common.params.CoreAdminParams;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.apache.solr.drv.client.SolrCollection;
import org.apache.solr.drv.client.SolrDecodeException;
import org.apache.solr.drv.client.SolrHttpRequest;
import org.apache.solr.drv.client.SolrResponse;
import org.apache.solr.drv.client.Solr;

/**
 * Collections API of a SolrCloud cluster: create, list, look up and delete
 * collections.
 *
 * <p>
 * Creation goes through a {@link CollectionBuilder}; the remaining operations
 * are single requests. All of them talk to {@code /solr/admin/collections}.
 *
 * @see <a href=
 *      "https://solr.apache.org/guide/solr/latest/deployment-guide/collection-management.html">Collection
 *      Management</a>
 */
public class CollectionsApi {

	static final String COLLECTIONS_PATH = "admin/collections";

	static final String JSON_FORMAT = "json";

	private static final String COLLECTIONS_KEY = "collections";

	private final Solr solr;

	public CollectionsApi(Solr solr) {
		this.solr = solr;
	}

	/**
	 * Starts the definition of a new collection.
	 *
	 * @param name
	 *            the name of the collection
	 */
	public CollectionBuilder create(String name) {
		return new CollectionBuilder(solr, name);
	}

	/**
	 * Lists every collection of the cluster.
	 */
	public CompletableFuture<List<SolrCollection>> list() {
		ModifiableSolrParams params = new ModifiableSolrParams();
		params.set(CoreAdminParams.ACTION, CollectionParams.CollectionAction.LIST.toString());
		params.set(CommonParams.WT, JSON_FORMAT);

		return solr.executor().execute(SolrHttpRequest.get(COLLECTIONS_PATH, params)).thenApply(this::toCollections);
	}

	/**
	 * Looks up an existing collection by name.
	 *
	 * @return the collection, or empty when the cluster has no collection with
	 *         that name
	 */
	public CompletableFuture<Optional<SolrCollection>> get(String name) {
		return list().thenApply(
				collections -> collections.stream().filter(collection -> collection.name().equals(name)).findFirst());
	}

	/**
	 * Deletes a collection and its data.
	 *
	 * @param name
	 *            the name of the collection to delete
	 */
	public CompletableFuture<Void> delete(String name) {
		ModifiableSolrParams params = new ModifiableSolrParams();
		params.set(CoreAdminParams.ACTION, CollectionParams.CollectionAction.DELETE.toString());
		params.set(CoreAdminParams.NAME, name);
		params.set(CommonParams.WT, JSON_FORMAT);

		return solr.executor().execute(SolrHttpRequest.get(COLLECTIONS_PATH, params)).thenApply(response -> null);
	}

	private List<SolrCollection> toCollections(SolrResponse response) {
		JsonNode names = response.body().get(COLLECTIONS_KEY);
		if (names == null || !names.isArray()) {
			throw new SolrDecodeException(response.httpStatus(), "LIST response has no collections array");
		}
		List<SolrCollection> collections = new ArrayList<>(names.size());
		for (JsonNode name : names) {
			collections.add(solr.collection(name.asText()));
		}
		return collections;
	}
}
