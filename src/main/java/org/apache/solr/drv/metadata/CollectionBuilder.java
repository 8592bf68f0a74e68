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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.solr.common.params.CollectionParams;
import org.apache.solr.common.params.CommonParams;
import org.apache.solr.common.params.CoreAdminParams;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.apache.solr.common.params.SolrParams;
import org.apache.solr.drv.client.SingleUseBuilder;
import org.apache.solr.drv.client.Solr;
import org.apache.solr.drv.client.SolrCollection;
import org.apache.solr.drv.client.SolrErrorResponseException;
import org.apache.solr.drv.client.SolrHttpRequest;
import org.apache.solr.drv.client.SolrResponse;
import org.apache.solr.drv.client.SolrUsageException;

/**
 * Accumulates the parameters of a Collections API {@code CREATE} call.
 *
 * <p>
 * Setters only record values; nothing is validated locally, Solr rejects
 * invalid combinations on commit. Unset parameters are left out of the
 * request so Solr applies its own defaults.
 *
 * <pre>{@code
 * SolrCollection users = solr.collections().create("users").routerField("id").numShards(16)
 * 		.maxShardsPerNode(16).commit().join();
 * }</pre>
 *
 * @see <a href=
 *      "https://solr.apache.org/guide/solr/latest/deployment-guide/collection-management.html#create">CREATE</a>
 */
public class CollectionBuilder extends SingleUseBuilder {

	// ========================================
	// Constants for API Parameters
	// ========================================

	static final String ROUTER_FIELD_PARAM = "router.field";

	static final String ROUTER_NAME_PARAM = "router.name";

	static final String NUM_SHARDS_PARAM = "numShards";

	static final String MAX_SHARDS_PER_NODE_PARAM = "maxShardsPerNode";

	static final String REPLICATION_FACTOR_PARAM = "replicationFactor";

	static final String NRT_REPLICAS_PARAM = "nrtReplicas";

	static final String TLOG_REPLICAS_PARAM = "tlogReplicas";

	static final String PULL_REPLICAS_PARAM = "pullReplicas";

	static final String CONFIG_NAME_PARAM = "collection.configName";

	static final String SHARDS_PARAM = "shards";

	static final String CREATE_NODE_SET_PARAM = "createNodeSet";

	static final String PROPERTY_PREFIX = "property.";

	private static final String FAILURE_KEY = "failure";

	private static final int FAILURE_CODE = 500;

	private final Solr solr;

	private final String name;

	private String routerField;

	private Integer numShards;

	private Integer maxShardsPerNode;

	private final Map<String, String> optionalParams = new LinkedHashMap<>();

	CollectionBuilder(Solr solr, String name) {
		super("Collection builder for '" + name + "'");
		this.solr = solr;
		this.name = name;
	}

	/**
	 * Sets the field whose value is hashed to pick a document's shard.
	 */
	public CollectionBuilder routerField(String routerField) {
		ensureOpen();
		this.routerField = routerField;
		return this;
	}

	/**
	 * Sets the router implementation, {@code compositeId} or {@code implicit}.
	 */
	public CollectionBuilder routerName(String routerName) {
		return optional(ROUTER_NAME_PARAM, routerName);
	}

	/**
	 * Sets the number of shards to be created as part of the collection.
	 */
	public CollectionBuilder numShards(int numShards) {
		ensureOpen();
		this.numShards = numShards;
		return this;
	}

	/**
	 * Sets the maximum number of shards per node.
	 */
	public CollectionBuilder maxShardsPerNode(int maxShardsPerNode) {
		ensureOpen();
		this.maxShardsPerNode = maxShardsPerNode;
		return this;
	}

	public CollectionBuilder replicationFactor(int replicationFactor) {
		return optional(REPLICATION_FACTOR_PARAM, String.valueOf(replicationFactor));
	}

	public CollectionBuilder nrtReplicas(int nrtReplicas) {
		return optional(NRT_REPLICAS_PARAM, String.valueOf(nrtReplicas));
	}

	public CollectionBuilder tlogReplicas(int tlogReplicas) {
		return optional(TLOG_REPLICAS_PARAM, String.valueOf(tlogReplicas));
	}

	public CollectionBuilder pullReplicas(int pullReplicas) {
		return optional(PULL_REPLICAS_PARAM, String.valueOf(pullReplicas));
	}

	/**
	 * Sets the configset the collection is created from.
	 */
	public CollectionBuilder configName(String configName) {
		return optional(CONFIG_NAME_PARAM, configName);
	}

	/**
	 * Sets the comma-separated shard names; used with the {@code implicit}
	 * router.
	 */
	public CollectionBuilder shards(String shards) {
		return optional(SHARDS_PARAM, shards);
	}

	/**
	 * Restricts replica placement to the given comma-separated nodes.
	 */
	public CollectionBuilder createNodeSet(String createNodeSet) {
		return optional(CREATE_NODE_SET_PARAM, createNodeSet);
	}

	/**
	 * Sets a core property, sent as {@code property.<key>=<value>}.
	 */
	public CollectionBuilder property(String key, String value) {
		return optional(PROPERTY_PREFIX + key, value);
	}

	private CollectionBuilder optional(String param, String value) {
		ensureOpen();
		optionalParams.put(param, value);
		return this;
	}

	SolrParams toParams() {
		ModifiableSolrParams params = new ModifiableSolrParams();
		params.set(CoreAdminParams.ACTION, CollectionParams.CollectionAction.CREATE.toString());
		params.set(CoreAdminParams.NAME, name);
		if (routerField != null) {
			params.set(ROUTER_FIELD_PARAM, routerField);
		}
		if (numShards != null) {
			params.set(NUM_SHARDS_PARAM, numShards);
		}
		if (maxShardsPerNode != null) {
			params.set(MAX_SHARDS_PER_NODE_PARAM, maxShardsPerNode);
		}
		optionalParams.forEach(params::set);
		params.set(CommonParams.WT, CollectionsApi.JSON_FORMAT);
		return params;
	}

	/**
	 * Creates the collection.
	 *
	 * @return a future completed with the handle of the new collection, or
	 *         failed when Solr rejected or only partially performed the creation
	 * @throws SolrUsageException
	 *             if the builder was already committed or the name is not a valid
	 *             collection name
	 */
	public CompletableFuture<SolrCollection> commit() {
		consume();
		SolrCollection.validateName(name);
		return solr.executor().execute(SolrHttpRequest.post(CollectionsApi.COLLECTIONS_PATH, toParams()))
				.thenApply(this::toCollection);
	}

	private SolrCollection toCollection(SolrResponse response) {
		JsonNode failure = response.body().get(FAILURE_KEY);
		if (failure != null) {
			List<String> messages = new ArrayList<>();
			failure.forEach(node -> messages.add(node.asText()));
			throw new SolrErrorResponseException(FAILURE_CODE,
					"Collection '" + name + "' was not created: " + String.join("; ", messages), failure);
		}
		return solr.collection(name);
	}
}
