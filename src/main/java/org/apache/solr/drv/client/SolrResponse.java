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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A successful response envelope, split into its header and payload.
 *
 * @param httpStatus
 *            HTTP status of the response
 * @param header
 *            the {@code responseHeader} object, a missing node when Solr
 *            omitted it
 * @param body
 *            the envelope without {@code responseHeader}
 */
public record SolrResponse(int httpStatus, JsonNode header, ObjectNode body) {

	public int status() {
		return header.path("status").asInt(0);
	}

	public int qTime() {
		return header.path("QTime").asInt(0);
	}
}
