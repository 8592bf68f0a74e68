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
import com.fasterxml.jackson.databind.node.MissingNode;
import org.apache.solr.common.SolrException;

/**
 * Solr reported a failure in its response envelope: a non-zero
 * {@code responseHeader.status}, an {@code error} section, or both.
 *
 * <p>
 * {@link #getMessage()} is the server's {@code error.msg} verbatim and
 * {@link #getCode()} its {@code error.code}. The complete {@code error} node,
 * including {@code metadata} and {@code details} when Solr sends them, is kept
 * in {@link #getError()}.
 */
public class SolrErrorResponseException extends SolrClientException {

	private static final long serialVersionUID = 1L;

	private final int code;

	private final transient JsonNode error;

	public SolrErrorResponseException(int code, String message, JsonNode error) {
		super(message);
		this.code = code;
		this.error = error != null ? error : MissingNode.getInstance();
	}

	protected SolrErrorResponseException(SolrErrorResponseException source) {
		this(source.code, source.getMessage(), source.error);
	}

	public int getCode() {
		return code;
	}

	/**
	 * The code mapped onto SolrJ's error codes; {@code UNKNOWN} when Solr used a
	 * code SolrJ does not define.
	 */
	public SolrException.ErrorCode getErrorCode() {
		return SolrException.ErrorCode.getErrorCode(code);
	}

	public JsonNode getError() {
		return error;
	}
}
