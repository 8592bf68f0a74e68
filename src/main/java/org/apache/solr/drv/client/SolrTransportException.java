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

import java.net.URI;

/**
 * The request never produced a response from Solr: connection refused,
 * timeout or another I/O failure in the transport.
 */
public class SolrTransportException extends SolrClientException {

	private static final long serialVersionUID = 1L;

	private final URI uri;

	public SolrTransportException(URI uri, Throwable cause) {
		super("Request to " + uri + " failed: " + cause.getMessage(), cause);
		this.uri = uri;
	}

	public URI getUri() {
		return uri;
	}
}
