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

import java.util.List;
import org.apache.solr.drv.client.SolrErrorResponseException;

/**
 * Solr rejected a batch of schema commands.
 *
 * <p>
 * Code and message are the server's. When Solr lists the offending commands
 * in {@code error.details}, each one is reported in
 * {@link #getFailedOperations()} with its position in the batch. An empty list
 * means Solr only reported an aggregate failure; nothing is inferred about
 * which commands were applied.
 */
public class SchemaUpdateException extends SolrErrorResponseException {

	private static final long serialVersionUID = 1L;

	/**
	 * A command Solr reported as failed.
	 *
	 * @param index
	 *            position of the command in the committed batch, {@code -1} when
	 *            it could not be matched to a pending operation
	 * @param command
	 *            the command name, e.g. {@code add-field}
	 * @param errorMessages
	 *            the server's messages for this command
	 */
	public record FailedOperation(int index, String command, List<String> errorMessages) {
	}

	private final transient List<FailedOperation> failedOperations;

	public SchemaUpdateException(SolrErrorResponseException source, List<FailedOperation> failedOperations) {
		super(source);
		this.failedOperations = List.copyOf(failedOperations);
	}

	public List<FailedOperation> getFailedOperations() {
		return failedOperations;
	}
}
