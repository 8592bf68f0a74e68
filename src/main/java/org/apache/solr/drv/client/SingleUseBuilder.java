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

/**
 * Common state of the deferred-execution builders.
 *
 * <p>
 * A builder accumulates parameters until {@code commit()} is called once.
 * Afterwards every mutator and a second {@code commit()} fail with
 * {@link SolrUsageException} before any request is issued. Builders are not
 * thread-safe; they are meant to be filled and committed by one caller.
 */
public abstract class SingleUseBuilder {

	private final String description;

	private boolean consumed;

	protected SingleUseBuilder(String description) {
		this.description = description;
	}

	/**
	 * Fails when this builder was already committed. Called at the start of every
	 * mutator.
	 */
	protected final void ensureOpen() {
		if (consumed) {
			throw new SolrUsageException(description + " was already committed and cannot be reused");
		}
	}

	/**
	 * Marks the builder consumed; called at the start of {@code commit()}.
	 */
	protected final void consume() {
		ensureOpen();
		consumed = true;
	}

	public final boolean isConsumed() {
		return consumed;
	}
}
