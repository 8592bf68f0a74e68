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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable definition of one schema field.
 *
 * <p>
 * {@code indexed}, {@code stored} and {@code multiValued} are always sent.
 * Every other field property Solr understands ({@code docValues},
 * {@code omitNorms}, {@code default}, ...) lives in {@code properties} under
 * its schema name and is sent only when set. The {@code with*} methods return
 * modified copies.
 *
 * @param name
 *            field name
 * @param type
 *            name of the field type declared in the schema
 * @param indexed
 *            whether the field can be used in queries
 * @param stored
 *            whether the value can be retrieved by queries
 * @param multiValued
 *            whether a document can hold several values
 * @param properties
 *            additional field properties keyed by their schema names
 * @see FieldBuilder
 */
public record FieldDescriptor(String name, String type, boolean indexed, boolean stored, boolean multiValued,
		Map<String, Object> properties) {

	static final String NAME_KEY = "name";

	static final String TYPE_KEY = "type";

	static final String INDEXED_KEY = "indexed";

	static final String STORED_KEY = "stored";

	static final String MULTI_VALUED_KEY = "multiValued";

	static final String DEFAULT_KEY = "default";

	public FieldDescriptor {
		properties = properties == null
				? Collections.emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<>(properties));
	}

	public FieldDescriptor withIndexed(boolean indexed) {
		return new FieldDescriptor(name, type, indexed, stored, multiValued, properties);
	}

	public FieldDescriptor withStored(boolean stored) {
		return new FieldDescriptor(name, type, indexed, stored, multiValued, properties);
	}

	public FieldDescriptor withMultiValued(boolean multiValued) {
		return new FieldDescriptor(name, type, indexed, stored, multiValued, properties);
	}

	/**
	 * Returns a copy whose missing-value default is {@code value}.
	 */
	public FieldDescriptor withDefault(Object value) {
		return withProperty(DEFAULT_KEY, value);
	}

	/**
	 * Returns a copy with one additional (or replaced) field property.
	 */
	public FieldDescriptor withProperty(String key, Object value) {
		Map<String, Object> copy = new LinkedHashMap<>(properties);
		copy.put(key, value);
		return new FieldDescriptor(name, type, indexed, stored, multiValued, copy);
	}

	/**
	 * Serializes the definition as expected by the Schema API
	 * {@code add-field}/{@code replace-field} commands.
	 */
	public ObjectNode toJson(ObjectMapper objectMapper) {
		ObjectNode json = objectMapper.createObjectNode();
		json.put(NAME_KEY, name);
		json.put(TYPE_KEY, type);
		json.put(INDEXED_KEY, indexed);
		json.put(STORED_KEY, stored);
		json.put(MULTI_VALUED_KEY, multiValued);
		properties.forEach((key, value) -> json.set(key, objectMapper.valueToTree(value)));
		return json;
	}
}
