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

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.solr.drv.client.SolrUsageException;

/**
 * Factories and a fluent builder for {@link FieldDescriptor}s.
 *
 * <p>
 * The static factories cover the common field kinds with defaults
 * {@code indexed=true}, {@code stored=true} and {@code multiValued=false}
 * (only {@link #multiString(String)} is multi-valued):
 *
 * <pre>{@code
 * users.schema().addField(FieldBuilder.string("name")).addField(FieldBuilder.numeric("age"))
 * 		.addField(FieldBuilder.date("birthday").withStored(false)).commit();
 * }</pre>
 *
 * <p>
 * Anything else is built explicitly:
 *
 * <pre>{@code
 * FieldDescriptor sku = FieldBuilder.named("sku").type("string").docValues(true).required(true).build();
 * }</pre>
 *
 * @see <a href=
 *      "https://solr.apache.org/guide/solr/latest/indexing-guide/fields.html#optional-field-type-override-properties">Field
 *      properties</a>
 */
public final class FieldBuilder {

	private final String name;

	private String type;

	private boolean indexed = true;

	private boolean stored = true;

	private boolean multiValued;

	private final Map<String, Object> properties = new LinkedHashMap<>();

	private FieldBuilder(String name) {
		this.name = name;
	}

	// ========================================
	// Prebuilt fields
	// ========================================

	/** A {@code string} field for exact matching, norms omitted. */
	public static FieldDescriptor string(String name) {
		return named(name).type(FieldType.STRING).omitNorms(true).build();
	}

	/** A multi-valued {@code strings} field, norms omitted. */
	public static FieldDescriptor multiString(String name) {
		return named(name).type(FieldType.STRINGS).omitNorms(true).multiValued(true).build();
	}

	/** A {@code lowercase} field: the whole value as one lower-cased token. */
	public static FieldDescriptor text(String name) {
		return named(name).type(FieldType.LOWERCASE).build();
	}

	/** A tokenized {@code text_general} field. */
	public static FieldDescriptor fulltext(String name) {
		return named(name).type(FieldType.TEXT_GENERAL).build();
	}

	/** A {@code pfloat} field. */
	public static FieldDescriptor numeric(String name) {
		return named(name).type(FieldType.FLOAT).build();
	}

	/** A {@code pint} field. */
	public static FieldDescriptor integer(String name) {
		return named(name).type(FieldType.INT).build();
	}

	/** A {@code plong} field. */
	public static FieldDescriptor longField(String name) {
		return named(name).type(FieldType.LONG).build();
	}

	/** A {@code pdouble} field. */
	public static FieldDescriptor doubleField(String name) {
		return named(name).type(FieldType.DOUBLE).build();
	}

	/** A {@code boolean} field. */
	public static FieldDescriptor booleanField(String name) {
		return named(name).type(FieldType.BOOLEAN).build();
	}

	/** A {@code pdate} field. */
	public static FieldDescriptor date(String name) {
		return named(name).type(FieldType.DATE).build();
	}

	/** A {@code delimited_payloads_string} field for weighted tags. */
	public static FieldDescriptor tag(String name) {
		return named(name).type(FieldType.DELIMITED_PAYLOADS_STRING).build();
	}

	// ========================================
	// Explicit definitions
	// ========================================

	/**
	 * Starts an explicit field definition.
	 *
	 * @param name
	 *            the name of the field
	 */
	public static FieldBuilder named(String name) {
		return new FieldBuilder(name);
	}

	public FieldBuilder type(FieldType type) {
		this.type = type.solrName();
		return this;
	}

	/**
	 * Sets a field type by its schema name, for types outside {@link FieldType}.
	 */
	public FieldBuilder type(String type) {
		this.type = type;
		return this;
	}

	public FieldBuilder indexed(boolean indexed) {
		this.indexed = indexed;
		return this;
	}

	public FieldBuilder stored(boolean stored) {
		this.stored = stored;
		return this;
	}

	public FieldBuilder multiValued(boolean multiValued) {
		this.multiValued = multiValued;
		return this;
	}

	/** Value used for documents without the field. */
	public FieldBuilder defaultValue(Object defaultValue) {
		return property(FieldDescriptor.DEFAULT_KEY, defaultValue);
	}

	public FieldBuilder docValues(boolean docValues) {
		return property("docValues", docValues);
	}

	public FieldBuilder sortMissingFirst(boolean sortMissingFirst) {
		return property("sortMissingFirst", sortMissingFirst);
	}

	public FieldBuilder sortMissingLast(boolean sortMissingLast) {
		return property("sortMissingLast", sortMissingLast);
	}

	/** Whether the field may be un-inverted at query time. */
	public FieldBuilder uninvertible(boolean uninvertible) {
		return property("uninvertible", uninvertible);
	}

	public FieldBuilder omitNorms(boolean omitNorms) {
		return property("omitNorms", omitNorms);
	}

	public FieldBuilder omitTermFreqAndPositions(boolean omitTermFreqAndPositions) {
		return property("omitTermFreqAndPositions", omitTermFreqAndPositions);
	}

	/** Like {@link #omitTermFreqAndPositions} but keeps term frequencies. */
	public FieldBuilder omitPositions(boolean omitPositions) {
		return property("omitPositions", omitPositions);
	}

	public FieldBuilder termVectors(boolean termVectors) {
		return property("termVectors", termVectors);
	}

	public FieldBuilder termPositions(boolean termPositions) {
		return property("termPositions", termPositions);
	}

	public FieldBuilder termOffsets(boolean termOffsets) {
		return property("termOffsets", termOffsets);
	}

	public FieldBuilder termPayloads(boolean termPayloads) {
		return property("termPayloads", termPayloads);
	}

	/** Reject documents without this field. */
	public FieldBuilder required(boolean required) {
		return property("required", required);
	}

	public FieldBuilder useDocValuesAsStored(boolean useDocValuesAsStored) {
		return property("useDocValuesAsStored", useDocValuesAsStored);
	}

	/** Load the value lazily; only for stored, single-valued text fields. */
	public FieldBuilder large(boolean large) {
		return property("large", large);
	}

	/**
	 * Sets any other field property by its schema name.
	 */
	public FieldBuilder property(String key, Object value) {
		properties.put(key, value);
		return this;
	}

	/**
	 * Builds the descriptor.
	 *
	 * @throws SolrUsageException
	 *             if the name or the type is missing
	 */
	public FieldDescriptor build() {
		if (name == null || name.isEmpty()) {
			throw new SolrUsageException("Field name must not be empty");
		}
		if (type == null || type.isEmpty()) {
			throw new SolrUsageException("Field '" + name + "' has no type");
		}
		return new FieldDescriptor(name, type, indexed, stored, multiValued, properties);
	}
}
