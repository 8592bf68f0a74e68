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

/**
 * Field types of Solr's {@code _default} configset used by the
 * {@link FieldBuilder} factories.
 */
public enum FieldType {

	STRING("string"),

	STRINGS("strings"),

	/** Keyword-tokenized, lower-cased text. */
	LOWERCASE("lowercase"),

	/** Tokenized full text with the standard analyzer. */
	TEXT_GENERAL("text_general"),

	FLOAT("pfloat"),

	DOUBLE("pdouble"),

	INT("pint"),

	LONG("plong"),

	BOOLEAN("boolean"),

	DATE("pdate"),

	DELIMITED_PAYLOADS_STRING("delimited_payloads_string");

	private final String solrName;

	FieldType(String solrName) {
		this.solrName = solrName;
	}

	/**
	 * The type name as declared in the schema.
	 */
	public String solrName() {
		return solrName;
	}
}
