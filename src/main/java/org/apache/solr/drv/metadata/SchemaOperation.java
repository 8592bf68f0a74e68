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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One pending Schema API command.
 *
 * @param action
 *            the command
 * @param field
 *            the field definition for add/replace, {@code null} for delete
 * @param fieldName
 *            the name of the affected field
 */
public record SchemaOperation(Action action, FieldDescriptor field, String fieldName) {

	/**
	 * Schema API field commands.
	 */
	public enum Action {

		ADD_FIELD("add-field"),

		REPLACE_FIELD("replace-field"),

		DELETE_FIELD("delete-field");

		private final String command;

		Action(String command) {
			this.command = command;
		}

		/** The command name used in the request body. */
		public String command() {
			return command;
		}
	}

	public static SchemaOperation add(FieldDescriptor field) {
		return new SchemaOperation(Action.ADD_FIELD, field, field.name());
	}

	public static SchemaOperation replace(FieldDescriptor field) {
		return new SchemaOperation(Action.REPLACE_FIELD, field, field.name());
	}

	public static SchemaOperation delete(String fieldName) {
		return new SchemaOperation(Action.DELETE_FIELD, null, fieldName);
	}

	/**
	 * The command argument: the full definition for add/replace, {@code {"name":
	 * ...}} for delete.
	 */
	public JsonNode payload(ObjectMapper objectMapper) {
		if (field != null) {
			return field.toJson(objectMapper);
		}
		return objectMapper.createObjectNode().put(FieldDescriptor.NAME_KEY, fieldName);
	}

	/**
	 * The command as sent: {@code {"<command>": <payload>}}.
	 */
	public ObjectNode toJson(ObjectMapper objectMapper) {
		ObjectNode json = objectMapper.createObjectNode();
		json.set(action.command(), payload(objectMapper));
		return json;
	}
}
