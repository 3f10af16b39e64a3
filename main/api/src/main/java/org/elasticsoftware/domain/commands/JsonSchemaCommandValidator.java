/*
 * Copyright 2022 - 2026 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.domain.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jakarta.validation.JakartaValidationModule;
import com.github.victools.jsonschema.module.jakarta.validation.JakartaValidationOption;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.everit.json.schema.Schema;
import org.everit.json.schema.ValidationException;
import org.everit.json.schema.loader.SchemaLoader;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Validates command payloads against a JSON Schema (draft 7). The schema is either supplied as is or
 * generated from the class that models the payload.
 */
public class JsonSchemaCommandValidator implements CommandValidator {
    private static final Logger log = LoggerFactory.getLogger(JsonSchemaCommandValidator.class);
    private final JsonNode schemaNode;
    private final Schema schema;

    public JsonSchemaCommandValidator(JsonNode schemaNode) {
        this.schemaNode = schemaNode.deepCopy();
        try {
            JSONObject rawSchema = new JSONObject(new JSONTokener(schemaNode.toString()));
            this.schema = SchemaLoader.builder()
                    .schemaJson(rawSchema)
                    .draftV7Support()
                    .build()
                    .load()
                    .build();
        } catch (JSONException | org.everit.json.schema.SchemaException e) {
            throw new InvalidDefinitionException("Invalid JSON schema for command validation", e);
        }
    }

    public static JsonSchemaCommandValidator forClass(Class<?> payloadClass) {
        return forClass(payloadClass, new ObjectMapper());
    }

    public static JsonSchemaCommandValidator forClass(Class<?> payloadClass, ObjectMapper objectMapper) {
        return new JsonSchemaCommandValidator(createJsonSchemaGenerator(objectMapper).generateSchema(payloadClass));
    }

    static SchemaGenerator createJsonSchemaGenerator(ObjectMapper objectMapper) {
        SchemaGeneratorConfigBuilder configBuilder = new SchemaGeneratorConfigBuilder(objectMapper,
                SchemaVersion.DRAFT_7,
                OptionPreset.PLAIN_JSON);
        configBuilder.with(new JakartaValidationModule(JakartaValidationOption.INCLUDE_PATTERN_EXPRESSIONS,
                JakartaValidationOption.NOT_NULLABLE_FIELD_IS_REQUIRED));
        configBuilder.with(new JacksonModule());
        configBuilder.with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT);
        configBuilder.with(Option.NULLABLE_FIELDS_BY_DEFAULT);
        configBuilder.with(Option.NULLABLE_METHOD_RETURN_VALUES_BY_DEFAULT);
        // amounts travel as strings, so BigDecimal is described as type = string
        configBuilder.forTypesInGeneral().withTypeAttributeOverride((collectedTypeAttributes, scope, context) -> {
            if (scope.getType().getTypeName().equals("java.math.BigDecimal")) {
                JsonNode typeNode = collectedTypeAttributes.get("type");
                if (typeNode != null && typeNode.isArray()) {
                    ((ArrayNode) typeNode).set(0, "string");
                } else {
                    collectedTypeAttributes.put("type", "string");
                }
            }
        });
        return new SchemaGenerator(configBuilder.build());
    }

    public JsonNode getSchema() {
        return schemaNode.deepCopy();
    }

    @Override
    public void validate(String commandName, int commandVersion, JsonNode payload) throws CommandValidationException {
        if (payload == null) {
            throw new CommandValidationException(commandName, commandVersion, List.of("#: payload is missing"));
        }
        try {
            schema.validate(new JSONTokener(payload.toString()).nextValue());
        } catch (ValidationException e) {
            log.debug("Command {} (version {}) failed validation: {}", commandName, commandVersion, e.getMessage());
            throw new CommandValidationException(commandName, commandVersion, e.getAllMessages(), e);
        }
    }
}
