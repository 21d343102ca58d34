package me.golemcore.calhelper.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import me.golemcore.calhelper.domain.exception.InvalidArgumentsException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates loosely-typed invocation arguments against a capability's JSON
 * Schema (draft 7) before dispatch.
 *
 * <p>
 * Schemas are compiled once with {@link #compile}. Object schemas that do not
 * say otherwise get {@code additionalProperties: false}, so unknown properties
 * are rejected. Null-valued arguments are treated as absent: a null required
 * property is reported as missing, a null optional one is ignored.
 */
@Component
public class CapabilityArgumentValidator {

    private static final String ADDITIONAL_PROPERTIES = "additionalProperties";

    private final ObjectMapper objectMapper;
    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    public CapabilityArgumentValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Compiles an input schema map into a reusable validator.
     */
    public JsonSchema compile(Map<String, Object> inputSchema) {
        JsonNode schemaNode = objectMapper.valueToTree(inputSchema != null ? inputSchema : Map.of("type", "object"));
        closeObjectSchemas(schemaNode);
        return schemaFactory.getSchema(schemaNode);
    }

    /**
     * Validates the arguments and throws when any violation is found.
     *
     * @throws InvalidArgumentsException
     *             listing every violation
     */
    public void requireValid(String capabilityName, JsonSchema schema, Map<String, Object> arguments) {
        List<String> violations = validate(schema, arguments);
        if (!violations.isEmpty()) {
            throw new InvalidArgumentsException(capabilityName, violations);
        }
    }

    /**
     * Returns the list of violations, empty when the arguments are valid.
     */
    public List<String> validate(JsonSchema schema, Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        for (ValidationMessage message : messages(schema, arguments)) {
            violations.add(message.getMessage());
        }
        return violations;
    }

    public List<String> validate(Map<String, Object> inputSchema, Map<String, Object> arguments) {
        return validate(compile(inputSchema), arguments);
    }

    List<ValidationMessage> messages(JsonSchema schema, Map<String, Object> arguments) {
        JsonNode argumentsNode = objectMapper.valueToTree(arguments != null ? arguments : Map.of());
        dropNulls(argumentsNode);
        Set<ValidationMessage> messages = schema.validate(argumentsNode);
        return messages.stream()
                .sorted(Comparator.comparing(ValidationMessage::getMessage))
                .toList();
    }

    private void closeObjectSchemas(JsonNode schemaNode) {
        if (!(schemaNode instanceof ObjectNode schema)) {
            return;
        }
        if ("object".equals(schema.path("type").asText()) && !schema.has(ADDITIONAL_PROPERTIES)) {
            schema.put(ADDITIONAL_PROPERTIES, false);
        }
        JsonNode properties = schema.get("properties");
        if (properties != null) {
            properties.forEach(this::closeObjectSchemas);
        }
        closeObjectSchemas(schema.get("items"));
    }

    private void dropNulls(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (value.isNull()) {
                    fields.remove();
                } else {
                    dropNulls(value);
                }
            }
        } else if (node instanceof ArrayNode array) {
            array.forEach(this::dropNulls);
        }
    }
}
