package me.golemcore.calhelper.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Defines a capability the model can request. Contains the capability name,
 * description, and JSON Schema for input parameters.
 */
@Data
@Builder
public class CapabilityDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    /**
     * Creates a simple definition without input parameters.
     */
    public static CapabilityDefinition simple(String name, String description) {
        return CapabilityDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(objectSchema(Map.of(), List.of()))
                .build();
    }

    /**
     * Closed object schema: properties not listed are rejected.
     */
    public static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", required,
                "additionalProperties", false);
    }
}
