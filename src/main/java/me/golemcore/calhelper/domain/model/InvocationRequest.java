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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A capability invocation requested by the language model. Contains the
 * invocation id for correlation with its result, the capability name and the
 * arguments decoded from the model's JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvocationRequest {

    private String id;
    private String capabilityName;
    private Map<String, Object> arguments;
}
