package me.golemcore.calhelper.domain.component;

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

import me.golemcore.calhelper.domain.model.CapabilityDefinition;
import me.golemcore.calhelper.domain.model.CapabilityResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an action the language model can request. Capabilities
 * expose their JSON Schema definition to the model and implement the execution
 * logic. They are stateless: any context they need (such as the current user)
 * is passed as an argument or resolved by the executor itself.
 */
public interface CapabilityComponent extends Component {

    @Override
    default String getComponentType() {
        return "capability";
    }

    /**
     * Returns the capability definition with JSON Schema for function calling.
     *
     * @return the capability definition
     */
    CapabilityDefinition getDefinition();

    /**
     * Executes the capability. Arguments are validated against the input schema
     * by the registry before this method is called.
     *
     * @param arguments
     *            the validated arguments
     * @return a future containing the execution result
     */
    CompletableFuture<CapabilityResult> execute(Map<String, Object> arguments);

    default String getCapabilityName() {
        return getDefinition().getName();
    }
}
