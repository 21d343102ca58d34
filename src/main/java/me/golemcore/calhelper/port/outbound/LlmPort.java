package me.golemcore.calhelper.port.outbound;

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

import me.golemcore.calhelper.domain.model.LlmRequest;
import me.golemcore.calhelper.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the language-model gateway. The gateway is stateless per call: every
 * request carries the complete visible history of a thread.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai").
     */
    String getProviderId();

    /**
     * Sends the history and capability surface, returning either a final answer
     * or the requested invocations.
     */
    CompletableFuture<LlmResponse> converse(LlmRequest request);

    /**
     * Returns the model identifier used by this provider.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
