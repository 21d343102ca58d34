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

/**
 * Response from the language-model gateway. Either a final answer (text and no
 * invocations) or a non-empty list of requested invocations.
 */
@Data
@Builder
public class LlmResponse {

    private String content;
    private List<InvocationRequest> invocations;
    private String model;
    private String finishReason;

    public boolean hasInvocations() {
        return invocations != null && !invocations.isEmpty();
    }

    public boolean isFinalAnswer() {
        return !hasInvocations();
    }

    public static LlmResponse answer(String content) {
        return LlmResponse.builder()
                .content(content)
                .invocations(List.of())
                .build();
    }

    public static LlmResponse invoke(List<InvocationRequest> invocations) {
        return LlmResponse.builder()
                .invocations(List.copyOf(invocations))
                .build();
    }
}
