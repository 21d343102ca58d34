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

/**
 * Result of capability execution containing success status, output text,
 * optional structured data, and error information. Results are sent back to the
 * model as invocation result messages.
 */
@Data
@Builder
public class CapabilityResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;
    private FailureKind failureKind;

    public static CapabilityResult success(String output) {
        return CapabilityResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    public static CapabilityResult success(String output, Object data) {
        return CapabilityResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    public static CapabilityResult failure(String error) {
        return failure(FailureKind.EXECUTION_FAILED, error);
    }

    public static CapabilityResult failure(FailureKind kind, String error) {
        return CapabilityResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .build();
    }
}
