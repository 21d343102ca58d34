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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single entry in a conversation thread. Invocation requests carry the
 * requested {@link InvocationRequest}; invocation results reference the request
 * by {@link #invocationId} and record whether the invocation failed and why.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String id;
    private MessageKind kind;
    private String content;

    private InvocationRequest invocation; // For INVOCATION_REQUEST

    private String invocationId; // For INVOCATION_RESULT
    private String capabilityName; // For INVOCATION_RESULT
    private boolean failed;
    private FailureKind failureKind;

    private Instant timestamp;

    @JsonIgnore
    public boolean isUserMessage() {
        return kind == MessageKind.USER;
    }

    @JsonIgnore
    public boolean isInvocationRequest() {
        return kind == MessageKind.INVOCATION_REQUEST;
    }

    @JsonIgnore
    public boolean isInvocationResult() {
        return kind == MessageKind.INVOCATION_RESULT;
    }

    /**
     * Checks if this result was produced because a human rejected the invocation.
     */
    @JsonIgnore
    public boolean isRejection() {
        return isInvocationResult() && failureKind == FailureKind.REJECTED;
    }
}
