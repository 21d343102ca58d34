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

/**
 * Outcome of the approval gate for one invocation. Consumed exactly once by the
 * turn controller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalDecision {

    public static final String NO_RESPONSE = "no response";

    private String invocationId;
    private boolean approved;
    private String humanFeedback;

    public static ApprovalDecision approve(String invocationId) {
        return new ApprovalDecision(invocationId, true, null);
    }

    public static ApprovalDecision reject(String invocationId, String humanFeedback) {
        return new ApprovalDecision(invocationId, false, humanFeedback);
    }

    public static ApprovalDecision noResponse(String invocationId) {
        return reject(invocationId, NO_RESPONSE);
    }
}
