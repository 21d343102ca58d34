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

import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.InvocationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for asking a human to approve sensitive invocations and to supply
 * free-text feedback after a rejection.
 *
 * <p>
 * Requests are keyed by invocation id (confirmations) and thread id (feedback)
 * and are idempotent: asking again returns the same pending future, and an
 * answer delivered before anyone asked is kept and returned at once.
 */
public interface ConfirmationPort {

    /**
     * Request a decision for one invocation.
     *
     * @param threadId
     *            thread the invocation belongs to
     * @param invocation
     *            the invocation awaiting approval
     * @param description
     *            human-readable description of the action
     * @return future that completes with the decision
     */
    CompletableFuture<ApprovalDecision> requestConfirmation(String threadId, InvocationRequest invocation,
            String description);

    /**
     * Request free-text feedback after one or more invocations were rejected.
     */
    CompletableFuture<String> requestFeedback(String threadId, String prompt);

    /**
     * Deliver an externally produced decision.
     */
    void deliverDecision(ApprovalDecision decision);

    /**
     * Deliver externally produced feedback for a thread.
     */
    void deliverFeedback(String threadId, String feedback);

    /**
     * Interactive ports block the running turn until the human answers. Deferred
     * ports let the turn suspend and receive the answer in a later request.
     */
    boolean isInteractive();

    /**
     * Check if the confirmation port can currently reach a human.
     */
    boolean isAvailable();
}
