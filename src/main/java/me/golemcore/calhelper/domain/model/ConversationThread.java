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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The unit of conversation continuity. Holds the ordered message history, the
 * current turn phase and the scratch fields for the dispatch round in flight.
 * Owned by the checkpoint store; the turn controller borrows a copy for the
 * duration of one turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationThread {

    private String threadId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private TurnPhase phase = TurnPhase.AWAITING_USER_INPUT;

    /**
     * Invocations of the current dispatch round, in request order.
     */
    @Builder.Default
    private List<InvocationRequest> pendingInvocations = new ArrayList<>();

    /**
     * Decisions recorded for the current round, keyed by invocation id.
     */
    @Builder.Default
    private Map<String, ApprovalDecision> decisions = new LinkedHashMap<>();

    /**
     * Result messages produced so far in the current round, keyed by invocation
     * id. Appended to {@link #messages} in request order once the round
     * completes.
     */
    @Builder.Default
    private Map<String, Message> completedResults = new LinkedHashMap<>();

    /**
     * Dispatch rounds taken in the current user turn.
     */
    private int roundTrips;

    /**
     * Incremented by every successful save.
     */
    private long version;

    private Instant createdAt;
    private Instant updatedAt;

    public void addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
    }

    public void recordDecision(ApprovalDecision decision) {
        if (decisions == null) {
            decisions = new LinkedHashMap<>();
        }
        decisions.put(decision.getInvocationId(), decision);
    }

    public void recordResult(Message result) {
        if (completedResults == null) {
            completedResults = new LinkedHashMap<>();
        }
        completedResults.put(result.getInvocationId(), result);
    }

    public Optional<InvocationRequest> findPending(String invocationId) {
        if (pendingInvocations == null) {
            return Optional.empty();
        }
        return pendingInvocations.stream()
                .filter(invocation -> invocation.getId().equals(invocationId))
                .findFirst();
    }

    @JsonIgnore
    public boolean hasDecision(String invocationId) {
        return decisions != null && decisions.containsKey(invocationId);
    }

    @JsonIgnore
    public boolean hasResult(String invocationId) {
        return completedResults != null && completedResults.containsKey(invocationId);
    }

    /**
     * Clears the scratch fields once a round has been appended to the history.
     */
    public void clearRound() {
        pendingInvocations = new ArrayList<>();
        decisions = new LinkedHashMap<>();
        completedResults = new LinkedHashMap<>();
    }

    /**
     * Text of the last assistant answer, if the thread ends with one.
     */
    @JsonIgnore
    public Optional<String> lastAnswer() {
        if (messages == null || messages.isEmpty()) {
            return Optional.empty();
        }
        Message last = messages.get(messages.size() - 1);
        if (last.getKind() != MessageKind.ASSISTANT_TEXT) {
            return Optional.empty();
        }
        return Optional.ofNullable(last.getContent());
    }
}
