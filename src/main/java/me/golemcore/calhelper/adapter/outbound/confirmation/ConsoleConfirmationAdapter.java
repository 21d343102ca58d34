package me.golemcore.calhelper.adapter.outbound.confirmation;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.infrastructure.console.ConsoleIO;
import me.golemcore.calhelper.port.outbound.ConfirmationPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Interactive confirmation port for the terminal front end. Prompts for y/n
 * plus optional feedback and blocks the running turn until the human answers.
 * End of input counts as no response.
 */
@Component
@ConditionalOnProperty(name = "calhelper.frontend", havingValue = "console")
@Slf4j
public class ConsoleConfirmationAdapter implements ConfirmationPort {

    private static final Set<String> YES = Set.of("y", "yes");

    private final ConsoleIO console;
    private final Map<String, ApprovalDecision> deliveredDecisions = new ConcurrentHashMap<>();
    private final Map<String, String> deliveredFeedback = new ConcurrentHashMap<>();

    public ConsoleConfirmationAdapter(ConsoleIO console) {
        this.console = console;
    }

    @Override
    public CompletableFuture<ApprovalDecision> requestConfirmation(String threadId, InvocationRequest invocation,
            String description) {
        ApprovalDecision delivered = deliveredDecisions.remove(invocation.getId());
        if (delivered != null) {
            return CompletableFuture.completedFuture(delivered);
        }

        console.println("Confirm action: " + description);
        String answer = console.prompt("Proceed? [y/N]: ");
        if (answer == null) {
            return CompletableFuture.completedFuture(ApprovalDecision.noResponse(invocation.getId()));
        }
        if (YES.contains(answer.trim().toLowerCase(Locale.ROOT))) {
            return CompletableFuture.completedFuture(ApprovalDecision.approve(invocation.getId()));
        }
        String reason = console.prompt("Feedback (optional): ");
        String feedback = reason != null && !reason.isBlank() ? reason.trim() : null;
        return CompletableFuture.completedFuture(ApprovalDecision.reject(invocation.getId(), feedback));
    }

    @Override
    public CompletableFuture<String> requestFeedback(String threadId, String prompt) {
        String delivered = deliveredFeedback.remove(threadId);
        if (delivered != null) {
            return CompletableFuture.completedFuture(delivered);
        }
        console.println(prompt);
        String answer = console.prompt("You: ");
        return CompletableFuture.completedFuture(answer != null ? answer.trim() : "");
    }

    @Override
    public void deliverDecision(ApprovalDecision decision) {
        deliveredDecisions.put(decision.getInvocationId(), decision);
    }

    @Override
    public void deliverFeedback(String threadId, String feedback) {
        deliveredFeedback.put(threadId, feedback);
    }

    @Override
    public boolean isInteractive() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
