package me.golemcore.calhelper.domain.service;

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
import me.golemcore.calhelper.domain.model.ApprovalPolicy;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import me.golemcore.calhelper.port.outbound.ConfirmationPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Policy gate deciding whether a requested invocation may proceed automatically
 * or must wait for a human. Policies are configured per capability name with a
 * configurable fallback.
 *
 * <p>
 * The gate never mutates thread state; it only produces decisions that the turn
 * controller applies. It never auto-approves: a confirmation that times out or
 * fails becomes a rejection with feedback {@value ApprovalDecision#NO_RESPONSE}.
 */
@Component
@Slf4j
public class ApprovalGate {

    private static final String UNKNOWN = "unknown";
    private static final int VALUE_LENGTH_THRESHOLD = 80;

    private final CalHelperProperties properties;
    private final ConfirmationPort confirmationPort;

    public ApprovalGate(CalHelperProperties properties, ConfirmationPort confirmationPort) {
        this.properties = properties;
        this.confirmationPort = confirmationPort;
        log.info("[Approval] Policies: {} (default {}), confirmation via {}",
                properties.getApproval().getPolicies(), properties.getApproval().getDefaultPolicy(),
                confirmationPort.getClass().getSimpleName());
    }

    public ApprovalPolicy policyFor(String capabilityName) {
        Map<String, ApprovalPolicy> policies = properties.getApproval().getPolicies();
        ApprovalPolicy policy = policies != null ? policies.get(capabilityName) : null;
        if (policy != null) {
            return policy;
        }
        ApprovalPolicy fallback = properties.getApproval().getDefaultPolicy();
        return fallback != null ? fallback : ApprovalPolicy.AUTO;
    }

    public boolean requiresConfirmation(String capabilityName) {
        return policyFor(capabilityName) == ApprovalPolicy.REQUIRE_CONFIRMATION;
    }

    /**
     * Decides one invocation.
     *
     * @return a completed approval for {@link ApprovalPolicy#AUTO} capabilities,
     *         otherwise the pending human decision, bounded by the configured
     *         timeout
     */
    public CompletableFuture<ApprovalDecision> decide(String threadId, InvocationRequest invocation) {
        if (!requiresConfirmation(invocation.getCapabilityName())) {
            return CompletableFuture.completedFuture(ApprovalDecision.approve(invocation.getId()));
        }
        if (!confirmationPort.isAvailable()) {
            log.warn("[Approval] Confirmation port unavailable, rejecting '{}' ({})",
                    invocation.getCapabilityName(), invocation.getId());
            return CompletableFuture.completedFuture(ApprovalDecision.noResponse(invocation.getId()));
        }

        String description = describeAction(invocation);
        Duration timeout = properties.getApproval().getTimeout();
        log.debug("[Approval] Requesting confirmation for {}: {}", invocation.getId(), description);
        try {
            return confirmationPort.requestConfirmation(threadId, invocation, description)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(error -> {
                        log.warn("[Approval] No decision for {} ({}): {}", invocation.getId(),
                                invocation.getCapabilityName(), error.toString());
                        return ApprovalDecision.noResponse(invocation.getId());
                    });
        } catch (RuntimeException e) {
            log.error("[Approval] Confirmation request failed for {}, rejecting", invocation.getId(), e);
            return CompletableFuture.completedFuture(ApprovalDecision.noResponse(invocation.getId()));
        }
    }

    /**
     * Forwards an externally produced decision to the confirmation port.
     */
    public void deliver(ApprovalDecision decision) {
        log.info("[Approval] Decision for {}: {}", decision.getInvocationId(),
                decision.isApproved() ? "approved" : "rejected");
        confirmationPort.deliverDecision(decision);
    }

    public boolean isInteractive() {
        return confirmationPort.isInteractive();
    }

    /**
     * Build a human-readable description of the action for the confirmation prompt.
     */
    public String describeAction(InvocationRequest invocation) {
        String name = invocation.getCapabilityName();
        Map<String, Object> args = invocation.getArguments() != null ? invocation.getArguments() : Map.of();

        return switch (name) {
        case "createBooking" -> describeCreateBooking(args);
        case "cancelBooking" -> describeCancelBooking(args);
        default -> name + ": " + args;
        };
    }

    private String describeCreateBooking(Map<String, Object> args) {
        StringBuilder sb = new StringBuilder("Create booking of event type ")
                .append(valueOf(args, "eventTypeId"))
                .append(" at ").append(valueOf(args, "start"))
                .append(" for ").append(valueOf(args, "attendeeName"));
        Object email = args.get("attendeeEmail");
        if (email != null) {
            sb.append(" <").append(email).append('>');
        }
        if (args.get("guestEmails") instanceof List<?> guests && !guests.isEmpty()) {
            sb.append(", guests: ").append(guests);
        }
        return sb.toString();
    }

    private String describeCancelBooking(Map<String, Object> args) {
        String description = "Cancel booking " + valueOf(args, "bookingUid");
        Object reason = args.get("reason");
        if (reason != null) {
            description += " (reason: " + shorten(reason.toString()) + ")";
        }
        return description;
    }

    private String valueOf(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null ? shorten(value.toString()) : UNKNOWN;
    }

    private String shorten(String value) {
        if (value.length() > VALUE_LENGTH_THRESHOLD) {
            return value.substring(0, VALUE_LENGTH_THRESHOLD) + "...";
        }
        return value;
    }
}
