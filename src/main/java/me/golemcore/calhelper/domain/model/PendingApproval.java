package me.golemcore.calhelper.domain.model;

import java.util.Map;

/**
 * An invocation of the current round still waiting for a human decision.
 */
public record PendingApproval(String invocationId, String capabilityName, Map<String, Object> arguments,
        String description) {
}
