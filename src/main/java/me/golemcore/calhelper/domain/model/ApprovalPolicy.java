package me.golemcore.calhelper.domain.model;

/**
 * Per-capability approval policy.
 */
public enum ApprovalPolicy {

    AUTO,

    REQUIRE_CONFIRMATION
}
