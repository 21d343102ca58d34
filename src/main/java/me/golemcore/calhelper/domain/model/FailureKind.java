package me.golemcore.calhelper.domain.model;

/**
 * Machine-readable classification of invocation failures.
 *
 * <p>
 * This exists to avoid relying on string matching in result messages.
 */
public enum FailureKind {

    /**
     * The model asked for a capability that is not registered.
     */
    UNKNOWN_CAPABILITY,

    /**
     * Arguments did not match the capability input schema. The executor was not
     * invoked.
     */
    INVALID_ARGUMENTS,

    /**
     * The executor failed (upstream 4xx/5xx, exception, timeout).
     */
    EXECUTION_FAILED,

    /**
     * A human rejected the invocation, or did not answer in time.
     */
    REJECTED
}
