package me.golemcore.calhelper.domain.exception;

/**
 * Thrown when a running turn observes cancellation at a transition boundary.
 */
public class TurnCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TurnCancelledException(String threadId) {
        super("Turn cancelled for thread " + threadId);
    }
}
