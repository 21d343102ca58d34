package me.golemcore.calhelper.domain.exception;

/**
 * Thrown when the model keeps requesting invocations after the per-turn
 * round-trip bound is reached. The thread stays at its last saved state.
 */
public class RunawayLoopException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String threadId;
    private final int maxRoundTrips;

    public RunawayLoopException(String threadId, int maxRoundTrips) {
        super("Thread " + threadId + " exceeded " + maxRoundTrips + " capability round trips in one turn");
        this.threadId = threadId;
        this.maxRoundTrips = maxRoundTrips;
    }

    public String getThreadId() {
        return threadId;
    }

    public int getMaxRoundTrips() {
        return maxRoundTrips;
    }
}
