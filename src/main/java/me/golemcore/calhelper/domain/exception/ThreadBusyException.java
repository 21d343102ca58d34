package me.golemcore.calhelper.domain.exception;

/**
 * Thrown when a thread is already being processed by another turn.
 */
public class ThreadBusyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String threadId;

    public ThreadBusyException(String threadId) {
        super("Thread is busy: " + threadId);
        this.threadId = threadId;
    }

    public String getThreadId() {
        return threadId;
    }
}
