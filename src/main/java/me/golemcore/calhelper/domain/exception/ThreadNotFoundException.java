package me.golemcore.calhelper.domain.exception;

public class ThreadNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String threadId;

    public ThreadNotFoundException(String threadId) {
        super("Thread not found: " + threadId);
        this.threadId = threadId;
    }

    public String getThreadId() {
        return threadId;
    }
}
