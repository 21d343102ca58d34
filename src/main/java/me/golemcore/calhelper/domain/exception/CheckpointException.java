package me.golemcore.calhelper.domain.exception;

/**
 * Checkpoint backend I/O failure. Fatal to the running turn.
 */
public class CheckpointException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
