package me.golemcore.calhelper.domain.exception;

/**
 * The language-model gateway call failed. Fatal to the running turn; the model
 * call is retried by resuming the thread.
 */
public class LlmGatewayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LlmGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
