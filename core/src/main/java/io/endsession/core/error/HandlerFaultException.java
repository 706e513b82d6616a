package io.endsession.core.error;

import io.endsession.core.pipeline.Stage;

/**
 * Thrown when a registered handler, or a stage's built-in logic, fails with an uncaught
 * exception. The executor catches these, logs them and answers the request with a generic
 * {@code server_error}. Never retried.
 */
public final class HandlerFaultException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final String handlerName;

    public HandlerFaultException(String message, Throwable cause, Stage stage, String handlerName) {
        super(message, cause, stage);
        this.handlerName = handlerName;
    }

    /** Name of the failing handler; the stage's built-in logic is reported as {@code <default>}. */
    public String handlerName() {
        return handlerName;
    }
}
