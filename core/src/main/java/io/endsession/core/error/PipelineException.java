package io.endsession.core.error;

import io.endsession.core.pipeline.Stage;

/**
 * Abstract base for all pipeline exceptions. Never thrown directly, use one of the concrete
 * subclasses. Carries the stage that was executing when the error was raised, or {@code null}
 * when the error is not tied to a request (e.g. registry configuration).
 */
public abstract class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Stage stage;

    protected PipelineException(String message, Stage stage) {
        super(message);
        this.stage = stage;
    }

    protected PipelineException(String message, Throwable cause, Stage stage) {
        super(message, cause);
        this.stage = stage;
    }

    /** The stage in which the error occurred, or {@code null} if not stage-bound. */
    public Stage stage() {
        return stage;
    }
}
