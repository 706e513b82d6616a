package io.endsession.core.error;

import io.endsession.core.pipeline.Stage;

/**
 * Thrown when a stage context field is read before the stage that produces it has run. This
 * always indicates a handler ordering bug.
 */
public final class StateNotAvailableException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public StateNotAvailableException(String message, Stage stage) {
        super(message, stage);
    }
}
