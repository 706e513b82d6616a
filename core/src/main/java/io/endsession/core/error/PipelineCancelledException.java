package io.endsession.core.error;

import io.endsession.core.pipeline.Stage;

/**
 * Thrown when the worker thread running a pipeline is interrupted. The transaction is discarded
 * and no response is rendered.
 */
public final class PipelineCancelledException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public PipelineCancelledException(String message, Stage stage) {
        super(message, stage);
    }

    public PipelineCancelledException(String message, Throwable cause, Stage stage) {
        super(message, cause, stage);
    }
}
