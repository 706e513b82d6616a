package io.endsession.core.error;

/** Thrown when a handler descriptor collides with another one under strict ordering. */
public final class HandlerRegistrationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public HandlerRegistrationException(String message) {
        super(message, null);
    }
}
