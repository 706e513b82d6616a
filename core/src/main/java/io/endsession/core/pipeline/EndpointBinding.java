package io.endsession.core.pipeline;

/**
 * Binds the generic four-stage pipeline to one concrete endpoint. A binding creates the
 * endpoint-specific context for each stage and supplies each stage's built-in default logic.
 *
 * <p>
 * Implementations MUST be thread-safe; one binding instance serves all requests.
 */
public interface EndpointBinding {

    /** Endpoint name used in logs and on the transaction, e.g. {@code logout}. */
    String name();

    /**
     * Creates the context handed to the given stage's handlers.
     *
     * @param stage       the stage about to run
     * @param transaction the request's transaction
     * @return a new context bound to the transaction
     */
    StageContext createContext(Stage stage, Transaction transaction);

    /**
     * Runs the built-in logic of the context's stage. Only called when no handler signaled an
     * outcome and no earlier stage handled or rejected the request. The default may itself
     * reject through the context.
     *
     * @param context the context created by {@link #createContext}
     * @throws Exception on collaborator failure; the executor turns it into a handler fault
     */
    void applyDefaults(StageContext context) throws Exception;
}
