package io.endsession.core.pipeline;

/**
 * Extension logic bound to one stage. Implementations inspect or mutate the context and may
 * signal at most one control operation.
 *
 * <p>
 * Handlers run on the transport's worker thread and may block. Any exception thrown is treated
 * as a handler fault and answered with {@code server_error}; an {@link InterruptedException}
 * cancels the request instead.
 *
 * @param <C> the stage context type
 */
@FunctionalInterface
public interface StageHandler<C extends StageContext> {

    void handle(C context) throws Exception;
}
