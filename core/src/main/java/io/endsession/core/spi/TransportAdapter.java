package io.endsession.core.spi;

import io.endsession.core.model.EndpointResponse;
import io.endsession.core.model.InboundRequest;

/**
 * Bridges an HTTP server's native request/response object and the pipeline.
 *
 * <p>
 * {@link #wrapRequest} copies everything the pipeline needs into an {@link InboundRequest};
 * the pipeline never sees the native type. {@link #writeResponse} writes the rendered response
 * back: a {@code 302} with a {@code Location} header for redirects, or the status and an
 * {@code application/json} body for inline responses.
 *
 * <p>
 * Implementations MUST be thread-safe. A single adapter instance is shared across the server's
 * worker threads.
 *
 * @param <R> the server-native exchange type (e.g. Javalin {@code Context})
 */
public interface TransportAdapter<R> {

    /**
     * Copies the native request into a transport-neutral request.
     *
     * @param nativeRequest the server-native exchange
     * @return the request snapshot
     */
    InboundRequest wrapRequest(R nativeRequest);

    /**
     * Writes the rendered response to the native exchange.
     *
     * @param response     the rendered response
     * @param nativeTarget the server-native exchange to write to
     */
    void writeResponse(EndpointResponse response, R nativeTarget);
}
