package io.endsession.standalone.http;

import io.endsession.core.error.PipelineCancelledException;
import io.endsession.core.model.EndpointResponse;
import io.endsession.core.model.HttpHeaders;
import io.endsession.core.model.InboundRequest;
import io.endsession.core.pipeline.PipelineExecutor;
import io.endsession.standalone.adapter.StandaloneAdapter;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the logout endpoint: wraps the Javalin request, runs it through the pipeline and
 * writes the rendered response.
 *
 * <p>
 * Every response carries an {@code X-Request-ID} header, echoed from the request or generated.
 * A cancelled pipeline run renders nothing; the client receives an empty {@code 503}.
 */
public final class EndSessionHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(EndSessionHandler.class);

    private final PipelineExecutor executor;
    private final StandaloneAdapter adapter;

    public EndSessionHandler(PipelineExecutor executor, StandaloneAdapter adapter) {
        this.executor = executor;
        this.adapter = adapter;
    }

    @Override
    public void handle(Context ctx) {
        InboundRequest request = adapter.wrapRequest(ctx);
        String requestId = request.requestId();
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        ctx.header(HttpHeaders.REQUEST_ID, requestId);

        EndpointResponse response;
        try {
            response = executor.execute(request, requestId);
        } catch (PipelineCancelledException e) {
            LOG.warn("Logout request {} cancelled at {}", requestId, e.stage());
            ctx.status(503);
            ctx.result("");
            return;
        }
        adapter.writeResponse(response, ctx);
    }
}
