package io.endsession.standalone.adapter;

import io.endsession.core.model.EndpointResponse;
import io.endsession.core.model.HttpHeaders;
import io.endsession.core.model.InboundRequest;
import io.endsession.core.spi.TransportAdapter;
import io.javalin.http.Context;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport adapter for Javalin's {@link Context}.
 *
 * <p>
 * {@link #wrapRequest} copies the method as sent on the wire, the path, the raw query string,
 * the headers and the raw body. {@link #writeResponse} writes a redirect as {@code 302} with a
 * {@code Location} header and no body, and an inline response as its status with an
 * {@code application/json} body.
 *
 * <p>
 * This class is thread-safe: all state is local to each method invocation.
 */
public final class StandaloneAdapter implements TransportAdapter<Context> {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneAdapter.class);

    @Override
    public InboundRequest wrapRequest(Context ctx) {
        HttpHeaders headers = buildHeaders(ctx);
        String body = ctx.body();

        // Javalin maps unknown methods to INVALID; the servlet request keeps the original name.
        String method = ctx.req().getMethod();

        LOG.debug("wrapRequest: {} {} (body={} bytes, {})", method, ctx.path(), body.length(), headers);

        return new InboundRequest(method, ctx.path(), ctx.queryString(), headers, body);
    }

    @Override
    public void writeResponse(EndpointResponse response, Context ctx) {
        if (response.isRedirect()) {
            ctx.status(response.status());
            ctx.header("Location", response.location());
            ctx.result("");
        } else {
            ctx.status(response.status());
            ctx.contentType("application/json");
            ctx.result(response.payload().toString());
        }
        LOG.debug("writeResponse: type={}, status={}", response.type(), response.status());
    }

    /** Copies the servlet request's multi-valued headers. */
    private static HttpHeaders buildHeaders(Context ctx) {
        Map<String, List<String>> headersAll = new LinkedHashMap<>();
        var headerNames = ctx.req().getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                var values = ctx.req().getHeaders(name);
                List<String> valueList = new ArrayList<>();
                if (values != null) {
                    while (values.hasMoreElements()) {
                        valueList.add(values.nextElement());
                    }
                }
                headersAll.put(name.toLowerCase(Locale.ROOT), Collections.unmodifiableList(valueList));
            }
        }
        return HttpHeaders.ofMulti(headersAll);
    }
}
