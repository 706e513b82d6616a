package io.endsession.standalone.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.List;

/**
 * Liveness probe. Answers {@code 200} with {@code {"status":"UP"}} and the logout paths being
 * served. Registered on its own route, outside the logout pipeline.
 */
public final class HealthHandler implements Handler {

    private final String body;

    public HealthHandler(List<String> logoutPaths) {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode node = mapper.createObjectNode();
        node.put("status", "UP");
        logoutPaths.forEach(node.putArray("logoutPaths")::add);
        this.body = node.toString();
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body);
    }
}
