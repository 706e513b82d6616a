package io.endsession.core.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.endsession.core.model.EndpointResponse;
import io.endsession.core.model.OAuthConstants;
import io.endsession.core.model.Parameter;
import io.endsession.core.model.ProtocolResponse;

/**
 * Turns a finished {@link Transaction} into an {@link EndpointResponse}.
 *
 * <p>
 * Rendering rules, in order:
 * <ol>
 * <li>Handled with a {@value Transaction#CUSTOM_RESPONSE_PROPERTY} property: inline, 200, the
 * property value as payload.</li>
 * <li>Error response: inline, status derived from the error code, all response parameters as
 * payload. Errors are never redirected.</li>
 * <li>Redirect target set: {@code 302} to the target with all response parameters appended as
 * query parameters.</li>
 * <li>Otherwise: inline, 200, all response parameters as payload.</li>
 * </ol>
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ResponseRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SERVER_ERROR_DESCRIPTION = "An internal error occurred while processing the request.";

    /**
     * Renders the transaction's response.
     *
     * @param transaction a transaction that went through the pipeline
     * @return the rendered response
     */
    public EndpointResponse render(Transaction transaction) {
        ProtocolResponse response = transaction.response();
        Parameter custom = transaction.getProperty(Transaction.CUSTOM_RESPONSE_PROPERTY);
        if (transaction.isHandled() && custom != null) {
            return EndpointResponse.inline(200, custom.toJson());
        }
        if (response.isError()) {
            return EndpointResponse.inline(statusFor(response.error()), toPayload(response));
        }
        if (transaction.redirectTarget() != null) {
            return EndpointResponse.redirect(
                    FormUrlEncoding.appendQuery(transaction.redirectTarget(), response.parameters()));
        }
        return EndpointResponse.inline(200, toPayload(response));
    }

    /** Renders the generic response used when a handler faults. */
    public EndpointResponse renderServerError() {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put(OAuthConstants.Parameters.ERROR, OAuthConstants.Errors.SERVER_ERROR);
        payload.put(OAuthConstants.Parameters.ERROR_DESCRIPTION, SERVER_ERROR_DESCRIPTION);
        return EndpointResponse.inline(500, payload);
    }

    /** HTTP status for an error code. */
    static int statusFor(String error) {
        return switch (error) {
            case OAuthConstants.Errors.SERVER_ERROR -> 500;
            case OAuthConstants.Errors.TEMPORARILY_UNAVAILABLE -> 503;
            default -> 400;
        };
    }

    private static ObjectNode toPayload(ProtocolResponse response) {
        ObjectNode payload = MAPPER.createObjectNode();
        response.parameters().forEach((name, value) -> payload.set(name, value.toJson()));
        return payload;
    }
}
