package io.endsession.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Rendered outcome of one pipeline run. Exactly one of two shapes:
 *
 * <ul>
 * <li>{@link Type#REDIRECT}: {@code location} holds the redirect target, including any
 * response parameters as query parameters; {@code payload} is {@code null}.
 * <li>{@link Type#INLINE}: {@code payload} holds the JSON body; {@code location} is
 * {@code null}.
 * </ul>
 */
public final class EndpointResponse {

    /** The shape of the response. */
    public enum Type {
        REDIRECT,
        INLINE
    }

    private final Type type;
    private final int status;
    private final String location;
    private final JsonNode payload;

    private EndpointResponse(Type type, int status, String location, JsonNode payload) {
        this.type = type;
        this.status = status;
        this.location = location;
        this.payload = payload;
    }

    /** Creates a {@code 302 Found} redirect. */
    public static EndpointResponse redirect(String location) {
        Objects.requireNonNull(location, "location must not be null for REDIRECT");
        return new EndpointResponse(Type.REDIRECT, 302, location, null);
    }

    /** Creates an inline JSON response. */
    public static EndpointResponse inline(int status, JsonNode payload) {
        Objects.requireNonNull(payload, "payload must not be null for INLINE");
        return new EndpointResponse(Type.INLINE, status, null, payload);
    }

    public Type type() {
        return type;
    }

    public int status() {
        return status;
    }

    /** The redirect target. Only valid when {@code type() == REDIRECT}. */
    public String location() {
        return location;
    }

    /** The JSON body. Only valid when {@code type() == INLINE}. */
    public JsonNode payload() {
        return payload;
    }

    public boolean isRedirect() {
        return type == Type.REDIRECT;
    }

    public boolean isInline() {
        return type == Type.INLINE;
    }

    @Override
    public String toString() {
        return switch (type) {
            case REDIRECT -> "EndpointResponse[REDIRECT, location=" + location + "]";
            case INLINE -> "EndpointResponse[INLINE, status=" + status + "]";
        };
    }
}
