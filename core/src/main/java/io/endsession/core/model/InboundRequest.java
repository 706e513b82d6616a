package io.endsession.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Transport-neutral snapshot of an inbound HTTP request. Transport adapters produce instances
 * of this record by copying their native request; the pipeline never touches transport types.
 *
 * @param method      the HTTP method as sent (e.g. {@code GET})
 * @param path        the request path (e.g. {@code /connect/logout})
 * @param queryString the raw query string without leading {@code ?}, nullable
 * @param headers     case-insensitive request headers
 * @param body        the raw request body, nullable
 */
public record InboundRequest(String method, String path, String queryString, HttpHeaders headers, String body) {

    private static final String FORM_MEDIA_TYPE = "application/x-www-form-urlencoded";

    public InboundRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        headers = headers != null ? headers : HttpHeaders.empty();
    }

    /** The {@code Content-Type} header, or {@code null}. */
    public String contentType() {
        return headers.first(HttpHeaders.CONTENT_TYPE);
    }

    /** The {@code X-Request-ID} header, or {@code null}. */
    public String requestId() {
        return headers.first(HttpHeaders.REQUEST_ID);
    }

    /** True if the body is declared as {@code application/x-www-form-urlencoded}. */
    public boolean isFormEncoded() {
        String contentType = contentType();
        return contentType != null && contentType.trim().toLowerCase(Locale.ROOT).startsWith(FORM_MEDIA_TYPE);
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }
}
