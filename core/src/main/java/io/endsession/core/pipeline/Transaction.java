package io.endsession.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import io.endsession.core.error.StateNotAvailableException;
import io.endsession.core.model.InboundRequest;
import io.endsession.core.model.Parameter;
import io.endsession.core.model.ProtocolRequest;
import io.endsession.core.model.ProtocolResponse;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request container carried through all stages: the inbound HTTP request, the bound
 * protocol request, the response under construction, a property bag for cross-handler
 * communication, and the current {@link Disposition}.
 *
 * <p>
 * A transaction is created when a request arrives, owned by a single {@link PipelineExecutor}
 * run and discarded once the response is rendered. Not thread-safe.
 */
public final class Transaction {

    /**
     * Property holding a structured payload emitted verbatim when a handler calls {@link
     * StageContext#handleRequest()}.
     */
    public static final String CUSTOM_RESPONSE_PROPERTY = "custom_response";

    private final String endpoint;
    private final String requestId;
    private final InboundRequest httpRequest;
    private final ProtocolResponse response = new ProtocolResponse();
    private final Map<String, Parameter> properties = new LinkedHashMap<>();
    private final EnumSet<Stage> traversed = EnumSet.noneOf(Stage.class);

    private ProtocolRequest request;
    private Disposition disposition = Disposition.CONTINUE;
    private Stage currentStage;
    private String redirectTarget;

    public Transaction(String endpoint, String requestId, InboundRequest httpRequest) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.requestId = requestId;
        this.httpRequest = Objects.requireNonNull(httpRequest, "httpRequest must not be null");
    }

    /** Name of the endpoint binding processing this transaction (e.g. {@code logout}). */
    public String endpoint() {
        return endpoint;
    }

    /** Correlation id supplied by the transport, may be null. */
    public String requestId() {
        return requestId;
    }

    public InboundRequest httpRequest() {
        return httpRequest;
    }

    /**
     * Returns the bound protocol request.
     *
     * @throws StateNotAvailableException if no request has been bound yet
     */
    public ProtocolRequest request() {
        if (request == null) {
            throw new StateNotAvailableException(
                    "The request is not available before it has been extracted", currentStage);
        }
        return request;
    }

    public boolean hasRequest() {
        return request != null;
    }

    public void setRequest(ProtocolRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    public ProtocolResponse response() {
        return response;
    }

    // --- Property bag ---

    /** Returns the property with the given key, or {@code null} if absent. */
    public Parameter getProperty(String key) {
        return properties.get(key);
    }

    public void setProperty(String key, Parameter value) {
        if (value == null) {
            properties.remove(key);
        } else {
            properties.put(key, value);
        }
    }

    public void setProperty(String key, String value) {
        setProperty(key, value != null ? Parameter.of(value) : null);
    }

    public void setProperty(String key, List<String> values) {
        setProperty(key, values != null ? Parameter.of(values) : null);
    }

    public void setProperty(String key, JsonNode value) {
        setProperty(key, value != null ? Parameter.json(value) : null);
    }

    /** Unmodifiable view of the property bag. */
    public Map<String, Parameter> properties() {
        return Collections.unmodifiableMap(properties);
    }

    // --- Disposition and stage tracking ---

    public Disposition disposition() {
        return disposition;
    }

    public boolean isHandled() {
        return disposition == Disposition.HANDLED;
    }

    public boolean isRejected() {
        return disposition == Disposition.REJECTED;
    }

    /** True once the given stage's handler chain has completed, whatever its outcome. */
    public boolean hasTraversed(Stage stage) {
        return traversed.contains(stage);
    }

    /**
     * Redirect target chosen by the response stage, or {@code null} for an inline response.
     */
    public String redirectTarget() {
        return redirectTarget;
    }

    public void setRedirectTarget(String redirectTarget) {
        this.redirectTarget = redirectTarget;
    }

    void enterStage(Stage stage) {
        this.currentStage = stage;
    }

    void markTraversed(Stage stage) {
        traversed.add(stage);
    }

    /**
     * Records a signaled outcome. {@link Disposition#SKIPPED} never overwrites a terminal
     * disposition from an earlier stage.
     */
    void signal(Disposition signaled) {
        if (signaled == Disposition.SKIPPED && disposition.isTerminal()) {
            return;
        }
        this.disposition = signaled;
    }

    /** Clears a per-stage {@link Disposition#SKIPPED} before the next stage starts. */
    void resetSkipped() {
        if (disposition == Disposition.SKIPPED) {
            disposition = Disposition.CONTINUE;
        }
    }

    @Override
    public String toString() {
        return "Transaction[endpoint=" + endpoint + ", stage=" + currentStage + ", disposition=" + disposition + "]";
    }
}
