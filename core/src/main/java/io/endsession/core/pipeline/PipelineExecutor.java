package io.endsession.core.pipeline;

import io.endsession.core.error.HandlerFaultException;
import io.endsession.core.error.PipelineCancelledException;
import io.endsession.core.model.EndpointResponse;
import io.endsession.core.model.InboundRequest;
import io.endsession.core.model.ProtocolResponse;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives a {@link Transaction} through the four stages of an endpoint.
 *
 * <p>
 * For each stage the executor builds the stage context, runs the handler chain resolved from
 * the {@link HandlerRegistry} in order, then interprets the signaled outcome:
 * <ul>
 * <li>{@code REJECTED}: the error is copied into the response and the executor jumps to
 * {@link Stage#APPLY_RESPONSE} with default logic disabled.</li>
 * <li>{@code HANDLED}: the executor jumps to {@link Stage#APPLY_RESPONSE} with default logic
 * disabled.</li>
 * <li>{@code SKIPPED}: the stage's default logic is skipped; the next stage runs
 * normally.</li>
 * <li>nothing signaled: the stage's default logic runs.</li>
 * </ul>
 * Once a handler signals an outcome, the rest of that stage's chain is not invoked. The
 * response stage always runs; its handlers may still adjust the response of a handled or
 * rejected request.
 *
 * <p>
 * A handler (or default) throwing an exception aborts the run: the fault is logged and the
 * request is answered with {@code server_error}. A cancelled run (interrupted worker thread)
 * throws {@link PipelineCancelledException} and renders nothing.
 *
 * <p>
 * Thread-safe: all per-request state lives in the transaction.
 */
public final class PipelineExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineExecutor.class);

    static final String DEFAULT_HANDLER_NAME = "<default>";

    private final HandlerRegistry registry;
    private final EndpointBinding binding;
    private final ResponseRenderer renderer;

    public PipelineExecutor(HandlerRegistry registry, EndpointBinding binding) {
        this(registry, binding, new ResponseRenderer());
    }

    public PipelineExecutor(HandlerRegistry registry, EndpointBinding binding, ResponseRenderer renderer) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.binding = Objects.requireNonNull(binding, "binding must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Processes one inbound request.
     *
     * @param request   the transport-neutral request
     * @param requestId correlation id for logs, may be null
     * @return the rendered response
     * @throws PipelineCancelledException if the worker thread was interrupted
     */
    public EndpointResponse execute(InboundRequest request, String requestId) {
        return execute(new Transaction(binding.name(), requestId, request));
    }

    /**
     * Processes a caller-built transaction. The transaction must be fresh.
     *
     * @throws PipelineCancelledException if the worker thread was interrupted
     */
    public EndpointResponse execute(Transaction transaction) {
        Objects.requireNonNull(transaction, "transaction must not be null");
        if (transaction.requestId() != null) {
            MDC.put("request_id", transaction.requestId());
        }
        MDC.put("endpoint", transaction.endpoint());
        try {
            return run(transaction);
        } finally {
            MDC.remove("request_id");
            MDC.remove("endpoint");
        }
    }

    private EndpointResponse run(Transaction transaction) {
        LOG.debug(
                "Pipeline started: endpoint={}, method={}, path={}",
                transaction.endpoint(),
                transaction.httpRequest().method(),
                transaction.httpRequest().path());
        try {
            for (Stage stage : Stage.PROCESSING) {
                runStage(stage, transaction);
                if (transaction.disposition().isTerminal()) {
                    LOG.debug("Short-circuit after {}: disposition={}", stage, transaction.disposition());
                    break;
                }
            }
            runStage(Stage.APPLY_RESPONSE, transaction);
        } catch (HandlerFaultException e) {
            LOG.warn(
                    "Handler fault: endpoint={}, stage={}, handler={}: {}",
                    transaction.endpoint(),
                    e.stage(),
                    e.handlerName(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(),
                    e);
            return renderer.renderServerError();
        }

        EndpointResponse response = renderer.render(transaction);
        LOG.debug("Pipeline complete: disposition={}, response={}", transaction.disposition(), response);
        return response;
    }

    private void runStage(Stage stage, Transaction transaction) {
        checkCancelled(stage);
        transaction.enterStage(stage);
        boolean defaultsEnabled = !transaction.disposition().isTerminal();

        StageContext context;
        try {
            context = binding.createContext(stage, transaction);
        } catch (RuntimeException e) {
            throw new HandlerFaultException(
                    "Failed to create the " + stage + " context", e, stage, DEFAULT_HANDLER_NAME);
        }

        List<HandlerDescriptor<?>> chain = registry.resolve(stage);
        for (HandlerDescriptor<?> descriptor : chain) {
            if (context.signaled() != Disposition.CONTINUE) {
                break;
            }
            if (!descriptor.accepts(context)) {
                continue;
            }
            checkCancelled(stage);
            invoke(stage, descriptor.name(), () -> descriptor.invoke(context));
        }

        switch (context.signaled()) {
            case REJECTED -> {
                copyError(context, transaction.response());
                LOG.info(
                        "Request rejected at {}: error={}, description={}",
                        stage,
                        context.error(),
                        context.errorDescription());
            }
            case HANDLED -> LOG.debug("Request handled at {}", stage);
            case SKIPPED -> {
                LOG.debug("Default logic skipped at {}", stage);
                transaction.resetSkipped();
            }
            case CONTINUE -> {
                if (defaultsEnabled) {
                    invoke(stage, DEFAULT_HANDLER_NAME, () -> binding.applyDefaults(context));
                    if (context.isRejected()) {
                        copyError(context, transaction.response());
                        LOG.info(
                                "Request rejected at {}: error={}, description={}",
                                stage,
                                context.error(),
                                context.errorDescription());
                    }
                }
            }
        }
        transaction.markTraversed(stage);
    }

    private static void invoke(Stage stage, String handlerName, Invocation invocation) {
        try {
            invocation.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException("Request cancelled during " + stage, e, stage);
        } catch (PipelineCancelledException | HandlerFaultException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerFaultException(
                    "Handler '" + handlerName + "' failed during " + stage, e, stage, handlerName);
        }
    }

    private static void checkCancelled(Stage stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineCancelledException("Request cancelled before " + stage, stage);
        }
    }

    private static void copyError(StageContext context, ProtocolResponse response) {
        response.setError(context.error());
        response.setErrorDescription(context.errorDescription());
        response.setErrorUri(context.errorUri());
    }

    @FunctionalInterface
    private interface Invocation {
        void run() throws Exception;
    }
}
