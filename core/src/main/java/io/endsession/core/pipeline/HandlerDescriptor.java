package io.endsession.core.pipeline;

import java.util.Objects;

/**
 * Immutable description of a handler: a unique name, the stage it is bound to, the context type
 * it accepts, a priority and the handler itself.
 *
 * <p>
 * Lower priorities run earlier. Ties are broken by registration order in the {@link
 * HandlerRegistry}. A handler is only invoked with contexts that are instances of its context
 * type, so a handler typed on {@link StageContext} sees every endpoint's context for its stage.
 *
 * @param <C> the stage context type
 */
public final class HandlerDescriptor<C extends StageContext> {

    /** Priority used when none is specified. */
    public static final int DEFAULT_PRIORITY = 100_000;

    private final String name;
    private final Stage stage;
    private final Class<C> contextType;
    private final int priority;
    private final StageHandler<C> handler;

    private HandlerDescriptor(String name, Stage stage, Class<C> contextType, int priority, StageHandler<C> handler) {
        this.name = name;
        this.stage = stage;
        this.contextType = contextType;
        this.priority = priority;
        this.handler = handler;
    }

    /**
     * Returns a builder for a handler accepting contexts of the given type.
     *
     * @param contextType the context class, e.g. {@code ValidateLogoutRequestContext.class}
     */
    public static <C extends StageContext> Builder<C> builder(Class<C> contextType) {
        return new Builder<>(contextType);
    }

    public String name() {
        return name;
    }

    public Stage stage() {
        return stage;
    }

    public int priority() {
        return priority;
    }

    /** True if this handler accepts the given context. */
    public boolean accepts(StageContext context) {
        return context.stage() == stage && contextType.isInstance(context);
    }

    /**
     * Invokes the handler. Callers must check {@link #accepts(StageContext)} first.
     *
     * @throws ClassCastException if the context is not an instance of the context type
     */
    void invoke(StageContext context) throws Exception {
        handler.handle(contextType.cast(context));
    }

    @Override
    public String toString() {
        return "HandlerDescriptor[" + name + ", stage=" + stage + ", priority=" + priority + "]";
    }

    /** Builder for {@link HandlerDescriptor}. Name, stage and handler are required. */
    public static final class Builder<C extends StageContext> {

        private final Class<C> contextType;
        private String name;
        private Stage stage;
        private int priority = DEFAULT_PRIORITY;
        private StageHandler<C> handler;

        Builder(Class<C> contextType) {
            this.contextType = Objects.requireNonNull(contextType, "contextType must not be null");
        }

        public Builder<C> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<C> stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder<C> priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder<C> handler(StageHandler<C> handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Builds the descriptor.
         *
         * @throws IllegalArgumentException if the name is null or blank
         * @throws NullPointerException     if the stage or the handler is missing
         */
        public HandlerDescriptor<C> build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("handler name must not be null or blank");
            }
            Objects.requireNonNull(stage, "stage must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
            return new HandlerDescriptor<>(name, stage, contextType, priority, handler);
        }
    }
}
