package io.endsession.standalone.http;

import io.endsession.core.logout.LogoutEndpoint;
import io.endsession.core.logout.LogoutEndpointOptions;
import io.endsession.core.pipeline.HandlerRegistry;
import io.endsession.core.pipeline.PipelineExecutor;
import io.endsession.core.spi.ApplicationResolver;
import io.endsession.core.spi.ConfirmationContributor;
import io.endsession.standalone.adapter.StandaloneAdapter;
import io.endsession.standalone.config.ConfigLoader;
import io.endsession.standalone.config.ServerConfig;
import io.endsession.standalone.resolver.InMemoryApplicationResolver;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the server startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure logging</li>
 * <li>Build the application registry from the {@code applications} section</li>
 * <li>Build the handler registry, the logout endpoint and the pipeline executor</li>
 * <li>Start the Javalin HTTP server</li>
 * </ol>
 *
 * <p>
 * This class is separate from {@link io.endsession.standalone.StandaloneMain} so that tests can
 * start a server without going through {@code main()}. The handler registry stays open after
 * startup; handlers registered later apply to subsequent requests.
 */
public final class ServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(ServerApp.class);

    /**
     * Methods routed to the logout endpoint; the endpoint itself rejects all but GET and POST.
     * Any other method on a logout path reaches the endpoint through the 404 error handler.
     */
    private static final List<HandlerType> ROUTED_METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS,
            HandlerType.TRACE);

    private final Javalin app;
    private final HandlerRegistry registry;

    private ServerApp(Javalin app, HandlerRegistry registry) {
        this.app = app;
        this.registry = registry;
    }

    /**
     * Loads the configuration named by the arguments and starts a server.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/config.yaml})
     * @return a running server
     * @throws io.endsession.standalone.config.ConfigLoadException if the configuration is invalid
     */
    public static ServerApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config, ConfirmationContributor.NONE);
    }

    /**
     * Starts a server from an already loaded configuration.
     *
     * @param config       the server configuration
     * @param confirmation fills inline logout confirmations
     * @return a running server
     */
    public static ServerApp start(ServerConfig config, ConfirmationContributor confirmation) {
        long startTime = System.nanoTime();

        ApplicationResolver resolver = config.degradedMode()
                ? null
                : InMemoryApplicationResolver.fromConfig(config.applications());

        HandlerRegistry registry = new HandlerRegistry(config.strictHandlerOrdering());
        LogoutEndpointOptions options = LogoutEndpointOptions.builder()
                .endpointPaths(config.logoutPaths())
                .ignoreEndpointPermissions(config.ignoreEndpointPermissions())
                .degradedMode(config.degradedMode())
                .build();
        LogoutEndpoint endpoint = new LogoutEndpoint(options, resolver, confirmation);
        EndSessionHandler handler =
                new EndSessionHandler(new PipelineExecutor(registry, endpoint), new StandaloneAdapter());

        Javalin app = Javalin.create();

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler(options.endpointPaths()));
        }
        for (String path : options.endpointPaths()) {
            for (HandlerType method : ROUTED_METHODS) {
                app.addHttpHandler(method, path, handler);
            }
        }
        // Unrouted and non-standard methods surface as 404 and are answered by the endpoint.
        app.error(404, ctx -> {
            if (options.matches(ctx.path())) {
                handler.handle(ctx);
            }
        });

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "endsession started: port={}, logoutPaths={}, applications={}, degradedMode={}, "
                        + "ignoreEndpointPermissions={}, startupMs={}",
                app.port(),
                options.endpointPaths(),
                config.degradedMode() ? 0 : config.applications().size(),
                config.degradedMode(),
                config.ignoreEndpointPermissions(),
                elapsedMs);

        return new ServerApp(app, registry);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    /** Returns the handler registry backing the logout pipeline. */
    public HandlerRegistry registry() {
        return registry;
    }

    public void stop() {
        app.stop();
        LOG.info("endsession stopped");
    }
}
