package io.endsession.standalone.config;

import java.util.List;

/**
 * Root configuration of the standalone end-session server.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param host                      bind address of the HTTP server
 * @param port                      listen port; {@code 0} picks an ephemeral port
 * @param logoutPaths               paths served by the logout endpoint
 * @param ignoreEndpointPermissions accept applications without the {@code ept:logout}
 *                                  permission
 * @param degradedMode              run without consulting the application registry
 * @param strictHandlerOrdering     reject handlers sharing a stage and priority
 * @param healthEnabled             expose the health endpoint
 * @param healthPath                health endpoint path
 * @param loggingFormat             json or text
 * @param loggingLevel              root log level
 * @param applications              statically registered client applications
 */
public record ServerConfig(
        String host,
        int port,
        List<String> logoutPaths,
        boolean ignoreEndpointPermissions,
        boolean degradedMode,
        boolean strictHandlerOrdering,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel,
        List<ApplicationConfig> applications) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private List<String> logoutPaths = List.of("/connect/logout");
        private boolean ignoreEndpointPermissions;
        private boolean degradedMode;
        private boolean strictHandlerOrdering;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";
        private List<ApplicationConfig> applications = List.of();

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder logoutPaths(List<String> logoutPaths) {
            this.logoutPaths = logoutPaths;
            return this;
        }

        public Builder ignoreEndpointPermissions(boolean ignoreEndpointPermissions) {
            this.ignoreEndpointPermissions = ignoreEndpointPermissions;
            return this;
        }

        public Builder degradedMode(boolean degradedMode) {
            this.degradedMode = degradedMode;
            return this;
        }

        public Builder strictHandlerOrdering(boolean strictHandlerOrdering) {
            this.strictHandlerOrdering = strictHandlerOrdering;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder applications(List<ApplicationConfig> applications) {
            this.applications = applications;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(
                    host,
                    port,
                    List.copyOf(logoutPaths),
                    ignoreEndpointPermissions,
                    degradedMode,
                    strictHandlerOrdering,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel,
                    List.copyOf(applications));
        }
    }
}
