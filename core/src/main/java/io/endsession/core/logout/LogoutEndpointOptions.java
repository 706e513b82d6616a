package io.endsession.core.logout;

import java.util.List;
import java.util.Objects;

/**
 * Options of the logout endpoint.
 *
 * @param endpointPaths             request paths served by the endpoint, never empty
 * @param ignoreEndpointPermissions when true, the first application registering the redirect URI
 *                                  is accepted without checking its {@code ept:logout} permission
 * @param degradedMode              when true, no application store is consulted and any
 *                                  well-formed redirect URI is honored
 */
public record LogoutEndpointOptions(
        List<String> endpointPaths, boolean ignoreEndpointPermissions, boolean degradedMode) {

    public static final String DEFAULT_PATH = "/connect/logout";

    public LogoutEndpointOptions {
        endpointPaths = endpointPaths == null || endpointPaths.isEmpty()
                ? List.of(DEFAULT_PATH)
                : List.copyOf(endpointPaths);
        for (String path : endpointPaths) {
            if (path.isBlank() || !path.startsWith("/")) {
                throw new IllegalArgumentException("endpoint path must start with '/': '" + path + "'");
            }
        }
    }

    /** Options with the default path, permission enforcement on and degraded mode off. */
    public static LogoutEndpointOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True if the given request path is served by the endpoint. Trailing slashes are ignored. */
    public boolean matches(String path) {
        if (path == null) {
            return false;
        }
        String normalized = path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return endpointPaths.contains(normalized);
    }

    /** Builder for {@link LogoutEndpointOptions}. */
    public static final class Builder {

        private List<String> endpointPaths = List.of(DEFAULT_PATH);
        private boolean ignoreEndpointPermissions;
        private boolean degradedMode;

        private Builder() {}

        public Builder endpointPaths(List<String> endpointPaths) {
            this.endpointPaths = Objects.requireNonNull(endpointPaths, "endpointPaths must not be null");
            return this;
        }

        public Builder endpointPaths(String... endpointPaths) {
            return endpointPaths(List.of(endpointPaths));
        }

        public Builder ignoreEndpointPermissions(boolean ignoreEndpointPermissions) {
            this.ignoreEndpointPermissions = ignoreEndpointPermissions;
            return this;
        }

        public Builder degradedMode(boolean degradedMode) {
            this.degradedMode = degradedMode;
            return this;
        }

        public LogoutEndpointOptions build() {
            return new LogoutEndpointOptions(endpointPaths, ignoreEndpointPermissions, degradedMode);
        }
    }
}
