package io.endsession.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Environment variables take precedence over YAML values. A variable counts as "set" only if it
 * is defined and non-blank after trimming.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path minimalConfigPath;
    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        minimalConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/minimal-config.yaml")
                .toURI());
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        void serverHostAndPort() {
            envVars.put("SERVER_HOST", "10.0.0.1");
            envVars.put("SERVER_PORT", "9090");
            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.host()).isEqualTo("10.0.0.1");
            assertThat(config.port()).isEqualTo(9090);
        }

        @Test
        void logoutPaths_areCommaSeparated() {
            envVars.put("LOGOUT_PATHS", " /signout , /connect/endsession ,");
            ServerConfig config = ConfigLoader.load(minimalConfigPath, envLookup());

            assertThat(config.logoutPaths()).containsExactly("/signout", "/connect/endsession");
        }

        @Test
        void endpointFlags() {
            envVars.put("IGNORE_ENDPOINT_PERMISSIONS", "false");
            envVars.put("DEGRADED_MODE", "true");
            envVars.put("STRICT_HANDLER_ORDERING", "false");
            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.ignoreEndpointPermissions()).isFalse();
            assertThat(config.degradedMode()).isTrue();
            assertThat(config.strictHandlerOrdering()).isFalse();
        }

        @Test
        void healthAndLogging() {
            envVars.put("HEALTH_ENABLED", "true");
            envVars.put("HEALTH_PATH", "/live");
            envVars.put("LOG_FORMAT", "json");
            envVars.put("LOG_LEVEL", "WARN");
            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.healthEnabled()).isTrue();
            assertThat(config.healthPath()).isEqualTo("/live");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }
    }

    @Nested
    @DisplayName("Unset semantics")
    class Unset {

        @Test
        void blankValue_keepsYamlValue() {
            envVars.put("SERVER_HOST", "   ");
            envVars.put("LOG_LEVEL", "");
            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.host()).isEqualTo("127.0.0.1");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        void valuesAreTrimmed() {
            envVars.put("SERVER_PORT", " 7070 ");
            ServerConfig config = ConfigLoader.load(minimalConfigPath, envLookup());

            assertThat(config.port()).isEqualTo(7070);
        }

        @Test
        void applications_areNotAffected() {
            envVars.put("DEGRADED_MODE", "true");
            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.applications()).hasSize(2);
        }
    }

    @Test
    void nonNumericPort_isReported() {
        envVars.put("SERVER_PORT", "eighty");

        assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("SERVER_PORT");
    }
}
