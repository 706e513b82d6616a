package io.endsession.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code endsession.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults of {@link ServerConfig.Builder}. Environment variables take
 * precedence over YAML values. A variable counts as "set" only if it is defined AND its trimmed
 * value is non-empty; otherwise the YAML value is used. Applications can only be declared in
 * YAML.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "endsession.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file, applying environment variable
     * overrides from the supplied lookup function. Returning {@code null} from {@code envLookup}
     * means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            } else if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());

        JsonNode endpoint = root.path("endpoint");
        if (endpoint.has("logout-paths")) builder.logoutPaths(textList(endpoint.get("logout-paths"), "logout-paths"));
        if (endpoint.has("ignore-endpoint-permissions"))
            builder.ignoreEndpointPermissions(endpoint.get("ignore-endpoint-permissions").asBoolean());
        if (endpoint.has("degraded-mode")) builder.degradedMode(endpoint.get("degraded-mode").asBoolean());
        if (endpoint.has("strict-handler-ordering"))
            builder.strictHandlerOrdering(endpoint.get("strict-handler-ordering").asBoolean());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        if (root.has("applications")) builder.applications(applications(root.get("applications")));

        // --- Environment variable overlay ---

        envString(envLookup, "SERVER_HOST", builder::host);
        envInt(envLookup, "SERVER_PORT", builder::port);
        envString(envLookup, "LOGOUT_PATHS", value -> builder.logoutPaths(splitCommaSeparated(value)));
        envBool(envLookup, "IGNORE_ENDPOINT_PERMISSIONS", builder::ignoreEndpointPermissions);
        envBool(envLookup, "DEGRADED_MODE", builder::degradedMode);
        envBool(envLookup, "STRICT_HANDLER_ORDERING", builder::strictHandlerOrdering);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static List<ApplicationConfig> applications(JsonNode node) {
        if (!node.isArray()) {
            throw new ConfigLoadException("'applications' must be a list");
        }
        List<ApplicationConfig> applications = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode app = node.get(i);
            String id = app.path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new ConfigLoadException("applications[" + i + "].id is required");
            }
            applications.add(new ApplicationConfig(
                    id,
                    app.has("permissions") ? textList(app.get("permissions"), "permissions") : List.of(),
                    app.has("post-logout-redirect-uris")
                            ? textList(app.get("post-logout-redirect-uris"), "post-logout-redirect-uris")
                            : List.of()));
        }
        return applications;
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static List<String> textList(JsonNode node, String field) {
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw new ConfigLoadException("'" + field + "' must be a string or a list of strings");
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> values.add(element.asText()));
        return values;
    }

    private static List<String> splitCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
