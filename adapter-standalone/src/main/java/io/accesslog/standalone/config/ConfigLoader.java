package io.accesslog.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code access-log-server.yaml} from the current
 * directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults from {@link ServerConfig.Builder}. Env
 * vars take precedence over YAML values. An env var is considered "set" if and
 * only if it is defined AND its trimmed value is non-empty; empty or
 * whitespace-only values leave the YAML value in place. List-valued env vars
 * are comma-separated.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "access-log-server.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file path, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return a fully constructed {@link ServerConfig} with defaults applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file path, applying
     * environment variable overrides from the supplied lookup function.
     * Returning {@code null} from {@code envLookup} means the variable is not
     * defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return a fully constructed {@link ServerConfig} with env overrides applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                root = YAML_MAPPER.createObjectNode();
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
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

        JsonNode accessLog = root.path("access-log");
        if (accessLog.has("format")) builder.accessLogFormat(accessLog.get("format").asText());
        if (accessLog.has("logger")) builder.accessLogLogger(accessLog.get("logger").asText());
        if (accessLog.has("exclude")) builder.excludePaths(textList(accessLog.get("exclude")));
        if (accessLog.has("exclude-regex"))
            builder.excludeRegexes(textList(accessLog.get("exclude-regex")));
        if (accessLog.has("header-dump-tags"))
            builder.headerDumpTags(accessLog.get("header-dump-tags").asBoolean());

        JsonNode span = accessLog.path("span");
        if (span.has("enabled")) builder.spanEnabled(span.get("enabled").asBoolean());
        if (span.has("header")) builder.spanHeader(span.get("header").asText());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "SERVER_HOST", builder::host);
        envInt(envLookup, "SERVER_PORT", builder::port);
        envString(envLookup, "ACCESS_LOG_FORMAT", builder::accessLogFormat);
        envString(envLookup, "ACCESS_LOG_LOGGER", builder::accessLogLogger);
        envList(envLookup, "ACCESS_LOG_EXCLUDE", builder::excludePaths);
        envList(envLookup, "ACCESS_LOG_EXCLUDE_REGEX", builder::excludeRegexes);
        envBool(envLookup, "ACCESS_LOG_HEADER_DUMP_TAGS", builder::headerDumpTags);
        envBool(envLookup, "ACCESS_LOG_SPAN_ENABLED", builder::spanEnabled);
        envString(envLookup, "ACCESS_LOG_SPAN_HEADER", builder::spanHeader);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
     */
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
                throw new ConfigLoadException("Environment variable " + envVar + " is not an integer: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static void envList(Function<String, String> envLookup, String envVar, Consumer<List<String>> setter) {
        if (isSet(envLookup, envVar)) {
            List<String> values = new ArrayList<>();
            for (String part : envLookup.apply(envVar).split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
            setter.accept(values);
        }
    }

    // --- YAML helpers ---

    /** A YAML sequence of scalars, or a single scalar treated as a one-element list. */
    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        } else if (!node.isNull()) {
            values.add(node.asText());
        }
        return values;
    }
}
