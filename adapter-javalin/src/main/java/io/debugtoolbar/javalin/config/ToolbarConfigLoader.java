package io.debugtoolbar.javalin.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.debugtoolbar.core.error.ToolbarConfigException;
import io.debugtoolbar.core.toolbar.ToolbarConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads a {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Layout:
 *
 * <pre>
 * server:
 *   host: 0.0.0.0
 *   port: 7070
 * logging:
 *   format: text        # or json
 *   level: INFO
 * toolbar:
 *   enabled: true
 *   insert-before: "&lt;/body&gt;"
 *   max-request-history: 50
 *   api-path: /_debug_toolbar
 *   static-path: /_debug_toolbar/static
 *   panels: [...]
 *   extra-panels: [...]
 *   exclude-panels: [...]
 *   exclude-paths: [...]
 *   allowed-hosts: [...]
 *   intercept-redirects: false
 *   max-body-bytes: 5242880
 *   server-timing: false
 *   disabled-codecs: [zstd]
 * </pre>
 *
 * <p>
 * Missing keys keep their defaults. Every key can be overridden by an environment variable named
 * {@code DEBUG_TOOLBAR_} plus the key in upper case with dashes turned into underscores (lists are
 * comma-separated; {@code server.*} and {@code logging.*} use {@code DEBUG_TOOLBAR_HOST},
 * {@code DEBUG_TOOLBAR_PORT}, {@code DEBUG_TOOLBAR_LOG_FORMAT} and {@code DEBUG_TOOLBAR_LOG_LEVEL}).
 * A variable counts as set only if its trimmed value is non-empty.
 */
public final class ToolbarConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String DEFAULT_CONFIG_FILE = "debug-toolbar.yaml";
    static final String ENV_PREFIX = "DEBUG_TOOLBAR_";

    private ToolbarConfigLoader() {
        // utility class
    }

    /**
     * Loads the given file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the given file, applying overrides from {@code envLookup}; a {@code null} return means
     * the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return build(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup, configPath.toString());
    }

    /** Defaults plus environment overrides, for hosts started without a file. */
    public static ServerConfig fromEnvironment(Function<String, String> envLookup) {
        return build(YAML_MAPPER.createObjectNode(), envLookup, "environment");
    }

    /**
     * Loads the file named by {@code --config}, else {@value #DEFAULT_CONFIG_FILE} in the working
     * directory if present, else defaults, applying environment overrides in every case.
     */
    public static ServerConfig loadFromArgs(String[] args, Function<String, String> envLookup) {
        Path path = resolveConfigPath(args);
        boolean explicit = path != null;
        Path candidate = explicit ? path : Path.of(DEFAULT_CONFIG_FILE);
        if (explicit || Files.exists(candidate)) {
            return load(candidate, envLookup);
        }
        return fromEnvironment(envLookup);
    }

    /**
     * The path given with {@code --config}, or {@code null} if the flag is absent.
     *
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
        return null;
    }

    private static ServerConfig build(JsonNode root, Function<String, String> envLookup, String source) {
        try {
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (ToolbarConfigException | IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> env) {
        ServerConfig defaults = ServerConfig.defaults();

        // server + logging
        JsonNode server = root.path("server");
        String host = textOrDefault(server, "host", defaults.host());
        int port = intOrDefault(server, "port", defaults.port());
        JsonNode logging = root.path("logging");
        String format = textOrDefault(logging, "format", defaults.loggingFormat());
        String level = textOrDefault(logging, "level", defaults.loggingLevel());

        host = envStringOrDefault(env, "HOST", host);
        port = envIntOrDefault(env, "PORT", port);
        format = envStringOrDefault(env, "LOG_FORMAT", format);
        level = envStringOrDefault(env, "LOG_LEVEL", level);

        // toolbar
        JsonNode toolbar = root.path("toolbar");
        ToolbarConfig.Builder builder = ToolbarConfig.builder().extraPanels(ServerConfig.DEFAULT_EXTRA_PANELS);
        if (toolbar.has("enabled")) builder.enabled(toolbar.get("enabled").asBoolean());
        if (toolbar.has("insert-before")) builder.insertBefore(toolbar.get("insert-before").asText());
        if (toolbar.has("max-request-history"))
            builder.maxRequestHistory(toolbar.get("max-request-history").asInt());
        if (toolbar.has("api-path")) builder.apiPath(toolbar.get("api-path").asText());
        if (toolbar.has("static-path")) builder.staticPath(toolbar.get("static-path").asText());
        if (toolbar.has("panels")) builder.panels(list(toolbar, "panels"));
        if (toolbar.has("extra-panels")) builder.extraPanels(list(toolbar, "extra-panels"));
        if (toolbar.has("exclude-panels")) builder.excludePanels(list(toolbar, "exclude-panels"));
        if (toolbar.has("exclude-paths")) builder.excludePaths(list(toolbar, "exclude-paths"));
        if (toolbar.has("allowed-hosts")) builder.allowedHosts(list(toolbar, "allowed-hosts"));
        if (toolbar.has("intercept-redirects"))
            builder.interceptRedirects(toolbar.get("intercept-redirects").asBoolean());
        if (toolbar.has("max-body-bytes")) builder.maxBodyBytes(toolbar.get("max-body-bytes").asLong());
        if (toolbar.has("server-timing")) builder.serverTiming(toolbar.get("server-timing").asBoolean());
        List<String> disabledCodecs = toolbar.has("disabled-codecs") ? list(toolbar, "disabled-codecs") : List.of();

        envBool(env, "ENABLED", builder::enabled);
        envString(env, "INSERT_BEFORE", builder::insertBefore);
        envInt(env, "MAX_REQUEST_HISTORY", builder::maxRequestHistory);
        envString(env, "API_PATH", builder::apiPath);
        envString(env, "STATIC_PATH", builder::staticPath);
        envList(env, "PANELS", builder::panels);
        envList(env, "EXTRA_PANELS", builder::extraPanels);
        envList(env, "EXCLUDE_PANELS", builder::excludePanels);
        envList(env, "EXCLUDE_PATHS", builder::excludePaths);
        envList(env, "ALLOWED_HOSTS", builder::allowedHosts);
        envBool(env, "INTERCEPT_REDIRECTS", builder::interceptRedirects);
        envLong(env, "MAX_BODY_BYTES", builder::maxBodyBytes);
        envBool(env, "SERVER_TIMING", builder::serverTiming);
        disabledCodecs = isSet(env, "DISABLED_CODECS") ? splitList(value(env, "DISABLED_CODECS")) : disabledCodecs;

        return new ServerConfig(host, port, format, level, disabledCodecs, builder.build());
    }

    // --- Env var helpers ---

    /** A variable is set if it is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> env, String key) {
        String value = env.apply(ENV_PREFIX + key);
        return value != null && !value.trim().isEmpty();
    }

    private static String value(Function<String, String> env, String key) {
        return env.apply(ENV_PREFIX + key).trim();
    }

    private static void envString(Function<String, String> env, String key, Consumer<String> setter) {
        if (isSet(env, key)) {
            setter.accept(value(env, key));
        }
    }

    private static void envInt(Function<String, String> env, String key, IntConsumer setter) {
        if (isSet(env, key)) {
            setter.accept(parseInt(env, key));
        }
    }

    private static void envLong(Function<String, String> env, String key, LongConsumer setter) {
        if (isSet(env, key)) {
            try {
                setter.accept(Long.parseLong(value(env, key)));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_PREFIX + key + " must be a number, got '" + value(env, key) + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> env, String key, Consumer<Boolean> setter) {
        if (isSet(env, key)) {
            setter.accept(Boolean.parseBoolean(value(env, key)));
        }
    }

    private static void envList(Function<String, String> env, String key, Consumer<List<String>> setter) {
        if (isSet(env, key)) {
            setter.accept(splitList(value(env, key)));
        }
    }

    private static String envStringOrDefault(Function<String, String> env, String key, String yamlDefault) {
        return isSet(env, key) ? value(env, key) : yamlDefault;
    }

    private static int envIntOrDefault(Function<String, String> env, String key, int yamlDefault) {
        return isSet(env, key) ? parseInt(env, key) : yamlDefault;
    }

    private static int parseInt(Function<String, String> env, String key) {
        try {
            return Integer.parseInt(value(env, key));
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(ENV_PREFIX + key + " must be an integer, got '" + value(env, key) + "'", e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    // --- YAML helpers ---

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }

    private static int intOrDefault(JsonNode node, String field, int defaultValue) {
        return node.has(field) ? node.get(field).asInt() : defaultValue;
    }

    /** A YAML sequence of scalars; a single scalar is read as a one-element list. */
    private static List<String> list(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<String> items = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(item -> items.add(item.asText()));
        } else if (!value.isNull()) {
            items.addAll(splitList(value.asText()));
        }
        return items;
    }
}
