package io.debugtoolbar.javalin.config;

import io.debugtoolbar.core.toolbar.ToolbarConfig;
import java.util.List;
import java.util.Objects;

/**
 * Everything the Javalin host needs at startup: listen address, logging setup, codecs switched
 * off by the operator, and the toolbar configuration itself.
 *
 * @param host listen address
 * @param port listen port; {@code 0} picks a free one
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel root log level
 * @param disabledCodecs content-coding tokens forced to "unavailable"
 * @param toolbar toolbar configuration
 */
public record ServerConfig(
        String host,
        int port,
        String loggingFormat,
        String loggingLevel,
        List<String> disabledCodecs,
        ToolbarConfig toolbar) {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 7070;

    /** The log-capturing panel is on by default when the toolbar runs inside this host. */
    public static final List<String> DEFAULT_EXTRA_PANELS = List.of("io.debugtoolbar.javalin.logging.LoggingPanel");

    public ServerConfig {
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(toolbar, "toolbar must not be null");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got " + port);
        }
        loggingFormat = loggingFormat == null ? "text" : loggingFormat;
        loggingLevel = loggingLevel == null ? "INFO" : loggingLevel;
        disabledCodecs = disabledCodecs == null ? List.of() : List.copyOf(disabledCodecs);
    }

    /** Defaults for every field; the toolbar gets the logging panel on top of the built-in ones. */
    public static ServerConfig defaults() {
        return new ServerConfig(
                DEFAULT_HOST,
                DEFAULT_PORT,
                "text",
                "INFO",
                List.of(),
                ToolbarConfig.builder().extraPanels(DEFAULT_EXTRA_PANELS).build());
    }
}
