package io.debugtoolbar.javalin.demo;

import io.debugtoolbar.core.encoding.CodecRegistry;
import io.debugtoolbar.javalin.DebugToolbarJavalin;
import io.debugtoolbar.javalin.config.ServerConfig;
import io.debugtoolbar.javalin.config.ToolbarConfigLoader;
import io.debugtoolbar.javalin.logging.LogbackConfigurator;
import io.javalin.Javalin;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A small Javalin site with the toolbar installed, for trying the toolbar in a browser.
 *
 * <p>
 * Startup:
 * <ol>
 * <li>Load configuration from {@code --config}, {@code debug-toolbar.yaml} or the environment</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Build the toolbar and its codec registry</li>
 * <li>Start Javalin with the demo pages and the toolbar routes</li>
 * </ol>
 *
 * Kept apart from {@link DemoMain} so tests can start and stop it without {@code main()}.
 */
public final class DemoApp {

    private static final Logger LOG = LoggerFactory.getLogger(DemoApp.class);

    static final String PAGE = "<!DOCTYPE html>\n<html><head><title>%s</title></head>"
            + "<body><h1>%s</h1><p>%s</p>"
            + "<ul><li><a href=\"/\">Plain page</a></li><li><a href=\"/gzip\">Gzip page</a></li>"
            + "<li><a href=\"/api/items\">JSON</a></li><li><a href=\"/redirect\">Redirect</a></li></ul>"
            + "</body></html>";

    private final Javalin app;
    private final DebugToolbarJavalin toolbar;
    private final ServerConfig config;

    private DemoApp(Javalin app, DebugToolbarJavalin toolbar, ServerConfig config) {
        this.app = app;
        this.toolbar = toolbar;
        this.config = config;
    }

    /**
     * Runs the startup sequence with the process environment.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/debug-toolbar.yaml})
     * @return the running demo
     */
    public static DemoApp start(String[] args) {
        return start(ToolbarConfigLoader.loadFromArgs(args, System::getenv));
    }

    /** Starts the demo with an already loaded configuration. */
    public static DemoApp start(ServerConfig config) {
        long startTime = System.nanoTime();

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        DebugToolbarJavalin toolbar = DebugToolbarJavalin.create(config);
        Javalin app = toolbar.createApp(javalinConfig -> javalinConfig.showJavalinBanner = false);
        registerPages(app);

        app.start(config.host(), config.port());

        CodecRegistry codecs = toolbar.toolbar().pipeline().codecs();
        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "debug-toolbar demo started: port={}, toolbar={}, panels={}, codecs={}, startupMs={}",
                app.port(),
                config.toolbar().enabled() ? config.toolbar().apiPath() : "disabled",
                toolbar.toolbar().enabledPanels().size(),
                codecs,
                elapsedMs);
        return new DemoApp(app, toolbar, config);
    }

    private static void registerPages(Javalin app) {
        app.get("/", ctx -> {
            LOG.info("Rendering home page");
            ctx.html(String.format(PAGE, "Debug Toolbar demo", "Hello", "The toolbar sits at the bottom of this page."));
        });
        app.get("/gzip", ctx -> {
            LOG.info("Rendering gzip page");
            byte[] html = String.format(PAGE, "Gzip", "Compressed", "The handler gzipped this page itself.")
                    .getBytes(StandardCharsets.UTF_8);
            ctx.header("Content-Encoding", "gzip");
            ctx.contentType("text/html; charset=utf-8");
            ctx.result(gzip(html));
        });
        app.get("/api/items", ctx -> ctx.json(Map.of("items", List.of("alpha", "beta", "gamma"))));
        app.get("/redirect", ctx -> ctx.redirect("/"));
    }

    static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        }
        return out.toByteArray();
    }

    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public DebugToolbarJavalin toolbar() {
        return toolbar;
    }

    public ServerConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("debug-toolbar demo stopped");
    }
}
