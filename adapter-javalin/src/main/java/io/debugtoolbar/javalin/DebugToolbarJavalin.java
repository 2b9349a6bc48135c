package io.debugtoolbar.javalin;

import io.debugtoolbar.core.encoding.CodecRegistry;
import io.debugtoolbar.core.toolbar.DebugToolbar;
import io.debugtoolbar.core.toolbar.ToolbarConfig;
import io.debugtoolbar.javalin.config.ServerConfig;
import io.javalin.Javalin;
import io.javalin.config.JavalinConfig;
import jakarta.servlet.DispatcherType;
import java.util.EnumSet;
import java.util.function.Consumer;
import org.eclipse.jetty.servlet.FilterHolder;

/**
 * Installs a {@link DebugToolbar} into a Javalin application.
 *
 * <pre>
 * DebugToolbarJavalin toolbar = DebugToolbarJavalin.create(ToolbarConfig.builder().build());
 * Javalin app = toolbar.createApp(config -&gt; {});
 * app.get("/", ctx -&gt; ctx.html("&lt;html&gt;&lt;body&gt;Hello&lt;/body&gt;&lt;/html&gt;"));
 * app.start(7070);
 * </pre>
 *
 * Applications that build Javalin themselves call {@link #configure(JavalinConfig)} inside
 * {@code Javalin.create} and {@link #registerRoutes(Javalin)} afterwards.
 */
public final class DebugToolbarJavalin {

    private final DebugToolbar toolbar;

    public DebugToolbarJavalin(DebugToolbar toolbar) {
        this.toolbar = toolbar;
    }

    public static DebugToolbarJavalin create(ToolbarConfig config) {
        return new DebugToolbarJavalin(new DebugToolbar(config));
    }

    public static DebugToolbarJavalin create(ToolbarConfig config, CodecRegistry codecs) {
        return new DebugToolbarJavalin(new DebugToolbar(config, codecs));
    }

    /** Builds the toolbar from loaded configuration, switching off the codecs it lists as disabled. */
    public static DebugToolbarJavalin create(ServerConfig config) {
        CodecRegistry.Builder codecs = CodecRegistry.builder().withStandardCodecs();
        for (String token : config.disabledCodecs()) {
            codecs.disable(token);
        }
        return create(config.toolbar(), codecs.build());
    }

    /** Adds the toolbar filter in front of every request dispatched to Javalin's servlet. */
    public void configure(JavalinConfig config) {
        DebugToolbarFilter filter = new DebugToolbarFilter(toolbar);
        config.jetty.modifyServletContextHandler(handler ->
                handler.addFilter(new FilterHolder(filter), "/*", EnumSet.of(DispatcherType.REQUEST)));
    }

    /** Mounts the history pages, JSON API and assets; skipped when the toolbar is disabled. */
    public void registerRoutes(Javalin app) {
        if (toolbar.config().enabled()) {
            new ToolbarRoutes(toolbar).register(app);
        }
    }

    /** Creates a Javalin app with the filter and routes installed. */
    public Javalin createApp(Consumer<JavalinConfig> userConfig) {
        Javalin app = Javalin.create(config -> {
            userConfig.accept(config);
            configure(config);
        });
        registerRoutes(app);
        return app;
    }

    public DebugToolbar toolbar() {
        return toolbar;
    }
}
