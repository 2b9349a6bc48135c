package io.debugtoolbar.javalin.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point for the demo server; logs the failure and exits non-zero if startup fails. */
public final class DemoMain {

    private static final Logger LOG = LoggerFactory.getLogger(DemoMain.class);

    private DemoMain() {
        // utility class
    }

    /**
     * @param args command-line arguments (e.g. {@code --config path/to/debug-toolbar.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            DemoApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
