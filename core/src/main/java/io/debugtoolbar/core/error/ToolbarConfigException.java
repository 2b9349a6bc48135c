package io.debugtoolbar.core.error;

/** Invalid toolbar configuration value, raised while building the configuration. */
public final class ToolbarConfigException extends ToolbarException {

    private static final long serialVersionUID = 1L;

    public ToolbarConfigException(String message) {
        super(message, Stage.CONFIGURATION);
    }
}
