package io.debugtoolbar.core.error;

/**
 * Abstract base for all debug-toolbar exceptions. Never thrown directly; each concrete subclass
 * names the pipeline stage it belongs to so callers can decide whether the failure is local to one
 * response or fatal at startup.
 */
public abstract class ToolbarException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stage in which the error occurred. */
    public enum Stage {
        CONFIGURATION,
        CAPTURE,
        DECODE
    }

    private final Stage stage;

    protected ToolbarException(String message, Stage stage) {
        super(message);
        this.stage = stage;
    }

    protected ToolbarException(String message, Throwable cause, Stage stage) {
        super(message, cause);
        this.stage = stage;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }
}
