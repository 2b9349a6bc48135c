package io.debugtoolbar.core.toolbar;

import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.spi.Panel;
import java.util.Map;

/** Base class for panels: holds the toolbar reference and the enabled flag. */
public abstract class AbstractPanel implements Panel {

    protected final DebugToolbar toolbar;
    private volatile boolean enabled = true;

    protected AbstractPanel(DebugToolbar toolbar) {
        this.toolbar = toolbar;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /** Stores every entry of {@code stats} under this panel's id. */
    protected void recordStats(RequestContext context, Map<String, Object> stats) {
        stats.forEach((key, value) -> context.storePanelData(id(), key, value));
    }

    /** Statistics recorded for this panel so far. */
    protected Map<String, Object> stats(RequestContext context) {
        return context.panelData(id());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id() + (enabled ? "" : ", disabled") + "]";
    }
}
