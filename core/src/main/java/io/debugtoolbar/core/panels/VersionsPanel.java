package io.debugtoolbar.core.panels;

import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.toolbar.AbstractPanel;
import io.debugtoolbar.core.toolbar.DebugToolbar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Runtime and toolbar versions, plus the codecs this process can decode. */
public final class VersionsPanel extends AbstractPanel {

    public VersionsPanel(DebugToolbar toolbar) {
        super(toolbar);
    }

    @Override
    public String title() {
        return "Versions";
    }

    @Override
    public String navSubtitle(RequestContext context) {
        return "Java " + System.getProperty("java.version", "?");
    }

    @Override
    public Map<String, Object> generateStats(RequestContext context) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("java_version", System.getProperty("java.version"));
        stats.put("java_vendor", System.getProperty("java.vendor"));
        stats.put("vm_name", System.getProperty("java.vm.name"));
        stats.put("os", System.getProperty("os.name") + " " + System.getProperty("os.arch"));
        stats.put("toolbar_version", toolbarVersion());
        stats.put("codecs", List.copyOf(toolbar.pipeline().codecs().availableTokens()));
        stats.put("unavailable_codecs", List.copyOf(toolbar.pipeline().codecs().unavailableTokens()));
        return stats;
    }

    private static String toolbarVersion() {
        String version = DebugToolbar.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }
}
