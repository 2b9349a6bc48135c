package io.debugtoolbar.core.panels;

import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.toolbar.AbstractPanel;
import io.debugtoolbar.core.toolbar.DebugToolbar;
import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Wall-clock and CPU time of the request. */
public final class TimerPanel extends AbstractPanel {

    private static final ThreadMXBean THREADS = ManagementFactory.getThreadMXBean();
    private static final String CPU_START = "cpu_start_ns";

    public TimerPanel(DebugToolbar toolbar) {
        super(toolbar);
    }

    @Override
    public String title() {
        return "Time";
    }

    @Override
    public String navSubtitle(RequestContext context) {
        Double total = context.timing(DebugToolbar.TOTAL_TIME);
        return total == null ? "" : String.format(Locale.ROOT, "%.2f ms", total * 1000);
    }

    @Override
    public void processRequest(RequestContext context) {
        long cpu = currentThreadCpuTime();
        if (cpu >= 0) {
            context.storePanelData(id(), CPU_START, cpu);
        }
    }

    @Override
    public Map<String, Object> generateStats(RequestContext context) {
        Map<String, Object> stats = new LinkedHashMap<>();
        Double total = context.timing(DebugToolbar.TOTAL_TIME);
        double seconds = total != null ? total : context.elapsedSeconds();
        stats.put("total_time", seconds);
        stats.put("total_time_ms", round(seconds * 1000));

        // CPU time only makes sense when the request stayed on one thread
        if (stats(context).get(CPU_START) instanceof Long start) {
            long now = currentThreadCpuTime();
            if (now >= start) {
                stats.put("cpu_time_ms", round((now - start) / 1_000_000.0));
            }
        }
        return stats;
    }

    private static long currentThreadCpuTime() {
        return THREADS.isCurrentThreadCpuTimeSupported() ? THREADS.getCurrentThreadCpuTime() : -1;
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
