package io.debugtoolbar.javalin.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.toolbar.AbstractPanel;
import io.debugtoolbar.core.toolbar.DebugToolbar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Log messages emitted while the request was handled.
 *
 * <p>
 * Loading the panel attaches a {@link ToolbarLogAppender} to the Logback root logger (once per
 * logger context). With any other SLF4J backend the panel stays empty.
 */
public final class LoggingPanel extends AbstractPanel {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingPanel.class);

    static final String RECORDS = "records";
    static final String TRUNCATED = "truncated";

    public LoggingPanel(DebugToolbar toolbar) {
        super(toolbar);
        attachAppender(id());
    }

    @Override
    public String title() {
        return "Logging";
    }

    @Override
    public String navSubtitle(RequestContext context) {
        int count = records(context).size();
        return count == 1 ? "1 message" : count + " messages";
    }

    @Override
    public Map<String, Object> generateStats(RequestContext context) {
        List<?> records = records(context);
        Map<String, Integer> byLevel = new TreeMap<>();
        for (Object record : records) {
            if (record instanceof Map<?, ?> map) {
                byLevel.merge(String.valueOf(map.get("level")), 1, Integer::sum);
            }
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put(RECORDS, records);
        stats.put("count", records.size());
        stats.put("levels", byLevel);
        stats.put(TRUNCATED, Boolean.TRUE.equals(stats(context).get(TRUNCATED)));
        return stats;
    }

    private List<?> records(RequestContext context) {
        return stats(context).get(RECORDS) instanceof List<?> list ? list : List.of();
    }

    static void attachAppender(String panelId) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext loggerContext)) {
            LOG.info("SLF4J backend is not Logback, logging panel will stay empty");
            return;
        }
        Logger root = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        synchronized (LoggingPanel.class) {
            if (root.getAppender(ToolbarLogAppender.NAME) != null) {
                return;
            }
            ToolbarLogAppender appender = new ToolbarLogAppender(panelId);
            appender.setContext(loggerContext);
            appender.start();
            root.addAppender(appender);
        }
        LOG.debug("Attached {} appender to the root logger", ToolbarLogAppender.NAME);
    }
}
