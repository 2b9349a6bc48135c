package io.debugtoolbar.javalin.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import io.debugtoolbar.core.context.RequestContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logback appender that copies every event logged while a request is being handled into that
 * request's {@link RequestContext}, where {@link LoggingPanel} picks it up. Events logged outside a
 * request are ignored.
 */
public final class ToolbarLogAppender extends AppenderBase<ILoggingEvent> {

    public static final String NAME = "DEBUG_TOOLBAR";
    static final int DEFAULT_MAX_RECORDS = 500;

    private final String panelId;
    private final int maxRecords;

    public ToolbarLogAppender(String panelId) {
        this(panelId, DEFAULT_MAX_RECORDS);
    }

    public ToolbarLogAppender(String panelId, int maxRecords) {
        this.panelId = panelId;
        this.maxRecords = maxRecords;
        setName(NAME);
    }

    @Override
    protected void append(ILoggingEvent event) {
        RequestContext context = RequestContext.current();
        if (context == null) {
            return;
        }
        if (context.panelData(panelId).get(LoggingPanel.RECORDS) instanceof List<?> records
                && records.size() >= maxRecords) {
            context.storePanelData(panelId, LoggingPanel.TRUNCATED, true);
            return;
        }
        context.appendPanelData(panelId, LoggingPanel.RECORDS, toRecord(event));
    }

    static Map<String, Object> toRecord(ILoggingEvent event) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("timestamp", event.getTimeStamp());
        record.put("level", event.getLevel().toString());
        record.put("logger", event.getLoggerName());
        record.put("thread", event.getThreadName());
        record.put("message", event.getFormattedMessage());
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            record.put("exception", throwable.getClassName() + ": " + throwable.getMessage());
        }
        return record;
    }
}
