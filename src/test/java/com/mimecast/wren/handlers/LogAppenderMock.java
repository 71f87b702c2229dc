package com.mimecast.wren.handlers;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Log appender mock for testing.
 * <p>Records level and formatted message of every event logged by the class it is attached to.
 */
public class LogAppenderMock extends AbstractAppender {

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final LoggerContext context;
    private final LoggerConfig loggerConfig;

    private LogAppenderMock(Class<?> clazz) {
        super("LogAppenderMock", null, null, true, Property.EMPTY_ARRAY);
        this.context = (LoggerContext) LogManager.getContext(false);
        this.loggerConfig = context.getConfiguration().getLoggerConfig(clazz.getName());
    }

    /**
     * Attaches a new appender to the logger of the given class.
     *
     * @param clazz Class whose logger to capture.
     * @return LogAppenderMock instance.
     */
    public static LogAppenderMock attach(Class<?> clazz) {
        LogAppenderMock appender = new LogAppenderMock(clazz);
        appender.start();
        appender.loggerConfig.addAppender(appender, Level.ALL, null);
        appender.context.updateLoggers();
        return appender;
    }

    /**
     * Detaches and stops the appender.
     */
    public void detach() {
        loggerConfig.removeAppender(getName());
        context.updateLoggers();
        stop();
    }

    @Override
    public void append(LogEvent event) {
        events.add(event.getLevel() + " " + event.getMessage().getFormattedMessage());
    }

    public List<String> getEvents() {
        return events;
    }
}
