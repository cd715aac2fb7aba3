package com.horae.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes lifecycle events to the {@code horae.events} logger.
 * 
 * Events marked as not writable are skipped. Failures and breakages are logged
 * at WARN, everything else at INFO.
 */
public class LoggingEventSink implements EventSink {

    public static final String LOGGER_NAME = "horae.events";

    private final Logger log;

    public LoggingEventSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public LoggingEventSink(Logger log) {
        this.log = log;
    }

    @Override
    public void emit(JobEvent event) {
        if (!event.isWritable()) {
            return;
        }
        switch (event.getFlag()) {
            case FAILED:
            case BROKEN:
                log.warn("{}", event);
                break;
            default:
                log.info("{}", event);
                break;
        }
    }
}
