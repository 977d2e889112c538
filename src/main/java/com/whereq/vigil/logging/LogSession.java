package com.whereq.vigil.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import lombok.Getter;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A job's log file for one run. Only the owning session detaches the file on close;
 * nested sessions handed to re-entrant callers close as a no-op.
 */
@Getter
public class LogSession implements AutoCloseable {

    private final String jobName;
    private final Path file;
    private final boolean owner;

    private final LogSessionManager manager;
    private final Appender<ILoggingEvent> appender;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LogSession(String jobName, Path file, boolean owner, LogSessionManager manager, Appender<ILoggingEvent> appender) {
        this.jobName = jobName;
        this.file = file;
        this.owner = owner;
        this.manager = manager;
        this.appender = appender;
    }

    LogSession nested() {
        return new LogSession(jobName, file, false, manager, null);
    }

    @Override
    public void close() {
        if (owner && closed.compareAndSet(false, true)) {
            manager.close(this);
        }
    }
}
