package com.whereq.vigil.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.job.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Per-job log files.
 *
 * <p>Each run of a job gets a timestamped file under {@code <log-dir>/<job>/}. Console output is
 * left to the regular logging setup, so the file mirrors what the terminal or cron stream sees for
 * that job. Opening a session for a job that already has one (in the run context or in this
 * process) returns a nested handle instead of a second file. After a session closes only the
 * newest {@code retention} files of the job are kept.</p>
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class LogSessionManager {

    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneId.systemDefault());
    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%level] [%thread] %logger{36} - %msg%n";
    private static final String LOG_EXTENSION = ".log";

    private final Path logDir;
    private final int retention;
    private final Map<String, LogSession> active = new ConcurrentHashMap<>();

    @Autowired
    public LogSessionManager(VigilProperties properties) {
        this(properties.getLogDir(), properties.getLogRetention());
    }

    public LogSessionManager(Path logDir, int retention) {
        this.logDir = logDir;
        this.retention = Math.max(1, retention);
    }

    /**
     * Open the log session of the context's job, or join the one already open for it.
     */
    public LogSession open(RunContext context) {
        String jobName = context.getJobName();
        if (jobName == null) {
            throw new IllegalArgumentException("A log session needs a job context");
        }

        LogSession inherited = context.getLogSession();
        if (inherited != null && jobName.equals(inherited.getJobName())) {
            log.debug("Logging already initialized for {}, reusing {}", jobName, inherited.getFile());
            return inherited.nested();
        }

        AtomicBoolean created = new AtomicBoolean(false);
        LogSession session = active.computeIfAbsent(jobName, name -> {
            created.set(true);
            return start(name, context);
        });
        return created.get() ? session : session.nested();
    }

    public Path jobLogDir(String jobName) {
        return logDir.resolve(jobName);
    }

    /**
     * Log files of a job, newest first.
     */
    public List<Path> listLogFiles(String jobName) {
        Path dir = jobLogDir(jobName);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        String prefix = jobName + "_";
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(p -> {
                    String name = p.getFileName().toString();
                    return name.startsWith(prefix) && name.endsWith(LOG_EXTENSION);
                })
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list log directory " + dir, e);
        }
    }

    void close(LogSession session) {
        active.remove(session.getJobName(), session);
        if (session.getAppender() != null) {
            loggerContext().ifPresent(context ->
                context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).detachAppender(session.getAppender()));
            session.getAppender().stop();
        }
        prune(session.getJobName());
    }

    void prune(String jobName) {
        List<Path> files = listLogFiles(jobName);
        for (Path old : files.stream().skip(retention).collect(Collectors.toList())) {
            try {
                Files.deleteIfExists(old);
                log.debug("Pruned old log file {}", old);
            } catch (IOException e) {
                log.warn("Failed to prune log file {}: {}", old, e.getMessage());
            }
        }
    }

    private LogSession start(String jobName, RunContext context) {
        Path dir = jobLogDir(jobName);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create log directory " + dir, e);
        }
        Path file = dir.resolve(jobName + "_" + FILE_STAMP.format(Instant.now()) + LOG_EXTENSION);

        FileAppender<ILoggingEvent> appender = loggerContext()
            .map(loggerContext -> attachFileAppender(loggerContext, jobName, file))
            .orElse(null);
        if (appender == null) {
            log.warn("Logback is not the active logging backend, {} logs go to the console only", jobName);
        }

        LogSession session = new LogSession(jobName, file, true, this, appender);
        try (MDC.MDCCloseable job = MDC.putCloseable(RunContext.MDC_JOB, jobName)) {
            log.info("===== {} run {} logging to {} =====", jobName, context.getRunId(), file);
        }
        return session;
    }

    private FileAppender<ILoggingEvent> attachFileAppender(LoggerContext loggerContext, String jobName, Path file) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        JobMdcFilter filter = new JobMdcFilter(jobName);
        filter.setContext(loggerContext);
        filter.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(loggerContext);
        appender.setName("vigil-job-" + jobName);
        appender.setFile(file.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.addFilter(filter);
        appender.start();

        Logger root = loggerContext.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);
        return appender;
    }

    private static java.util.Optional<LoggerContext> loggerContext() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        return factory instanceof LoggerContext context
            ? java.util.Optional.of(context)
            : java.util.Optional.empty();
    }
}
