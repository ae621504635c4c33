package com.raditha.divergence.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Points logging at the current run: a fresh {@code analyzer.log} in the run's log
 * directory plus the requested console threshold.
 */
public final class RunLoggingConfigurator {

    public static final String LOG_FILE = "analyzer.log";
    static final String RUN_APPENDER = "RUN_FILE";

    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private RunLoggingConfigurator() {
    }

    /**
     * @param logsDir directory that receives {@value #LOG_FILE}; created by the appender if needed
     * @return the log file
     */
    public static Path configure(Path logsDir, ConsoleVerbosity verbosity) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        applyConsoleThreshold(context, root, verbosity);

        Appender<ILoggingEvent> previous = root.getAppender(RUN_APPENDER);
        if (previous != null) {
            root.detachAppender(previous);
            previous.stop();
        }

        Path logFile = logsDir.resolve(LOG_FILE);
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setName(RUN_APPENDER);
        appender.setContext(context);
        appender.setFile(logFile.toString());
        appender.setAppend(false);
        appender.setEncoder(encoder);
        appender.start();
        root.addAppender(appender);
        return logFile;
    }

    /**
     * Detach and close the run log file, if one is attached.
     */
    public static void close() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        Appender<ILoggingEvent> appender = root.getAppender(RUN_APPENDER);
        if (appender != null) {
            root.detachAppender(appender);
            appender.stop();
        }
    }

    private static void applyConsoleThreshold(LoggerContext context, Logger root, ConsoleVerbosity verbosity) {
        for (var iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            Appender<ILoggingEvent> appender = iterator.next();
            if (appender instanceof ConsoleAppender<ILoggingEvent> console) {
                ThresholdFilter filter = new ThresholdFilter();
                filter.setContext(context);
                filter.setLevel(verbosity.threshold().levelStr);
                filter.start();
                console.clearAllFilters();
                console.addFilter(filter);
            }
        }
    }
}
