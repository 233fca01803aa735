package im.arun.taxonomy.logging;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Points the application log file at the configured logs directory.
 *
 * <p>{@code logback.xml} only sets up the console; the file appender is attached here once
 * {@code paths.logs_dir} is known, so the log file sits next to the run logs.</p>
 */
public final class LoggingService {
    private static final Logger logger = LoggerFactory.getLogger(LoggingService.class);

    public static final String FILE_APPENDER = "FILE";
    public static final String LOG_FILE_NAME = "taxonomy-etl.log";
    static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss,SSS} - %logger{36} - %level - %msg%n";

    private LoggingService() {
    }

    /**
     * Attach (or re-point) the file appender to {@code <logsDir>/taxonomy-etl.log}.
     *
     * @return the log file, or null when the SLF4J binding is not Logback
     */
    public static Path attachFileAppender(Path logsDir) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            logger.warn("SLF4J is not bound to Logback; application log stays on the console");
            return null;
        }
        LoggerContext ctx = (LoggerContext) factory;
        Path logFile = logsDir.resolve(LOG_FILE_NAME);

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern(LOG_PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(ctx);
        appender.setName(FILE_APPENDER);
        appender.setFile(logFile.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        ch.qos.logback.classic.Logger root = ctx.getLogger(Logger.ROOT_LOGGER_NAME);
        Appender<ILoggingEvent> previous = root.getAppender(FILE_APPENDER);
        if (previous != null) {
            root.detachAppender(previous);
            previous.stop();
        }
        root.addAppender(appender);
        logger.debug("Application log file: {}", logFile);
        return logFile;
    }
}
