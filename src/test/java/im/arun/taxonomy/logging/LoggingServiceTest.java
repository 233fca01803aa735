package im.arun.taxonomy.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingServiceTest {

    @TempDir
    Path tempDir;

    private static Logger rootLogger() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        return ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }

    @AfterEach
    void detachFileAppender() {
        Appender<ILoggingEvent> appender = rootLogger().getAppender(LoggingService.FILE_APPENDER);
        if (appender != null) {
            rootLogger().detachAppender(appender);
            appender.stop();
        }
    }

    @Test
    @DisplayName("Attaches the file appender under the configured logs directory")
    void testAttach() {
        Path logsDir = tempDir.resolve("run-logs");

        Path logFile = LoggingService.attachFileAppender(logsDir);

        assertThat(logFile).isEqualTo(logsDir.resolve("taxonomy-etl.log")).isRegularFile();
        Appender<ILoggingEvent> appender = rootLogger().getAppender(LoggingService.FILE_APPENDER);
        assertThat(appender).isInstanceOf(FileAppender.class);
        assertThat(((FileAppender<ILoggingEvent>) appender).getFile()).isEqualTo(logFile.toString());
        assertThat(appender.isStarted()).isTrue();
    }

    @Test
    @DisplayName("Re-pointing replaces and stops the previous file appender")
    void testReattach() {
        LoggingService.attachFileAppender(tempDir.resolve("first"));
        Appender<ILoggingEvent> first = rootLogger().getAppender(LoggingService.FILE_APPENDER);

        Path logFile = LoggingService.attachFileAppender(tempDir.resolve("second"));

        Appender<ILoggingEvent> current = rootLogger().getAppender(LoggingService.FILE_APPENDER);
        assertThat(current).isNotSameAs(first);
        assertThat(first.isStarted()).isFalse();
        assertThat(((FileAppender<ILoggingEvent>) current).getFile()).isEqualTo(logFile.toString());
    }

    @Test
    @DisplayName("Log events reach the file")
    void testWritesEvents() {
        Path logFile = LoggingService.attachFileAppender(tempDir);

        LoggerFactory.getLogger(LoggingServiceTest.class).warn("threshold reached");

        assertThat(logFile).content().contains(" - WARN - threshold reached");
    }
}
