package io.journeyguard.cli.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.journeyguard.cli.config.CliConfig;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logback setup for a {@code journey-guard} run.
 *
 * <p>
 * Logs go to standard error so that reports on standard output stay machine-readable. The
 * configured level applies to journey-guard's own loggers; third-party libraries stay at WARN
 * whatever the level. Every event logged while a document is being processed carries its bare
 * file name under the {@value #DOCUMENT_KEY} MDC key, printed in text mode and emitted as an
 * MDC field by Logback's {@link JsonEncoder} in JSON mode.
 */
public final class LogbackConfigurator {

    /** MDC key holding the bare name of the document being processed. */
    public static final String DOCUMENT_KEY = "document";

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level [%X{" + DOCUMENT_KEY + ":--}] %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    static final String APPLICATION_LOGGER = "io.journeyguard";

    private LogbackConfigurator() {
        // utility class
    }

    /** Replaces the root appender and sets levels from the {@code logging} section. */
    public static void configure(CliConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.WARN);
        context.getLogger(APPLICATION_LOGGER).setLevel(Level.toLevel(config.loggingLevel(), Level.WARN));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(context, config.loggingFormat()));
        appender.start();
        rootLogger.addAppender(appender);
    }

    /**
     * Tags log events on the current thread with a document name until the returned handle is
     * closed.
     */
    public static MDC.MDCCloseable documentContext(String documentName) {
        return MDC.putCloseable(DOCUMENT_KEY, documentName);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
