package io.journeyguard.cli.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.joran.spi.JoranException;
import io.journeyguard.cli.config.CliConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

@DisplayName("Logback configuration")
class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreDefaultConfiguration() throws JoranException {
        MDC.clear();
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    @Test
    void levelAppliesToJourneyGuardLoggersOnly() {
        LogbackConfigurator.configure(CliConfig.builder().loggingFormat("json").loggingLevel("DEBUG").build());

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertThat(root.getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger("io.journeyguard").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("io.journeyguard.core.engine.JourneyValidator").getEffectiveLevel())
                .isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("com.networknt.schema").getEffectiveLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void jsonFormatUsesJsonEncoderOnStandardError() {
        LogbackConfigurator.configure(CliConfig.builder().loggingFormat("json").build());

        var appender = (ConsoleAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME)
                .getAppender("STDERR");
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    void textFormatPrintsDocumentName() {
        LogbackConfigurator.configure(CliConfig.builder().loggingFormat("text").build());

        var appender = (ConsoleAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME)
                .getAppender("STDERR");
        assertThat(appender.getEncoder()).isInstanceOfSatisfying(PatternLayoutEncoder.class,
                encoder -> assertThat(encoder.getPattern()).contains("%X{document:--}"));
    }

    @Test
    void unknownLevelFallsBackToWarn() {
        LogbackConfigurator.configure(CliConfig.builder().loggingLevel("chatty").build());

        assertThat(context.getLogger("io.journeyguard").getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void documentContextIsRemovedOnClose() {
        try (MDC.MDCCloseable ignored = LogbackConfigurator.documentContext("login.json")) {
            assertThat(MDC.get(LogbackConfigurator.DOCUMENT_KEY)).isEqualTo("login.json");
        }
        assertThat(MDC.get(LogbackConfigurator.DOCUMENT_KEY)).isNull();
    }
}
