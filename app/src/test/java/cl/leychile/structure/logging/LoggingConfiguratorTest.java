package cl.leychile.structure.logging;

import static org.assertj.core.api.Assertions.assertThat;

import cl.leychile.structure.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextFormat() {
        LoggingConfigurator.configure(LogFormat.TEXT);
    }

    @Test
    void textFormatUsesPatternWithDocumentKey() {
        LoggerContext context = new LoggerContext();

        Encoder<ILoggingEvent> encoder = LoggingConfigurator.encoderFor(LogFormat.TEXT, context);

        assertThat(encoder).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) encoder).getPattern()).contains("%X{document:-}");
        assertThat(encoder.isStarted()).isTrue();
    }

    @Test
    void jsonFormatWrapsSimpleJsonLayout() {
        LoggerContext context = new LoggerContext();

        Encoder<ILoggingEvent> encoder = LoggingConfigurator.encoderFor(LogFormat.JSON, context);

        assertThat(encoder).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) encoder).getLayout()).isInstanceOf(SimpleJsonLayout.class);
    }

    @Test
    void configuringLiveContextKeepsLogging() {
        LoggingConfigurator.configure(LogFormat.JSON);

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Appender<ILoggingEvent> console = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("CONSOLE");
        assertThat(console).isInstanceOf(OutputStreamAppender.class);
        assertThat(((OutputStreamAppender<ILoggingEvent>) console).getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(console.isStarted()).isTrue();
        LoggerFactory.getLogger(LoggingConfiguratorTest.class).warn("json logging active");
    }
}
