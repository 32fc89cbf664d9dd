package ai.rtlparser.analyzer.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.rtlparser.analyzer.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreDefaults() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
    }

    @Test
    void verboseEnablesDebugForAnalyzerLoggers() {
        LoggingConfigurator.configure(LogFormat.TEXT, true);

        assertThat(context.getLogger(LoggingConfigurator.BASE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("ai.rtlparser.analyzer.parse.ParseService").isDebugEnabled()).isTrue();
    }

    @Test
    void defaultVerbosityIsInfo() {
        LoggingConfigurator.configure(LogFormat.JSON, false);

        assertThat(context.getLogger(LoggingConfigurator.BASE_LOGGER).getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger("ai.rtlparser.analyzer.parse.ParseService").isDebugEnabled()).isFalse();
    }
}
