package im.arun.menubuilder.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class LogLevelsTest {

    @AfterEach
    void restore() {
        LogLevels.apply("ERROR");
    }

    @Test
    void mapsSettingsNamesOntoLogbackLevels() {
        assertThat(LogLevels.toLevel("debug")).isEqualTo(Level.DEBUG);
        assertThat(LogLevels.toLevel("WARNING")).isEqualTo(Level.WARN);
        assertThat(LogLevels.toLevel("CRITICAL")).isEqualTo(Level.ERROR);
        assertThat(LogLevels.toLevel("verbose")).isEqualTo(Level.ERROR);
        assertThat(LogLevels.toLevel(null)).isEqualTo(Level.ERROR);
    }

    @Test
    void appliesToTheApplicationLogger() {
        LogLevels.apply("INFO");

        Logger logger = (Logger) LoggerFactory.getLogger(LogLevels.APPLICATION_LOGGER);
        assertThat(logger.getLevel()).isEqualTo(Level.INFO);
    }
}
