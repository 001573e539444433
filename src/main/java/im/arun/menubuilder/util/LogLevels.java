package im.arun.menubuilder.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Maps the settings' log level names onto Logback levels for the application logger.
 */
public final class LogLevels {

    public static final String APPLICATION_LOGGER = "im.arun.menubuilder";

    private LogLevels() {}

    /**
     * DEBUG, INFO, WARNING, ERROR and CRITICAL; WARN is accepted too.
     * Unknown names fall back to ERROR.
     */
    public static Level toLevel(String name) {
        if (name == null) {
            return Level.ERROR;
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG":
                return Level.DEBUG;
            case "INFO":
                return Level.INFO;
            case "WARN":
            case "WARNING":
                return Level.WARN;
            case "CRITICAL":
            case "ERROR":
            default:
                return Level.ERROR;
        }
    }

    public static Level apply(String name) {
        Level level = toLevel(name);
        org.slf4j.Logger logger = LoggerFactory.getLogger(APPLICATION_LOGGER);
        if (logger instanceof Logger) {
            ((Logger) logger).setLevel(level);
        }
        return level;
    }
}
