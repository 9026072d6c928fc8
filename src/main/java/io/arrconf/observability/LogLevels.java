package io.arrconf.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

public final class LogLevels {
    public static final String ENV = "ARRCONF_LOG_LEVEL";
    public static final Set<String> NAMES = Set.of("ERROR", "WARNING", "WARN", "INFO", "DEBUG", "TRACE");

    private LogLevels() {
    }

    public static Level resolve(String option, String environment) {
        String raw = option != null && !option.isBlank() ? option : environment;
        if (raw == null || raw.isBlank()) {
            return Level.INFO;
        }
        String name = raw.trim().toUpperCase(Locale.ROOT);
        if (!NAMES.contains(name)) {
            throw new IllegalArgumentException("Invalid log level '" + raw + "' (expected one of ERROR, WARNING, INFO, DEBUG, TRACE)");
        }
        return Level.toLevel("WARNING".equals(name) ? "WARN" : name, Level.INFO);
    }

    public static void apply(Level level) {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
        ((Logger) LoggerFactory.getLogger("io.arrconf")).setLevel(level);
    }
}
