package dumb.cogproof.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Static logging facade over SLF4J, imported statically where a class has no logger of its own. */
public class Log {

    private static final Logger logger = LoggerFactory.getLogger("cogproof");

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void debug(String message) {
        message(message, LogLevel.DEBUG);
    }

    public static void message(String message, LogLevel level) {
        switch (level) {
            case DEBUG -> logger.debug(message);
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
    }

    public enum LogLevel {
        DEBUG, INFO, WARNING, ERROR
    }
}
