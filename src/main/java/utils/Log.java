package utils;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public class Log {

    // One logger per calling class, resolved from the stack on first use
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    public static void info(String message) {
        getLogger().info(message);
    }

    public static void debug(String message) {
        getLogger().debug(message);
    }

    /**
     * Tagged debug output, e.g. {@code Log.debug("internal-rep-debug", ...)}.
     */
    public static void debug(String tag, String message) {
        getLogger().debug(MarkerManager.getMarker(tag), message);
    }

    /**
     * Tagged trace output. The message is only built when TRACE is enabled for the caller.
     */
    public static void trace(String tag, Supplier<String> message) {
        Logger logger = getLogger();
        Marker marker = MarkerManager.getMarker(tag);
        if (logger.isTraceEnabled(marker)) {
            logger.trace(marker, message.get());
        }
    }

    public static void warn(String message) {
        getLogger().warn(message);
    }

    public static void warn(String tag, String message) {
        getLogger().warn(MarkerManager.getMarker(tag), message);
    }

    public static void fatal(String message) {
        getLogger().fatal(message);
    }

    private static Logger getLogger() {
        // [0] getLogger, [1] Log.xxx, [2] the caller
        String callingClassName = new Throwable().getStackTrace()[2].getClassName();
        return loggers.computeIfAbsent(callingClassName, LogManager::getLogger);
    }
}
