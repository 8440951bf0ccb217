package org.broadinstitute.treealign.utils;

import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Logging utilities.
 *
 * The log4j {@link Level} is the currency for verbosity throughout this code base; the java built-in logger has
 * a different set of level values, which we map onto the four log4j levels we support.
 */
public final class LoggingUtils {

    private static final Map<Level, java.util.logging.Level> javaUtilLevelNamespaceMap = ImmutableMap.of(
            Level.ERROR, java.util.logging.Level.SEVERE,
            Level.WARN, java.util.logging.Level.WARNING,
            Level.INFO, java.util.logging.Level.INFO,
            Level.DEBUG, java.util.logging.Level.FINEST);

    private LoggingUtils() {}

    /**
     * Propagate the verbosity level to log4j and the java built in logger.
     * @param verbosity one of {@link Level#ERROR}, {@link Level#WARN}, {@link Level#INFO} or {@link Level#DEBUG}
     */
    public static void setLoggingLevel(final Level verbosity) {
        Utils.nonNull(verbosity);
        Utils.validateArg(javaUtilLevelNamespaceMap.containsKey(verbosity), () -> "Unsupported logging level: " + verbosity);
        setLog4JLoggingLevel(verbosity);
        setJavaUtilLoggingLevel(verbosity);
    }

    private static void setLog4JLoggingLevel(final Level verbosity) {
        // propagate the requested level to the root of our logging configuration
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(LogManager.ROOT_LOGGER_NAME);

        loggerConfig.setLevel(verbosity);
        loggerContext.updateLoggers();
    }

    private static void setJavaUtilLoggingLevel(final Level verbosity) {
        final Logger topLogger = java.util.logging.Logger.getLogger("");

        Handler consoleHandler = null;
        for (final Handler handler : topLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                consoleHandler = handler;
                break;
            }
        }

        if (consoleHandler == null) {
            consoleHandler = new ConsoleHandler();
            topLogger.addHandler(consoleHandler);
        }
        consoleHandler.setLevel(javaUtilLevelNamespaceMap.get(verbosity));
    }
}
