package org.broadinstitute.fusionworkbook.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

/**
 * Logging utilities.
 *
 * Tools use the htsjdk Log.LogLevel enum as the type for VERBOSITY command line arguments (each log4j level is
 * represented by a static object so there is no built-in enum that is compatible with the command line argument
 * framework). Therefore we use the htsjdk enum as the currency and convert back and forth between that and the
 * log4j namespace as necessary.
 */
public final class LoggingUtils {

    // Map between the logging level used throughout the code (htsjdk Log.LogLevel) and the log4j Level values.
    private static final BiMap<Log.LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        loggingLevelNamespaceMap.put(Log.LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(Log.LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(Log.LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private LoggingUtils() {}

    /**
     * Converts a htsjdk log level to a log4j log level.
     * @param htsjdkLevel htsjdk {@link Log.LogLevel} to convert to a Log4J {@link Level}.
     * @return The {@link Level} that corresponds to the given {@code htsjdkLevel}.
     */
    public static Level levelToLog4jLevel(final Log.LogLevel htsjdkLevel) {
        return loggingLevelNamespaceMap.get(htsjdkLevel);
    }

    /**
     * Propagate the verbosity level to htsjdk and log4j.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Log.setGlobalLogLevel(verbosity);

        // propagate the requested level to the root logger of our logging configuration
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(LogManager.ROOT_LOGGER_NAME);

        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }
}
