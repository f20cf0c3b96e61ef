package org.broadinstitute.pedsim.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;

/**
 * Applies the {@code --verbosity} of a command line program to logging.
 *
 * The argument is an htsjdk {@link Log.LogLevel}, since barclay needs an enum and log4j levels are not one.
 */
public final class LoggingUtils {

    private static final BiMap<Log.LogLevel, Level> LOG4J_LEVELS = EnumHashBiMap.create(Log.LogLevel.class);
    static {
        LOG4J_LEVELS.put(Log.LogLevel.ERROR, Level.ERROR);
        LOG4J_LEVELS.put(Log.LogLevel.WARNING, Level.WARN);
        LOG4J_LEVELS.put(Log.LogLevel.INFO, Level.INFO);
        LOG4J_LEVELS.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private LoggingUtils() {}

    public static Level toLog4jLevel(final Log.LogLevel verbosity) {
        return LOG4J_LEVELS.get(Utils.nonNull(verbosity));
    }

    static Log.LogLevel fromLog4jLevel(final Level level) {
        return LOG4J_LEVELS.inverse().get(level);
    }

    /**
     * Sets the root log4j level, and the htsjdk level, to {@code verbosity}.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Log.setGlobalLogLevel(verbosity);

        final LoggerContext context = (LoggerContext) LogManager.getContext(false);
        context.getConfiguration().getRootLogger().setLevel(toLog4jLevel(verbosity));
        context.updateLoggers();
    }
}
