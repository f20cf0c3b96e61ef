package org.broadinstitute.pedsim.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pedsim.exceptions.UserException;
import org.broadinstitute.pedsim.utils.LoggingUtils;
import org.broadinstitute.pedsim.utils.Utils;

/**
 * Loads the {@link PedSimConfig} through OWNER, once per JVM.
 *
 * The config file named on the command line reaches OWNER through the {@link PedSimConfig#CONFIG_FILE_VARIABLE_FILE_NAME}
 * variable of its {@code @Sources}.  When no file was named the variable points at an empty file, otherwise OWNER
 * would read the unexpanded {@code ${...}} as a path.
 */
public final class ConfigFactory {
    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    @VisibleForTesting
    static final String NO_CONFIG_FILE = "/dev/null";

    private ConfigFactory() {}

    public static ConfigFactory getInstance() {
        return instance;
    }

    /**
     * @return the toolkit configuration, loaded on first use
     */
    public synchronized PedSimConfig getPedSimConfig() {
        final String variable = PedSimConfig.CONFIG_FILE_VARIABLE_FILE_NAME;
        if (System.getProperty(variable) == null && System.getenv(variable) == null
                && org.aeonbits.owner.ConfigFactory.getProperty(variable) == null) {
            org.aeonbits.owner.ConfigFactory.setProperty(variable, NO_CONFIG_FILE);
        }
        return ConfigCache.getOrCreate(PedSimConfig.class);
    }

    /**
     * Loads the configuration, reading the file that follows {@code configFileOption} in {@code args} if there is one.
     * A configuration loaded earlier is replaced when a file is given.
     */
    public synchronized PedSimConfig initializeFromCommandLineArgs(final String[] args, final String configFileOption) {
        final String configFile = getConfigFilenameFromArgs(args, configFileOption);
        if (configFile != null) {
            logger.debug("Reading configuration from " + configFile);
            org.aeonbits.owner.ConfigFactory.setProperty(PedSimConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFile);
            ConfigCache.remove(PedSimConfig.class);
        }
        return getPedSimConfig();
    }

    /**
     * @return the value following the first {@code configFileOption} in {@code args}, or null if the option is absent
     * @throws UserException.BadInput if the option is not followed by a value
     */
    public static String getConfigFilenameFromArgs(final String[] args, final String configFileOption) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);
        for (int i = 0; i < args.length; i++) {
            if (!args[i].equals(configFileOption)) {
                continue;
            }
            if (i + 1 == args.length || args[i + 1].startsWith("-")) {
                throw new UserException.BadInput("no configuration file given after " + configFileOption);
            }
            return args[i + 1];
        }
        return null;
    }

    public static void logConfig(final PedSimConfig config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        final Level level = LoggingUtils.toLog4jLevel(logLevel);
        logger.log(level, "Configuration:");
        logger.log(level, "\tcomment_marker = " + config.comment_marker());
        logger.log(level, "\twarn_on_last_generation_no_print = " + config.warn_on_last_generation_no_print());
        logger.log(level, "\tpedsim_stacktrace_on_user_exception = " + config.pedsim_stacktrace_on_user_exception());
    }
}
