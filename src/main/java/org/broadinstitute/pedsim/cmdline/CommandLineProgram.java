package org.broadinstitute.pedsim.cmdline;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.*;
import org.broadinstitute.pedsim.utils.LoggingUtils;
import org.broadinstitute.pedsim.utils.Utils;
import org.broadinstitute.pedsim.utils.config.ConfigFactory;

import java.util.Collections;

/**
 * Base class of the toolkit's programs.
 *
 * Subclasses declare their options as barclay {@link Argument} fields and implement {@link #doWork()}.  After the
 * arguments are parsed, {@link #instanceMain(String[])} calls {@link #onStartup()}, {@link #doWork()} and, even when
 * one of them throws, {@link #onShutdown()}.
 */
public abstract class CommandLineProgram {

    // one logger per concrete program
    protected final Logger logger = LogManager.getLogger(getClass());

    private static final int BANNER_WIDTH = 60;

    @ArgumentCollection(doc = "Arguments handled by the argument parser itself")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME,
            doc = "Logging verbosity", common = true, optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, doc = "Whether to leave out the startup banner and the elapsed time",
            common = true, optional = true)
    public Boolean QUIET = false;

    // Main reads the file before the program exists; declared so the parser accepts the option
    @Argument(fullName = StandardArgumentDefinitions.PEDSIM_CONFIG_FILE_OPTION,
            doc = "Properties file overriding the toolkit configuration", common = true, optional = true)
    public String PEDSIM_CONFIG_FILE = null;

    private CommandLineArgumentParser commandLineParser;

    protected void onStartup() {}

    /**
     * @return the program's result, possibly null
     */
    protected abstract Object doWork();

    protected void onShutdown() {}

    /**
     * Extra checks on the parsed arguments.
     *
     * @return the problems found, or null if there are none
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parses {@code argv} into this program's arguments and runs it.
     *
     * @return the result of {@link #doWork()}, or null if the arguments only asked for help or the version
     * @throws CommandLineException if the arguments do not parse or fail {@link #customCommandLineValidation()}
     */
    public Object instanceMain(final String[] argv) {
        if (!getCommandLineParser().parseArguments(System.err, argv)) {
            return null;
        }
        final String[] problems = customCommandLineValidation();
        if (problems != null) {
            throw new CommandLineException("Invalid arguments: " + String.join(", ", problems));
        }

        LoggingUtils.setLoggingLevel(VERBOSITY);
        final long start = System.nanoTime();
        if (!QUIET) {
            logger.info(Utils.rule('-', BANNER_WIDTH));
            logger.info(getClass().getSimpleName() + " " + getVersion());
            logger.info("Java " + System.getProperty("java.version") + " on " + System.getProperty("os.name"));
            logger.info(Utils.rule('-', BANNER_WIDTH));
            ConfigFactory.logConfig(ConfigFactory.getInstance().getPedSimConfig(), Log.LogLevel.DEBUG);
        }
        try {
            onStartup();
            return doWork();
        } finally {
            onShutdown();
            if (!QUIET) {
                logger.info(String.format("%s done. Elapsed time: %.2f seconds.",
                        getClass().getSimpleName(), (System.nanoTime() - start) / 1e9));
            }
        }
    }

    /**
     * @return the version from the jar manifest, or "unknown" when not running from a jar
     */
    public String getVersion() {
        final String version = getClass().getPackage().getImplementationVersion();
        return version != null ? version : "unknown";
    }

    public final String getUsage() {
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    @VisibleForTesting
    public final CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, Collections.emptyList(), Collections.emptySet());
        }
        return commandLineParser;
    }
}
