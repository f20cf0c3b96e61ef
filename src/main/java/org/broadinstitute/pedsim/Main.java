package org.broadinstitute.pedsim;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.pedsim.cmdline.CommandLineProgram;
import org.broadinstitute.pedsim.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pedsim.exceptions.ErrorCategory;
import org.broadinstitute.pedsim.exceptions.PedSimException;
import org.broadinstitute.pedsim.exceptions.UserException;
import org.broadinstitute.pedsim.utils.Utils;
import org.broadinstitute.pedsim.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * Entry point of the toolkit: {@code pedsim <program name> [arguments]}.
 *
 * Programs are the concrete {@link CommandLineProgram}s found in {@link #getPackageList()} plus the ones in
 * {@link #getClassList()}, and are named by their simple class name.  The process exits with 0 on success and with
 * the {@link ErrorCategory} exit value of the error otherwise.
 */
public class Main {

    static {
        // number formatting in messages must not depend on the host
        Locale.setDefault(Locale.US);
    }

    private static final String STACK_TRACE_ENVIRONMENT_VARIABLE = "PEDSIM_STACKTRACE_ON_USER_EXCEPTION";

    private static final int MAX_SUGGESTION_DISTANCE = 4;

    private static final int USAGE_WIDTH = 80;

    protected List<String> getPackageList() {
        return Collections.singletonList("org.broadinstitute.pedsim");
    }

    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.emptyList();
    }

    protected String getCommandLineName() {
        return "pedsim";
    }

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    /**
     * The only place that exits the JVM.
     */
    protected final void mainEntry(final String[] args) {
        System.exit(runAndGetExitValue(args));
    }

    /**
     * Loads the configuration, then runs the program named by {@code args[0]} with the remaining arguments.
     *
     * @return the program's result, or null if only the usage was printed
     */
    public Object instanceMain(final String[] args) {
        return run(setUp(args), args);
    }

    /**
     * Runs like {@link #instanceMain(String[])}, reporting errors on System.err.
     *
     * @return 0 on success, the exit value of the error's category otherwise
     */
    protected final int runAndGetExitValue(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = setUp(args);
            handleResult(run(program, args));
            return 0;
        } catch (final CommandLineException e) {
            if (program != null) {
                System.err.println(program.getUsage());
            }
            reportUserError(e);
            return ErrorCategory.COMMAND_LINE.getExitValue();
        } catch (final UserException e) {
            reportUserError(e);
            return e.getCategory().getExitValue();
        } catch (final RuntimeException e) {
            e.printStackTrace();
            return ErrorCategory.INTERNAL_ERROR.getExitValue();
        }
    }

    /**
     * Prints a non-null result of a program.
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    private CommandLineProgram setUp(final String[] args) {
        ConfigFactory.getInstance().initializeFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.PEDSIM_CONFIG_FILE_OPTION);
        return findProgram(args);
    }

    private static Object run(final CommandLineProgram program, final String[] args) {
        return program == null ? null : program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    private CommandLineProgram findProgram(final String[] args) {
        final Map<String, Class<?>> programs = getPrograms();
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, programs.values());
            return null;
        }
        final Class<?> clazz = programs.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, programs.values());
            throw new UserException(unknownProgramMessage(args[0], programs.keySet()));
        }
        try {
            return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
        } catch (final ReflectiveOperationException e) {
            throw new PedSimException("Cannot create program " + clazz.getName(), e);
        }
    }

    /**
     * @return the runnable programs by simple name, sorted
     */
    private Map<String, Class<?>> getPrograms() {
        final ClassFinder finder = new ClassFinder();
        for (final String pkg : getPackageList()) {
            finder.find(pkg, CommandLineProgram.class);
        }
        final Set<Class<?>> candidates = new LinkedHashSet<>(finder.getClasses());
        candidates.addAll(getClassList());

        final Map<String, Class<?>> programs = new TreeMap<>();
        for (final Class<?> clazz : candidates) {
            if (clazz.isInterface() || clazz.isSynthetic() || clazz.isLocalClass() || clazz.isAnonymousClass()
                    || Modifier.isAbstract(clazz.getModifiers())) {
                continue;
            }
            if (clazz.getAnnotation(CommandLineProgramProperties.class) == null) {
                throw new PedSimException(clazz.getName() + " is missing its @CommandLineProgramProperties");
            }
            final Class<?> previous = programs.put(clazz.getSimpleName(), clazz);
            if (previous != null && previous != clazz) {
                throw new PedSimException("Programs " + previous.getName() + " and " + clazz.getName() + " share a name");
            }
        }
        return programs;
    }

    private void printUsage(final PrintStream out, final Collection<Class<?>> programs) {
        final Map<CommandLineProgramGroup, List<Class<?>>> byGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        for (final Class<?> clazz : programs) {
            final CommandLineProgramProperties properties = clazz.getAnnotation(CommandLineProgramProperties.class);
            if (!properties.omitFromCommandLine()) {
                byGroup.computeIfAbsent(newGroup(properties.programGroup()), group -> new ArrayList<>()).add(clazz);
            }
        }

        out.println("USAGE: " + getCommandLineName() + " <program name> [arguments]");
        out.println();
        out.println("Available Programs:");
        for (final Map.Entry<CommandLineProgramGroup, List<Class<?>>> entry : byGroup.entrySet()) {
            out.println(Utils.rule('-', USAGE_WIDTH));
            out.println(entry.getKey().getName() + ": " + entry.getKey().getDescription());
            for (final Class<?> clazz : entry.getValue()) {
                out.println(String.format("    %-36s %s", clazz.getSimpleName(),
                        clazz.getAnnotation(CommandLineProgramProperties.class).oneLineSummary()));
            }
        }
        out.println(Utils.rule('-', USAGE_WIDTH));
    }

    private static CommandLineProgramGroup newGroup(final Class<? extends CommandLineProgramGroup> groupClass) {
        try {
            return groupClass.getDeclaredConstructor().newInstance();
        } catch (final ReflectiveOperationException e) {
            throw new PedSimException("Cannot create program group " + groupClass.getName(), e);
        }
    }

    /**
     * @return the error for an unknown program name, naming the closest programs when some are only a few edits away
     */
    @VisibleForTesting
    static String unknownProgramMessage(final String name, final Collection<String> programNames) {
        final List<String> closest = new ArrayList<>();
        int bestDistance = MAX_SUGGESTION_DISTANCE + 1;
        for (final String candidate : programNames) {
            final int distance = StringUtil.levenshteinDistance(name.toLowerCase(), candidate.toLowerCase(), 1, 1, 1, 1);
            if (distance < bestDistance) {
                bestDistance = distance;
                closest.clear();
            }
            if (distance == bestDistance) {
                closest.add(candidate);
            }
        }
        final String message = String.format("'%s' is not a valid command.", name);
        return closest.isEmpty() ? message : message + " Did you mean " + String.join(" or ", closest) + "?";
    }

    private static void reportUserError(final Exception e) {
        System.err.println(Utils.rule('*', USAGE_WIDTH));
        System.err.println("A USER ERROR has occurred: " + e.getMessage());
        System.err.println(Utils.rule('*', USAGE_WIDTH));
        if ("true".equals(System.getenv(STACK_TRACE_ENVIRONMENT_VARIABLE))
                || ConfigFactory.getInstance().getPedSimConfig().pedsim_stacktrace_on_user_exception()) {
            e.printStackTrace();
        } else {
            System.err.println("Set -Dpedsim_stacktrace_on_user_exception=true or the configuration option of the same name to print the stack trace.");
        }
    }
}
