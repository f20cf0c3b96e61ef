package org.broadinstitute.pedsim;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.pedsim.cmdline.CommandLineProgram;
import org.broadinstitute.pedsim.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pedsim.cmdline.TestProgramGroup;
import org.broadinstitute.pedsim.exceptions.ErrorCategory;
import org.broadinstitute.pedsim.exceptions.UserException;
import org.broadinstitute.pedsim.tools.ResolvePedigreeDefinitions;
import org.broadinstitute.pedsim.utils.pedigree.PedigreeDefinition;
import org.broadinstitute.pedsim.testutils.ArgumentsBuilder;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class MainTest extends CommandLineProgramTest {

    @CommandLineProgramProperties(
            summary = "Echoes its argument back",
            oneLineSummary = "Echoes its argument back",
            programGroup = TestProgramGroup.class,
            omitFromCommandLine = true)
    public static final class EchoProgram extends CommandLineProgram {

        @Argument(fullName = "message", doc = "message to return", optional = true)
        public String message = "hello";

        @Override
        protected Object doWork() {
            return message;
        }
    }

    /**
     * Main that only offers the echo program, so usage output does not depend on the classpath.
     */
    private static final class EchoMain extends Main {
        @Override
        protected List<String> getPackageList() {
            return Collections.emptyList();
        }

        @Override
        protected List<Class<? extends CommandLineProgram>> getClassList() {
            return Collections.singletonList(EchoProgram.class);
        }

        @Override
        protected void handleResult(final Object result) {
            // results are checked through instanceMain
        }
    }

    private static String[] quietly(final String... args) {
        final String[] quiet = new String[args.length + 4];
        System.arraycopy(args, 0, quiet, 0, args.length);
        quiet[args.length] = "--" + StandardArgumentDefinitions.VERBOSITY_NAME;
        quiet[args.length + 1] = "ERROR";
        quiet[args.length + 2] = "--" + StandardArgumentDefinitions.QUIET_NAME;
        quiet[args.length + 3] = "true";
        return quiet;
    }

    @Override
    public String getTestedToolName() {
        return ResolvePedigreeDefinitions.class.getSimpleName();
    }

    @Test
    public void testRunsProgramFromClassList() {
        Assert.assertEquals(new EchoMain().instanceMain(quietly("EchoProgram", "--message", "resolved")), "resolved");
    }

    @Test
    public void testHelpGoesToStdout() {
        final String out = captureStdout(() -> Assert.assertNull(new EchoMain().instanceMain(new String[] {"-h"})));
        assertContains(out, "USAGE: pedsim");
    }

    @Test
    public void testNoArgumentsPrintsUsage() {
        final String out = captureStdout(() -> Assert.assertNull(new EchoMain().instanceMain(new String[0])));
        assertContains(out, "Available Programs");
    }

    @Test
    public void testUnknownCommandSuggestsAlternative() {
        final UserException e = Assert.expectThrows(UserException.class,
                () -> captureStderr(() -> new EchoMain().instanceMain(new String[] {"EchoProgrm"})));
        assertContains(e.getMessage(), "'EchoProgrm' is not a valid command.");
        assertContains(e.getMessage(), "EchoProgram");
    }

    @Test
    public void testUnknownProgramMessage() {
        final List<String> names = Arrays.asList("EchoProgram", "ResolvePedigreeDefinitions");
        Assert.assertEquals(Main.unknownProgramMessage("Zzz", names), "'Zzz' is not a valid command.");
        Assert.assertEquals(Main.unknownProgramMessage("resolvepedigreedefinition", names),
                "'resolvepedigreedefinition' is not a valid command. Did you mean ResolvePedigreeDefinitions?");
    }

    @Test
    public void testFindsToolsInPackage() {
        final Path defFile = createTempFileWithContents("sibs", ".def", "def sibs 1 2\n2 2\n");
        final ArgumentsBuilder args = new ArgumentsBuilder().addDefFile(defFile);
        @SuppressWarnings("unchecked")
        final List<PedigreeDefinition> definitions = (List<PedigreeDefinition>) runCommandLine(args);
        Assert.assertEquals(definitions.size(), 1);
        Assert.assertEquals(definitions.get(0).getName(), "sibs");
    }

    @Test
    public void testExitValues() {
        final Main main = new EchoMain();
        captureStderr(() -> {
            Assert.assertEquals(main.runAndGetExitValue(quietly("EchoProgram")), 0);
            Assert.assertEquals(main.runAndGetExitValue(quietly("EchoProgram", "--no-such-argument", "1")),
                    ErrorCategory.COMMAND_LINE.getExitValue());
            Assert.assertEquals(main.runAndGetExitValue(new String[] {"NoSuchProgram"}),
                    ErrorCategory.USER_ERROR.getExitValue());
        });
    }

    @Test
    public void testExitValueForBadDefFile() {
        final Path defFile = createTempFileWithContents("triangle", ".def",
                "def triangle 1 3\n2 0 3\n3 1 3 1:1_2 2:2_3 3:1_3\n");
        final String[] args = makeCommandLineArgs(new ArgumentsBuilder().addDefFile(defFile).getArgsList());
        captureStderr(() -> Assert.assertEquals(new Main().runAndGetExitValue(args), ErrorCategory.INCONSISTENT_SEX.getExitValue()));
    }
}
