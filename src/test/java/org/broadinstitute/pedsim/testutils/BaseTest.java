package org.broadinstitute.pedsim.testutils;

import htsjdk.samtools.util.Log;
import org.broadinstitute.pedsim.utils.LoggingUtils;
import org.testng.Assert;
import org.testng.annotations.BeforeSuite;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Base of all test classes: quiet logging, test data lookup, temp files and output capture.
 */
public abstract class BaseTest {

    @BeforeSuite
    public void setTestVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    /**
     * Test data of a class lives in {@code src/test/resources/<package>/<tested class name>/}.
     */
    public String getToolTestDataDir() {
        return "src/test/resources/" + getClass().getPackage().getName().replace('.', '/') + "/" + getTestedClassName() + "/";
    }

    /**
     * @return the test class name without its {@code IntegrationTest}, {@code UnitTest} or {@code Test} suffix
     */
    public String getTestedClassName() {
        return getClass().getSimpleName().replaceAll("(Integration|Unit)?Test$", "");
    }

    public File getTestFile(final String fileName) {
        return new File(getToolTestDataDir(), fileName);
    }

    /**
     * Writes {@code contents} to a new temp file, deleted when the JVM exits.
     */
    public static Path createTempFileWithContents(final String name, final String extension, final String contents) {
        try {
            final File file = File.createTempFile(name, extension);
            file.deleteOnExit();
            Files.write(file.toPath(), contents.getBytes(StandardCharsets.UTF_8));
            return file.toPath();
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot write temp file " + name + extension, e);
        }
    }

    /**
     * @return a path in a fresh temp directory, so nothing exists there
     */
    public static File getSafeNonExistentFile(final String fileName) {
        try {
            final File dir = Files.createTempDirectory("missing").toFile();
            dir.deleteOnExit();
            return new File(dir, fileName);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot create temp directory", e);
        }
    }

    public static String captureStdout(final Runnable runnable) {
        return capture(runnable, System.out, System::setOut);
    }

    public static String captureStderr(final Runnable runnable) {
        return capture(runnable, System.err, System::setErr);
    }

    private static String capture(final Runnable runnable, final PrintStream original, final Consumer<PrintStream> setter) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        setter.accept(new PrintStream(out, true));
        try {
            runnable.run();
        } finally {
            setter.accept(original);
        }
        return out.toString();
    }

    public static void assertContains(final String actual, final String expectedSubstring) {
        Assert.assertTrue(actual.contains(expectedSubstring), "'" + expectedSubstring + "' not found in: " + actual);
    }
}
