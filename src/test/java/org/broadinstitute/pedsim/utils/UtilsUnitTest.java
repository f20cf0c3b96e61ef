package org.broadinstitute.pedsim.utils;

import htsjdk.samtools.util.Log.LogLevel;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pedsim.PedSimBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class UtilsUnitTest extends PedSimBaseTest {

    @Test
    public void testRule() {
        Assert.assertEquals(Utils.rule('-', 3), "---");
        Assert.assertEquals(Utils.rule('*', 0), "");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonNullThrows() {
        final Object o = null;
        Utils.nonNull(o);
    }

    @Test
    public void testNonNullDoesNotThrow() {
        final Object o = new Object();
        Assert.assertSame(Utils.nonNull(o), o);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "^The exception message$")
    public void testNonNullWithMessageThrows() {
        Utils.nonNull(null, "The exception message");
    }

    @DataProvider(name= "emptyAndNull")
    public Object[][] getEmptyAndNull() {
        return new Object[][] {
                {null},
                {""},
        };
    }

    @Test(expectedExceptions = IllegalArgumentException.class, dataProvider = "emptyAndNull")
    public void testNonEmptyThrows(String string) {
        Utils.nonEmpty(string, "some message");
    }

    @Test
    public void testNonEmpty() {
        Assert.assertEquals(Utils.nonEmpty("def", "name"), "def");
    }

    @DataProvider(name = "successfulValidIndexData")
    public Object[][] successfulValidIndexData() {
        return new Object[][] {
                {0, 10},
                {10, 11},
                {9, 10},
        };
    }

    @Test(dataProvider = "successfulValidIndexData")
    public void testValidIndexSuccessful(final int index, final int length) {
        Assert.assertEquals(Utils.validIndex(index, length), index);
    }

    @DataProvider(name = "unsuccessfulValidIndexData")
    public Object[][] unsuccessfulValidIndexData() {
        return new Object[][] {
                {-1, 10},
                {10, 10},
                {0, 0},
        };
    }

    @Test(dataProvider = "unsuccessfulValidIndexData", expectedExceptions = IllegalArgumentException.class)
    public void testValidIndexUnsuccessful(final int index, final int length) {
        Utils.validIndex(index, length);
    }

    @Test
    public void testValidate() {
        Utils.validateArg(true, "never thrown");
        Utils.validate(true, () -> "never thrown");
        Assert.expectThrows(IllegalArgumentException.class, () -> Utils.validateArg(false, () -> "bad argument"));
        Assert.expectThrows(IllegalStateException.class, () -> Utils.validate(false, "bad state"));
    }

    @Test
    public void testSetLoggingLevel() {
        final Logger logger = LogManager.getLogger(UtilsUnitTest.class);
        final LogLevel initial = LoggingUtils.fromLog4jLevel(logger.getLevel());
        Assert.assertNotNull(initial, "level " + logger.getLevel() + " cannot be restored");
        try {
            for (final LogLevel level : LogLevel.values()) {
                LoggingUtils.setLoggingLevel(level);
                Assert.assertEquals(logger.getLevel(), LoggingUtils.toLog4jLevel(level));
            }
        } finally {
            LoggingUtils.setLoggingLevel(initial);
        }
        Assert.assertEquals(LoggingUtils.fromLog4jLevel(logger.getLevel()), initial);
    }

    @Test
    public void testLevelConversions() {
        Assert.assertEquals(LoggingUtils.toLog4jLevel(LogLevel.WARNING), Level.WARN);
        for (final LogLevel level : LogLevel.values()) {
            Assert.assertEquals(LoggingUtils.fromLog4jLevel(LoggingUtils.toLog4jLevel(level)), level);
        }
    }
}
