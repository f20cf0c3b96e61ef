package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.PedSimBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Optional;

public final class SexUnitTest extends PedSimBaseTest {

    @DataProvider(name = "symbols")
    public Object[][] symbols() {
        return new Object[][] {
                {"M", Optional.of(Sex.MALE)},
                {"F", Optional.of(Sex.FEMALE)},
                {"m", Optional.empty()},
                {"f", Optional.empty()},
                {"MF", Optional.empty()},
                {"", Optional.empty()},
                {"X", Optional.empty()},
        };
    }

    @Test(dataProvider = "symbols")
    public void testFromSymbol(final String symbol, final Optional<Sex> expected) {
        Assert.assertEquals(Sex.fromSymbol(symbol), expected);
    }

    @Test
    public void testOpposite() {
        Assert.assertEquals(Sex.MALE.opposite(), Sex.FEMALE);
        Assert.assertEquals(Sex.FEMALE.opposite(), Sex.MALE);
        for (final Sex sex : Sex.values()) {
            Assert.assertEquals(Sex.fromSymbol(sex.getSymbol()), Optional.of(sex));
        }
    }
}
