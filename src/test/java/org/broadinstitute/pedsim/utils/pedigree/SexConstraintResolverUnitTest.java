package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.PedSimBaseTest;
import org.broadinstitute.pedsim.exceptions.DefFileException;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.Optional;

public final class SexConstraintResolverUnitTest extends PedSimBaseTest {

    private PedigreeDefinition definition;
    private SexConstraintResolver resolver;

    private final BranchRef a = new BranchRef(1, 0);
    private final BranchRef b = new BranchRef(1, 1);
    private final BranchRef c = new BranchRef(1, 2);
    private final BranchRef d = new BranchRef(1, 3);
    private final BranchRef e = new BranchRef(0, 0);

    @BeforeMethod
    public void setUp() {
        definition = new PedigreeDefinition("sexes", 1, 3, null);
        definition.defineGeneration(0, 2, 0);
        definition.defineGeneration(1, 4, 0);
        resolver = new SexConstraintResolver(TEST_SOURCE, definition::getSexConstraint);
    }

    @Test
    public void testUnresolvedMarriage() {
        resolver.addMarriage(a, b, 3);
        Assert.assertEquals(resolver.getNumGroups(), 1);
        Assert.assertTrue(resolver.requiresOppositeSex(a, b));
        Assert.assertFalse(resolver.getResolvedSex(a).isPresent());

        resolver.finish();
        Assert.assertEquals(resolver.getNumGroups(), 0);
        Assert.assertFalse(definition.getSex(1, 0).isPresent());
        Assert.assertFalse(definition.getSex(1, 1).isPresent());
    }

    @Test
    public void testSexAssignedAfterMarriageIsPropagated() {
        resolver.addMarriage(a, b, 3);
        resolver.assignSex(a, Sex.MALE, 4);
        Assert.assertEquals(resolver.getResolvedSex(b), Optional.of(Sex.FEMALE));

        final DefFileException.InconsistentSex ex = Assert.expectThrows(DefFileException.InconsistentSex.class,
                () -> resolver.assignSex(b, Sex.MALE, 5));
        Assert.assertEquals(ex.getLineNumber().getAsInt(), 5);
    }

    @Test
    public void testSexAssignedBeforeMarriageIsPropagated() {
        resolver.assignSex(a, Sex.FEMALE, 2);
        resolver.addMarriage(a, b, 3);
        resolver.finish();
        Assert.assertEquals(definition.getSex(1, 0), Optional.of(Sex.FEMALE));
        Assert.assertEquals(definition.getSex(1, 1), Optional.of(Sex.MALE));
    }

    @Test
    public void testSameSexMarriage() {
        resolver.assignSex(a, Sex.MALE, 2);
        resolver.assignSex(b, Sex.MALE, 2);
        Assert.expectThrows(DefFileException.InconsistentSex.class, () -> resolver.addMarriage(a, b, 3));
    }

    @Test
    public void testMarriageIntoGroupWithConflictingSex() {
        resolver.assignSex(a, Sex.MALE, 2);
        resolver.assignSex(c, Sex.FEMALE, 2);
        resolver.addMarriage(a, b, 3);
        // c would have to be male like a
        Assert.expectThrows(DefFileException.InconsistentSex.class, () -> resolver.addMarriage(b, c, 4));
    }

    @Test
    public void testOddCycleIsRejected() {
        resolver.addMarriage(a, b, 3);
        resolver.addMarriage(b, c, 3);
        Assert.assertFalse(resolver.requiresOppositeSex(a, c));
        Assert.expectThrows(DefFileException.InconsistentSex.class, () -> resolver.addMarriage(a, c, 4));
    }

    @Test
    public void testRepeatedMarriageIsAccepted() {
        resolver.addMarriage(a, b, 3);
        resolver.addMarriage(b, a, 4);
        Assert.assertEquals(resolver.getNumGroups(), 1);
    }

    @Test
    public void testMergeGroups() {
        resolver.addMarriage(a, b, 3);
        resolver.addMarriage(c, d, 3);
        Assert.assertEquals(resolver.getNumGroups(), 2);

        resolver.addMarriage(a, c, 4);
        Assert.assertEquals(resolver.getNumGroups(), 1);
        Assert.assertTrue(resolver.requiresOppositeSex(a, c));
        Assert.assertTrue(resolver.requiresOppositeSex(b, d));
        Assert.assertFalse(resolver.requiresOppositeSex(a, d));
        Assert.assertFalse(resolver.requiresOppositeSex(b, c));

        resolver.assignSex(d, Sex.FEMALE, 5);
        resolver.finish();
        Assert.assertEquals(definition.getSex(1, 0), Optional.of(Sex.FEMALE));
        Assert.assertEquals(definition.getSex(1, 1), Optional.of(Sex.MALE));
        Assert.assertEquals(definition.getSex(1, 2), Optional.of(Sex.MALE));
        Assert.assertEquals(definition.getSex(1, 3), Optional.of(Sex.FEMALE));
    }

    @Test
    public void testMergeAdoptsSexOfAbsorbedGroup() {
        resolver.addMarriage(a, b, 3);
        resolver.assignSex(c, Sex.MALE, 3);
        resolver.addMarriage(c, d, 3);
        resolver.addMarriage(a, c, 4);
        Assert.assertEquals(resolver.getResolvedSex(a), Optional.of(Sex.FEMALE));
        Assert.assertEquals(resolver.getResolvedSex(b), Optional.of(Sex.MALE));
        Assert.assertEquals(resolver.getResolvedSex(d), Optional.of(Sex.FEMALE));
    }

    @Test
    public void testMergeWithConflictingSexes() {
        resolver.assignSex(a, Sex.MALE, 2);
        resolver.addMarriage(a, b, 3);
        resolver.assignSex(c, Sex.MALE, 2);
        resolver.addMarriage(c, d, 3);
        Assert.expectThrows(DefFileException.InconsistentSex.class, () -> resolver.addMarriage(a, c, 4));
    }

    @Test
    public void testMergeIntoSameSide() {
        resolver.addMarriage(a, b, 3);
        resolver.addMarriage(c, d, 3);
        resolver.addMarriage(b, d, 4);
        // a and d are now on the same side
        Assert.expectThrows(DefFileException.InconsistentSex.class, () -> resolver.addMarriage(a, d, 5));
        resolver.addMarriage(a, c, 5);
        Assert.assertEquals(resolver.getNumGroups(), 1);
    }

    @Test
    public void testMarriageAcrossGenerations() {
        resolver.addMarriage(a, e, 3);
        resolver.assignSex(e, Sex.MALE, 4);
        resolver.finish();
        Assert.assertEquals(definition.getSex(0, 0), Optional.of(Sex.MALE));
        Assert.assertEquals(definition.getSex(1, 0), Optional.of(Sex.FEMALE));
    }

    @Test
    public void testDuplicateSexAssignment() {
        resolver.assignSex(a, Sex.MALE, 2);
        final DefFileException ex = Assert.expectThrows(DefFileException.DuplicateAssignment.class,
                () -> resolver.assignSex(a, Sex.MALE, 3));
        assertContains(ex.getMessage(), "sex of branch number 1 in generation 2 assigned multiple times");
    }

    @Test
    public void testFinishIsIdempotent() {
        resolver.addMarriage(a, b, 3);
        resolver.assignSex(b, Sex.MALE, 3);
        resolver.finish();
        resolver.finish();
        Assert.assertEquals(resolver.getNumGroups(), 0);
        Assert.assertEquals(definition.getSex(1, 0), Optional.of(Sex.FEMALE));
        Assert.assertEquals(definition.getSex(1, 1), Optional.of(Sex.MALE));
        Assert.assertFalse(definition.getGeneration(1).getSexConstraint(0).getGroup().isPresent());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSelfMarriage() {
        resolver.addMarriage(a, new BranchRef(1, 0), 3);
    }
}
