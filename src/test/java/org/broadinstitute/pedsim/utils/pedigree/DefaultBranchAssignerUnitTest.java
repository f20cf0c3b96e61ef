package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.PedSimBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class DefaultBranchAssignerUnitTest extends PedSimBaseTest {

    @Test
    public void testDefaultNumBranches() {
        final PedigreeDefinition definition = new PedigreeDefinition("defaults", 1, 4, null);
        Assert.assertEquals(DefaultBranchAssigner.defaultNumBranches(definition, 0), 1);
        definition.defineGeneration(0, 1, 0);
        // a single founder branch doubles into two
        Assert.assertEquals(DefaultBranchAssigner.defaultNumBranches(definition, 1), 2);
        definition.defineGeneration(1, 2, 0);
        Assert.assertEquals(DefaultBranchAssigner.defaultNumBranches(definition, 2), 2);
        definition.defineGeneration(2, 5, 0);
        Assert.assertEquals(DefaultBranchAssigner.defaultNumBranches(definition, 3), 5);
    }

    @Test
    public void testDefaultNumBranchesSeveralFounderBranches() {
        final PedigreeDefinition definition = new PedigreeDefinition("defaults", 1, 2, null);
        definition.defineGeneration(0, 3, 1);
        Assert.assertEquals(DefaultBranchAssigner.defaultNumBranches(definition, 1), 3);
    }

    @Test
    public void testSiblingsShareOneSpouse() {
        final PedigreeDefinition definition = new PedigreeDefinition("sibs", 1, 2, null);
        final Generation previous = definition.defineGeneration(0, 1, 1);
        final Generation current = definition.defineGeneration(1, 2, 1);
        DefaultBranchAssigner.assignDefaultParents(previous, current);

        final BranchRef founder = new BranchRef(0, 0);
        final ParentPair expected = new ParentPair(founder, Founder.spouseOf(founder, 1));
        Assert.assertEquals(current.getParents(0).get(), expected);
        Assert.assertEquals(current.getParents(1).get(), expected);
        Assert.assertEquals(previous.getNumSpouses(0), 1);
        Assert.assertFalse(current.isParentsAssigned(0));
    }

    @Test
    public void testExpansionWithLeftoverBranches() {
        final PedigreeDefinition definition = new PedigreeDefinition("expand", 1, 3, null);
        definition.defineGeneration(0, 1, 0);
        final Generation previous = definition.defineGeneration(1, 2, 0);
        final Generation current = definition.defineGeneration(2, 5, 1);
        DefaultBranchAssigner.assignDefaultParents(previous, current);

        // two children per previous branch, the fifth branch descends from new founders
        for (int b = 0; b < 4; b++) {
            final BranchRef parent = new BranchRef(1, b / 2);
            Assert.assertEquals(current.getParents(b).get(), new ParentPair(parent, Founder.spouseOf(parent, 1)), "branch " + b);
        }
        Assert.assertEquals(current.getParents(4).get(), ParentPair.unrelatedFounders(new BranchRef(2, 4)));
        Assert.assertEquals(previous.getNumSpouses(0), 1);
        Assert.assertEquals(previous.getNumSpouses(1), 1);
    }

    @Test
    public void testContraction() {
        final PedigreeDefinition definition = new PedigreeDefinition("contract", 1, 2, null);
        final Generation previous = definition.defineGeneration(0, 3, 0);
        final Generation current = definition.defineGeneration(1, 2, 1);
        DefaultBranchAssigner.assignDefaultParents(previous, current);

        for (int b = 0; b < 2; b++) {
            final BranchRef parent = new BranchRef(0, b);
            Assert.assertEquals(current.getParents(b).get(), new ParentPair(parent, Founder.spouseOf(parent, 1)));
        }
        Assert.assertEquals(previous.getNumSpouses(2), 0);
    }

    @Test
    public void testExplicitParentsAreKept() {
        final PedigreeDefinition definition = new PedigreeDefinition("explicit", 1, 2, null);
        final Generation previous = definition.defineGeneration(0, 2, 0);
        final Generation current = definition.defineGeneration(1, 4, 1);
        final ParentPair explicit = new ParentPair(new BranchRef(0, 0), new BranchRef(0, 1));
        current.assignParents(2, explicit);
        current.assignParents(3, explicit);
        DefaultBranchAssigner.assignDefaultParents(previous, current);

        Assert.assertEquals(current.getParents(2).get(), explicit);
        Assert.assertEquals(current.getParents(3).get(), explicit);
        // no child of the second branch needed a default spouse
        Assert.assertEquals(previous.getNumSpouses(0), 1);
        Assert.assertEquals(previous.getNumSpouses(1), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testGenerationsMustBeConsecutive() {
        final PedigreeDefinition definition = new PedigreeDefinition("gap", 1, 3, null);
        final Generation first = definition.defineGeneration(0, 1, 0);
        definition.defineGeneration(1, 2, 0);
        final Generation third = definition.defineGeneration(2, 2, 1);
        DefaultBranchAssigner.assignDefaultParents(first, third);
    }
}
