package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.utils.Utils;

/**
 * Default branch counts and parents for the parts of a pedigree a def file leaves out.
 *
 * Each branch of the previous generation has children in {@code k = max(1, current / previous)} consecutive
 * branches of the current generation, always with the same newly introduced founder spouse.  Branches past
 * {@code previous * k} descend from a brand new couple of unrelated founders.
 */
public final class DefaultBranchAssigner {

    private DefaultBranchAssigner() {}

    /**
     * Number of branches of a generation that has no explicit branch count: 1 for the first generation,
     * 2 for the second one if the first has a single branch, otherwise the same as the previous generation.
     *
     * @param generation 0-based index of the generation; all earlier generations must be defined
     */
    public static int defaultNumBranches(final PedigreeDefinition definition, final int generation) {
        Utils.nonNull(definition);
        Utils.validIndex(generation, definition.getNumGenerations());
        if (generation == 0) {
            return 1;
        } else if (generation == 1 && definition.getNumBranches(0) == 1) {
            return 2;
        } else {
            return definition.getNumBranches(generation - 1);
        }
    }

    /**
     * Assigns default parents to every branch of {@code current} whose parents were not given explicitly.
     * Each previous branch that is the default parent of at least one such branch gets exactly one new founder
     * spouse, numbered with {@link Generation#nextSpouseNumber(int)}.
     */
    public static void assignDefaultParents(final Generation previous, final Generation current) {
        Utils.nonNull(previous);
        Utils.nonNull(current);
        Utils.validateArg(current.getIndex() == previous.getIndex() + 1, "generations must be consecutive");

        final int prevNumBranches = previous.getNumBranches();
        final int curNumBranches = current.getNumBranches();
        final int multFactor = Math.max(1, curNumBranches / prevNumBranches);

        for (int prevB = 0; prevB < prevNumBranches && prevB < curNumBranches; prevB++) {
            final BranchRef parent = previous.getBranchRef(prevB);
            Founder spouse = null;
            for (int multB = 0; multB < multFactor; multB++) {
                final int curB = prevB * multFactor + multB;
                if (current.isParentsAssigned(curB)) {
                    continue;
                }
                if (spouse == null) {
                    spouse = Founder.spouseOf(parent, previous.nextSpouseNumber(prevB));
                }
                current.setDefaultParents(curB, new ParentPair(parent, spouse));
            }
        }

        for (int newB = prevNumBranches * multFactor; newB < curNumBranches; newB++) {
            if (!current.isParentsAssigned(newB)) {
                current.setDefaultParents(newB, ParentPair.unrelatedFounders(current.getBranchRef(newB)));
            }
        }
    }
}
