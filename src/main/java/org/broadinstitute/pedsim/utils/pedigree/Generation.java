package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.utils.Utils;

import java.util.Arrays;
import java.util.Optional;

/**
 * The branches of one generation of a {@link PedigreeDefinition}: per branch, the number of samples to print,
 * the two parents (none in the first generation), the {@link SexConstraint} and the number of founder spouses
 * introduced to have children with it.
 */
public final class Generation {
    private final PedigreeDefinition owner;
    private final int index;
    private final int[] numSamplesToPrint;
    private final ParentPair[] parents;
    private final boolean[] parentsAssigned;
    private final SexConstraint[] sexConstraints;
    private final int[] numSpouses;

    Generation(final PedigreeDefinition owner, final int index, final int numBranches, final int numSamplesToPrint) {
        Utils.validateArg(index >= 0, "generation index must be non-negative");
        Utils.validateArg(numBranches > 0, () -> "a generation needs at least one branch but got " + numBranches);
        Utils.validateArg(numSamplesToPrint >= 0, "number of samples to print must be non-negative");
        this.owner = Utils.nonNull(owner);
        this.index = index;
        this.numSamplesToPrint = new int[numBranches];
        Arrays.fill(this.numSamplesToPrint, numSamplesToPrint);
        this.parents = index == 0 ? null : new ParentPair[numBranches];
        this.parentsAssigned = new boolean[numBranches];
        this.sexConstraints = new SexConstraint[numBranches];
        for (int b = 0; b < numBranches; b++) {
            sexConstraints[b] = new SexConstraint();
        }
        this.numSpouses = new int[numBranches];
    }

    /**
     * @return the 0-based index of this generation
     */
    public int getIndex() {
        return index;
    }

    public int getNumBranches() {
        return numSamplesToPrint.length;
    }

    public BranchRef getBranchRef(final int branch) {
        return new BranchRef(index, Utils.validIndex(branch, getNumBranches()));
    }

    public int getNumSamplesToPrint(final int branch) {
        return numSamplesToPrint[Utils.validIndex(branch, getNumBranches())];
    }

    void setNumSamplesToPrint(final int branch, final int numToPrint) {
        owner.checkNotFinalized();
        Utils.validateArg(numToPrint >= 0, "number of samples to print must be non-negative");
        numSamplesToPrint[Utils.validIndex(branch, getNumBranches())] = numToPrint;
    }

    /**
     * @return the parents of {@code branch}, or empty in the first generation and while a branch is not yet assigned
     */
    public Optional<ParentPair> getParents(final int branch) {
        Utils.validIndex(branch, getNumBranches());
        return parents == null ? Optional.empty() : Optional.ofNullable(parents[branch]);
    }

    /**
     * @return true if the parents of {@code branch} were given explicitly in the def file
     */
    public boolean isParentsAssigned(final int branch) {
        return parentsAssigned[Utils.validIndex(branch, getNumBranches())];
    }

    void assignParents(final int branch, final ParentPair pair) {
        setParents(branch, pair);
        parentsAssigned[branch] = true;
    }

    void setDefaultParents(final int branch, final ParentPair pair) {
        Utils.validate(!isParentsAssigned(branch), () -> "parents of branch " + (branch + 1) + " were assigned explicitly");
        setParents(branch, pair);
    }

    private void setParents(final int branch, final ParentPair pair) {
        owner.checkNotFinalized();
        Utils.validate(parents != null, "the first generation has no parents");
        parents[Utils.validIndex(branch, getNumBranches())] = Utils.nonNull(pair);
    }

    public SexConstraint getSexConstraint(final int branch) {
        return sexConstraints[Utils.validIndex(branch, getNumBranches())];
    }

    /**
     * @return how many founder spouses were introduced to have children with {@code branch}
     */
    public int getNumSpouses(final int branch) {
        return numSpouses[Utils.validIndex(branch, getNumBranches())];
    }

    /**
     * Introduces another founder spouse of {@code branch}.
     * @return the 1-based number of the new spouse
     */
    int nextSpouseNumber(final int branch) {
        owner.checkNotFinalized();
        return ++numSpouses[Utils.validIndex(branch, getNumBranches())];
    }

    @Override
    public String toString() {
        return "Generation{" + (index + 1) + ", branches=" + getNumBranches() + ", print=" + Arrays.toString(numSamplesToPrint) + "}";
    }
}
