package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.utils.Utils;

import java.util.Comparator;

/**
 * Coordinates of a branch: a 0-based generation index and a 0-based branch index within that generation.
 * Ordered by generation, then branch.
 */
public final class BranchRef implements Parent, Comparable<BranchRef> {
    private static final Comparator<BranchRef> COMPARATOR =
            Comparator.comparingInt(BranchRef::getGeneration).thenComparingInt(BranchRef::getBranch);

    private final int generation;
    private final int branch;

    public BranchRef(final int generation, final int branch) {
        Utils.validateArg(generation >= 0, () -> "generation index must be non-negative but was " + generation);
        Utils.validateArg(branch >= 0, () -> "branch index must be non-negative but was " + branch);
        this.generation = generation;
        this.branch = branch;
    }

    public int getGeneration() {
        return generation;
    }

    public int getBranch() {
        return branch;
    }

    @Override
    public boolean isFounder() {
        return false;
    }

    @Override
    public int compareTo(final BranchRef other) {
        return COMPARATOR.compare(this, other);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final BranchRef that = (BranchRef) o;
        return generation == that.generation && branch == that.branch;
    }

    @Override
    public int hashCode() {
        return 31 * generation + branch;
    }

    /**
     * Renders the coordinates 1-based, the way they are written in def files and diagnostics.
     */
    @Override
    public String toString() {
        return String.format("branch %d from generation %d", branch + 1, generation + 1);
    }
}
