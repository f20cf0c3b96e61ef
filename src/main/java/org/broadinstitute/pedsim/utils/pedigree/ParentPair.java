package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.utils.Utils;

/**
 * The two parents of a branch, in the order they were given in the def file (or assigned by default:
 * the parent from the previous generation first).
 */
public final class ParentPair {
    private final Parent first;
    private final Parent second;

    public ParentPair(final Parent first, final Parent second) {
        this.first = Utils.nonNull(first, "first parent");
        this.second = Utils.nonNull(second, "second parent");
    }

    /**
     * @return a couple of new founders, unrelated to each other and to every other branch, for {@code child}
     */
    public static ParentPair unrelatedFounders(final BranchRef child) {
        return new ParentPair(Founder.unrelated(child, 1), Founder.unrelated(child, 2));
    }

    public Parent getFirst() {
        return first;
    }

    public Parent getSecond() {
        return second;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final ParentPair that = (ParentPair) o;
        return first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return 31 * first.hashCode() + second.hashCode();
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
