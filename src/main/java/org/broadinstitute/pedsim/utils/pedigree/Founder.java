package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.utils.Utils;

import java.util.Objects;
import java.util.Optional;

/**
 * A parent with no parents of its own in the pedigree.
 *
 * Founders introduced as the spouse of a branch are numbered per branch, starting at 1, so the pair
 * (spouse branch, spouse number) identifies them uniquely within a pedigree.  Branches that descend from neither
 * an earlier branch nor a spouse (the excess branches of a generation and explicitly unrelated parents) get a
 * couple of their own, identified by (child branch, parent number 1 or 2).
 */
public final class Founder implements Parent {

    private final BranchRef spouse;
    private final int spouseNumber;
    private final BranchRef child;
    private final int parentNumber;

    private Founder(final BranchRef spouse, final int spouseNumber, final BranchRef child, final int parentNumber) {
        this.spouse = spouse;
        this.spouseNumber = spouseNumber;
        this.child = child;
        this.parentNumber = parentNumber;
    }

    /**
     * @param spouse the branch this founder has children with
     * @param spouseNumber 1-based number of this founder among the spouses of {@code spouse}
     */
    public static Founder spouseOf(final BranchRef spouse, final int spouseNumber) {
        Utils.nonNull(spouse, "spouse");
        Utils.validateArg(spouseNumber > 0, () -> "spouse numbers are 1-based but got " + spouseNumber);
        return new Founder(spouse, spouseNumber, null, 0);
    }

    /**
     * @param child the branch whose parents are both new founders
     * @param parentNumber 1 or 2
     * @return a founder unrelated to any other branch of the pedigree
     */
    public static Founder unrelated(final BranchRef child, final int parentNumber) {
        Utils.nonNull(child, "child");
        Utils.validateArg(parentNumber == 1 || parentNumber == 2, () -> "parent number must be 1 or 2 but got " + parentNumber);
        return new Founder(null, 0, child, parentNumber);
    }

    @Override
    public boolean isFounder() {
        return true;
    }

    public boolean isUnrelated() {
        return child != null;
    }

    public Optional<BranchRef> getSpouse() {
        return Optional.ofNullable(spouse);
    }

    /**
     * @return the 1-based number of this founder among the spouses of {@link #getSpouse()}, or 0 for an unrelated founder
     */
    public int getSpouseNumber() {
        return spouseNumber;
    }

    /**
     * @return for an unrelated founder, the branch it is a parent of
     */
    public Optional<BranchRef> getChild() {
        return Optional.ofNullable(child);
    }

    /**
     * @return 1 or 2 for an unrelated founder, 0 otherwise
     */
    public int getParentNumber() {
        return parentNumber;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Founder founder = (Founder) o;
        return spouseNumber == founder.spouseNumber && parentNumber == founder.parentNumber
                && Objects.equals(spouse, founder.spouse) && Objects.equals(child, founder.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spouse, spouseNumber, child, parentNumber);
    }

    @Override
    public String toString() {
        return spouse == null
                ? String.format("unrelated founder %d of %s", parentNumber, child)
                : String.format("founder spouse %d of %s", spouseNumber, spouse);
    }
}
