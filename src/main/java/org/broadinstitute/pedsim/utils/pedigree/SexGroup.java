package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.utils.Utils;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Two sets of branches linked by marriages: every branch on one side must have the same sex, and that sex
 * must be the opposite of the sex of every branch on the other side.  At most one sex is stored, for the
 * {@link Side#FIRST} side; the {@link Side#SECOND} side always resolves to its opposite.
 */
final class SexGroup {

    enum Side {
        FIRST, SECOND;

        Side opposite() {
            return this == FIRST ? SECOND : FIRST;
        }
    }

    private final int id;
    private final Map<Side, SortedSet<BranchRef>> members = new EnumMap<>(Side.class);
    private Sex firstSideSex = null;

    SexGroup(final int id) {
        this.id = id;
        for (final Side side : Side.values()) {
            members.put(side, new TreeSet<>());
        }
    }

    /**
     * @return the creation-order id of this group within its pedigree
     */
    int getId() {
        return id;
    }

    void add(final Side side, final BranchRef branch) {
        members.get(side).add(Utils.nonNull(branch));
    }

    void addAll(final Side side, final Collection<BranchRef> branches) {
        members.get(side).addAll(branches);
    }

    SortedSet<BranchRef> getMembers(final Side side) {
        return Collections.unmodifiableSortedSet(members.get(side));
    }

    boolean isResolved() {
        return firstSideSex != null;
    }

    Optional<Sex> getSex(final Side side) {
        if (firstSideSex == null) {
            return Optional.empty();
        }
        return Optional.of(side == Side.FIRST ? firstSideSex : firstSideSex.opposite());
    }

    void setSex(final Side side, final Sex sex) {
        Utils.nonNull(sex);
        Utils.validate(firstSideSex == null, () -> "sex of group " + id + " is already resolved");
        firstSideSex = side == Side.FIRST ? sex : sex.opposite();
    }

    /**
     * @return true if some branch is on both sides, that is, required to be both sexes at once
     */
    boolean sidesIntersect() {
        return !Collections.disjoint(members.get(Side.FIRST), members.get(Side.SECOND));
    }

    @Override
    public String toString() {
        return "SexGroup{" + id + ", " + members + ", firstSideSex=" + firstSideSex + "}";
    }
}
