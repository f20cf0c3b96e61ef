package org.broadinstitute.pedsim.utils.pedigree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pedsim.exceptions.DefFileException;
import org.broadinstitute.pedsim.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Tracks which branches of one pedigree must have the same or the opposite sex because they have children
 * together, and checks that these requirements and the explicitly assigned sexes never contradict each other.
 *
 * Every marriage between two branches puts them on opposite sides of a {@link SexGroup}.  Groups are created
 * lazily and merged when a marriage links branches of two different groups.  Sexes known for any member
 * (explicitly assigned, or inferred through a chain of marriages) are kept on the group until {@link #finish()}
 * writes them back to every member's {@link SexConstraint}.
 */
public final class SexConstraintResolver {
    private static final Logger logger = LogManager.getLogger(SexConstraintResolver.class);

    private final String source;
    private final Function<BranchRef, SexConstraint> constraints;

    // live groups, in creation order
    private final List<SexGroup> groups = new ArrayList<>();
    private int nextGroupId = 0;

    /**
     * @param source name of the def file, for diagnostics
     * @param constraints gives the sex constraint of every branch that can be married
     */
    public SexConstraintResolver(final String source, final Function<BranchRef, SexConstraint> constraints) {
        this.source = Utils.nonNull(source);
        this.constraints = Utils.nonNull(constraints);
    }

    /**
     * Records that branches {@code a} and {@code b} have children together and so must have opposite sexes.
     *
     * @param lineNumber line of the def file giving the marriage, for diagnostics
     * @throws DefFileException.InconsistentSex if the two branches are already required to have the same sex
     */
    public void addMarriage(final BranchRef a, final BranchRef b, final int lineNumber) {
        Utils.nonNull(a);
        Utils.nonNull(b);
        Utils.validateArg(!a.equals(b), () -> "cannot marry " + a + " to itself");

        final SexConstraint constraintA = constraints.apply(a);
        final SexConstraint constraintB = constraints.apply(b);
        final Optional<SexGroup> groupA = constraintA.getGroup();
        final Optional<SexGroup> groupB = constraintB.getGroup();

        if ( !groupA.isPresent() && !groupB.isPresent() ) {
            marryUngrouped(a, constraintA, b, constraintB, lineNumber);
        } else if ( !groupA.isPresent() ) {
            marryIntoGroup(a, constraintA, b, constraintB, lineNumber);
        } else if ( !groupB.isPresent() ) {
            marryIntoGroup(b, constraintB, a, constraintA, lineNumber);
        } else if ( groupA.get() == groupB.get() ) {
            if ( constraintA.getSide() == constraintB.getSide() ) {
                throw new DefFileException.InconsistentSex(source, lineNumber, String.format(
                        "assigning %s and %s as parents is impossible due to other parent assignments: they necessarily have same sex", a, b));
            }
            // already on opposite sides: nothing new
        } else {
            merge(a, constraintA, b, constraintB, lineNumber);
        }
    }

    private void marryUngrouped(final BranchRef a, final SexConstraint constraintA,
                                final BranchRef b, final SexConstraint constraintB,
                                final int lineNumber) {
        final Optional<Sex> sexA = constraintA.getSex();
        final Optional<Sex> sexB = constraintB.getSex();
        if ( sexA.isPresent() && sexB.isPresent() && sexA.get() == sexB.get() ) {
            throw new DefFileException.InconsistentSex(source, lineNumber, String.format(
                    "assigning %s and %s as parents is impossible: they are assigned the same sex", a, b));
        }

        final SexGroup group = new SexGroup(nextGroupId++);
        group.add(SexGroup.Side.FIRST, a);
        group.add(SexGroup.Side.SECOND, b);
        constraintA.setGroup(group, SexGroup.Side.FIRST);
        constraintB.setGroup(group, SexGroup.Side.SECOND);

        if ( sexA.isPresent() ) {
            group.setSex(SexGroup.Side.FIRST, sexA.get());
        } else if ( sexB.isPresent() ) {
            group.setSex(SexGroup.Side.SECOND, sexB.get());
        }
        groups.add(group);
        logger.debug("New sex group " + group);
    }

    private void marryIntoGroup(final BranchRef newcomer, final SexConstraint newcomerConstraint,
                                final BranchRef grouped, final SexConstraint groupedConstraint,
                                final int lineNumber) {
        final SexGroup group = groupedConstraint.getGroup().get();
        final SexGroup.Side side = groupedConstraint.getSide().opposite();

        final Optional<Sex> newcomerSex = newcomerConstraint.getSex();
        if ( newcomerSex.isPresent() ) {
            final Optional<Sex> sideSex = group.getSex(side);
            if ( !sideSex.isPresent() ) {
                group.setSex(side, newcomerSex.get());
            } else if ( sideSex.get() != newcomerSex.get() ) {
                throw new DefFileException.InconsistentSex(source, lineNumber, String.format(
                        "assigning %s as a parent with %s is impossible: due to sex assignments and/or other parent assignments they necessarily have the same sex",
                        newcomer, grouped));
            }
        }

        group.add(side, newcomer);
        newcomerConstraint.setGroup(group, side);
    }

    /**
     * Merges the group of {@code b} into the group of {@code a} so that the two end up on opposite sides.
     */
    private void merge(final BranchRef a, final SexConstraint constraintA,
                       final BranchRef b, final SexConstraint constraintB,
                       final int lineNumber) {
        final SexGroup target = constraintA.getGroup().get();
        final SexGroup absorbed = constraintB.getGroup().get();
        final SexGroup.Side sideA = constraintA.getSide();
        final SexGroup.Side sideB = constraintB.getSide();

        // the side of b's group opposite b lands on a's side, and b's side lands opposite a
        final Optional<Sex> targetSex = target.getSex(sideA);
        final Optional<Sex> incomingSex = absorbed.getSex(sideB.opposite());
        if ( targetSex.isPresent() && incomingSex.isPresent() && targetSex.get() != incomingSex.get() ) {
            throw new DefFileException.InconsistentSex(source, lineNumber, String.format(
                    "assigning %s as a parent with %s is impossible: due to sex assignments and/or other parent assignments they necessarily have the same sex",
                    a, b));
        }
        if ( !targetSex.isPresent() && incomingSex.isPresent() ) {
            target.setSex(sideA, incomingSex.get());
        }

        final SortedSet<BranchRef> sameSideAsA = new TreeSet<>(absorbed.getMembers(sideB.opposite()));
        final SortedSet<BranchRef> sameSideAsB = new TreeSet<>(absorbed.getMembers(sideB));
        target.addAll(sideA, sameSideAsA);
        target.addAll(sideA.opposite(), sameSideAsB);

        if ( target.sidesIntersect() ) {
            throw new DefFileException.InconsistentSex(source, lineNumber, String.format(
                    "assigning %s and %s as parents is impossible due to other parent assignments: they necessarily have same sex", a, b));
        }

        for ( final BranchRef member : sameSideAsA ) {
            constraints.apply(member).setGroup(target, sideA);
        }
        for ( final BranchRef member : sameSideAsB ) {
            constraints.apply(member).setGroup(target, sideA.opposite());
        }
        groups.remove(absorbed);
        logger.debug("Merged sex group " + absorbed.getId() + " into " + target);
    }

    /**
     * Assigns {@code sex} to the founder-equivalent individual of {@code branch}.  If the branch already
     * belongs to a group the sex is propagated to the whole group.
     *
     * @param lineNumber line of the def file giving the assignment, for diagnostics
     * @throws DefFileException.DuplicateAssignment if the branch was already explicitly assigned a sex
     * @throws DefFileException.InconsistentSex if the group of the branch requires the other sex
     */
    public void assignSex(final BranchRef branch, final Sex sex, final int lineNumber) {
        Utils.nonNull(branch);
        Utils.nonNull(sex);

        final SexConstraint constraint = constraints.apply(branch);
        if ( constraint.getSex().isPresent() ) {
            throw new DefFileException.DuplicateAssignment(source, lineNumber, String.format(
                    "sex of branch number %d in generation %d assigned multiple times", branch.getBranch() + 1, branch.getGeneration() + 1));
        }

        final Optional<SexGroup> group = constraint.getGroup();
        if ( group.isPresent() ) {
            final Optional<Sex> groupSex = group.get().getSex(constraint.getSide());
            if ( !groupSex.isPresent() ) {
                group.get().setSex(constraint.getSide(), sex);
            } else if ( groupSex.get() != sex ) {
                throw new DefFileException.InconsistentSex(source, lineNumber, String.format(
                        "assigning sex %s to %s is impossible: due to other sex and parent assignments it must be %s",
                        sex.getSymbol(), branch, groupSex.get().getSymbol()));
            }
        }
        constraint.setSex(sex);
    }

    /**
     * @return the sex currently known for {@code branch}, explicitly assigned or inferred from its group
     */
    public Optional<Sex> getResolvedSex(final BranchRef branch) {
        final SexConstraint constraint = constraints.apply(Utils.nonNull(branch));
        if ( constraint.getSex().isPresent() ) {
            return constraint.getSex();
        }
        return constraint.getGroup().flatMap(group -> group.getSex(constraint.getSide()));
    }

    /**
     * @return true if {@code a} and {@code b} are currently required to have opposite sexes
     */
    public boolean requiresOppositeSex(final BranchRef a, final BranchRef b) {
        final SexConstraint constraintA = constraints.apply(Utils.nonNull(a));
        final SexConstraint constraintB = constraints.apply(Utils.nonNull(b));
        return constraintA.getGroup().isPresent()
                && constraintA.getGroup().equals(constraintB.getGroup())
                && constraintA.getSide() != constraintB.getSide();
    }

    public int getNumGroups() {
        return groups.size();
    }

    /**
     * Writes the sex of every resolved group into the {@link SexConstraint} of each of its members, in the order
     * the groups were created, and discards all groups.  Calling this again without new marriages does nothing.
     */
    public void finish() {
        for ( final SexGroup group : groups ) {
            for ( final SexGroup.Side side : SexGroup.Side.values() ) {
                final Optional<Sex> sex = group.getSex(side);
                for ( final BranchRef member : group.getMembers(side) ) {
                    final SexConstraint constraint = constraints.apply(member);
                    if ( sex.isPresent() ) {
                        Utils.validate(!constraint.getSex().isPresent() || constraint.getSex().get() == sex.get(),
                                () -> member + " has sex " + constraint.getSex().get() + " but its sex group requires " + sex.get());
                        constraint.setSex(sex.get());
                    }
                    constraint.clearGroup();
                }
            }
        }
        if ( !groups.isEmpty() ) {
            logger.debug("Committed " + groups.size() + " sex groups");
        }
        groups.clear();
    }

    /**
     * Unmodifiable view of the live groups, for tests.
     */
    List<SexGroup> getGroups() {
        return Collections.unmodifiableList(groups);
    }
}
