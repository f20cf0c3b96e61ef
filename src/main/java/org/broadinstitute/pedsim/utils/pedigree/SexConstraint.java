package org.broadinstitute.pedsim.utils.pedigree;

import java.util.Optional;

/**
 * Sex state of the founder-equivalent individual of one branch: the sex assigned to it (explicitly in the
 * def file, or once its definition is complete, inferred from its marriages) and, while the definition is
 * being read, the side of the {@link SexGroup} it belongs to.
 */
public final class SexConstraint {
    private Sex sex = null;
    private SexGroup group = null;
    private SexGroup.Side side = null;

    SexConstraint() { }

    public Optional<Sex> getSex() {
        return Optional.ofNullable(sex);
    }

    void setSex(final Sex sex) {
        this.sex = sex;
    }

    Optional<SexGroup> getGroup() {
        return Optional.ofNullable(group);
    }

    SexGroup.Side getSide() {
        return side;
    }

    void setGroup(final SexGroup group, final SexGroup.Side side) {
        this.group = group;
        this.side = side;
    }

    void clearGroup() {
        this.group = null;
        this.side = null;
    }

    @Override
    public String toString() {
        return "SexConstraint{sex=" + sex + ", group=" + (group == null ? "none" : group.getId() + "/" + side) + "}";
    }
}
