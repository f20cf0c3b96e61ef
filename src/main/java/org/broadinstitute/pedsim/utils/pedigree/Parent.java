package org.broadinstitute.pedsim.utils.pedigree;

/**
 * One of the two parents of a branch: either the founder-equivalent individual of a branch in an
 * earlier generation ({@link BranchRef}) or an individual with no parents in the pedigree ({@link Founder}).
 */
public interface Parent {

    /**
     * @return true if this parent has no parents of its own in the pedigree
     */
    boolean isFounder();
}
