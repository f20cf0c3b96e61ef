package org.broadinstitute.pedsim.utils.pedigree;

import org.broadinstitute.pedsim.exceptions.PedSimException;
import org.broadinstitute.pedsim.utils.Utils;

import java.util.Optional;

/**
 * One pedigree template read from a def file: its name, how many replicates to simulate, and for every
 * generation the branches with their parents, print counts and sexes.
 *
 * Generations and branches are 0-based here; def files and diagnostics number them from 1.
 *
 * Definitions are built by {@link PedigreeDefinitionBuilder} and are finalized before {@link DefFileReader}
 * hands them out.  A finalized definition is fully resolved: every generation is present and every branch
 * after the first generation has both parents.
 */
public final class PedigreeDefinition {
    private final String name;
    private final int numReplicates;
    private final Sex founderSex;
    private final Generation[] generations;
    private boolean finalized = false;

    PedigreeDefinition(final String name, final int numReplicates, final int numGenerations, final Sex founderSex) {
        Utils.nonEmpty(name, "pedigree name");
        Utils.validateArg(numReplicates >= 0, "number of replicates must be non-negative");
        Utils.validateArg(numGenerations > 0, "a pedigree needs at least one generation");
        this.name = name;
        this.numReplicates = numReplicates;
        this.founderSex = founderSex;
        this.generations = new Generation[numGenerations];
    }

    public String getName() {
        return name;
    }

    public int getNumReplicates() {
        return numReplicates;
    }

    public int getNumGenerations() {
        return generations.length;
    }

    /**
     * @return the sex every founder-equivalent individual has by default, if the def header fixes one
     */
    public Optional<Sex> getFounderSex() {
        return Optional.ofNullable(founderSex);
    }

    public boolean isFinalized() {
        return finalized;
    }

    public int getNumBranches(final int generation) {
        return getGeneration(generation).getNumBranches();
    }

    public int getNumSamplesToPrint(final int generation, final int branch) {
        return getGeneration(generation).getNumSamplesToPrint(branch);
    }

    /**
     * @param generation a generation after the first
     */
    public ParentPair getParents(final int generation, final int branch) {
        Utils.validateArg(generation > 0, "branches of the first generation are founders and have no parents");
        return getGeneration(generation).getParents(branch).orElseThrow(
                () -> new IllegalStateException("parents of branch " + (branch + 1) + " in generation " + (generation + 1) + " are not assigned"));
    }

    /**
     * @return the sex of the founder-equivalent individual of the branch, if it is assigned or implied by marriages
     */
    public Optional<Sex> getSex(final int generation, final int branch) {
        return getGeneration(generation).getSexConstraint(branch).getSex();
    }

    public int getNumSpouses(final int generation, final int branch) {
        return getGeneration(generation).getNumSpouses(branch);
    }

    /**
     * @return the number of samples printed for one replicate of this pedigree
     */
    public int getNumSamplesToPrintPerReplicate() {
        int total = 0;
        for (int gen = 0; gen < getNumGenerations(); gen++) {
            for (int b = 0; b < getNumBranches(gen); b++) {
                total += getNumSamplesToPrint(gen, b);
            }
        }
        return total;
    }

    /**
     * @throws IllegalArgumentException if the generation has not been defined yet
     */
    public Generation getGeneration(final int generation) {
        final Generation gen = generations[Utils.validIndex(generation, generations.length)];
        Utils.validateArg(gen != null, () -> "generation " + (generation + 1) + " of pedigree " + name + " is not defined yet");
        return gen;
    }

    boolean isDefined(final int generation) {
        return generations[Utils.validIndex(generation, generations.length)] != null;
    }

    Generation defineGeneration(final int generation, final int numBranches, final int numSamplesToPrint) {
        checkNotFinalized();
        Utils.validate(!isDefined(generation), () -> "generation " + (generation + 1) + " is already defined");
        Utils.validate(generation == 0 || isDefined(generation - 1), "generations must be defined in order");
        generations[generation] = new Generation(this, generation, numBranches, numSamplesToPrint);
        return generations[generation];
    }

    /**
     * @return the sex constraint of {@code branch}, which must be in an already defined generation
     */
    SexConstraint getSexConstraint(final BranchRef branch) {
        return getGeneration(branch.getGeneration()).getSexConstraint(branch.getBranch());
    }

    void checkNotFinalized() {
        if (finalized) {
            throw new PedSimException.DefinitionAlreadyFinalized(name);
        }
    }

    void markFinalized() {
        checkNotFinalized();
        for (final Generation gen : generations) {
            Utils.validate(gen != null, "all generations must be defined before finalizing");
            if (gen.getIndex() == 0) {
                continue;
            }
            for (int b = 0; b < gen.getNumBranches(); b++) {
                Utils.validate(gen.getParents(b).isPresent(), "every branch after the first generation needs parents");
            }
        }
        finalized = true;
    }

    @Override
    public String toString() {
        return "PedigreeDefinition{" + name + ", replicates=" + numReplicates + ", generations=" + generations.length + "}";
    }
}
