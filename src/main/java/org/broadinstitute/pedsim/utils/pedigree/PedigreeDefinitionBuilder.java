package org.broadinstitute.pedsim.utils.pedigree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pedsim.exceptions.DefFileException;
import org.broadinstitute.pedsim.utils.Utils;
import org.broadinstitute.pedsim.utils.text.TokenizedLine;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Builds one {@link PedigreeDefinition} from its {@code def} header and the generation lines that follow it:
 *
 *      def name numReplicates numGenerations [M|F]
 *      generation numToPrint [numBranches] [directive ...]
 *
 * Generation lines must come in increasing generation order.  Generations without a line get default branch
 * counts and parents and print nothing.  {@link #finish()} completes the definition once the block ends.
 */
public final class PedigreeDefinitionBuilder {
    private static final Logger logger = LogManager.getLogger(PedigreeDefinitionBuilder.class);

    public static final String DEF_KEYWORD = "def";

    /**
     * Upper bound on the number of branches of one pedigree, summed over its generations.  Also bounds the number
     * of generations, since every generation has at least one branch.
     */
    public static final int MAX_BRANCHES_PER_PEDIGREE = 1_000_000;

    private static final String DEF_USAGE = "expect four or five fields for pedigree definition: def [name] [numReps] [numGen] <sex of i1>";
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private final String source;
    private final PedigreeDefinition definition;
    private final SexConstraintResolver resolver;
    private final BranchSpecParser branchSpecParser;
    private final Consumer<String> warnings;
    private final boolean warnOnLastGenerationNoPrint;
    private final int headerLineNumber;

    private int totalBranches = 0;
    // index of the last generation defined so far, -1 before the first
    private int lastDefinedGeneration = -1;
    private boolean finished = false;

    private PedigreeDefinitionBuilder(final String source, final PedigreeDefinition definition, final int headerLineNumber,
                                      final Consumer<String> warnings, final boolean warnOnLastGenerationNoPrint) {
        this.source = source;
        this.definition = definition;
        this.resolver = new SexConstraintResolver(source, definition::getSexConstraint);
        this.branchSpecParser = new BranchSpecParser(source, definition, resolver, warnings);
        this.warnings = warnings;
        this.warnOnLastGenerationNoPrint = warnOnLastGenerationNoPrint;
        this.headerLineNumber = headerLineNumber;
    }

    /**
     * Starts a new definition from its {@code def} header line.
     *
     * @param source name of the def file, for diagnostics
     * @param warnings receives the text of every non-fatal problem
     * @param warnOnLastGenerationNoPrint whether to warn when the last generation has branches that print nothing
     */
    public static PedigreeDefinitionBuilder fromHeader(final TokenizedLine header, final String source,
                                                       final Consumer<String> warnings,
                                                       final boolean warnOnLastGenerationNoPrint) {
        Utils.nonNull(header);
        Utils.nonNull(source);
        Utils.nonNull(warnings);
        Utils.validateArg(header.getFirst().equals(DEF_KEYWORD), () -> "not a def header: " + header);

        final int lineNumber = header.getLineNumber();
        if (header.size() < 4 || header.size() > 5) {
            throw new DefFileException.MalformedLine(source, lineNumber, DEF_USAGE);
        }

        final String name = header.get(1);
        final int numReplicates = parseInt(header.get(2), source, lineNumber, "expected number of replicates to simulate as second token");
        final int numGenerations = parseInt(header.get(3), source, lineNumber, "expected number of generations to simulate as third token");
        if (numReplicates < 0) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "number of replicates for pedigree \"%s\" must not be negative but was %d", name, numReplicates));
        }
        if (numGenerations < 1) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "pedigree \"%s\" must have at least one generation but has %d", name, numGenerations));
        }
        if (numGenerations > MAX_BRANCHES_PER_PEDIGREE) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "pedigree \"%s\" has %d generations, more than the maximum of %d", name, numGenerations, MAX_BRANCHES_PER_PEDIGREE));
        }

        Sex founderSex = null;
        if (header.size() == 5) {
            final Optional<Sex> sex = Sex.fromSymbol(header.get(4));
            if (!sex.isPresent()) {
                throw new DefFileException.MalformedLine(source, lineNumber, String.format(
                        "allowed values for sex of i1 field are 'M' and 'F' but got %s", header.get(4)));
            }
            founderSex = sex.get();
        }

        logger.debug(String.format("Line %d: pedigree %s with %d replicates and %d generations", lineNumber, name, numReplicates, numGenerations));
        return new PedigreeDefinitionBuilder(source, new PedigreeDefinition(name, numReplicates, numGenerations, founderSex),
                lineNumber, warnings, warnOnLastGenerationNoPrint);
    }

    public String getName() {
        return definition.getName();
    }

    /**
     * @return the definition being built; incomplete until {@link #finish()} is called
     */
    PedigreeDefinition getDefinition() {
        return definition;
    }

    SexConstraintResolver getResolver() {
        return resolver;
    }

    /**
     * Applies one generation line: defines any skipped generations with defaults, then the listed generation
     * with its print count, branch count and directives, then default parents for its unassigned branches.
     */
    public void addGenerationLine(final TokenizedLine line) {
        Utils.nonNull(line);
        definition.checkNotFinalized();
        Utils.validate(!finished, "definition is already finished");

        final int lineNumber = line.getLineNumber();
        final int generationNumber = parseInt(line.get(0), source, lineNumber, "expected generation number or \"def\" as first token");
        if (line.size() < 2) {
            throw new DefFileException.MalformedLine(source, lineNumber, "expected at least two fields on a generation line");
        }
        final int numToPrint = parseInt(line.get(1), source, lineNumber, "expected number of samples to print as second token");

        final int numGenerations = definition.getNumGenerations();
        if (generationNumber < 1 || generationNumber > numGenerations) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "generation %d below 1 or above %d (max number of generations)", generationNumber, numGenerations));
        }
        if (numToPrint < 0) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "in generation %d, number of samples to print below 0", generationNumber));
        }
        if (generationNumber == 1 && numToPrint > 1) {
            throw new DefFileException.BadStructure(source, lineNumber,
                    "in generation 1, if founders are to be printed must list 1 as the number to be printed (others invalid)");
        }

        final int generation = generationNumber - 1;
        if (generation == lastDefinedGeneration) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "multiple entries for generation %d", generationNumber));
        }
        if (generation < lastDefinedGeneration) {
            throw new DefFileException.BadStructure(source, lineNumber, "generation numbers must be in increasing order");
        }

        defineSkippedGenerations(generation, lineNumber);

        final List<String> tokens = line.getTokens();
        int firstDirective = 2;
        final int numBranches;
        if (tokens.size() > 2 && INTEGER.matcher(tokens.get(2)).matches()) {
            numBranches = parseInt(tokens.get(2), source, lineNumber, "optional third token must be numerical value giving number of branches");
            if (numBranches <= 0) {
                throw new DefFileException.BadStructure(source, lineNumber, String.format(
                        "in generation %d, branch number zero or below", generationNumber));
            }
            firstDirective = 3;
        } else {
            numBranches = DefaultBranchAssigner.defaultNumBranches(definition, generation);
        }

        final Generation current = defineGeneration(generation, numBranches, numToPrint, lineNumber);
        lastDefinedGeneration = generation;
        logger.debug(String.format("Line %d: generation %d of %s has %d branches printing %d samples each",
                lineNumber, generationNumber, definition.getName(), numBranches, numToPrint));

        branchSpecParser.applyDirectives(current, tokens.subList(firstDirective, tokens.size()), lineNumber);

        if (generation > 0) {
            DefaultBranchAssigner.assignDefaultParents(definition.getGeneration(generation - 1), current);
        }
    }

    /**
     * Defines every generation after the last defined one and before {@code generation} with its default
     * branch count and parents; these print nothing.
     */
    private void defineSkippedGenerations(final int generation, final int lineNumber) {
        for (int gen = lastDefinedGeneration + 1; gen < generation; gen++) {
            final Generation skipped = defineGeneration(gen, DefaultBranchAssigner.defaultNumBranches(definition, gen), 0, lineNumber);
            if (gen > 0) {
                DefaultBranchAssigner.assignDefaultParents(definition.getGeneration(gen - 1), skipped);
            }
            lastDefinedGeneration = gen;
        }
    }

    private Generation defineGeneration(final int generation, final int numBranches, final int numToPrint, final int lineNumber) {
        if (numBranches > MAX_BRANCHES_PER_PEDIGREE - totalBranches) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "generation %d would take pedigree \"%s\" over the maximum of %d branches",
                    generation + 1, definition.getName(), MAX_BRANCHES_PER_PEDIGREE));
        }
        totalBranches += numBranches;
        return definition.defineGeneration(generation, numBranches, numToPrint);
    }

    /**
     * Completes the definition: defines any remaining generations, commits the sexes implied by marriages,
     * checks that the last generation prints something, and finalizes it.  Calling this again returns the same
     * definition without doing anything.
     *
     * @throws DefFileException.IncompleteDefinition if no branch of the last generation prints any samples
     */
    public PedigreeDefinition finish() {
        if (finished) {
            return definition;
        }
        // generations left out at the end of the block are charged to the header that asked for them
        defineSkippedGenerations(definition.getNumGenerations(), headerLineNumber);
        resolver.finish();

        final int lastGeneration = definition.getNumGenerations() - 1;
        boolean someBranchToPrint = false;
        boolean anyNoPrint = false;
        for (int b = 0; b < definition.getNumBranches(lastGeneration); b++) {
            if (definition.getNumSamplesToPrint(lastGeneration, b) == 0) {
                anyNoPrint = true;
            } else {
                someBranchToPrint = true;
            }
        }
        if (!someBranchToPrint) {
            throw new DefFileException.IncompleteDefinition(source, String.format(
                    "request to simulate pedigree \"%s\" with %d generations but no request to print any samples from last generation (number %d)",
                    definition.getName(), definition.getNumGenerations(), definition.getNumGenerations()));
        }
        if (anyNoPrint && warnOnLastGenerationNoPrint) {
            final String message = String.format(
                    "no-print branches in last generation of pedigree %s: can omit these branches and possibly reduce number of founders needed",
                    definition.getName());
            logger.warn(message);
            warnings.accept(message);
        }

        definition.markFinalized();
        finished = true;
        return definition;
    }

    private static int parseInt(final String text, final String source, final int lineNumber, final String problem) {
        if (!INTEGER.matcher(text).matches()) {
            throw new DefFileException.MalformedNumber(source, lineNumber, problem + ", got \"" + text + "\"");
        }
        try {
            return Integer.parseInt(text);
        } catch (final NumberFormatException e) {
            throw new DefFileException.MalformedNumber(source, lineNumber, problem + ", got \"" + text + "\"");
        }
    }
}
