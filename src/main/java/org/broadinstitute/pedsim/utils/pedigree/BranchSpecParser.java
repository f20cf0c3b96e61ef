package org.broadinstitute.pedsim.utils.pedigree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pedsim.exceptions.DefFileException;
import org.broadinstitute.pedsim.exceptions.PedSimException;
import org.broadinstitute.pedsim.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Parses and applies the branch directives of a generation line.  Each directive is one token made of a
 * branch set followed by one of:
 *
 *      :p1_p2^g    the parents of the branches (see below)
 *      n           the branches print no samples
 *      sM or sF    the sex of the founder-equivalent individual of the branches
 *
 * A branch set is a comma separated list of 1-based branch numbers and inclusive ranges such as {@code 1,3-5}.
 *
 * Parents are 1-based branch numbers of the previous generation; the second one may name an earlier generation
 * with {@code ^g}.  Leaving out the first parent makes both parents new unrelated founders, and leaving out the
 * second one makes it a new founder spouse of the first.  The spouse, like any marriage between two branches,
 * is shared by every branch in the set.
 */
public final class BranchSpecParser {
    private static final Logger logger = LogManager.getLogger(BranchSpecParser.class);

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    static final char PARENTS_SUFFIX = ':';
    static final char NO_PRINT_SUFFIX = 'n';
    static final char SEX_SUFFIX = 's';
    static final char SECOND_PARENT_SEPARATOR = '_';
    static final char GENERATION_SEPARATOR = '^';

    private final String source;
    private final PedigreeDefinition definition;
    private final SexConstraintResolver resolver;
    private final Consumer<String> warnings;

    /**
     * @param source name of the def file, for diagnostics
     * @param warnings receives the text of every non-fatal problem
     */
    public BranchSpecParser(final String source, final PedigreeDefinition definition,
                            final SexConstraintResolver resolver, final Consumer<String> warnings) {
        this.source = Utils.nonNull(source);
        this.definition = Utils.nonNull(definition);
        this.resolver = Utils.nonNull(resolver);
        this.warnings = Utils.nonNull(warnings);
    }

    /**
     * The three kinds of directive and the text that follows the branch set.
     */
    static final class Directive {
        enum Kind { PARENTS, NO_PRINT, SEX }

        private final Kind kind;
        private final String branches;
        private final String parents;
        private final Sex sex;

        private Directive(final Kind kind, final String branches, final String parents, final Sex sex) {
            this.kind = kind;
            this.branches = branches;
            this.parents = parents;
            this.sex = sex;
        }

        Kind getKind() {
            return kind;
        }

        String getBranches() {
            return branches;
        }

        String getParents() {
            return parents;
        }

        Sex getSex() {
            return sex;
        }
    }

    /**
     * Applies every directive of a generation line to {@code current}, in order.
     */
    public void applyDirectives(final Generation current, final List<String> directives, final int lineNumber) {
        Utils.nonNull(current);
        Utils.nonNull(directives);
        for (final String token : directives) {
            applyDirective(current, token, lineNumber);
        }
    }

    void applyDirective(final Generation current, final String token, final int lineNumber) {
        final Directive directive = parseDirective(token, lineNumber);

        // parents are resolved, and marriages recorded, once per directive before its branches are read
        ParentPair parents = null;
        if (directive.getKind() == Directive.Kind.PARENTS) {
            if (current.getIndex() == 0) {
                throw new DefFileException.MalformedLine(source, lineNumber, "first generation cannot have parent specifications");
            }
            parents = resolveParents(current.getIndex() - 1, directive.getParents(), directive.getBranches(), lineNumber);
        }

        for (final int branch : parseBranchSet(directive.getBranches(), current.getNumBranches(), current.getIndex(), lineNumber)) {
            switch (directive.getKind()) {
                case PARENTS:
                    if (current.isParentsAssigned(branch)) {
                        throw new DefFileException.DuplicateAssignment(source, lineNumber, String.format(
                                "parents of branch number %d assigned multiple times", branch + 1));
                    }
                    current.assignParents(branch, parents != null ? parents : ParentPair.unrelatedFounders(current.getBranchRef(branch)));
                    break;
                case NO_PRINT:
                    markNoPrint(current, branch, lineNumber);
                    break;
                case SEX:
                    resolver.assignSex(current.getBranchRef(branch), directive.getSex(), lineNumber);
                    break;
                default:
                    throw new PedSimException.ShouldNeverReachHereException("Unknown directive kind " + directive.getKind());
            }
        }
    }

    private void markNoPrint(final Generation current, final int branch, final int lineNumber) {
        final int numToPrint = current.getNumSamplesToPrint(branch);
        if (numToPrint > 0) {
            warn(String.format("%s line %d: generation %d branch %d would print %d individuals, now set to 0",
                    source, lineNumber, current.getIndex() + 1, branch + 1, numToPrint));
        } else {
            warn(String.format("%s line %d: generation %d branch %d, no-print is redundant",
                    source, lineNumber, current.getIndex() + 1, branch + 1));
        }
        current.setNumSamplesToPrint(branch, 0);
    }

    private void warn(final String message) {
        logger.warn(message);
        warnings.accept(message);
    }

    /**
     * Splits a directive token at its first {@code ':'}, {@code 'n'} or {@code 's'}.
     */
    Directive parseDirective(final String token, final int lineNumber) {
        Utils.nonNull(token);
        int i = 0;
        while (i < token.length() && token.charAt(i) != PARENTS_SUFFIX && token.charAt(i) != NO_PRINT_SUFFIX && token.charAt(i) != SEX_SUFFIX) {
            i++;
        }
        if (i == token.length()) {
            throw new DefFileException.MalformedLine(source, lineNumber, String.format(
                    "improperly formatted parent assignment, sex assignment or no-print field %s", token));
        }

        final String branches = token.substring(0, i);
        final String rest = token.substring(i + 1);
        switch (token.charAt(i)) {
            case PARENTS_SUFFIX:
                return new Directive(Directive.Kind.PARENTS, branches, rest, null);
            case NO_PRINT_SUFFIX:
                if (!rest.isEmpty()) {
                    throw new DefFileException.MalformedLine(source, lineNumber, String.format(
                            "improperly formatted no-print field \"%s\": no-print character 'n' should be followed by white space", token));
                }
                return new Directive(Directive.Kind.NO_PRINT, branches, null, null);
            default:
                final Optional<Sex> sex = Sex.fromSymbol(rest);
                if (!sex.isPresent()) {
                    throw new DefFileException.MalformedLine(source, lineNumber, String.format(
                            "improperly formatted sex assignment field \"%s\": character 's' should be followed by either 'M' or 'F' and then white space", token));
                }
                return new Directive(Directive.Kind.SEX, branches, null, sex.get());
        }
    }

    /**
     * Expands a branch set such as {@code 1,3-5} into 0-based branch indexes, in the order given.
     *
     * @param numBranches number of branches of the generation the set refers to
     * @param generation 0-based index of that generation, for diagnostics
     */
    List<Integer> parseBranchSet(final String branchSet, final int numBranches, final int generation, final int lineNumber) {
        if (branchSet.isEmpty()) {
            throw new DefFileException.MalformedNumber(source, lineNumber, "directive does not list any branches");
        }
        final List<Integer> branches = new ArrayList<>();
        for (final String element : branchSet.split(",", -1)) {
            final String[] range = element.split("-", -1);
            if (range.length > 2) {
                throw new DefFileException.MalformedRange(source, lineNumber, String.format(
                        "improperly formatted branch range \"%s\"", element));
            }
            if (range.length == 2) {
                if (range[1].isEmpty()) {
                    throw new DefFileException.MalformedRange(source, lineNumber, String.format(
                            "range of branches \"%s\" does not terminate", element));
                }
                final int start = parseBranchNumber(range[0], lineNumber);
                final int end = parseBranchNumber(range[1], lineNumber);
                if (start >= end) {
                    throw new DefFileException.MalformedRange(source, lineNumber, String.format(
                            "non-increasing branch range %d-%d", start, end));
                }
                checkBranchInRange(start, numBranches, generation, lineNumber);
                checkBranchInRange(end, numBranches, generation, lineNumber);
                for (int branch = start; branch <= end; branch++) {
                    branches.add(branch - 1);
                }
            } else {
                final int branch = parseBranchNumber(element, lineNumber);
                checkBranchInRange(branch, numBranches, generation, lineNumber);
                branches.add(branch - 1);
            }
        }
        return branches;
    }

    private int parseBranchNumber(final String text, final int lineNumber) {
        return parseInt(text, lineNumber, "unable to parse branch");
    }

    private void checkBranchInRange(final int branch, final int numBranches, final int generation, final int lineNumber) {
        if (branch < 1) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "branch numbers must be positive but got %d", branch));
        }
        if (branch > numBranches) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "request to assign branch %d but generation %d has only %d branches", branch, generation + 1, numBranches));
        }
    }

    /**
     * Reads a parent specification and records the marriage it implies.
     *
     * @param prevGen 0-based index of the generation before the one whose branches are being assigned
     * @param branches the branch set of the directive, for diagnostics
     * @return the parents, or null when every branch of the directive gets its own couple of unrelated founders
     */
    ParentPair resolveParents(final int prevGen, final String parentSpec, final String branches, final int lineNumber) {
        final int separator = parentSpec.indexOf(SECOND_PARENT_SEPARATOR);
        final String firstSpec = separator < 0 ? parentSpec : parentSpec.substring(0, separator);
        final String secondSpec = separator < 0 ? "" : parentSpec.substring(separator + 1);

        if (firstSpec.isEmpty()) {
            return null;
        }

        if (firstSpec.indexOf(GENERATION_SEPARATOR) >= 0) {
            throw new DefFileException.MalformedLine(source, lineNumber, String.format(
                    "parent assignment for branches %s gives generation number for the first parent, but this is only allowed for the second parent; for example, 2:1_3^1 has branch 1 from previous generation married to branch 3 from generation 1",
                    branches));
        }
        final BranchRef first = parseParentBranch(firstSpec, prevGen, lineNumber);

        if (secondSpec.isEmpty()) {
            final Generation previous = definition.getGeneration(prevGen);
            return new ParentPair(first, Founder.spouseOf(first, previous.nextSpouseNumber(first.getBranch())));
        }

        int secondGen = prevGen;
        String secondBranch = secondSpec;
        final int caret = secondSpec.indexOf(GENERATION_SEPARATOR);
        if (caret >= 0) {
            secondBranch = secondSpec.substring(0, caret);
            final String genText = secondSpec.substring(caret + 1);
            final int genNumber = parseInt(genText, lineNumber,
                    "unable to parse parent assignment for branches " + branches + ": malformed generation number string for second parent");
            if (genNumber - 1 > prevGen) {
                throw new DefFileException.BadStructure(source, lineNumber, String.format(
                        "unable to parse parent assignment for branches %s: generation number %d for second parent is after previous generation", branches, genNumber));
            } else if (genNumber < 1) {
                throw new DefFileException.BadStructure(source, lineNumber, String.format(
                        "unable to parse parent assignment for branches %s: generation number %d for second parent is before first generation", branches, genNumber));
            }
            secondGen = genNumber - 1;
        }
        final BranchRef second = parseParentBranch(secondBranch, secondGen, lineNumber);

        if (first.equals(second)) {
            throw new DefFileException.InconsistentSex(source, lineNumber, "cannot have both parents be from same branch");
        }
        if (definition.getFounderSex().isPresent()) {
            throw new DefFileException.InconsistentSex(source, lineNumber,
                    "cannot have fixed sex for i1 samples and marriages between branches: i1's will have the same sex and cannot reproduce; consider assigning sexes to individual branches");
        }
        resolver.addMarriage(first, second, lineNumber);
        return new ParentPair(first, second);
    }

    private BranchRef parseParentBranch(final String text, final int generation, final int lineNumber) {
        final int branch = parseInt(text, lineNumber, "unable to parse parent branch");
        if (branch < 1) {
            throw new DefFileException.BadStructure(source, lineNumber, "parent assignments must be of positive branch numbers");
        }
        final int numBranches = definition.getNumBranches(generation);
        if (branch > numBranches) {
            throw new DefFileException.BadStructure(source, lineNumber, String.format(
                    "parent branch number %d is more than the number of branches (%d) in generation %d", branch, numBranches, generation + 1));
        }
        return new BranchRef(generation, branch - 1);
    }

    private int parseInt(final String text, final int lineNumber, final String problem) {
        if (!INTEGER.matcher(text).matches()) {
            throw new DefFileException.MalformedNumber(source, lineNumber, problem + " \"" + text + "\"");
        }
        try {
            return Integer.parseInt(text);
        } catch (final NumberFormatException e) {
            throw new DefFileException.MalformedNumber(source, lineNumber, problem + " \"" + text + "\"");
        }
    }
}
