package org.broadinstitute.pedsim.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.pedsim.cmdline.CommandLineProgram;
import org.broadinstitute.pedsim.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pedsim.cmdline.programgroups.PedigreeProgramGroup;
import org.broadinstitute.pedsim.utils.pedigree.DefFileReader;
import org.broadinstitute.pedsim.utils.pedigree.PedigreeDefinition;

import java.io.File;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Reads a pedigree def file, fills in the default branch counts and parents, checks the sexes implied by
 * marriages between branches, and reports a summary of every resolved pedigree.
 *
 * Sample Usage:
 *
 * pedsim ResolvePedigreeDefinitions \
 *   --def-file cousins.def
 */
@CommandLineProgramProperties(
        summary = "Reads a pedigree def file, resolves default branches, parents and founder sexes, and reports any problem in the file",
        oneLineSummary = "Resolve and check pedigree definitions",
        programGroup = PedigreeProgramGroup.class
)
public final class ResolvePedigreeDefinitions extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.DEF_FILE_LONG_NAME,
            shortName = StandardArgumentDefinitions.DEF_FILE_SHORT_NAME,
            doc = "Def file describing the pedigrees to resolve",
            optional = false)
    public File defFile;

    private DefFileReader reader;

    @Override
    protected void onStartup() {
        super.onStartup();
        reader = new DefFileReader();
    }

    @Override
    protected Object doWork() {
        final List<PedigreeDefinition> definitions = reader.parse(defFile.toPath());
        for (final PedigreeDefinition definition : definitions) {
            logger.info(describe(definition));
        }
        if (!reader.getWarnings().isEmpty()) {
            logger.info(reader.getWarnings().size() + " warning(s) while reading " + defFile);
        }
        return definitions;
    }

    /**
     * One-line summary of a resolved pedigree.
     */
    static String describe(final PedigreeDefinition definition) {
        final int numGenerations = definition.getNumGenerations();
        final String branchCounts = IntStream.range(0, numGenerations)
                .mapToObj(gen -> String.valueOf(definition.getNumBranches(gen)))
                .collect(Collectors.joining(","));
        int founderSpouses = 0;
        for (int gen = 0; gen < numGenerations; gen++) {
            for (int b = 0; b < definition.getNumBranches(gen); b++) {
                founderSpouses += definition.getNumSpouses(gen, b);
            }
        }
        return String.format("%s: %d replicate(s), %d generation(s), branches [%s], %d founder spouse(s), %d sample(s) printed per replicate",
                definition.getName(), definition.getNumReplicates(), numGenerations, branchCounts,
                founderSpouses, definition.getNumSamplesToPrintPerReplicate());
    }
}
