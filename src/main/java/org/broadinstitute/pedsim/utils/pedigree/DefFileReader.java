package org.broadinstitute.pedsim.utils.pedigree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pedsim.exceptions.DefFileException;
import org.broadinstitute.pedsim.exceptions.UserException;
import org.broadinstitute.pedsim.utils.Utils;
import org.broadinstitute.pedsim.utils.config.ConfigFactory;
import org.broadinstitute.pedsim.utils.config.PedSimConfig;
import org.broadinstitute.pedsim.utils.text.TokenizedLine;
import org.broadinstitute.pedsim.utils.text.TokenizedLineReader;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads pedigree def files: one or more blocks, each a {@code def} header followed by generation lines,
 * for example
 *
 *      # first cousins
 *      def full-1cousin 2 3
 *      1 1
 *      2 1
 *      3 1
 *
 * Blank lines and lines whose first token starts with the comment marker are ignored.
 *
 * Reading stops at the first error, reported as a {@link DefFileException} carrying the line it was found on;
 * nothing read before it is returned.  Non-fatal problems are logged as warnings and kept for
 * {@link #getWarnings()}.
 */
public final class DefFileReader {
    private static final Logger logger = LogManager.getLogger(DefFileReader.class);

    private final String commentMarker;
    private final boolean warnOnLastGenerationNoPrint;
    private final List<String> warnings = new ArrayList<>();

    /**
     * Creates a reader configured from the {@link PedSimConfig}.
     */
    public DefFileReader() {
        this(ConfigFactory.getInstance().getPedSimConfig());
    }

    public DefFileReader(final PedSimConfig config) {
        this(Utils.nonNull(config).comment_marker(), config.warn_on_last_generation_no_print());
    }

    public DefFileReader(final String commentMarker, final boolean warnOnLastGenerationNoPrint) {
        this.commentMarker = Utils.nonEmpty(commentMarker, "comment marker");
        this.warnOnLastGenerationNoPrint = warnOnLastGenerationNoPrint;
    }

    /**
     * Reads every pedigree definition in the given def file.
     * @return the definitions, finalized, in the order of their blocks in the file
     */
    public List<PedigreeDefinition> parse(final Path defFile) {
        Utils.nonNull(defFile);
        logger.info("Reading def file " + defFile);
        try (final TokenizedLineReader lines = new TokenizedLineReader(defFile, commentMarker)) {
            return parse(lines, defFile.toString());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(defFile, e);
        } catch (final UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(defFile, e.getCause());
        }
    }

    /**
     * Reads every pedigree definition from {@code reader}.
     * @param sourceName name of the source used in diagnostics
     */
    public List<PedigreeDefinition> parse(final Reader reader, final String sourceName) {
        Utils.nonNull(reader);
        Utils.nonNull(sourceName);
        try (final TokenizedLineReader lines = new TokenizedLineReader(reader, commentMarker)) {
            return parse(lines, sourceName);
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(sourceName, e);
        }
    }

    /**
     * Reads every pedigree definition from the text of a def file.
     */
    public List<PedigreeDefinition> parse(final String defFileContents, final String sourceName) {
        Utils.nonNull(defFileContents);
        return parse(new StringReader(defFileContents), sourceName);
    }

    private List<PedigreeDefinition> parse(final Iterable<TokenizedLine> lines, final String source) {
        warnings.clear();

        final List<PedigreeDefinition> definitions = new ArrayList<>();
        final Set<String> names = new HashSet<>();
        PedigreeDefinitionBuilder current = null;
        for (final TokenizedLine line : lines) {
            if (line.getFirst().equals(PedigreeDefinitionBuilder.DEF_KEYWORD)) {
                if (current != null) {
                    definitions.add(current.finish());
                }
                current = PedigreeDefinitionBuilder.fromHeader(line, source, warnings::add, warnOnLastGenerationNoPrint);
                if (!names.add(current.getName())) {
                    throw new DefFileException.DuplicateName(source, line.getLineNumber(), current.getName());
                }
            } else if (current == null) {
                throw new DefFileException.MalformedLine(source, line.getLineNumber(),
                        "expect four or five fields for pedigree definition: def [name] [numReps] [numGen] <sex of i1>");
            } else {
                current.addGenerationLine(line);
            }
        }
        if (current != null) {
            definitions.add(current.finish());
        }

        if (definitions.isEmpty()) {
            throw new DefFileException.IncompleteDefinition(source, "def file does not contain pedigree definitions; nothing to simulate");
        }
        if (!warnings.isEmpty()) {
            logger.warn(String.format("%d warning%s while reading %s", warnings.size(), warnings.size() == 1 ? "" : "s", source));
        }
        logger.info(String.format("Read %d pedigree definition%s from %s", definitions.size(), definitions.size() == 1 ? "" : "s", source));
        return Collections.unmodifiableList(definitions);
    }

    /**
     * @return the warnings emitted by the most recent read
     */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
