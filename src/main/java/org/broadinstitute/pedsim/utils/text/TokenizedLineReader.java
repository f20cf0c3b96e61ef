package org.broadinstitute.pedsim.utils.text;

import org.broadinstitute.pedsim.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Iterator and iterable over the whitespace-delimited tokens of each line of a text source.  Blank lines and
 * lines whose first token starts with the comment prefix are skipped, but still counted, so that every
 * {@link TokenizedLine} reports the line number it came from:
 *
 * try (final TokenizedLineReader reader = new TokenizedLineReader(path, "#")) {
 *     for (final TokenizedLine line : reader) {
 *         doSomeWork(line.getLineNumber(), line.getTokens());
 *     }
 * }
 *
 * Problems reading the underlying stream surface as {@link UncheckedIOException}s from {@link #hasNext()}
 * and {@link #next()}.
 */
public final class TokenizedLineReader implements Iterator<TokenizedLine>, Iterable<TokenizedLine>, AutoCloseable {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final BufferedReader in;      // The stream we're reading from
    private final String commentPrefix;
    private int lineNumber = 0;           // Number of raw lines consumed so far
    private TokenizedLine nextLine;       // Return value of next call to next()

    /**
     * Opens the given UTF-8 file for reading.
     *
     * @param commentPrefix prefix of the first token of comment lines, or null if comments are not recognized
     */
    public TokenizedLineReader(final Path path, final String commentPrefix) throws IOException {
        this(Files.newBufferedReader(Utils.nonNull(path), StandardCharsets.UTF_8), commentPrefix);
    }

    /**
     * @param reader the source of the lines; closed once the last line has been read
     * @param commentPrefix prefix of the first token of comment lines, or null if comments are not recognized
     */
    public TokenizedLineReader(final Reader reader, final String commentPrefix) {
        Utils.nonNull(reader);
        Utils.validateArg(commentPrefix == null || !commentPrefix.isEmpty(), "the comment prefix may not be empty");
        this.in = (reader instanceof BufferedReader) ? (BufferedReader)reader : new BufferedReader(reader);
        this.commentPrefix = commentPrefix;
        this.nextLine = readNextLine();
    }

    /**
     * Splits a single line into its whitespace-delimited tokens.
     * @return the tokens, empty if the line is blank
     */
    public static List<String> tokenize(final String line) {
        Utils.nonNull(line);
        final String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(WHITESPACE.split(trimmed)));
    }

    /**
     * Reads all of the remaining lines.
     */
    public List<TokenizedLine> readLines() {
        final List<TokenizedLine> lines = new ArrayList<>();
        for ( final TokenizedLine line : this ) {
            lines.add(line);
        }
        return lines;
    }

    @Override
    public Iterator<TokenizedLine> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        return this.nextLine != null;
    }

    private TokenizedLine readNextLine() {
        try {
            String rawLine;
            while ((rawLine = this.in.readLine()) != null) {
                lineNumber++;
                final List<String> tokens = tokenize(rawLine);
                if (tokens.isEmpty()) {
                    continue;
                }
                if (commentPrefix != null && tokens.get(0).startsWith(commentPrefix)) {
                    continue;
                }
                return new TokenizedLine(lineNumber, tokens);
            }
            // close on EOF
            in.close();
            return null;
        } catch (final IOException e) {
            throw new UncheckedIOException("Error reading line " + (lineNumber + 1), e);
        }
    }

    @Override
    public TokenizedLine next() {
        if ( !hasNext() ) {
            throw new NoSuchElementException("No more lines");
        }
        final TokenizedLine result = this.nextLine;
        this.nextLine = readNextLine();
        return result;
    }

    // The source is read-only; we don't allow lines to be removed.
    @Override
    public void remove() {
        throw new UnsupportedOperationException();
    }

    @Override
    public void close() throws IOException {
        this.in.close();
    }
}
