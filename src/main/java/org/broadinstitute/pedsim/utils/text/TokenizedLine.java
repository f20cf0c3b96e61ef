package org.broadinstitute.pedsim.utils.text;

import org.broadinstitute.pedsim.utils.Utils;

import java.util.Collections;
import java.util.List;

/**
 * One non-blank, non-comment line of a whitespace-delimited text file split into its tokens,
 * together with the 1-based number of that line in the source.
 */
public final class TokenizedLine {
    private final int lineNumber;
    private final List<String> tokens;

    public TokenizedLine(final int lineNumber, final List<String> tokens) {
        Utils.validateArg(lineNumber > 0, () -> "line numbers are 1-based but got " + lineNumber);
        Utils.nonNull(tokens, "tokens");
        Utils.validateArg(!tokens.isEmpty(), "a tokenized line must have at least one token");
        this.lineNumber = lineNumber;
        this.tokens = Collections.unmodifiableList(tokens);
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public List<String> getTokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public String get(final int i) {
        return tokens.get(Utils.validIndex(i, tokens.size()));
    }

    public String getFirst() {
        return tokens.get(0);
    }

    @Override
    public String toString() {
        return lineNumber + ": " + String.join(" ", tokens);
    }
}
