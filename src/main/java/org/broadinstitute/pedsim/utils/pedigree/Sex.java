package org.broadinstitute.pedsim.utils.pedigree;

import java.util.Optional;

/**
 * Sex of the founder-equivalent individual of a branch.
 */
public enum Sex {
    MALE("M"), FEMALE("F");

    /** The single-character symbol used for this sex in def files */
    private final String symbol;

    Sex(final String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /** Returns the sex a spouse of someone of this sex must have. */
    public Sex opposite() {
        return this == MALE ? FEMALE : MALE;
    }

    /**
     * Decodes a def file sex field. Only the exact symbols "M" and "F" are recognized.
     * @return the sex, or empty if {@code symbol} is anything else
     */
    public static Optional<Sex> fromSymbol(final String symbol) {
        for (final Sex sex : values()) {
            if (sex.symbol.equals(symbol)) {
                return Optional.of(sex);
            }
        }
        return Optional.empty();
    }
}
