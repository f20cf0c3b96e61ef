package org.broadinstitute.pedsim.exceptions;

/**
 * Categories of failure recognized by the toolkit.  Each category maps to the process exit value that
 * {@link org.broadinstitute.pedsim.Main} uses when a run is terminated by an error of that category, so
 * that scripts driving the toolkit can tell the kinds of failure apart.
 */
public enum ErrorCategory {
    /** Problem with the command line itself (unknown argument, missing required argument...). */
    COMMAND_LINE(1),

    /** Generic user error with no more specific category. */
    USER_ERROR(2),

    /** Anything that is not the user's fault. */
    INTERNAL_ERROR(3),

    /** The def file could not be opened or read. */
    UNREADABLE_INPUT(10),

    /** A token that must be an integer could not be parsed as one. */
    MALFORMED_NUMBER(11),

    /** Missing fields, unknown sex symbols or directives with an unrecognized suffix. */
    MALFORMED_LINE(12),

    /** Generation/branch numbers out of range or out of order, bad parent references. */
    BAD_STRUCTURE(13),

    /** Two pedigree definitions share a name. */
    DUPLICATE_NAME(14),

    /** The parents or the sex of a branch were assigned more than once. */
    DUPLICATE_ASSIGNMENT(15),

    /** Parent assignments that would force two spouses to have the same sex. */
    INCONSISTENT_SEX(16),

    /** Branch ranges that do not terminate, do not increase, or chain more than one separator. */
    MALFORMED_RANGE(17),

    /** Nothing to simulate: no definitions at all, or nothing printed in the last generation. */
    INCOMPLETE_DEFINITION(18);

    private final int exitValue;

    ErrorCategory(final int exitValue) {
        this.exitValue = exitValue;
    }

    public int getExitValue() {
        return exitValue;
    }
}
