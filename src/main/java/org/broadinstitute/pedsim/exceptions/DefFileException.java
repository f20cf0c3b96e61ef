package org.broadinstitute.pedsim.exceptions;

import java.util.OptionalInt;

/**
 * Errors found while reading a pedigree def file.  Every subtype reports the file and, when the problem can be
 * tied to one, the 1-based line number where it was found; problems detected when a definition block is
 * completed (or at end of file) carry no line number.
 *
 * Reading is fail-fast: the first of these terminates the read and no partial definitions are returned.
 */
public abstract class DefFileException extends UserException {
    private static final long serialVersionUID = 0L;

    private final String source;
    private final Integer lineNumber;

    protected DefFileException(final String source, final int lineNumber, final String message) {
        super(String.format("%s line %d: %s", source, lineNumber, message));
        this.source = source;
        this.lineNumber = lineNumber;
    }

    protected DefFileException(final String source, final String message) {
        super(String.format("%s: %s", source, message));
        this.source = source;
        this.lineNumber = null;
    }

    public String getSource() {
        return source;
    }

    public OptionalInt getLineNumber() {
        return lineNumber == null ? OptionalInt.empty() : OptionalInt.of(lineNumber);
    }

    @Override
    public abstract ErrorCategory getCategory();

    public static class MalformedNumber extends DefFileException {
        private static final long serialVersionUID = 0L;

        public MalformedNumber(final String source, final int lineNumber, final String message) {
            super(source, lineNumber, message);
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.MALFORMED_NUMBER;
        }
    }

    public static class MalformedLine extends DefFileException {
        private static final long serialVersionUID = 0L;

        public MalformedLine(final String source, final int lineNumber, final String message) {
            super(source, lineNumber, message);
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.MALFORMED_LINE;
        }
    }

    public static class BadStructure extends DefFileException {
        private static final long serialVersionUID = 0L;

        public BadStructure(final String source, final int lineNumber, final String message) {
            super(source, lineNumber, message);
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.BAD_STRUCTURE;
        }
    }

    public static class DuplicateName extends DefFileException {
        private static final long serialVersionUID = 0L;

        public DuplicateName(final String source, final int lineNumber, final String name) {
            super(source, lineNumber, String.format("name of pedigree \"%s\" is the same as a previous pedigree", name));
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.DUPLICATE_NAME;
        }
    }

    public static class DuplicateAssignment extends DefFileException {
        private static final long serialVersionUID = 0L;

        public DuplicateAssignment(final String source, final int lineNumber, final String message) {
            super(source, lineNumber, message);
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.DUPLICATE_ASSIGNMENT;
        }
    }

    public static class InconsistentSex extends DefFileException {
        private static final long serialVersionUID = 0L;

        public InconsistentSex(final String source, final int lineNumber, final String message) {
            super(source, lineNumber, message);
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.INCONSISTENT_SEX;
        }
    }

    public static class MalformedRange extends DefFileException {
        private static final long serialVersionUID = 0L;

        public MalformedRange(final String source, final int lineNumber, final String message) {
            super(source, lineNumber, message);
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.MALFORMED_RANGE;
        }
    }

    public static class IncompleteDefinition extends DefFileException {
        private static final long serialVersionUID = 0L;

        public IncompleteDefinition(final String source, final String message) {
            super(source, message);
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.INCOMPLETE_DEFINITION;
        }
    }
}
