package org.broadinstitute.pedsim.exceptions;

import java.nio.file.Path;

/**
 * An error caused by the user's input, such as an unreadable or malformed def file or a bad option.
 * Main reports these without a stack trace and exits with the value of {@link #getCategory()}.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String message) {
        super(message);
    }

    public UserException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ErrorCategory getCategory() {
        return ErrorCategory.USER_ERROR;
    }

    private static String describe(final Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * A def file (or other input) could not be opened or read.
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String problem) {
            super(String.format("Cannot read %s: %s", file.toAbsolutePath(), problem));
        }

        public CouldNotReadInputFile(final Path file, final Throwable cause) {
            super(String.format("Cannot read %s: %s", file.toAbsolutePath(), describe(cause)), cause);
        }

        public CouldNotReadInputFile(final String source, final Throwable cause) {
            super(String.format("Cannot read %s: %s", source, describe(cause)), cause);
        }

        @Override
        public ErrorCategory getCategory() {
            return ErrorCategory.UNREADABLE_INPUT;
        }
    }

    /**
     * A bad value outside of a def file, such as a command line or configuration option.
     */
    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super("Bad input: " + message);
        }
    }
}
