package org.broadinstitute.pedsim.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.function.Supplier;

/**
 * Argument and state checks shared by the def file parsers.
 *
 * Bad arguments from callers raise {@link IllegalArgumentException}, broken internal state raises
 * {@link IllegalStateException}.  Problems in a def file are never reported through here; they are
 * {@link org.broadinstitute.pedsim.exceptions.DefFileException}s.
 */
public final class Utils {

    private Utils() {}

    /**
     * @return {@code object}, if it is not null
     */
    public static <T> T nonNull(final T object) {
        return nonNull(object, "unexpected null value");
    }

    /**
     * @param message used as the exception message when {@code object} is null
     * @return {@code object}, if it is not null
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * @param what names the value in the exception message
     * @return {@code text}, if it is neither null nor empty
     */
    public static String nonEmpty(final String text, final String what) {
        validateArg(text != null && !text.isEmpty(), () -> what + " must not be null or empty");
        return text;
    }

    /**
     * @return {@code index}, if it is in {@code [0, size)}
     */
    public static int validIndex(final int index, final int size) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException(String.format("index %d out of bounds for size %d", index, size));
        }
        return index;
    }

    public static void validateArg(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> message) {
        if (!condition) {
            throw new IllegalArgumentException(message.get());
        }
    }

    public static void validate(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    public static void validate(final boolean condition, final Supplier<String> message) {
        if (!condition) {
            throw new IllegalStateException(message.get());
        }
    }

    /**
     * @return a rule of {@code width} copies of {@code c}, for log banners
     */
    public static String rule(final char c, final int width) {
        return StringUtils.repeat(c, width);
    }
}
