package de.bsommerfeld.marketscope.db;

import java.time.Duration;

/** Argument checks that fail with {@link MalformedInputException}. */
final class StoreArguments {

    private StoreArguments() {
    }

    static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new MalformedInputException(name + " must not be null");
        }
        return value;
    }

    static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new MalformedInputException(name + " must not be blank");
        }
        return value;
    }

    static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new MalformedInputException(name + " must be positive, was " + value);
        }
        return value;
    }

    static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new MalformedInputException(name + " must not be negative, was " + value);
        }
        return value;
    }

    static Duration requireNonNegative(Duration value, String name) {
        requireNonNull(value, name);
        if (value.isNegative()) {
            throw new MalformedInputException(name + " must not be negative, was " + value);
        }
        return value;
    }
}
