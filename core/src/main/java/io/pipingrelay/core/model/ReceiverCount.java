package io.pipingrelay.core.model;

import java.util.OptionalInt;

/**
 * Parses the {@code n} query parameter: the number of receivers a sender pairs
 * with (and the count a receiver expects to be part of).
 *
 * <p>
 * Absent means {@code 1}. Anything other than a decimal positive {@code int}
 * (zero, negative, signs, whitespace, overflow past {@link Integer#MAX_VALUE})
 * is invalid.
 */
public final class ReceiverCount {

    /** Count used when the request carries no {@code n} parameter. */
    public static final int DEFAULT = 1;

    private ReceiverCount() {
        // utility class
    }

    /**
     * @param raw the raw parameter value, {@code null} when absent
     * @return the parsed count, or empty if the value is not a positive integer
     */
    public static OptionalInt parse(String raw) {
        if (raw == null) {
            return OptionalInt.of(DEFAULT);
        }
        if (raw.isEmpty() || raw.length() > 10) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalInt.empty();
            }
        }
        long value = Long.parseLong(raw);
        if (value < 1 || value > Integer.MAX_VALUE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) value);
    }
}
