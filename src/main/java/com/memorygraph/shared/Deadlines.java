package com.memorygraph.shared;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public final class Deadlines {

    private Deadlines() {}

    /** {@code start + ttl}, or empty when the sum lies outside the range of {@link Instant}. */
    public static Optional<Instant> after(Instant start, Duration ttl) {
        try {
            return Optional.of(start.plus(ttl));
        } catch (ArithmeticException | DateTimeException e) {
            return Optional.empty();
        }
    }
}
