package com.memorygraph.shared.model;

/**
 * Result of a graph operation. Not-found, forbidden and invalid-argument are
 * expected results of consent enforcement and are returned, never thrown.
 */
public record Outcome<T>(Status status, T value, String message) {

    public enum Status { OK, NOT_FOUND, FORBIDDEN, INVALID_ARGUMENT }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Status.OK, value, null);
    }

    public static <T> Outcome<T> notFound(String message) {
        return new Outcome<>(Status.NOT_FOUND, null, message);
    }

    public static <T> Outcome<T> forbidden(String message) {
        return new Outcome<>(Status.FORBIDDEN, null, message);
    }

    public static <T> Outcome<T> invalid(String message) {
        return new Outcome<>(Status.INVALID_ARGUMENT, null, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /** Re-types a failed outcome; calling this on a success is a programming error. */
    public <U> Outcome<U> failure() {
        if (isOk()) throw new IllegalStateException("Outcome is OK");
        return new Outcome<>(status, null, message);
    }

    public T orElseThrow() {
        if (!isOk()) throw new IllegalStateException(status + ": " + message);
        return value;
    }
}
