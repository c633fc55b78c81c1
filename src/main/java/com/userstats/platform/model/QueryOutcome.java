package com.userstats.platform.model;

import lombok.Getter;

/**
 * Result of a fail-soft query. A {@code FAILED} outcome always carries the query's empty
 * value, so callers reading only {@link #getValue()} cannot tell a failure from no match.
 */
@Getter
public final class QueryOutcome<T> {

    public enum Status {
        FOUND,
        EMPTY,
        FAILED
    }

    private final T value;
    private final Status status;
    private final Throwable failure;

    private QueryOutcome(T value, Status status, Throwable failure) {
        this.value = value;
        this.status = status;
        this.failure = failure;
    }

    public static <T> QueryOutcome<T> of(T value, boolean empty) {
        return new QueryOutcome<>(value, empty ? Status.EMPTY : Status.FOUND, null);
    }

    public static <T> QueryOutcome<T> failed(T emptyValue, Throwable cause) {
        return new QueryOutcome<>(emptyValue, Status.FAILED, cause);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    @Override
    public String toString() {
        return status == Status.FAILED
            ? "QueryOutcome(FAILED, " + failure.getMessage() + ")"
            : "QueryOutcome(" + status + ", " + value + ")";
    }
}
