package com.hookrelay.common.resilience;

/**
 * Outcome of one operation in a settled batch.
 *
 * @param value set when fulfilled
 * @param reason set when rejected
 */
public record Settled<T>(Status status, T value, Throwable reason) {

    public enum Status {
        FULFILLED,
        REJECTED
    }

    public static <T> Settled<T> fulfilled(T value) {
        return new Settled<>(Status.FULFILLED, value, null);
    }

    public static <T> Settled<T> rejected(Throwable reason) {
        return new Settled<>(Status.REJECTED, null, reason);
    }

    public boolean isFulfilled() {
        return status == Status.FULFILLED;
    }
}
