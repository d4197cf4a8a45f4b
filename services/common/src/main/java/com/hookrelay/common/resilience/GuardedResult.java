package com.hookrelay.common.resilience;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a guarded call, returned instead of throwing so callers handle every case explicitly:
 *
 * <pre>{@code
 * GuardedResult<Receipt> result = errorRecoveryService.executeGuarded("notify:slack", this::send);
 * switch (result.getStatus()) {
 *     case OK -> record(result.getValue());
 *     case CIRCUIT_OPEN -> log.info("Skipping notification, downstream unhealthy");
 *     case LOCK_TIMEOUT -> log.info("Another replica is handling this team");
 *     case FAILED -> throw result.getError();
 * }
 * }</pre>
 */
public final class GuardedResult<T> {

    public enum Status {
        OK,
        CIRCUIT_OPEN,
        LOCK_TIMEOUT,
        FAILED
    }

    private final Status status;
    private final T value;
    private final String key;
    private final RuntimeException error;

    private GuardedResult(Status status, T value, String key, RuntimeException error) {
        this.status = status;
        this.value = value;
        this.key = key;
        this.error = error;
    }

    public static <T> GuardedResult<T> ok(T value) {
        return new GuardedResult<>(Status.OK, value, null, null);
    }

    public static <T> GuardedResult<T> circuitOpen(String circuitKey) {
        return new GuardedResult<>(Status.CIRCUIT_OPEN, null, circuitKey, null);
    }

    public static <T> GuardedResult<T> lockTimeout(String lockKey) {
        return new GuardedResult<>(Status.LOCK_TIMEOUT, null, lockKey, null);
    }

    public static <T> GuardedResult<T> failed(RuntimeException error) {
        return new GuardedResult<>(Status.FAILED, null, null, Objects.requireNonNull(error, "error"));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * @throws NoSuchElementException if the status is not {@link Status#OK}
     */
    public T getValue() {
        if (status != Status.OK) {
            throw new NoSuchElementException("No value for status " + status);
        }
        return value;
    }

    public T orElse(T fallback) {
        return status == Status.OK ? value : fallback;
    }

    /**
     * Circuit or lock key for {@link Status#CIRCUIT_OPEN} and {@link Status#LOCK_TIMEOUT}.
     */
    public String getKey() {
        return key;
    }

    /**
     * The failure for {@link Status#FAILED}, null otherwise.
     */
    public RuntimeException getError() {
        return error;
    }

    public <R> GuardedResult<R> map(Function<? super T, ? extends R> mapper) {
        if (status != Status.OK) {
            return new GuardedResult<>(status, null, key, error);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        switch (status) {
            case OK:
                return "GuardedResult[OK]";
            case FAILED:
                return "GuardedResult[FAILED: " + error.getMessage() + "]";
            default:
                return "GuardedResult[" + status + " " + key + "]";
        }
    }
}
