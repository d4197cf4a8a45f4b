package com.hookrelay.common.resilience;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Results of {@link ErrorRecoveryService#executeAllSettled}, in the order the operations were given.
 */
public final class SettledBatch<T> {

    private final List<Settled<T>> results;

    SettledBatch(List<Settled<T>> results) {
        this.results = List.copyOf(results);
    }

    public List<Settled<T>> getResults() {
        return results;
    }

    public int getTotal() {
        return results.size();
    }

    public int getFailures() {
        return (int) results.stream().filter(result -> !result.isFulfilled()).count();
    }

    /**
     * Percentage of fulfilled operations, 100 for an empty batch.
     */
    public double getSuccessRate() {
        if (results.isEmpty()) {
            return 100.0;
        }
        return (getTotal() - getFailures()) * 100.0 / getTotal();
    }

    public List<T> getFulfilledValues() {
        return results.stream()
                .filter(Settled::isFulfilled)
                .map(Settled::value)
                .collect(Collectors.toList());
    }

    public List<Throwable> getRejectionReasons() {
        return results.stream()
                .filter(result -> !result.isFulfilled())
                .map(Settled::reason)
                .collect(Collectors.toList());
    }
}
