package com.hookrelay.common.resilience;

import com.hookrelay.common.config.HookRelayProperties;
import com.hookrelay.common.config.ResilienceExecutorConfiguration;
import com.hookrelay.common.exception.CircuitOpenException;
import com.hookrelay.common.exception.LockAcquisitionTimeoutException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

/**
 * Execution wrappers for calls to unreliable downstream services: retry with backoff,
 * per-key circuit breakers, and bounded-concurrency batch execution.
 *
 * <p>Breaker state lives in this process only. Each replica opens and closes its breakers
 * independently; there is no cluster-wide view.
 */
@Slf4j
@Service
public class ErrorRecoveryService {

    private final ConcurrentMap<String, CircuitState> circuitBreakers = new ConcurrentHashMap<>();

    private final Clock clock;
    private final Sleeper sleeper;
    private final Executor executor;
    private final RetryOptions defaultRetryOptions;
    private final CircuitBreakerOptions defaultBreakerOptions;
    private final Counter circuitsOpened;

    public ErrorRecoveryService(HookRelayProperties properties,
                                Clock clock,
                                Sleeper sleeper,
                                @Qualifier(ResilienceExecutorConfiguration.RESILIENCE_TASK_EXECUTOR) Executor executor,
                                MeterRegistry meterRegistry) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.executor = executor;

        HookRelayProperties.Resilience config = properties.getResilience();
        this.defaultRetryOptions = RetryOptions.builder()
                .maxAttempts(config.getDefaultMaxAttempts())
                .delay(config.getDefaultRetryDelay())
                .build();
        this.defaultBreakerOptions = CircuitBreakerOptions.builder()
                .failureThreshold(config.getDefaultFailureThreshold())
                .openTimeout(config.getDefaultOpenTimeout())
                .build();

        this.circuitsOpened = Counter.builder("hookrelay.circuit.opened")
                .description("Circuit breaker transitions to OPEN")
                .register(meterRegistry);
    }

    // ---------------------------------------------------------------- retry

    public <T> T withRetry(Callable<T> operation) {
        return withRetry(operation, defaultRetryOptions);
    }

    /**
     * Runs the operation, retrying failures the options' predicate accepts.
     *
     * <p>Non-retryable failures propagate immediately without delay. No delay follows the final
     * attempt. When attempts are exhausted the last failure is re-raised.
     */
    public <T> T withRetry(Callable<T> operation, RetryOptions options) {
        if (options.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= options.getMaxAttempts(); attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastError = asUnchecked(e);

                if (options.getRetryOn() == null || !options.getRetryOn().test(e)) {
                    log.warn("Error not retryable: error={}, attempt={}", e.getMessage(), attempt);
                    throw lastError;
                }

                if (attempt < options.getMaxAttempts()) {
                    Duration delay = options.delayAfter(attempt);
                    log.warn("Operation failed, retrying: error={}, attempt={}, maxAttempts={}, nextRetryInMs={}",
                            e.getMessage(), attempt, options.getMaxAttempts(), delay.toMillis());
                    pause(delay, lastError);
                }
            }
        }

        log.error("Operation failed after all retry attempts: error={}, attempts={}",
                lastError.getMessage(), options.getMaxAttempts());
        throw lastError;
    }

    // ------------------------------------------------------- circuit breaker

    public <T> T withCircuitBreaker(String key, Callable<T> operation) {
        return withCircuitBreaker(key, operation, defaultBreakerOptions);
    }

    /**
     * Runs the operation behind the breaker for {@code key}.
     *
     * <ul>
     *   <li>CLOSED: invoke; each failure counts, reaching the threshold opens the breaker.</li>
     *   <li>OPEN: before the timeout, fail fast with {@link CircuitOpenException} without invoking.
     *       After it, move to HALF_OPEN and let exactly one trial call through.</li>
     *   <li>HALF_OPEN: trial success closes and clears the count; trial failure re-opens.
     *       Other callers fail fast while the trial is in flight.</li>
     * </ul>
     *
     * @throws CircuitOpenException if the call was rejected
     */
    public <T> T withCircuitBreaker(String key, Callable<T> operation, CircuitBreakerOptions options) {
        CircuitState circuit = circuitBreakers.computeIfAbsent(key, CircuitState::new);
        boolean trial = admit(circuit, options);

        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            onFailure(circuit, options, trial);
            throw asUnchecked(e);
        } catch (Error e) {
            onFailure(circuit, options, trial);
            throw e;
        }

        if (trial) {
            synchronized (circuit) {
                circuit.close();
            }
            log.info("Circuit breaker reset to CLOSED: key={}", key);
        }
        return result;
    }

    private boolean admit(CircuitState circuit, CircuitBreakerOptions options) {
        synchronized (circuit) {
            switch (circuit.phase()) {
                case OPEN:
                    long sinceFailure = clock.millis() - circuit.lastFailureTimestamp();
                    if (sinceFailure < options.getOpenTimeout().toMillis()) {
                        log.debug("Circuit breaker OPEN, rejecting call: key={}", circuit.key());
                        throw new CircuitOpenException(circuit.key());
                    }
                    circuit.startTrial();
                    log.info("Circuit breaker transitioning to HALF_OPEN: key={}", circuit.key());
                    return true;
                case HALF_OPEN:
                    if (circuit.trialInFlight()) {
                        log.debug("Circuit breaker HALF_OPEN trial in flight, rejecting call: key={}", circuit.key());
                        throw new CircuitOpenException(circuit.key());
                    }
                    circuit.startTrial();
                    return true;
                default:
                    return false;
            }
        }
    }

    private void onFailure(CircuitState circuit, CircuitBreakerOptions options, boolean trial) {
        boolean opened = false;
        int failures;
        synchronized (circuit) {
            circuit.recordFailure(clock.millis());
            failures = circuit.consecutiveFailures();
            if (circuit.phase() != CircuitPhase.OPEN
                    && (trial || failures >= options.getFailureThreshold())) {
                circuit.open();
                opened = true;
            }
        }
        if (opened) {
            circuitsOpened.increment();
            log.error("Circuit breaker opened: key={}, failures={}, threshold={}",
                    circuit.key(), failures, options.getFailureThreshold());
        }
    }

    public Optional<CircuitStatus> getCircuitBreakerStatus(String key) {
        CircuitState circuit = circuitBreakers.get(key);
        if (circuit == null) {
            return Optional.empty();
        }
        synchronized (circuit) {
            return Optional.of(circuit.snapshot());
        }
    }

    public Map<String, CircuitStatus> getAllCircuitBreakers() {
        Map<String, CircuitStatus> result = new LinkedHashMap<>();
        circuitBreakers.forEach((key, circuit) -> {
            synchronized (circuit) {
                result.put(key, circuit.snapshot());
            }
        });
        return result;
    }

    /**
     * Forces the breaker back to CLOSED with no recorded failures.
     *
     * @return false if no breaker exists for the key
     */
    public boolean resetCircuitBreaker(String key) {
        CircuitState circuit = circuitBreakers.get(key);
        if (circuit == null) {
            return false;
        }
        synchronized (circuit) {
            circuit.reset();
        }
        log.info("Circuit breaker manually reset: key={}", key);
        return true;
    }

    // ------------------------------------------------------ tagged results

    public <T> GuardedResult<T> executeGuarded(String key, Callable<T> operation) {
        return executeGuarded(key, operation, defaultRetryOptions, defaultBreakerOptions);
    }

    /**
     * Circuit breaker around retry, reported as a {@link GuardedResult} instead of exceptions.
     */
    public <T> GuardedResult<T> executeGuarded(String key, Callable<T> operation,
                                               RetryOptions retryOptions, CircuitBreakerOptions breakerOptions) {
        try {
            return GuardedResult.ok(withCircuitBreaker(key, () -> withRetry(operation, retryOptions), breakerOptions));
        } catch (CircuitOpenException e) {
            return GuardedResult.circuitOpen(e.getCircuitKey());
        } catch (LockAcquisitionTimeoutException e) {
            return GuardedResult.lockTimeout(e.getLockKey());
        } catch (RuntimeException e) {
            return GuardedResult.failed(e);
        }
    }

    // --------------------------------------------------------------- batches

    /**
     * Runs every operation concurrently and waits for all of them. A failure never stops the
     * others; each one is logged and reported in the batch.
     */
    public <T> SettledBatch<T> executeAllSettled(List<? extends Callable<T>> operations) {
        List<CompletableFuture<T>> futures = new ArrayList<>(operations.size());
        for (Callable<T> operation : operations) {
            futures.add(submit(operation));
        }

        List<Settled<T>> results = new ArrayList<>(futures.size());
        for (int index = 0; index < futures.size(); index++) {
            try {
                results.add(Settled.fulfilled(futures.get(index).join()));
            } catch (CompletionException e) {
                Throwable reason = unwrap(e);
                log.error("Operation failed in batch execution: operationIndex={}, error={}",
                        index, reason.getMessage(), reason);
                results.add(Settled.rejected(reason));
            }
        }

        SettledBatch<T> batch = new SettledBatch<>(results);
        if (batch.getFailures() > 0) {
            log.warn("Batch operation completed with failures: total={}, failures={}, successRate={}",
                    batch.getTotal(), batch.getFailures(), batch.getSuccessRate());
        }
        return batch;
    }

    public int safeCacheInvalidation(List<? extends Runnable> operations) {
        return safeCacheInvalidation(operations, InvalidationOptions.defaults());
    }

    /**
     * Runs invalidations in batches of {@code maxParallel}, one batch at a time.
     *
     * <p>With {@code continueOnError} each batch is settled and its failures are logged and
     * swallowed. Otherwise the first failure aborts: batches not yet started are skipped and the
     * failure is re-raised. Operations already running are not cancelled.
     *
     * @return the number of failed operations (always 0 when not continuing on error)
     */
    public int safeCacheInvalidation(List<? extends Runnable> operations, InvalidationOptions options) {
        if (options.getMaxParallel() < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1");
        }
        int failures = 0;
        try {
            for (int from = 0; from < operations.size(); from += options.getMaxParallel()) {
                List<? extends Runnable> batch =
                        operations.subList(from, Math.min(from + options.getMaxParallel(), operations.size()));
                if (options.isContinueOnError()) {
                    List<Callable<Object>> callables = new ArrayList<>(batch.size());
                    batch.forEach(op -> callables.add(Executors.callable(op)));
                    failures += executeAllSettled(callables).getFailures();
                } else {
                    joinFailFast(batch);
                }
            }
        } catch (RuntimeException e) {
            log.error("Critical error in cache invalidation: error={}, operationCount={}",
                    e.getMessage(), operations.size());
            throw e;
        }
        return failures;
    }

    private void joinFailFast(List<? extends Runnable> batch) {
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        List<CompletableFuture<Object>> futures = new ArrayList<>(batch.size());
        for (Runnable op : batch) {
            CompletableFuture<Object> future = submit(Executors.callable(op));
            future.whenComplete((ignored, error) -> {
                if (error != null) {
                    firstFailure.completeExceptionally(unwrap(error));
                }
            });
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        firstFailure.completeExceptionally(unwrap(error));
                    } else {
                        firstFailure.complete(null);
                    }
                });
        try {
            firstFailure.join();
        } catch (CompletionException e) {
            throw asUnchecked(unwrap(e));
        }
    }

    private <T> CompletableFuture<T> submit(Callable<T> operation) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return operation.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    // --------------------------------------------------------------- helpers

    private void pause(Duration delay, RuntimeException lastError) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastError.addSuppressed(e);
            throw lastError;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException asUnchecked(Throwable error) {
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        return new OperationFailedException(error);
    }
}
