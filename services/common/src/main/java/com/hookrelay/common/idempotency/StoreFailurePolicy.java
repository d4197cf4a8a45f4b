package com.hookrelay.common.idempotency;

/**
 * What the deduplication filter does when the shared store cannot be reached.
 */
public enum StoreFailurePolicy {

    /**
     * Treat the event as new and process it. Risks double processing; every
     * occurrence is logged at ERROR and counted.
     */
    PROCESS,

    /**
     * Propagate the store failure so the caller answers with a retryable error
     * and the platform redelivers later.
     */
    REJECT
}
