package com.hookrelay.common.ratelimit;

/**
 * Persisted token bucket, serialized as JSON.
 *
 * @param lastRefill epoch millis up to which refill has been credited
 */
record TokenBucketState(long tokens, long lastRefill) {
}
