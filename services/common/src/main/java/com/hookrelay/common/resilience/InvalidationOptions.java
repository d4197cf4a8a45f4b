package com.hookrelay.common.resilience;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for {@link ErrorRecoveryService#safeCacheInvalidation}.
 */
@Data
@Builder
public class InvalidationOptions {

    /**
     * Log and swallow failures per batch instead of aborting on the first one.
     */
    @Builder.Default
    private boolean continueOnError = true;

    @Builder.Default
    private int maxParallel = 5;

    public static InvalidationOptions defaults() {
        return InvalidationOptions.builder().build();
    }
}
