package com.dynop.routing.hybrid.engine;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking sleep used for retry backoff and inter-batch pacing.
 */
@FunctionalInterface
public interface DelayScheduler {

    /**
     * @return a future completing once {@code delay} has elapsed; already complete for zero or negative delays
     */
    CompletableFuture<Void> delay(Duration delay);
}
