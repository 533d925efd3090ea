package com.dynop.routing.hybrid.engine;

import com.dynop.routing.hybrid.config.RoutingConfig;
import com.dynop.routing.hybrid.model.TravelProfile;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for {@link BatchScheduler#resolveMany}.
 */
public final class BatchOptions {

    private final TravelProfile profile;
    private final int batchSize;
    private final Duration interBatchDelay;
    private final ResolveOptions resolveOptions;

    public BatchOptions(TravelProfile profile, int batchSize, Duration interBatchDelay, ResolveOptions resolveOptions) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        Objects.requireNonNull(interBatchDelay, "interBatchDelay");
        if (interBatchDelay.isNegative()) {
            throw new IllegalArgumentException("interBatchDelay must be non-negative");
        }
        this.profile = Objects.requireNonNull(profile, "profile");
        this.batchSize = batchSize;
        this.interBatchDelay = interBatchDelay;
        this.resolveOptions = Objects.requireNonNull(resolveOptions, "resolveOptions");
    }

    /**
     * @return driving profile with the configured batch size and delay and default resolve options
     */
    public static BatchOptions from(RoutingConfig config) {
        return new BatchOptions(TravelProfile.DRIVING, config.getBatchSize(), config.getInterBatchDelay(),
                ResolveOptions.defaults());
    }

    public BatchOptions withProfile(TravelProfile value) {
        return new BatchOptions(value, batchSize, interBatchDelay, resolveOptions);
    }

    public BatchOptions withBatchSize(int value) {
        return new BatchOptions(profile, value, interBatchDelay, resolveOptions);
    }

    public BatchOptions withInterBatchDelay(Duration value) {
        return new BatchOptions(profile, batchSize, value, resolveOptions);
    }

    public BatchOptions withResolveOptions(ResolveOptions value) {
        return new BatchOptions(profile, batchSize, interBatchDelay, value);
    }

    public TravelProfile getProfile() {
        return profile;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getInterBatchDelay() {
        return interBatchDelay;
    }

    public ResolveOptions getResolveOptions() {
        return resolveOptions;
    }
}
