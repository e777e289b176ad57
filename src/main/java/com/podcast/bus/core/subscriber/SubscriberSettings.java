package com.podcast.bus.core.subscriber;

import com.podcast.bus.core.store.StoreRetryPolicy;

import java.time.Duration;

/**
 * Tuning of a {@link SubscriberLoop}.
 *
 * @param batchSize       entries per read
 * @param pollTimeout     how long one live read waits for new entries; must be positive
 * @param reclaimInterval time between idle-entry sweeps; zero disables sweeping
 * @param reclaimLimit    ledger entries inspected per sweep
 * @param storeRetry      backoff for an unreachable store
 */
public record SubscriberSettings(int batchSize,
                                 Duration pollTimeout,
                                 Duration reclaimInterval,
                                 int reclaimLimit,
                                 StoreRetryPolicy storeRetry) {

    public SubscriberSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        // A zero block means "wait forever" to Redis, so it is rejected rather than passed through.
        if (pollTimeout == null || pollTimeout.isZero() || pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout must be > 0");
        }
        if (reclaimInterval == null || reclaimInterval.isNegative()) {
            throw new IllegalArgumentException("reclaimInterval must be >= 0");
        }
        if (reclaimLimit < 1) {
            throw new IllegalArgumentException("reclaimLimit must be >= 1");
        }
        if (storeRetry == null) {
            throw new IllegalArgumentException("storeRetry is required");
        }
    }

    public static SubscriberSettings defaults() {
        return new SubscriberSettings(10, Duration.ofSeconds(2), Duration.ofMinutes(1), 100, StoreRetryPolicy.defaults());
    }

    public boolean reclaimEnabled() {
        return !reclaimInterval.isZero();
    }
}
