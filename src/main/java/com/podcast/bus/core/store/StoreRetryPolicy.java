package com.podcast.bus.core.store;

import com.podcast.bus.core.error.StoreUnavailableException;
import org.slf4j.Logger;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/**
 * Bounded exponential backoff for {@link StoreUnavailableException}.
 *
 * <p>Only store connectivity failures are retried. Handler failures and command errors pass straight
 * through. Once {@code maxAttempts} consecutive retries fail, the last failure is logged at ERROR as an
 * escalation and propagated.</p>
 *
 * @param maxAttempts consecutive retries before giving up
 * @param minBackoff  first delay
 * @param maxBackoff  cap for the doubling delay
 */
public record StoreRetryPolicy(long maxAttempts, Duration minBackoff, Duration maxBackoff) {

    public StoreRetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (minBackoff == null || minBackoff.isNegative()) {
            throw new IllegalArgumentException("minBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= minBackoff");
        }
    }

    public static StoreRetryPolicy defaults() {
        return new StoreRetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(60));
    }

    public static StoreRetryPolicy none() {
        return new StoreRetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Builds the Reactor retry spec.
     *
     * @param log       logger of the calling component
     * @param operation short label for log lines, e.g. {@code "readNew episodes:transcribed/rag_group"}
     */
    public RetryBackoffSpec toRetrySpec(Logger log, String operation) {
        return Retry.backoff(maxAttempts, minBackoff)
                .maxBackoff(maxBackoff)
                .transientErrors(true)
                .filter(StoreUnavailableException.class::isInstance)
                .doBeforeRetry(sig -> log.warn("Log store unavailable during {}; retry {}/{} with backoff. err={}",
                        operation, sig.totalRetriesInARow() + 1, maxAttempts, sig.failure().toString()))
                .onRetryExhaustedThrow((spec, sig) -> {
                    log.error("Log store unreachable after {} consecutive attempts during {}; escalating",
                            sig.totalRetriesInARow(), operation, sig.failure());
                    return sig.failure();
                });
    }
}
