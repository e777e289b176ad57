package com.podcast.bus.core.ack;

import com.podcast.bus.core.error.ExceededRetryException;
import com.podcast.bus.core.model.AckOutcome;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.model.PendingEntry;
import com.podcast.bus.core.store.LogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * =====================================================================
 * AcknowledgementTracker
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Owns the group ledger side of delivery:
 *  - owner-checked acknowledgement for subscriber loops
 *  - unconditional acknowledgement for operators
 *  - claim of entries whose owner went quiet for longer than the visibility timeout
 *  - detection of entries that used up their delivery budget
 *
 * RULES
 * -----
 * - an entry is claimable only when idle for at least {@code visibilityTimeout}; callers may ask
 *   for a longer idle time, never a shorter one
 * - a claim increments the delivery count
 * - an entry whose count already reached {@code maxDeliveries} is reported, never claimed
 * - nothing here deletes entries from a stream
 */
public class AcknowledgementTracker {

    private static final Logger log = LoggerFactory.getLogger(AcknowledgementTracker.class);

    private final LogStore store;
    private final DeadLetterReporter reporter;
    private final Duration visibilityTimeout;
    private final int maxDeliveries;

    public AcknowledgementTracker(LogStore store, DeadLetterReporter reporter, Duration visibilityTimeout, int maxDeliveries) {
        if (visibilityTimeout == null || visibilityTimeout.isNegative()) {
            throw new IllegalArgumentException("visibilityTimeout must be >= 0");
        }
        if (maxDeliveries < 1) {
            throw new IllegalArgumentException("maxDeliveries must be >= 1");
        }
        this.store = store;
        this.reporter = reporter;
        this.visibilityTimeout = visibilityTimeout;
        this.maxDeliveries = maxDeliveries;
    }

    public Duration getVisibilityTimeout() {
        return visibilityTimeout;
    }

    public int getMaxDeliveries() {
        return maxDeliveries;
    }

    /**
     * Owner-checked acknowledgement. A consumer whose entry was claimed away gets
     * {@link AckOutcome#NOT_OWNER} and the ledger is left unchanged.
     */
    public Mono<AckOutcome> acknowledge(String stream, String group, String consumer, EntryId id) {
        return store.acknowledgeOwned(stream, group, consumer, id)
                .doOnNext(outcome -> {
                    if (outcome == AckOutcome.ACKNOWLEDGED) {
                        log.debug("Acked stream={} group={} id={} consumer={}", stream, group, id, consumer);
                    }
                });
    }

    /**
     * Unconditional acknowledgement used by the maintenance surface.
     *
     * @return {@code true} if the entry was pending
     */
    public Mono<Boolean> acknowledge(String stream, String group, EntryId id) {
        return store.acknowledge(stream, group, id)
                .doOnNext(removed -> log.info("Manual ack stream={} group={} id={} removed={}", stream, group, id, removed));
    }

    /**
     * Claims one pending entry for {@code newConsumer} using the configured visibility timeout.
     *
     * @return the new delivery, or empty when the entry is not pending, not idle long enough, or
     * already over budget (in which case it is reported)
     */
    public Mono<Delivery> claim(String stream, String group, EntryId id, String newConsumer) {
        return claim(stream, group, id, newConsumer, visibilityTimeout);
    }

    /**
     * Same as {@link #claim(String, String, EntryId, String)} with an explicit minimum idle time.
     * {@code minIdle} may raise the visibility timeout but never lower it.
     */
    public Mono<Delivery> claim(String stream, String group, EntryId id, String newConsumer, Duration minIdle) {
        if (newConsumer == null || newConsumer.isBlank()) {
            return Mono.error(new IllegalArgumentException("consumer is required"));
        }
        if (minIdle != null && minIdle.compareTo(visibilityTimeout) < 0) {
            return Mono.error(new IllegalArgumentException(
                    "minIdle " + minIdle + " is below the visibility timeout " + visibilityTimeout));
        }
        Duration idle = minIdle == null ? visibilityTimeout : minIdle;
        return store.pendingEntry(stream, group, id)
                .flatMap(pe -> {
                    if (isExhausted(pe.deliveryCount())) {
                        report(stream, group, pe);
                        return Mono.empty();
                    }
                    return store.claim(stream, group, newConsumer, idle, List.of(id)).next();
                })
                .doOnNext(d -> log.info("Claimed stream={} group={} id={} consumer={} deliveries={}",
                        stream, group, id, newConsumer, d.deliveryCount()));
    }

    /**
     * Claims up to {@code limit} idle entries that still have budget. The ledger is read page by page
     * from the lowest id, so exhausted entries left pending at the front never hide the ones behind
     * them. Includes the claimant's own idle entries, which is how a failed entry gets its next attempt.
     */
    public Flux<Delivery> reclaimIdle(String stream, String group, String consumer, int limit) {
        if (limit < 1) {
            return Flux.error(new IllegalArgumentException("limit must be >= 1"));
        }
        return store.pending(stream, group, EntryId.MIN, limit).collectList()
                .expand(page -> page.size() < limit
                        ? Mono.empty()
                        : store.pending(stream, group, page.get(page.size() - 1).id(), limit).collectList())
                .concatMapIterable(page -> page)
                .filter(pe -> pe.isIdleLongerThan(visibilityTimeout))
                .filter(pe -> {
                    if (isExhausted(pe.deliveryCount())) {
                        report(stream, group, pe);
                        return false;
                    }
                    return true;
                })
                .take(limit)
                .map(PendingEntry::id)
                .collectList()
                .flatMapMany(ids -> {
                    if (ids.isEmpty()) {
                        return Flux.empty();
                    }
                    log.info("Reclaiming idle entries stream={} group={} consumer={} count={}", stream, group, consumer, ids.size());
                    return store.claim(stream, group, consumer, visibilityTimeout, ids);
                });
    }

    public Flux<PendingEntry> pending(String stream, String group, int limit) {
        if (limit < 1) {
            return Flux.error(new IllegalArgumentException("limit must be >= 1"));
        }
        return store.pending(stream, group, limit);
    }

    /**
     * @return {@code true} if the delivery went past the budget and was reported
     */
    public boolean reportIfExceeded(Delivery delivery) {
        if (delivery.deliveryCount() <= maxDeliveries) {
            return false;
        }
        reporter.report(new ExceededRetryException(delivery.stream(), delivery.group(), delivery.id(),
                delivery.consumer(), delivery.deliveryCount(), maxDeliveries));
        return true;
    }

    private boolean isExhausted(long deliveryCount) {
        return deliveryCount >= maxDeliveries;
    }

    private void report(String stream, String group, PendingEntry pe) {
        reporter.report(new ExceededRetryException(stream, group, pe.id(), pe.consumer(), pe.deliveryCount(), maxDeliveries));
    }
}
