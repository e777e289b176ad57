package com.podcast.bus.core.subscriber;

import com.podcast.bus.core.ack.AcknowledgementTracker;
import com.podcast.bus.core.error.DeliveryException;
import com.podcast.bus.core.model.AckOutcome;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.store.LogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * =====================================================================
 * SubscriberLoop
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Runs one consumer of one group on one stream:
 *
 *   resumption ──► reclaim sweep ──► live loop (with periodic sweeps)
 *
 * PHASES
 * ------
 * 1. Resumption: re-reads this consumer's own pending entries page by page, cursor advancing past each
 *    page, until a page comes back empty. Entries delivered before a crash are processed before
 *    anything new.
 * 2. Reclaim: claims entries of the group that sat idle longer than the visibility timeout, including
 *    this consumer's own failed entries.
 * 3. Live: reads never-delivered entries with a bounded block and handles them in id order.
 *
 * ERROR POLICY
 * ------------
 * - handler failure: logged, entry left pending, loop continues
 * - delivery count over budget: handler skipped, entry reported, left pending
 * - store unreachable: bounded exponential backoff, then ERROR escalation and termination
 * - anything else from the store (missing group, protocol errors): terminates the loop
 *
 * Entries are handled strictly one at a time per loop.
 */
public class SubscriberLoop {

    private static final Logger log = LoggerFactory.getLogger(SubscriberLoop.class);

    private final LogStore store;
    private final AcknowledgementTracker tracker;
    private final SubscriberSettings settings;
    private final Clock clock;

    public SubscriberLoop(LogStore store, AcknowledgementTracker tracker, SubscriberSettings settings) {
        this(store, tracker, settings, Clock.systemUTC());
    }

    public SubscriberLoop(LogStore store, AcknowledgementTracker tracker, SubscriberSettings settings, Clock clock) {
        this.store = store;
        this.tracker = tracker;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Starts a loop. The group must already exist.
     */
    public Subscription subscribe(String stream, String group, String consumer, EntryHandler handler) {
        require(stream, "stream");
        require(group, "group");
        require(consumer, "consumer");
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }

        Subscription sub = new Subscription(stream, group, consumer);
        AtomicReference<Instant> lastSweep = new AtomicReference<>(clock.instant());

        Mono<Void> run = resume(sub, handler)
                .then(Mono.defer(() -> sweep(sub, handler)))
                .doOnSuccess(v -> lastSweep.set(clock.instant()))
                .then(Mono.defer(() -> live(sub, handler, lastSweep)));

        Disposable d = run
                .doOnSubscribe(s -> log.info("Subscriber started stream={} group={} consumer={}", stream, group, consumer))
                .subscribe(
                        v -> { },
                        err -> {
                            log.error("Subscriber terminated stream={} group={} consumer={} err={}",
                                    stream, group, consumer, err.toString(), err);
                            sub.failed(err);
                        },
                        () -> {
                            log.info("Subscriber stopped stream={} group={} consumer={}", stream, group, consumer);
                            sub.completed();
                        });
        sub.attach(d);
        return sub;
    }

    // ---------------------------------------------------------------------
    // Phases
    // ---------------------------------------------------------------------

    private Mono<Void> resume(Subscription sub, EntryHandler handler) {
        return Mono.just(EntryId.MIN)
                .expand(after -> {
                    if (sub.isStopRequested()) {
                        return Mono.empty();
                    }
                    return readPendingPage(sub, after)
                            .flatMap(page -> {
                                if (page.isEmpty()) {
                                    return Mono.empty();
                                }
                                log.info("Resuming pending entries stream={} group={} consumer={} count={} after={}",
                                        sub.stream(), sub.group(), sub.consumer(), page.size(), after);
                                EntryId next = page.get(page.size() - 1).id();
                                return deliverAll(sub, handler, page).thenReturn(next);
                            });
                })
                .then();
    }

    private Mono<Void> sweep(Subscription sub, EntryHandler handler) {
        if (!settings.reclaimEnabled() || sub.isStopRequested()) {
            return Mono.empty();
        }
        return Mono.defer(() -> tracker.reclaimIdle(sub.stream(), sub.group(), sub.consumer(), settings.reclaimLimit()).collectList())
                .retryWhen(retry("reclaim", sub))
                .flatMap(claimed -> deliverAll(sub, handler, claimed));
    }

    private Mono<Void> live(Subscription sub, EntryHandler handler, AtomicReference<Instant> lastSweep) {
        return Mono.defer(() -> {
                    if (sub.isStopRequested()) {
                        return Mono.<Void>empty();
                    }
                    return sweepIfDue(sub, handler, lastSweep)
                            .then(Mono.defer(() -> readNewBatch(sub)))
                            .flatMap(batch -> deliverAll(sub, handler, batch));
                })
                .repeat(() -> !sub.isStopRequested())
                .then();
    }

    private Mono<Void> sweepIfDue(Subscription sub, EntryHandler handler, AtomicReference<Instant> lastSweep) {
        if (!settings.reclaimEnabled()) {
            return Mono.empty();
        }
        Instant now = clock.instant();
        if (Duration.between(lastSweep.get(), now).compareTo(settings.reclaimInterval()) < 0) {
            return Mono.empty();
        }
        lastSweep.set(now);
        return sweep(sub, handler);
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    private Mono<List<Delivery>> readPendingPage(Subscription sub, EntryId after) {
        return Mono.defer(() -> store.readPending(sub.stream(), sub.group(), sub.consumer(), after, settings.batchSize()).collectList())
                .retryWhen(retry("readPending", sub));
    }

    private Mono<List<Delivery>> readNewBatch(Subscription sub) {
        return Mono.defer(() -> store.readNew(sub.stream(), sub.group(), sub.consumer(), settings.batchSize(), settings.pollTimeout()).collectList())
                .retryWhen(retry("readNew", sub));
    }

    // ---------------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------------

    private Mono<Void> deliverAll(Subscription sub, EntryHandler handler, List<Delivery> batch) {
        return Flux.fromIterable(batch)
                .concatMap(d -> deliver(sub, handler, d))
                .then();
    }

    private Mono<Void> deliver(Subscription sub, EntryHandler handler, Delivery delivery) {
        // Remaining entries of the batch stay pending for this consumer and come back on resumption.
        if (sub.isStopRequested()) {
            return Mono.empty();
        }
        if (tracker.reportIfExceeded(delivery)) {
            return Mono.empty();
        }
        return Mono.defer(() -> handler.handle(delivery))
                .thenReturn(Boolean.TRUE)
                .onErrorResume(err -> {
                    DeliveryException failure = new DeliveryException(delivery, err);
                    try (DeliveryMdc mdc = DeliveryMdc.of(delivery)) {
                        log.warn("{}; entry left pending", failure.getMessage(), failure);
                    }
                    return Mono.just(Boolean.FALSE);
                })
                .flatMap(ok -> ok ? acknowledge(sub, delivery) : Mono.empty());
    }

    private Mono<Void> acknowledge(Subscription sub, Delivery delivery) {
        return Mono.defer(() -> tracker.acknowledge(delivery.stream(), delivery.group(), delivery.consumer(), delivery.id()))
                .retryWhen(retry("ack", sub))
                .doOnNext(outcome -> {
                    try (DeliveryMdc mdc = DeliveryMdc.of(delivery)) {
                        if (outcome == AckOutcome.NOT_OWNER) {
                            log.warn("Ack rejected: entry was claimed by another consumer while being handled. id={}", delivery.id());
                        } else if (outcome == AckOutcome.NOT_PENDING) {
                            log.debug("Ack found entry no longer pending. id={}", delivery.id());
                        }
                    }
                })
                .then();
    }

    private RetryBackoffSpec retry(String operation, Subscription sub) {
        return settings.storeRetry().toRetrySpec(log, operation + " " + sub.stream() + "/" + sub.group() + "/" + sub.consumer());
    }

    private static void require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
