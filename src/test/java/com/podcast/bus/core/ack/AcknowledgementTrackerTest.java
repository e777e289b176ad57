package com.podcast.bus.core.ack;

import com.podcast.bus.core.error.ExceededRetryException;
import com.podcast.bus.core.model.AckOutcome;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.model.StreamEntry;
import com.podcast.bus.core.store.InMemoryLogStore;
import com.podcast.bus.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AcknowledgementTrackerTest {

    private static final String STREAM = "episodes:summarized";
    private static final String GROUP = "rag_group";
    private static final Duration VISIBILITY = Duration.ofMinutes(5);

    private MutableClock clock;
    private InMemoryLogStore store;
    private final List<ExceededRetryException> reported = new ArrayList<>();
    private AcknowledgementTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        store = new InMemoryLogStore(clock);
        tracker = new AcknowledgementTracker(store, reported::add, VISIBILITY, 3);
        store.createGroup(STREAM, GROUP, StartPosition.BEGINNING).block();
    }

    @Test
    void shouldAcknowledgeOnlyForOwner() {
        EntryId id = deliverTo("worker_a");

        assertThat(tracker.acknowledge(STREAM, GROUP, "worker_b", id).block()).isEqualTo(AckOutcome.NOT_OWNER);
        assertThat(store.pendingEntry(STREAM, GROUP, id).block()).isNotNull();
        assertThat(tracker.acknowledge(STREAM, GROUP, "worker_a", id).block()).isEqualTo(AckOutcome.ACKNOWLEDGED);
        assertThat(store.pendingEntry(STREAM, GROUP, id).block()).isNull();
    }

    @Test
    void shouldAcknowledgeUnconditionallyForMaintenance() {
        EntryId id = deliverTo("worker_a");

        assertThat(tracker.acknowledge(STREAM, GROUP, id).block()).isTrue();
        assertThat(tracker.acknowledge(STREAM, GROUP, id).block()).isFalse();
    }

    @Test
    void shouldRefuseClaimBeforeVisibilityTimeout() {
        EntryId id = deliverTo("worker_a");
        clock.advance(VISIBILITY.minusSeconds(1));

        StepVerifier.create(tracker.claim(STREAM, GROUP, id, "worker_b")).verifyComplete();
        assertThat(store.pendingEntry(STREAM, GROUP, id).block().consumer()).isEqualTo("worker_a");
    }

    @Test
    void shouldClaimAfterVisibilityTimeoutAndMakeOldOwnerStale() {
        EntryId id = deliverTo("worker_a");
        clock.advance(VISIBILITY.plusSeconds(1));

        Delivery claimed = tracker.claim(STREAM, GROUP, id, "worker_b").block();

        assertThat(claimed.consumer()).isEqualTo("worker_b");
        assertThat(claimed.deliveryCount()).isEqualTo(2);
        assertThat(tracker.acknowledge(STREAM, GROUP, "worker_a", id).block()).isEqualTo(AckOutcome.NOT_OWNER);
        assertThat(tracker.acknowledge(STREAM, GROUP, "worker_b", id).block()).isEqualTo(AckOutcome.ACKNOWLEDGED);
    }

    @Test
    void shouldReportInsteadOfClaimingExhaustedEntry() {
        EntryId id = deliverTo("worker_a");
        store.readPending(STREAM, GROUP, "worker_a", EntryId.MIN, 10).blockLast();
        store.readPending(STREAM, GROUP, "worker_a", EntryId.MIN, 10).blockLast();
        clock.advance(VISIBILITY.plusSeconds(1));

        StepVerifier.create(tracker.claim(STREAM, GROUP, id, "worker_b")).verifyComplete();

        assertThat(reported).singleElement().satisfies(e -> {
            assertThat(e.getEntryId()).isEqualTo(id);
            assertThat(e.getDeliveryCount()).isEqualTo(3);
            assertThat(e.getMaxDeliveries()).isEqualTo(3);
        });
        assertThat(store.pendingEntry(STREAM, GROUP, id).block().consumer()).isEqualTo("worker_a");
    }

    @Test
    void shouldReclaimOnlyIdleEntriesWithBudget() {
        EntryId stale = deliverTo("dead_worker");
        clock.advance(VISIBILITY.plusSeconds(1));
        EntryId fresh = deliverTo("live_worker");

        List<Delivery> reclaimed = tracker.reclaimIdle(STREAM, GROUP, "rescuer", 100).collectList().block();

        assertThat(reclaimed).extracting(Delivery::id).containsExactly(stale);
        assertThat(store.pendingEntry(STREAM, GROUP, fresh).block().consumer()).isEqualTo("live_worker");
    }

    @Test
    void shouldReclaimPastExhaustedEntriesAtFrontOfLedger() {
        EntryId first = deliverTo("dead_worker");
        EntryId second = deliverTo("dead_worker");
        EntryId third = deliverTo("dead_worker");
        store.readPending(STREAM, GROUP, "dead_worker", EntryId.MIN, 2).blockLast();
        store.readPending(STREAM, GROUP, "dead_worker", EntryId.MIN, 2).blockLast();
        clock.advance(VISIBILITY.plusSeconds(1));

        List<Delivery> reclaimed = tracker.reclaimIdle(STREAM, GROUP, "rescuer", 2).collectList().block();

        assertThat(reclaimed).extracting(Delivery::id).containsExactly(third);
        assertThat(reported).extracting(ExceededRetryException::getEntryId).containsExactly(first, second);
        assertThat(store.pendingEntry(STREAM, GROUP, first).block().consumer()).isEqualTo("dead_worker");
    }

    @Test
    void shouldStopSweepAtLimit() {
        deliverTo("dead_worker");
        deliverTo("dead_worker");
        EntryId third = deliverTo("dead_worker");
        clock.advance(VISIBILITY.plusSeconds(1));

        List<Delivery> reclaimed = tracker.reclaimIdle(STREAM, GROUP, "rescuer", 2).collectList().block();

        assertThat(reclaimed).hasSize(2);
        assertThat(store.pendingEntry(STREAM, GROUP, third).block().consumer()).isEqualTo("dead_worker");
    }

    @Test
    void shouldRejectMinIdleBelowVisibilityTimeout() {
        EntryId id = deliverTo("busy_worker");

        StepVerifier.create(tracker.claim(STREAM, GROUP, id, "worker_b", Duration.ZERO))
                .expectError(IllegalArgumentException.class)
                .verify();

        assertThat(store.pendingEntry(STREAM, GROUP, id).block().consumer()).isEqualTo("busy_worker");
        assertThat(store.pendingEntry(STREAM, GROUP, id).block().deliveryCount()).isEqualTo(1);
    }

    @Test
    void shouldHonourMinIdleLongerThanVisibilityTimeout() {
        EntryId id = deliverTo("worker_a");
        clock.advance(VISIBILITY.plusMinutes(1));

        StepVerifier.create(tracker.claim(STREAM, GROUP, id, "worker_b", Duration.ofMinutes(10))).verifyComplete();
        assertThat(store.pendingEntry(STREAM, GROUP, id).block().consumer()).isEqualTo("worker_a");
    }

    @Test
    void shouldReportDeliveryOverBudget() {
        StreamEntry entry = new StreamEntry(STREAM, new EntryId(1, 0), new byte[0]);

        assertThat(tracker.reportIfExceeded(new Delivery(entry, GROUP, "c", 3))).isFalse();
        assertThat(tracker.reportIfExceeded(new Delivery(entry, GROUP, "c", 4))).isTrue();
        assertThat(reported).hasSize(1);
    }

    @Test
    void shouldValidateSettings() {
        assertThatThrownBy(() -> new AcknowledgementTracker(store, reported::add, VISIBILITY, 0))
                .isInstanceOf(IllegalArgumentException.class);
        StepVerifier.create(tracker.pending(STREAM, GROUP, 0)).expectError(IllegalArgumentException.class).verify();
    }

    private EntryId deliverTo(String consumer) {
        store.append(STREAM, "payload".getBytes(StandardCharsets.UTF_8)).block();
        return store.readNew(STREAM, GROUP, consumer, 1, null).blockFirst().id();
    }
}
