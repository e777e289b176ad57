package com.podcast.bus.core.subscriber;

import com.podcast.bus.core.ack.AcknowledgementTracker;
import com.podcast.bus.core.error.ExceededRetryException;
import com.podcast.bus.core.error.StoreUnavailableException;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.model.PendingEntry;
import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.store.InMemoryLogStore;
import com.podcast.bus.core.store.LogStore;
import com.podcast.bus.core.store.StoreRetryPolicy;
import com.podcast.bus.support.Eventually;
import com.podcast.bus.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SubscriberLoopTest {

    private static final String STREAM = "episodes:transcribed";
    private static final String GROUP = "summarizer_group";
    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final Duration VISIBILITY = Duration.ofMinutes(5);

    private MutableClock clock;
    private InMemoryLogStore store;
    private final List<ExceededRetryException> reported = new CopyOnWriteArrayList<>();
    private final List<Subscription> started = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T08:00:00Z");
        store = new InMemoryLogStore(clock);
        store.createGroup(STREAM, GROUP, StartPosition.BEGINNING).block();
    }

    @AfterEach
    void tearDown() {
        started.forEach(Subscription::dispose);
    }

    @Test
    void shouldDeliverAndAcknowledgePublishedEntry() {
        List<Delivery> handled = new CopyOnWriteArrayList<>();
        EntryId id = append("{\"episodeId\":\"ep_1\"}");

        start(loop(5, Duration.ZERO), "summarizer_node01", recording(handled));

        Eventually.await(WAIT, () -> handled.size() == 1 && pending().isEmpty());
        assertThat(handled.get(0).id()).isEqualTo(id);
        assertThat(handled.get(0).deliveryCount()).isEqualTo(1);
        assertThat(handled.get(0).entry().payloadAsString()).contains("ep_1");
    }

    @Test
    void shouldResumeOwnPendingEntriesBeforeNewOnes() {
        EntryId e1 = append("1");
        EntryId e2 = append("2");
        store.readNew(STREAM, GROUP, "c1", 2, null).blockLast();
        EntryId e3 = append("3");
        List<Delivery> handled = new CopyOnWriteArrayList<>();

        start(loop(5, Duration.ZERO), "c1", recording(handled));

        Eventually.await(WAIT, () -> handled.size() == 3);
        assertThat(handled).extracting(Delivery::id).containsExactly(e1, e2, e3);
        assertThat(handled).extracting(Delivery::deliveryCount).containsExactly(2L, 2L, 1L);
        Eventually.await(WAIT, () -> pending().isEmpty());
    }

    @Test
    void shouldLeaveFailedEntryPendingAndContinue() {
        EntryId bad = append("bad");
        EntryId good = append("good");
        List<Delivery> handled = new CopyOnWriteArrayList<>();

        start(loop(5, Duration.ZERO), "c1", d -> {
            if (d.entry().payloadAsString().equals("bad")) {
                return Mono.error(new IllegalStateException("summarizer crashed"));
            }
            handled.add(d);
            return Mono.empty();
        });

        Eventually.await(WAIT, () -> handled.size() == 1);
        Eventually.await(WAIT, () -> pending().size() == 1);
        assertThat(handled.get(0).id()).isEqualTo(good);
        assertThat(pending().get(0).id()).isEqualTo(bad);
        assertThat(pending().get(0).consumer()).isEqualTo("c1");
    }

    @Test
    void shouldTreatThrownHandlerErrorLikeSignalledError() {
        EntryId id = append("x");

        start(loop(5, Duration.ZERO), "c1", d -> {
            throw new IllegalArgumentException("boom");
        });

        Eventually.await(WAIT, () -> pending().size() == 1);
        assertThat(pending().get(0).id()).isEqualTo(id);
    }

    @Test
    void shouldReportEntryOverBudgetWithoutInvokingHandler() {
        EntryId id = append("poison");
        store.readNew(STREAM, GROUP, "c1", 1, null).blockLast();
        List<Delivery> handled = new CopyOnWriteArrayList<>();

        start(loop(1, Duration.ZERO), "c1", recording(handled));

        Eventually.await(WAIT, () -> !reported.isEmpty());
        assertThat(reported.get(0).getEntryId()).isEqualTo(id);
        assertThat(reported.get(0).getDeliveryCount()).isEqualTo(2);
        assertThat(handled).isEmpty();
        assertThat(pending()).extracting(PendingEntry::id).containsExactly(id);
    }

    @Test
    void shouldHandleEntriesInIdOrder() {
        List<EntryId> published = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            published.add(append("e" + i));
        }
        List<Delivery> handled = new CopyOnWriteArrayList<>();

        start(loop(5, Duration.ZERO), "c1", recording(handled));

        Eventually.await(WAIT, () -> handled.size() == 25);
        assertThat(handled).extracting(Delivery::id).containsExactlyElementsOf(published);
    }

    @Test
    void shouldNotDeliverSameEntryToTwoConsumersOfOneGroup() {
        Set<EntryId> seen = ConcurrentHashMap.newKeySet();
        List<EntryId> duplicates = Collections.synchronizedList(new ArrayList<>());
        EntryHandler handler = d -> {
            if (!seen.add(d.id())) {
                duplicates.add(d.id());
            }
            return Mono.empty();
        };
        SubscriberLoop loop = loop(5, Duration.ZERO);
        start(loop, "c1", handler);
        start(loop, "c2", handler);

        for (int i = 0; i < 40; i++) {
            append("e" + i);
        }

        Eventually.await(WAIT, () -> seen.size() == 40);
        assertThat(duplicates).isEmpty();
        Eventually.await(WAIT, () -> pending().isEmpty());
    }

    @Test
    void shouldFinishInFlightEntryOnCooperativeStop() throws InterruptedException {
        EntryId first = append("first");
        EntryId second = append("second");
        CountDownLatch inFlight = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<EntryId> handled = new CopyOnWriteArrayList<>();

        Subscription sub = start(loop(5, Duration.ZERO), "c1", EntryHandler.blocking(d -> {
            inFlight.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            handled.add(d.id());
        }));

        assertThat(inFlight.await(5, TimeUnit.SECONDS)).isTrue();
        Mono<Void> termination = sub.stop();
        release.countDown();
        termination.block(WAIT);

        assertThat(sub.isTerminated()).isTrue();
        assertThat(handled).containsExactly(first);
        assertThat(pending()).extracting(PendingEntry::id).containsExactly(second);
    }

    @Test
    void shouldReclaimEntryOfSilentConsumer() {
        EntryId id = append("orphan");
        store.readNew(STREAM, GROUP, "dead_node", 1, null).blockLast();
        clock.advance(VISIBILITY.plusSeconds(1));
        List<Delivery> handled = new CopyOnWriteArrayList<>();

        start(loop(5, Duration.ofMinutes(1)), "rescuer", recording(handled));

        Eventually.await(WAIT, () -> handled.size() == 1);
        assertThat(handled.get(0).id()).isEqualTo(id);
        assertThat(handled.get(0).consumer()).isEqualTo("rescuer");
        assertThat(handled.get(0).deliveryCount()).isEqualTo(2);
        Eventually.await(WAIT, () -> pending().isEmpty());
    }

    @Test
    void shouldRejectStaleAcknowledgementAfterClaim() {
        EntryId id = append("contested");
        CountDownLatch done = new CountDownLatch(1);

        start(loop(5, Duration.ZERO), "slow", d -> store.claim(STREAM, GROUP, "fast", Duration.ZERO, List.of(d.id()))
                .then()
                .doFinally(s -> done.countDown()));

        Eventually.await(WAIT, () -> done.getCount() == 0);
        Eventually.await(WAIT, () -> !pending().isEmpty() && pending().get(0).consumer().equals("fast"));
        assertThat(pending()).extracting(PendingEntry::id).containsExactly(id);
    }

    @Test
    void shouldTerminateWithErrorWhenStoreStaysUnreachable() {
        LogStore broken = mock(LogStore.class);
        when(broken.readPending(anyString(), anyString(), anyString(), any(), anyInt()))
                .thenReturn(Flux.error(new StoreUnavailableException("connection refused", null)));
        AcknowledgementTracker tracker = new AcknowledgementTracker(broken, reported::add, VISIBILITY, 5);
        SubscriberSettings settings = new SubscriberSettings(10, Duration.ofMillis(50), Duration.ZERO, 100,
                new StoreRetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(5)));
        SubscriberLoop loop = new SubscriberLoop(broken, tracker, settings, clock);

        Subscription sub = start(loop, "c1", d -> Mono.empty());

        assertThatThrownBy(() -> sub.termination().block(WAIT)).isInstanceOf(StoreUnavailableException.class);
        assertThat(sub.isTerminated()).isTrue();
    }

    @Test
    void shouldRejectMissingArguments() {
        SubscriberLoop loop = loop(5, Duration.ZERO);

        assertThatThrownBy(() -> loop.subscribe(STREAM, GROUP, " ", d -> Mono.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loop.subscribe(STREAM, GROUP, "c1", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------------

    private SubscriberLoop loop(int maxDeliveries, Duration reclaimInterval) {
        AcknowledgementTracker tracker = new AcknowledgementTracker(store, reported::add, VISIBILITY, maxDeliveries);
        SubscriberSettings settings = new SubscriberSettings(10, Duration.ofMillis(50), reclaimInterval, 100,
                new StoreRetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5)));
        return new SubscriberLoop(store, tracker, settings, clock);
    }

    private Subscription start(SubscriberLoop loop, String consumer, EntryHandler handler) {
        Subscription sub = loop.subscribe(STREAM, GROUP, consumer, handler);
        started.add(sub);
        return sub;
    }

    private static EntryHandler recording(List<Delivery> sink) {
        return d -> {
            sink.add(d);
            return Mono.empty();
        };
    }

    private List<PendingEntry> pending() {
        return store.pending(STREAM, GROUP, 100).collectList().block();
    }

    private EntryId append(String payload) {
        return store.append(STREAM, payload.getBytes(StandardCharsets.UTF_8)).block();
    }
}
