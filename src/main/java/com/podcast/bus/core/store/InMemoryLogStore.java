package com.podcast.bus.core.store;

import com.podcast.bus.core.model.AckOutcome;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.model.GroupInfo;
import com.podcast.bus.core.model.PendingEntry;
import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.model.StreamEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Process-local {@link LogStore} with the same observable semantics as the Redis Streams adapter.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Every operation runs under a single store-wide lock, which gives the atomic id assignment,
 *       exclusive new-entry assignment and atomic claim that the bus depends on.</li>
 *   <li>Blocking reads wait on an append signal (a multicast {@link Sinks.Many}) or the block timeout,
 *       whichever comes first. A read that misses a signal is still bounded by the timeout.</li>
 * </ul>
 *
 * <h2>Notes</h2>
 * <ul>
 *   <li>Nothing survives a restart. Use it for tests and single-process local runs only.</li>
 *   <li>The {@link Clock} drives identifier millis and ledger idle times, so tests can move time.</li>
 * </ul>
 */
public class InMemoryLogStore implements LogStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLogStore.class);

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, StreamLog> streams = new HashMap<>();
    private final Sinks.Many<String> appended = Sinks.many().multicast().directBestEffort();

    public InMemoryLogStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLogStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<EntryId> append(String stream, byte[] payload) {
        return Mono.fromCallable(() -> {
            EntryId id;
            synchronized (lock) {
                StreamLog sl = streams.computeIfAbsent(stream, k -> new StreamLog());
                id = EntryId.nextAfter(sl.lastId, clock.millis());
                sl.entries.put(id, payload == null ? new byte[0] : Arrays.copyOf(payload, payload.length));
                sl.lastId = id;
            }
            signalAppend(stream);
            return id;
        });
    }

    @Override
    public Mono<Boolean> createGroup(String stream, String group, StartPosition start) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                StreamLog sl = streams.computeIfAbsent(stream, k -> new StreamLog());
                if (sl.groups.containsKey(group)) {
                    return false;
                }
                GroupState gs = new GroupState();
                gs.lastDelivered = start == StartPosition.NEW_ONLY ? sl.lastId : EntryId.MIN;
                sl.groups.put(group, gs);
                log.debug("Created group stream={} group={} start={} cursor={}", stream, group, start, gs.lastDelivered);
                return true;
            }
        });
    }

    @Override
    public Flux<Delivery> readPending(String stream, String group, String consumer, EntryId after, int count) {
        return Flux.defer(() -> {
            List<Delivery> out = new ArrayList<>();
            synchronized (lock) {
                StreamLog sl = requireStream(stream, group);
                GroupState gs = requireGroup(sl, stream, group);
                gs.consumers.add(consumer);
                Instant now = clock.instant();
                for (Map.Entry<EntryId, PendingRecord> e : gs.pending.tailMap(after, false).entrySet()) {
                    if (out.size() >= count) {
                        break;
                    }
                    PendingRecord rec = e.getValue();
                    if (!rec.consumer.equals(consumer)) {
                        continue;
                    }
                    rec.deliveryCount++;
                    rec.lastDelivery = now;
                    out.add(toDelivery(sl, stream, group, e.getKey(), rec));
                }
            }
            return Flux.fromIterable(out);
        });
    }

    @Override
    public Flux<Delivery> readNew(String stream, String group, String consumer, int count, Duration block) {
        Flux<Delivery> attempt = Flux.defer(() -> Flux.fromIterable(assignNew(stream, group, consumer, count)));
        if (block == null || block.isZero() || block.isNegative()) {
            return attempt;
        }
        Mono<Void> wakeUp = appended.asFlux()
                .filter(stream::equals)
                .next()
                .timeout(block, Mono.empty())
                .then();
        return attempt.switchIfEmpty(wakeUp.thenMany(attempt));
    }

    @Override
    public Mono<Boolean> acknowledge(String stream, String group, EntryId id) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                GroupState gs = findGroup(stream, group);
                return gs != null && gs.pending.remove(id) != null;
            }
        });
    }

    @Override
    public Mono<AckOutcome> acknowledgeOwned(String stream, String group, String consumer, EntryId id) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                GroupState gs = findGroup(stream, group);
                PendingRecord rec = gs == null ? null : gs.pending.get(id);
                if (rec == null) {
                    return AckOutcome.NOT_PENDING;
                }
                if (!rec.consumer.equals(consumer)) {
                    return AckOutcome.NOT_OWNER;
                }
                gs.pending.remove(id);
                return AckOutcome.ACKNOWLEDGED;
            }
        });
    }

    @Override
    public Flux<PendingEntry> pending(String stream, String group, EntryId after, int count) {
        return Flux.defer(() -> {
            List<PendingEntry> out = new ArrayList<>();
            synchronized (lock) {
                GroupState gs = requireGroup(requireStream(stream, group), stream, group);
                Instant now = clock.instant();
                for (Map.Entry<EntryId, PendingRecord> e : gs.pending.tailMap(after, false).entrySet()) {
                    if (out.size() >= count) {
                        break;
                    }
                    out.add(toPendingEntry(e.getKey(), e.getValue(), now));
                }
            }
            return Flux.fromIterable(out);
        });
    }

    @Override
    public Mono<PendingEntry> pendingEntry(String stream, String group, EntryId id) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                GroupState gs = findGroup(stream, group);
                PendingRecord rec = gs == null ? null : gs.pending.get(id);
                return rec == null ? null : toPendingEntry(id, rec, clock.instant());
            }
        });
    }

    @Override
    public Flux<Delivery> claim(String stream, String group, String consumer, Duration minIdle, List<EntryId> ids) {
        return Flux.defer(() -> {
            List<Delivery> out = new ArrayList<>();
            synchronized (lock) {
                StreamLog sl = requireStream(stream, group);
                GroupState gs = requireGroup(sl, stream, group);
                gs.consumers.add(consumer);
                Instant now = clock.instant();
                for (EntryId id : ids) {
                    PendingRecord rec = gs.pending.get(id);
                    if (rec == null || idle(rec, now).compareTo(minIdle) < 0) {
                        continue;
                    }
                    rec.consumer = consumer;
                    rec.deliveryCount++;
                    rec.lastDelivery = now;
                    out.add(toDelivery(sl, stream, group, id, rec));
                }
            }
            return Flux.fromIterable(out);
        });
    }

    @Override
    public Flux<GroupInfo> groups(String stream) {
        return Flux.defer(() -> {
            List<GroupInfo> out = new ArrayList<>();
            synchronized (lock) {
                StreamLog sl = streams.get(stream);
                if (sl != null) {
                    sl.groups.forEach((name, gs) -> out.add(
                            new GroupInfo(name, gs.consumers.size(), gs.pending.size(), gs.lastDelivered)));
                }
            }
            return Flux.fromIterable(out);
        });
    }

    @Override
    public Mono<Long> length(String stream) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                StreamLog sl = streams.get(stream);
                return sl == null ? 0L : (long) sl.entries.size();
            }
        });
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private List<Delivery> assignNew(String stream, String group, String consumer, int count) {
        List<Delivery> out = new ArrayList<>();
        synchronized (lock) {
            StreamLog sl = requireStream(stream, group);
            GroupState gs = requireGroup(sl, stream, group);
            gs.consumers.add(consumer);
            Instant now = clock.instant();
            for (EntryId id : sl.entries.tailMap(gs.lastDelivered, false).keySet()) {
                if (out.size() >= count) {
                    break;
                }
                PendingRecord rec = new PendingRecord(consumer, 1, now);
                gs.pending.put(id, rec);
                gs.lastDelivered = id;
                out.add(toDelivery(sl, stream, group, id, rec));
            }
        }
        return out;
    }

    private void signalAppend(String stream) {
        // Emission is serialized here; the sink rejects concurrent emitters.
        synchronized (appended) {
            appended.tryEmitNext(stream);
        }
    }

    private StreamLog requireStream(String stream, String group) {
        StreamLog sl = streams.get(stream);
        if (sl == null) {
            throw new IllegalStateException("NOGROUP no such stream '" + stream + "' for group '" + group + "'");
        }
        return sl;
    }

    private static GroupState requireGroup(StreamLog sl, String stream, String group) {
        GroupState gs = sl.groups.get(group);
        if (gs == null) {
            throw new IllegalStateException("NOGROUP no such consumer group '" + group + "' on stream '" + stream + "'");
        }
        return gs;
    }

    private GroupState findGroup(String stream, String group) {
        StreamLog sl = streams.get(stream);
        return sl == null ? null : sl.groups.get(group);
    }

    private static Delivery toDelivery(StreamLog sl, String stream, String group, EntryId id, PendingRecord rec) {
        byte[] payload = sl.entries.get(id);
        StreamEntry entry = new StreamEntry(stream, id, Arrays.copyOf(payload, payload.length));
        return new Delivery(entry, group, rec.consumer, rec.deliveryCount);
    }

    private static PendingEntry toPendingEntry(EntryId id, PendingRecord rec, Instant now) {
        return new PendingEntry(id, rec.consumer, rec.deliveryCount, idle(rec, now));
    }

    private static Duration idle(PendingRecord rec, Instant now) {
        Duration d = Duration.between(rec.lastDelivery, now);
        return d.isNegative() ? Duration.ZERO : d;
    }

    private static final class StreamLog {
        final NavigableMap<EntryId, byte[]> entries = new TreeMap<>();
        final Map<String, GroupState> groups = new LinkedHashMap<>();
        EntryId lastId = EntryId.MIN;
    }

    private static final class GroupState {
        final NavigableMap<EntryId, PendingRecord> pending = new TreeMap<>();
        final Set<String> consumers = new LinkedHashSet<>();
        EntryId lastDelivered;
    }

    private static final class PendingRecord {
        String consumer;
        long deliveryCount;
        Instant lastDelivery;

        PendingRecord(String consumer, long deliveryCount, Instant lastDelivery) {
            this.consumer = consumer;
            this.deliveryCount = deliveryCount;
            this.lastDelivery = lastDelivery;
        }
    }
}
