package com.podcast.bus.redis;

import com.podcast.bus.core.error.StoreUnavailableException;
import com.podcast.bus.core.model.AckOutcome;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.model.GroupInfo;
import com.podcast.bus.core.model.PendingEntry;
import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.model.StreamEntry;
import com.podcast.bus.core.store.LogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisStreamCommands.XClaimOptions;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveStreamOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * =====================================================================
 * RedisStreamLogStore
 * =====================================================================
 *
 * PURPOSE
 * -------
 * {@link LogStore} on Redis Streams through Spring Data Redis reactive (Lettuce).
 *
 * COMMAND MAPPING
 * ---------------
 *  append            → XADD stream * payload &lt;bytes&gt;
 *  createGroup       → XGROUP CREATE stream group 0|$ MKSTREAM   (BUSYGROUP → false)
 *  readPending       → XREADGROUP ... STREAMS stream &lt;after&gt;    + XPENDING for counts
 *                      (pages of trimmed entries are read past)
 *  readNew           → XREADGROUP ... BLOCK ms STREAMS stream &gt;
 *  acknowledge       → XACK
 *  acknowledgeOwned  → Lua: XPENDING owner check, then XACK
 *  pending           → XPENDING stream group &lt;after+1&gt; + count
 *  claim             → XCLAIM stream group consumer min-idle ids   + XPENDING for counts
 *  groups            → XINFO GROUPS
 *  length            → XLEN
 *
 * ERROR MAPPING
 * -------------
 * - connection failures → {@link StoreUnavailableException}
 * - NOGROUP replies → {@link IllegalStateException}
 * - everything else propagates as translated by Spring
 *
 * NOTES
 * -----
 * - One field per entry: {@value #PAYLOAD_FIELD}, holding the raw payload bytes.
 * - A BLOCK of zero means "forever" to Redis; live reads always carry a positive block.
 * - Entries removed from the stream while still pending come back from XREADGROUP without fields.
 *   They are logged and skipped.
 */
public class RedisStreamLogStore implements LogStore {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamLogStore.class);

    static final String PAYLOAD_FIELD = "payload";

    /**
     * KEYS[1]=stream, ARGV[1]=group, ARGV[2]=consumer, ARGV[3]=id.
     * Returns 1 acknowledged, 0 not pending, -1 owned by another consumer.
     */
    static final String ACK_OWNED_LUA = """
            local p = redis.call('XPENDING', KEYS[1], ARGV[1], ARGV[3], ARGV[3], 1)
            if #p == 0 then
              return 0
            end
            if p[1][2] ~= ARGV[2] then
              return -1
            end
            return redis.call('XACK', KEYS[1], ARGV[1], ARGV[3])
            """;

    private static final RedisScript<Long> ACK_OWNED = new DefaultRedisScript<>(ACK_OWNED_LUA, Long.class);

    private final ReactiveRedisTemplate<String, byte[]> template;
    private final ReactiveStringRedisTemplate strings;
    private final ReactiveStreamOperations<String, String, byte[]> ops;

    public RedisStreamLogStore(ReactiveRedisTemplate<String, byte[]> template, ReactiveStringRedisTemplate strings) {
        this.template = template;
        this.strings = strings;
        this.ops = template.opsForStream();
    }

    @Override
    public Mono<EntryId> append(String stream, byte[] payload) {
        MapRecord<String, String, byte[]> record = StreamRecords.newRecord()
                .in(stream)
                .ofMap(Map.of(PAYLOAD_FIELD, payload == null ? new byte[0] : payload));
        return ops.add(record)
                .map(RedisStreamLogStore::toEntryId)
                .onErrorMap(e -> translate(e, "XADD " + stream));
    }

    @Override
    public Mono<Boolean> createGroup(String stream, String group, StartPosition start) {
        ReadOffset offset = start == StartPosition.NEW_ONLY ? ReadOffset.latest() : ReadOffset.from("0-0");
        ByteBuffer key = ByteBuffer.wrap(stream.getBytes(StandardCharsets.UTF_8));
        return template.execute(conn -> conn.streamCommands().xGroupCreate(key, group, offset, true))
                .next()
                .map(ok -> Boolean.TRUE)
                .onErrorResume(RedisStreamLogStore::isBusyGroup, e -> Mono.just(Boolean.FALSE))
                .onErrorMap(e -> translate(e, "XGROUP CREATE " + stream + " " + group));
    }

    @Override
    public Flux<Delivery> readPending(String stream, String group, String consumer, EntryId after, int count) {
        Consumer who = Consumer.from(group, consumer);
        // A page holding only trimmed entries yields nothing, so read on past it instead of ending resumption.
        return readPendingPage(who, stream, after, count)
                .expand(raw -> raw.isEmpty() || raw.stream().anyMatch(RedisStreamLogStore::carriesPayload)
                        ? Mono.empty()
                        : readPendingPage(who, stream, toEntryId(raw.get(raw.size() - 1).getId()), count))
                .map(raw -> raw.stream().filter(rec -> hasPayload(rec, group)).collect(Collectors.toList()))
                .filter(records -> !records.isEmpty())
                .next()
                .flatMapMany(records -> withDeliveryCounts(stream, group, consumer, records))
                .onErrorMap(e -> translate(e, "XREADGROUP " + stream + " " + group + " " + after));
    }

    private Mono<List<MapRecord<String, String, byte[]>>> readPendingPage(Consumer who, String stream,
                                                                         EntryId after, int count) {
        StreamOffset<String> offset = StreamOffset.create(stream, ReadOffset.from(after.toString()));
        return ops.read(who, StreamReadOptions.empty().count(count), offset).collectList();
    }

    @Override
    public Flux<Delivery> readNew(String stream, String group, String consumer, int count, Duration block) {
        StreamReadOptions options = StreamReadOptions.empty().count(count);
        if (block != null && !block.isZero() && !block.isNegative()) {
            options = options.block(block);
        }
        return ops.read(Consumer.from(group, consumer), options, StreamOffset.create(stream, ReadOffset.lastConsumed()))
                .filter(rec -> hasPayload(rec, group))
                .map(rec -> new Delivery(toEntry(stream, rec), group, consumer, 1))
                .onErrorMap(e -> translate(e, "XREADGROUP " + stream + " " + group + " >"));
    }

    @Override
    public Mono<Boolean> acknowledge(String stream, String group, EntryId id) {
        return ops.acknowledge(stream, group, RecordId.of(id.toString()))
                .map(n -> n > 0)
                .onErrorMap(e -> translate(e, "XACK " + stream + " " + group + " " + id));
    }

    @Override
    public Mono<AckOutcome> acknowledgeOwned(String stream, String group, String consumer, EntryId id) {
        return strings.execute(ACK_OWNED, List.of(stream), List.of(group, consumer, id.toString()))
                .next()
                .map(RedisStreamLogStore::toAckOutcome)
                .onErrorMap(e -> translate(e, "ack-owned " + stream + " " + group + " " + id));
    }

    @Override
    public Flux<PendingEntry> pending(String stream, String group, EntryId after, int count) {
        Range<String> range = Range.rightUnbounded(Range.Bound.inclusive(after.successor().toString()));
        return ops.pending(stream, group, range, count)
                .flatMapMany(pm -> Flux.fromStream(pm.stream()))
                .map(RedisStreamLogStore::toPendingEntry)
                .onErrorMap(e -> translate(e, "XPENDING " + stream + " " + group));
    }

    @Override
    public Mono<PendingEntry> pendingEntry(String stream, String group, EntryId id) {
        return ops.pending(stream, group, Range.closed(id.toString(), id.toString()), 1)
                .flatMap(pm -> pm.isEmpty() ? Mono.empty() : Mono.just(toPendingEntry(pm.get(0))))
                .onErrorMap(e -> translate(e, "XPENDING " + stream + " " + group + " " + id));
    }

    @Override
    public Flux<Delivery> claim(String stream, String group, String consumer, Duration minIdle, List<EntryId> ids) {
        if (ids.isEmpty()) {
            return Flux.empty();
        }
        RecordId[] recordIds = ids.stream().map(id -> RecordId.of(id.toString())).toArray(RecordId[]::new);
        return ops.claim(stream, group, consumer, XClaimOptions.minIdle(minIdle).ids(recordIds))
                .filter(rec -> hasPayload(rec, group))
                .collectList()
                .flatMapMany(records -> records.isEmpty()
                        ? Flux.empty()
                        : withDeliveryCounts(stream, group, consumer, records))
                .onErrorMap(e -> translate(e, "XCLAIM " + stream + " " + group + " " + consumer));
    }

    @Override
    public Flux<GroupInfo> groups(String stream) {
        return ops.groups(stream)
                .map(g -> new GroupInfo(g.groupName(), g.consumerCount(), g.pendingCount(),
                        g.lastDeliveredId() == null ? EntryId.MIN : EntryId.parse(g.lastDeliveredId())))
                .onErrorResume(RedisStreamLogStore::isNoSuchKey, e -> Flux.empty())
                .onErrorMap(e -> translate(e, "XINFO GROUPS " + stream));
    }

    @Override
    public Mono<Long> length(String stream) {
        return ops.size(stream)
                .defaultIfEmpty(0L)
                .onErrorMap(e -> translate(e, "XLEN " + stream));
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    /**
     * XREADGROUP and XCLAIM do not report delivery counts, so they are read back from the ledger.
     */
    private Flux<Delivery> withDeliveryCounts(String stream, String group, String consumer,
                                              List<MapRecord<String, String, byte[]>> records) {
        String first = records.get(0).getId().getValue();
        String last = records.get(records.size() - 1).getId().getValue();
        return ops.pending(stream, Consumer.from(group, consumer), Range.closed(first, last), records.size())
                .map(pm -> {
                    Map<String, Long> counts = new HashMap<>();
                    for (PendingMessage m : pm) {
                        counts.put(m.getIdAsString(), m.getTotalDeliveryCount());
                    }
                    return counts;
                })
                .defaultIfEmpty(Map.of())
                .flatMapMany(counts -> Flux.fromIterable(records)
                        .map(rec -> new Delivery(toEntry(stream, rec), group, consumer,
                                counts.getOrDefault(rec.getId().getValue(), 1L))));
    }

    private static boolean carriesPayload(MapRecord<String, String, byte[]> rec) {
        Map<String, byte[]> value = rec.getValue();
        return value != null && value.containsKey(PAYLOAD_FIELD);
    }

    private static boolean hasPayload(MapRecord<String, String, byte[]> rec, String group) {
        if (!carriesPayload(rec)) {
            log.warn("Skipping pending entry without payload (removed from stream?) stream={} group={} id={}",
                    rec.getStream(), group, rec.getId());
            return false;
        }
        return true;
    }

    private static StreamEntry toEntry(String stream, MapRecord<String, String, byte[]> rec) {
        return new StreamEntry(stream, toEntryId(rec.getId()), rec.getValue().get(PAYLOAD_FIELD));
    }

    private static EntryId toEntryId(RecordId id) {
        return EntryId.parse(id.getValue());
    }

    private static PendingEntry toPendingEntry(PendingMessage m) {
        return new PendingEntry(EntryId.parse(m.getIdAsString()), m.getConsumerName(),
                m.getTotalDeliveryCount(), m.getElapsedTimeSinceLastDelivery());
    }

    static AckOutcome toAckOutcome(Long reply) {
        long r = reply == null ? 0 : reply;
        if (r > 0) {
            return AckOutcome.ACKNOWLEDGED;
        }
        return r < 0 ? AckOutcome.NOT_OWNER : AckOutcome.NOT_PENDING;
    }

    static Throwable translate(Throwable e, String command) {
        if (e instanceof StoreUnavailableException || e instanceof IllegalStateException) {
            return e;
        }
        if (e instanceof RedisConnectionFailureException) {
            return new StoreUnavailableException("Redis unreachable during " + command, e);
        }
        if (messageContains(e, "NOGROUP")) {
            return new IllegalStateException("NOGROUP " + command + ": " + e.getMessage(), e);
        }
        return e;
    }

    private static boolean isBusyGroup(Throwable e) {
        return messageContains(e, "BUSYGROUP");
    }

    private static boolean isNoSuchKey(Throwable e) {
        return messageContains(e, "no such key");
    }

    private static boolean messageContains(Throwable e, String marker) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(marker)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
