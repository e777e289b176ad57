package com.podcast.bus.core.store;

import com.podcast.bus.core.model.AckOutcome;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.model.GroupInfo;
import com.podcast.bus.core.model.PendingEntry;
import com.podcast.bus.core.model.StartPosition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * =====================================================================
 * LogStore
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The **storage-facing contract** of the bus: an append-only, ordered log per stream with consumer
 * groups, per-group delivery cursors and a pending entries ledger.
 *
 * The primary implementation targets **Redis Streams**; an in-memory implementation with the same
 * semantics backs tests and local runs.
 *
 * ROLE IN ARCHITECTURE
 * --------------------
 *
 *   [ Publisher ]   [ Registrar ]   [ Subscriber loop / Ack tracker ]
 *          │              │                      │
 *          ▼              ▼                      ▼
 *   [ LogStore ]  ← YOU ARE HERE
 *          │
 *          ▼
 *   [ Redis / memory ]
 *
 * ATOMICITY
 * ---------
 * Implementations MUST serialize:
 *  - identifier assignment on append
 *  - assignment of new entries to exactly one consumer of a group
 *  - claim and owner-checked acknowledgement
 *
 * The bus relies on these guarantees and holds no locks of its own.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Unreachable store → {@link com.podcast.bus.core.error.StoreUnavailableException}
 *   (the command was not executed)
 * - Missing group on read → {@link IllegalStateException}
 * - Anything else propagates as-is
 */
public interface LogStore {

    /**
     * Appends one entry, creating the stream if needed.
     *
     * @return the identifier assigned to the entry
     */
    Mono<EntryId> append(String stream, byte[] payload);

    /**
     * Creates a consumer group anchored at {@code start}, creating the stream if needed.
     *
     * @return {@code true} if the group was created, {@code false} if it already existed
     */
    Mono<Boolean> createGroup(String stream, String group, StartPosition start);

    /**
     * Re-delivers entries already pending for {@code consumer} whose id is greater than {@code after},
     * in ascending id order. Each returned entry has its delivery count incremented and its delivery
     * time refreshed.
     */
    Flux<Delivery> readPending(String stream, String group, String consumer, EntryId after, int count);

    /**
     * Assigns up to {@code count} never-delivered entries of the group to {@code consumer}, in ascending
     * id order. When none are available, waits up to {@code block} for an append before returning empty.
     */
    Flux<Delivery> readNew(String stream, String group, String consumer, int count, Duration block);

    /**
     * Removes the entry from the group's ledger regardless of owner.
     *
     * @return {@code true} if it was pending
     */
    Mono<Boolean> acknowledge(String stream, String group, EntryId id);

    /**
     * Removes the entry from the group's ledger only if {@code consumer} owns it.
     */
    Mono<AckOutcome> acknowledgeOwned(String stream, String group, String consumer, EntryId id);

    /**
     * Lists up to {@code count} pending entries of the group, lowest id first.
     */
    default Flux<PendingEntry> pending(String stream, String group, int count) {
        return pending(stream, group, EntryId.MIN, count);
    }

    /**
     * Lists up to {@code count} pending entries of the group whose id is greater than {@code after},
     * lowest id first. Pass the last id of one page to read the next.
     */
    Flux<PendingEntry> pending(String stream, String group, EntryId after, int count);

    /**
     * Looks up a single ledger row; empty when the entry is not pending.
     */
    Mono<PendingEntry> pendingEntry(String stream, String group, EntryId id);

    /**
     * Reassigns the given pending entries to {@code consumer}, but only those idle for at least
     * {@code minIdle}. Claimed entries have their delivery count incremented.
     *
     * @return the entries actually claimed
     */
    Flux<Delivery> claim(String stream, String group, String consumer, Duration minIdle, List<EntryId> ids);

    /**
     * Lists the consumer groups of a stream.
     */
    Flux<GroupInfo> groups(String stream);

    /**
     * Number of entries in the stream; zero when it does not exist.
     */
    Mono<Long> length(String stream);
}
