package com.podcast.bus.core.publisher;

import com.podcast.bus.core.event.EpisodeEvent;
import com.podcast.bus.core.model.EntryId;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * EventPublisher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Appends events to named streams. Transport-agnostic and test-friendly; the default implementation
 * writes through a {@link com.podcast.bus.core.store.LogStore}.
 *
 * SUCCESS MEANS
 * -------------
 * - the entry is durably stored
 * - it is visible to every consumer group of the stream
 * - it is ordered after every earlier successful publish from the same caller
 *
 * It does NOT mean any consumer received or acknowledged it.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - blank stream name → {@link IllegalArgumentException}
 * - anything else → {@link com.podcast.bus.core.error.PublishException}
 *
 * A failed publish is not retried once the write may have reached the store. Callers that retry should
 * keep the event's idempotency key so that consumers can deduplicate.
 */
public interface EventPublisher {

    /**
     * Appends an opaque payload.
     *
     * @return the identifier assigned by the store
     */
    Mono<EntryId> publish(String stream, byte[] payload);

    /**
     * Encodes the event and appends it to {@code stream}.
     */
    Mono<EntryId> publish(String stream, EpisodeEvent event);

    /**
     * Encodes the event and appends it to the stream configured for its type.
     */
    Mono<EntryId> publish(EpisodeEvent event);
}
