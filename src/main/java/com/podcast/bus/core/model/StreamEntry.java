package com.podcast.bus.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One immutable record of a stream as handed out by the log store.
 *
 * <p>The payload is opaque to the bus. Callers must not mutate the array they receive; the store keeps
 * its own copy.</p>
 */
public record StreamEntry(String stream, EntryId id, byte[] payload) {

    public StreamEntry {
        Objects.requireNonNull(stream, "stream");
        Objects.requireNonNull(id, "id");
        payload = payload == null ? new byte[0] : payload;
    }

    /** Payload decoded as UTF-8, for logging and JSON handlers. */
    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "StreamEntry[stream=" + stream + ", id=" + id + ", bytes=" + payload.length + "]";
    }
}
