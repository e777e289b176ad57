package com.podcast.bus.core.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * =====================================================================
 * EpisodeEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Producer/consumer contract for the payloads carried on the episode streams. The bus itself never
 * looks inside a payload; this type exists so that publishers and handlers agree on one encoding.
 *
 * WIRE FORMAT
 * -----------
 * JSON, discriminated by a {@code type} property:
 * <pre>
 * {"type":"transcribed","eventId":"evt_123","timestamp":"2025-12-10T12:00:00Z",
 *  "service":"transcription","episodeId":"ep_456","filePaths":["/shared/transcripts/ep_456.txt"], ...}
 * </pre>
 *
 * IDEMPOTENCY
 * -----------
 * {@link #eventId()} is assigned by the producer and is the key consumers use for their own dedup
 * checks. Delivery is at-least-once.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EpisodeTranscribed.class, name = EpisodeTranscribed.TYPE),
        @JsonSubTypes.Type(value = EpisodeSummarized.class, name = EpisodeSummarized.TYPE),
        @JsonSubTypes.Type(value = EpisodeIngested.class, name = EpisodeIngested.TYPE)
})
public interface EpisodeEvent {

    /** Producer-assigned idempotency key. */
    String eventId();

    Instant timestamp();

    /** Name of the producing service, e.g. {@code transcription}. */
    String service();

    /** Subject of the event. */
    String episodeId();

    /** File references interpreted by consumers; may be empty, never null after decoding. */
    List<String> filePaths();
}
