package com.podcast.bus.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON encoding of {@link EpisodeEvent} payloads, shared by publishers and handlers.
 *
 * <p>Uses the application {@link ObjectMapper} so that {@code java.time} values are written as ISO-8601
 * strings.</p>
 */
public class EventCodec {

    private final ObjectMapper mapper;

    public EventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(EpisodeEvent event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode event " + event.eventId() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException when the payload is not a known episode event
     */
    public EpisodeEvent decode(byte[] payload) {
        try {
            return mapper.readValue(payload, EpisodeEvent.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Payload is not a valid episode event: " + e.getMessage(), e);
        }
    }
}
