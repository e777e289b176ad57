package com.podcast.bus.bootstrap;

import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.subscriber.EntryHandler;

import java.util.Objects;

/**
 * Declares one consumer of a group, contributed by the application as a bean.
 *
 * <pre>
 * &#64;Bean
 * SubscriptionDefinition summarizeTranscripts(EventCodec codec, Summarizer summarizer) {
 *     return new SubscriptionDefinition("episodes:transcribed", "summarizer_group", StartPosition.BEGINNING,
 *             EntryHandler.decoding(codec, summarizer::summarize));
 * }
 * </pre>
 *
 * The group is registered at startup; the handler runs in a {@link com.podcast.bus.core.subscriber.SubscriberLoop}
 * under this instance's consumer name.
 */
public record SubscriptionDefinition(String stream, String group, StartPosition startPosition, EntryHandler handler) {

    public SubscriptionDefinition {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream is required");
        }
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group is required");
        }
        Objects.requireNonNull(handler, "handler");
        if (startPosition == null) {
            startPosition = StartPosition.BEGINNING;
        }
    }
}
