package com.podcast.bus.core.publisher;

import com.podcast.bus.core.error.PublishException;
import com.podcast.bus.core.event.EpisodeEvent;
import com.podcast.bus.core.event.EventCodec;
import com.podcast.bus.core.event.EventStreams;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.store.LogStore;
import com.podcast.bus.core.store.StoreRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@link EventPublisher} that appends to a {@link LogStore}.
 *
 * <h2>Retry rule</h2>
 * <ul>
 *   <li>{@link com.podcast.bus.core.error.StoreUnavailableException} means the append never reached the
 *       store, so it is retried with the configured backoff.</li>
 *   <li>Any other failure (timeouts, rejected writes, quota) may have left an entry behind and is
 *       surfaced immediately as {@link PublishException}.</li>
 * </ul>
 *
 * <h2>Logging</h2>
 * Logs the assigned entry id for traceability.
 */
public class StreamEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(StreamEventPublisher.class);

    private final LogStore store;
    private final EventCodec codec;
    private final EventStreams streams;
    private final StoreRetryPolicy retryPolicy;

    public StreamEventPublisher(LogStore store, EventCodec codec, EventStreams streams, StoreRetryPolicy retryPolicy) {
        this.store = store;
        this.codec = codec;
        this.streams = streams;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Mono<EntryId> publish(String stream, byte[] payload) {
        if (stream == null || stream.isBlank()) {
            return Mono.error(new IllegalArgumentException("stream is required"));
        }
        byte[] body = payload == null ? new byte[0] : payload;
        return Mono.defer(() -> store.append(stream, body))
                .retryWhen(retryPolicy.toRetrySpec(log, "publish " + stream))
                .doOnNext(id -> log.info("Published entry stream={} id={} bytes={}", stream, id, body.length))
                .onErrorMap(e -> !(e instanceof PublishException), e -> new PublishException(stream, e));
    }

    @Override
    public Mono<EntryId> publish(String stream, EpisodeEvent event) {
        if (stream == null || stream.isBlank()) {
            return Mono.error(new IllegalArgumentException("stream is required"));
        }
        return Mono.fromCallable(() -> codec.encode(event))
                .onErrorMap(e -> new PublishException(stream, e))
                .flatMap(bytes -> publish(stream, bytes))
                .doOnNext(id -> log.debug("Published event eventId={} episodeId={} stream={} id={}",
                        event.eventId(), event.episodeId(), stream, id));
    }

    @Override
    public Mono<EntryId> publish(EpisodeEvent event) {
        return Mono.fromCallable(() -> streams.forEvent(event))
                .flatMap(stream -> publish(stream, event));
    }
}
