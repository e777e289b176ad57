package com.podcast.bus.redis;

import com.podcast.bus.core.event.EpisodeEvent;
import com.podcast.bus.core.event.EventCodec;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.subscriber.EntryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Consumer-side duplicate suppression keyed on {@link EpisodeEvent#eventId()}.
 *
 * <p>Key pattern: {@code idempotency:<group>:<eventId>}. The key is written with {@code SET NX EX} only
 * after the wrapped handler succeeded, so a failed attempt never hides the event from its retry.</p>
 *
 * <p>Fails open: if Redis cannot answer the lookup, the event is processed. Processing twice is
 * preferred over not processing.</p>
 */
public class RedisIdempotencyGuard {

    private static final Logger log = LoggerFactory.getLogger(RedisIdempotencyGuard.class);

    static final String KEY_PREFIX = "idempotency:";

    private final ReactiveStringRedisTemplate redis;
    private final EventCodec codec;
    private final Duration ttl;
    private final Clock clock;

    public RedisIdempotencyGuard(ReactiveStringRedisTemplate redis, EventCodec codec, Duration ttl) {
        this(redis, codec, ttl, Clock.systemUTC());
    }

    RedisIdempotencyGuard(ReactiveStringRedisTemplate redis, EventCodec codec, Duration ttl, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        this.redis = redis;
        this.codec = codec;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Wraps {@code delegate} so that an already processed event completes without calling it.
     * Payloads that are not episode events go straight to the delegate.
     */
    public EntryHandler guard(String group, EntryHandler delegate) {
        return delivery -> eventIdOf(delivery)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(eventId -> eventId.isPresent()
                        ? handleOnce(group, eventId.get(), delivery, delegate)
                        : delegate.handle(delivery));
    }

    public Mono<Boolean> isProcessed(String group, String eventId) {
        return redis.hasKey(key(group, eventId))
                .defaultIfEmpty(Boolean.FALSE)
                .onErrorResume(e -> {
                    log.error("Redis error during idempotency check, treating as not processed. group={} eventId={} err={}",
                            group, eventId, e.toString());
                    return Mono.just(Boolean.FALSE);
                });
    }

    /**
     * @return {@code true} if this call wrote the marker
     */
    public Mono<Boolean> markProcessed(String group, String eventId) {
        return redis.opsForValue()
                .setIfAbsent(key(group, eventId), clock.instant().toString(), ttl)
                .defaultIfEmpty(Boolean.FALSE)
                .doOnNext(set -> log.debug("Marked processed group={} eventId={} new={}", group, eventId, set))
                .onErrorResume(e -> {
                    log.warn("Could not mark event processed; a redelivery will run it again. group={} eventId={} err={}",
                            group, eventId, e.toString());
                    return Mono.just(Boolean.FALSE);
                });
    }

    static String key(String group, String eventId) {
        return KEY_PREFIX + group + ":" + eventId;
    }

    private Mono<Void> handleOnce(String group, String eventId, Delivery delivery, EntryHandler delegate) {
        return isProcessed(group, eventId)
                .flatMap(seen -> {
                    if (seen) {
                        log.info("Skipping duplicate event eventId={} group={} entryId={}", eventId, group, delivery.id());
                        return Mono.<Void>empty();
                    }
                    return delegate.handle(delivery)
                            .then(markProcessed(group, eventId))
                            .then();
                });
    }

    private Mono<String> eventIdOf(Delivery delivery) {
        return Mono.fromCallable(() -> codec.decode(delivery.entry().payload()).eventId())
                .onErrorResume(IllegalArgumentException.class, e -> {
                    log.debug("Payload is not an episode event; no idempotency check. entryId={}", delivery.id());
                    return Mono.empty();
                });
    }
}
