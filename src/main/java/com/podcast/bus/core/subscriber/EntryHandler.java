package com.podcast.bus.core.subscriber;

import com.podcast.bus.core.event.EpisodeEvent;
import com.podcast.bus.core.event.EventCodec;
import com.podcast.bus.core.model.Delivery;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Application callback for one delivered entry.
 *
 * <p>Completing normally means "processed": the subscriber loop then acknowledges the entry. An error
 * (signalled or thrown) leaves the entry pending for redelivery. Handlers must tolerate seeing the same
 * entry more than once.</p>
 */
@FunctionalInterface
public interface EntryHandler {

    Mono<Void> handle(Delivery delivery);

    /**
     * Adapts a synchronous handler. The body runs on {@code boundedElastic} with the delivery MDC set.
     */
    static EntryHandler blocking(Consumer<Delivery> body) {
        return delivery -> Mono.<Void>fromRunnable(() -> {
                    try (DeliveryMdc mdc = DeliveryMdc.of(delivery)) {
                        body.accept(delivery);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Decodes the payload as an {@link EpisodeEvent} before calling {@code body}. A payload that does not
     * decode fails the delivery like any other handler error.
     */
    static EntryHandler decoding(EventCodec codec, Function<EpisodeEvent, Mono<Void>> body) {
        return delivery -> Mono.fromCallable(() -> codec.decode(delivery.entry().payload()))
                .flatMap(body);
    }
}
