package com.podcast.bus.core.group;

import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.store.LogStore;
import com.podcast.bus.core.store.StoreRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Makes sure a consumer group exists before anyone consumes from it.
 *
 * <p>Idempotent: an existing group is left untouched, including its cursor. Must run before the first
 * subscriber loop of the group starts, otherwise entries published in between are never delivered to a
 * group created later with {@link StartPosition#NEW_ONLY}.</p>
 */
public class ConsumerGroupRegistrar {

    private static final Logger log = LoggerFactory.getLogger(ConsumerGroupRegistrar.class);

    private final LogStore store;
    private final StoreRetryPolicy retryPolicy;

    public ConsumerGroupRegistrar(LogStore store, StoreRetryPolicy retryPolicy) {
        this.store = store;
        this.retryPolicy = retryPolicy;
    }

    /**
     * @return {@code true} if the group was created by this call
     */
    public Mono<Boolean> ensureGroup(String stream, String group, StartPosition start) {
        if (stream == null || stream.isBlank()) {
            return Mono.error(new IllegalArgumentException("stream is required"));
        }
        if (group == null || group.isBlank()) {
            return Mono.error(new IllegalArgumentException("group is required"));
        }
        StartPosition position = start == null ? StartPosition.BEGINNING : start;
        return Mono.defer(() -> store.createGroup(stream, group, position))
                .retryWhen(retryPolicy.toRetrySpec(log, "ensureGroup " + stream + "/" + group))
                .doOnNext(created -> {
                    if (created) {
                        log.info("Created consumer group stream={} group={} start={}", stream, group, position);
                    } else {
                        log.info("Consumer group already exists stream={} group={}", stream, group);
                    }
                });
    }
}
