package com.podcast.bus.bootstrap;

import com.podcast.bus.config.ConsumerName;
import com.podcast.bus.config.EventBusProperties;
import com.podcast.bus.core.subscriber.EntryHandler;
import com.podcast.bus.core.subscriber.SubscriberLoop;
import com.podcast.bus.core.subscriber.Subscription;
import com.podcast.bus.redis.RedisIdempotencyGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts one {@link SubscriberLoop} per {@link SubscriptionDefinition} bean and stops them on shutdown.
 *
 * <h2>Operational behavior</h2>
 * <ul>
 *   <li>Starts after group registration ({@link BusBootstrapCompleteEvent}) or, when bootstrapping is
 *       disabled, on {@link ApplicationReadyEvent}. Start is idempotent.</li>
 *   <li>All loops of this instance share one consumer name, resolved once at construction.</li>
 *   <li>Shutdown first requests a cooperative stop and waits up to {@code shutdown-timeout}; loops still
 *       running after that are disposed. Their unacknowledged entries stay pending.</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "eventbus.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SubscriberSupervisor implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SubscriberSupervisor.class);

    private final SubscriberLoop loop;
    private final ObjectProvider<SubscriptionDefinition> definitions;
    private final ObjectProvider<RedisIdempotencyGuard> idempotency;
    private final Duration shutdownTimeout;
    private final String consumerName;

    private final AtomicReference<List<Subscription>> running = new AtomicReference<>();

    public SubscriberSupervisor(SubscriberLoop loop,
                                ObjectProvider<SubscriptionDefinition> definitions,
                                ObjectProvider<RedisIdempotencyGuard> idempotency,
                                EventBusProperties props) {
        this.loop = loop;
        this.definitions = definitions;
        this.idempotency = idempotency;
        this.shutdownTimeout = props.getConsumer().getShutdownTimeout();
        this.consumerName = ConsumerName.resolve(props);
    }

    @EventListener(BusBootstrapCompleteEvent.class)
    public void onBootstrapComplete() {
        startIfNotStarted();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfNotStarted();
    }

    public String getConsumerName() {
        return consumerName;
    }

    public List<Subscription> getSubscriptions() {
        List<Subscription> subs = running.get();
        return subs == null ? List.of() : List.copyOf(subs);
    }

    synchronized void startIfNotStarted() {
        if (running.get() != null) {
            return;
        }
        RedisIdempotencyGuard guard = idempotency.getIfAvailable();
        List<Subscription> subs = new ArrayList<>();
        definitions.orderedStream().forEach(def -> {
            EntryHandler handler = guard == null ? def.handler() : guard.guard(def.group(), def.handler());
            subs.add(loop.subscribe(def.stream(), def.group(), consumerName, handler));
        });
        running.set(subs);
        log.info("Started {} subscriber loops as consumer={}", subs.size(), consumerName);
    }

    @Override
    public void destroy() {
        List<Subscription> subs = running.getAndSet(List.of());
        if (subs == null || subs.isEmpty()) {
            return;
        }
        log.info("Stopping {} subscriber loops (grace={})", subs.size(), shutdownTimeout);
        try {
            Flux.fromIterable(subs)
                    .flatMap(s -> s.stop().onErrorResume(e -> Mono.empty()))
                    .then()
                    .block(shutdownTimeout);
        } catch (RuntimeException e) {
            log.warn("Subscriber loops did not stop within {}; disposing. err={}", shutdownTimeout, e.toString());
        } finally {
            subs.forEach(Subscription::dispose);
        }
    }
}
