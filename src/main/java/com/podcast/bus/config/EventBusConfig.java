package com.podcast.bus.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.podcast.bus.core.ack.AcknowledgementTracker;
import com.podcast.bus.core.ack.DeadLetterReporter;
import com.podcast.bus.core.ack.LoggingDeadLetterReporter;
import com.podcast.bus.core.event.EventCodec;
import com.podcast.bus.core.event.EventStreams;
import com.podcast.bus.core.group.ConsumerGroupRegistrar;
import com.podcast.bus.core.publisher.EventPublisher;
import com.podcast.bus.core.publisher.StreamEventPublisher;
import com.podcast.bus.core.store.InMemoryLogStore;
import com.podcast.bus.core.store.LogStore;
import com.podcast.bus.core.store.StoreRetryPolicy;
import com.podcast.bus.core.subscriber.SubscriberLoop;
import com.podcast.bus.core.subscriber.SubscriberSettings;
import com.podcast.bus.redis.RedisIdempotencyGuard;
import com.podcast.bus.redis.RedisStreamLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Spring wiring of the event bus.
 *
 * <h2>Store selection</h2>
 * <ul>
 *   <li>{@code eventbus.store=redis} (default): {@link RedisStreamLogStore} on the Boot-managed
 *       Lettuce connection factory.</li>
 *   <li>{@code eventbus.store=memory}: {@link InMemoryLogStore}, single process only.</li>
 * </ul>
 *
 * Every other bean is store-agnostic.
 */
@Configuration
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusConfig {

    private static final Logger log = LoggerFactory.getLogger(EventBusConfig.class);

    // ---------------------------------------------------------------------
    // Log store
    // ---------------------------------------------------------------------

    /**
     * String keys and field names, raw byte values. Payloads are never re-encoded by Redis serializers.
     */
    @Bean
    @ConditionalOnProperty(prefix = "eventbus", name = "store", havingValue = "redis", matchIfMissing = true)
    public ReactiveRedisTemplate<String, byte[]> eventBusBytesTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
                .<String, byte[]>newSerializationContext(RedisSerializer.string())
                .key(RedisSerializer.string())
                .value(RedisSerializer.byteArray())
                .hashKey(RedisSerializer.string())
                .hashValue(RedisSerializer.byteArray())
                .build();
        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventbus", name = "store", havingValue = "redis", matchIfMissing = true)
    public LogStore redisStreamLogStore(ReactiveRedisTemplate<String, byte[]> eventBusBytesTemplate,
                                        ReactiveStringRedisTemplate stringTemplate) {
        log.info("Event bus log store: Redis Streams");
        return new RedisStreamLogStore(eventBusBytesTemplate, stringTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventbus", name = "store", havingValue = "memory")
    public LogStore inMemoryLogStore() {
        log.warn("Event bus log store: in-memory. Nothing survives a restart and nothing is shared between processes.");
        return new InMemoryLogStore();
    }

    // ---------------------------------------------------------------------
    // Core
    // ---------------------------------------------------------------------

    @Bean
    public StoreRetryPolicy storeRetryPolicy(EventBusProperties props) {
        EventBusProperties.StoreRetry r = props.getStoreRetry();
        return new StoreRetryPolicy(r.getMaxAttempts(), r.getMinBackoff(), r.getMaxBackoff());
    }

    @Bean
    public EventStreams eventStreams(EventBusProperties props) {
        EventBusProperties.Streams s = props.getStreams();
        return new EventStreams(s.getTranscribed(), s.getSummarized(), s.getIngested());
    }

    @Bean
    public EventCodec eventCodec(ObjectMapper objectMapper) {
        return new EventCodec(objectMapper);
    }

    @Bean
    public EventPublisher eventPublisher(LogStore store, EventCodec codec, EventStreams streams, StoreRetryPolicy retryPolicy) {
        return new StreamEventPublisher(store, codec, streams, retryPolicy);
    }

    @Bean
    public ConsumerGroupRegistrar consumerGroupRegistrar(LogStore store, StoreRetryPolicy retryPolicy) {
        return new ConsumerGroupRegistrar(store, retryPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterReporter deadLetterReporter(ApplicationEventPublisher events) {
        return new LoggingDeadLetterReporter(events);
    }

    @Bean
    public AcknowledgementTracker acknowledgementTracker(LogStore store, DeadLetterReporter reporter, EventBusProperties props) {
        EventBusProperties.Consumer c = props.getConsumer();
        return new AcknowledgementTracker(store, reporter, c.getVisibilityTimeout(), c.getMaxDeliveries());
    }

    @Bean
    public SubscriberSettings subscriberSettings(EventBusProperties props, StoreRetryPolicy retryPolicy) {
        EventBusProperties.Consumer c = props.getConsumer();
        return new SubscriberSettings(c.getBatchSize(), c.getPollTimeout(), c.getReclaimInterval(), c.getReclaimLimit(), retryPolicy);
    }

    @Bean
    public SubscriberLoop subscriberLoop(LogStore store, AcknowledgementTracker tracker, SubscriberSettings settings) {
        return new SubscriberLoop(store, tracker, settings);
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventbus.idempotency", name = "enabled", havingValue = "true")
    public RedisIdempotencyGuard redisIdempotencyGuard(ReactiveStringRedisTemplate stringTemplate, EventCodec codec,
                                                       EventBusProperties props) {
        return new RedisIdempotencyGuard(stringTemplate, codec, props.getIdempotency().getTtl());
    }
}
