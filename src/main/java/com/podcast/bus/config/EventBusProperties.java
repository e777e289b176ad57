package com.podcast.bus.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * =====================================================================
 * EventBusProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Single source of truth for the event bus of one service instance:
 *  - which log store backs the bus
 *  - who this instance is (service + node → consumer name)
 *  - stream names, consumer tuning and store retry policy
 *  - which consumer groups to register at startup
 *
 * BINDING
 * -------
 * <pre>
 * eventbus:
 *   store: redis                 # redis | memory
 *   service: summarizer
 *   node-id: node01
 *   identity-mode: fixed         # fixed | ephemeral
 *   consumer:
 *     batch-size: 10
 *     poll-timeout: 2s
 *     visibility-timeout: 5m
 *     max-deliveries: 5
 *     reclaim-interval: 1m
 *   store-retry:
 *     max-attempts: 10
 *     min-backoff: 1s
 *     max-backoff: 60s
 *   subscriptions:
 *     - stream: episodes:transcribed
 *       group: summarizer_group
 *       start-position: beginning
 * </pre>
 *
 * The Redis connection itself comes from Spring Boot's {@code spring.data.redis.*}.
 */
@ConfigurationProperties(prefix = "eventbus")
public class EventBusProperties {

    public enum IdentityMode {
        /** {@code <service>_<node>}: stable across restarts, resumes its own pending entries. */
        FIXED,
        /** {@code <service>_<node>_<random>}: new identity per start; relies on reclaim for leftovers. */
        EPHEMERAL
    }

    /** {@code redis} (default) or {@code memory}. */
    private String store = "redis";

    private String service = "worker";

    private String nodeId = "node01";

    private IdentityMode identityMode = IdentityMode.FIXED;

    /** Explicit consumer name. Overrides service/node derivation when set. */
    private String consumerName;

    private Streams streams = new Streams();
    private Consumer consumer = new Consumer();
    private StoreRetry storeRetry = new StoreRetry();
    private Bootstrap bootstrap = new Bootstrap();
    private Idempotency idempotency = new Idempotency();

    /** Groups to register at startup, in addition to subscription beans. */
    private List<SubscriptionSpec> subscriptions = new ArrayList<>();

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }

    public String getService() { return service; }
    public void setService(String service) { this.service = service; }

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public IdentityMode getIdentityMode() { return identityMode; }
    public void setIdentityMode(IdentityMode identityMode) { this.identityMode = identityMode; }

    public String getConsumerName() { return consumerName; }
    public void setConsumerName(String consumerName) { this.consumerName = consumerName; }

    public Streams getStreams() { return streams; }
    public void setStreams(Streams streams) { this.streams = streams; }

    public Consumer getConsumer() { return consumer; }
    public void setConsumer(Consumer consumer) { this.consumer = consumer; }

    public StoreRetry getStoreRetry() { return storeRetry; }
    public void setStoreRetry(StoreRetry storeRetry) { this.storeRetry = storeRetry; }

    public Bootstrap getBootstrap() { return bootstrap; }
    public void setBootstrap(Bootstrap bootstrap) { this.bootstrap = bootstrap; }

    public Idempotency getIdempotency() { return idempotency; }
    public void setIdempotency(Idempotency idempotency) { this.idempotency = idempotency; }

    public List<SubscriptionSpec> getSubscriptions() { return subscriptions; }
    public void setSubscriptions(List<SubscriptionSpec> subscriptions) { this.subscriptions = subscriptions; }

    // ---------------------------------------------------------------------
    // Nested sections
    // ---------------------------------------------------------------------

    public static class Streams {
        private String transcribed = "episodes:transcribed";
        private String summarized = "episodes:summarized";
        private String ingested = "episodes:ingested";

        public String getTranscribed() { return transcribed; }
        public void setTranscribed(String transcribed) { this.transcribed = transcribed; }

        public String getSummarized() { return summarized; }
        public void setSummarized(String summarized) { this.summarized = summarized; }

        public String getIngested() { return ingested; }
        public void setIngested(String ingested) { this.ingested = ingested; }
    }

    public static class Consumer {
        /** Starts subscriber loops for subscription beans. */
        private boolean enabled = true;
        private int batchSize = 10;
        /** Bound on one live read. Must be positive. */
        private Duration pollTimeout = Duration.ofSeconds(2);
        /** Idle time after which another consumer may claim a pending entry. */
        private Duration visibilityTimeout = Duration.ofMinutes(5);
        private int maxDeliveries = 5;
        /** Sweep period for idle entries; 0 disables. */
        private Duration reclaimInterval = Duration.ofMinutes(1);
        private int reclaimLimit = 100;
        /** Grace period for a cooperative stop on shutdown. */
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public Duration getPollTimeout() { return pollTimeout; }
        public void setPollTimeout(Duration pollTimeout) { this.pollTimeout = pollTimeout; }

        public Duration getVisibilityTimeout() { return visibilityTimeout; }
        public void setVisibilityTimeout(Duration visibilityTimeout) { this.visibilityTimeout = visibilityTimeout; }

        public int getMaxDeliveries() { return maxDeliveries; }
        public void setMaxDeliveries(int maxDeliveries) { this.maxDeliveries = maxDeliveries; }

        public Duration getReclaimInterval() { return reclaimInterval; }
        public void setReclaimInterval(Duration reclaimInterval) { this.reclaimInterval = reclaimInterval; }

        public int getReclaimLimit() { return reclaimLimit; }
        public void setReclaimLimit(int reclaimLimit) { this.reclaimLimit = reclaimLimit; }

        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    }

    public static class StoreRetry {
        private long maxAttempts = 10;
        private Duration minBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);

        public long getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(long maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getMinBackoff() { return minBackoff; }
        public void setMinBackoff(Duration minBackoff) { this.minBackoff = minBackoff; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    public static class Bootstrap {
        /** Registers consumer groups before any subscriber starts. */
        private boolean enabled = true;
        /** Startup fails when a group cannot be registered. */
        private boolean failFast = true;
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isFailFast() { return failFast; }
        public void setFailFast(boolean failFast) { this.failFast = failFast; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Idempotency {
        private boolean enabled = false;
        private Duration ttl = Duration.ofHours(24);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
    }

    public static class SubscriptionSpec {
        private String stream;
        private String group;
        /** {@code beginning} (default) or {@code new}. */
        private String startPosition = "beginning";

        public String getStream() { return stream; }
        public void setStream(String stream) { this.stream = stream; }

        public String getGroup() { return group; }
        public void setGroup(String group) { this.group = group; }

        public String getStartPosition() { return startPosition; }
        public void setStartPosition(String startPosition) { this.startPosition = startPosition; }
    }
}
