package com.podcast.bus;

import com.podcast.bus.bootstrap.SubscriberSupervisor;
import com.podcast.bus.bootstrap.SubscriptionDefinition;
import com.podcast.bus.core.event.EpisodeEvent;
import com.podcast.bus.core.event.EpisodeTranscribed;
import com.podcast.bus.core.event.EventCodec;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.model.PendingEntry;
import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.publisher.EventPublisher;
import com.podcast.bus.core.store.LogStore;
import com.podcast.bus.core.subscriber.EntryHandler;
import com.podcast.bus.support.Eventually;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class EventBusApplicationTest {

    static final List<EpisodeEvent> RECEIVED = new CopyOnWriteArrayList<>();

    @TestConfiguration
    static class SummarizerSubscription {
        @Bean
        SubscriptionDefinition summarizerDefinition(EventCodec codec) {
            return new SubscriptionDefinition("episodes:transcribed", "summarizer_group", StartPosition.BEGINNING,
                    EntryHandler.decoding(codec, event -> Mono.fromRunnable(() -> RECEIVED.add(event))));
        }

        @Bean
        SubscriptionDefinition auditDefinition() {
            return new SubscriptionDefinition("episodes:transcribed", "audit_group", StartPosition.BEGINNING,
                    delivery -> Mono.error(new IllegalStateException("audit sink offline")));
        }
    }

    @Autowired
    private EventPublisher publisher;

    @Autowired
    private LogStore store;

    @Autowired
    private SubscriberSupervisor supervisor;

    @Autowired
    private WebTestClient client;

    @Test
    void shouldDeliverPublishedEventToRegisteredSubscriber() {
        EpisodeTranscribed event = EpisodeTranscribed.of("transcription", "ep_456", "Pilot", "Daily Tech",
                List.of("/shared/transcripts/ep_456.txt"));

        EntryId id = publisher.publish(event).block(Duration.ofSeconds(5));

        assertThat(id).isNotNull();
        Eventually.await(Duration.ofSeconds(5), () -> RECEIVED.contains(event));
        Eventually.await(Duration.ofSeconds(5),
                () -> store.pending("episodes:transcribed", "summarizer_group", 10).collectList().block().isEmpty());
        assertThat(supervisor.getConsumerName()).isEqualTo("test_node01");
    }

    @Test
    void shouldKeepEntryPendingInOtherGroupAfterOneGroupAcknowledges() {
        EpisodeTranscribed event = EpisodeTranscribed.of("transcription", "ep_789", "Second", "Daily Tech",
                List.of("/shared/transcripts/ep_789.txt"));

        EntryId id = publisher.publish(event).block(Duration.ofSeconds(5));

        Eventually.await(Duration.ofSeconds(5), () -> RECEIVED.contains(event));
        Eventually.await(Duration.ofSeconds(5),
                () -> store.pendingEntry("episodes:transcribed", "summarizer_group", id).block() == null);
        Eventually.await(Duration.ofSeconds(5),
                () -> store.pendingEntry("episodes:transcribed", "audit_group", id).block() != null);
        PendingEntry audit = store.pendingEntry("episodes:transcribed", "audit_group", id).block();
        assertThat(audit.consumer()).isEqualTo("test_node01");
        assertThat(audit.deliveryCount()).isEqualTo(1);
    }

    @Test
    void shouldExposeAdminEndpointsWhenEnabled() {
        client.get().uri("/admin/bus/streams/{stream}", "episodes:transcribed")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.groups[?(@.name == 'summarizer_group')]").exists()
                .jsonPath("$.groups[?(@.name == 'audit_group')]").exists();
    }
}
