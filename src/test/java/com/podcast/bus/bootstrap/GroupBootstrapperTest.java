package com.podcast.bus.bootstrap;

import com.podcast.bus.config.EventBusProperties;
import com.podcast.bus.core.error.StoreUnavailableException;
import com.podcast.bus.core.group.ConsumerGroupRegistrar;
import com.podcast.bus.core.model.GroupInfo;
import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.store.InMemoryLogStore;
import com.podcast.bus.core.store.StoreRetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GroupBootstrapperTest {

    private InMemoryLogStore store;
    private EventBusProperties props;
    private ObjectProvider<SubscriptionDefinition> definitions;
    private ApplicationEventPublisher events;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        store = new InMemoryLogStore();
        props = new EventBusProperties();
        definitions = mock(ObjectProvider.class);
        when(definitions.orderedStream()).thenAnswer(inv -> Stream.empty());
        events = mock(ApplicationEventPublisher.class);
    }

    @Test
    void shouldRegisterConfiguredGroupsAndAnnounceCompletion() {
        props.setSubscriptions(List.of(
                spec("episodes:transcribed", "summarizer_group", "beginning"),
                spec("episodes:summarized", "rag_group", "new")));

        bootstrapper(new ConsumerGroupRegistrar(store, StoreRetryPolicy.none())).run(new DefaultApplicationArguments());

        assertThat(store.groups("episodes:transcribed").map(GroupInfo::name).collectList().block())
                .containsExactly("summarizer_group");
        assertThat(store.groups("episodes:summarized").map(GroupInfo::name).collectList().block())
                .containsExactly("rag_group");
        verify(events).publishEvent(any(BusBootstrapCompleteEvent.class));
    }

    @Test
    void shouldMergeDefinitionBeansAndKeepFirstStartPosition() {
        props.setSubscriptions(List.of(spec("episodes:transcribed", "summarizer_group", "new")));
        when(definitions.orderedStream()).thenAnswer(inv -> Stream.of(
                new SubscriptionDefinition("episodes:transcribed", "summarizer_group", StartPosition.BEGINNING, d -> Mono.empty()),
                new SubscriptionDefinition("episodes:ingested", "audit_group", null, d -> Mono.empty())));

        Map<String, GroupBootstrapper.GroupSpec> specs =
                bootstrapper(new ConsumerGroupRegistrar(store, StoreRetryPolicy.none())).collect();

        assertThat(specs).containsOnlyKeys("episodes:transcribed|summarizer_group", "episodes:ingested|audit_group");
        assertThat(specs.get("episodes:transcribed|summarizer_group").start()).isEqualTo(StartPosition.NEW_ONLY);
        assertThat(specs.get("episodes:ingested|audit_group").start()).isEqualTo(StartPosition.BEGINNING);
    }

    @Test
    void shouldFailStartupWhenStoreIsDownAndFailFast() {
        props.setSubscriptions(List.of(spec("episodes:transcribed", "summarizer_group", "beginning")));
        ConsumerGroupRegistrar registrar = mock(ConsumerGroupRegistrar.class);
        when(registrar.ensureGroup(anyString(), anyString(), any()))
                .thenReturn(Mono.error(new StoreUnavailableException("connection refused", null)));

        assertThatThrownBy(() -> bootstrapper(registrar).run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("summarizer_group")
                .hasCauseInstanceOf(StoreUnavailableException.class);
        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void shouldContinueWithRemainingGroupsWhenNotFailFast() {
        props.getBootstrap().setFailFast(false);
        props.setSubscriptions(List.of(
                spec("episodes:transcribed", "summarizer_group", "beginning"),
                spec("episodes:summarized", "rag_group", "beginning")));
        ConsumerGroupRegistrar registrar = mock(ConsumerGroupRegistrar.class);
        when(registrar.ensureGroup(eq("episodes:transcribed"), anyString(), any()))
                .thenReturn(Mono.error(new StoreUnavailableException("connection refused", null)));
        when(registrar.ensureGroup(eq("episodes:summarized"), anyString(), any())).thenReturn(Mono.just(true));

        bootstrapper(registrar).run(new DefaultApplicationArguments());

        verify(registrar).ensureGroup("episodes:summarized", "rag_group", StartPosition.BEGINNING);
        verify(events).publishEvent(any(BusBootstrapCompleteEvent.class));
    }

    @Test
    void shouldRejectSubscriptionWithoutGroup() {
        props.setSubscriptions(List.of(spec("episodes:transcribed", " ", "beginning")));

        assertThatThrownBy(() -> bootstrapper(new ConsumerGroupRegistrar(store, StoreRetryPolicy.none())).collect())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("group");
    }

    private GroupBootstrapper bootstrapper(ConsumerGroupRegistrar registrar) {
        return new GroupBootstrapper(registrar, props, definitions, events);
    }

    private static EventBusProperties.SubscriptionSpec spec(String stream, String group, String start) {
        EventBusProperties.SubscriptionSpec s = new EventBusProperties.SubscriptionSpec();
        s.setStream(stream);
        s.setGroup(group);
        s.setStartPosition(start);
        return s;
    }
}
