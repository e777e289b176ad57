package com.podcast.bus.bootstrap;

import com.podcast.bus.config.EventBusProperties;
import com.podcast.bus.core.group.ConsumerGroupRegistrar;
import com.podcast.bus.core.model.StartPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * =====================================================================
 * GroupBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Registers every consumer group this instance needs before any subscriber loop starts.
 *
 * Sources, merged and deduplicated on (stream, group):
 *  - {@code eventbus.subscriptions} entries
 *  - {@link SubscriptionDefinition} beans
 *
 * WHEN THIS RUNS
 * --------------
 * Once, as an {@link ApplicationRunner}: after the context is up, before {@code ApplicationReadyEvent}.
 *
 * FAILURE MODEL
 * -------------
 * - {@code fail-fast=true} (default): a group that cannot be registered fails startup
 * - {@code fail-fast=false}: logged, the remaining groups are still attempted
 *
 * Publishes {@link BusBootstrapCompleteEvent} when done.
 */
@Component
@ConditionalOnProperty(prefix = "eventbus.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GroupBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(GroupBootstrapper.class);

    private final ConsumerGroupRegistrar registrar;
    private final EventBusProperties props;
    private final ObjectProvider<SubscriptionDefinition> definitions;
    private final ApplicationEventPublisher publisher;

    public GroupBootstrapper(ConsumerGroupRegistrar registrar,
                             EventBusProperties props,
                             ObjectProvider<SubscriptionDefinition> definitions,
                             ApplicationEventPublisher publisher) {
        this.registrar = registrar;
        this.props = props;
        this.definitions = definitions;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) {
        Map<String, GroupSpec> specs = collect();
        log.info("Event bus bootstrap: registering {} consumer groups", specs.size());

        for (GroupSpec spec : specs.values()) {
            ensure(spec);
        }

        publisher.publishEvent(new BusBootstrapCompleteEvent());
        log.info("Event bus bootstrap complete (published BusBootstrapCompleteEvent)");
    }

    Map<String, GroupSpec> collect() {
        Map<String, GroupSpec> specs = new LinkedHashMap<>();
        for (EventBusProperties.SubscriptionSpec s : props.getSubscriptions()) {
            GroupSpec spec = new GroupSpec(require(s.getStream(), "subscriptions[].stream"),
                    require(s.getGroup(), "subscriptions[].group"),
                    StartPosition.parse(s.getStartPosition()));
            specs.putIfAbsent(spec.key(), spec);
        }
        List<SubscriptionDefinition> beans = definitions.orderedStream().collect(Collectors.toList());
        for (SubscriptionDefinition d : beans) {
            GroupSpec spec = new GroupSpec(d.stream(), d.group(), d.startPosition());
            GroupSpec previous = specs.putIfAbsent(spec.key(), spec);
            if (previous != null && previous.start() != spec.start()) {
                log.warn("Conflicting start positions for stream={} group={}: using {} (ignoring {})",
                        spec.stream(), spec.group(), previous.start(), spec.start());
            }
        }
        return specs;
    }

    private void ensure(GroupSpec spec) {
        try {
            registrar.ensureGroup(spec.stream(), spec.group(), spec.start())
                    .block(props.getBootstrap().getTimeout());
        } catch (RuntimeException e) {
            String msg = "Could not register consumer group stream=" + spec.stream() + " group=" + spec.group();
            if (props.getBootstrap().isFailFast()) {
                throw new IllegalStateException(msg, e);
            }
            log.warn("{}; continuing. err={}", msg, e.toString());
        }
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }

    record GroupSpec(String stream, String group, StartPosition start) {
        String key() {
            return stream + "|" + group;
        }
    }
}
