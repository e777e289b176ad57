package com.podcast.bus.core.ack;

import com.podcast.bus.core.error.ExceededRetryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default {@link DeadLetterReporter}: ERROR log plus an {@link EntryExceededRetriesEvent}.
 *
 * <p>The sweep and the live loop can both see the same exhausted entry. Reports are therefore
 * deduplicated on stream, group, entry id and delivery count. Only the most recent
 * {@code maxTracked} keys are remembered; an older entry reported again is logged again.</p>
 */
public class LoggingDeadLetterReporter implements DeadLetterReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterReporter.class);

    static final int DEFAULT_MAX_TRACKED = 10_000;

    private final ApplicationEventPublisher events;
    private final Map<String, Boolean> reported;

    public LoggingDeadLetterReporter(ApplicationEventPublisher events) {
        this(events, DEFAULT_MAX_TRACKED);
    }

    public LoggingDeadLetterReporter(ApplicationEventPublisher events, int maxTracked) {
        if (maxTracked < 1) {
            throw new IllegalArgumentException("maxTracked must be >= 1");
        }
        this.events = events;
        this.reported = Collections.synchronizedMap(new LinkedHashMap<String, Boolean>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > maxTracked;
            }
        });
    }

    @Override
    public void report(ExceededRetryException exceeded) {
        String key = exceeded.getStream() + "|" + exceeded.getGroup() + "|"
                + exceeded.getEntryId() + "|" + exceeded.getDeliveryCount();
        if (reported.putIfAbsent(key, Boolean.TRUE) != null) {
            return;
        }
        log.error("Entry exceeded retry budget; left pending for manual action. stream={} group={} id={} consumer={} deliveries={} max={}",
                exceeded.getStream(), exceeded.getGroup(), exceeded.getEntryId(), exceeded.getConsumer(),
                exceeded.getDeliveryCount(), exceeded.getMaxDeliveries());
        if (events != null) {
            events.publishEvent(new EntryExceededRetriesEvent(exceeded));
        }
    }

    int trackedCount() {
        return reported.size();
    }
}
