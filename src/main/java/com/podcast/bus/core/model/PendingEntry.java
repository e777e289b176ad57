package com.podcast.bus.core.model;

import java.time.Duration;

/**
 * A row of a consumer group's pending entries ledger: delivered, not yet acknowledged.
 *
 * @param id            entry identifier
 * @param consumer      current owner
 * @param deliveryCount total deliveries in this group
 * @param idle          time since the last delivery (or claim)
 */
public record PendingEntry(EntryId id, String consumer, long deliveryCount, Duration idle) {

    /** True once the entry has gone unacknowledged for longer than {@code visibilityTimeout}. */
    public boolean isIdleLongerThan(Duration visibilityTimeout) {
        return idle.compareTo(visibilityTimeout) > 0;
    }
}
