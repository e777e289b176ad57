package com.podcast.bus.core.model;

import java.util.Objects;

/**
 * An entry as delivered to one consumer of a group.
 *
 * @param entry         the stream entry
 * @param group         consumer group the delivery belongs to
 * @param consumer      consumer that currently owns the entry in the group's pending ledger
 * @param deliveryCount how many times the entry has been delivered in this group, including this one
 */
public record Delivery(StreamEntry entry, String group, String consumer, long deliveryCount) {

    public Delivery {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(consumer, "consumer");
    }

    public String stream() {
        return entry.stream();
    }

    public EntryId id() {
        return entry.id();
    }
}
