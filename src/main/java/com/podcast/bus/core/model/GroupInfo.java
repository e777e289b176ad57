package com.podcast.bus.core.model;

/**
 * Snapshot of a consumer group, used by the admin surface.
 */
public record GroupInfo(String name, long consumers, long pending, EntryId lastDeliveredId) {
}
