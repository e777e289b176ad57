package com.podcast.bus.core.model;

import java.util.Locale;

/**
 * Where a newly created consumer group anchors its delivery cursor.
 *
 * <p>Only relevant on creation: an existing group keeps its cursor.</p>
 */
public enum StartPosition {

    /** Deliver every entry already in the stream, then new ones. */
    BEGINNING,

    /** Deliver only entries appended after the group was created. */
    NEW_ONLY;

    /**
     * Parses operator input with a safe default.
     *
     * Default: BEGINNING (nothing already published is skipped)
     */
    public static StartPosition parse(String value) {
        if (value == null || value.isBlank()) {
            return BEGINNING;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "beginning", "begin", "earliest", "0" -> BEGINNING;
            case "new", "new-only", "new_only", "latest", "$" -> NEW_ONLY;
            default -> throw new IllegalArgumentException("Unsupported start position: " + value);
        };
    }
}
