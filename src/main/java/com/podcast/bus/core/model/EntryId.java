package com.podcast.bus.core.model;

import java.util.Objects;

/**
 * Identifier of a single entry within a stream.
 *
 * <h2>Format</h2>
 * <pre>
 * &lt;millis&gt;-&lt;sequence&gt;
 * </pre>
 * This is the identifier format of Redis Streams; the in-memory store produces the same shape so that
 * logs and admin responses read identically regardless of backend.
 *
 * <h2>Ordering</h2>
 * Identifiers are compared by {@code millis} first, then {@code sequence}. Within one stream they are
 * strictly increasing in append order.
 */
public record EntryId(long millis, long sequence) implements Comparable<EntryId> {

    /** The smallest possible identifier; reading "after MIN" starts at the first entry. */
    public static final EntryId MIN = new EntryId(0, 0);

    public EntryId {
        if (millis < 0 || sequence < 0) {
            throw new IllegalArgumentException("EntryId parts must be non-negative: " + millis + "-" + sequence);
        }
    }

    /**
     * Parses {@code "1700000000000-0"}. A bare number is accepted as {@code <millis>-0}.
     *
     * @throws IllegalArgumentException when the value is not a valid identifier
     */
    public static EntryId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("entry id is required");
        }
        String s = value.trim();
        int dash = s.indexOf('-');
        try {
            if (dash < 0) {
                return new EntryId(Long.parseLong(s), 0);
            }
            return new EntryId(Long.parseLong(s.substring(0, dash)), Long.parseLong(s.substring(dash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid entry id: " + value, e);
        }
    }

    /**
     * Next identifier to assign after {@code last}, given the current wall clock.
     * Falls back to incrementing the sequence when the clock has not moved forward (or moved back).
     */
    public static EntryId nextAfter(EntryId last, long nowMillis) {
        Objects.requireNonNull(last, "last");
        if (nowMillis > last.millis) {
            return new EntryId(nowMillis, 0);
        }
        return new EntryId(last.millis, last.sequence + 1);
    }

    /**
     * Smallest identifier greater than this one, for inclusive range starts.
     */
    public EntryId successor() {
        return new EntryId(millis, sequence + 1);
    }

    public boolean isAfter(EntryId other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(EntryId o) {
        int c = Long.compare(millis, o.millis);
        return c != 0 ? c : Long.compare(sequence, o.sequence);
    }

    @Override
    public String toString() {
        return millis + "-" + sequence;
    }
}
