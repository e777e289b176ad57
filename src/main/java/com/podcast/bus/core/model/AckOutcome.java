package com.podcast.bus.core.model;

/**
 * Result of an owner-checked acknowledgement.
 */
public enum AckOutcome {

    /** The entry was pending for the acknowledging consumer and has been removed from the ledger. */
    ACKNOWLEDGED,

    /** The entry is not in the group's ledger (already acknowledged, or never delivered). */
    NOT_PENDING,

    /** The entry is pending but owned by another consumer, typically after a claim. Nothing changed. */
    NOT_OWNER
}
