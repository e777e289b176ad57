package com.podcast.bus.bootstrap;

/**
 * =====================================================================
 * BusBootstrapCompleteEvent
 * =====================================================================
 *
 * Signals that every configured consumer group exists and subscriber loops may start.
 *
 *   ┌──────────────────────┐
 *   │ Group registration   │
 *   └─────────┬────────────┘
 *             │ publishes
 *             ▼
 *   ┌──────────────────────┐
 *   │ Subscribers start    │
 *   └──────────────────────┘
 *
 * A loop started before its group exists fails with NOGROUP, and a group created later with
 * "new only" would skip whatever was published in between. Publishers may ignore this event.
 *
 * No payload: presence means readiness.
 */
public record BusBootstrapCompleteEvent() {
}
