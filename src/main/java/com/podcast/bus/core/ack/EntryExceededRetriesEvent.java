package com.podcast.bus.core.ack;

import com.podcast.bus.core.error.ExceededRetryException;

/**
 * Spring application event raised once per exhausted entry and delivery count.
 */
public record EntryExceededRetriesEvent(ExceededRetryException exceeded) {
}
