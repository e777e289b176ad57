package com.podcast.bus.core.ack;

import com.podcast.bus.core.error.ExceededRetryException;

/**
 * Receives entries that used up their delivery budget.
 *
 * <p>Reporting never removes the entry. It stays pending in the group ledger until an operator
 * acknowledges it.</p>
 */
@FunctionalInterface
public interface DeadLetterReporter {

    void report(ExceededRetryException exceeded);
}
