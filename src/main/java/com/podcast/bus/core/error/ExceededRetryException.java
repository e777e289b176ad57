package com.podcast.bus.core.error;

import com.podcast.bus.core.model.EntryId;

/**
 * An entry has used up the configured number of deliveries and will not be handed to a handler again.
 *
 * <p>Raised to the dead-letter reporting path, never thrown out of a subscriber loop. The entry itself
 * stays in the pending ledger so that it can be inspected and replayed by an operator.</p>
 */
public class ExceededRetryException extends EventBusException {

    private final String stream;
    private final String group;
    private final EntryId entryId;
    private final String consumer;
    private final long deliveryCount;
    private final int maxDeliveries;

    public ExceededRetryException(String stream, String group, EntryId entryId, String consumer,
                                  long deliveryCount, int maxDeliveries) {
        super("Entry " + entryId + " on " + stream + "/" + group + " exhausted its delivery budget (deliveries="
                + deliveryCount + ", max=" + maxDeliveries + "), owner=" + consumer);
        this.stream = stream;
        this.group = group;
        this.entryId = entryId;
        this.consumer = consumer;
        this.deliveryCount = deliveryCount;
        this.maxDeliveries = maxDeliveries;
    }

    public String getStream() { return stream; }
    public String getGroup() { return group; }
    public EntryId getEntryId() { return entryId; }
    public String getConsumer() { return consumer; }
    public long getDeliveryCount() { return deliveryCount; }
    public int getMaxDeliveries() { return maxDeliveries; }
}
