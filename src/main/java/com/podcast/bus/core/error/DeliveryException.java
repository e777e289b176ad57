package com.podcast.bus.core.error;

import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;

/**
 * A handler failed to process a delivered entry.
 *
 * <p>Recovered locally: the entry is left in the pending ledger and becomes eligible for redelivery on
 * the next resumption phase or through a claim after the visibility timeout.</p>
 */
public class DeliveryException extends EventBusException {

    private final String stream;
    private final String group;
    private final EntryId entryId;
    private final long deliveryCount;

    public DeliveryException(Delivery delivery, Throwable cause) {
        super("Handler failed for entry " + delivery.id() + " on " + delivery.stream() + "/" + delivery.group()
                + " (delivery " + delivery.deliveryCount() + "): "
                + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.stream = delivery.stream();
        this.group = delivery.group();
        this.entryId = delivery.id();
        this.deliveryCount = delivery.deliveryCount();
    }

    public String getStream() { return stream; }
    public String getGroup() { return group; }
    public EntryId getEntryId() { return entryId; }
    public long getDeliveryCount() { return deliveryCount; }
}
