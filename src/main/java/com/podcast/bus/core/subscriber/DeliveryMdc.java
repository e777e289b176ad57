package com.podcast.bus.core.subscriber;

import com.podcast.bus.core.model.Delivery;
import org.slf4j.MDC;

/**
 * Populates the SLF4J MDC with the coordinates of one delivery for the duration of a try block.
 *
 * <pre>
 * try (DeliveryMdc mdc = DeliveryMdc.of(delivery)) {
 *     log.info("Processing");
 * }
 * </pre>
 *
 * Only the keys set here are removed on close, so an outer request context survives.
 */
public final class DeliveryMdc implements AutoCloseable {

    public static final String STREAM = "stream";
    public static final String GROUP = "group";
    public static final String CONSUMER = "consumer";
    public static final String ENTRY_ID = "entryId";
    public static final String DELIVERY_COUNT = "deliveryCount";

    private DeliveryMdc(Delivery delivery) {
        MDC.put(STREAM, delivery.stream());
        MDC.put(GROUP, delivery.group());
        MDC.put(CONSUMER, delivery.consumer());
        MDC.put(ENTRY_ID, delivery.id().toString());
        MDC.put(DELIVERY_COUNT, Long.toString(delivery.deliveryCount()));
    }

    public static DeliveryMdc of(Delivery delivery) {
        return new DeliveryMdc(delivery);
    }

    @Override
    public void close() {
        MDC.remove(STREAM);
        MDC.remove(GROUP);
        MDC.remove(CONSUMER);
        MDC.remove(ENTRY_ID);
        MDC.remove(DELIVERY_COUNT);
    }
}
