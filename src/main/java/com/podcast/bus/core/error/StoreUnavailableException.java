package com.podcast.bus.core.error;

/**
 * The log store could not be reached, so the command was never executed.
 *
 * <p>This is an infrastructure-level, transient condition. Subscriber loops and publishers retry it with
 * bounded exponential backoff, unlike handler failures which are left pending for redelivery.</p>
 */
public class StoreUnavailableException extends EventBusException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
