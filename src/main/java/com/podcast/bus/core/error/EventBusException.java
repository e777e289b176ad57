package com.podcast.bus.core.error;

/**
 * Root of the bus exception hierarchy.
 *
 * <p>All bus failures are unchecked and travel through reactive error signals
 * ({@code Mono.error}) rather than being thrown across thread boundaries.</p>
 */
public class EventBusException extends RuntimeException {

    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
