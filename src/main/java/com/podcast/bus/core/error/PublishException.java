package com.podcast.bus.core.error;

/**
 * An append to a stream failed.
 *
 * <p>The bus does not retry a publish once the write may have reached the store, because a retry could
 * append a duplicate entry. The caller decides whether to publish again; events carry an idempotency key
 * so consumers can deduplicate when it does.</p>
 */
public class PublishException extends EventBusException {

    private final String stream;

    public PublishException(String stream, Throwable cause) {
        super("Publish to stream '" + stream + "' failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.stream = stream;
    }

    public String getStream() {
        return stream;
    }
}
