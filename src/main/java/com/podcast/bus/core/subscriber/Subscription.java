package com.podcast.bus.core.subscriber;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on one running subscriber loop.
 *
 * <ul>
 *   <li>{@link #stop()} is cooperative: the loop finishes the entry in flight, acknowledges it or leaves it
 *       pending, and then terminates. A live read in progress completes first, bounded by the poll
 *       timeout.</li>
 *   <li>{@link #dispose()} cancels immediately. Entries assigned but not acknowledged stay pending.</li>
 * </ul>
 */
public final class Subscription {

    private final String stream;
    private final String group;
    private final String consumer;

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final AtomicBoolean done = new AtomicBoolean();
    private final Sinks.Empty<Void> terminated = Sinks.empty();
    private volatile Disposable running;

    Subscription(String stream, String group, String consumer) {
        this.stream = stream;
        this.group = group;
        this.consumer = consumer;
    }

    public String stream() {
        return stream;
    }

    public String group() {
        return group;
    }

    public String consumer() {
        return consumer;
    }

    /**
     * Requests a cooperative stop.
     *
     * @return completes when the loop has terminated
     */
    public Mono<Void> stop() {
        stopRequested.set(true);
        return termination();
    }

    public void dispose() {
        stopRequested.set(true);
        Disposable d = running;
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
        done.set(true);
        terminated.tryEmitEmpty();
    }

    /**
     * Completes when the loop stops, or errors when it gave up on an unreachable store.
     */
    public Mono<Void> termination() {
        return terminated.asMono();
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public boolean isTerminated() {
        return done.get();
    }

    void attach(Disposable disposable) {
        this.running = disposable;
    }

    void completed() {
        done.set(true);
        terminated.tryEmitEmpty();
    }

    void failed(Throwable error) {
        done.set(true);
        terminated.tryEmitError(error);
    }

    @Override
    public String toString() {
        return "Subscription{" + stream + "/" + group + "/" + consumer + "}";
    }
}
