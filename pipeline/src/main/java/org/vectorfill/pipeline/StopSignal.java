package org.vectorfill.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Cooperative cancellation. Once requested, the pipeline stops starting new batches, lets the
 * in-flight ones finish and commit, and terminates with {@code CANCELLED}.
 */
public class StopSignal {

    private final AtomicBoolean requested = new AtomicBoolean();
    private final Sinks.Empty<Void> stopped = Sinks.empty();

    public void requestStop() {
        if (requested.compareAndSet(false, true)) {
            stopped.tryEmitEmpty();
        }
    }

    public boolean isStopRequested() {
        return requested.get();
    }

    /** Completes when a stop is requested. */
    public Mono<Void> whenStopped() {
        return stopped.asMono();
    }
}
