package io.nodelogs.client;

import io.nodelogs.core.RequestOutcome;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded hand-off between consumers submitting node requests and the dispatcher serving them.
 *
 * <p>Submitting never blocks. Backpressure is left to the dispatcher.
 */
public final class RequestChannel {

    private final BlockingQueue<RemoteRequest> queue = new LinkedBlockingQueue<>();

    public RemoteRequest submit(String target) {
        RemoteRequest request = new RemoteRequest(target);
        queue.add(request);
        return request;
    }

    public RequestOutcome snapshot(RemoteRequest request) {
        return request.outcome();
    }

    /** Dispatcher side: waits for the next submitted request. */
    public RemoteRequest take() throws InterruptedException {
        return queue.take();
    }

    /** Dispatcher side: waits up to {@code timeout} for the next submitted request, or returns {@code null}. */
    public RemoteRequest poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Number of submitted requests no dispatcher has picked up yet. */
    public int pending() {
        return queue.size();
    }
}
