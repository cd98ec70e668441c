package io.nodelogs.client;

import io.nodelogs.core.RequestOutcome;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One request to a node, shared between the consumer that submitted it and the dispatcher serving it.
 *
 * <p>State changes publish a whole new {@link RequestOutcome}; {@link #outcome()} never observes a partial update.
 * The dispatcher may retry the same request: every recorded success or failure counts one attempt, and
 * {@link #restart()} marks a new attempt as in progress.
 */
public final class RemoteRequest {

    private final String target;
    private final AtomicReference<RequestOutcome> outcome = new AtomicReference<>(RequestOutcome.pending());

    public RemoteRequest(String target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    /** Node request target, for example {@code /logs/read?file=erigon.log&offset=0}. */
    public String target() {
        return target;
    }

    public RequestOutcome outcome() {
        return outcome.get();
    }

    /** Records a successful attempt. {@code payload} is copied. */
    public RequestOutcome recordSuccess(byte[] payload) {
        byte[] copy = Arrays.copyOf(Objects.requireNonNull(payload, "payload"), payload.length);
        return outcome.updateAndGet(prev -> RequestOutcome.success(copy, prev.attempt() + 1));
    }

    public RequestOutcome recordFailure(String error) {
        return outcome.updateAndGet(prev -> RequestOutcome.failure(error, prev.attempt() + 1));
    }

    /** Marks the request as unserved again while the dispatcher works on another attempt. */
    public RequestOutcome restart() {
        return outcome.updateAndGet(prev -> new RequestOutcome(false, "", prev.attempt(), null));
    }

    @Override
    public String toString() {
        return "RemoteRequest{" + target.strip() + ", attempt=" + outcome.get().attempt() + "}";
    }
}
