package io.nodelogs.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable view of a node request at one point in time.
 *
 * <p>The dispatcher publishes a new outcome on every state change; consumers read a whole outcome at once,
 * so {@code served}, {@code error} and {@code attempt} always belong together.
 *
 * @param served true once the dispatcher produced an outcome for the current attempt
 * @param error error text, empty unless the outcome is a failure
 * @param attempt number of attempts the dispatcher has made so far
 * @param payload raw response bytes, only meaningful when served without error; compared by content
 */
public record RequestOutcome(boolean served, String error, int attempt, byte[] payload) {

    private static final byte[] NO_PAYLOAD = new byte[0];

    public RequestOutcome {
        error = error == null ? "" : error;
        payload = payload == null ? NO_PAYLOAD : payload;
    }

    /** Outcome of a request no attempt has finished for yet. */
    public static RequestOutcome pending() {
        return new RequestOutcome(false, "", 0, null);
    }

    public static RequestOutcome success(byte[] payload, int attempt) {
        return new RequestOutcome(true, "", attempt, Objects.requireNonNull(payload, "payload"));
    }

    public static RequestOutcome failure(String error, int attempt) {
        if (error == null || error.isEmpty()) {
            throw new IllegalArgumentException("failure outcome needs an error text");
        }
        return new RequestOutcome(true, error, attempt, null);
    }

    public boolean hasError() {
        return !error.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RequestOutcome r && served == r.served && attempt == r.attempt
                && error.equals(r.error) && Arrays.equals(payload, r.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(served, error, attempt) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "RequestOutcome[served=" + served + ", error=" + error + ", attempt=" + attempt
                + ", payload=" + payload.length + " bytes]";
    }
}
