package io.nodelogs.core;

/**
 * Decides when a request that keeps failing is given up on.
 *
 * <p>The dispatcher counts attempts on the request it retries. Consumers tolerate failures until the
 * count reaches the ceiling; a well-formed success is final regardless of the count.
 */
public record RetryCeiling(int maxAttempts) {

    public RetryCeiling {
        if (maxAttempts < 1) {
            throw new NodeLogsException.InvalidConfiguration("retry ceiling must be at least 1, was " + maxAttempts);
        }
    }

    public boolean isExhausted(int attempt) {
        return attempt >= maxAttempts;
    }
}
