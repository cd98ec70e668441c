package io.nodelogs.client;

import io.nodelogs.core.ChunkDecode;
import io.nodelogs.core.LogAccessConfig;
import io.nodelogs.core.LogChunkDecoder;
import io.nodelogs.core.RequestOutcome;
import io.nodelogs.core.RetryCeiling;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Blocks on node requests by re-reading their outcome every poll interval.
 *
 * <p>Failures are tolerated while the dispatcher keeps retrying the same request; they become final once the
 * dispatcher's attempt count reaches the retry ceiling. Cancellation is checked before every look at the
 * request and also ends the wait between two looks.
 */
public final class RequestPoller {

    private static final Logger logger = LogManager.getLogger(RequestPoller.class);

    private final RequestChannel channel;
    private final Duration pollInterval;
    private final RetryCeiling ceiling;
    private final LogChunkDecoder chunkDecoder;

    public RequestPoller(RequestChannel channel, LogAccessConfig config) {
        this.channel = Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(config, "config");
        this.pollInterval = config.pollInterval();
        this.ceiling = config.retryCeiling();
        this.chunkDecoder = new LogChunkDecoder(config);
    }

    public RequestChannel channel() {
        return channel;
    }

    /**
     * Submits {@code target} and waits until the node answered or the ceiling is reached.
     */
    public TextResponse awaitText(String target, Cancellation cancellation) throws CancelledReadException {
        RemoteRequest request = channel.submit(target);
        AtomicInteger warned = new AtomicInteger();
        RequestOutcome outcome = await(request, cancellation, o -> {
            if (!o.served()) return Optional.empty();
            if (o.hasError() && !ceiling.isExhausted(o.attempt())) {
                warnOnce(warned, request, o.attempt(), o.error());
                return Optional.empty();
            }
            return Optional.of(o);
        });
        if (outcome.hasError()) {
            return new TextResponse(false, outcome.error());
        }
        return new TextResponse(true, new String(outcome.payload(), StandardCharsets.UTF_8));
    }

    /**
     * Waits for a well-formed chunk starting at {@code offset}.
     *
     * @throws ChunkReadException once the failure is final
     */
    public ChunkDecode.Delivered awaitChunk(RemoteRequest request, long offset, Cancellation cancellation)
            throws ChunkReadException, CancelledReadException {
        AtomicInteger warned = new AtomicInteger();
        ChunkDecode result = await(request, cancellation, o -> {
            ChunkDecode decoded = chunkDecoder.decode(o, offset);
            if (decoded instanceof ChunkDecode.Failed failed && !failed.terminal()) {
                warnOnce(warned, request, failed.attempt(), failed.error());
            }
            return decoded.terminal() ? Optional.of(decoded) : Optional.empty();
        });
        if (result instanceof ChunkDecode.Failed failed) {
            throw new ChunkReadException(failed.error(), offset);
        }
        return (ChunkDecode.Delivered) result;
    }

    // one warning per dispatcher attempt, not per poll
    private static void warnOnce(AtomicInteger warned, RemoteRequest request, int attempt, String error) {
        if (warned.getAndSet(attempt) != attempt) {
            logger.warn("{} failed at attempt {}, waiting for retry: {}", request, attempt, error);
        }
    }

    private <T> T await(RemoteRequest request, Cancellation cancellation, Function<RequestOutcome, Optional<T>> step)
            throws CancelledReadException {
        try {
            while (true) {
                if (cancellation.isCancelled()) {
                    logger.debug("abandoning {}: cancelled", request);
                    throw new CancelledReadException("interrupted");
                }
                Optional<T> done = step.apply(channel.snapshot(request));
                if (done.isPresent()) {
                    return done.get();
                }
                cancellation.await(pollInterval);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledReadException("interrupted");
        }
    }
}
