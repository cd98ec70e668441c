package io.nodelogs.client;

import io.nodelogs.core.LogAccessConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Minimal dispatcher draining a {@link RequestChannel} on a daemon thread.
 *
 * <p>Each request is sent through the {@link NodeTransport}; a failed call is repeated right away on the same
 * request until it succeeds or the configured retry ceiling is reached, so that consumers waiting on the request
 * see a final failure. There is no backoff.
 */
public final class ChannelDispatcher implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ChannelDispatcher.class);
    private static final Duration IDLE_POLL = Duration.ofMillis(100);

    private final RequestChannel channel;
    private final NodeTransport transport;
    private final int maxAttempts;
    private volatile boolean running;
    private Thread thread;

    public ChannelDispatcher(RequestChannel channel, NodeTransport transport, LogAccessConfig config) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.maxAttempts = Objects.requireNonNull(config, "config").retryCeiling().maxAttempts();
    }

    public synchronized ChannelDispatcher start() {
        if (thread != null) {
            throw new IllegalStateException("dispatcher already started");
        }
        running = true;
        thread = new Thread(this::run, "node-logs-dispatcher");
        thread.setDaemon(true);
        thread.start();
        logger.info("dispatcher started, max attempts {}", maxAttempts);
        return this;
    }

    private void run() {
        try {
            while (running) {
                RemoteRequest request = channel.poll(IDLE_POLL);
                if (request != null) {
                    dispatch(request);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("dispatcher stopped");
    }

    void dispatch(RemoteRequest request) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            if (attempt > 1) {
                request.restart();
            }
            NodeResponse response;
            try {
                response = transport.fetch(request.target());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("{} abandoned at attempt {}: dispatcher interrupted", request, attempt);
                return;
            } catch (Exception e) {
                String error = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
                logger.warn("{} attempt {} failed: {}", request, attempt, error);
                request.recordFailure(error);
                continue;
            }
            if (response.success()) {
                request.recordSuccess(response.body());
                return;
            }
            String error = response.body().length == 0 ? "request failed" : response.bodyText();
            logger.debug("{} attempt {} answered with error: {}", request, attempt, error);
            request.recordFailure(error);
        }
    }

    @Override
    public synchronized void close() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
    }
}
