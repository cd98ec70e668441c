package io.nodelogs.server.core;

import io.nodelogs.client.RequestChannel;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request channels of the sessions that currently have a node allocated.
 */
public final class SessionRegistry {

    private final Map<String, RequestChannel> channels = new ConcurrentHashMap<>();

    public void allocate(String session, RequestChannel channel) {
        channels.put(Objects.requireNonNull(session, "session"), Objects.requireNonNull(channel, "channel"));
    }

    public void release(String session) {
        channels.remove(session);
    }

    /** The session's channel, empty when no node is allocated to it. */
    public Optional<RequestChannel> channel(String session) {
        return Optional.ofNullable(channels.get(session));
    }
}
