/**
 * Blocking, seekable access to node log files over a fire-and-poll request channel.
 *
 * <p>{@link io.nodelogs.client.RequestChannel} hands {@link io.nodelogs.client.RemoteRequest}s to a dispatcher,
 * {@link io.nodelogs.client.RequestPoller} waits for their outcome and
 * {@link io.nodelogs.client.LogStreamReader} turns chunk requests into an {@link java.io.InputStream} that can seek.
 */
package io.nodelogs.client;
