/**
 * Framework-neutral HTTP handling for node logs.
 *
 * <p>{@link io.nodelogs.server.core.LogHandler} routes listing, preview and download requests;
 * {@link io.nodelogs.server.core.ContentServer} serves a {@link io.nodelogs.client.LogStreamReader} with
 * byte-range support. Framework bindings translate their request and response types to
 * {@link io.nodelogs.server.core.ServerRequest} and {@link io.nodelogs.server.core.ServerResponse}.
 */
package io.nodelogs.server.core;
