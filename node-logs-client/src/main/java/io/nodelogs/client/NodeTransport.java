package io.nodelogs.client;

/**
 * Performs one call against a node.
 */
public interface NodeTransport {
    NodeResponse fetch(String target) throws Exception;
}
