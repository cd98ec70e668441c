package io.nodelogs.client;

/**
 * Final outcome of a text request, in the shape the list and snippet decoders take.
 *
 * @param success false when the node reported an error
 * @param text response text, or the error text when not successful
 */
public record TextResponse(boolean success, String text) {}
