package io.nodelogs.client;

import java.nio.charset.StandardCharsets;

/**
 * Raw answer of a node to one call.
 *
 * @param success whether the node served the call
 * @param body response bytes; the error text when not successful
 */
public record NodeResponse(boolean success, byte[] body) {

    public NodeResponse {
        if (body == null) {
            body = new byte[0];
        }
    }

    public static NodeResponse failure(String error) {
        return new NodeResponse(false, error.getBytes(StandardCharsets.UTF_8));
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
