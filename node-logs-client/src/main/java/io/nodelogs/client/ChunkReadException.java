package io.nodelogs.client;

import java.io.IOException;

/**
 * A chunk could not be read: the node kept failing until the retry ceiling, or its response was unusable.
 */
public class ChunkReadException extends IOException {

    private final long offset;

    public ChunkReadException(String message, long offset) {
        super(message);
        this.offset = offset;
    }

    /** Offset the failed read was issued at. */
    public long offset() {
        return offset;
    }
}
