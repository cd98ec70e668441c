package io.nodelogs.client;

import java.io.InterruptedIOException;

/**
 * A wait for a node request ended because the session was cancelled or the thread interrupted.
 * The request in flight is abandoned.
 */
public class CancelledReadException extends InterruptedIOException {

    public CancelledReadException(String message) {
        super(message);
    }
}
