package io.nodelogs.client;

/**
 * Reference point of {@link LogStreamReader#seek(long, Whence)}.
 */
public enum Whence {
    /** Relative to the beginning of the file. */
    START,
    /** Relative to the current offset. */
    CURRENT,
    /** Relative to the end of the file, when its size is known. */
    END
}
