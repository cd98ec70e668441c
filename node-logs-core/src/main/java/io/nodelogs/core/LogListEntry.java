package io.nodelogs.core;

/**
 * One log file available on a node.
 *
 * @param filename file name as reported by the node
 * @param size size in bytes (unsigned)
 * @param printedSize {@link ByteCount human readable} size
 */
public record LogListEntry(String filename, long size, String printedSize) {

    public static LogListEntry of(String filename, long size) {
        return new LogListEntry(filename, size, ByteCount.format(size));
    }
}
