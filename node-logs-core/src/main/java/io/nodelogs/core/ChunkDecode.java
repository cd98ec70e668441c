package io.nodelogs.core;

import java.util.Arrays;

/**
 * Result of decoding one snapshot of a chunk request.
 */
public sealed interface ChunkDecode permits ChunkDecode.NotReady, ChunkDecode.Failed, ChunkDecode.Delivered {

    /** Whether polling the request again is pointless. */
    boolean terminal();

    /** The dispatcher has not produced an outcome yet. */
    record NotReady() implements ChunkDecode {
        @Override
        public boolean terminal() {
            return false;
        }
    }

    /**
     * The node reported an error, or the response was malformed.
     *
     * @param error description of the failure
     * @param attempt dispatcher attempt the failure was observed at
     * @param terminal true once the retry ceiling is reached
     */
    record Failed(String error, int attempt, boolean terminal) implements ChunkDecode {}

    /**
     * A well-formed chunk for the requested offset.
     *
     * @param to end of the chunk (exclusive) as reported by the node
     * @param total size of the whole file as reported by the node
     * @param payload chunk bytes, compared by content
     */
    record Delivered(long to, long total, byte[] payload) implements ChunkDecode {
        @Override
        public boolean terminal() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Delivered d && to == d.to && total == d.total && Arrays.equals(payload, d.payload);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * Long.hashCode(to) + Long.hashCode(total)) + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "Delivered[to=" + to + ", total=" + total + ", payload=" + payload.length + " bytes]";
        }
    }
}
