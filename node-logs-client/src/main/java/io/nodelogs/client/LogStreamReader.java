package io.nodelogs.client;

import io.nodelogs.core.ChunkDecode;
import io.nodelogs.core.NodeTargets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads a log file from a node as if it were local, one chunk request per {@link #read(byte[], int, int)}.
 *
 * <p>The reader can {@link #seek(long, Whence) seek}, which lets range-aware content serving establish the
 * content length and jump to the start of a requested range. It is single-consumer: reads and seeks must not
 * run concurrently.
 *
 * <p>When a read reaches the end of the file it still returns the bytes it copied; the following read
 * returns {@code -1} without contacting the node.
 */
public final class LogStreamReader extends InputStream {

    private static final Logger logger = LogManager.getLogger(LogStreamReader.class);

    private final String filename;
    private final RequestPoller poller;
    private final Cancellation cancellation;
    private long total;
    private long offset;
    private boolean endOfStream;

    /**
     * @param filename name of the log file on the node
     * @param knownSize size of the file if known up front, {@code 0} if unknown
     * @param poller poller bound to the session's request channel
     * @param cancellation cancellation signal of the session
     */
    public LogStreamReader(String filename, long knownSize, RequestPoller poller, Cancellation cancellation) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.poller = Objects.requireNonNull(poller, "poller");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        if (knownSize < 0) {
            throw new IllegalArgumentException("knownSize must not be negative");
        }
        this.total = knownSize;
    }

    public String filename() {
        return filename;
    }

    /** Current offset. */
    public long position() {
        return offset;
    }

    /** Size of the file as last reported by the node, {@code 0} while unknown. */
    public long size() {
        return total;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n <= 0 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (endOfStream) {
            return -1;
        }

        long requested = offset;
        RemoteRequest request = poller.channel().submit(NodeTargets.read(filename, requested));
        ChunkDecode.Delivered chunk = poller.awaitChunk(request, requested, cancellation);

        total = chunk.total();
        byte[] payload = chunk.payload();
        int copied = Math.min(len, payload.length);
        if (copied == 0) {
            if (requested == total) {
                endOfStream = true;
                return -1;
            }
            throw new ChunkReadException("empty chunk at offset " + requested + " of " + total + " for " + filename, requested);
        }
        System.arraycopy(payload, 0, b, off, copied);
        offset += copied;
        logger.debug("read {} bytes of {} at offset {}/{}", copied, filename, requested, total);
        if (offset == total) {
            endOfStream = true;
        }
        return copied;
    }

    /**
     * Moves the offset without any I/O. Seeking relative to {@link Whence#END} before the size is known moves
     * to offset 0.
     *
     * @return the new absolute offset
     * @throws IllegalArgumentException if the new offset would be negative
     */
    public long seek(long delta, Whence whence) {
        long target = switch (whence) {
            case START -> delta;
            case CURRENT -> offset + delta;
            case END -> total > 0 ? total + delta : 0;
        };
        if (target < 0) {
            throw new IllegalArgumentException("negative offset " + target + " seeking " + delta + " from " + whence);
        }
        offset = target;
        endOfStream = false;
        return offset;
    }

    @Override
    public long skip(long n) {
        if (n <= 0) {
            return 0;
        }
        long target = offset + n;
        if (total > 0 && target > total) {
            target = total;
        }
        long skipped = target - offset;
        seek(target, Whence.START);
        return skipped;
    }

    @Override
    public int available() {
        if (endOfStream || total <= offset) {
            return 0;
        }
        return (int) Math.min(Integer.MAX_VALUE, total - offset);
    }
}
