package io.nodelogs.server.core;

import io.nodelogs.client.LogStreamReader;
import io.nodelogs.client.Whence;
import io.nodelogs.core.Protocol;

import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Range-aware serving of a {@link LogStreamReader}.
 *
 * <p>The content length is established by seeking to the end and back, so it comes from the size the reader
 * already knows. A reader that knows no size is streamed until it ends, without range support.
 */
public final class ContentServer {
    private ContentServer() {}

    static final int BUFFER_SIZE = 32 * 1024;

    /**
     * @param method GET streams the body, HEAD only sends headers
     * @param rangeHeader the request's {@code Range} header, or {@code null}
     * @param reader reader positioned anywhere; it is repositioned as needed
     */
    public static ServerResponse serve(HttpMethod method, String rangeHeader, LogStreamReader reader) {
        long size = reader.seek(0, Whence.END);
        reader.seek(0, Whence.START);

        if (size == 0) {
            return new ServerResponse(200, body(method, out -> copyToEnd(reader, out)));
        }

        ByteRange.Parsed parsed = ByteRange.parse(rangeHeader, size);
        if (parsed instanceof ByteRange.Invalid invalid) {
            return rangeError(invalid.reason());
        }
        if (parsed instanceof ByteRange.Unsatisfiable) {
            return rangeError("invalid range: failed to overlap")
                    .header(Protocol.H_CONTENT_RANGE, "bytes */" + size);
        }
        if (parsed instanceof ByteRange.Single single) {
            ByteRange range = single.range();
            return new ServerResponse(206, body(method, out -> copy(reader, range.start(), range.length(), out)))
                    .header(Protocol.H_ACCEPT_RANGES, "bytes")
                    .header(Protocol.H_CONTENT_RANGE, range.contentRange(size))
                    .header(Protocol.H_CONTENT_LENGTH, Long.toString(range.length()));
        }
        return new ServerResponse(200, body(method, out -> copy(reader, 0, size, out)))
                .header(Protocol.H_ACCEPT_RANGES, "bytes")
                .header(Protocol.H_CONTENT_LENGTH, Long.toString(size));
    }

    private static ResponseBody body(HttpMethod method, ResponseBody.Writer writer) {
        return method == HttpMethod.HEAD ? new ResponseBody.Empty() : new ResponseBody.Stream(writer);
    }

    private static ServerResponse rangeError(String message) {
        return new ServerResponse(416, new ResponseBody.Bytes((message + "\n").getBytes(StandardCharsets.UTF_8)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_TEXT_PLAIN);
    }

    static void copy(LogStreamReader reader, long start, long length, OutputStream out) throws IOException {
        reader.seek(start, Whence.START);
        byte[] buf = new byte[BUFFER_SIZE];
        long remaining = length;
        while (remaining > 0) {
            int n = reader.read(buf, 0, (int) Math.min(buf.length, remaining));
            if (n < 0) {
                throw new EOFException(reader.filename() + " ended at offset " + reader.position()
                        + ", expected " + (start + length));
            }
            out.write(buf, 0, n);
            remaining -= n;
        }
    }

    static void copyToEnd(LogStreamReader reader, OutputStream out) throws IOException {
        byte[] buf = new byte[BUFFER_SIZE];
        int n;
        while ((n = reader.read(buf, 0, buf.length)) >= 0) {
            out.write(buf, 0, n);
        }
    }
}
