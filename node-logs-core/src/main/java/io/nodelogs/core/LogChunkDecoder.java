package io.nodelogs.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes chunk responses of the form {@code SUCCESS: <from>-<to>/<total>\n<payload>}.
 *
 * <p>Every outcome other than a well-formed chunk for the requested offset is a {@link ChunkDecode.Failed}
 * whose {@code terminal} flag only depends on the attempt count reaching the retry ceiling.
 */
public final class LogChunkDecoder {

    private final RetryCeiling ceiling;
    private final String successMarker;
    private final Pattern firstLine;

    public LogChunkDecoder(LogAccessConfig config) {
        Objects.requireNonNull(config, "config");
        this.ceiling = config.retryCeiling();
        this.successMarker = config.successMarker();
        this.firstLine = Pattern.compile("^" + Pattern.quote(successMarker) + ": ([0-9]+)-([0-9]+)/([0-9]+)$");
    }

    public ChunkDecode decode(RequestOutcome outcome, long requestedOffset) {
        if (!outcome.served()) {
            return new ChunkDecode.NotReady();
        }
        int attempt = outcome.attempt();
        if (outcome.hasError()) {
            return failed(outcome.error(), attempt);
        }

        byte[] response = outcome.payload();
        int firstLineEnd = indexOf(response, (byte) '\n');
        if (firstLineEnd < 0) {
            return failed("could not find first line in log part response", attempt);
        }
        String line = new String(response, 0, firstLineEnd, StandardCharsets.ISO_8859_1);
        Matcher m = firstLine.matcher(line);
        if (!m.matches()) {
            return failed("first line needs to have format " + successMarker + ": from-to/total, was [" + line + "]", attempt);
        }

        long from;
        long to;
        long total;
        try {
            from = Long.parseUnsignedLong(m.group(1));
        } catch (NumberFormatException e) {
            return failed("parsing from: " + e.getMessage(), attempt);
        }
        if (from != requestedOffset) {
            return failed("unexpected from " + Long.toUnsignedString(from)
                    + ", wanted " + Long.toUnsignedString(requestedOffset), attempt);
        }
        try {
            to = Long.parseUnsignedLong(m.group(2));
        } catch (NumberFormatException e) {
            return failed("parsing to: " + e.getMessage(), attempt);
        }
        try {
            total = Long.parseUnsignedLong(m.group(3));
        } catch (NumberFormatException e) {
            return failed("parsing total: " + e.getMessage(), attempt);
        }

        byte[] payload = Arrays.copyOfRange(response, firstLineEnd + 1, response.length);
        return new ChunkDecode.Delivered(to, total, payload);
    }

    private ChunkDecode.Failed failed(String error, int attempt) {
        return new ChunkDecode.Failed(error, attempt, ceiling.isExhausted(attempt));
    }

    private static int indexOf(byte[] bytes, byte b) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == b) return i;
        }
        return -1;
    }
}
