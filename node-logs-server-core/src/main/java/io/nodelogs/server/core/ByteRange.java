package io.nodelogs.server.core;

import java.util.ArrayList;
import java.util.List;

/**
 * A single satisfiable byte range of a resource, and parsing of {@code Range} request headers.
 *
 * @param start first byte
 * @param length number of bytes
 */
public record ByteRange(long start, long length) {

    private static final String BYTES_UNIT = "bytes=";

    public long end() {
        return start + length - 1;
    }

    public String contentRange(long size) {
        return "bytes " + start + "-" + end() + "/" + size;
    }

    /** Outcome of parsing a {@code Range} header against a resource size. */
    public sealed interface Parsed permits Whole, Single, Unsatisfiable, Invalid {}

    /** Serve the whole resource: no header, or several ranges. */
    public record Whole() implements Parsed {}

    public record Single(ByteRange range) implements Parsed {}

    /** Every range starts at or past the end of the resource. */
    public record Unsatisfiable() implements Parsed {}

    /** The header does not follow the {@code bytes=} syntax. */
    public record Invalid(String reason) implements Parsed {}

    public static Parsed parse(String header, long size) {
        if (header == null || header.isEmpty()) {
            return new Whole();
        }
        if (!header.startsWith(BYTES_UNIT)) {
            return new Invalid("invalid range");
        }
        List<ByteRange> ranges = new ArrayList<>();
        boolean noOverlap = false;
        for (String spec : header.substring(BYTES_UNIT.length()).split(",")) {
            spec = spec.trim();
            if (spec.isEmpty()) {
                continue;
            }
            int dash = spec.indexOf('-');
            if (dash < 0) {
                return new Invalid("invalid range");
            }
            String first = spec.substring(0, dash).trim();
            String last = spec.substring(dash + 1).trim();
            if (first.isEmpty()) {
                // suffix: the final N bytes
                long n = parseNumber(last);
                if (n < 0) {
                    return new Invalid("invalid range");
                }
                if (n == 0 || size == 0) {
                    noOverlap = true;
                    continue;
                }
                long length = Math.min(n, size);
                ranges.add(new ByteRange(size - length, length));
                continue;
            }
            long start = parseNumber(first);
            if (start < 0) {
                return new Invalid("invalid range");
            }
            if (start >= size) {
                noOverlap = true;
                continue;
            }
            long end;
            if (last.isEmpty()) {
                end = size - 1;
            } else {
                end = parseNumber(last);
                if (end < 0 || start > end) {
                    return new Invalid("invalid range");
                }
                end = Math.min(end, size - 1);
            }
            ranges.add(new ByteRange(start, end - start + 1));
        }
        if (ranges.isEmpty()) {
            return noOverlap ? new Unsatisfiable() : new Whole();
        }
        if (ranges.size() > 1) {
            return new Whole();
        }
        return new Single(ranges.get(0));
    }

    /** @return the value, or -1 if {@code s} is not a plain decimal number */
    private static long parseNumber(String s) {
        if (s.isEmpty()) return -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return -1;
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
