package io.nodelogs.core;

import java.util.Locale;

/**
 * Human readable, 1024-based byte sizes: {@code 1023B}, {@code 1.0KB}, {@code 1.5MB}.
 *
 * <p>Sizes are unsigned 64-bit values.
 */
public final class ByteCount {
    private ByteCount() {}

    private static final long UNIT = 1024;
    private static final String UNITS = "KMGTPE";

    public static String format(long bytes) {
        if (Long.compareUnsigned(bytes, UNIT) < 0) {
            return Long.toUnsignedString(bytes) + "B";
        }
        long div = UNIT;
        int exp = 0;
        for (long n = Long.divideUnsigned(bytes, UNIT); Long.compareUnsigned(n, UNIT) >= 0; n = Long.divideUnsigned(n, UNIT)) {
            div *= UNIT;
            exp++;
        }
        return String.format(Locale.ROOT, "%.1f%cB", unsignedToDouble(bytes) / div, UNITS.charAt(exp));
    }

    private static double unsignedToDouble(long v) {
        if (v >= 0) return v;
        return ((v >>> 1) | (v & 1)) * 2.0;
    }
}
