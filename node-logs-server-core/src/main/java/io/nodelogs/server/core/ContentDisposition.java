package io.nodelogs.server.core;

import java.nio.charset.StandardCharsets;

/**
 * Formats {@code Content-Disposition: attachment} values.
 *
 * <p>ASCII names are quoted; names with other characters use the {@code filename*} extended notation.
 */
public final class ContentDisposition {
    private ContentDisposition() {}

    private static final String HEX = "0123456789ABCDEF";

    public static String attachment(String filename) {
        if (isAscii(filename)) {
            return "attachment; filename=\"" + filename.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        return "attachment; filename*=utf-8''" + percentEncode(filename);
    }

    private static boolean isAscii(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c > 0x7e) return false;
        }
        return true;
    }

    private static String percentEncode(String s) {
        StringBuilder sb = new StringBuilder();
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xff;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '-' || c == '_' || c == '~') {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX.charAt(c >> 4)).append(HEX.charAt(c & 0xf));
            }
        }
        return sb.toString();
    }
}
