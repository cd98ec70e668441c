package io.nodelogs.core;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the request targets understood by a node.
 */
public final class NodeTargets {
    private NodeTargets() {}

    public static String list() {
        return Protocol.PATH_LIST + Protocol.TARGET_TERMINATOR;
    }

    public static String head(String filename) {
        return Protocol.PATH_HEAD + "?" + Protocol.Q_FILE + "=" + encode(filename) + Protocol.TARGET_TERMINATOR;
    }

    public static String tail(String filename) {
        return Protocol.PATH_TAIL + "?" + Protocol.Q_FILE + "=" + encode(filename) + Protocol.TARGET_TERMINATOR;
    }

    public static String read(String filename, long offset) {
        return Protocol.PATH_READ + "?" + Protocol.Q_FILE + "=" + encode(filename)
                + "&" + Protocol.Q_OFFSET + "=" + Long.toUnsignedString(offset)
                + Protocol.TARGET_TERMINATOR;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
