package io.nodelogs.core;

import java.time.Duration;

/**
 * Node log protocol constants (request paths, query keys and well-known values).
 *
 * <p>This module intentionally contains no transport bindings. It only models protocol-level concerns
 * shared by the request channel, the reader and the HTTP handlers.
 */
public final class Protocol {
    private Protocol() {}

    // Node request paths
    public static final String PATH_LIST = "/logs/list";
    public static final String PATH_HEAD = "/logs/head";
    public static final String PATH_TAIL = "/logs/tail";
    public static final String PATH_READ = "/logs/read";

    // Query parameter keys
    public static final String Q_FILE = "file";
    public static final String Q_OFFSET = "offset";
    public static final String Q_SIZE = "size";

    /** Every node request target is terminated by a newline. */
    public static final String TARGET_TERMINATOR = "\n";

    /** Marker the first line of every successful response starts with. */
    public static final String SUCCESS_LINE = "SUCCESS";

    /** Separator between file name and size in a list response line. */
    public static final String LIST_SEPARATOR = " | ";

    /** Interval between two snapshots of an in-flight request. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    /** Number of dispatcher attempts after which a failed request is given up on. */
    public static final int DEFAULT_RETRY_CEILING = 16;

    // HTTP
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CONTENT_LENGTH = "Content-Length";
    public static final String H_CONTENT_DISPOSITION = "Content-Disposition";
    public static final String H_CONTENT_RANGE = "Content-Range";
    public static final String H_ACCEPT_RANGES = "Accept-Ranges";
    public static final String H_RANGE = "Range";

    public static final String CT_OCTET_STREAM = "application/octet-stream";
    public static final String CT_TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String CT_JSON = "application/json";

    /** Plain text body prefix for errors reported to the operator. */
    public static final String ERROR_PREFIX = "ERROR: ";
}
