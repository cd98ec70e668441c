package io.nodelogs.core;

import java.util.List;

/**
 * Log files available on a node, in the order the node listed them.
 */
public record LogListing(List<LogListEntry> entries) {

    public LogListing {
        entries = List.copyOf(entries);
    }
}
