package io.nodelogs.core;

import java.util.List;

/**
 * Head or tail preview of a log file, one element per line.
 */
public record LogSnippet(List<String> lines) {

    public LogSnippet {
        lines = List.copyOf(lines);
    }
}
