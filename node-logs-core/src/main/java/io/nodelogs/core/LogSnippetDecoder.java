package io.nodelogs.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Decodes snippet responses. The success line is dropped when present; every other line is kept verbatim.
 */
public final class LogSnippetDecoder {

    private final String successMarker;

    public LogSnippetDecoder(LogAccessConfig config) {
        this.successMarker = Objects.requireNonNull(config, "config").successMarker();
    }

    /**
     * @throws NodeLogsException.RemoteFailure if {@code success} is false, with {@code result} as message
     */
    public LogSnippet decode(boolean success, String result) {
        if (!success) {
            throw new NodeLogsException.RemoteFailure(result);
        }
        List<String> lines = Arrays.asList(result.split("\n", -1));
        if (!lines.isEmpty() && lines.get(0).startsWith(successMarker)) {
            lines = lines.subList(1, lines.size());
        }
        return new LogSnippet(lines);
    }
}
