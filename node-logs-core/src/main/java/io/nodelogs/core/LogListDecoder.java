package io.nodelogs.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decodes list responses: a success line followed by {@code <filename> | <size>} lines.
 *
 * <p>A single bad line rejects the whole listing.
 */
public final class LogListDecoder {

    private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(Protocol.LIST_SEPARATOR));
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private final String successMarker;

    public LogListDecoder(LogAccessConfig config) {
        this.successMarker = Objects.requireNonNull(config, "config").successMarker();
    }

    /**
     * @param success whether the request channel reported success
     * @param result raw response text
     * @throws NodeLogsException.RemoteFailure if {@code success} is false, with {@code result} as message
     * @throws NodeLogsException.MalformedResponse if the response does not follow the list format
     */
    public LogListing decode(boolean success, String result) {
        if (!success) {
            throw new NodeLogsException.RemoteFailure(result);
        }

        String[] lines = result.split("\n", -1);
        if (lines.length < 2) {
            throw new NodeLogsException.MalformedResponse(
                    "incorrect response (length of lines should be at least 2): " + List.of(lines));
        }
        if (!lines[0].startsWith(successMarker)) {
            throw new NodeLogsException.MalformedResponse(
                    "incorrect response (first line needs to be " + successMarker + "): " + List.of(lines));
        }

        List<LogListEntry> entries = new ArrayList<>();
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) {
                continue;
            }
            String[] terms = SEPARATOR.split(line, -1);
            if (terms.length != 2) {
                throw new NodeLogsException.MalformedResponse(
                        "incorrect response line (need to have 2 terms divided by |): " + line);
            }
            if (!DIGITS.matcher(terms[1]).matches()) {
                throw new NodeLogsException.MalformedResponse("incorrect size: " + terms[1] + " in line: " + line);
            }
            long size;
            try {
                size = Long.parseUnsignedLong(terms[1]);
            } catch (NumberFormatException e) {
                throw new NodeLogsException.MalformedResponse("incorrect size: " + terms[1] + " in line: " + line, e);
            }
            entries.add(LogListEntry.of(terms[0], size));
        }
        return new LogListing(entries);
    }
}
