package io.nodelogs.server.core;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-neutral request abstraction.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /** First value of a header, matching the name case-insensitively. */
    public Optional<String> header(String name) {
        String target = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey() == null || !e.getKey().toLowerCase(Locale.ROOT).equals(target)) continue;
            for (String v : e.getValue()) {
                if (v != null) return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
