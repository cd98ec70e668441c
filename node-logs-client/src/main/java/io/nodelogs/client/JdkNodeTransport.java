package io.nodelogs.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Transport reaching a node's HTTP endpoint using {@link java.net.http.HttpClient}.
 *
 * <p>The target is resolved against the node's base URI; any status other than 200 is a failure whose
 * error text is the response body, or the status when the body is empty.
 */
public final class JdkNodeTransport implements NodeTransport {
    private final HttpClient http;
    private final URI baseUri;
    private final Duration timeout;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     * @param baseUri base URI of the node, for example {@code http://node:6060}
     * @param timeout per-call timeout, or {@code null} for none
     */
    public JdkNodeTransport(HttpClient http, URI baseUri, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.timeout = timeout;
    }

    @Override
    public NodeResponse fetch(String target) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(target)).GET();
        if (timeout != null) {
            builder.timeout(timeout);
        }
        HttpResponse<byte[]> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        byte[] body = resp.body() == null ? new byte[0] : resp.body();
        if (resp.statusCode() == 200) {
            return new NodeResponse(true, body);
        }
        if (body.length == 0) {
            return NodeResponse.failure("node returned status " + resp.statusCode());
        }
        return new NodeResponse(false, body);
    }

    private URI resolve(String target) {
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + target.strip());
    }
}
