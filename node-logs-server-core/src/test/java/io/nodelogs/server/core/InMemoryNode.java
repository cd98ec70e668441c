package io.nodelogs.server.core;

import io.nodelogs.client.NodeResponse;
import io.nodelogs.client.NodeTransport;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node serving log files from memory in fixed-size chunks.
 */
final class InMemoryNode implements NodeTransport {

    private final Map<String, byte[]> files = new LinkedHashMap<>();
    private final int chunkSize;
    private volatile boolean broken;

    InMemoryNode(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    InMemoryNode file(String name, String content) {
        files.put(name, content.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    void breakDown() {
        broken = true;
    }

    @Override
    public synchronized NodeResponse fetch(String target) {
        if (broken) {
            return NodeResponse.failure("node unreachable");
        }
        URI uri = URI.create(target.strip());
        Map<String, String> query = QueryString.parse(uri);
        switch (uri.getPath()) {
            case "/logs/list": {
                StringBuilder sb = new StringBuilder("SUCCESS\n");
                files.forEach((name, bytes) -> sb.append(name).append(" | ").append(bytes.length).append('\n'));
                return ok(sb.toString().getBytes(StandardCharsets.UTF_8));
            }
            case "/logs/head":
            case "/logs/tail": {
                byte[] content = files.get(query.get("file"));
                if (content == null) return NodeResponse.failure("no such file: " + query.get("file"));
                return ok(("SUCCESS\n" + new String(content, StandardCharsets.UTF_8)).getBytes(StandardCharsets.UTF_8));
            }
            case "/logs/read": {
                byte[] content = files.get(query.get("file"));
                if (content == null) return NodeResponse.failure("no such file: " + query.get("file"));
                int from = Integer.parseInt(query.get("offset"));
                int to = Math.min(content.length, from + chunkSize);
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                out.writeBytes(("SUCCESS: " + from + "-" + to + "/" + content.length + "\n").getBytes(StandardCharsets.US_ASCII));
                out.write(content, from, to - from);
                return ok(out.toByteArray());
            }
            default:
                return NodeResponse.failure("unknown target " + target.strip());
        }
    }

    private static NodeResponse ok(byte[] body) {
        return new NodeResponse(true, body);
    }
}
