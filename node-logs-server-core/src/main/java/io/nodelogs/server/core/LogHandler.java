package io.nodelogs.server.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nodelogs.client.CancelledReadException;
import io.nodelogs.client.Cancellation;
import io.nodelogs.client.LogStreamReader;
import io.nodelogs.client.RequestChannel;
import io.nodelogs.client.RequestPoller;
import io.nodelogs.client.TextResponse;
import io.nodelogs.core.LogAccessConfig;
import io.nodelogs.core.LogListDecoder;
import io.nodelogs.core.LogListEntry;
import io.nodelogs.core.LogListing;
import io.nodelogs.core.LogSnippet;
import io.nodelogs.core.LogSnippetDecoder;
import io.nodelogs.core.NodeLogsException;
import io.nodelogs.core.NodeTargets;
import io.nodelogs.core.Protocol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-neutral HTTP handler for browsing and downloading node logs.
 *
 * <p>Routes, relative to the base path (default {@code /logs}):
 * <ul>
 *   <li>{@code GET /logs/{session}}: list of log files, as JSON</li>
 *   <li>{@code GET /logs/{session}/head?file=f} and {@code /tail?file=f}: preview lines, as JSON</li>
 *   <li>{@code GET|HEAD /logs/{session}/download?file=f&size=n}: the file, with byte-range support</li>
 * </ul>
 *
 * <p>Use {@link #builder(SessionRegistry)} to create instances with custom configuration:
 * <pre>{@code
 * LogHandler handler = LogHandler.builder(sessions)
 *     .config(LogAccessConfig.builder().retryCeiling(8).build())
 *     .basePath("/node-logs")
 *     .build();
 * }</pre>
 */
public final class LogHandler {

    private static final Logger logger = LogManager.getLogger(LogHandler.class);

    static final String NOT_ALLOCATED = "Node is not allocated";

    private final SessionRegistry sessions;
    private final LogAccessConfig config;
    private final String basePath;
    private final ObjectMapper mapper;
    private final LogListDecoder listDecoder;
    private final LogSnippetDecoder snippetDecoder;

    public static Builder builder(SessionRegistry sessions) {
        return new Builder(sessions);
    }

    public LogHandler(SessionRegistry sessions) {
        this(builder(sessions));
    }

    private LogHandler(Builder builder) {
        this.sessions = Objects.requireNonNull(builder.sessions, "sessions");
        this.config = builder.config != null ? builder.config : LogAccessConfig.defaults();
        this.basePath = builder.basePath != null ? builder.basePath : "/logs";
        this.mapper = builder.mapper != null ? builder.mapper : new ObjectMapper();
        this.listDecoder = new LogListDecoder(config);
        this.snippetDecoder = new LogSnippetDecoder(config);
    }

    /**
     * Builder for {@link LogHandler}.
     */
    public static final class Builder {
        private final SessionRegistry sessions;
        private LogAccessConfig config;
        private String basePath;
        private ObjectMapper mapper;

        private Builder(SessionRegistry sessions) {
            this.sessions = Objects.requireNonNull(sessions, "sessions");
        }

        /** Sets poll interval, retry ceiling and success marker. Default: {@link LogAccessConfig#defaults()}. */
        public Builder config(LogAccessConfig config) {
            this.config = config;
            return this;
        }

        /** Sets the path prefix the routes live under. Default: {@code /logs}. */
        public Builder basePath(String basePath) {
            if (basePath != null && basePath.endsWith("/")) {
                basePath = basePath.substring(0, basePath.length() - 1);
            }
            this.basePath = basePath;
            return this;
        }

        /** Sets the mapper used for JSON views. */
        public Builder mapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public LogHandler build() {
            return new LogHandler(this);
        }
    }

    /** JSON view of a listing. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ListView(boolean success, String error, String sessionName, List<LogListEntry> list) {}

    /** JSON view of a head or tail preview. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SnippetView(boolean success, String error, List<String> lines) {}

    /**
     * Handles a request. {@code cancellation} is the signal of the HTTP exchange: bindings trigger it when the
     * client goes away, which ends any wait on the node.
     */
    public ServerResponse handle(ServerRequest req, Cancellation cancellation) {
        String path = req.uri().getPath();
        if (path == null || !path.startsWith(basePath + "/")) {
            return plain(404, "not found");
        }
        String[] parts = path.substring(basePath.length() + 1).split("/");
        if (parts.length == 0 || parts[0].isEmpty() || parts.length > 2) {
            return plain(404, "not found");
        }
        String session = parts[0];
        String action = parts.length == 2 ? parts[1] : "";
        Map<String, String> query = QueryString.parse(req.uri());

        if (req.method() != HttpMethod.GET && !action.equals("download")) {
            return plain(405, "method not allowed");
        }
        try {
            return switch (action) {
                case "" -> list(session, cancellation);
                case "head" -> snippet(session, NodeTargets.head(requireFile(query)), cancellation);
                case "tail" -> snippet(session, NodeTargets.tail(requireFile(query)), cancellation);
                case "download" -> download(req.method(), session, requireFile(query), parseSize(query),
                        req.header(Protocol.H_RANGE).orElse(null), cancellation);
                default -> plain(404, "not found");
            };
        } catch (BadRequest e) {
            return plain(400, Protocol.ERROR_PREFIX + e.getMessage());
        }
    }

    /**
     * Serves a log file for download as {@code <session>_<filename>}.
     *
     * <p>Without a channel for the session a plain text error is returned and the node is not contacted.
     *
     * @param size size of the file if known from a listing, {@code 0} otherwise
     */
    public ServerResponse download(HttpMethod method, String session, String filename, long size,
                                   String rangeHeader, Cancellation cancellation) {
        Optional<RequestChannel> channel = sessions.channel(session);
        if (channel.isEmpty()) {
            return plain(200, Protocol.ERROR_PREFIX + NOT_ALLOCATED);
        }
        LogStreamReader reader = new LogStreamReader(filename, size, new RequestPoller(channel.get(), config), cancellation);
        logger.debug("serving {} of session {} ({} bytes, range {})", filename, session, size, rangeHeader);
        ServerResponse resp = ContentServer.serve(method, rangeHeader, reader)
                .header(Protocol.H_CONTENT_DISPOSITION, ContentDisposition.attachment(session + "_" + filename));
        if (resp.firstHeader(Protocol.H_CONTENT_TYPE) == null) {
            resp.header(Protocol.H_CONTENT_TYPE, Protocol.CT_OCTET_STREAM);
        }
        return resp;
    }

    public ServerResponse list(String session, Cancellation cancellation) {
        ListView view;
        try {
            TextResponse resp = await(session, NodeTargets.list(), cancellation);
            LogListing listing = listDecoder.decode(resp.success(), resp.text());
            view = new ListView(true, null, session, listing.entries());
        } catch (NodeLogsException | CancelledReadException e) {
            view = new ListView(false, e.getMessage(), session, null);
        }
        return json(view);
    }

    public ServerResponse snippet(String session, String target, Cancellation cancellation) {
        SnippetView view;
        try {
            TextResponse resp = await(session, target, cancellation);
            LogSnippet snippet = snippetDecoder.decode(resp.success(), resp.text());
            view = new SnippetView(true, null, snippet.lines());
        } catch (NodeLogsException | CancelledReadException e) {
            view = new SnippetView(false, e.getMessage(), null);
        }
        return json(view);
    }

    private TextResponse await(String session, String target, Cancellation cancellation) throws CancelledReadException {
        RequestChannel channel = sessions.channel(session)
                .orElseThrow(() -> new NodeLogsException.RemoteFailure(NOT_ALLOCATED));
        return new RequestPoller(channel, config).awaitText(target, cancellation);
    }

    private ServerResponse json(Object view) {
        try {
            return new ServerResponse(200, new ResponseBody.Bytes(mapper.writeValueAsBytes(view)))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
        } catch (JsonProcessingException e) {
            logger.error("could not render {}", view.getClass().getSimpleName(), e);
            return plain(500, Protocol.ERROR_PREFIX + "could not render response");
        }
    }

    private static String requireFile(Map<String, String> query) {
        String file = query.get(Protocol.Q_FILE);
        if (file == null || file.isEmpty()) {
            throw new BadRequest("missing " + Protocol.Q_FILE + " parameter");
        }
        return file;
    }

    private static long parseSize(Map<String, String> query) {
        String size = query.get(Protocol.Q_SIZE);
        if (size == null || size.isEmpty()) {
            return 0;
        }
        try {
            long v = Long.parseLong(size);
            if (v < 0) {
                throw new BadRequest("invalid " + Protocol.Q_SIZE + ": " + size);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new BadRequest("invalid " + Protocol.Q_SIZE + ": " + size);
        }
    }

    static ServerResponse plain(int status, String message) {
        return new ServerResponse(status, new ResponseBody.Bytes((message + "\n").getBytes(StandardCharsets.UTF_8)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_TEXT_PLAIN);
    }

    private static final class BadRequest extends RuntimeException {
        BadRequest(String message) {
            super(message);
        }
    }
}
