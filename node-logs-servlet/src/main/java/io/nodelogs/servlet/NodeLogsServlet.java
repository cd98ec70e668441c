package io.nodelogs.servlet;

import io.nodelogs.client.Cancellation;
import io.nodelogs.core.Protocol;
import io.nodelogs.server.core.HttpMethod;
import io.nodelogs.server.core.LogHandler;
import io.nodelogs.server.core.ResponseBody;
import io.nodelogs.server.core.ServerRequest;
import io.nodelogs.server.core.ServerResponse;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves a {@link LogHandler} from a servlet container.
 *
 * <p>Every exchange gets its own {@link Cancellation}; it is triggered when writing to the client fails, so
 * waits on the node end once the client has gone away.
 */
public final class NodeLogsServlet extends HttpServlet {

    private static final Logger logger = LogManager.getLogger(NodeLogsServlet.class);

    private final transient LogHandler handler;

    public NodeLogsServlet(LogHandler handler) {
        this.handler = handler;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        HttpMethod method;
        try {
            method = HttpMethod.valueOf(req.getMethod());
        } catch (IllegalArgumentException e) {
            resp.setStatus(405);
            return;
        }

        Cancellation cancellation = new Cancellation();
        ServerResponse engineResp;
        try {
            engineResp = handler.handle(toEngineRequest(req, method), cancellation);
        } catch (URISyntaxException e) {
            writePlain(resp, 400, Protocol.ERROR_PREFIX + "invalid request uri");
            return;
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Bytes bytes) {
            resp.getOutputStream().write(bytes.bytes());
            return;
        }
        if (body instanceof ResponseBody.Stream stream) {
            writeStream(req, resp, stream, cancellation);
        }
    }

    private static void writeStream(HttpServletRequest req, HttpServletResponse resp, ResponseBody.Stream stream,
                                    Cancellation cancellation) throws IOException {
        OutputStream out = new CancellingOutputStream(resp.getOutputStream(), cancellation);
        try {
            stream.writer().writeTo(out);
            out.flush();
        } catch (IOException e) {
            cancellation.cancel();
            if (resp.isCommitted()) {
                logger.warn("aborted {}?{} after the response was committed: {}",
                        req.getRequestURI(), req.getQueryString(), e.getMessage());
                return;
            }
            resp.reset();
            writePlain(resp, 502, Protocol.ERROR_PREFIX + e.getMessage());
        }
    }

    private static void writePlain(HttpServletResponse resp, int status, String message) throws IOException {
        resp.setStatus(status);
        resp.setContentType(Protocol.CT_TEXT_PLAIN);
        resp.getOutputStream().write((message + "\n").getBytes(StandardCharsets.UTF_8));
    }

    private static ServerRequest toEngineRequest(HttpServletRequest req, HttpMethod method) throws URISyntaxException {
        URI uri = new URI(req.getRequestURL().toString() + (req.getQueryString() == null ? "" : "?" + req.getQueryString()));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }
        return new ServerRequest(method, uri, headers);
    }

    /** Cancels the exchange as soon as a write to the client fails. */
    private static final class CancellingOutputStream extends FilterOutputStream {
        private final Cancellation cancellation;

        CancellingOutputStream(OutputStream out, Cancellation cancellation) {
            super(out);
            this.cancellation = cancellation;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            try {
                out.write(b, off, len);
            } catch (IOException e) {
                cancellation.cancel();
                throw e;
            }
        }

        @Override
        public void flush() throws IOException {
            try {
                out.flush();
            } catch (IOException e) {
                cancellation.cancel();
                throw e;
            }
        }
    }
}
