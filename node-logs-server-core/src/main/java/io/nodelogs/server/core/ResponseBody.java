package io.nodelogs.server.core;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Stream {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    /**
     * Body produced while the response is written, typically pulled from a node chunk by chunk.
     * Failures surface after the status line was sent.
     */
    record Stream(Writer writer) implements ResponseBody {}

    @FunctionalInterface
    interface Writer {
        void writeTo(OutputStream out) throws IOException;
    }
}
