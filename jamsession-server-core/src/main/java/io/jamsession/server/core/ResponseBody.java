package io.jamsession.server.core;

import java.nio.charset.StandardCharsets;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes {

    record Empty() implements ResponseBody {}

    /** Encoded JSON document. */
    record Bytes(byte[] bytes) implements ResponseBody {
        public String asString() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}
