package io.jamsession.server.core;

import io.jamsession.core.Headers;
import io.jamsession.core.Protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Response produced by {@link JamSessionHandler}; adapters copy status, headers and body verbatim.
 *
 * <p>Every jam session response is JSON and must never be cached, since clients refetch state after each
 * push event.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body == null ? new ResponseBody.Empty() : body;
    }

    static ServerResponse json(int status, byte[] encoded) {
        ResponseBody body = encoded == null ? new ResponseBody.Empty() : new ResponseBody.Bytes(encoded);
        return new ServerResponse(status, body)
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON_UTF8)
                .header(Protocol.H_CACHE_CONTROL, Protocol.NO_STORE);
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /** Machine-readable error code of a failed request, from {@code X-Error}. */
    public Optional<String> errorCode() {
        return firstHeader(Protocol.H_X_ERROR);
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    public Optional<String> firstHeader(String name) {
        return Headers.firstValue(headers, name);
    }
}
