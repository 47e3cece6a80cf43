package io.jamsession.spring.webmvc;

import io.jamsession.core.Headers;
import io.jamsession.core.Protocol;
import io.jamsession.server.core.HttpMethod;
import io.jamsession.server.core.JamSessionHandler;
import io.jamsession.server.core.ResponseBody;
import io.jamsession.server.core.ServerRequest;
import io.jamsession.server.core.ServerResponse;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * HttpServlet adapter for {@link JamSessionHandler}.
 *
 * <p>Map it over the handler's base path, e.g. {@code /jams/*}. The client id used for rate limiting is
 * the first {@code X-Forwarded-For} entry, or the remote address.
 */
public final class JamSessionWebMvcServlet extends HttpServlet {

    private final transient JamSessionHandler handler;

    public JamSessionWebMvcServlet(JamSessionHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        Optional<HttpMethod> method = HttpMethod.parse(req.getMethod());
        if (method.isEmpty()) {
            resp.setStatus(405);
            resp.setHeader("Allow", "GET, POST, PUT, DELETE");
            return;
        }

        ServerResponse out = handler.handle(toServerRequest(req, method.get()), clientId(req));

        resp.setStatus(out.status());
        out.headers().forEach((name, values) -> values.forEach(v -> resp.addHeader(name, v)));
        if (out.body() instanceof ResponseBody.Bytes bytes) {
            resp.setContentLength(bytes.bytes().length);
            resp.getOutputStream().write(bytes.bytes());
        }
    }

    static ServerRequest toServerRequest(HttpServletRequest req, HttpMethod method) throws IOException {
        String path = req.getRequestURI().substring(req.getContextPath().length());
        String query = req.getQueryString();
        URI uri = URI.create(req.getScheme() + "://" + req.getServerName() + ":" + req.getServerPort()
                + path + (query == null ? "" : "?" + query));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }
        return new ServerRequest(method, uri, headers, req.getInputStream());
    }

    static String clientId(HttpServletRequest req) {
        return Headers.forwardedClient(req.getHeader(Protocol.H_X_FORWARDED_FOR)).orElse(req.getRemoteAddr());
    }
}
