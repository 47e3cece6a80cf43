package io.jamsession.client;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;

/**
 * Transport implementation using {@link java.net.http.HttpClient}.
 */
public final class JdkHttpTransport implements JamSessionTransport {
    private final HttpClient http;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     */
    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = http.send(buildRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        byte[] body = resp.body() == null ? new byte[0] : resp.body();
        return new TransportResponse(resp.statusCode(), resp.headers().map(), body);
    }

    private static HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.BodyPublisher body = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .method(request.method(), body);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        for (Map.Entry<String, ? extends Iterable<String>> entry : request.headers().entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            for (String value : entry.getValue()) {
                if (value != null) {
                    builder.header(entry.getKey(), value);
                }
            }
        }

        return builder.build();
    }
}
