package io.jamsession.client;

import io.jamsession.core.Protocol;
import io.jamsession.json.spi.JsonCodec;
import io.jamsession.json.spi.JsonCodecs;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

public final class JamSessionClientBuilder {
    private URI baseUrl;
    private String basePath = "/" + Protocol.PATH_JAMS;
    private String sessionId;
    private Duration timeout = Duration.ofSeconds(10);
    private JamSessionTransport transport;
    private JsonCodec codec;

    JamSessionClientBuilder() {}

    /** Server root, for example {@code http://localhost:8080}. */
    public JamSessionClientBuilder baseUrl(URI baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        return this;
    }

    public JamSessionClientBuilder basePath(String basePath) {
        this.basePath = Objects.requireNonNull(basePath, "basePath");
        return this;
    }

    /** Session token to reuse; a random one is generated when not set. */
    public JamSessionClientBuilder sessionId(String sessionId) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        return this;
    }

    public JamSessionClientBuilder timeout(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        return this;
    }

    public JamSessionClientBuilder transport(JamSessionTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public JamSessionClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public JamSessionClientBuilder codec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    public JamSessionClient build() {
        if (baseUrl == null) {
            throw new IllegalStateException("baseUrl is required");
        }
        JamSessionTransport resolved = transport;
        if (resolved == null) {
            resolved = new JdkHttpTransport(HttpClient.newHttpClient());
        }
        return new JdkJamSessionClient(
                resolved,
                codec != null ? codec : JsonCodecs.load(),
                baseUrl,
                basePath,
                sessionId != null ? sessionId : UUID.randomUUID().toString(),
                timeout);
    }
}
