package io.jamsession.client;

import io.jamsession.core.JamEvent;
import io.jamsession.core.JamEventType;
import io.jamsession.core.Protocol;
import io.jamsession.json.spi.JsonCodec;
import io.jamsession.json.spi.JsonCodecs;
import io.jamsession.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live feed client for {@code /ws/{jamId}} on top of {@link java.net.http.WebSocket}.
 *
 * <p>Each {@link JamFeed} reconnects after an abnormal close or a failed handshake, waiting as dictated by
 * the {@link ReconnectPolicy}, and calls {@link JamFeedListener#onResync()} once connected again. A normal
 * close (1000) ends the feed.
 *
 * <p>Closing a feed sends a normal close and aborts the socket if the server has not completed the
 * closing handshake within {@link #CLOSE_GRACE}. Closing the client closes every feed it opened.
 */
public final class JamFeedClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JamFeedClient.class);

    static final Duration CLOSE_GRACE = Duration.ofSeconds(1);

    private final HttpClient http;
    private final JsonCodec codec;
    private final URI baseUrl;
    private final ReconnectPolicy policy;
    private final Duration connectTimeout;
    private final ScheduledExecutorService scheduler;
    private final Set<LiveFeed> feeds = ConcurrentHashMap.newKeySet();

    private JamFeedClient(Builder b) {
        this.http = b.http != null ? b.http : HttpClient.newHttpClient();
        this.codec = b.codec != null ? b.codec : JsonCodecs.load();
        this.baseUrl = toWebSocketUri(Objects.requireNonNull(b.baseUrl, "baseUrl"));
        this.policy = b.policy;
        this.connectTimeout = b.connectTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jamsession-feed-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param baseUrl feed root including the WebSocket path, for example {@code ws://localhost:8080/ws};
     *                {@code http} and {@code https} are mapped to {@code ws} and {@code wss}
     */
    public static Builder builder(URI baseUrl) {
        return new Builder(baseUrl);
    }

    /**
     * Opens the feed of a jam. Connection happens in the background; failures are reported through the
     * listener.
     */
    public JamFeed connect(String jamId, JamFeedListener listener) {
        LiveFeed feed = new LiveFeed(Objects.requireNonNull(jamId, "jamId"), Objects.requireNonNull(listener, "listener"));
        feeds.add(feed);
        feed.open();
        return feed;
    }

    /** Closes every feed opened by this client and stops pending reconnects. */
    @Override
    public void close() {
        for (LiveFeed feed : Set.copyOf(feeds)) {
            feed.close();
        }
        scheduler.shutdownNow();
    }

    int openFeeds() {
        return feeds.size();
    }

    private static void shutdown(WebSocket ws, String reason) {
        if (!ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, reason);
        }
        CompletableFuture.delayedExecutor(CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (!ws.isInputClosed()) {
                logger.debug("Server did not answer close, aborting socket");
                ws.abort();
            }
        });
    }

    /**
     * Decodes a {@code {event, data}} frame. Unknown event names and malformed frames yield empty.
     */
    Optional<JamEvent> decode(String jamId, String text) {
        Map<String, Object> frame;
        try {
            frame = codec.readObject(text);
        } catch (JsonException e) {
            logger.debug("Ignoring malformed frame on jam {}: {}", jamId, e.getMessage());
            return Optional.empty();
        }
        Object name = frame.get(Protocol.F_EVENT);
        Optional<JamEventType> type = JamEventType.fromWireName(name == null ? null : name.toString());
        if (type.isEmpty()) {
            logger.debug("Ignoring unknown event {} on jam {}", name, jamId);
            return Optional.empty();
        }
        Map<String, Object> data = null;
        if (frame.get(Protocol.F_DATA) instanceof Map<?, ?> raw) {
            data = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : raw.entrySet()) {
                data.put(String.valueOf(e.getKey()), e.getValue());
            }
        }
        return Optional.of(new JamEvent(jamId, type.get(), data));
    }

    private static URI toWebSocketUri(URI uri) {
        String scheme = uri.getScheme();
        String s = uri.toString();
        if ("http".equalsIgnoreCase(scheme)) {
            s = "ws" + s.substring(4);
        } else if ("https".equalsIgnoreCase(scheme)) {
            s = "wss" + s.substring(5);
        }
        return URI.create(s.endsWith("/") ? s.substring(0, s.length() - 1) : s);
    }

    private final class LiveFeed implements JamFeed, WebSocket.Listener {
        private final String jamId;
        private final JamFeedListener listener;
        private final URI uri;
        private final AtomicInteger attempts = new AtomicInteger();
        private final StringBuilder partial = new StringBuilder();
        private volatile WebSocket socket;
        private volatile boolean finished;

        LiveFeed(String jamId, JamFeedListener listener) {
            this.jamId = jamId;
            this.listener = listener;
            this.uri = URI.create(baseUrl + "/" + URLEncoder.encode(jamId, StandardCharsets.UTF_8).replace("+", "%20"));
        }

        void open() {
            if (finished) return;
            http.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, this)
                    .whenComplete((ws, error) -> {
                        if (error != null) {
                            lost(error);
                            return;
                        }
                        if (finished) {
                            shutdown(ws, "client closed");
                            return;
                        }
                        socket = ws;
                        attempts.set(0);
                        logger.debug("Feed connected to {}", uri);
                        deliver(listener::onResync);
                    });
        }

        private void lost(Throwable error) {
            socket = null;
            if (finished) return;
            int attempt = attempts.incrementAndGet();
            if (!policy.shouldRetry(attempt) || scheduler.isShutdown()) {
                finish();
                logger.warn("Giving up on feed for jam {} after {} reconnect attempts", jamId, attempt - 1, error);
                deliver(() -> listener.onGiveUp(error));
                return;
            }
            Duration delay = policy.delayFor(attempt);
            logger.info("Feed for jam {} lost ({}), reconnecting in {} ms (attempt {}/{})",
                    jamId, error.getMessage(), delay.toMillis(), attempt, policy.maxAttempts());
            scheduler.schedule(this::open, delay.toMillis(), TimeUnit.MILLISECONDS);
        }

        private void finish() {
            finished = true;
            feeds.remove(this);
        }

        private void deliver(Runnable callback) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.warn("Feed listener for jam {} failed", jamId, e);
            }
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                decode(jamId, text).ifPresent(event -> deliver(() -> listener.onEvent(event)));
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            socket = null;
            if (statusCode == WebSocket.NORMAL_CLOSURE || finished) {
                finish();
                deliver(() -> listener.onClosed(statusCode, reason));
            } else {
                lost(new IOException("Feed closed with status " + statusCode + (reason.isEmpty() ? "" : ": " + reason)));
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            lost(error);
        }

        @Override
        public String jamId() {
            return jamId;
        }

        @Override
        public boolean isConnected() {
            WebSocket ws = socket;
            return ws != null && !ws.isOutputClosed();
        }

        @Override
        public void ping() {
            WebSocket ws = socket;
            if (ws == null) return;
            try {
                ws.sendText(codec.writeString(Map.of(Protocol.F_TYPE, Protocol.TYPE_PING)), true);
            } catch (JsonException e) {
                throw new IllegalStateException("Failed to encode ping frame", e);
            }
        }

        @Override
        public void close() {
            finish();
            WebSocket ws = socket;
            socket = null;
            if (ws != null) {
                shutdown(ws, "client closed");
            }
        }
    }

    public static final class Builder {
        private final URI baseUrl;
        private HttpClient http;
        private JsonCodec codec;
        private ReconnectPolicy policy = ReconnectPolicy.defaults();
        private Duration connectTimeout = Duration.ofSeconds(10);

        private Builder(URI baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Builder httpClient(HttpClient http) {
            this.http = Objects.requireNonNull(http, "http");
            return this;
        }

        public Builder codec(JsonCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        public Builder reconnectPolicy(ReconnectPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public JamFeedClient build() {
            return new JamFeedClient(this);
        }
    }
}
