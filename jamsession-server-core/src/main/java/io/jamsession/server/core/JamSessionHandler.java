package io.jamsession.server.core;

import io.jamsession.core.JamSessionException;
import io.jamsession.core.Protocol;
import io.jamsession.json.spi.JsonCodec;
import io.jamsession.json.spi.JsonCodecs;
import io.jamsession.json.spi.JsonException;
import io.jamsession.server.spi.BodySizeLimiter;
import io.jamsession.server.spi.JamStatus;
import io.jamsession.server.spi.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Framework-neutral HTTP handler for the jam session API under {@code /jams/{jamId}/...}.
 *
 * <p>Routing, body parsing and error mapping live here; the work is delegated to
 * {@link JamSessionService}. Mutations run on an executor and fail with 503 {@code mutation_timeout}
 * if they do not finish in time.
 *
 * <pre>{@code
 * JamSessionHandler handler = JamSessionHandler.builder(service)
 *     .maxBodySize(64 * 1024)
 *     .mutationTimeout(Duration.ofSeconds(10))
 *     .rateLimiter(new TokenBucketRateLimiter())
 *     .build();
 * }</pre>
 */
public final class JamSessionHandler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JamSessionHandler.class);

    public static final long DEFAULT_MAX_BODY_SIZE = 64 * 1024;
    public static final Duration DEFAULT_MUTATION_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_BASE_PATH = "/" + Protocol.PATH_JAMS;

    private static final String ROUTE_PLAY = Protocol.PATH_SONGS + "/" + Protocol.PATH_PLAY;
    private static final String ROUTE_BY_SLUG = Protocol.PATH_BY_SLUG;

    private static final Map<String, Set<HttpMethod>> ROUTES = Map.of(
            Protocol.PATH_VOTE, EnumSet.of(HttpMethod.POST),
            Protocol.PATH_VOTE_STATUS, EnumSet.of(HttpMethod.GET),
            Protocol.PATH_VOTES, EnumSet.of(HttpMethod.GET),
            Protocol.PATH_PERFORM, EnumSet.of(HttpMethod.POST, HttpMethod.DELETE),
            Protocol.PATH_PERFORMERS, EnumSet.of(HttpMethod.GET),
            Protocol.PATH_SONGS, EnumSet.of(HttpMethod.GET, HttpMethod.POST),
            ROUTE_PLAY, EnumSet.of(HttpMethod.POST),
            Protocol.PATH_ATTENDEES, EnumSet.of(HttpMethod.GET, HttpMethod.POST),
            Protocol.PATH_STATUS, EnumSet.of(HttpMethod.PUT),
            ROUTE_BY_SLUG, EnumSet.of(HttpMethod.GET));

    private final JamSessionService service;
    private final JsonCodec codec;
    private final String basePath;
    private final RateLimiter rateLimiter;
    private final long maxBodySize;
    private final Duration mutationTimeout;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public static Builder builder(JamSessionService service) {
        return new Builder(service);
    }

    private JamSessionHandler(Builder builder) {
        this.service = builder.service;
        this.codec = builder.codec != null ? builder.codec : JsonCodecs.load();
        this.basePath = normalizeBasePath(builder.basePath);
        this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : RateLimiter.permitAll();
        this.maxBodySize = builder.maxBodySize > 0 ? builder.maxBodySize : DEFAULT_MAX_BODY_SIZE;
        this.mutationTimeout = builder.mutationTimeout != null ? builder.mutationTimeout : DEFAULT_MUTATION_TIMEOUT;
        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null ? builder.executor : VirtualThreads.newExecutor("jamsession-mutation");
    }

    /**
     * Builder for {@link JamSessionHandler}.
     */
    public static final class Builder {
        private final JamSessionService service;
        private JsonCodec codec;
        private String basePath = DEFAULT_BASE_PATH;
        private RateLimiter rateLimiter;
        private long maxBodySize = DEFAULT_MAX_BODY_SIZE;
        private Duration mutationTimeout;
        private ExecutorService executor;

        private Builder(JamSessionService service) {
            this.service = Objects.requireNonNull(service, "service");
        }

        /** Sets the JSON codec. Default: the first one found through {@link JsonCodecs#load()}. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Path prefix the jam routes live under. Default: {@code /jams}. */
        public Builder basePath(String basePath) {
            this.basePath = basePath;
            return this;
        }

        /** Sets the rate limiter. Default: {@link RateLimiter#permitAll()} (disabled). */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        /** Maximum request body size in bytes. Default: 64 KiB. */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /** How long a mutation may run before the caller gets 503. Default: 10 seconds. */
        public Builder mutationTimeout(Duration mutationTimeout) {
            if (mutationTimeout != null && (mutationTimeout.isNegative() || mutationTimeout.isZero())) {
                throw new IllegalArgumentException("mutationTimeout must be positive");
            }
            this.mutationTimeout = mutationTimeout;
            return this;
        }

        /** Executor for mutations. Default: a virtual-thread (or cached) executor owned by the handler. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public JamSessionHandler build() {
            return new JamSessionHandler(this);
        }
    }

    public String basePath() {
        return basePath;
    }

    public ServerResponse handle(ServerRequest req) {
        return handle(req, null);
    }

    /**
     * Handle a request with optional client identifier for rate limiting.
     *
     * @param clientId e.g. remote address; null shares one anonymous bucket
     */
    public ServerResponse handle(ServerRequest req, String clientId) {
        Target target = Target.parse(basePath, req.rawPath());
        if (target == null) {
            return error(404, "not_found", "No such resource: " + req.uri().getPath());
        }

        RateLimiter.Result rate = rateLimiter.tryAcquire(target.jamId(), clientId);
        if (rate instanceof RateLimiter.Result.Rejected rejected) {
            ServerResponse resp = error(429, "rate_limit_exceeded", "Too many requests, slow down");
            rejected.retryAfter().ifPresent(d ->
                    resp.header(Protocol.H_RETRY_AFTER, Long.toString(Math.max(1, (d.toMillis() + 999) / 1000))));
            return resp;
        }

        Set<HttpMethod> allowed = ROUTES.get(target.route());
        if (allowed == null) {
            return error(404, "not_found", "No such resource: " + req.uri().getPath());
        }
        if (!allowed.contains(req.method())) {
            StringJoiner allow = new StringJoiner(", ");
            allowed.forEach(m -> allow.add(m.name()));
            return error(405, "method_not_allowed", req.method() + " is not supported here")
                    .header("Allow", allow.toString());
        }

        try {
            Input input = Input.read(req, codec, maxBodySize);
            if (!req.method().isMutation()) {
                return dispatch(req.method(), target, input);
            }
            return runMutation(req.method(), target, input);
        } catch (Exception e) {
            return toResponse(e);
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private ServerResponse runMutation(HttpMethod method, Target target, Input input) throws Exception {
        Future<ServerResponse> future = executor.submit(() -> dispatch(method, target, input));
        try {
            return future.get(mutationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("{} {} on jam {} timed out after {}", method, target.route(), target.jamId(), mutationTimeout);
            return error(503, "mutation_timeout", "The request took too long, please retry");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return error(503, "mutation_timeout", "The request was interrupted, please retry");
        }
    }

    private ServerResponse dispatch(HttpMethod method, Target target, Input in) throws JsonException {
        String jamId = target.jamId();
        logger.debug("{} {} on jam {}", method, target.route(), jamId);
        switch (target.route()) {
            case Protocol.PATH_VOTE:
                return json(200, service.toggleVote(jamId, in.require(Protocol.F_SONG_ID),
                        in.get(Protocol.F_SESSION_ID), in.get(Protocol.F_ATTENDEE_ID)));
            case Protocol.PATH_VOTE_STATUS:
                return json(200, service.voteStatus(jamId, in.require(Protocol.F_SONG_ID),
                        in.get(Protocol.F_SESSION_ID), in.get(Protocol.F_ATTENDEE_ID)));
            case Protocol.PATH_VOTES: {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("songIds", service.votedSongIds(jamId, in.get(Protocol.F_SESSION_ID), in.get(Protocol.F_ATTENDEE_ID)));
                return json(200, body);
            }
            case Protocol.PATH_PERFORM:
                if (method == HttpMethod.DELETE) {
                    return json(200, service.unregisterPerformance(jamId, in.require(Protocol.F_SONG_ID),
                            in.require(Protocol.F_ATTENDEE_ID)));
                }
                return json(201, service.registerPerformance(jamId, in.require(Protocol.F_SONG_ID),
                        in.require(Protocol.F_ATTENDEE_ID), in.get(Protocol.F_INSTRUMENT)));
            case Protocol.PATH_PERFORMERS:
                return json(200, service.performers(jamId, in.get(Protocol.F_SONG_ID)));
            case Protocol.PATH_SONGS:
                if (method == HttpMethod.POST) {
                    return json(201, service.addSong(jamId, in.require(Protocol.F_SONG_ID)));
                }
                return json(200, service.queue(jamId));
            case ROUTE_PLAY:
                return json(200, service.markPlayed(jamId, target.subject()));
            case ROUTE_BY_SLUG:
                return json(200, service.jamBySlug(target.subject()));
            case Protocol.PATH_ATTENDEES:
                if (method == HttpMethod.POST) {
                    AttendeeRegistration reg = service.registerAttendee(jamId, in.require(Protocol.F_NAME),
                            in.get(Protocol.F_SESSION_ID));
                    return json(reg.created() ? 201 : 200, reg);
                }
                return json(200, service.attendees(jamId, in.get(Protocol.F_SESSION_ID)));
            case Protocol.PATH_STATUS: {
                String raw = in.require(Protocol.F_STATUS);
                JamStatus status = JamStatus.fromWireName(raw)
                        .orElseThrow(() -> new JamSessionException.InvalidRequest("Unknown jam status: " + raw));
                return json(200, service.updateStatus(jamId, status));
            }
            default:
                return error(404, "not_found", "No such resource");
        }
    }

    private ServerResponse toResponse(Exception e) {
        if (e instanceof JamSessionException.StoreUnavailable su) {
            logger.error("Store unavailable", su);
            return error(su.httpStatus(), su.code(), "The jam store is temporarily unavailable, please retry");
        }
        if (e instanceof JamSessionException jse) {
            logger.debug("Rejected request: {} {}", jse.code(), jse.getMessage());
            return error(jse.httpStatus(), jse.code(), jse.getMessage());
        }
        if (e instanceof BodySizeLimiter.PayloadTooLargeException ptle) {
            return error(413, "payload_too_large", ptle.getMessage())
                    .header(Protocol.H_X_MAX_SIZE, Long.toString(ptle.maxBytes()));
        }
        if (e instanceof JsonException) {
            return error(400, "invalid_json", "Request body must be a JSON object");
        }
        if (e instanceof IllegalArgumentException) {
            return error(400, "invalid_request", e.getMessage());
        }
        logger.error("Unexpected failure handling request", e);
        return error(500, "internal_error", "Internal error");
    }

    private ServerResponse json(int status, Object body) throws JsonException {
        return ServerResponse.json(status, codec.writeBytes(body));
    }

    private ServerResponse error(int status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_ERROR, code);
        body.put(Protocol.F_MESSAGE, message);
        byte[] encoded = null;
        try {
            encoded = codec.writeBytes(body);
        } catch (JsonException e) {
            logger.warn("Cannot encode error body for {}", code, e);
        }
        return ServerResponse.json(status, encoded).header(Protocol.H_X_ERROR, code);
    }

    private static String normalizeBasePath(String basePath) {
        if (basePath == null || basePath.isBlank() || basePath.equals("/")) return "";
        String p = basePath.startsWith("/") ? basePath : "/" + basePath;
        return p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
    }

    /**
     * Jam id, route key and optional song id or slug taken from the request path. Slug lookups carry no
     * jam id.
     */
    private record Target(String jamId, String route, String subject) {

        static Target parse(String basePath, String rawPath) {
            if (rawPath == null || !rawPath.startsWith(basePath + "/")) return null;
            List<String> segments = new ArrayList<>();
            for (String s : rawPath.substring(basePath.length() + 1).split("/")) {
                if (!s.isEmpty()) segments.add(URLDecoder.decode(s, StandardCharsets.UTF_8));
            }
            if (segments.size() == 2 && segments.get(0).equals(Protocol.PATH_BY_SLUG)) {
                return new Target(null, ROUTE_BY_SLUG, segments.get(1));
            }
            if (segments.size() == 2 && !segments.get(1).equals(ROUTE_BY_SLUG)) {
                return new Target(segments.get(0), segments.get(1), null);
            }
            if (segments.size() == 4 && segments.get(1).equals(Protocol.PATH_SONGS)
                    && segments.get(3).equals(Protocol.PATH_PLAY)) {
                return new Target(segments.get(0), ROUTE_PLAY, segments.get(2));
            }
            return null;
        }
    }

    /**
     * Request fields from the JSON body, falling back to query parameters.
     */
    private static final class Input {
        private final Map<String, Object> body;
        private final Map<String, String> query;

        private Input(Map<String, Object> body, Map<String, String> query) {
            this.body = body;
            this.query = query;
        }

        static Input read(ServerRequest req, JsonCodec codec, long maxBodySize) throws Exception {
            Map<String, String> query = req.query();
            if (!req.carriesFields()) {
                return new Input(Map.of(), query);
            }
            byte[] bytes = BodySizeLimiter.readAll(req.body(), maxBodySize);
            String text = new String(bytes, StandardCharsets.UTF_8);
            if (text.isBlank()) {
                return new Input(Map.of(), query);
            }
            return new Input(codec.readObject(text), query);
        }

        String get(String field) {
            Object v = body.get(field);
            if (v == null) v = query.get(field);
            if (v == null) return null;
            if (v instanceof String s) return s.isBlank() ? null : s.trim();
            if (v instanceof Number || v instanceof Boolean) return v.toString();
            throw new JamSessionException.InvalidRequest(field + " must be a string");
        }

        String require(String field) {
            String v = get(field);
            if (v == null) throw new JamSessionException.InvalidRequest(field + " is required");
            return v;
        }
    }
}
