package io.jamsession.client;

import io.jamsession.core.Headers;
import io.jamsession.core.Protocol;
import io.jamsession.json.spi.JsonCodec;
import io.jamsession.json.spi.JsonException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class JdkJamSessionClient implements JamSessionClient {

    private static final Map<String, List<String>> JSON_HEADERS = Map.of(
            Protocol.H_CONTENT_TYPE, List.of(Protocol.CT_JSON),
            "Accept", List.of(Protocol.CT_JSON));

    private final JamSessionTransport transport;
    private final JsonCodec codec;
    private final String root;
    private final String sessionId;
    private final Duration timeout;

    JdkJamSessionClient(JamSessionTransport transport, JsonCodec codec, URI baseUrl, String basePath,
                        String sessionId, Duration timeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.root = trimSlash(baseUrl.toString()) + normalizePath(basePath);
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.timeout = timeout;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public VoteResult toggleVote(String jamId, String songId, String attendeeId)
            throws IOException, InterruptedException {
        Map<String, Object> body = identity(attendeeId);
        body.put(Protocol.F_SONG_ID, songId);
        return read(send("POST", url(jamId, Protocol.PATH_VOTE), body), VoteResult.class);
    }

    @Override
    public VoteStatus voteStatus(String jamId, String songId, String attendeeId)
            throws IOException, InterruptedException {
        Map<String, Object> query = identity(attendeeId);
        query.put(Protocol.F_SONG_ID, songId);
        return read(get(url(jamId, Protocol.PATH_VOTE_STATUS), query), VoteStatus.class);
    }

    @Override
    public List<String> votedSongIds(String jamId, String attendeeId) throws IOException, InterruptedException {
        Map<String, Object> body = readObject(get(url(jamId, Protocol.PATH_VOTES), identity(attendeeId)));
        List<String> out = new ArrayList<>();
        if (body.get("songIds") instanceof List<?> ids) {
            for (Object id : ids) {
                out.add(String.valueOf(id));
            }
        }
        return out;
    }

    @Override
    public Performance registerPerformance(String jamId, String songId, String attendeeId, String instrument)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_SONG_ID, songId);
        body.put(Protocol.F_ATTENDEE_ID, attendeeId);
        if (instrument != null) body.put(Protocol.F_INSTRUMENT, instrument);
        return read(send("POST", url(jamId, Protocol.PATH_PERFORM), body), Performance.class);
    }

    @Override
    public int unregisterPerformance(String jamId, String songId, String attendeeId)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_SONG_ID, songId);
        body.put(Protocol.F_ATTENDEE_ID, attendeeId);
        Object count = readObject(send("DELETE", url(jamId, Protocol.PATH_PERFORM), body))
                .get(Protocol.E_ACTIVE_COUNT);
        return count instanceof Number n ? n.intValue() : 0;
    }

    @Override
    public List<Performance> performers(String jamId, String songId) throws IOException, InterruptedException {
        Map<String, Object> query = new LinkedHashMap<>();
        if (songId != null) query.put(Protocol.F_SONG_ID, songId);
        return Arrays.asList(read(get(url(jamId, Protocol.PATH_PERFORMERS), query), Performance[].class));
    }

    @Override
    public List<QueueEntry> addSong(String jamId, String songId) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_SONG_ID, songId);
        return read(send("POST", url(jamId, Protocol.PATH_SONGS), body), QueueState.class).queue();
    }

    @Override
    public QueueState queue(String jamId) throws IOException, InterruptedException {
        return read(get(url(jamId, Protocol.PATH_SONGS), Map.of()), QueueState.class);
    }

    @Override
    public JamInfo jamBySlug(String slug) throws IOException, InterruptedException {
        return read(get(url(Protocol.PATH_BY_SLUG, Objects.requireNonNull(slug, "slug")), Map.of()), JamInfo.class);
    }

    @Override
    public void markPlayed(String jamId, String songId) throws IOException, InterruptedException {
        send("POST", url(jamId, Protocol.PATH_SONGS, songId, Protocol.PATH_PLAY), null);
    }

    @Override
    public AttendeeRegistration registerAttendee(String jamId, String name) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_NAME, name);
        body.put(Protocol.F_SESSION_ID, sessionId);
        return read(send("POST", url(jamId, Protocol.PATH_ATTENDEES), body), AttendeeRegistration.class);
    }

    @Override
    public List<Attendee> attendees(String jamId) throws IOException, InterruptedException {
        Map<String, Object> query = Map.of(Protocol.F_SESSION_ID, sessionId);
        return Arrays.asList(read(get(url(jamId, Protocol.PATH_ATTENDEES), query), Attendee[].class));
    }

    @Override
    public String updateStatus(String jamId, String status) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_STATUS, status);
        Object now = readObject(send("PUT", url(jamId, Protocol.PATH_STATUS), body)).get(Protocol.E_STATUS);
        return now == null ? null : now.toString();
    }

    private Map<String, Object> identity(String attendeeId) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(Protocol.F_SESSION_ID, sessionId);
        if (attendeeId != null) out.put(Protocol.F_ATTENDEE_ID, attendeeId);
        return out;
    }

    private TransportResponse get(String url, Map<String, Object> query) throws IOException, InterruptedException {
        return execute(new TransportRequest("GET", URI.create(url + queryString(query)), Map.of(), null, timeout));
    }

    private TransportResponse send(String method, String url, Map<String, Object> body)
            throws IOException, InterruptedException {
        byte[] bytes = null;
        if (body != null) {
            try {
                bytes = codec.writeBytes(body);
            } catch (JsonException e) {
                throw new IOException("Failed to encode request body", e);
            }
        }
        return execute(new TransportRequest(method, URI.create(url), JSON_HEADERS, bytes, timeout));
    }

    private TransportResponse execute(TransportRequest request) throws IOException, InterruptedException {
        TransportResponse resp = transport.send(request);
        if (resp.status() >= 200 && resp.status() < 300) {
            return resp;
        }
        throw toException(resp);
    }

    private JamSessionClientException toException(TransportResponse resp) {
        String code = "http_" + resp.status();
        String message = "HTTP " + resp.status();
        if (resp.body() != null && resp.body().length > 0) {
            try {
                Map<String, Object> error = codec.readObject(new String(resp.body(), StandardCharsets.UTF_8));
                if (error.get(Protocol.F_ERROR) != null) code = error.get(Protocol.F_ERROR).toString();
                if (error.get(Protocol.F_MESSAGE) != null) message = error.get(Protocol.F_MESSAGE).toString();
            } catch (JsonException e) {
                message = message + ": " + new String(resp.body(), StandardCharsets.UTF_8);
            }
        }
        return new JamSessionClientException(resp.status(), code, message, retryAfter(resp));
    }

    private static Duration retryAfter(TransportResponse resp) {
        String v = Headers.firstValue(resp.headers(), Protocol.H_RETRY_AFTER).orElse(null);
        if (v == null || v.isBlank()) return null;
        try {
            return Duration.ofSeconds(Long.parseLong(v.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private <T> T read(TransportResponse resp, Class<T> type) throws IOException {
        try {
            return codec.readValue(new String(resp.body(), StandardCharsets.UTF_8), type);
        } catch (JsonException e) {
            throw new IOException("Malformed " + type.getSimpleName() + " response", e);
        }
    }

    private Map<String, Object> readObject(TransportResponse resp) throws IOException {
        try {
            return codec.readObject(new String(resp.body(), StandardCharsets.UTF_8));
        } catch (JsonException e) {
            throw new IOException("Malformed response", e);
        }
    }

    private String url(String jamId, String... segments) {
        StringBuilder sb = new StringBuilder(root).append('/').append(encode(Objects.requireNonNull(jamId, "jamId")));
        for (String segment : segments) {
            sb.append('/').append(encode(Objects.requireNonNull(segment, "path segment")));
        }
        return sb.toString();
    }

    private static String queryString(Map<String, Object> query) {
        if (query.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> e : query.entrySet()) {
            sb.append(sb.length() == 0 ? '?' : '&')
                    .append(encode(e.getKey()))
                    .append('=')
                    .append(encode(String.valueOf(e.getValue())));
        }
        return sb.toString();
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String trimSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String normalizePath(String path) {
        if (path.isEmpty() || path.equals("/")) return "";
        return trimSlash(path.startsWith("/") ? path : "/" + path);
    }
}
