package io.jamsession.spring.webmvc;

import io.jamsession.core.JamEvent;
import io.jamsession.core.JamEventType;
import io.jamsession.core.JamSessionException;
import io.jamsession.core.Protocol;
import io.jamsession.json.spi.JsonCodec;
import io.jamsession.json.spi.JsonException;
import io.jamsession.server.core.BroadcastHub;
import io.jamsession.server.core.JamSessionService;
import io.jamsession.server.core.LiveConnection;
import io.jamsession.server.core.SubscriptionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Bridges WebSocket sessions on {@code /ws/{jamId}} into the {@link BroadcastHub}.
 *
 * <p>A session is subscribed to its jam when it opens and unsubscribed when it closes or fails. The only
 * inbound frame understood is {@code {"type":"ping"}}, answered with a {@code pong} event; mutations go
 * over HTTP.
 */
public class JamWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(JamWebSocketHandler.class);

    public static final int DEFAULT_SEND_TIME_LIMIT_MS = 10_000;
    public static final int DEFAULT_BUFFER_SIZE_LIMIT = 512 * 1024;

    static final String HANDLE_ATTRIBUTE = JamWebSocketHandler.class.getName() + ".subscription";

    private final JamSessionService service;
    private final BroadcastHub hub;
    private final JsonCodec codec;

    public JamWebSocketHandler(JamSessionService service, JsonCodec codec) {
        this.service = Objects.requireNonNull(service, "service");
        this.hub = service.hub();
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String jamId = jamIdOf(session.getUri());
        if (jamId == null) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Missing jam id"));
            return;
        }
        try {
            service.identity().requireJam(jamId);
        } catch (JamSessionException.UnknownJam e) {
            logger.debug("Rejecting live connection {} for unknown jam {}", session.getId(), jamId);
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown jam"));
            return;
        } catch (JamSessionException.StoreUnavailable e) {
            logger.warn("Cannot accept live connection {} for jam {}", session.getId(), jamId, e);
            session.close(CloseStatus.SERVER_ERROR);
            return;
        }

        LiveConnection connection = new WebSocketLiveConnection(
                new ConcurrentWebSocketSessionDecorator(session, DEFAULT_SEND_TIME_LIMIT_MS, DEFAULT_BUFFER_SIZE_LIMIT));
        SubscriptionHandle handle = hub.subscribe(jamId, connection);
        session.getAttributes().put(HANDLE_ATTRIBUTE, handle);
        logger.debug("WebSocket session {} subscribed to jam {}", session.getId(), jamId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SubscriptionHandle handle = handleOf(session);
        if (handle == null) return;
        Map<String, Object> frame;
        try {
            frame = codec.readObject(message.getPayload());
        } catch (JsonException e) {
            logger.debug("Ignoring malformed frame from {}", session.getId());
            return;
        }
        if (Protocol.TYPE_PING.equals(frame.get(Protocol.F_TYPE))) {
            hub.sendTo(handle.connection(), JamEvent.builder(handle.jamId(), JamEventType.PONG).build());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        logger.debug("Transport error on live connection {}", session.getId(), exception);
        release(session);
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SubscriptionHandle handle = release(session);
        if (handle != null) {
            logger.debug("WebSocket session {} closed with {}", session.getId(), status.getCode());
        }
    }

    private static SubscriptionHandle handleOf(WebSocketSession session) {
        return (SubscriptionHandle) session.getAttributes().get(HANDLE_ATTRIBUTE);
    }

    private static SubscriptionHandle release(WebSocketSession session) {
        SubscriptionHandle handle = (SubscriptionHandle) session.getAttributes().remove(HANDLE_ATTRIBUTE);
        if (handle != null) {
            handle.unsubscribe();
        }
        return handle;
    }

    /**
     * Last non-empty path segment, e.g. {@code /ws/abc} gives {@code abc}.
     */
    static String jamIdOf(URI uri) {
        if (uri == null || uri.getRawPath() == null) return null;
        String[] segments = uri.getRawPath().split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isEmpty()) {
                String id = URLDecoder.decode(segments[i], StandardCharsets.UTF_8);
                return id.equals(Protocol.PATH_WS) ? null : id;
            }
        }
        return null;
    }
}
