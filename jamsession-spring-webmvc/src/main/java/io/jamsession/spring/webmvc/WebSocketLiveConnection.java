package io.jamsession.spring.webmvc;

import io.jamsession.server.core.LiveConnection;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link LiveConnection} over a Spring {@link WebSocketSession}.
 *
 * <p>Hub fan-out and keep-alive replies may write from different threads, so the session passed in should
 * be a {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}.
 */
final class WebSocketLiveConnection implements LiveConnection {

    private final WebSocketSession session;

    WebSocketLiveConnection(WebSocketSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public String toString() {
        return "WebSocketLiveConnection[" + session.getId() + "]";
    }
}
