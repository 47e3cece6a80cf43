package io.jamsession.client;

import io.jamsession.core.JamEvent;
import io.jamsession.core.JamEventType;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class JamFeedClientTest {

    private static final ReconnectPolicy FAST = new ReconnectPolicy(Duration.ofMillis(10), 2.0, Duration.ofMillis(50), 2);

    private MockWebServer server;
    private JamFeedClient feeds;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        feeds = JamFeedClient.builder(server.url("/ws").uri())
                .reconnectPolicy(FAST)
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        feeds.close();
        server.shutdown();
    }

    private static MockResponse sending(String frame) {
        return new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.send(frame);
            }
        });
    }

    private static MockResponse closingWith(int code) {
        return new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.close(code, "bye");
            }
        });
    }

    @Test
    void deliversEventsAfterResync() throws Exception {
        server.enqueue(sending("{\"event\":\"vote_update\",\"data\":{\"songId\":\"s1\",\"voteCount\":3}}"));
        RecordingListener listener = new RecordingListener();

        try (JamFeed feed = feeds.connect("jam1", listener)) {
            JamEvent event = listener.events.poll(2, TimeUnit.SECONDS);

            assertThat(event).isNotNull();
            assertThat(event.jamId()).isEqualTo("jam1");
            assertThat(event.type()).isEqualTo(JamEventType.VOTE_UPDATE);
            assertThat(event.data()).containsEntry("songId", "s1").containsEntry("voteCount", 3);
            assertThat(listener.resynced.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(feed.jamId()).isEqualTo("jam1");
        }
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/ws/jam1");
    }

    @Test
    void pingIsAnsweredWithPong() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onMessage(WebSocket webSocket, String text) {
                if (text.contains("\"ping\"")) {
                    webSocket.send("{\"event\":\"pong\",\"data\":{}}");
                }
            }
        }));
        RecordingListener listener = new RecordingListener();

        try (JamFeed feed = feeds.connect("jam1", listener)) {
            assertThat(listener.resynced.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(feed.isConnected()).isTrue();
            feed.ping();

            JamEvent event = listener.events.poll(2, TimeUnit.SECONDS);
            assertThat(event).isNotNull();
            assertThat(event.type()).isEqualTo(JamEventType.PONG);
        }
    }

    @Test
    void reconnectsAfterFailedHandshakeAndResyncs() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(sending("{\"event\":\"song_added\",\"data\":{\"songId\":\"s2\"}}"));
        RecordingListener listener = new RecordingListener();

        try (JamFeed ignored = feeds.connect("jam1", listener)) {
            JamEvent event = listener.events.poll(2, TimeUnit.SECONDS);

            assertThat(event).isNotNull();
            assertThat(event.type()).isEqualTo(JamEventType.SONG_ADDED);
            assertThat(listener.awaitResyncs(1)).isTrue();
            assertThat(server.getRequestCount()).isEqualTo(2);
        }
    }

    @Test
    void abnormalCloseTriggersReconnect() throws Exception {
        server.enqueue(closingWith(1011));
        server.enqueue(sending("{\"event\":\"jam_status\",\"data\":{\"status\":\"paused\"}}"));
        RecordingListener listener = new RecordingListener();

        try (JamFeed ignored = feeds.connect("jam1", listener)) {
            JamEvent event = listener.events.poll(2, TimeUnit.SECONDS);

            assertThat(event).isNotNull();
            assertThat(event.type()).isEqualTo(JamEventType.JAM_STATUS);
            assertThat(listener.awaitResyncs(2)).isTrue();
        }
    }

    @Test
    void normalCloseDoesNotReconnect() throws Exception {
        server.enqueue(closingWith(1000));
        RecordingListener listener = new RecordingListener();

        feeds.connect("jam1", listener);

        assertThat(listener.closed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.closeCode.get()).isEqualTo(1000);
        Thread.sleep(200);
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(listener.gaveUp.getCount()).isEqualTo(1);
    }

    @Test
    void givesUpAfterAttemptBudget() throws Exception {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }
        RecordingListener listener = new RecordingListener();

        feeds.connect("jam1", listener);

        assertThat(listener.gaveUp.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.lastError.get()).isNotNull();
        assertThat(listener.resyncCount.get()).isZero();
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void closingTheClientClosesItsOpenFeeds() throws Exception {
        CountDownLatch serverSawClose = new CountDownLatch(2);
        for (int i = 0; i < 2; i++) {
            server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
                @Override
                public void onClosing(WebSocket webSocket, int code, String reason) {
                    serverSawClose.countDown();
                    webSocket.close(code, null);
                }
            }));
        }
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();
        JamFeed a = feeds.connect("jam1", first);
        JamFeed b = feeds.connect("jam2", second);
        assertThat(first.resynced.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(second.resynced.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(feeds.openFeeds()).isEqualTo(2);

        feeds.close();

        assertThat(serverSawClose.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(a.isConnected()).isFalse();
        assertThat(b.isConnected()).isFalse();
        assertThat(feeds.openFeeds()).isZero();
    }

    @Test
    void closedFeedIsForgottenByTheClient() throws Exception {
        server.enqueue(sending("{\"event\":\"pong\",\"data\":{}}"));
        RecordingListener listener = new RecordingListener();

        JamFeed feed = feeds.connect("jam1", listener);
        assertThat(listener.resynced.await(2, TimeUnit.SECONDS)).isTrue();
        feed.close();

        assertThat(feed.isConnected()).isFalse();
        assertThat(feeds.openFeeds()).isZero();
    }

    @Test
    void decodeIgnoresMalformedAndUnknownFrames() {
        assertThat(feeds.decode("jam1", "{oops")).isEmpty();
        assertThat(feeds.decode("jam1", "{\"event\":\"confetti\",\"data\":{}}")).isEmpty();
        assertThat(feeds.decode("jam1", "{\"event\":\"attendee_registered\"}"))
                .hasValueSatisfying(e -> {
                    assertThat(e.type()).isEqualTo(JamEventType.ATTENDEE_REGISTERED);
                    assertThat(e.data()).isEmpty();
                });
    }

    private static final class RecordingListener implements JamFeedListener {
        final BlockingQueue<JamEvent> events = new LinkedBlockingQueue<>();
        final CountDownLatch resynced = new CountDownLatch(1);
        final AtomicInteger resyncCount = new AtomicInteger();
        final CountDownLatch closed = new CountDownLatch(1);
        final AtomicInteger closeCode = new AtomicInteger();
        final CountDownLatch gaveUp = new CountDownLatch(1);
        final AtomicReference<Throwable> lastError = new AtomicReference<>();

        boolean awaitResyncs(int expected) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (resyncCount.get() < expected && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            return resyncCount.get() == expected;
        }

        @Override
        public void onEvent(JamEvent event) {
            events.add(event);
        }

        @Override
        public void onResync() {
            resyncCount.incrementAndGet();
            resynced.countDown();
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            closeCode.set(statusCode);
            closed.countDown();
        }

        @Override
        public void onGiveUp(Throwable lastError) {
            this.lastError.set(lastError);
            gaveUp.countDown();
        }
    }
}
