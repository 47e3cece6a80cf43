package io.jamsession.client;

import io.jamsession.core.JamEvent;

/**
 * Receives the live feed of one jam.
 *
 * <p>Events only signal that something changed; the usual reaction is to refetch the affected state through
 * {@link JamSessionClient}. Callbacks run on the WebSocket or reconnect thread and should not block.
 */
public interface JamFeedListener {

    void onEvent(JamEvent event);

    /**
     * Called after every successful (re)connect. Events sent while disconnected are lost, so the full jam
     * state should be refetched here.
     */
    default void onResync() {}

    /** The server closed the feed normally; no reconnect follows. */
    default void onClosed(int statusCode, String reason) {}

    /** Every reconnect attempt failed; the feed is finished. */
    default void onGiveUp(Throwable lastError) {}
}
