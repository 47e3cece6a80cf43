package io.jamsession.client;

/**
 * Handle to a live feed opened by {@link JamFeedClient#connect(String, JamFeedListener)}.
 */
public interface JamFeed extends AutoCloseable {

    String jamId();

    /** True while a connection is established. */
    boolean isConnected();

    /** Asks the server for a {@code pong} event; a no-op while disconnected. */
    void ping();

    /** Closes the connection normally and stops reconnecting. */
    @Override
    void close();
}
