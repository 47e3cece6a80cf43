package io.jamsession.server.core;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registration of one {@link LiveConnection} with a {@link BroadcastHub}.
 *
 * <p>{@link #unsubscribe()} may be called any number of times, also after the connection closed.
 */
public final class SubscriptionHandle implements AutoCloseable {
    private final BroadcastHub hub;
    private final String jamId;
    private final LiveConnection connection;
    private final AtomicBoolean active = new AtomicBoolean(true);

    SubscriptionHandle(BroadcastHub hub, String jamId, LiveConnection connection) {
        this.hub = Objects.requireNonNull(hub, "hub");
        this.jamId = Objects.requireNonNull(jamId, "jamId");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public String jamId() {
        return jamId;
    }

    public LiveConnection connection() {
        return connection;
    }

    public boolean isActive() {
        return active.get();
    }

    public void unsubscribe() {
        hub.unsubscribe(this);
    }

    @Override
    public void close() {
        unsubscribe();
    }

    /** @return true only for the first caller */
    boolean deactivate() {
        return active.compareAndSet(true, false);
    }
}
