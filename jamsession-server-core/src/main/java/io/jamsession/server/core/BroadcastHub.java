package io.jamsession.server.core;

import io.jamsession.core.JamEvent;
import io.jamsession.json.spi.JsonCodec;
import io.jamsession.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans jam events out to the live connections watching each jam.
 *
 * <p>Connections are grouped per jam in independent channels, so subscribe, unsubscribe and publish on
 * one jam never contend with another. Within a jam, frames are delivered in publish order by a serial
 * dispatcher running on the shared executor; across jams there is no ordering.
 *
 * <p>Delivery is best effort. A connection that is closed or fails a send is dropped and the failure is
 * logged; publishers never see it. Receivers are expected to refetch state on every event.
 *
 * <pre>{@code
 * BroadcastHub hub = BroadcastHub.builder(codec).build();
 * SubscriptionHandle handle = hub.subscribe("jam-1", connection);
 * hub.publish(JamEvent.builder("jam-1", JamEventType.VOTE_UPDATE).put("songId", "s1").build());
 * handle.unsubscribe();
 * }</pre>
 */
public final class BroadcastHub implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastHub.class);

    private final JsonCodec codec;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Map<String, JamChannel> channels = new ConcurrentHashMap<>();

    public static Builder builder(JsonCodec codec) {
        return new Builder(codec);
    }

    private BroadcastHub(Builder builder) {
        this.codec = builder.codec;
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = VirtualThreads.newExecutor("jamsession-broadcast");
            this.executor = ownedExecutor;
        }
    }

    public static final class Builder {
        private final JsonCodec codec;
        private Executor executor;

        private Builder(JsonCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        /**
         * Executor that runs the per-jam dispatchers. Default: a virtual-thread (or cached) executor owned
         * and shut down by the hub.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public BroadcastHub build() {
            return new BroadcastHub(this);
        }
    }

    public SubscriptionHandle subscribe(String jamId, LiveConnection connection) {
        Objects.requireNonNull(jamId, "jamId");
        Objects.requireNonNull(connection, "connection");
        SubscriptionHandle handle = new SubscriptionHandle(this, jamId, connection);
        channels.compute(jamId, (id, channel) -> {
            JamChannel ch = channel != null ? channel : new JamChannel(id);
            ch.subscribers.add(handle);
            return ch;
        });
        logger.info("Connection {} joined jam {} ({} connected)", connection.id(), jamId, connectionCount(jamId));
        return handle;
    }

    /**
     * Remove a subscription. Safe to call repeatedly and after the connection closed.
     */
    public void unsubscribe(SubscriptionHandle handle) {
        if (handle == null || !handle.deactivate()) return;
        channels.computeIfPresent(handle.jamId(), (id, channel) -> {
            channel.subscribers.remove(handle);
            return channel.subscribers.isEmpty() && channel.pending.isEmpty() ? null : channel;
        });
        logger.info("Connection {} left jam {} ({} connected)",
                handle.connection().id(), handle.jamId(), connectionCount(handle.jamId()));
    }

    public void publish(JamEvent event) {
        publish(event.jamId(), event);
    }

    /**
     * Queue an event for every connection currently watching {@code jamId}. Returns without waiting for
     * delivery; never throws for delivery problems.
     */
    public void publish(String jamId, JamEvent event) {
        Objects.requireNonNull(event, "event");
        JamChannel channel = channels.get(jamId);
        if (channel == null || channel.subscribers.isEmpty()) {
            logger.debug("No listeners for {} in jam {}", event.type().wireName(), jamId);
            return;
        }
        String frame;
        try {
            frame = encode(event);
        } catch (JsonException | RuntimeException e) {
            logger.warn("Dropping {} for jam {}: cannot encode", event.type().wireName(), jamId, e);
            return;
        }
        channel.pending.add(frame);
        channel.schedule();
    }

    /**
     * Send an event to a single connection, outside any jam's queue (keep-alive replies).
     *
     * @return false if the frame could not be delivered
     */
    public boolean sendTo(LiveConnection connection, JamEvent event) {
        try {
            connection.send(encode(event));
            return true;
        } catch (Exception e) {
            logger.debug("Direct send to {} failed", connection.id(), e);
            return false;
        }
    }

    public int connectionCount(String jamId) {
        JamChannel channel = channels.get(jamId);
        return channel == null ? 0 : channel.subscribers.size();
    }

    public int totalConnections() {
        int total = 0;
        for (JamChannel channel : channels.values()) {
            total += channel.subscribers.size();
        }
        return total;
    }

    public Set<String> activeJams() {
        return Set.copyOf(channels.keySet());
    }

    @Override
    public void close() {
        for (JamChannel channel : channels.values()) {
            for (SubscriptionHandle handle : channel.subscribers) {
                unsubscribe(handle);
            }
        }
        channels.clear();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private String encode(JamEvent event) throws JsonException {
        return codec.writeString(event.envelope());
    }

    private void deliver(JamChannel channel, String frame) {
        for (SubscriptionHandle handle : channel.subscribers) {
            LiveConnection connection = handle.connection();
            if (!connection.isOpen()) {
                logger.debug("Connection {} closed, dropping it from jam {}", connection.id(), channel.jamId);
                unsubscribe(handle);
                continue;
            }
            try {
                connection.send(frame);
            } catch (Exception e) {
                logger.warn("Delivery to {} in jam {} failed, dropping connection: {}",
                        connection.id(), channel.jamId, e.toString());
                unsubscribe(handle);
            }
        }
    }

    /**
     * Subscribers and pending frames of one jam. At most one drain task runs per channel at a time.
     */
    private final class JamChannel {
        final String jamId;
        final Set<SubscriptionHandle> subscribers = ConcurrentHashMap.newKeySet();
        final Queue<String> pending = new ConcurrentLinkedQueue<>();
        final AtomicBoolean draining = new AtomicBoolean();

        JamChannel(String jamId) {
            this.jamId = jamId;
        }

        void schedule() {
            if (!draining.compareAndSet(false, true)) return;
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                pending.clear();
                logger.warn("Broadcast executor rejected dispatch for jam {}", jamId, e);
            }
        }

        private void drain() {
            do {
                String frame;
                while ((frame = pending.poll()) != null) {
                    deliver(this, frame);
                }
                draining.set(false);
            } while (!pending.isEmpty() && draining.compareAndSet(false, true));
            releaseIfIdle();
        }

        /**
         * Drops this channel once its last subscriber left and nothing is queued.
         */
        private void releaseIfIdle() {
            channels.computeIfPresent(jamId, (id, channel) ->
                    channel == this && subscribers.isEmpty() && pending.isEmpty() && !draining.get() ? null : channel);
        }
    }
}
