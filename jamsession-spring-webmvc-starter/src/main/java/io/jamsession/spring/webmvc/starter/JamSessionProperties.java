package io.jamsession.spring.webmvc.starter;

import io.jamsession.core.Protocol;
import io.jamsession.server.core.JamSessionHandler;
import io.jamsession.server.jdbc.JdbcJamStore;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code jamsession.*}.
 */
@ConfigurationProperties("jamsession")
public class JamSessionProperties {

    /** Concurrent performance registrations allowed per attendee and jam. */
    private int maxPerformancesPerAttendee = Protocol.DEFAULT_MAX_PERFORMANCES;

    /** Retries of a store operation that hit a write conflict. */
    private int storeMaxRetries = 3;

    private Duration storeRetryBackoff = Duration.ofMillis(10);

    /** How long a mutation may run before the caller gets 503. */
    private Duration mutationTimeout = JamSessionHandler.DEFAULT_MUTATION_TIMEOUT;

    /** Maximum request body size in bytes. */
    private long maxBodySize = JamSessionHandler.DEFAULT_MAX_BODY_SIZE;

    private String basePath = JamSessionHandler.DEFAULT_BASE_PATH;

    private String websocketPath = "/" + Protocol.PATH_WS;

    /** Origin patterns allowed to open live connections. */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    private final RateLimit rateLimit = new RateLimit();

    private final Jdbc jdbc = new Jdbc();

    public int getMaxPerformancesPerAttendee() {
        return maxPerformancesPerAttendee;
    }

    public void setMaxPerformancesPerAttendee(int maxPerformancesPerAttendee) {
        this.maxPerformancesPerAttendee = maxPerformancesPerAttendee;
    }

    public int getStoreMaxRetries() {
        return storeMaxRetries;
    }

    public void setStoreMaxRetries(int storeMaxRetries) {
        this.storeMaxRetries = storeMaxRetries;
    }

    public Duration getStoreRetryBackoff() {
        return storeRetryBackoff;
    }

    public void setStoreRetryBackoff(Duration storeRetryBackoff) {
        this.storeRetryBackoff = storeRetryBackoff;
    }

    public Duration getMutationTimeout() {
        return mutationTimeout;
    }

    public void setMutationTimeout(Duration mutationTimeout) {
        this.mutationTimeout = mutationTimeout;
    }

    public long getMaxBodySize() {
        return maxBodySize;
    }

    public void setMaxBodySize(long maxBodySize) {
        this.maxBodySize = maxBodySize;
    }

    public String getBasePath() {
        return basePath;
    }

    public void setBasePath(String basePath) {
        this.basePath = basePath;
    }

    public String getWebsocketPath() {
        return websocketPath;
    }

    public void setWebsocketPath(String websocketPath) {
        this.websocketPath = websocketPath;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    /**
     * Per-client token bucket. Off unless enabled.
     */
    public static class RateLimit {
        private boolean enabled;
        private int capacity = 60;
        private double refillPerSecond = 10.0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public double getRefillPerSecond() {
            return refillPerSecond;
        }

        public void setRefillPerSecond(double refillPerSecond) {
            this.refillPerSecond = refillPerSecond;
        }
    }

    /**
     * Durable store. The in-memory store is used while {@code url} is unset.
     */
    public static class Jdbc {
        private String url;
        private int poolSize = JdbcJamStore.DEFAULT_POOL_SIZE;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
