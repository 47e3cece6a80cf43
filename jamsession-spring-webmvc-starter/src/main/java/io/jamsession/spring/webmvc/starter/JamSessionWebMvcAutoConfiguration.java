package io.jamsession.spring.webmvc.starter;

import io.jamsession.json.spi.JsonCodec;
import io.jamsession.json.spi.JsonCodecs;
import io.jamsession.server.core.BroadcastHub;
import io.jamsession.server.core.InMemoryJamStore;
import io.jamsession.server.core.JamSessionHandler;
import io.jamsession.server.core.JamSessionService;
import io.jamsession.server.core.TokenBucketRateLimiter;
import io.jamsession.server.core.VoteRegistrationStore;
import io.jamsession.server.jdbc.JdbcJamStore;
import io.jamsession.server.spi.JamStore;
import io.jamsession.server.spi.RateLimiter;
import io.jamsession.server.spi.StoreException;
import io.jamsession.spring.webmvc.JamSessionWebMvcServlet;
import io.jamsession.spring.webmvc.JamWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;

import java.time.Clock;

/**
 * Auto-configuration for jam sessions on Spring WebMVC.
 *
 * <p>Provides default beans for every component; each can be overridden by defining your own bean of the
 * same type. The HTTP API is served by a {@link JamSessionWebMvcServlet} mapped to
 * {@code jamsession.base-path} and live connections are accepted on {@code jamsession.websocket-path/{jamId}}.
 *
 * <p>Storage is in memory unless {@code jamsession.jdbc.url} is set:
 * <pre>
 * jamsession:
 *   jdbc:
 *     url: jdbc:sqlite:data/jams.db
 *   rate-limit:
 *     enabled: true
 * </pre>
 */
@AutoConfiguration
@ConditionalOnClass({JamSessionHandler.class, JamSessionWebMvcServlet.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(JamSessionProperties.class)
public class JamSessionWebMvcAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(JamSessionWebMvcAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public JsonCodec jamSessionJsonCodec() {
        return JsonCodecs.load();
    }

    /**
     * Durable store, used when {@code jamsession.jdbc.url} is set.
     */
    @Bean
    @ConditionalOnMissingBean(JamStore.class)
    @ConditionalOnProperty(prefix = "jamsession.jdbc", name = "url")
    public JdbcJamStore jamSessionJdbcStore(JamSessionProperties properties) throws StoreException {
        return JdbcJamStore.open(properties.getJdbc().getUrl(), properties.getJdbc().getPoolSize());
    }

    /**
     * In-memory store for demos and tests. Override by defining your own JamStore bean.
     */
    @Bean
    @ConditionalOnMissingBean(JamStore.class)
    public JamStore jamSessionStore() {
        logger.info("No jamsession.jdbc.url configured, jam state is kept in memory");
        return new InMemoryJamStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public VoteRegistrationStore jamSessionVoteRegistrationStore(JamStore store, JamSessionProperties properties) {
        return VoteRegistrationStore.builder(store)
                .maxPerformancesPerAttendee(properties.getMaxPerformancesPerAttendee())
                .maxRetries(properties.getStoreMaxRetries())
                .retryBackoff(properties.getStoreRetryBackoff())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public BroadcastHub jamSessionBroadcastHub(JsonCodec codec) {
        return BroadcastHub.builder(codec).build();
    }

    @Bean
    @ConditionalOnMissingBean
    public JamSessionService jamSessionService(VoteRegistrationStore votes, BroadcastHub hub) {
        return new JamSessionService(votes, hub);
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter jamSessionRateLimiter(JamSessionProperties properties) {
        JamSessionProperties.RateLimit rate = properties.getRateLimit();
        if (!rate.isEnabled()) {
            return RateLimiter.permitAll();
        }
        return new TokenBucketRateLimiter(rate.getCapacity(), rate.getRefillPerSecond(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public JamSessionHandler jamSessionHandler(JamSessionService service, JsonCodec codec, RateLimiter rateLimiter,
                                               JamSessionProperties properties) {
        return JamSessionHandler.builder(service)
                .codec(codec)
                .basePath(properties.getBasePath())
                .rateLimiter(rateLimiter)
                .maxBodySize(properties.getMaxBodySize())
                .mutationTimeout(properties.getMutationTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public JamSessionWebMvcServlet jamSessionWebMvcServlet(JamSessionHandler handler) {
        return new JamSessionWebMvcServlet(handler);
    }

    @Bean
    @ConditionalOnMissingBean(name = "jamSessionServletRegistration")
    public ServletRegistrationBean<JamSessionWebMvcServlet> jamSessionServletRegistration(
            JamSessionWebMvcServlet servlet, JamSessionHandler handler) {
        ServletRegistrationBean<JamSessionWebMvcServlet> registration =
                new ServletRegistrationBean<>(servlet, handler.basePath() + "/*");
        registration.setName("jamSessionServlet");
        return registration;
    }

    /**
     * Live connections on {@code jamsession.websocket-path/{jamId}}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(WebSocketConfigurer.class)
    @EnableWebSocket
    static class WebSocketConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public JamWebSocketHandler jamWebSocketHandler(JamSessionService service, JsonCodec codec) {
            return new JamWebSocketHandler(service, codec);
        }

        @Bean
        public WebSocketConfigurer jamSessionWebSocketConfigurer(JamWebSocketHandler handler,
                                                                 JamSessionProperties properties) {
            String path = trimTrailingSlash(properties.getWebsocketPath()) + "/*";
            String[] origins = properties.getAllowedOrigins().toArray(new String[0]);
            return registry -> registry.addHandler(handler, path).setAllowedOriginPatterns(origins);
        }

        private static String trimTrailingSlash(String path) {
            String p = path.startsWith("/") ? path : "/" + path;
            return p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
        }
    }
}
