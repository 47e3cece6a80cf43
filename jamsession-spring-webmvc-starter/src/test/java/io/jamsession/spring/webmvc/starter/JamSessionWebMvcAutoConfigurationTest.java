package io.jamsession.spring.webmvc.starter;

import io.jamsession.server.core.BroadcastHub;
import io.jamsession.server.core.InMemoryJamStore;
import io.jamsession.server.core.JamSessionHandler;
import io.jamsession.server.core.JamSessionService;
import io.jamsession.server.core.TokenBucketRateLimiter;
import io.jamsession.server.core.VoteRegistrationStore;
import io.jamsession.server.jdbc.JdbcJamStore;
import io.jamsession.server.spi.JamStore;
import io.jamsession.server.spi.RateLimiter;
import io.jamsession.spring.webmvc.JamWebSocketHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JamSessionWebMvcAutoConfigurationTest {

    private final WebApplicationContextRunner runner = new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JamSessionWebMvcAutoConfiguration.class));

    @Test
    void providesInMemoryDefaults() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(JamSessionHandler.class);
            assertThat(context).hasSingleBean(JamSessionService.class);
            assertThat(context).hasSingleBean(BroadcastHub.class);
            assertThat(context).hasSingleBean(JamWebSocketHandler.class);
            assertThat(context.getBean(JamStore.class)).isInstanceOf(InMemoryJamStore.class);
            assertThat(context.getBean(RateLimiter.class)).isNotInstanceOf(TokenBucketRateLimiter.class);
            assertThat(context.getBean(VoteRegistrationStore.class).maxPerformancesPerAttendee()).isEqualTo(3);

            ServletRegistrationBean<?> registration = context.getBean("jamSessionServletRegistration",
                    ServletRegistrationBean.class);
            assertThat(registration.getUrlMappings()).containsExactly("/jams/*");
        });
    }

    @Test
    void bindsProperties() {
        runner.withPropertyValues(
                        "jamsession.max-performances-per-attendee=5",
                        "jamsession.base-path=/api/jams",
                        "jamsession.rate-limit.enabled=true",
                        "jamsession.rate-limit.capacity=10")
                .run(context -> {
                    assertThat(context.getBean(VoteRegistrationStore.class).maxPerformancesPerAttendee()).isEqualTo(5);
                    assertThat(context.getBean(JamSessionHandler.class).basePath()).isEqualTo("/api/jams");
                    assertThat(context.getBean(RateLimiter.class)).isInstanceOf(TokenBucketRateLimiter.class);
                    assertThat(context.getBean("jamSessionServletRegistration", ServletRegistrationBean.class)
                            .getUrlMappings()).containsExactly("/api/jams/*");
                });
    }

    @Test
    void usesJdbcStoreWhenUrlIsSet(@TempDir Path dir) {
        runner.withPropertyValues("jamsession.jdbc.url=jdbc:sqlite:" + dir.resolve("jams.db").toAbsolutePath())
                .run(context -> {
                    assertThat(context).hasSingleBean(JamStore.class);
                    assertThat(context.getBean(JamStore.class)).isInstanceOf(JdbcJamStore.class);
                });
    }

    @Test
    void userStoreWins() {
        runner.withUserConfiguration(CustomStoreConfig.class)
                .run(context -> assertThat(context.getBean(JamStore.class))
                        .isSameAs(context.getBean(CustomStoreConfig.class).store));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfig {
        final InMemoryJamStore store = new InMemoryJamStore();

        @Bean
        JamStore customJamStore() {
            return store;
        }
    }
}
