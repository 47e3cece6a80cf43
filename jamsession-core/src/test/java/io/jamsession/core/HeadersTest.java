package io.jamsession.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HeadersTest {

    @Test
    void lookupIgnoresCaseAndNullValues() {
        Map<String, List<String>> headers = Map.of(
                "Retry-After", Arrays.asList(null, "3"),
                "X-Error", List.of());

        assertThat(Headers.firstValue(headers, "retry-after")).contains("3");
        assertThat(Headers.firstValue(headers, "x-error")).isEmpty();
        assertThat(Headers.firstValue(headers, "Missing")).isEmpty();
        assertThat(Headers.firstValue(null, "Retry-After")).isEmpty();
    }

    @Test
    void forwardedClientIsTheLeftMostEntry() {
        assertThat(Headers.forwardedClient("203.0.113.7, 10.0.0.1")).contains("203.0.113.7");
        assertThat(Headers.forwardedClient(" 198.51.100.2 ")).contains("198.51.100.2");
        assertThat(Headers.forwardedClient(" , 10.0.0.1")).isEmpty();
        assertThat(Headers.forwardedClient(null)).isEmpty();
    }
}
