package io.jamsession.server.core;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class QueryStringTest {

    @Test
    void decodesParametersAndKeepsTheFirstOccurrence() {
        URI uri = URI.create("http://localhost/jams/j/vote-status?song_id=s%201&session_id=a&session_id=b&flag");

        assertThat(QueryString.parse(uri))
                .containsEntry("song_id", "s 1")
                .containsEntry("session_id", "a")
                .containsEntry("flag", "");
    }

    @Test
    void missingQueryIsEmpty() {
        assertThat(QueryString.parse(URI.create("http://localhost/jams/j/votes"))).isEmpty();
    }
}
