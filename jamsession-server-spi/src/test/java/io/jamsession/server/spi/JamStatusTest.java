package io.jamsession.server.spi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JamStatusTest {

    @Test
    void wireNamesAreLowerCase() {
        assertThat(JamStatus.PLAYING.wireName()).isEqualTo("playing");
    }

    @Test
    void parsesWireNamesLeniently() {
        assertThat(JamStatus.fromWireName(" Paused ")).contains(JamStatus.PAUSED);
        assertThat(JamStatus.fromWireName("ended")).contains(JamStatus.ENDED);
        assertThat(JamStatus.fromWireName("rehearsing")).isEmpty();
        assertThat(JamStatus.fromWireName(null)).isEmpty();
    }
}
