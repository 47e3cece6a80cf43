package io.jamsession.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActorIdTest {

    @Test
    void attendeeAndSessionWithSameValueAreDistinct() {
        ActorId attendee = ActorId.attendee("abc");
        ActorId session = ActorId.session("abc");

        assertThat(attendee).isNotEqualTo(session);
        assertThat(attendee.key()).isEqualTo("attendee:abc");
        assertThat(session.key()).isEqualTo("session:abc");
    }

    @Test
    void parseReadsBackKey() {
        ActorId parsed = ActorId.parse("session:tok:with:colons");

        assertThat(parsed.kind()).isEqualTo(ActorId.Kind.SESSION);
        assertThat(parsed.value()).isEqualTo("tok:with:colons");
        assertThat(ActorId.parse(ActorId.attendee("7").key())).isEqualTo(ActorId.attendee("7"));
    }

    @Test
    void toStringMasksSessionTokens() {
        assertThat(ActorId.session("secret-token").toString()).isEqualTo("session:***").doesNotContain("secret");
        assertThat(ActorId.attendee("a-7").toString()).isEqualTo("attendee:a-7");
    }

    @Test
    void rejectsBlankAndUnknownKinds() {
        assertThatThrownBy(() -> ActorId.session(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ActorId.parse("robot:1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ActorId.parse("nokind")).isInstanceOf(IllegalArgumentException.class);
    }
}
