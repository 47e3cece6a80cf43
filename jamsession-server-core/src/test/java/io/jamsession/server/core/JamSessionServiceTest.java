package io.jamsession.server.core;

import io.jamsession.core.JamSessionException;
import io.jamsession.server.spi.JamStatus;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JamSessionServiceTest {

    @Test
    void aliceVotesRegistersAndHitsThePerformanceLimit() throws Exception {
        JamFixture f = new JamFixture("S1", "S2", "S3", "S4");
        String jam = f.jam.id();
        String alice = f.service.registerAttendee(jam, "Alice", "alice-browser").attendeeId();

        VoteResult up = f.service.toggleVote(jam, f.songId(0), null, alice);
        assertThat(up.voted()).isTrue();
        assertThat(up.voteCount()).isEqualTo(1);

        VoteResult down = f.service.toggleVote(jam, f.songId(0), null, alice);
        assertThat(down.voted()).isFalse();
        assertThat(down.voteCount()).isZero();

        PerformanceResult guitar = f.service.registerPerformance(jam, f.songId(0), alice, "guitar");
        assertThat(guitar.instrument()).isEqualTo("guitar");
        assertThat(guitar.activeCount()).isEqualTo(1);

        f.service.registerPerformance(jam, f.songId(1), alice, "guitar");
        f.service.registerPerformance(jam, f.songId(2), alice, "guitar");
        assertThatThrownBy(() -> f.service.registerPerformance(jam, f.songId(3), alice, "guitar"))
                .isInstanceOf(JamSessionException.PerformanceLimitExceeded.class);

        UnregisterResult left = f.service.unregisterPerformance(jam, f.songId(0), alice);
        assertThat(left.activeCount()).isEqualTo(2);

        PerformanceResult again = f.service.registerPerformance(jam, f.songId(0), alice, "guitar");
        assertThat(again.activeCount()).isEqualTo(3);
        assertThat(f.service.performers(jam, null)).hasSize(3);
    }

    @Test
    void voteResponseCarriesTheReRankedQueue() throws Exception {
        JamFixture f = new JamFixture("Zeta", "Alpha");
        String jam = f.jam.id();

        VoteResult result = f.service.toggleVote(jam, f.songId(0), "browser-1", null);

        assertThat(result.queue()).extracting(RankedSong::title).containsExactly("Zeta", "Alpha");
        assertThat(result.queue().get(0).voteCount()).isEqualTo(1);
        assertThat(f.service.queue(jam).queue()).isEqualTo(result.queue());
    }

    @Test
    void everyMutationIsBroadcastToTheJam() throws Exception {
        JamFixture f = new JamFixture("S1");
        RecordingConnection watcher = new RecordingConnection("watcher");
        f.hub.subscribe(f.jam.id(), watcher);
        String jam = f.jam.id();

        String bob = f.service.registerAttendee(jam, "Bob", "bob-browser").attendeeId();
        f.service.toggleVote(jam, f.songId(0), null, bob);
        f.service.registerPerformance(jam, f.songId(0), bob, null);
        f.service.unregisterPerformance(jam, f.songId(0), bob);
        String extra = f.store.createSong("Extra", "Band").id();
        f.service.addSong(jam, extra);
        f.service.markPlayed(jam, extra);
        f.service.updateStatus(jam, JamStatus.PLAYING);

        assertThat(watcher.frames()).hasSize(7);
        assertThat(watcher.frames().get(0)).startsWith("{\"event\":\"attendee_registered\"");
        assertThat(watcher.frames().get(1))
                .startsWith("{\"event\":\"vote_update\"")
                .contains("\"voted\":true", "\"voteCount\":1", "\"attendeeId\":\"" + bob + "\"");
        assertThat(watcher.frames().get(2)).contains("performance_update", "\"action\":\"registered\"", "\"instrument\":\"Unknown\"");
        assertThat(watcher.frames().get(3)).contains("performance_update", "\"action\":\"unregistered\"");
        assertThat(watcher.frames().get(4)).contains("song_added", "\"title\":\"Extra\"");
        assertThat(watcher.frames().get(5)).contains("song_played");
        assertThat(watcher.frames().get(6)).contains("jam_status", "\"status\":\"playing\"");
    }

    @Test
    void anonymousVoteEventsDoNotLeakTheSessionToken() throws Exception {
        JamFixture f = new JamFixture("S1");
        RecordingConnection watcher = new RecordingConnection("watcher");
        f.hub.subscribe(f.jam.id(), watcher);

        f.service.toggleVote(f.jam.id(), f.songId(0), "secret-token", null);

        assertThat(watcher.frames()).singleElement(InstanceOfAssertFactories.STRING).doesNotContain("secret-token");
    }

    @Test
    void registrationClaimsAnonymousVotesOfTheSameSession() throws Exception {
        JamFixture f = new JamFixture("S1", "S2");
        String jam = f.jam.id();
        f.service.toggleVote(jam, f.songId(0), "carol-browser", null);
        f.service.toggleVote(jam, f.songId(1), "carol-browser", null);

        AttendeeRegistration carol = f.service.registerAttendee(jam, "Carol", "carol-browser");

        assertThat(carol.created()).isTrue();
        assertThat(carol.claimedVotes()).isEqualTo(2);
        assertThat(f.service.votedSongIds(jam, null, carol.attendeeId()))
                .containsExactlyInAnyOrder(f.songId(0), f.songId(1));
        // same actor whichever id the browser sends
        VoteStatus viaSession = f.service.voteStatus(jam, f.songId(0), "carol-browser", null);
        assertThat(viaSession.voted()).isTrue();
        assertThat(viaSession.voteCount()).isEqualTo(1);

        VoteResult toggledOff = f.service.toggleVote(jam, f.songId(0), "carol-browser", null);
        assertThat(toggledOff.voted()).isFalse();
        assertThat(toggledOff.voteCount()).isZero();
    }

    @Test
    void claimingNeverDoublesAVote() throws Exception {
        JamFixture f = new JamFixture("S1");
        String jam = f.jam.id();
        AttendeeRegistration dave = f.service.registerAttendee(jam, "Dave", "laptop");
        f.service.toggleVote(jam, f.songId(0), null, dave.attendeeId());
        // phone votes anonymously before Dave signs in on it
        f.service.toggleVote(jam, f.songId(0), "phone", null);
        assertThat(f.votes.voteCount(jam, f.songId(0))).isEqualTo(2);

        AttendeeRegistration again = f.service.registerAttendee(jam, "Dave", "phone");

        assertThat(again.created()).isFalse();
        assertThat(again.attendeeId()).isEqualTo(dave.attendeeId());
        assertThat(again.claimedVotes()).isZero();
        assertThat(f.votes.voteCount(jam, f.songId(0))).isEqualTo(1);
    }

    @Test
    void addingASongTwiceConflicts() throws Exception {
        JamFixture f = new JamFixture("S1");

        assertThatThrownBy(() -> f.service.addSong(f.jam.id(), f.songId(0)))
                .isInstanceOf(JamSessionException.SongAlreadyInJam.class)
                .satisfies(e -> assertThat(((JamSessionException) e).httpStatus()).isEqualTo(409));
    }

    @Test
    void votingForAnUnqueuedSongIsRejected() throws Exception {
        JamFixture f = new JamFixture("S1");
        String loose = f.store.createSong("Not queued", "Nobody").id();

        assertThatThrownBy(() -> f.service.toggleVote(f.jam.id(), loose, "s", null))
                .isInstanceOf(JamSessionException.SongNotInJam.class);
        assertThatThrownBy(() -> f.service.toggleVote(f.jam.id(), "missing", "s", null))
                .isInstanceOf(JamSessionException.UnknownSong.class);
        assertThatThrownBy(() -> f.service.toggleVote("no-such-jam", f.songId(0), "s", null))
                .isInstanceOf(JamSessionException.UnknownJam.class);
    }

    @Test
    void unregisteringFromAnUnknownSongIsRejectedWithoutBroadcast() throws Exception {
        JamFixture f = new JamFixture("S1");
        String jam = f.jam.id();
        String carol = f.service.registerAttendee(jam, "Carol", "carol-browser").attendeeId();
        RecordingConnection watcher = new RecordingConnection("watcher");
        f.hub.subscribe(jam, watcher);

        assertThatThrownBy(() -> f.service.unregisterPerformance(jam, "missing", carol))
                .isInstanceOf(JamSessionException.UnknownSong.class)
                .satisfies(e -> assertThat(((JamSessionException) e).httpStatus()).isEqualTo(404));
        assertThatThrownBy(() -> f.service.unregisterPerformance(jam, " ", carol))
                .isInstanceOf(JamSessionException.InvalidRequest.class);
        assertThat(watcher.frames()).isEmpty();
    }

    @Test
    void jamIsFoundBySlug() throws Exception {
        JamFixture f = new JamFixture();

        JamSummary summary = f.service.jamBySlug("friday-jam");

        assertThat(summary.jamId()).isEqualTo(f.jam.id());
        assertThat(summary.status()).isEqualTo("waiting");
        assertThatThrownBy(() -> f.service.jamBySlug("nope")).isInstanceOf(JamSessionException.UnknownJam.class);
        assertThatThrownBy(() -> f.service.jamBySlug(" ")).isInstanceOf(JamSessionException.UnknownJam.class);
    }

    @Test
    void markingPlayedUpdatesQueueAndCurrentSong() throws Exception {
        JamFixture f = new JamFixture("S1", "S2");

        f.service.markPlayed(f.jam.id(), f.songId(1));

        QueueSnapshot snapshot = f.service.queue(f.jam.id());
        assertThat(snapshot.currentSongId()).isEqualTo(f.songId(1));
        assertThat(snapshot.queue()).filteredOn(RankedSong::played).extracting(RankedSong::songId)
                .containsExactly(f.songId(1));
        assertThat(f.store.findSong(f.songId(1)).orElseThrow().timesPlayed()).isEqualTo(1);
    }

    @Test
    void attendeeListingHidesSessionsAndFiltersBySession() throws Exception {
        JamFixture f = new JamFixture();
        f.service.registerAttendee(f.jam.id(), "Erin", "erin-browser");
        f.service.registerAttendee(f.jam.id(), "Frank", "frank-browser");

        assertThat(f.service.attendees(f.jam.id(), null)).extracting(AttendeeSummary::name)
                .containsExactly("Erin", "Frank");
        assertThat(f.service.attendees(f.jam.id(), "frank-browser")).extracting(AttendeeSummary::name)
                .containsExactly("Frank");
    }

    @Test
    void blankAttendeeNameIsRejected() throws Exception {
        JamFixture f = new JamFixture();

        assertThatThrownBy(() -> f.service.registerAttendee(f.jam.id(), "   ", "s"))
                .isInstanceOf(JamSessionException.InvalidRequest.class);
    }
}
