package io.jamsession.server.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.jamsession.core.ActorId;
import io.jamsession.core.JamSessionException;
import io.jamsession.core.Protocol;
import io.jamsession.server.spi.JamStore;
import io.jamsession.server.spi.PerformanceRegistration;
import io.jamsession.server.spi.RegistrationOutcome;
import io.jamsession.server.spi.StoreConflictException;
import io.jamsession.server.spi.StoreException;
import io.jamsession.server.spi.ToggleOutcome;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoteRegistrationStoreTest {

    @Test
    void toggleTwiceRestoresTheOriginalState() throws Exception {
        JamFixture f = new JamFixture("Hey Jude");
        ActorId actor = ActorId.session("browser-1");

        ToggleOutcome first = f.votes.toggleVote(f.jam.id(), f.songId(0), actor);
        ToggleOutcome second = f.votes.toggleVote(f.jam.id(), f.songId(0), actor);

        assertThat(first.voted()).isTrue();
        assertThat(first.voteCount()).isEqualTo(1);
        assertThat(second.voted()).isFalse();
        assertThat(second.voteCount()).isZero();
        assertThat(f.votes.hasVoted(f.jam.id(), f.songId(0), actor)).isFalse();
    }

    @Test
    void voteLoggingNeverPrintsSessionTokens() throws Exception {
        JamFixture f = new JamFixture("Hey Jude");
        Logger log = (Logger) LoggerFactory.getLogger(VoteRegistrationStore.class);
        Level previous = log.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        log.addAppender(appender);
        log.setLevel(Level.DEBUG);
        try {
            f.votes.toggleVote(f.jam.id(), f.songId(0), ActorId.session("secret-browser-token"));
            f.votes.toggleVote(f.jam.id(), f.songId(0), ActorId.attendee("a-1"));
        } finally {
            log.detachAppender(appender);
            log.setLevel(previous);
        }

        assertThat(appender.list).hasSize(2);
        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .noneMatch(m -> m.contains("secret-browser-token"))
                .anyMatch(m -> m.contains("by session:"))
                .anyMatch(m -> m.contains("attendee:a-1"));
    }

    @Test
    void oddNumberOfTogglesFlipsTheState() throws Exception {
        JamFixture f = new JamFixture("Hey Jude");
        ActorId actor = ActorId.attendee("a-1");

        ToggleOutcome last = null;
        for (int i = 0; i < 7; i++) {
            last = f.votes.toggleVote(f.jam.id(), f.songId(0), actor);
        }

        assertThat(last.voted()).isTrue();
        assertThat(f.votes.voteCount(f.jam.id(), f.songId(0))).isEqualTo(1);
    }

    @Test
    void concurrentTogglesOfOneActorNeverCountTwice() throws Exception {
        JamFixture f = new JamFixture("Hey Jude");
        ActorId actor = ActorId.session("browser-1");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int round = 0; round < 50; round++) {
                CountDownLatch start = new CountDownLatch(1);
                List<Future<ToggleOutcome>> results = new ArrayList<>();
                for (int i = 0; i < 2; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return f.votes.toggleVote(f.jam.id(), f.songId(0), actor);
                    }));
                }
                start.countDown();
                for (Future<ToggleOutcome> r : results) {
                    assertThat(r.get().voteCount()).isBetween(0, 1);
                }
                // two toggles always cancel out
                assertThat(f.votes.voteCount(f.jam.id(), f.songId(0))).isZero();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void manyActorsVotingConcurrentlyAreAllCounted() throws Exception {
        JamFixture f = new JamFixture("Hey Jude");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<ToggleOutcome>> results = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                ActorId actor = ActorId.session("browser-" + i);
                results.add(pool.submit(() -> f.votes.toggleVote(f.jam.id(), f.songId(0), actor)));
            }
            for (Future<ToggleOutcome> r : results) {
                assertThat(r.get().voted()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(f.votes.voteCount(f.jam.id(), f.songId(0))).isEqualTo(100);
    }

    @Test
    void fourthRegistrationExceedsTheLimitAndKeepsTheOthers() throws Exception {
        JamFixture f = new JamFixture("One", "Two", "Three", "Four");
        String alice = f.store.upsertAttendee(f.jam.id(), "Alice", null, JamFixture.T0).attendee().id();
        for (int i = 0; i < 3; i++) {
            f.votes.registerPerformance(f.jam.id(), f.songId(i), alice, "guitar");
        }

        assertThatThrownBy(() -> f.votes.registerPerformance(f.jam.id(), f.songId(3), alice, "guitar"))
                .isInstanceOf(JamSessionException.PerformanceLimitExceeded.class)
                .satisfies(e -> assertThat(((JamSessionException.PerformanceLimitExceeded) e).limit()).isEqualTo(3));
        assertThat(f.votes.registrationsOf(f.jam.id(), alice))
                .extracting(PerformanceRegistration::songId)
                .containsExactlyInAnyOrder(f.songId(0), f.songId(1), f.songId(2));
    }

    @Test
    void concurrentRegistrationsNeverExceedTheLimit() throws Exception {
        JamFixture f = new JamFixture("1", "2", "3", "4", "5", "6", "7", "8");
        String bob = f.store.upsertAttendee(f.jam.id(), "Bob", null, JamFixture.T0).attendee().id();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger rejected = new AtomicInteger();
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String songId = f.songId(i);
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        f.votes.registerPerformance(f.jam.id(), songId, bob, "drums");
                    } catch (JamSessionException.PerformanceLimitExceeded e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> fu : futures) fu.get();
        } finally {
            pool.shutdownNow();
        }
        assertThat(f.votes.registrationsOf(f.jam.id(), bob)).hasSize(3);
        assertThat(rejected.get()).isEqualTo(5);
    }

    @Test
    void duplicateRegistrationIsRejected() throws Exception {
        JamFixture f = new JamFixture("One");
        String alice = f.store.upsertAttendee(f.jam.id(), "Alice", null, JamFixture.T0).attendee().id();
        f.votes.registerPerformance(f.jam.id(), f.songId(0), alice, "guitar");

        assertThatThrownBy(() -> f.votes.registerPerformance(f.jam.id(), f.songId(0), alice, "bass"))
                .isInstanceOf(JamSessionException.DuplicateRegistration.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void blankInstrumentIsRecordedAsUnknown() throws Exception {
        JamFixture f = new JamFixture("One");
        String alice = f.store.upsertAttendee(f.jam.id(), "Alice", null, JamFixture.T0).attendee().id();

        RegistrationOutcome out = f.votes.registerPerformance(f.jam.id(), f.songId(0), alice, "  ");

        assertThat(out.registration().instrument()).isEqualTo(Protocol.DEFAULT_INSTRUMENT);
        assertThat(out.registration().attendeeName()).isEqualTo("Alice");
    }

    @Test
    void unregisteringSomethingNeverRegisteredFails() throws Exception {
        JamFixture f = new JamFixture("One");
        String alice = f.store.upsertAttendee(f.jam.id(), "Alice", null, JamFixture.T0).attendee().id();

        assertThatThrownBy(() -> f.votes.unregisterPerformance(f.jam.id(), f.songId(0), alice))
                .isInstanceOf(JamSessionException.NotRegistered.class);
    }

    @Test
    void limitMustBePositive() {
        assertThatThrownBy(() -> VoteRegistrationStore.builder(new InMemoryJamStore()).maxPerformancesPerAttendee(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void conflictsAreRetriedUntilTheStoreSucceeds() throws Exception {
        InMemoryJamStore delegate = new InMemoryJamStore();
        AtomicInteger failuresLeft = new AtomicInteger(2);
        JamFixture f = new JamFixture(conflicting(delegate, "toggleVote", failuresLeft), "Hey Jude");
        VoteRegistrationStore votes = VoteRegistrationStore.builder(f.store)
                .retryBackoff(Duration.ZERO)
                .build();

        ToggleOutcome out = votes.toggleVote(f.jam.id(), f.songId(0), ActorId.session("s"));

        assertThat(out.voted()).isTrue();
        assertThat(failuresLeft.get()).isZero();
    }

    @Test
    void exhaustedRetriesSurfaceAsStoreUnavailable() throws Exception {
        InMemoryJamStore delegate = new InMemoryJamStore();
        AtomicInteger failuresLeft = new AtomicInteger(100);
        JamFixture f = new JamFixture(conflicting(delegate, "toggleVote", failuresLeft), "Hey Jude");
        VoteRegistrationStore votes = VoteRegistrationStore.builder(f.store)
                .maxRetries(2)
                .retryBackoff(Duration.ZERO)
                .build();

        assertThatThrownBy(() -> votes.toggleVote(f.jam.id(), f.songId(0), ActorId.session("s")))
                .isInstanceOf(JamSessionException.StoreUnavailable.class)
                .satisfies(e -> assertThat(((JamSessionException) e).httpStatus()).isEqualTo(503));
        assertThat(failuresLeft.get()).isEqualTo(97);
        assertThat(delegate.voteCount(f.jam.id(), f.songId(0))).isZero();
    }

    @Test
    void nonConflictStoreFailuresAreNotRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        JamStore broken = (JamStore) Proxy.newProxyInstance(JamStore.class.getClassLoader(),
                new Class<?>[]{JamStore.class}, (proxy, method, args) -> {
                    calls.incrementAndGet();
                    throw new StoreException("disk full");
                });
        VoteRegistrationStore votes = VoteRegistrationStore.builder(broken).build();

        assertThatThrownBy(() -> votes.voteCount("jam", "song"))
                .isInstanceOf(JamSessionException.StoreUnavailable.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    /**
     * Wraps a store so the named method fails with a conflict while {@code failuresLeft} is positive.
     */
    static JamStore conflicting(JamStore delegate, String methodName, AtomicInteger failuresLeft) {
        return (JamStore) Proxy.newProxyInstance(JamStore.class.getClassLoader(), new Class<?>[]{JamStore.class},
                (proxy, method, args) -> {
                    if (method.getName().equals(methodName) && failuresLeft.get() > 0) {
                        failuresLeft.decrementAndGet();
                        throw new StoreConflictException("simulated conflict");
                    }
                    try {
                        return method.invoke(delegate, args);
                    } catch (InvocationTargetException e) {
                        throw e.getCause();
                    }
                });
    }
}
