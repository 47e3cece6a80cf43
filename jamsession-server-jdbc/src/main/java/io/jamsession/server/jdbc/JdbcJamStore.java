package io.jamsession.server.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.jamsession.core.ActorId;
import io.jamsession.server.spi.AddSongOutcome;
import io.jamsession.server.spi.Attendee;
import io.jamsession.server.spi.AttendeeOutcome;
import io.jamsession.server.spi.Jam;
import io.jamsession.server.spi.JamSong;
import io.jamsession.server.spi.JamStatus;
import io.jamsession.server.spi.JamStore;
import io.jamsession.server.spi.PerformanceRegistration;
import io.jamsession.server.spi.RegistrationOutcome;
import io.jamsession.server.spi.Song;
import io.jamsession.server.spi.StoreConflictException;
import io.jamsession.server.spi.StoreException;
import io.jamsession.server.spi.ToggleOutcome;
import io.jamsession.server.spi.Vote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteException;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link JamStore} on JDBC.
 *
 * <p>Every mutation runs in one transaction. With {@link #sqlite(Path)} transactions start with
 * {@code BEGIN IMMEDIATE}, so a check followed by an insert (the registration limit, the vote toggle)
 * cannot interleave with another writer. Busy and locked databases, lost unique-key races and
 * serialization failures surface as {@link StoreConflictException} and are safe to retry; any other
 * constraint failure is a plain {@link StoreException}.
 *
 * <pre>{@code
 * try (JdbcJamStore store = JdbcJamStore.sqlite(Path.of("data/jams.db"))) {
 *     Jam jam = store.createJam("Friday Jam", "friday-jam", Instant.now());
 * }
 * }</pre>
 */
public final class JdbcJamStore implements JamStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JdbcJamStore.class);

    public static final int DEFAULT_POOL_SIZE = 4;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int SQLITE_CONSTRAINT_PRIMARYKEY = 1555;
    private static final int SQLITE_CONSTRAINT_UNIQUE = 2067;

    private static final String JAM_SONG_COLUMNS =
            "js.jam_id, js.played, js.played_at_ms, js.added_at_ms, "
                    + "s.id, s.title, s.artist, s.times_played, s.last_played_ms, "
                    + "(SELECT COUNT(*) FROM votes v WHERE v.jam_id = js.jam_id AND v.song_id = js.song_id) AS vote_count";

    private static final String REGISTRATION_COLUMNS =
            "r.jam_id, r.song_id, r.attendee_id, a.name, r.instrument, r.registered_at_ms";

    private final DataSource dataSource;
    private final boolean ownsDataSource;

    /**
     * Uses an existing data source. The schema is created if missing.
     *
     * <p>Any isolation level from read committed up keeps the registration limit: a registration first
     * writes the attendee's row, so concurrent registrations of one attendee queue on that row lock before
     * counting. Vote toggles rely on the unique key and are retried on conflict.
     */
    public JdbcJamStore(DataSource dataSource) throws StoreException {
        this(dataSource, false);
    }

    private JdbcJamStore(DataSource dataSource, boolean ownsDataSource) throws StoreException {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.ownsDataSource = ownsDataSource;
        try (Connection c = dataSource.getConnection()) {
            JdbcSchema.migrate(c);
        } catch (SQLException e) {
            throw new StoreException("Failed to create jam store schema", e);
        }
    }

    /**
     * Opens (creating if needed) a SQLite database file behind a small connection pool.
     */
    public static JdbcJamStore sqlite(Path file) throws StoreException {
        return sqlite(file, DEFAULT_POOL_SIZE);
    }

    public static JdbcJamStore sqlite(Path file, int poolSize) throws StoreException {
        Path absolute = file.toAbsolutePath();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new StoreException("Cannot create directory for " + absolute, e);
        }
        return open("jdbc:sqlite:" + absolute, poolSize);
    }

    /**
     * Opens a pooled store for a JDBC URL. SQLite URLs get WAL journaling, foreign keys, a busy timeout
     * and immediate transactions.
     */
    public static JdbcJamStore open(String jdbcUrl, int poolSize) throws StoreException {
        HikariConfig config = new HikariConfig();
        config.setPoolName("jamsession-jdbc");
        config.setJdbcUrl(jdbcUrl);
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(DEFAULT_BUSY_TIMEOUT_MS);
        if (jdbcUrl.startsWith("jdbc:sqlite:")) {
            config.addDataSourceProperty("journal_mode", "WAL");
            config.addDataSourceProperty("foreign_keys", "true");
            config.addDataSourceProperty("busy_timeout", Integer.toString(DEFAULT_BUSY_TIMEOUT_MS));
            config.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        }

        HikariDataSource ds;
        try {
            ds = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new StoreException("Cannot open jam store at " + jdbcUrl, e);
        }
        try {
            JdbcJamStore store = new JdbcJamStore(ds, true);
            logger.info("Jam store opened: {}", jdbcUrl);
            return store;
        } catch (StoreException e) {
            ds.close();
            throw e;
        }
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            hikari.close();
        }
    }

    // Jams

    @Override
    public Jam createJam(String name, String slug, Instant now) throws StoreException {
        Jam jam = new Jam(newId(), name, slug, JamStatus.WAITING, null, now);
        return inTransaction("create jam", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO jams (id, name, slug, status, current_song_id, created_at_ms) VALUES (?, ?, ?, ?, NULL, ?)")) {
                ps.setString(1, jam.id());
                ps.setString(2, name);
                ps.setString(3, slug);
                ps.setString(4, jam.status().wireName());
                ps.setLong(5, now.toEpochMilli());
                ps.executeUpdate();
            }
            return jam;
        });
    }

    @Override
    public Optional<Jam> findJam(String jamId) throws StoreException {
        return query("find jam", c -> findJam(c, jamId));
    }

    @Override
    public Optional<Jam> findJamBySlug(String slug) throws StoreException {
        return query("find jam by slug", c -> findJamWhere(c, "slug = ?", slug));
    }

    @Override
    public Optional<Jam> updateJamStatus(String jamId, JamStatus status) throws StoreException {
        return inTransaction("update jam status", c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE jams SET status = ? WHERE id = ?")) {
                ps.setString(1, status.wireName());
                ps.setString(2, jamId);
                if (ps.executeUpdate() == 0) return Optional.empty();
            }
            return findJam(c, jamId);
        });
    }

    // Catalog

    @Override
    public Song createSong(String title, String artist) throws StoreException {
        Song song = new Song(newId(), title, artist, 0, null);
        return inTransaction("create song", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO songs (id, title, artist, times_played, last_played_ms) VALUES (?, ?, ?, 0, NULL)")) {
                ps.setString(1, song.id());
                ps.setString(2, title);
                ps.setString(3, artist);
                ps.executeUpdate();
            }
            return song;
        });
    }

    @Override
    public Optional<Song> findSong(String songId) throws StoreException {
        return query("find song", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id, title, artist, times_played, last_played_ms FROM songs WHERE id = ?")) {
                ps.setString(1, songId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    return Optional.of(new Song(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4),
                            instant(rs, 5)));
                }
            }
        });
    }

    // Queue

    @Override
    public AddSongOutcome addSong(String jamId, String songId, Instant now) throws StoreException {
        return inTransaction("add song", c -> {
            requireJam(c, jamId);
            if (findJamSong(c, jamId, songId).isPresent()) {
                return new AddSongOutcome(AddSongOutcome.Status.ALREADY_PRESENT, null);
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO jam_songs (jam_id, song_id, played, played_at_ms, added_at_ms) VALUES (?, ?, 0, NULL, ?)")) {
                ps.setString(1, jamId);
                ps.setString(2, songId);
                ps.setLong(3, now.toEpochMilli());
                ps.executeUpdate();
            }
            JamSong added = findJamSong(c, jamId, songId)
                    .orElseThrow(() -> new StoreException("Unknown song: " + songId));
            return new AddSongOutcome(AddSongOutcome.Status.ADDED, added);
        });
    }

    @Override
    public List<JamSong> jamSongs(String jamId) throws StoreException {
        return query("list queue", c -> {
            requireJam(c, jamId);
            List<JamSong> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT " + JAM_SONG_COLUMNS
                    + " FROM jam_songs js JOIN songs s ON s.id = js.song_id WHERE js.jam_id = ? ORDER BY js.seq")) {
                ps.setString(1, jamId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(jamSong(rs));
                }
            }
            return out;
        });
    }

    @Override
    public Optional<JamSong> findJamSong(String jamId, String songId) throws StoreException {
        return query("find queued song", c -> {
            requireJam(c, jamId);
            return findJamSong(c, jamId, songId);
        });
    }

    @Override
    public boolean markPlayed(String jamId, String songId, Instant now) throws StoreException {
        return inTransaction("mark played", c -> {
            requireJam(c, jamId);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE jam_songs SET played = 1, played_at_ms = ? WHERE jam_id = ? AND song_id = ?")) {
                ps.setLong(1, now.toEpochMilli());
                ps.setString(2, jamId);
                ps.setString(3, songId);
                if (ps.executeUpdate() == 0) return false;
            }
            try (PreparedStatement ps = c.prepareStatement("UPDATE jams SET current_song_id = ? WHERE id = ?")) {
                ps.setString(1, songId);
                ps.setString(2, jamId);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE songs SET times_played = times_played + 1, last_played_ms = ? WHERE id = ?")) {
                ps.setLong(1, now.toEpochMilli());
                ps.setString(2, songId);
                ps.executeUpdate();
            }
            return true;
        });
    }

    // Attendees

    @Override
    public AttendeeOutcome upsertAttendee(String jamId, String name, String sessionToken, Instant now) throws StoreException {
        return inTransaction("register attendee", c -> {
            requireJam(c, jamId);
            if (sessionToken != null) {
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE attendees SET session_token = NULL WHERE jam_id = ? AND session_token = ? AND name <> ?")) {
                    ps.setString(1, jamId);
                    ps.setString(2, sessionToken);
                    ps.setString(3, name);
                    ps.executeUpdate();
                }
            }
            Optional<Attendee> existing = findAttendeeWhere(c, "jam_id = ? AND name = ?", jamId, name);
            if (existing.isPresent()) {
                Attendee a = existing.get();
                try (PreparedStatement ps = c.prepareStatement("UPDATE attendees SET session_token = ? WHERE id = ?")) {
                    ps.setString(1, sessionToken);
                    ps.setString(2, a.id());
                    ps.executeUpdate();
                }
                return new AttendeeOutcome(AttendeeOutcome.Status.UPDATED,
                        new Attendee(a.id(), jamId, a.name(), sessionToken, a.registeredAt()));
            }
            Attendee created = new Attendee(newId(), jamId, name, sessionToken, now);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO attendees (id, jam_id, name, session_token, registered_at_ms) VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, created.id());
                ps.setString(2, jamId);
                ps.setString(3, name);
                if (sessionToken == null) ps.setNull(4, Types.VARCHAR);
                else ps.setString(4, sessionToken);
                ps.setLong(5, now.toEpochMilli());
                ps.executeUpdate();
            }
            return new AttendeeOutcome(AttendeeOutcome.Status.CREATED, created);
        });
    }

    @Override
    public Optional<Attendee> findAttendee(String jamId, String attendeeId) throws StoreException {
        return query("find attendee", c -> {
            requireJam(c, jamId);
            return findAttendeeWhere(c, "jam_id = ? AND id = ?", jamId, attendeeId);
        });
    }

    @Override
    public Optional<Attendee> findAttendeeBySession(String jamId, String sessionToken) throws StoreException {
        if (sessionToken == null) return Optional.empty();
        return query("find attendee by session", c -> {
            requireJam(c, jamId);
            return findAttendeeWhere(c, "jam_id = ? AND session_token = ?", jamId, sessionToken);
        });
    }

    @Override
    public List<Attendee> attendees(String jamId) throws StoreException {
        return query("list attendees", c -> {
            requireJam(c, jamId);
            List<Attendee> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id, jam_id, name, session_token, registered_at_ms FROM attendees WHERE jam_id = ? "
                            + "ORDER BY registered_at_ms, rowid")) {
                ps.setString(1, jamId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(attendee(rs));
                }
            }
            return out;
        });
    }

    // Votes

    @Override
    public ToggleOutcome toggleVote(String jamId, String songId, ActorId actor, Instant now) throws StoreException {
        return inTransaction("toggle vote", c -> {
            requireQueued(c, jamId, songId);
            boolean voted;
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM votes WHERE jam_id = ? AND song_id = ? AND actor_key = ?")) {
                ps.setString(1, jamId);
                ps.setString(2, songId);
                ps.setString(3, actor.key());
                voted = ps.executeUpdate() == 0;
            }
            if (voted) {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO votes (jam_id, song_id, actor_key, voted_at_ms) VALUES (?, ?, ?, ?)")) {
                    ps.setString(1, jamId);
                    ps.setString(2, songId);
                    ps.setString(3, actor.key());
                    ps.setLong(4, now.toEpochMilli());
                    ps.executeUpdate();
                }
            }
            return new ToggleOutcome(voted, countVotes(c, jamId, songId));
        });
    }

    @Override
    public boolean hasVoted(String jamId, String songId, ActorId actor) throws StoreException {
        return query("check vote", c -> {
            requireQueued(c, jamId, songId);
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT 1 FROM votes WHERE jam_id = ? AND song_id = ? AND actor_key = ?")) {
                ps.setString(1, jamId);
                ps.setString(2, songId);
                ps.setString(3, actor.key());
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public int voteCount(String jamId, String songId) throws StoreException {
        return query("count votes", c -> {
            requireQueued(c, jamId, songId);
            return countVotes(c, jamId, songId);
        });
    }

    @Override
    public List<Vote> votesBy(String jamId, ActorId actor) throws StoreException {
        return query("list votes", c -> {
            requireJam(c, jamId);
            List<Vote> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT song_id, voted_at_ms FROM votes WHERE jam_id = ? AND actor_key = ? ORDER BY voted_at_ms, song_id")) {
                ps.setString(1, jamId);
                ps.setString(2, actor.key());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new Vote(jamId, rs.getString(1), actor, Instant.ofEpochMilli(rs.getLong(2))));
                    }
                }
            }
            return out;
        });
    }

    @Override
    public int reassignVotes(String jamId, ActorId from, ActorId to) throws StoreException {
        return inTransaction("reassign votes", c -> {
            requireJam(c, jamId);
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM votes WHERE jam_id = ? AND actor_key = ? AND song_id IN "
                            + "(SELECT song_id FROM votes WHERE jam_id = ? AND actor_key = ?)")) {
                ps.setString(1, jamId);
                ps.setString(2, from.key());
                ps.setString(3, jamId);
                ps.setString(4, to.key());
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE votes SET actor_key = ? WHERE jam_id = ? AND actor_key = ?")) {
                ps.setString(1, to.key());
                ps.setString(2, jamId);
                ps.setString(3, from.key());
                return ps.executeUpdate();
            }
        });
    }

    // Performance registrations

    @Override
    public RegistrationOutcome registerPerformance(String jamId, String songId, String attendeeId, String instrument,
                                                   int limit, Instant now) throws StoreException {
        return inTransaction("register performance", c -> {
            lockAttendee(c, jamId, attendeeId);
            int held = countRegistrations(c, jamId, attendeeId);
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT 1 FROM performance_registrations WHERE jam_id = ? AND song_id = ? AND attendee_id = ?")) {
                ps.setString(1, jamId);
                ps.setString(2, songId);
                ps.setString(3, attendeeId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) return RegistrationOutcome.duplicate(held);
                }
            }
            if (held >= limit) {
                return RegistrationOutcome.limitExceeded(held);
            }
            Attendee attendee = findAttendeeWhere(c, "jam_id = ? AND id = ?", jamId, attendeeId)
                    .orElseThrow(() -> new StoreException("Unknown attendee: " + attendeeId));
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO performance_registrations (jam_id, song_id, attendee_id, instrument, registered_at_ms) "
                            + "VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, jamId);
                ps.setString(2, songId);
                ps.setString(3, attendeeId);
                ps.setString(4, instrument);
                ps.setLong(5, now.toEpochMilli());
                ps.executeUpdate();
            }
            PerformanceRegistration reg = new PerformanceRegistration(jamId, songId, attendeeId, attendee.name(),
                    instrument, Instant.ofEpochMilli(now.toEpochMilli()));
            return RegistrationOutcome.registered(reg, held + 1);
        });
    }

    @Override
    public boolean unregisterPerformance(String jamId, String songId, String attendeeId) throws StoreException {
        return inTransaction("unregister performance", c -> {
            requireJam(c, jamId);
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM performance_registrations WHERE jam_id = ? AND song_id = ? AND attendee_id = ?")) {
                ps.setString(1, jamId);
                ps.setString(2, songId);
                ps.setString(3, attendeeId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public List<PerformanceRegistration> performers(String jamId, String songId) throws StoreException {
        return query("list performers", c -> {
            requireJam(c, jamId);
            String sql = "SELECT " + REGISTRATION_COLUMNS
                    + " FROM performance_registrations r LEFT JOIN attendees a ON a.id = r.attendee_id WHERE r.jam_id = ?"
                    + (songId == null ? "" : " AND r.song_id = ?")
                    + " ORDER BY r.registered_at_ms, r.attendee_id, r.song_id";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, jamId);
                if (songId != null) ps.setString(2, songId);
                return registrations(ps);
            }
        });
    }

    @Override
    public List<PerformanceRegistration> registrationsOf(String jamId, String attendeeId) throws StoreException {
        return query("list registrations", c -> {
            requireJam(c, jamId);
            try (PreparedStatement ps = c.prepareStatement("SELECT " + REGISTRATION_COLUMNS
                    + " FROM performance_registrations r LEFT JOIN attendees a ON a.id = r.attendee_id"
                    + " WHERE r.jam_id = ? AND r.attendee_id = ? ORDER BY r.registered_at_ms, r.song_id")) {
                ps.setString(1, jamId);
                ps.setString(2, attendeeId);
                return registrations(ps);
            }
        });
    }

    // Internals

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection c) throws SQLException, StoreException;
    }

    private <T> T query(String op, SqlWork<T> work) throws StoreException {
        try (Connection c = dataSource.getConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            throw translate(op, e);
        }
    }

    private <T> T inTransaction(String op, SqlWork<T> work) throws StoreException {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (SQLException | StoreException | RuntimeException e) {
                rollbackQuietly(c, op, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw translate(op, e);
        }
    }

    private static void rollbackQuietly(Connection c, String op, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            logger.warn("Rollback of {} failed", op, e);
        }
    }

    /**
     * Busy or locked databases, unique and primary key violations, serialization failures and deadlocks
     * mean nothing was written and the caller may retry. Everything else, including foreign key, check
     * and not-null violations, is final.
     */
    static StoreException translate(String op, SQLException e) {
        if (isTransient(e)) {
            logger.debug("{} conflicted: {}", op, e.getMessage());
            return new StoreConflictException("Conflict during " + op, e);
        }
        return new StoreException("Failed to " + op, e);
    }

    private static boolean isTransient(SQLException e) {
        if (e instanceof SQLiteException sqlite) {
            int extended = sqlite.getResultCode().code;
            int primary = extended & 0xFF;
            if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) return true;
            if (extended == SQLITE_CONSTRAINT_UNIQUE || extended == SQLITE_CONSTRAINT_PRIMARYKEY) return true;
            return primary == SQLITE_CONSTRAINT && isUniqueViolationMessage(e.getMessage());
        }
        int code = e.getErrorCode();
        if (code == SQLITE_BUSY || code == SQLITE_LOCKED
                || code == SQLITE_CONSTRAINT_UNIQUE || code == SQLITE_CONSTRAINT_PRIMARYKEY) {
            return true;
        }
        String state = e.getSQLState();
        return "23505".equals(state) || "40001".equals(state) || "40P01".equals(state);
    }

    // Without extended result codes SQLite only reports the constraint class.
    private static boolean isUniqueViolationMessage(String message) {
        return message != null
                && (message.contains("UNIQUE constraint failed") || message.contains("PRIMARY KEY constraint failed"));
    }

    private static void requireJam(Connection c, String jamId) throws SQLException, StoreException {
        if (jamId == null || findJam(c, jamId).isEmpty()) {
            throw new StoreException("Unknown jam: " + jamId);
        }
    }

    /**
     * No-op write on the attendee row; holds its lock until commit.
     */
    private static void lockAttendee(Connection c, String jamId, String attendeeId) throws SQLException, StoreException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE attendees SET name = name WHERE jam_id = ? AND id = ?")) {
            ps.setString(1, jamId);
            ps.setString(2, attendeeId);
            if (ps.executeUpdate() == 1) return;
        }
        requireJam(c, jamId);
        throw new StoreException("Unknown attendee: " + attendeeId);
    }

    private static void requireQueued(Connection c, String jamId, String songId) throws SQLException, StoreException {
        requireJam(c, jamId);
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM jam_songs WHERE jam_id = ? AND song_id = ?")) {
            ps.setString(1, jamId);
            ps.setString(2, songId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) throw new StoreException("Song " + songId + " is not queued in jam " + jamId);
            }
        }
    }

    private static Optional<Jam> findJam(Connection c, String jamId) throws SQLException {
        return findJamWhere(c, "id = ?", jamId);
    }

    private static Optional<Jam> findJamWhere(Connection c, String where, String param) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id, name, slug, status, current_song_id, created_at_ms FROM jams WHERE " + where)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                JamStatus status = JamStatus.fromWireName(rs.getString(4)).orElse(JamStatus.WAITING);
                return Optional.of(new Jam(rs.getString(1), rs.getString(2), rs.getString(3), status,
                        rs.getString(5), Instant.ofEpochMilli(rs.getLong(6))));
            }
        }
    }

    private static Optional<JamSong> findJamSong(Connection c, String jamId, String songId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + JAM_SONG_COLUMNS
                + " FROM jam_songs js JOIN songs s ON s.id = js.song_id WHERE js.jam_id = ? AND js.song_id = ?")) {
            ps.setString(1, jamId);
            ps.setString(2, songId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(jamSong(rs)) : Optional.empty();
            }
        }
    }

    private static Optional<Attendee> findAttendeeWhere(Connection c, String where, String... params) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id, jam_id, name, session_token, registered_at_ms FROM attendees WHERE " + where)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(attendee(rs)) : Optional.empty();
            }
        }
    }

    private static int countVotes(Connection c, String jamId, String songId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM votes WHERE jam_id = ? AND song_id = ?")) {
            ps.setString(1, jamId);
            ps.setString(2, songId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    private static int countRegistrations(Connection c, String jamId, String attendeeId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*) FROM performance_registrations WHERE jam_id = ? AND attendee_id = ?")) {
            ps.setString(1, jamId);
            ps.setString(2, attendeeId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    private static List<PerformanceRegistration> registrations(PreparedStatement ps) throws SQLException {
        List<PerformanceRegistration> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new PerformanceRegistration(rs.getString(1), rs.getString(2), rs.getString(3),
                        rs.getString(4), rs.getString(5), Instant.ofEpochMilli(rs.getLong(6))));
            }
        }
        return out;
    }

    private static JamSong jamSong(ResultSet rs) throws SQLException {
        Song song = new Song(rs.getString(5), rs.getString(6), rs.getString(7), rs.getInt(8), instant(rs, 9));
        return new JamSong(rs.getString(1), song, rs.getInt(10), rs.getInt(2) != 0, instant(rs, 3),
                Instant.ofEpochMilli(rs.getLong(4)));
    }

    private static Attendee attendee(ResultSet rs) throws SQLException {
        return new Attendee(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                Instant.ofEpochMilli(rs.getLong(5)));
    }

    private static Instant instant(ResultSet rs, int column) throws SQLException {
        long ms = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(ms);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
