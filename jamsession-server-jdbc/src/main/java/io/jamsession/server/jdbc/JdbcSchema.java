package io.jamsession.server.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Tables of the jam store. Created on startup if missing.
 *
 * <p>Vote counts are never stored; they are always {@code COUNT(*)} over {@code votes}.
 */
final class JdbcSchema {
    private JdbcSchema() {}

    private static final List<String> STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS jams (
                id TEXT PRIMARY KEY,
                name TEXT NOT NULL,
                slug TEXT NOT NULL UNIQUE,
                status TEXT NOT NULL DEFAULT 'waiting',
                current_song_id TEXT,
                created_at_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS songs (
                id TEXT PRIMARY KEY,
                title TEXT NOT NULL,
                artist TEXT NOT NULL,
                times_played INTEGER NOT NULL DEFAULT 0,
                last_played_ms INTEGER
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS jam_songs (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                jam_id TEXT NOT NULL REFERENCES jams(id) ON DELETE CASCADE,
                song_id TEXT NOT NULL REFERENCES songs(id) ON DELETE CASCADE,
                played INTEGER NOT NULL DEFAULT 0,
                played_at_ms INTEGER,
                added_at_ms INTEGER NOT NULL,
                UNIQUE (jam_id, song_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS attendees (
                id TEXT PRIMARY KEY,
                jam_id TEXT NOT NULL REFERENCES jams(id) ON DELETE CASCADE,
                name TEXT NOT NULL,
                session_token TEXT,
                registered_at_ms INTEGER NOT NULL,
                UNIQUE (jam_id, name)
            )
            """,
            "CREATE UNIQUE INDEX IF NOT EXISTS idx_attendees_session ON attendees(jam_id, session_token) "
                    + "WHERE session_token IS NOT NULL",
            """
            CREATE TABLE IF NOT EXISTS votes (
                jam_id TEXT NOT NULL REFERENCES jams(id) ON DELETE CASCADE,
                song_id TEXT NOT NULL REFERENCES songs(id) ON DELETE CASCADE,
                actor_key TEXT NOT NULL,
                voted_at_ms INTEGER NOT NULL,
                PRIMARY KEY (jam_id, song_id, actor_key)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_votes_actor ON votes(jam_id, actor_key)",
            """
            CREATE TABLE IF NOT EXISTS performance_registrations (
                jam_id TEXT NOT NULL REFERENCES jams(id) ON DELETE CASCADE,
                song_id TEXT NOT NULL REFERENCES songs(id) ON DELETE CASCADE,
                attendee_id TEXT NOT NULL REFERENCES attendees(id) ON DELETE CASCADE,
                instrument TEXT NOT NULL,
                registered_at_ms INTEGER NOT NULL,
                PRIMARY KEY (jam_id, song_id, attendee_id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_registrations_attendee ON performance_registrations(jam_id, attendee_id)");

    static void migrate(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String sql : STATEMENTS) {
                st.execute(sql);
            }
        }
    }
}
