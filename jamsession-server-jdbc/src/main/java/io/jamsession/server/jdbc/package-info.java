/**
 * {@link io.jamsession.server.spi.JamStore} backed by a relational database through JDBC.
 *
 * <p>The shipped schema targets SQLite in WAL mode behind a HikariCP pool.
 */
package io.jamsession.server.jdbc;
