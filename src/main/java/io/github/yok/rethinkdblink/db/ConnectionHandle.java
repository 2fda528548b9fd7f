package io.github.yok.rethinkdblink.db;

/**
 * Opaque handle to one live server connection.
 *
 * <p>
 * A handle belongs to exactly one session and is bound to one database name through
 * {@link RethinkDriver#selectDatabase(ConnectionHandle, String)}. It must not be shared between
 * sessions or mutated concurrently.
 * </p>
 */
public interface ConnectionHandle extends AutoCloseable {

    /**
     * Returns the database name this connection currently uses for unqualified queries.
     *
     * @return bound database name, or {@code null} before a database was selected
     */
    String getDatabaseName();

    /**
     * Returns whether the connection has not been closed yet.
     *
     * @return {@code true} while open
     */
    boolean isOpen();

    /**
     * Closes the connection. Calling it again has no effect.
     */
    @Override
    void close();
}
