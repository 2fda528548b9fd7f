package io.github.yok.rethinkdblink.db;

import io.github.yok.rethinkdblink.config.SessionConfig;
import java.util.List;

/**
 * Calls the session initializer makes against the database server.
 *
 * <p>
 * Every method blocks until its network round trip completes. Apart from
 * {@link #connect(SessionConfig)}, failures surface as unchecked exceptions; a create call that
 * loses a race against another creator throws {@link EntityAlreadyExistsException}.
 * </p>
 */
public interface RethinkDriver {

    /**
     * Opens a connection to {@link SessionConfig#getServer()}, giving up after
     * {@link SessionConfig#getConnectTimeout()}.
     *
     * @param config session configuration
     * @return open connection
     * @throws SessionConnectionException if the server is unreachable, refuses the connection, or
     *         the timeout elapses
     */
    ConnectionHandle connect(SessionConfig config) throws SessionConnectionException;

    /**
     * Makes {@code databaseName} the default database of the connection. The database does not
     * need to exist yet.
     *
     * @param connection open connection
     * @param databaseName database name
     */
    void selectDatabase(ConnectionHandle connection, String databaseName);

    /**
     * Lists every database known to the server.
     *
     * @param connection open connection
     * @return database names
     */
    List<String> listDatabaseNames(ConnectionHandle connection);

    /**
     * Creates a database.
     *
     * @param connection open connection
     * @param databaseName database name
     * @return server result
     * @throws EntityAlreadyExistsException if the server reports the database already exists
     */
    CreateResult createDatabase(ConnectionHandle connection, String databaseName);

    /**
     * Returns a reference to the named database. No round trip is made.
     *
     * @param databaseName database name
     * @return database reference
     */
    DatabaseReference database(String databaseName);

    /**
     * Lists the tables of a database.
     *
     * @param database database reference
     * @param connection open connection
     * @return table names
     */
    List<String> listTableNames(DatabaseReference database, ConnectionHandle connection);

    /**
     * Creates a table inside a database.
     *
     * @param database database reference
     * @param connection open connection
     * @param tableName table name
     * @return server result
     * @throws EntityAlreadyExistsException if the server reports the table already exists
     */
    CreateResult createTable(DatabaseReference database, ConnectionHandle connection,
            String tableName);
}
