package io.github.yok.rethinkdblink.db.rethink;

import com.rethinkdb.net.Connection;
import io.github.yok.rethinkdblink.config.ServerAddress;
import io.github.yok.rethinkdblink.db.ConnectionHandle;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ConnectionHandle} backed by a RethinkDB driver {@link Connection}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class RethinkConnectionHandle implements ConnectionHandle {

    private final Connection connection;
    private final ServerAddress server;
    private String databaseName;
    private boolean open = true;

    RethinkConnectionHandle(Connection connection, ServerAddress server, String databaseName) {
        this.connection = connection;
        this.server = server;
        this.databaseName = databaseName;
    }

    /**
     * Returns the driver connection for running queries.
     *
     * @return driver connection
     * @throws IllegalStateException if the handle has been closed
     */
    Connection unwrap() {
        if (!open) {
            throw new IllegalStateException("Connection to " + server + " is closed");
        }
        return connection;
    }

    /**
     * Switches the default database of the driver connection.
     *
     * @param name database name
     */
    void use(String name) {
        unwrap().use(name);
        this.databaseName = name;
    }

    @Override
    public String getDatabaseName() {
        return databaseName;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        try {
            connection.close();
            log.debug("Closed connection to {}", server);
        } catch (Exception e) {
            log.warn("Failed to close connection to {}: {}", server, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "RethinkConnectionHandle[" + server + ", db=" + databaseName + ", open=" + open
                + "]";
    }
}
