package io.github.yok.rethinkdblink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.rethinkdblink.config.SessionConfig;
import io.github.yok.rethinkdblink.db.ConnectionHandle;
import io.github.yok.rethinkdblink.db.DatabaseReference;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * An initialized session: the connection it owns, the database it resolved, and what each
 * provisioning step reported.
 *
 * <p>
 * Each session owns its own connection; nothing is shared between sessions. Later row-level work
 * receives the connection and database reference from here. Closing the session closes the
 * connection.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public final class RethinkSession implements AutoCloseable {

    private final SessionConfig config;
    private final ConnectionHandle connection;
    private final DatabaseReference database;
    private final ProvisioningResult databaseResult;
    private final ProvisioningResult tableResult;
    // Visited states in order, DISCONNECTED first
    private final ImmutableList<SessionState> states;

    RethinkSession(SessionConfig config, ConnectionHandle connection, DatabaseReference database,
            ProvisioningResult databaseResult, ProvisioningResult tableResult,
            List<SessionState> states) {
        this.config = config;
        this.connection = connection;
        this.database = database;
        this.databaseResult = databaseResult;
        this.tableResult = tableResult;
        this.states = ImmutableList.copyOf(states);
    }

    /**
     * Returns the last state reached.
     *
     * @return current state
     */
    public SessionState getState() {
        return states.get(states.size() - 1);
    }

    /**
     * Returns whether initialization ran to completion.
     *
     * @return {@code true} in state {@link SessionState#READY}
     */
    public boolean isReady() {
        return getState() == SessionState.READY;
    }

    /**
     * Returns the status line of each provisioning step, database first.
     *
     * @return status lines
     */
    public List<String> statusLines() {
        return ImmutableList.of(databaseResult.statusLine(), tableResult.statusLine());
    }

    @Override
    public void close() {
        log.debug("Closing session for {} on {}", config.getDatabaseName(), config.getServer());
        connection.close();
    }

    @Override
    public String toString() {
        return "RethinkSession[" + config.getServer() + ", " + databaseResult + ", " + tableResult
                + ", state=" + getState() + "]";
    }
}
