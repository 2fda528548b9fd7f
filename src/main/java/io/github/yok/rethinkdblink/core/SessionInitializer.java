package io.github.yok.rethinkdblink.core;

import com.google.common.base.Preconditions;
import io.github.yok.rethinkdblink.config.SessionConfig;
import io.github.yok.rethinkdblink.config.TableProvisioningPolicy;
import io.github.yok.rethinkdblink.db.ConnectionHandle;
import io.github.yok.rethinkdblink.db.CreateResult;
import io.github.yok.rethinkdblink.db.DatabaseReference;
import io.github.yok.rethinkdblink.db.EntityAlreadyExistsException;
import io.github.yok.rethinkdblink.db.RethinkDriver;
import io.github.yok.rethinkdblink.db.SessionConnectionException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens a session against a RethinkDB server and provisions its database and table.
 *
 * <p>
 * Every call to {@link #initialize(SessionConfig)} runs the following steps once, in order:
 * </p>
 * <ol>
 * <li>Connect within the configured timeout and select the configured database on the new
 * connection (the database may not exist yet).</li>
 * <li>Ensure the database exists: list database names and create the database when it is
 * missing.</li>
 * <li>Resolve the database reference: the one captured at creation, or one obtained by name.</li>
 * <li>Ensure the table exists, if the {@link TableProvisioningPolicy} allows it: list table names
 * and create the table when it is missing.</li>
 * </ol>
 *
 * <p>
 * Only step 1 can fail the call ({@link SessionConnectionException}). Failures in steps 2 and 4
 * are logged with their cause and come back as {@link ProvisioningOutcome#FAILED} results. Nothing
 * is retried. The initializer holds no per-session state, so one instance may serve concurrent
 * sessions; concurrent creators of the same database are arbitrated by the server.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionInitializer {

    private final RethinkDriver driver;

    /**
     * Runs the initialization sequence.
     *
     * @param config session configuration
     * @return the initialized session, owning its open connection
     * @throws SessionConnectionException if no connection could be established
     */
    public RethinkSession initialize(SessionConfig config) throws SessionConnectionException {
        Preconditions.checkNotNull(config, "config must not be null");
        String databaseName = config.getDatabaseName();
        String tableName = config.getTableName();

        List<SessionState> states = new ArrayList<>();
        advance(states, SessionState.DISCONNECTED, config);

        ConnectionHandle connection = connect(config);
        advance(states, SessionState.CONNECTED, config);

        DatabaseStep databaseStep = ensureDatabase(connection, databaseName);
        ProvisioningResult databaseResult = databaseStep.result;
        advance(states, SessionState.DATABASE_CHECKED, config);
        report(databaseResult);
        if (databaseResult.getOutcome() == ProvisioningOutcome.CREATED) {
            advance(states, SessionState.DATABASE_CREATED, config);
        } else if (databaseResult.getOutcome() == ProvisioningOutcome.ALREADY_EXISTED) {
            advance(states, SessionState.DATABASE_EXISTED, config);
        }

        DatabaseReference database = resolveDatabase(databaseStep, databaseName);

        ProvisioningResult tableResult;
        if (shouldProvisionTable(config.getTableProvisioning(), databaseResult)) {
            tableResult = ensureTable(database, connection, tableName);
            advance(states, SessionState.TABLE_CHECKED, config);
        } else {
            tableResult = ProvisioningResult.skipped(EntityKind.TABLE, tableName,
                    skipReason(databaseResult));
        }
        report(tableResult);

        advance(states, SessionState.READY, config);
        return new RethinkSession(config, connection, database, databaseResult, tableResult,
                states);
    }

    /**
     * Step 1: connects and binds the connection to the configured database.
     *
     * @param config session configuration
     * @return open connection bound to the database name
     * @throws SessionConnectionException if connecting or selecting the database fails
     */
    ConnectionHandle connect(SessionConfig config) throws SessionConnectionException {
        ConnectionHandle connection;
        try {
            connection = driver.connect(config);
        } catch (SessionConnectionException e) {
            log.error("Connection to {} failed: {}", config.getServer(), e.getMessage());
            throw e;
        }

        try {
            driver.selectDatabase(connection, config.getDatabaseName());
        } catch (RuntimeException e) {
            connection.close();
            log.error("Could not use database {} on {}", config.getDatabaseName(),
                    config.getServer(), e);
            throw new SessionConnectionException(config.getServer(),
                    "Could not use database " + config.getDatabaseName() + " on "
                            + config.getServer(),
                    e);
        }
        log.info("Connected to {} using database {}", config.getServer(),
                config.getDatabaseName());
        return connection;
    }

    /**
     * Step 2: makes sure the database exists.
     *
     * @param connection open connection
     * @param databaseName database name
     * @return step outcome, with the reference captured when the database was created
     */
    DatabaseStep ensureDatabase(ConnectionHandle connection, String databaseName) {
        List<String> existing;
        try {
            existing = driver.listDatabaseNames(connection);
        } catch (RuntimeException e) {
            return new DatabaseStep(ProvisioningResult.failed(EntityKind.DATABASE, databaseName,
                    "could not list databases", e), null);
        }
        if (existing.contains(databaseName)) {
            return new DatabaseStep(
                    ProvisioningResult.alreadyExisted(EntityKind.DATABASE, databaseName), null);
        }

        try {
            CreateResult created = driver.createDatabase(connection, databaseName);
            if (!created.isCreated()) {
                return new DatabaseStep(ProvisioningResult.failed(EntityKind.DATABASE,
                        databaseName, "server reported no database created", null), null);
            }
            return new DatabaseStep(ProvisioningResult.created(EntityKind.DATABASE, databaseName),
                    driver.database(databaseName));
        } catch (EntityAlreadyExistsException e) {
            log.warn("Database {} was created by another session after it was listed",
                    e.getEntityName());
            return new DatabaseStep(
                    ProvisioningResult.alreadyExisted(EntityKind.DATABASE, databaseName), null);
        } catch (RuntimeException e) {
            return new DatabaseStep(ProvisioningResult.failed(EntityKind.DATABASE, databaseName,
                    "there was a problem creating the database", e), null);
        }
    }

    /**
     * Step 3: returns the reference captured while creating the database, or obtains one by name.
     *
     * @param databaseStep result of step 2
     * @param databaseName database name
     * @return database reference
     */
    DatabaseReference resolveDatabase(DatabaseStep databaseStep, String databaseName) {
        if (databaseStep.result.isCreated() && databaseStep.createdReference != null) {
            return databaseStep.createdReference;
        }
        return driver.database(databaseName);
    }

    /**
     * Step 4: makes sure the table exists inside the database.
     *
     * @param database database reference
     * @param connection open connection
     * @param tableName table name
     * @return step outcome
     */
    ProvisioningResult ensureTable(DatabaseReference database, ConnectionHandle connection,
            String tableName) {
        try {
            List<String> existing = driver.listTableNames(database, connection);
            if (existing.contains(tableName)) {
                return ProvisioningResult.alreadyExisted(EntityKind.TABLE, tableName);
            }
            CreateResult created = driver.createTable(database, connection, tableName);
            if (!created.isCreated()) {
                return ProvisioningResult.failed(EntityKind.TABLE, tableName,
                        "server reported no table created in " + database.getName(), null);
            }
            return ProvisioningResult.created(EntityKind.TABLE, tableName);
        } catch (EntityAlreadyExistsException e) {
            log.warn("Table {} was created by another session after it was listed",
                    e.getEntityName());
            return ProvisioningResult.alreadyExisted(EntityKind.TABLE, tableName);
        } catch (RuntimeException e) {
            return ProvisioningResult.failed(EntityKind.TABLE, tableName,
                    "there was a problem creating the table in " + database.getName(), e);
        }
    }

    /**
     * Decides whether step 4 runs.
     *
     * @param policy configured table policy
     * @param databaseResult outcome of step 2
     * @return {@code true} if the table step should run
     */
    static boolean shouldProvisionTable(TableProvisioningPolicy policy,
            ProvisioningResult databaseResult) {
        if (policy == TableProvisioningPolicy.ALWAYS) {
            return !databaseResult.isFailed();
        }
        return databaseResult.isCreated();
    }

    private static String skipReason(ProvisioningResult databaseResult) {
        switch (databaseResult.getOutcome()) {
            case ALREADY_EXISTED:
                return "database already existed";
            case FAILED:
                return "database provisioning failed";
            default:
                return "database was not created by this session";
        }
    }

    private static void report(ProvisioningResult result) {
        String line = result.statusLine();
        if (result.isFailed()) {
            if (result.getCause().isPresent()) {
                log.error("{}", line, result.getCause().get());
            } else {
                log.error("{}", line);
            }
            return;
        }
        log.info("{}", line);
    }

    private static void advance(List<SessionState> states, SessionState next,
            SessionConfig config) {
        log.debug("[{}@{}] -> {}", config.getDatabaseName(), config.getServer(), next);
        states.add(next);
    }

    /**
     * Outcome of step 2 plus the reference captured when this session created the database.
     */
    static final class DatabaseStep {
        final ProvisioningResult result;
        final DatabaseReference createdReference;

        DatabaseStep(ProvisioningResult result, DatabaseReference createdReference) {
            this.result = result;
            this.createdReference = createdReference;
        }
    }
}
