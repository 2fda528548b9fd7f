package io.github.yok.rethinkdblink.db.rethink;

import com.rethinkdb.RethinkDB;
import com.rethinkdb.gen.exc.ReqlError;
import com.rethinkdb.net.Connection;
import io.github.yok.rethinkdblink.config.ServerAddress;
import io.github.yok.rethinkdblink.config.SessionConfig;
import io.github.yok.rethinkdblink.db.ConnectionHandle;
import io.github.yok.rethinkdblink.db.CreateResult;
import io.github.yok.rethinkdblink.db.DatabaseReference;
import io.github.yok.rethinkdblink.db.EntityAlreadyExistsException;
import io.github.yok.rethinkdblink.db.RethinkDriver;
import io.github.yok.rethinkdblink.db.SessionConnectionException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.stereotype.Component;

/**
 * {@link RethinkDriver} implemented with the official RethinkDB Java driver.
 *
 * <p>
 * Query mapping:
 * </p>
 * <ul>
 * <li>connect: {@code r.connection().hostname().port().db().timeout().connect()}, timeout in
 * milliseconds</li>
 * <li>select database: {@code Connection.use(name)}</li>
 * <li>list databases: {@code r.dbList()}</li>
 * <li>create database: {@code r.dbCreate(name)}, counted by {@code dbs_created}</li>
 * <li>list tables: {@code r.db(name).tableList()}</li>
 * <li>create table: {@code r.db(name).tableCreate(table)}, counted by {@code tables_created}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class RethinkDbDriver implements RethinkDriver {

    static final String DBS_CREATED = "dbs_created";
    static final String TABLES_CREATED = "tables_created";

    private static final RethinkDB r = RethinkDB.r;

    @Override
    public ConnectionHandle connect(SessionConfig config) throws SessionConnectionException {
        ServerAddress server = config.getServer();
        long timeoutMillis = toDriverTimeout(config.getConnectTimeout());
        log.debug("Connecting to {} (db={}, timeout={}ms)", server, config.getDatabaseName(),
                timeoutMillis);
        try {
            Connection connection = r.connection()
                    .hostname(server.getHost())
                    .port(server.getPort())
                    .db(config.getDatabaseName())
                    .timeout(timeoutMillis)
                    .connect();
            return new RethinkConnectionHandle(connection, server, config.getDatabaseName());
        } catch (Exception e) {
            String reason = isTimeout(e)
                    ? "timed out after " + timeoutMillis + " ms"
                    : ExceptionUtils.getRootCauseMessage(e);
            throw new SessionConnectionException(server,
                    "Could not connect to RethinkDB at " + server + ": " + reason, e);
        }
    }

    @Override
    public void selectDatabase(ConnectionHandle connection, String databaseName) {
        handle(connection).use(databaseName);
    }

    @Override
    public List<String> listDatabaseNames(ConnectionHandle connection) {
        List<?> names = r.dbList().run(handle(connection).unwrap());
        return toNames(names);
    }

    @Override
    public CreateResult createDatabase(ConnectionHandle connection, String databaseName) {
        try {
            Map<?, ?> result = r.dbCreate(databaseName).run(handle(connection).unwrap());
            return CreateResult.of(createdCount(result, DBS_CREATED));
        } catch (ReqlError e) {
            throw translate(e, databaseName);
        }
    }

    @Override
    public DatabaseReference database(String databaseName) {
        return new DatabaseReference(databaseName);
    }

    @Override
    public List<String> listTableNames(DatabaseReference database, ConnectionHandle connection) {
        List<?> names = r.db(database.getName()).tableList().run(handle(connection).unwrap());
        return toNames(names);
    }

    @Override
    public CreateResult createTable(DatabaseReference database, ConnectionHandle connection,
            String tableName) {
        try {
            Map<?, ?> result = r.db(database.getName()).tableCreate(tableName)
                    .run(handle(connection).unwrap());
            return CreateResult.of(createdCount(result, TABLES_CREATED));
        } catch (ReqlError e) {
            throw translate(e, tableName);
        }
    }

    /**
     * Converts the connect timeout to the milliseconds the driver expects. The driver hands the
     * value to {@link java.net.Socket#connect(java.net.SocketAddress, int)}, so it is kept within
     * {@code [1, Integer.MAX_VALUE]}.
     *
     * @param timeout configured timeout
     * @return timeout in milliseconds
     */
    static long toDriverTimeout(Duration timeout) {
        if (timeout.getSeconds() >= Integer.MAX_VALUE / 1000L) {
            return Integer.MAX_VALUE;
        }
        return Math.max(1L, Math.min(timeout.toMillis(), Integer.MAX_VALUE));
    }

    /**
     * Returns whether a connect failure was caused by the timeout: a socket timeout during the TCP
     * connect, or the driver's "Connection timed out." during the handshake.
     *
     * @param error connect failure
     * @return {@code true} if the timeout elapsed
     */
    static boolean isTimeout(Throwable error) {
        if (ExceptionUtils.indexOfType(error, SocketTimeoutException.class) >= 0) {
            return true;
        }
        for (Throwable t : ExceptionUtils.getThrowableList(error)) {
            if (StringUtils.containsIgnoreCase(t.getMessage(), "timed out")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads a created count out of a create response document.
     *
     * @param result response document, may be {@code null}
     * @param key counter key ({@code dbs_created} or {@code tables_created})
     * @return created count, 0 when absent or not numeric
     */
    static long createdCount(Map<?, ?> result, String key) {
        if (result == null) {
            return 0L;
        }
        Object value = result.get(key);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    /**
     * Returns whether a server error reports a duplicate database or table.
     *
     * @param error server error
     * @return {@code true} for an "already exists" rejection
     */
    static boolean isAlreadyExists(RuntimeException error) {
        return StringUtils.containsIgnoreCase(error.getMessage(), "already exists");
    }

    private RuntimeException translate(ReqlError error, String entityName) {
        if (isAlreadyExists(error)) {
            return new EntityAlreadyExistsException(entityName, error);
        }
        return error;
    }

    private static List<String> toNames(List<?> raw) {
        List<String> names = new ArrayList<>();
        if (raw != null) {
            for (Object name : raw) {
                names.add(String.valueOf(name));
            }
        }
        return names;
    }

    private static RethinkConnectionHandle handle(ConnectionHandle connection) {
        if (!(connection instanceof RethinkConnectionHandle)) {
            throw new IllegalArgumentException(
                    "Connection was not opened by " + RethinkDbDriver.class.getSimpleName() + ": "
                            + connection);
        }
        return (RethinkConnectionHandle) connection;
    }
}
