package io.github.yok.rethinkdblink.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

/**
 * Session settings loaded from the {@code rethink} section of {@code application.yml}.
 *
 * <pre>
 * rethink:
 *   url: rethink://localhost:28015
 *   db: default
 *   table: users
 *   timeout: 5s
 *   table-provisioning: when-database-created
 * </pre>
 *
 * <p>
 * When {@code url} is set it wins over {@code host}/{@code port}. A bare number for
 * {@code timeout} is read as seconds.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "rethink")
@Data
public class RethinkProperties {

    // Server URL, e.g. rethink://localhost:28015 (optional)
    private String url;
    // Server host, used when url is not set
    private String host = ServerAddress.DEFAULT_HOST;
    // Client driver port, used when url is not set
    private int port = ServerAddress.DEFAULT_PORT;
    // Database to bind and provision
    private String db = SessionConfig.DEFAULT_DATABASE;
    // Table to provision inside db
    private String table = SessionConfig.DEFAULT_TABLE;
    // Connect timeout
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = SessionConfig.DEFAULT_TIMEOUT;
    // When to check the table
    private TableProvisioningPolicy tableProvisioning =
            TableProvisioningPolicy.WHEN_DATABASE_CREATED;

    /**
     * Resolves the server address from {@code url}, or from {@code host}/{@code port} when no URL
     * is configured.
     *
     * @return server address
     * @throws IllegalArgumentException if the values do not form a valid address
     */
    public ServerAddress resolveServerAddress() {
        if (StringUtils.isNotBlank(url)) {
            return ServerAddress.parse(url);
        }
        return new ServerAddress(host, port);
    }

    /**
     * Builds the immutable session input from these properties.
     *
     * @return session configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public SessionConfig toSessionConfig() {
        return SessionConfig.builder()
                .server(resolveServerAddress())
                .databaseName(db)
                .tableName(table)
                .connectTimeout(timeout)
                .tableProvisioning(tableProvisioning)
                .build();
    }
}
