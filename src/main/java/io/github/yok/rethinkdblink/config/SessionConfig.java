package io.github.yok.rethinkdblink.config;

import com.google.common.base.Preconditions;
import java.time.Duration;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable input of one session run.
 *
 * <p>
 * Unset builder values fall back to the defaults below. Values are validated once on
 * construction.
 * </p>
 * <ul>
 * <li>server: {@code localhost:28015}</li>
 * <li>database: {@code default}</li>
 * <li>table: {@code users}</li>
 * <li>connect timeout: 5 seconds</li>
 * <li>table provisioning: {@link TableProvisioningPolicy#WHEN_DATABASE_CREATED}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SessionConfig {

    public static final String DEFAULT_DATABASE = "default";
    public static final String DEFAULT_TABLE = "users";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final ServerAddress server;
    private final String databaseName;
    private final String tableName;
    private final Duration connectTimeout;
    private final TableProvisioningPolicy tableProvisioning;

    @Builder(toBuilder = true)
    private SessionConfig(ServerAddress server, String databaseName, String tableName,
            Duration connectTimeout, TableProvisioningPolicy tableProvisioning) {
        this.server = server != null ? server
                : new ServerAddress(ServerAddress.DEFAULT_HOST, ServerAddress.DEFAULT_PORT);
        this.databaseName = databaseName != null ? databaseName : DEFAULT_DATABASE;
        this.tableName = tableName != null ? tableName : DEFAULT_TABLE;
        this.connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_TIMEOUT;
        this.tableProvisioning = tableProvisioning != null ? tableProvisioning
                : TableProvisioningPolicy.WHEN_DATABASE_CREATED;

        Preconditions.checkArgument(StringUtils.isNotBlank(this.databaseName),
                "database name must not be blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(this.tableName),
                "table name must not be blank");
        Preconditions.checkArgument(
                !this.connectTimeout.isNegative() && !this.connectTimeout.isZero(),
                "connect timeout must be positive: %s", this.connectTimeout);
    }

    /**
     * Returns a configuration with every default applied.
     *
     * @return default configuration
     */
    public static SessionConfig defaults() {
        return builder().build();
    }
}
