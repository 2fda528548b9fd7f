package io.github.yok.rethinkdblink;

import io.github.yok.rethinkdblink.config.RethinkProperties;
import io.github.yok.rethinkdblink.config.ServerAddress;
import io.github.yok.rethinkdblink.config.SessionConfig;
import io.github.yok.rethinkdblink.config.TableProvisioningPolicy;
import io.github.yok.rethinkdblink.core.RethinkSession;
import io.github.yok.rethinkdblink.core.SessionInitializer;
import io.github.yok.rethinkdblink.db.SessionConnectionException;
import io.github.yok.rethinkdblink.util.ErrorHandler;
import java.time.Duration;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Opens one RethinkDB session with the settings of the {@code rethink} section of
 * {@code application.yml}, provisions its database and table, logs the outcome of each step and
 * closes the connection.
 * </p>
 *
 * <p>
 * Command-line options override the configuration:
 * </p>
 * <ul>
 * <li>{@code --url <url>} or {@code -u <url>}: server URL, e.g.
 * {@code rethink://localhost:28015}</li>
 * <li>{@code --db <name>} or {@code -d <name>}: database name</li>
 * <li>{@code --table <name>} or {@code -t <name>}: table name</li>
 * <li>{@code --timeout <seconds>}: connect timeout</li>
 * <li>{@code --always-provision-table}: check the table even when the database already
 * existed</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see RethinkProperties
 * @see SessionInitializer
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(RethinkProperties.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final RethinkProperties rethinkProperties;
    private final SessionInitializer sessionInitializer;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        SessionConfig config;
        try {
            config = applyArguments(rethinkProperties.toSessionConfig(), args);
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Invalid session configuration: " + e.getMessage(), e);
            return;
        }

        log.info("Server: {}, Database: {}, Table: {}, Timeout: {}, Table provisioning: {}",
                config.getServer(), config.getDatabaseName(), config.getTableName(),
                config.getConnectTimeout(), config.getTableProvisioning());

        try (RethinkSession session = sessionInitializer.initialize(config)) {
            log.info("Session initialized. Database: {}, Table: {}, State: {}",
                    session.getDatabaseResult().getOutcome(),
                    session.getTableResult().getOutcome(), session.getState());
        } catch (SessionConnectionException e) {
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    /**
     * Applies command-line overrides to the configured session settings.
     *
     * @param base settings from {@code application.yml}
     * @param args command-line arguments
     * @return settings with overrides applied
     * @throws IllegalArgumentException if an option value is missing or invalid
     */
    static SessionConfig applyArguments(SessionConfig base, String... args) {
        SessionConfig.SessionConfigBuilder builder = base.toBuilder();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--url":
                case "-u":
                    builder.server(ServerAddress.parse(requireValue(args, ++i)));
                    break;
                case "--db":
                case "-d":
                    builder.databaseName(requireValue(args, ++i));
                    break;
                case "--table":
                case "-t":
                    builder.tableName(requireValue(args, ++i));
                    break;
                case "--timeout":
                    builder.connectTimeout(
                            Duration.ofSeconds(Long.parseLong(requireValue(args, ++i).trim())));
                    break;
                case "--always-provision-table":
                    builder.tableProvisioning(TableProvisioningPolicy.ALWAYS);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        return builder.build();
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }
}
