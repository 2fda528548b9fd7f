package io.github.yok.rethinkdblink.db;

import io.github.yok.rethinkdblink.config.ServerAddress;
import lombok.Getter;

/**
 * Fatal error: no connection to the server could be established within the connect timeout, or
 * the server refused it.
 *
 * <p>
 * Initialization aborts when this is thrown; no provisioning step runs and nothing is retried.
 * </p>
 */
@Getter
public class SessionConnectionException extends Exception {

    private static final long serialVersionUID = 1L;

    // Address the connection attempt was made to
    private final transient ServerAddress server;

    /**
     * Creates the exception.
     *
     * @param server address the connection attempt was made to
     * @param message description of the failure
     * @param cause underlying driver error
     */
    public SessionConnectionException(ServerAddress server, String message, Throwable cause) {
        super(message, cause);
        this.server = server;
    }
}
