package io.github.yok.rethinkdblink.db;

import lombok.Getter;

/**
 * Thrown by a {@link RethinkDriver} when the server rejects a create call because the database or
 * table already exists, typically because another session created it after this one listed the
 * existing names.
 */
@Getter
public class EntityAlreadyExistsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Name of the database or table that already exists
    private final String entityName;

    /**
     * Creates the exception.
     *
     * @param entityName database or table name
     * @param cause server error that reported the duplicate
     */
    public EntityAlreadyExistsException(String entityName, Throwable cause) {
        super("'" + entityName + "' already exists", cause);
        this.entityName = entityName;
    }
}
