package io.github.yok.rethinkdblink.config;

/**
 * Decides when a session checks for (and creates) its table.
 *
 * @author Yasuharu.Okawauchi
 */
public enum TableProvisioningPolicy {

    /**
     * Provision the table only when the same session run created the database. An existing
     * database never gets its table checked.
     */
    WHEN_DATABASE_CREATED,

    /**
     * Provision the table whenever the database step did not fail.
     */
    ALWAYS
}
