package io.github.yok.rethinkdblink.core;

/**
 * Kind of server entity a provisioning step deals with.
 */
public enum EntityKind {
    DATABASE,
    TABLE
}
