/**
 * Database driver package.
 *
 * <p>
 * {@link io.github.yok.rethinkdblink.db.RethinkDriver} is the boundary between the session
 * logic in {@code core} and the server. The production implementation in {@code db.rethink}
 * delegates to the official RethinkDB Java driver.
 * </p>
 */
package io.github.yok.rethinkdblink.db;
