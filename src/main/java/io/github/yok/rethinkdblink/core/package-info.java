/**
 * Session initialization package.
 *
 * <p>
 * {@link io.github.yok.rethinkdblink.core.SessionInitializer} connects to the server and runs the
 * database and table provisioning steps; the outcome of a run is a
 * {@link io.github.yok.rethinkdblink.core.RethinkSession}. Server access goes through the driver
 * port in {@code db}.
 * </p>
 */
package io.github.yok.rethinkdblink.core;
