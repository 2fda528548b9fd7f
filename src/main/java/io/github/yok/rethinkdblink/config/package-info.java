/**
 * Configuration model package for RethinkDBLink.
 *
 * <p>
 * {@link io.github.yok.rethinkdblink.config.RethinkProperties} holds the mutable values bound
 * from {@code application.yml}; {@link io.github.yok.rethinkdblink.config.SessionConfig} is the
 * validated, immutable form handed to the session initializer.
 * </p>
 */
package io.github.yok.rethinkdblink.config;
