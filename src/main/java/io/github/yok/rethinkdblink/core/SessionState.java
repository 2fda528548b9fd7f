package io.github.yok.rethinkdblink.core;

/**
 * States a session passes through during initialization.
 *
 * <pre>
 * DISCONNECTED -&gt; CONNECTED -&gt; DATABASE_CHECKED -&gt; [DATABASE_CREATED | DATABASE_EXISTED]
 *              -&gt; TABLE_CHECKED -&gt; READY
 * </pre>
 *
 * <p>
 * With the default table policy {@code DATABASE_EXISTED} goes straight to {@code READY}. A failed
 * database step also ends in {@code READY} without visiting either branch state.
 * </p>
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTED,
    DATABASE_CHECKED,
    DATABASE_CREATED,
    DATABASE_EXISTED,
    TABLE_CHECKED,
    READY
}
