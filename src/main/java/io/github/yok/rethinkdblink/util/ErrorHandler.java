package io.github.yok.rethinkdblink.util;

import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal errors of the command-line runner.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the message and the full stack trace through SLF4J.</li>
 * <li>Writes one concise line, with the root cause, to {@code System.err}.</li>
 * <li>Does not terminate the JVM; the caller decides how the process ends.</li>
 * <li>Tests can make it throw instead, per thread.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Prevents instantiation.
     */
    @Generated
    private ErrorHandler() {}

    /**
     * Makes {@code errorAndExit} throw {@link IllegalStateException} on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a fatal error with its cause.
     *
     * @param message what failed
     * @param cause underlying exception
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + " (" + ExceptionUtils.getRootCauseMessage(cause)
                + ")");
    }

    /**
     * Reports a fatal error without an underlying exception.
     *
     * @param message what failed
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
