package io.github.yok.sqlrestore.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal restore error and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * A restore is all-or-nothing, so every failure that reaches the top of the run ends up here
 * before the process exits with a non-zero status.
 * </p>
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error and the full stack trace using SLF4J.</li>
 * <li>Writes the message and the root cause message to {@code System.err} so the operator can find
 * the offending dump file without reading the log.</li>
 * <li>Does not terminate the JVM by itself; {@link io.github.yok.sqlrestore.Main} owns the exit
 * code.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via thread-local flags.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the given message and cause at error level and prints the message together with the
     * root cause message to {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws an exception instead.
     * </p>
     *
     * @param message message to log
     * @param cause failure that aborted the restore
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        Throwable root = ExceptionUtils.getRootCause(cause);
        System.err.println("ERROR: " + message + "\n"
                + (root != null ? root.getMessage() : cause.getMessage()));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws an exception instead.
     * </p>
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
