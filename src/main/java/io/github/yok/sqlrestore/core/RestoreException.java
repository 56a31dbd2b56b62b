package io.github.yok.sqlrestore.core;

/**
 * Unchecked exception thrown when a restore cannot proceed.
 *
 * <p>
 * Covers both precondition failures (unreadable dump directory, unidentifiable file name, pool
 * construction failure) and execution failures (a statement rejected by the server). The message
 * always names the dump file and, where known, the database, table, part and connection involved,
 * so the operator can locate the offending file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class RestoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message only.
     *
     * @param message failure description including file context
     */
    public RestoreException(String message) {
        super(message);
    }

    /**
     * Creates an exception wrapping the underlying failure.
     *
     * @param message failure description including file context
     * @param cause underlying I/O or SQL failure
     */
    public RestoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
