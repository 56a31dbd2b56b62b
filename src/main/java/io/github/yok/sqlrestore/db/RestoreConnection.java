package io.github.yok.sqlrestore.db;

import java.sql.SQLException;

/**
 * A live server connection used by the restorers.
 *
 * <p>
 * Each instance is used by at most one unit of work at a time; the pool guarantees this.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface RestoreConnection extends AutoCloseable {

    /**
     * Returns the identity of this connection, used in log lines and error context.
     *
     * @return 1-based connection id assigned by the pool
     */
    int getId();

    /**
     * Executes one or more statements on the server.
     *
     * @param sql SQL text
     * @throws SQLException if the server rejects the statement or the connection is lost
     */
    void execute(String sql) throws SQLException;

    /**
     * Selects the default database for subsequent statements.
     *
     * @param database database name (backticks are escaped)
     * @throws SQLException if the database does not exist or the connection is lost
     */
    default void useDatabase(String database) throws SQLException {
        execute("USE `" + database.replace("`", "``") + "`");
    }

    /**
     * Closes the underlying server connection.
     *
     * @throws SQLException on close failure
     */
    @Override
    void close() throws SQLException;
}
