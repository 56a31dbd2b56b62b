package io.github.yok.sqlrestore.db;

import java.sql.SQLException;

/**
 * Opens new server connections for the pool.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface RestoreConnectionFactory {

    /**
     * Opens a connection.
     *
     * @param id 1-based identity to assign to the connection
     * @return open connection
     * @throws SQLException if the server cannot be reached or rejects the credentials
     */
    RestoreConnection open(int id) throws SQLException;
}
