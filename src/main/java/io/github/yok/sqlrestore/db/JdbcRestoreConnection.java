package io.github.yok.sqlrestore.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * {@link RestoreConnection} backed by a JDBC {@link Connection}.
 *
 * <p>
 * Every call to {@link #execute(String)} runs on a fresh {@link Statement}; the connection stays in
 * auto-commit mode so each statement is committed as soon as the server accepts it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class JdbcRestoreConnection implements RestoreConnection {

    @Getter
    private final int id;

    private final Connection connection;

    @Override
    public void execute(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    @Override
    public String toString() {
        return "JdbcRestoreConnection[" + id + "]";
    }
}
