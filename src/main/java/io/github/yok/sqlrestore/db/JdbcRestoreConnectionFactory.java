package io.github.yok.sqlrestore.db;

import io.github.yok.sqlrestore.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Opens {@link JdbcRestoreConnection}s through {@link DriverManager} using the {@code connection.*}
 * settings.
 *
 * <p>
 * When {@code connection.driver-class} is configured, the driver is loaded explicitly before the
 * first connection is opened; otherwise JDBC 4 auto-loading is relied on.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcRestoreConnectionFactory implements RestoreConnectionFactory {

    private final ConnectionConfig connectionConfig;

    @Override
    public RestoreConnection open(int id) throws SQLException {
        loadDriverIfConfigured();
        Connection jdbc = DriverManager.getConnection(connectionConfig.getUrl(),
                connectionConfig.getUser(), connectionConfig.getPassword());
        try {
            jdbc.setAutoCommit(true);
        } catch (SQLException e) {
            jdbc.close();
            throw e;
        }
        log.debug("Opened connection[{}] to {}", id, connectionConfig.getUrl());
        return new JdbcRestoreConnection(id, jdbc);
    }

    private void loadDriverIfConfigured() throws SQLException {
        String driverClass = connectionConfig.getDriverClass();
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver class not found: " + driverClass, e);
        }
    }
}
