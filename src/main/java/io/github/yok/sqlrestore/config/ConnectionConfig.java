package io.github.yok.sqlrestore.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the target server connection settings.
 *
 * <pre>
 * connection:
 *   url: jdbc:mysql://127.0.0.1:3306/?allowMultiQueries=true
 *   user: root
 *   password: secret
 *   driver-class: com.mysql.cj.jdbc.Driver
 * </pre>
 *
 * <p>
 * The URL must not select a database; every restored file selects its own database with
 * {@code USE}. {@code allowMultiQueries=true} is needed when a database schema file contains more
 * than one statement.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // JDBC connection URL of the target server
    private String url;
    // Database user name
    private String user;
    // Database password
    @ToString.Exclude
    private String password;
    // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
    private String driverClass;
}
