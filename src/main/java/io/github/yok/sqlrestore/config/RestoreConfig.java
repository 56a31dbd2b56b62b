package io.github.yok.sqlrestore.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds restore run settings.
 *
 * <p>
 * You can specify the following properties in {@code application.yml}; the command line of
 * {@link io.github.yok.sqlrestore.Main} overrides them.
 * </p>
 * <ul>
 * <li>{@code restore.dump-dir}: dump directory to restore</li>
 * <li>{@code restore.threads}: number of pooled connections, and therefore of concurrent table
 * restores</li>
 * <li>{@code restore.interval-ms}: progress report interval in milliseconds</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "restore")
@Data
public class RestoreConfig {

    // Directory that holds the dump files
    private String dumpDir;

    // Pool size / worker count
    private int threads = 16;

    // Progress report interval
    private long intervalMs = 10_000L;

    /**
     * Returns the dump directory as a path.
     *
     * @return dump directory
     * @throws IllegalStateException if {@code dumpDir} has not been set
     */
    public Path getDumpPath() {
        if (StringUtils.isBlank(dumpDir)) {
            throw new IllegalStateException(
                    "restore.dump-dir is not configured. Please set it in application.yml "
                            + "or pass --dir.");
        }
        return Paths.get(dumpDir);
    }

    /**
     * Checks that the settings describe a runnable restore.
     *
     * @throws IllegalStateException if the dump directory is missing or a numeric setting is not
     *         positive
     */
    public void validate() {
        getDumpPath();
        if (threads < 1) {
            throw new IllegalStateException("restore.threads must be at least 1: " + threads);
        }
        if (intervalMs < 1) {
            throw new IllegalStateException("restore.interval-ms must be at least 1: " + intervalMs);
        }
    }
}
