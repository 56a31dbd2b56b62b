package io.github.yok.sqlrestore.core;

import io.github.yok.sqlrestore.catalog.DumpFileCatalog;
import io.github.yok.sqlrestore.catalog.DumpFileSet;
import io.github.yok.sqlrestore.config.ConnectionConfig;
import io.github.yok.sqlrestore.config.RestoreConfig;
import io.github.yok.sqlrestore.db.BlockingRestoreConnectionPool;
import io.github.yok.sqlrestore.db.JdbcRestoreConnectionFactory;
import io.github.yok.sqlrestore.db.RestoreConnectionPool;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of one restore run: catalogs the dump directory, opens the connection pool and hands
 * both to a {@link RestoreOrchestrator}.
 *
 * <p>
 * The catalog is built before any connection is opened, so a bad dump directory fails without
 * touching the server. The pool is always closed when the run ends.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DumpLoader {

    /**
     * Opens the connection pool for a run.
     */
    @FunctionalInterface
    interface PoolProvider {

        /**
         * Opens a pool.
         *
         * @param size number of connections
         * @return open pool
         * @throws SQLException if a connection cannot be opened
         */
        RestoreConnectionPool open(int size) throws SQLException;
    }

    private final RestoreConfig restoreConfig;
    private final DumpFileCatalog catalog;
    private final PoolProvider poolProvider;
    private final Function<RestoreConnectionPool, RestoreOrchestrator> orchestratorFactory;

    /**
     * Creates a loader that connects through JDBC.
     *
     * @param connectionConfig connection settings
     * @param restoreConfig run settings
     */
    public DumpLoader(ConnectionConfig connectionConfig, RestoreConfig restoreConfig) {
        this(restoreConfig, new DumpFileCatalog(),
                size -> BlockingRestoreConnectionPool.create(size,
                        new JdbcRestoreConnectionFactory(connectionConfig)),
                pool -> new RestoreOrchestrator(pool,
                        Duration.ofMillis(restoreConfig.getIntervalMs())));
    }

    /**
     * Creates a loader with custom collaborators (for tests).
     *
     * @param restoreConfig run settings
     * @param catalog dump catalog
     * @param poolProvider pool provider
     * @param orchestratorFactory orchestrator factory
     */
    DumpLoader(RestoreConfig restoreConfig, DumpFileCatalog catalog, PoolProvider poolProvider,
            Function<RestoreConnectionPool, RestoreOrchestrator> orchestratorFactory) {
        this.restoreConfig = restoreConfig;
        this.catalog = catalog;
        this.poolProvider = poolProvider;
        this.orchestratorFactory = orchestratorFactory;
    }

    /**
     * Restores the configured dump directory.
     *
     * @return final throughput summary
     * @throws RestoreException if the dump cannot be read, the pool cannot be opened, or any
     *         statement fails
     */
    public RestoreSummary execute() {
        Path dumpDir = restoreConfig.getDumpPath();
        log.info("=== DumpLoader started (dir={}, threads={}) ===", dumpDir.toAbsolutePath(),
                restoreConfig.getThreads());

        DumpFileSet files = catalog.load(dumpDir);
        if (files.isEmpty()) {
            log.warn("No dump files found under {}", dumpDir.toAbsolutePath());
        }

        RestoreConnectionPool pool;
        try {
            pool = poolProvider.open(restoreConfig.getThreads());
        } catch (SQLException e) {
            throw new RestoreException("Failed to open connection pool (threads="
                    + restoreConfig.getThreads() + "): " + e.getMessage(), e);
        }

        try (pool) {
            RestoreSummary summary = orchestratorFactory.apply(pool).execute(files);
            log.info("=== DumpLoader finished ===");
            return summary;
        }
    }
}
