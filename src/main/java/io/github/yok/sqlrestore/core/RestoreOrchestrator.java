package io.github.yok.sqlrestore.core;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.sqlrestore.catalog.DumpFileSet;
import io.github.yok.sqlrestore.db.RestoreConnection;
import io.github.yok.sqlrestore.db.RestoreConnectionPool;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a restore through its three phases.
 *
 * <ol>
 * <li>Database definitions, on one pooled connection.</li>
 * <li>Table definitions, on one pooled connection.</li>
 * <li>Row data: the table files are shuffled and each one is restored by a worker holding its own
 * pooled connection. The driver thread acquires the connection before submitting the work, so at
 * most {@link RestoreConnectionPool#size()} files are restored at once.</li>
 * </ol>
 *
 * <p>
 * Phases 1 and 2 complete before any row data is sent. The first failure in any phase is fatal:
 * no further table file is dispatched, work already running is allowed to finish, and the failure
 * is rethrown to the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RestoreOrchestrator {

    private final RestoreConnectionPool pool;
    private final SchemaRestorer schemaRestorer;
    private final TableRestorer tableRestorer;
    private final Duration reportInterval;
    private final Random random;

    /**
     * Creates an orchestrator with the default restorers.
     *
     * @param pool connection pool; its size is the row-data concurrency
     * @param reportInterval progress report interval
     */
    public RestoreOrchestrator(RestoreConnectionPool pool, Duration reportInterval) {
        this(pool, new SchemaRestorer(), new TableRestorer(), reportInterval, new SecureRandom());
    }

    /**
     * Creates an orchestrator with custom collaborators (for tests).
     *
     * @param pool connection pool
     * @param schemaRestorer schema phase restorer
     * @param tableRestorer row-data restorer
     * @param reportInterval progress report interval
     * @param random source of the table order
     */
    RestoreOrchestrator(RestoreConnectionPool pool, SchemaRestorer schemaRestorer,
            TableRestorer tableRestorer, Duration reportInterval, Random random) {
        this.pool = Preconditions.checkNotNull(pool, "pool must not be null");
        this.schemaRestorer = schemaRestorer;
        this.tableRestorer = tableRestorer;
        this.reportInterval = reportInterval;
        this.random = random;
    }

    /**
     * Restores the given dump.
     *
     * @param files classified dump files
     * @return final throughput summary of the row-data phase
     * @throws RestoreException on the first read or execution failure
     */
    public RestoreSummary execute(DumpFileSet files) {
        log.info("=== Restore started (databases={}, schemas={}, tables={}, threads={}) ===",
                files.getDatabases().size(), files.getSchemas().size(), files.getTables().size(),
                pool.size());

        RestoreConnection conn = acquire();
        try {
            schemaRestorer.restoreDatabaseSchemas(conn, files.getDatabases());
        } finally {
            pool.release(conn);
        }

        conn = acquire();
        try {
            schemaRestorer.restoreTableSchemas(conn, files.getSchemas());
        } finally {
            pool.release(conn);
        }

        List<Path> tables = shuffle(files.getTables(), random);
        RestoreSummary summary = restoreTables(tables);

        log.info(String.format(
                "=== Restore completed: elapsed %.2f sec, %.2f MB, %.2f MB/sec (tables=%d) ===",
                summary.getElapsedSeconds(), summary.getMegabytes(),
                summary.getMegabytesPerSecond(), summary.getCompletedTables()));
        return summary;
    }

    /**
     * Returns a uniformly shuffled copy of the table files.
     *
     * <p>
     * Dump writers emit the shards of a large table next to each other; restoring them in that
     * order would put the same table on every worker at once.
     * </p>
     *
     * @param tables table files in discovery order
     * @param random randomness source
     * @return new mutable list holding the same files in random order
     */
    static List<Path> shuffle(List<Path> tables, Random random) {
        List<Path> shuffled = new ArrayList<>(tables);
        Collections.shuffle(shuffled, random);
        return shuffled;
    }

    private RestoreSummary restoreTables(List<Path> tables) {
        RestoreProgress progress = new RestoreProgress(tables.size());
        AtomicReference<Throwable> failure = new AtomicReference<>();
        List<CompletableFuture<Long>> dispatched = new ArrayList<>(tables.size());
        ExecutorService workers = Executors.newFixedThreadPool(pool.size(),
                new ThreadFactoryBuilder().setNameFormat("restore-worker-%d").setDaemon(true)
                        .build());

        try (ProgressReporter reporter = new ProgressReporter(progress, reportInterval)) {
            progress.start();
            reporter.start();

            for (Path table : tables) {
                if (failure.get() != null) {
                    break;
                }
                RestoreConnection conn = acquire();
                if (failure.get() != null) {
                    pool.release(conn);
                    break;
                }
                dispatched.add(CompletableFuture
                        .supplyAsync(() -> tableRestorer.restoreTable(conn, table), workers)
                        .whenComplete((bytes, ex) -> {
                            try {
                                if (ex == null) {
                                    progress.tableCompleted(bytes);
                                } else {
                                    failure.compareAndSet(null, unwrap(ex));
                                }
                            } finally {
                                pool.release(conn);
                            }
                        }));
            }

            awaitAll(dispatched);
        } finally {
            workers.shutdown();
        }

        Throwable cause = failure.get();
        if (cause != null) {
            log.error("Restore aborted: {}/{} table file(s) restored, {} not dispatched",
                    progress.snapshot().getCompletedTables(), tables.size(),
                    tables.size() - dispatched.size());
            if (cause instanceof RestoreException) {
                throw (RestoreException) cause;
            }
            throw new RestoreException("Table restore failed: " + cause.getMessage(), cause);
        }
        return progress.snapshot();
    }

    private RestoreConnection acquire() {
        try {
            return pool.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RestoreException("Interrupted while waiting for a connection", e);
        }
    }

    private static void awaitAll(List<CompletableFuture<Long>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            // Recorded by the failing unit; every dispatched unit has completed at this point.
            log.debug("Row-data phase completed with a failure: {}", e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable ex) {
        return (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
    }
}
