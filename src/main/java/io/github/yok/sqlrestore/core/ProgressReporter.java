package io.github.yok.sqlrestore.core;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs restore throughput on a fixed interval while the row-data phase runs.
 *
 * <p>
 * {@link #stop()} shuts the scheduler down with {@code shutdownNow()}, which interrupts a pending
 * wait and ends the reporting thread at once; no thread outlives the restore.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ProgressReporter implements AutoCloseable {

    // Maximum wait for the reporting thread to finish on stop
    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final RestoreProgress progress;
    private final Duration interval;
    private ScheduledExecutorService scheduler;
    private boolean stopped;

    /**
     * Creates a reporter.
     *
     * @param progress counters to sample
     * @param interval time between two reports
     */
    public ProgressReporter(RestoreProgress progress, Duration interval) {
        Preconditions.checkArgument(!interval.isNegative() && !interval.isZero(),
                "interval must be positive: %s", interval);
        this.progress = progress;
        this.interval = interval;
    }

    /**
     * Starts periodic reporting. The first report is logged one interval after this call.
     *
     * @throws IllegalStateException if the reporter was already started
     */
    public synchronized void start() {
        Preconditions.checkState(scheduler == null && !stopped, "reporter already started");
        scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("restore-progress").setDaemon(true).build());
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::report, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Logs one progress line.
     *
     * @return the snapshot that was logged
     */
    RestoreSummary report() {
        RestoreSummary snapshot = progress.snapshot();
        log.info(String.format("Restoring: %.2f MB in %.2f sec (%.2f MB/sec), tables %d/%d",
                snapshot.getMegabytes(), snapshot.getElapsedSeconds(),
                snapshot.getMegabytesPerSecond(), snapshot.getCompletedTables(),
                snapshot.getTotalTables()));
        return snapshot;
    }

    /**
     * Stops reporting and waits for the reporting thread to end. Safe to call more than once.
     */
    public synchronized void stop() {
        stopped = true;
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Progress reporter did not stop within {} sec", STOP_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Returns whether the reporting thread has ended.
     *
     * @return {@code true} once stopped and terminated, or if never started
     */
    public synchronized boolean isTerminated() {
        return scheduler == null || scheduler.isTerminated();
    }

    @Override
    public void close() {
        stop();
    }
}
