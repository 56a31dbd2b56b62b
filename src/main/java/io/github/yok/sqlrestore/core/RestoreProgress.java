package io.github.yok.sqlrestore.core;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared counters of the row-data phase.
 *
 * <p>
 * Workers add the size of each restored file; the reporter and the final summary only read. The
 * byte counter never decreases.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class RestoreProgress {

    private final AtomicLong bytes = new AtomicLong();
    private final AtomicInteger completedTables = new AtomicInteger();
    private final Stopwatch stopwatch;
    private final int totalTables;

    /**
     * Creates progress counters measured with the system ticker.
     *
     * @param totalTables number of table files to restore
     */
    public RestoreProgress(int totalTables) {
        this(totalTables, Ticker.systemTicker());
    }

    /**
     * Creates progress counters measured with the given ticker.
     *
     * @param totalTables number of table files to restore
     * @param ticker time source
     */
    RestoreProgress(int totalTables, Ticker ticker) {
        this.totalTables = totalTables;
        this.stopwatch = Stopwatch.createUnstarted(ticker);
    }

    /**
     * Starts measuring elapsed time. Called when row-data dispatch begins.
     */
    public synchronized void start() {
        if (!stopwatch.isRunning()) {
            stopwatch.start();
        }
    }

    /**
     * Records one completed table file.
     *
     * @param fileBytes size of the restored file
     * @return cumulative bytes after this addition
     * @throws IllegalArgumentException if {@code fileBytes} is negative
     */
    public long tableCompleted(long fileBytes) {
        Preconditions.checkArgument(fileBytes >= 0, "bytes must not be negative: %s", fileBytes);
        completedTables.incrementAndGet();
        return bytes.addAndGet(fileBytes);
    }

    /**
     * Returns the cumulative number of bytes restored.
     *
     * @return bytes
     */
    public long getBytes() {
        return bytes.get();
    }

    /**
     * Returns the current throughput snapshot.
     *
     * @return summary of elapsed time, bytes and completed tables
     */
    public synchronized RestoreSummary snapshot() {
        return new RestoreSummary(stopwatch.elapsed(), bytes.get(), completedTables.get(),
                totalTables);
    }
}
