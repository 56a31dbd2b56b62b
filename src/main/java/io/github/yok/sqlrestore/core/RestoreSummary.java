package io.github.yok.sqlrestore.core;

import java.time.Duration;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Snapshot of restore throughput: elapsed time, bytes processed and completed table files.
 *
 * <p>
 * Used for both the periodic progress lines and the final summary.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
@ToString
public final class RestoreSummary {

    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    private final Duration elapsed;
    private final long bytes;
    private final int completedTables;
    private final int totalTables;

    /**
     * Returns the processed volume in MiB.
     *
     * @return megabytes
     */
    public double getMegabytes() {
        return bytes / BYTES_PER_MEGABYTE;
    }

    /**
     * Returns the elapsed time in fractional seconds.
     *
     * @return seconds
     */
    public double getElapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }

    /**
     * Returns the average rate in MiB per second, or {@code 0} before any time has elapsed.
     *
     * @return megabytes per second
     */
    public double getMegabytesPerSecond() {
        double seconds = getElapsedSeconds();
        return seconds > 0 ? getMegabytes() / seconds : 0.0;
    }
}
