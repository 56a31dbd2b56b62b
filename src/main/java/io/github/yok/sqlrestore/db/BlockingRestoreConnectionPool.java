package io.github.yok.sqlrestore.db;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RestoreConnectionPool} holding a fixed set of connections in a blocking queue.
 *
 * <p>
 * A connection is either in the free queue or checked out, never both. Releasing a connection that
 * is not checked out (a double release, or a foreign connection) is rejected so that pool
 * accounting cannot drift.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BlockingRestoreConnectionPool implements RestoreConnectionPool {

    private final ImmutableList<RestoreConnection> connections;
    private final BlockingQueue<RestoreConnection> free;
    private final Set<RestoreConnection> checkedOut =
            Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));
    private volatile boolean closed;

    /**
     * Creates a pool over already opened connections.
     *
     * @param connections connections to pool; must not be empty
     */
    public BlockingRestoreConnectionPool(List<? extends RestoreConnection> connections) {
        Preconditions.checkArgument(connections != null && !connections.isEmpty(),
                "connections must not be empty");
        this.connections = ImmutableList.copyOf(connections);
        this.free = new ArrayBlockingQueue<>(this.connections.size(), true, this.connections);
    }

    /**
     * Opens {@code size} connections with ids {@code 1..size} and pools them.
     *
     * <p>
     * If any connection fails to open, the ones already opened are closed before the failure is
     * rethrown.
     * </p>
     *
     * @param size number of connections
     * @param factory connection factory
     * @return new pool
     * @throws SQLException if a connection cannot be opened
     */
    public static BlockingRestoreConnectionPool create(int size, RestoreConnectionFactory factory)
            throws SQLException {
        Preconditions.checkArgument(size > 0, "pool size must be positive: %s", size);
        List<RestoreConnection> opened = new ArrayList<>(size);
        try {
            for (int id = 1; id <= size; id++) {
                opened.add(factory.open(id));
            }
        } catch (SQLException | RuntimeException e) {
            for (RestoreConnection conn : opened) {
                closeQuietly(conn);
            }
            throw e;
        }
        log.info("Connection pool created: size={}", size);
        return new BlockingRestoreConnectionPool(opened);
    }

    @Override
    public RestoreConnection acquire() throws InterruptedException {
        Preconditions.checkState(!closed, "connection pool is closed");
        RestoreConnection conn = free.take();
        checkedOut.add(conn);
        return conn;
    }

    @Override
    public void release(RestoreConnection connection) {
        Preconditions.checkNotNull(connection, "connection must not be null");
        if (!checkedOut.remove(connection)) {
            throw new IllegalStateException(
                    "Connection[" + connection.getId() + "] is not checked out of this pool");
        }
        free.add(connection);
    }

    @Override
    public int size() {
        return connections.size();
    }

    /**
     * Returns the number of connections currently checked out.
     *
     * @return in-use connection count
     */
    public int inUse() {
        return checkedOut.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!checkedOut.isEmpty()) {
            log.warn("Closing connection pool with {} connection(s) still in use",
                    checkedOut.size());
        }
        for (RestoreConnection conn : connections) {
            closeQuietly(conn);
        }
        log.info("Connection pool closed: size={}", connections.size());
    }

    private static void closeQuietly(RestoreConnection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection[{}]: {}", conn.getId(), e.getMessage(), e);
        }
    }
}
