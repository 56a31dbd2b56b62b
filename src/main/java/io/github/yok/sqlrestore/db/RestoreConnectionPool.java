package io.github.yok.sqlrestore.db;

/**
 * Fixed-size pool of {@link RestoreConnection}s shared by the restore workers.
 *
 * @author Yasuharu.Okawauchi
 */
public interface RestoreConnectionPool extends AutoCloseable {

    /**
     * Takes a free connection, waiting until one is released if all are in use.
     *
     * @return connection owned by the caller until {@link #release(RestoreConnection)}
     * @throws InterruptedException if interrupted while waiting
     */
    RestoreConnection acquire() throws InterruptedException;

    /**
     * Returns a connection obtained from {@link #acquire()}.
     *
     * @param connection connection to return
     * @throws IllegalStateException if the connection is not currently checked out of this pool
     */
    void release(RestoreConnection connection);

    /**
     * Returns the fixed number of connections in the pool.
     *
     * @return pool size
     */
    int size();

    /**
     * Closes every connection of the pool.
     */
    @Override
    void close();
}
