/**
 * Root package of SqlRestore.
 *
 * <p>
 * Provides a CLI that restores a directory of SQL dump files into a MySQL-compatible server using
 * several connections in parallel.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.sqlrestore.catalog}: dump file discovery and file name parsing</li>
 * <li>{@code io.github.yok.sqlrestore.core}: restore phases, worker dispatch and progress</li>
 * <li>{@code io.github.yok.sqlrestore.db}: server connections and the connection pool</li>
 * <li>{@code io.github.yok.sqlrestore.config}: configuration models</li>
 * </ul>
 */
package io.github.yok.sqlrestore;
