/**
 * Configuration model package for SqlRestore.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: the target server
 * connection and the restore run settings. Execution logic is implemented in {@code core}.
 * </p>
 */
package io.github.yok.sqlrestore.config;
