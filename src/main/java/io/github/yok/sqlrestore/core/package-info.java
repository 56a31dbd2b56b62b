/**
 * Core restore workflow.
 *
 * <p>
 * {@link io.github.yok.sqlrestore.core.DumpLoader} runs one restore;
 * {@link io.github.yok.sqlrestore.core.RestoreOrchestrator} sequences the database, schema and
 * row-data phases.
 * </p>
 */
package io.github.yok.sqlrestore.core;
