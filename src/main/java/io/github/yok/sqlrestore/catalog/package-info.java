/**
 * Dump file discovery and classification.
 */
package io.github.yok.sqlrestore.catalog;
