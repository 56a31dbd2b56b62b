package io.github.yok.sqlrestore.core;

import io.github.yok.sqlrestore.catalog.DumpFileName;
import io.github.yok.sqlrestore.catalog.DumpFileType;
import io.github.yok.sqlrestore.db.RestoreConnection;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Replays database and table definitions on a single connection.
 *
 * <p>
 * Both phases run strictly in list order and have no partial-success semantics: the first read or
 * execution failure aborts the restore with a {@link RestoreException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaRestorer {

    /**
     * Executes every {@code *-schema-create.sql} file as one batch.
     *
     * @param connection connection to use
     * @param databasePaths database schema files in replay order
     * @throws RestoreException if a file cannot be read or executed
     */
    public void restoreDatabaseSchemas(RestoreConnection connection, List<Path> databasePaths) {
        for (Path file : databasePaths) {
            DumpFileName name = RestoreSteps.parse(file, DumpFileType.DATABASE_SCHEMA);
            SqlScript script = RestoreSteps.read(file, name, connection);
            try {
                connection.execute(script.getText());
            } catch (SQLException e) {
                throw new RestoreException(String.format("Failed to create database (%s): %s",
                        RestoreSteps.describe(file, name, connection), e.getMessage()), e);
            }
            log.info("Restored database[{}] (connection={})", name.getDatabase(),
                    connection.getId());
        }
    }

    /**
     * Executes the DDL statements of every {@code *-schema.sql} file after selecting its database.
     *
     * @param connection connection to use
     * @param schemaPaths table schema files in replay order
     * @throws RestoreException if a file cannot be read or a statement fails
     */
    public void restoreTableSchemas(RestoreConnection connection, List<Path> schemaPaths) {
        for (Path file : schemaPaths) {
            DumpFileName name = RestoreSteps.parse(file, DumpFileType.TABLE_SCHEMA);
            RestoreSteps.useDatabase(connection, file, name);
            SqlScript script = RestoreSteps.read(file, name, connection);
            for (String statement : script.statements()) {
                RestoreSteps.execute(connection, file, name, statement);
            }
            log.info("Restored schema[{}] (connection={})", name.getQualifiedName(),
                    connection.getId());
        }
    }
}
