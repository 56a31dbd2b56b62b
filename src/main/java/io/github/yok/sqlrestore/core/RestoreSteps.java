package io.github.yok.sqlrestore.core;

import io.github.yok.sqlrestore.catalog.DumpFileName;
import io.github.yok.sqlrestore.catalog.DumpFileType;
import io.github.yok.sqlrestore.db.RestoreConnection;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Steps shared by {@link SchemaRestorer} and {@link TableRestorer}. Each step converts its
 * failure into a {@link RestoreException} carrying the file context.
 */
final class RestoreSteps {

    // Maximum statement length quoted in error messages
    static final int STATEMENT_PREVIEW_LENGTH = 200;

    @Generated
    private RestoreSteps() {}

    static DumpFileName parse(Path file, DumpFileType type) {
        try {
            return DumpFileName.parse(file, type);
        } catch (IllegalArgumentException e) {
            throw new RestoreException(e.getMessage(), e);
        }
    }

    static SqlScript read(Path file, DumpFileName name, RestoreConnection connection) {
        try {
            return SqlScript.read(file);
        } catch (IOException e) {
            throw new RestoreException(String.format("Failed to read dump file (%s): %s",
                    describe(file, name, connection), e.getMessage()), e);
        }
    }

    static void useDatabase(RestoreConnection connection, Path file, DumpFileName name) {
        try {
            connection.useDatabase(name.getDatabase());
        } catch (SQLException e) {
            throw new RestoreException(String.format("Failed to select database (%s): %s",
                    describe(file, name, connection), e.getMessage()), e);
        }
    }

    static void execute(RestoreConnection connection, Path file, DumpFileName name,
            String statement) {
        try {
            connection.execute(statement);
        } catch (SQLException e) {
            throw new RestoreException(String.format("Statement failed (%s): %s%n  statement: %s",
                    describe(file, name, connection), e.getMessage(),
                    StringUtils.abbreviate(statement.strip(), STATEMENT_PREVIEW_LENGTH)), e);
        }
    }

    /**
     * Renders the file context of an error.
     *
     * @param file dump file
     * @param name parsed file name
     * @param connection connection in use
     * @return context string such as
     *         {@code file=shop.orders.2.sql, database=shop, table=orders, part=2, connection=3}
     */
    static String describe(Path file, DumpFileName name, RestoreConnection connection) {
        StringBuilder sb = new StringBuilder();
        sb.append("file=").append(file.getFileName());
        sb.append(", database=").append(name.getDatabase());
        if (name.getTable() != null) {
            sb.append(", table=").append(name.getTable());
        }
        if (name.getType() == DumpFileType.TABLE_DATA) {
            sb.append(", part=").append(name.getPartOrDefault());
        }
        sb.append(", connection=").append(connection.getId());
        return sb.toString();
    }
}
