package io.github.yok.sqlrestore.core;

import io.github.yok.sqlrestore.catalog.DumpFileName;
import io.github.yok.sqlrestore.catalog.DumpFileType;
import io.github.yok.sqlrestore.db.RestoreConnection;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Replays the row data of one table file, or one shard of a table, on one connection.
 *
 * <p>
 * Thread-safe: the restorer holds no state, so one instance is shared by all workers.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableRestorer {

    /**
     * Restores one data file.
     *
     * @param connection connection held by the calling worker
     * @param tablePath {@code <db>.<table>[.<part>].sql} file
     * @return size of the file in bytes
     * @throws RestoreException if the file name is malformed, the file cannot be read, or a
     *         statement fails
     */
    public long restoreTable(RestoreConnection connection, Path tablePath) {
        DumpFileName name = RestoreSteps.parse(tablePath, DumpFileType.TABLE_DATA);
        log.info("Restoring table[{}] part[{}] (connection={})", name.getQualifiedName(),
                name.getPartOrDefault(), connection.getId());

        RestoreSteps.useDatabase(connection, tablePath, name);
        SqlScript script = RestoreSteps.read(tablePath, name, connection);
        int executed = 0;
        for (String statement : script.statements()) {
            RestoreSteps.execute(connection, tablePath, name, statement);
            executed++;
        }

        log.info("Restored table[{}] part[{}] (connection={}, statements={}, bytes={})",
                name.getQualifiedName(), name.getPartOrDefault(), connection.getId(), executed,
                script.getByteLength());
        return script.getByteLength();
    }
}
