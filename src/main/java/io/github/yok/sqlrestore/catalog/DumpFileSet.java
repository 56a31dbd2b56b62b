package io.github.yok.sqlrestore.catalog;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Classified contents of a dump directory.
 *
 * <p>
 * Each list keeps the order in which the catalog walk visited the files. The set is immutable;
 * the orchestrator shuffles its own copy of {@link #getTables()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DumpFileSet {

    // *-schema-create.sql files, replayed first
    private final ImmutableList<Path> databases;

    // *-schema.sql files, replayed second
    private final ImmutableList<Path> schemas;

    // Remaining *.sql files, restored in parallel
    private final ImmutableList<Path> tables;

    /**
     * Creates a file set.
     *
     * @param databases database schema files
     * @param schemas table schema files
     * @param tables table data files
     */
    public DumpFileSet(List<Path> databases, List<Path> schemas, List<Path> tables) {
        this.databases = ImmutableList.copyOf(databases);
        this.schemas = ImmutableList.copyOf(schemas);
        this.tables = ImmutableList.copyOf(tables);
    }

    /**
     * Returns the number of classified files.
     *
     * @return total file count
     */
    public int size() {
        return databases.size() + schemas.size() + tables.size();
    }

    /**
     * Returns whether the dump contains nothing to restore.
     *
     * @return {@code true} if no file was classified
     */
    public boolean isEmpty() {
        return size() == 0;
    }
}
