package io.github.yok.sqlrestore.catalog;

import io.github.yok.sqlrestore.core.RestoreException;
import io.github.yok.sqlrestore.util.LogPathUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Walks a dump directory and classifies every regular file by suffix.
 *
 * <p>
 * Entries of each directory are visited in lexical order, depth first, so the replay order of
 * database and table schema files is stable across platforms. Files whose names match no
 * {@link DumpFileType} are ignored. Symbolic links to directories are not followed.
 * </p>
 *
 * <p>
 * Any I/O failure during the walk is fatal: a restore cannot start without knowing what to load.
 * The same holds for a classified file whose name does not yield its database (and, for table
 * files, its table); such a dump is rejected here, before any connection is opened.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DumpFileCatalog {

    /**
     * Builds the file set for the given dump directory.
     *
     * @param root dump directory
     * @return classified files in visit order
     * @throws RestoreException if the directory does not exist, is not a directory, cannot be
     *         read, or holds a dump file whose name cannot be identified
     */
    public DumpFileSet load(Path root) {
        if (!Files.isDirectory(root)) {
            throw new RestoreException(
                    "Dump directory does not exist or is not a directory: " + root.toAbsolutePath());
        }

        List<Path> databases = new ArrayList<>();
        List<Path> schemas = new ArrayList<>();
        List<Path> tables = new ArrayList<>();
        try {
            walk(root, root, databases, schemas, tables);
        } catch (IOException e) {
            throw new RestoreException("Failed to walk dump directory: " + root.toAbsolutePath(), e);
        }

        log.info("Dump catalog built: databases={}, schemas={}, tables={} (dir={})",
                databases.size(), schemas.size(), tables.size(), root.toAbsolutePath());
        return new DumpFileSet(databases, schemas, tables);
    }

    private void walk(Path root, Path dir, List<Path> databases, List<Path> schemas,
            List<Path> tables) throws IOException {
        List<Path> entries;
        try (Stream<Path> children = Files.list(dir)) {
            entries = children.sorted().collect(Collectors.toList());
        }

        for (Path entry : entries) {
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                walk(root, entry, databases, schemas, tables);
                continue;
            }
            if (!Files.isRegularFile(entry)) {
                continue;
            }

            Optional<DumpFileType> type = DumpFileType.classify(entry.getFileName().toString());
            if (type.isEmpty()) {
                log.debug("Ignoring non-dump file: {}", LogPathUtil.renderForLog(root, entry));
                continue;
            }
            requireIdentifiable(root, entry, type.get());
            switch (type.get()) {
                case DATABASE_SCHEMA:
                    databases.add(entry);
                    break;
                case TABLE_SCHEMA:
                    schemas.add(entry);
                    break;
                default:
                    tables.add(entry);
            }
            log.debug("Classified {} as {}", LogPathUtil.renderForLog(root, entry), type.get());
        }
    }

    private static void requireIdentifiable(Path root, Path entry, DumpFileType type) {
        try {
            DumpFileName.parse(entry, type);
        } catch (IllegalArgumentException e) {
            throw new RestoreException("Unidentifiable dump file "
                    + LogPathUtil.renderForLog(root, entry) + ": " + e.getMessage(), e);
        }
    }
}
