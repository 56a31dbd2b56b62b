package io.github.yok.sqlrestore.catalog;

import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Enumeration of the dump file kinds recognized by the catalog.
 *
 * <p>
 * Declaration order is the classification priority. The more specific suffixes end with the
 * generic {@code .sql} suffix, so they must be tried first or every file would be classified as
 * {@link #TABLE_DATA}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum DumpFileType {

    // <db>-schema-create.sql: CREATE DATABASE statement.
    DATABASE_SCHEMA("-schema-create.sql"),

    // <db>.<table>-schema.sql: table DDL.
    TABLE_SCHEMA("-schema.sql"),

    // <db>.<table>[.<part>].sql: row data of a table or one of its shards.
    TABLE_DATA(".sql");

    // Literal file name suffix (case-sensitive).
    private final String suffix;

    /**
     * Determines whether the given file name ends with this type's suffix.
     *
     * @param fileName base file name
     * @return {@code true} if the name carries this suffix
     */
    public boolean matches(String fileName) {
        return fileName.endsWith(suffix);
    }

    /**
     * Classifies a file name, trying the most specific suffix first.
     *
     * @param fileName base file name
     * @return matching type, or empty if the file is not part of a dump
     */
    public static Optional<DumpFileType> classify(String fileName) {
        for (DumpFileType type : values()) {
            if (type.matches(fileName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
