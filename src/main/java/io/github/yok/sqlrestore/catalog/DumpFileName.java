package io.github.yok.sqlrestore.catalog;

import java.nio.file.Path;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Database/table identity derived from a dump file name.
 *
 * <p>
 * The classifying suffix is removed as a literal suffix and the remainder is split on {@code .}:
 * the first segment is the database, the second the table and the optional third the shard part.
 * </p>
 *
 * <pre>
 * shop-schema-create.sql   database=shop
 * shop.orders-schema.sql   database=shop, table=orders
 * shop.orders.sql          database=shop, table=orders, part=(none)
 * shop.orders.00003.sql    database=shop, table=orders, part=00003
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DumpFileName {

    // Part reported for unsharded data files
    public static final String DEFAULT_PART = "0";

    private final DumpFileType type;
    private final String database;
    // null for database schema files
    private final String table;
    // null for unsharded data files
    private final String part;

    private DumpFileName(DumpFileType type, String database, String table, String part) {
        this.type = type;
        this.database = database;
        this.table = table;
        this.part = part;
    }

    /**
     * Parses the name of a dump file of the given type.
     *
     * @param file dump file
     * @param type type the catalog assigned to the file
     * @return parsed identity
     * @throws IllegalArgumentException if the name does not carry the type's suffix, has an empty
     *         database segment, or is a table file without a table segment
     */
    public static DumpFileName parse(Path file, DumpFileType type) {
        String fileName = file.getFileName().toString();
        if (!type.matches(fileName)) {
            throw new IllegalArgumentException(
                    "File name does not end with '" + type.getSuffix() + "': " + fileName);
        }
        String name = StringUtils.removeEnd(fileName, type.getSuffix());
        String[] segments = name.split("\\.", -1);
        if (segments[0].isEmpty()) {
            throw new IllegalArgumentException("Missing database name in dump file: " + fileName);
        }

        if (type == DumpFileType.DATABASE_SCHEMA) {
            return new DumpFileName(type, segments[0], null, null);
        }
        if (segments.length < 2 || segments[1].isEmpty()) {
            throw new IllegalArgumentException(
                    "Expected <database>.<table> in dump file name: " + fileName);
        }
        String part = (type == DumpFileType.TABLE_DATA && segments.length > 2) ? segments[2] : null;
        return new DumpFileName(type, segments[0], segments[1], part);
    }

    /**
     * Returns the shard part, or {@value #DEFAULT_PART} for an unsharded file.
     *
     * @return part identifier for logging
     */
    public String getPartOrDefault() {
        return part != null ? part : DEFAULT_PART;
    }

    /**
     * Returns {@code database.table}, or just the database for database schema files.
     *
     * @return qualified name for logging
     */
    public String getQualifiedName() {
        return table != null ? database + "." + table : database;
    }
}
