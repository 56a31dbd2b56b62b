package io.github.yok.sqlrestore.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sqlrestore.catalog.DumpFileCatalog;
import io.github.yok.sqlrestore.catalog.DumpFileSet;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link RestoreOrchestrator}.
 */
class RestoreOrchestratorTest {

    private static final long SEED = 20240611L;

    @TempDir
    Path tempDir;

    private final RecordingConnection.Journal journal = new RecordingConnection.Journal();

    @Test
    void execute_正常ケース_DB1件スキーマ2文データ2シャードを指定する_全文が実行されバイト数が合計されること()
            throws Exception {
        write("shop-schema-create.sql", "CREATE DATABASE IF NOT EXISTS `shop`");
        write("shop.t-schema.sql", "CREATE TABLE `t` (\n  `id` int NOT NULL\n);\n"
                + "CREATE INDEX `idx_t_id` ON `t` (`id`);\n");
        Path part1 = write("shop.t.1.sql", inserts(1, 10));
        Path part2 = write("shop.t.2.sql", inserts(11, 10));

        TrackingPool pool = newPool(3, sql -> false);
        RestoreSummary summary = newOrchestrator(pool).execute(load());

        List<RecordingConnection.Entry> entries = journal.entries();
        assertEquals(1, count(entries, "CREATE DATABASE"));
        List<RecordingConnection.Entry> ddl = entries.stream()
                .filter(e -> e.sql.startsWith("CREATE TABLE") || e.sql.startsWith("CREATE INDEX"))
                .collect(Collectors.toList());
        assertEquals(2, ddl.size());
        assertTrue(ddl.get(0).sql.startsWith("CREATE TABLE"));
        assertTrue(ddl.get(1).sql.startsWith("CREATE INDEX"));
        assertEquals(ddl.get(0).connectionId, ddl.get(1).connectionId);
        assertEquals(20, count(entries, "INSERT INTO"));
        assertEquals(3, count(entries, "USE `shop`"));

        long expectedBytes = Files.size(part1) + Files.size(part2);
        assertEquals(expectedBytes, summary.getBytes());
        assertEquals(2, summary.getCompletedTables());
        assertEquals(2, summary.getTotalTables());
        assertEquals(0, pool.inUse());
    }

    @Test
    void execute_正常ケース_複数テーブルを並列復元する_全スキーマ文がデータ文より先に実行されること() throws Exception {
        write("a-schema-create.sql", "CREATE DATABASE `a`");
        write("b-schema-create.sql", "CREATE DATABASE `b`");
        for (String db : List.of("a", "b")) {
            for (int t = 1; t <= 3; t++) {
                write(db + ".t" + t + "-schema.sql",
                        "CREATE TABLE `t" + t + "` (`id` int);\nALTER TABLE `t" + t
                                + "` ADD PRIMARY KEY (`id`);\n");
                for (int p = 1; p <= 3; p++) {
                    write(db + ".t" + t + "." + p + ".sql", inserts(p * 100, 5));
                }
            }
        }

        TrackingPool pool = newPool(4, sql -> false);
        newOrchestrator(pool).execute(load());

        List<RecordingConnection.Entry> entries = journal.entries();
        long lastSchemaSeq = entries.stream()
                .filter(e -> e.sql.startsWith("CREATE") || e.sql.startsWith("ALTER"))
                .mapToLong(e -> e.seq).max().orElseThrow();
        long firstInsertSeq = entries.stream().filter(e -> e.sql.startsWith("INSERT"))
                .mapToLong(e -> e.seq).min().orElseThrow();
        assertEquals(2 + 6 * 2, entries.stream()
                .filter(e -> e.sql.startsWith("CREATE") || e.sql.startsWith("ALTER")).count());
        assertEquals(18 * 5, count(entries, "INSERT INTO"));
        assertTrue(lastSchemaSeq < firstInsertSeq,
                "schema statement " + lastSchemaSeq + " ran after insert " + firstInsertSeq);
    }

    @Test
    void execute_正常ケース_プールサイズ2で12ファイルを復元する_同時貸出数がプールサイズを超えないこと() throws Exception {
        write("a.t-schema.sql", "CREATE TABLE `t` (`id` int);\n");
        for (int p = 0; p < 12; p++) {
            write("a.t." + p + ".sql", inserts(p, 3));
        }

        TrackingPool pool = newPool(2, sql -> false);
        RestoreSummary summary = newOrchestrator(pool).execute(load());

        assertTrue(pool.maxInUse() <= 2, "max in use: " + pool.maxInUse());
        // 2 schema phases + 12 table files
        assertEquals(14, pool.acquires());
        assertEquals(pool.acquires(), pool.releases());
        assertEquals(0, pool.inUse());
        assertEquals(12, summary.getCompletedTables());
    }

    @Test
    void execute_異常ケース_不正な文を含むデータファイルを指定する_未投入ファイルが実行されずファイル情報付きで中断されること()
            throws Exception {
        write("a.t-schema.sql", "CREATE TABLE `t` (`id` int);\n");
        for (int p = 0; p < 8; p++) {
            write("a.t." + p + ".sql", inserts(p * 10, 2));
        }
        write("a.t.bad.sql", "INSERT INTO `t` VALUES (1);\nINSERT INTO `t` VALUES (oops;\n");

        DumpFileSet files = load();
        List<Path> order = RestoreOrchestrator.shuffle(files.getTables(), new Random(SEED));
        int badIndex = IntStream.range(0, order.size())
                .filter(i -> order.get(i).getFileName().toString().equals("a.t.bad.sql"))
                .findFirst().orElseThrow();

        TrackingPool pool = newPool(1, sql -> sql.contains("oops"));
        RestoreException ex =
                assertThrows(RestoreException.class, () -> newOrchestrator(pool).execute(files));

        assertTrue(ex.getMessage().contains("file=a.t.bad.sql"), ex.getMessage());
        assertTrue(ex.getMessage().contains("database=a"), ex.getMessage());
        assertTrue(ex.getMessage().contains("table=t"), ex.getMessage());
        assertTrue(ex.getMessage().contains("part=bad"), ex.getMessage());
        assertTrue(ex.getMessage().contains("connection=1"), ex.getMessage());

        // files before the bad one restored in full, the bad one up to its failing statement
        long inserts = count(journal.entries(), "INSERT INTO");
        assertEquals(badIndex * 2L + 1, inserts);
        assertEquals(pool.acquires(), pool.releases());
        assertEquals(0, pool.inUse());
    }

    @Test
    void execute_異常ケース_テーブル定義が失敗する_行データが一切実行されないこと() throws Exception {
        write("a.t-schema.sql", "CREATE TABLE `t` (`id` int);\n");
        write("a.t.sql", inserts(1, 3));

        TrackingPool pool = newPool(2, sql -> sql.startsWith("CREATE TABLE"));
        RestoreException ex =
                assertThrows(RestoreException.class, () -> newOrchestrator(pool).execute(load()));

        assertTrue(ex.getMessage().contains("file=a.t-schema.sql"), ex.getMessage());
        assertEquals(0, count(journal.entries(), "INSERT INTO"));
        assertEquals(0, pool.inUse());
    }

    @Test
    void execute_正常ケース_データファイルがない_スキーマのみ復元され集計が0であること() throws Exception {
        write("a-schema-create.sql", "CREATE DATABASE `a`");

        TrackingPool pool = newPool(2, sql -> false);
        RestoreSummary summary = newOrchestrator(pool).execute(load());

        assertEquals(0L, summary.getBytes());
        assertEquals(0, summary.getCompletedTables());
        assertEquals(1, count(journal.entries(), "CREATE DATABASE"));
    }

    @Test
    void shuffle_正常ケース_50件のリストを指定する_同じ要素の並べ替えが返ること() {
        List<Path> tables = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            tables.add(Paths.get("db.t" + i + ".sql"));
        }
        List<Path> original = List.copyOf(tables);

        List<Path> shuffled = RestoreOrchestrator.shuffle(tables, new Random(SEED));

        assertNotSame(tables, shuffled);
        assertEquals(original, tables);
        assertEquals(50, shuffled.size());
        assertEquals(50, new HashSet<>(shuffled).size());
        assertEquals(new HashSet<>(original), new HashSet<>(shuffled));
        assertFalse(original.equals(shuffled), "50 elements should not keep their order");
    }

    @Test
    void shuffle_正常ケース_空リストと1件のリストを指定する_そのまま返ること() {
        assertTrue(RestoreOrchestrator.shuffle(List.of(), new Random(SEED)).isEmpty());
        assertEquals(List.of(Paths.get("a.b.sql")),
                RestoreOrchestrator.shuffle(List.of(Paths.get("a.b.sql")), new Random(SEED)));
    }

    private RestoreOrchestrator newOrchestrator(TrackingPool pool) {
        return new RestoreOrchestrator(pool, new SchemaRestorer(), new TableRestorer(),
                Duration.ofMillis(5), new Random(SEED));
    }

    private TrackingPool newPool(int size, Predicate<String> failWhen) {
        List<RecordingConnection> connections = new ArrayList<>();
        for (int id = 1; id <= size; id++) {
            connections.add(new RecordingConnection(id, journal, failWhen));
        }
        return new TrackingPool(connections);
    }

    private DumpFileSet load() {
        return new DumpFileCatalog().load(tempDir);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    private static String inserts(int firstId, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append("INSERT INTO `t` VALUES (").append(firstId + i).append(");\n");
        }
        return sb.toString();
    }

    private static long count(List<RecordingConnection.Entry> entries, String prefix) {
        return entries.stream().filter(e -> e.sql.startsWith(prefix)).count();
    }
}
