package io.github.yok.sqlrestore.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DumpFileTypeTest {

    @Test
    void classify_正常ケース_DB定義ファイルを指定する_汎用サフィックスより優先されること() {
        assertEquals(Optional.of(DumpFileType.DATABASE_SCHEMA),
                DumpFileType.classify("shop-schema-create.sql"));
    }

    @Test
    void classify_正常ケース_テーブル定義ファイルを指定する_TABLE_SCHEMAが返ること() {
        assertEquals(Optional.of(DumpFileType.TABLE_SCHEMA),
                DumpFileType.classify("shop.orders-schema.sql"));
    }

    @Test
    void classify_正常ケース_データファイルを指定する_TABLE_DATAが返ること() {
        assertEquals(Optional.of(DumpFileType.TABLE_DATA), DumpFileType.classify("shop.orders.sql"));
        assertEquals(Optional.of(DumpFileType.TABLE_DATA),
                DumpFileType.classify("shop.orders.00001.sql"));
    }

    @Test
    void classify_正常ケース_対象外の拡張子を指定する_空が返ること() {
        assertTrue(DumpFileType.classify("readme.txt").isEmpty());
        assertTrue(DumpFileType.classify("shop.orders.sql.gz").isEmpty());
        assertTrue(DumpFileType.classify("metadata").isEmpty());
    }

    @Test
    void classify_正常ケース_大文字の拡張子を指定する_一致しないこと() {
        assertTrue(DumpFileType.classify("shop.orders.SQL").isEmpty());
    }
}
