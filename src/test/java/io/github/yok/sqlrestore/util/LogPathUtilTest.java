package io.github.yok.sqlrestore.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogPathUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void renderForLog_正常ケース_ルート配下のファイルを指定する_相対パスが返ること() {
        Path file = tempDir.resolve("shop").resolve("shop.orders.1.sql");
        assertEquals(Path.of("shop", "shop.orders.1.sql").toString(),
                LogPathUtil.renderForLog(tempDir, file));
    }

    @Test
    void renderForLog_正常ケース_ルート外のファイルを指定する_絶対パスが返ること() {
        Path root = tempDir.resolve("dump");
        Path file = tempDir.resolve("other").resolve("a.b.sql");
        assertEquals(file.toAbsolutePath().normalize().toString(),
                LogPathUtil.renderForLog(root, file));
    }

    @Test
    void renderForLog_正常ケース_ルート未指定_絶対パスが返ること() {
        Path file = tempDir.resolve("a.b.sql");
        assertEquals(file.toAbsolutePath().normalize().toString(),
                LogPathUtil.renderForLog(null, file));
    }

    @Test
    void renderForLog_異常ケース_ファイルにnullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> LogPathUtil.renderForLog(tempDir, null));
    }
}
