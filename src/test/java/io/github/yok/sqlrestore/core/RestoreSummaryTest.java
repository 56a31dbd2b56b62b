package io.github.yok.sqlrestore.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RestoreSummaryTest {

    @Test
    void getMegabytesPerSecond_正常ケース_3MBを1500ミリ秒で処理する_2MB毎秒が返ること() {
        RestoreSummary summary = new RestoreSummary(Duration.ofMillis(1500), 3L * 1024 * 1024, 2, 2);
        assertEquals(3.0, summary.getMegabytes(), 1e-9);
        assertEquals(1.5, summary.getElapsedSeconds(), 1e-9);
        assertEquals(2.0, summary.getMegabytesPerSecond(), 1e-9);
    }

    @Test
    void getMegabytesPerSecond_正常ケース_経過時間0を指定する_0が返ること() {
        RestoreSummary summary = new RestoreSummary(Duration.ZERO, 1024, 1, 1);
        assertEquals(0.0, summary.getMegabytesPerSecond());
    }

    @Test
    void equals_正常ケース_同値と異なる値を比較する_値で比較されること() {
        RestoreSummary a = new RestoreSummary(Duration.ofSeconds(1), 10, 1, 2);
        assertEquals(a, new RestoreSummary(Duration.ofSeconds(1), 10, 1, 2));
        assertEquals(a.hashCode(), new RestoreSummary(Duration.ofSeconds(1), 10, 1, 2).hashCode());
        assertNotEquals(a, new RestoreSummary(Duration.ofSeconds(1), 11, 1, 2));
    }
}
