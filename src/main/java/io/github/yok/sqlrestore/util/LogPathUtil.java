package io.github.yok.sqlrestore.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility for rendering dump file paths for logs.
 *
 * <p>
 * Files located under the dump root are rendered relative to it (for example
 * {@code shop/shop.orders.3.sql}); anything else is rendered as an absolute normalized path.
 * </p>
 */
@Slf4j
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.sqlrestore.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a dump file path for logs.
     *
     * @param root dump root directory, may be {@code null}
     * @param file file to render
     * @return path string rendered for logs
     * @throws NullPointerException if {@code file} is {@code null}
     */
    public static String renderForLog(Path root, Path file) {
        Preconditions.checkNotNull(file, "file must not be null");

        Path abs = file.toAbsolutePath().normalize();
        if (root != null) {
            Path base = root.toAbsolutePath().normalize();
            if (abs.startsWith(base) && !abs.equals(base)) {
                String rel = base.relativize(abs).toString();
                log.debug("Rendered relative log path. base={}, abs={}, rel={}", base, abs, rel);
                return rel;
            }
        }

        String absolute = abs.toString();
        log.debug("Rendered absolute log path. abs={}", absolute);
        return absolute;
    }
}
