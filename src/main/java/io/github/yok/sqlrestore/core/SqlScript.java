package io.github.yok.sqlrestore.core;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Text of one dump file and the statements it holds.
 *
 * <p>
 * Statements are separated by a semicolon immediately followed by a line feed. This is a
 * syntactic convention of the dump writer, not SQL parsing: a string literal containing that exact
 * sequence would be split as well. Pieces that are blank, or whose very first character opens a
 * {@code /*} comment, are not executed. A comment preceded by whitespace does not count, so a
 * comment-led statement after a blank line is still sent to the server.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class SqlScript {

    /** Separator between statements in dump files. */
    public static final String STATEMENT_SEPARATOR = ";\n";

    /** Prefix of statements that are skipped. */
    public static final String COMMENT_PREFIX = "/*";

    private final String text;

    // Size of the file in bytes; the throughput unit
    private final long byteLength;

    private SqlScript(String text, long byteLength) {
        this.text = text;
        this.byteLength = byteLength;
    }

    /**
     * Reads a dump file as UTF-8.
     *
     * @param file dump file
     * @return script holding the whole file
     * @throws IOException if the file cannot be read
     */
    public static SqlScript read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return new SqlScript(new String(bytes, StandardCharsets.UTF_8), bytes.length);
    }

    /**
     * Wraps SQL text that did not come from a file.
     *
     * @param text SQL text
     * @return script whose byte length is the UTF-8 length of {@code text}
     */
    public static SqlScript of(String text) {
        return new SqlScript(text, text.getBytes(StandardCharsets.UTF_8).length);
    }

    /**
     * Splits the text into executable statements, in file order.
     *
     * @return statements without their trailing separator
     */
    public ImmutableList<String> statements() {
        ImmutableList.Builder<String> result = ImmutableList.builder();
        for (String piece : StringUtils.splitByWholeSeparatorPreserveAllTokens(text,
                STATEMENT_SEPARATOR)) {
            if (isExecutable(piece)) {
                result.add(piece);
            }
        }
        return result.build();
    }

    static boolean isExecutable(String statement) {
        return StringUtils.isNotBlank(statement)
                && !statement.startsWith(COMMENT_PREFIX);
    }
}
