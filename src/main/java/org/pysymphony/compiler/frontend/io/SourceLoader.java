package org.pysymphony.compiler.frontend.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file loading for the merger and the auditor. Line endings are normalized so
 * that node spans index into exactly the text that is later sliced during emission.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The file to read.
     * @return The loaded content and the path (with forward slashes) as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(path, StandardCharsets.UTF_8));
        return new LoadResult(stripByteOrderMark(content), logicalName);
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }

    private static String stripByteOrderMark(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
