package org.pysymphony.compiler.diagnostics;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A single error or warning. Errors and warnings share this shape so that reports
 * can render both the same way.
 *
 * @param type     Whether this diagnostic blocks (error) or only informs (warning).
 * @param kind     The problem classification.
 * @param message  The human readable message.
 * @param fileName The source file the diagnostic refers to.
 * @param lines    One or more 1-based line numbers, ascending.
 */
public record Diagnostic(Type type, ErrorKind kind, String message, String fileName, List<Integer> lines) {

    public enum Type {
        ERROR,
        WARNING
    }

    public Diagnostic {
        lines = List.copyOf(lines);
    }

    /**
     * @return The first line this diagnostic refers to, or 0 if it carries none.
     */
    public int line() {
        return lines.isEmpty() ? 0 : lines.get(0);
    }

    /**
     * @return The line numbers joined for display, e.g. {@code "3, 7"}.
     */
    public String linesText() {
        return lines.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        String where = lines.isEmpty() ? fileName : fileName + ":" + linesText();
        return type + " [" + kind + "] " + where + ": " + message;
    }
}
