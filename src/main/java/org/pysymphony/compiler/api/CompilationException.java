package org.pysymphony.compiler.api;

import org.pysymphony.compiler.diagnostics.ErrorKind;

import java.util.List;

/**
 * Base class of all fatal merge failures. Every failure names its kind, the source
 * file it refers to and the offending lines or symbols, so that the command line can
 * report it without further context.
 */
public class CompilationException extends Exception {

    private final ErrorKind kind;
    private final String fileName;
    private final List<Integer> lines;

    public CompilationException(ErrorKind kind, String message, String fileName, List<Integer> lines) {
        super(kind.displayName() + ": " + message + location(fileName, lines));
        this.kind = kind;
        this.fileName = fileName;
        this.lines = List.copyOf(lines);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return The source file the failure refers to, or null if it spans several files.
     */
    public String getFileName() {
        return fileName;
    }

    public List<Integer> getLines() {
        return lines;
    }

    private static String location(String fileName, List<Integer> lines) {
        if (fileName == null) {
            return "";
        }
        if (lines.isEmpty()) {
            return " (" + fileName + ")";
        }
        return " (" + fileName + ":" + lines.get(0) + ")";
    }
}
