package org.pysymphony.compiler.api;

import org.pysymphony.compiler.diagnostics.ErrorKind;

import java.util.List;

/**
 * Thrown when a source file is not syntactically valid.
 */
public class ParseFailureException extends CompilationException {

    private final String detail;

    public ParseFailureException(String detail, String fileName, int line) {
        super(ErrorKind.PARSE_FAILURE, detail, fileName, List.of(line));
        this.detail = detail;
    }

    /**
     * @return The parser message without kind and location prefix.
     */
    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return getLines().get(0);
    }
}
