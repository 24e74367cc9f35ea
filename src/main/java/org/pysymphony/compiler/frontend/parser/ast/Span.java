package org.pysymphony.compiler.frontend.parser.ast;

/**
 * A region of source text.
 *
 * @param start  Absolute offset of the first character.
 * @param end    Absolute offset one past the last character.
 * @param line   1-based line of the first character.
 * @param column 0-based column of the first character.
 */
public record Span(int start, int end, int line, int column) {

    public int length() {
        return end - start;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }
}
