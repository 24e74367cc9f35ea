package org.pysymphony.compiler.frontend.parser.ast;

/**
 * Anything that can point back to its place in the source.
 */
public interface SourceLocatable {

    /**
     * @return The source region this element was parsed from.
     */
    Span span();

    /**
     * @return The 1-based line of the first character.
     */
    default int line() {
        return span().line();
    }
}
