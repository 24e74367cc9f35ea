package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A literal. For strings {@code value} holds the concatenated contents without prefixes
 * and quotes (escape sequences are kept as written); for other kinds it is the source text.
 */
public record ConstantNode(Span span, Kind kind, String value) implements Node {

    public enum Kind {
        STRING,
        NUMBER,
        NONE,
        TRUE,
        FALSE,
        ELLIPSIS
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    @Override
    public List<Integer> children() {
        return List.of();
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitConstant(index, this);
    }
}
