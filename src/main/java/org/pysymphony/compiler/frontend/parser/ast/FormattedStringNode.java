package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An f-string (possibly concatenated with plain strings). {@code values} are the
 * replacement-field expressions in source order.
 */
public record FormattedStringNode(Span span, List<Integer> values) implements Node {

    public FormattedStringNode {
        values = List.copyOf(values);
    }

    @Override
    public List<Integer> children() {
        return values;
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitFormattedString(index, this);
    }
}
