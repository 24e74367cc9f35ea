package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Tuple, list and set displays.
 */
public record CollectionNode(Span span, Kind kind, List<Integer> elements) implements Node {

    public enum Kind {
        TUPLE,
        LIST,
        SET
    }

    public CollectionNode {
        elements = List.copyOf(elements);
    }

    @Override
    public List<Integer> children() {
        return elements;
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitCollection(index, this);
    }
}
