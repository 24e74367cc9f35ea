package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * List, set and dict comprehensions and generator expressions. For dict comprehensions
 * {@code element} is the key and {@code value} the value; otherwise {@code value} is -1.
 */
public record ComprehensionNode(Span span, Kind kind, int element, int value, List<Integer> generators) implements Node {

    public enum Kind {
        LIST,
        SET,
        DICT,
        GENERATOR
    }

    public ComprehensionNode {
        generators = List.copyOf(generators);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(element, value, generators);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitComprehension(index, this);
    }
}
