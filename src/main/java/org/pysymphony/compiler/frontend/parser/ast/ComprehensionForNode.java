package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * One {@code for target in iterable [if condition]...} clause of a comprehension.
 */
public record ComprehensionForNode(Span span, boolean async, int target, int iterable,
                                   List<Integer> conditions) implements Node {

    public ComprehensionForNode {
        conditions = List.copyOf(conditions);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(target, iterable, conditions);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitComprehensionFor(index, this);
    }
}
