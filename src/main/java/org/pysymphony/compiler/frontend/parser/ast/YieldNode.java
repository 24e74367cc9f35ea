package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code yield [value]} or, with {@code delegate}, {@code yield from value}.
 */
public record YieldNode(Span span, boolean delegate, int value) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitYield(index, this);
    }
}
