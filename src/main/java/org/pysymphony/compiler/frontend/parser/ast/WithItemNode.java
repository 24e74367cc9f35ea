package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code context [as target]}; {@code target} is -1 without {@code as}.
 */
public record WithItemNode(Span span, int context, int target) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(context, target);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitWithItem(index, this);
    }
}
