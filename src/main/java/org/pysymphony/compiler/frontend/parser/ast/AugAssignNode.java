package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code target op= value}. The target is both read and bound.
 */
public record AugAssignNode(Span span, int target, String operator, int value) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(target, value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitAugAssign(index, this);
    }
}
