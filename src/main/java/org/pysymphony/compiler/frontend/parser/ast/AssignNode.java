package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code t1 = t2 = value}. Every target is already marked with {@link ExprContext#STORE}.
 */
public record AssignNode(Span span, List<Integer> targets, int value) implements Node {

    public AssignNode {
        targets = List.copyOf(targets);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(targets, value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitAssign(index, this);
    }
}
