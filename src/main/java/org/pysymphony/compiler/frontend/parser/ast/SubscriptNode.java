package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record SubscriptNode(Span span, int value, int slice, ExprContext ctx) implements Node {

    public SubscriptNode withContext(ExprContext newCtx) {
        return new SubscriptNode(span, value, slice, newCtx);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(value, slice);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitSubscript(index, this);
    }
}
