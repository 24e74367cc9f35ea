package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record StarredNode(Span span, int value, ExprContext ctx) implements Node {

    public StarredNode withContext(ExprContext newCtx) {
        return new StarredNode(span, value, newCtx);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitStarred(index, this);
    }
}
