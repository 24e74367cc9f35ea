package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record NameNode(Span span, String id, ExprContext ctx) implements Node {

    public NameNode withContext(ExprContext newCtx) {
        return new NameNode(span, id, newCtx);
    }

    @Override
    public List<Integer> children() {
        return List.of();
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitName(index, this);
    }
}
