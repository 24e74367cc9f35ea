package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record WithNode(Span span, boolean async, List<Integer> items, List<Integer> body) implements Node {

    public WithNode {
        items = List.copyOf(items);
        body = List.copyOf(body);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(items, body);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitWith(index, this);
    }
}
