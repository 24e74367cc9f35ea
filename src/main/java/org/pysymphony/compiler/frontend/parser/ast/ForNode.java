package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record ForNode(Span span, boolean async, int target, int iterable, List<Integer> body,
                      List<Integer> orElse) implements Node {

    public ForNode {
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(target, iterable, body, orElse);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitFor(index, this);
    }
}
