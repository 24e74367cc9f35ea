package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record WhileNode(Span span, int test, List<Integer> body, List<Integer> orElse) implements Node {

    public WhileNode {
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(test, body, orElse);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitWhile(index, this);
    }
}
