package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record IfExpNode(Span span, int test, int body, int orElse) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(body, test, orElse);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitIfExp(index, this);
    }
}
