package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record AssertNode(Span span, int test, int message) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(test, message);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitAssert(index, this);
    }
}
