package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record SliceNode(Span span, int lower, int upper, int step) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(lower, upper, step);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitSlice(index, this);
    }
}
