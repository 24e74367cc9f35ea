package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record RaiseNode(Span span, int exception, int cause) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(exception, cause);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitRaise(index, this);
    }
}
