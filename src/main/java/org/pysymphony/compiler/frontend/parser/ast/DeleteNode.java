package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record DeleteNode(Span span, List<Integer> targets) implements Node {

    public DeleteNode {
        targets = List.copyOf(targets);
    }

    @Override
    public List<Integer> children() {
        return targets;
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitDelete(index, this);
    }
}
