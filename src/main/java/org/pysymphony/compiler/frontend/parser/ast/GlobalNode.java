package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record GlobalNode(Span span, List<String> names, List<Span> nameSpans) implements Node {

    public GlobalNode {
        names = List.copyOf(names);
        nameSpans = List.copyOf(nameSpans);
    }

    @Override
    public List<Integer> children() {
        return List.of();
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitGlobal(index, this);
    }
}
