package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record NonlocalNode(Span span, List<String> names, List<Span> nameSpans) implements Node {

    public NonlocalNode {
        names = List.copyOf(names);
        nameSpans = List.copyOf(nameSpans);
    }

    @Override
    public List<Integer> children() {
        return List.of();
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitNonlocal(index, this);
    }
}
