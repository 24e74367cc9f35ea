package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code name=value} in a call or class header; {@code name} is null for {@code **value}.
 */
public record KeywordNode(Span span, String name, int value) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitKeyword(index, this);
    }
}
