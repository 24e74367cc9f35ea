package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code function(arguments)}. Keyword and {@code **} arguments are {@link KeywordNode}s,
 * {@code *} arguments are {@link StarredNode}s.
 */
public record CallNode(Span span, int function, List<Integer> arguments) implements Node {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(function, arguments);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitCall(index, this);
    }
}
