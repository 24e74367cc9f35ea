package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code except [type [as name]]: body}. {@code name} and {@code nameSpan} are null without {@code as}.
 */
public record ExceptHandlerNode(Span span, int type, String name, Span nameSpan, List<Integer> body) implements Node {

    public ExceptHandlerNode {
        body = List.copyOf(body);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(type, body);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitExceptHandler(index, this);
    }
}
