package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An {@code if} statement. An {@code elif} chain is represented as a nested {@link IfNode}
 * that is the only statement of {@code orElse}.
 */
public record IfNode(Span span, int test, List<Integer> body, List<Integer> orElse) implements Node {

    public IfNode {
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(test, body, orElse);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitIf(index, this);
    }
}
