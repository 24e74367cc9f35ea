package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record TryNode(Span span, List<Integer> body, List<Integer> handlers, List<Integer> orElse,
                      List<Integer> finalBody) implements Node {

    public TryNode {
        body = List.copyOf(body);
        handlers = List.copyOf(handlers);
        orElse = List.copyOf(orElse);
        finalBody = List.copyOf(finalBody);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(body, handlers, orElse, finalBody);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitTry(index, this);
    }
}
