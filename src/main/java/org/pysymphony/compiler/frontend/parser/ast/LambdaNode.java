package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record LambdaNode(Span span, List<Integer> parameters, int body) implements Node {

    public LambdaNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(parameters, body);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitLambda(index, this);
    }
}
