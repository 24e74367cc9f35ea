package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code def} or {@code async def} statement. The span starts at the first decorator
 * so that slicing it yields the complete definition.
 */
public record FunctionDefNode(Span span, String name, Span nameSpan, boolean async, List<Integer> decorators,
                              List<Integer> parameters, int returns, List<Integer> body) implements Node {

    public FunctionDefNode {
        decorators = List.copyOf(decorators);
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(decorators, parameters, returns, body);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitFunctionDef(index, this);
    }
}
