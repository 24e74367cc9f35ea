package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * One parameter of a function or lambda. The span covers the parameter name only.
 */
public record ParameterNode(Span span, String name, Kind kind, int annotation, int defaultValue) implements Node {

    public enum Kind {
        POSITIONAL,
        VAR_POSITIONAL,
        KEYWORD_ONLY,
        VAR_KEYWORD
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(annotation, defaultValue);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitParameter(index, this);
    }
}
