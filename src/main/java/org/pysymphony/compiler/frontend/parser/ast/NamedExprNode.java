package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code target := value}.
 */
public record NamedExprNode(Span span, int target, int value) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(target, value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitNamedExpr(index, this);
    }
}
