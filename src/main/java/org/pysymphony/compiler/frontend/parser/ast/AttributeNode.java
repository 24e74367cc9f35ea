package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code value.attr}. {@code attrSpan} covers the attribute name only.
 */
public record AttributeNode(Span span, int value, String attr, Span attrSpan, ExprContext ctx) implements Node {

    public AttributeNode withContext(ExprContext newCtx) {
        return new AttributeNode(span, value, attr, attrSpan, newCtx);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitAttribute(index, this);
    }
}
