package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code pass}, {@code break} or {@code continue}.
 */
public record KeywordStatementNode(Span span, String keyword) implements Node {

    @Override
    public List<Integer> children() {
        return List.of();
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitKeywordStatement(index, this);
    }
}
