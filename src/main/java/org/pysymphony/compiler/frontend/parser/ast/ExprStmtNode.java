package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

public record ExprStmtNode(Span span, int value) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitExprStmt(index, this);
    }
}
