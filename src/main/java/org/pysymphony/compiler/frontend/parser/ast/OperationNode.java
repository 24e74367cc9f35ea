package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Unary, binary, boolean and comparison operations. Comparison chains keep all operands
 * in one node; {@code operator} then lists the operators separated by blanks.
 */
public record OperationNode(Span span, String operator, List<Integer> operands) implements Node {

    public OperationNode {
        operands = List.copyOf(operands);
    }

    @Override
    public List<Integer> children() {
        return operands;
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitOperation(index, this);
    }
}
