package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code target: annotation [= value]}; {@code value} is -1 for a bare annotation.
 */
public record AnnAssignNode(Span span, int target, int annotation, int value) implements Node {

    @Override
    public List<Integer> children() {
        return Node.childrenOf(target, annotation, value);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitAnnAssign(index, this);
    }
}
