package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of one parsed file.
 */
public record ModuleNode(Span span, List<Integer> body) implements Node {

    public ModuleNode {
        body = List.copyOf(body);
    }

    @Override
    public List<Integer> children() {
        return body;
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitModule(index, this);
    }
}
