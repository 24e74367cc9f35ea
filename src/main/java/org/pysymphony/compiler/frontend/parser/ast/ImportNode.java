package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code import a.b [as c], ...}.
 */
public record ImportNode(Span span, List<ImportAlias> names) implements Node {

    public ImportNode {
        names = List.copyOf(names);
    }

    @Override
    public List<Integer> children() {
        return List.of();
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitImport(index, this);
    }
}
