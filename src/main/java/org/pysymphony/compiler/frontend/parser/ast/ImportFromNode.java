package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code from [dots]module import names}. {@code module} is empty for {@code from . import x};
 * {@code level} counts the leading dots.
 */
public record ImportFromNode(Span span, String module, int level, List<ImportAlias> names) implements Node {

    public ImportFromNode {
        names = List.copyOf(names);
    }

    public boolean isRelative() {
        return level > 0;
    }

    public boolean isWildcard() {
        return names.stream().anyMatch(ImportAlias::isWildcard);
    }

    public boolean isFuture() {
        return level == 0 && "__future__".equals(module);
    }

    @Override
    public List<Integer> children() {
        return List.of();
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitImportFrom(index, this);
    }
}
