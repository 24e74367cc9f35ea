package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code class} statement. {@code bases} holds the positional bases as well as
 * keyword arguments such as {@code metaclass=...}, which appear as {@link KeywordNode}s.
 */
public record ClassDefNode(Span span, String name, Span nameSpan, List<Integer> decorators, List<Integer> bases,
                           List<Integer> body) implements Node {

    public ClassDefNode {
        decorators = List.copyOf(decorators);
        bases = List.copyOf(bases);
        body = List.copyOf(body);
    }

    @Override
    public List<Integer> children() {
        return Node.childrenOf(decorators, bases, body);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitClassDef(index, this);
    }
}
