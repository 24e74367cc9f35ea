package org.pysymphony.compiler.frontend.semantics;

import java.util.List;

/**
 * A name bound more than once in the same scope in a way that is not an ordinary rebinding.
 *
 * @param name  The duplicated name.
 * @param scope The scope holding both definitions.
 * @param lines Every line that defines the name, ascending.
 */
public record DuplicateDefinition(String name, Scope scope, List<Integer> lines) {

    public DuplicateDefinition {
        lines = List.copyOf(lines);
    }

    public boolean isTopLevel() {
        return scope.kind() == Scope.Kind.MODULE;
    }
}
