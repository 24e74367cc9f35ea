package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.semantics.Symbol;

/**
 * A directed edge from a dependent definition to a definition that must be emitted no later.
 *
 * @param dependent  The definition whose evaluation or body reads {@code dependency}.
 * @param dependency The definition being read.
 * @param kind       Why the edge exists.
 */
public record DependencyEdge(Symbol dependent, Symbol dependency, Kind kind) {

    public enum Kind {
        /** The dependent's code refers to the dependency by name or attribute chain. */
        REFERENCE,
        /** The dependent is a member of the dependency class. */
        MEMBER_OF
    }

    @Override
    public String toString() {
        return dependent.id() + " -> " + dependency.id() + " (" + kind + ")";
    }
}
