package org.pysymphony.compiler.frontend.semantics;

/**
 * Outcome of resolving a bare name from a scope.
 *
 * @param kind   How the name resolved.
 * @param symbol The binding symbol for {@link Kind#LOCAL}, otherwise null.
 */
public record Resolution(Kind kind, Symbol symbol) {

    public enum Kind {
        /** Bound by a definition in one of the merged modules. */
        LOCAL,
        /** A builtin or an implicit module/class/function name. */
        BUILTIN,
        UNRESOLVED
    }

    private static final Resolution BUILTIN = new Resolution(Kind.BUILTIN, null);
    private static final Resolution UNRESOLVED = new Resolution(Kind.UNRESOLVED, null);

    public static Resolution local(Symbol symbol) {
        return new Resolution(Kind.LOCAL, symbol);
    }

    public static Resolution builtin() {
        return BUILTIN;
    }

    public static Resolution unresolved() {
        return UNRESOLVED;
    }

    public boolean isResolved() {
        return kind != Kind.UNRESOLVED;
    }
}
