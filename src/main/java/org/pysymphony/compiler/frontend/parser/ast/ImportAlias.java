package org.pysymphony.compiler.frontend.parser.ast;

/**
 * One entry of an import statement: {@code name [as asName]}.
 *
 * @param name   The dotted module name ({@code import}) or the imported name ({@code from}).
 * @param asName The alias, or null.
 * @param span   The region covering the entry.
 */
public record ImportAlias(String name, String asName, Span span) {

    /**
     * @return The name this entry binds in the importing scope.
     */
    public String boundName() {
        if (asName != null) {
            return asName;
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    public boolean isWildcard() {
        return "*".equals(name);
    }
}
