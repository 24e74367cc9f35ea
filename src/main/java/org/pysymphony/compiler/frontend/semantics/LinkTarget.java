package org.pysymphony.compiler.frontend.semantics;

/**
 * What an internal import points at: a whole module, or a module-level symbol of it.
 *
 * @param moduleName The dotted name of the target module.
 * @param table      The catalog of the target module.
 * @param symbol     The imported symbol, or null when the import names the module itself.
 */
public record LinkTarget(String moduleName, SymbolTable table, Symbol symbol) {

    public boolean isModule() {
        return symbol == null;
    }
}
