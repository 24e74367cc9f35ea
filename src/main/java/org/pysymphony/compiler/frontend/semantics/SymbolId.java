package org.pysymphony.compiler.frontend.semantics;

/**
 * Identifies a symbol across all modules for diagnostics and logging.
 *
 * @param module The module this symbol belongs to.
 * @param name   The symbol name, prefixed with enclosing class names for members.
 */
public record SymbolId(ModuleId module, String name) {

    @Override
    public String toString() {
        return module.path() + "::" + name;
    }
}
