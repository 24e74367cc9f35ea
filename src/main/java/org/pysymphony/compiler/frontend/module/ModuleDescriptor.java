package org.pysymphony.compiler.frontend.module;

import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.semantics.ModuleId;
import org.pysymphony.compiler.frontend.semantics.SymbolTable;

import java.nio.file.Path;

/**
 * Per-module result of the dependency scan.
 *
 * @param id    The module's path relative to the project root.
 * @param name  The dotted module name.
 * @param file  The absolute file the module was loaded from.
 * @param store The parsed module.
 * @param table The module's symbol catalog.
 */
public record ModuleDescriptor(ModuleId id, String name, Path file, NodeStore store, SymbolTable table) {

    public String source() {
        return store.source();
    }

    public boolean isPackage() {
        return id.isPackage();
    }

    /**
     * @return The package relative imports of this module are resolved against.
     */
    public String packageName() {
        if (isPackage()) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }
}
