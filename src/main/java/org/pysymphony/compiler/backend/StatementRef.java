package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.module.ModuleDescriptor;
import org.pysymphony.compiler.frontend.parser.ast.Span;

/**
 * A top-level statement of one module: the unit the merged file is assembled from.
 *
 * @param module    The owning module.
 * @param statement The statement's node index.
 */
public record StatementRef(ModuleDescriptor module, int statement) {

    public Span span() {
        return module.store().get(statement).span();
    }

    public int line() {
        return module.store().get(statement).line();
    }

    @Override
    public String toString() {
        return module.id().path() + ":" + line();
    }
}
