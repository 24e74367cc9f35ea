package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.semantics.DuplicateDefinition;
import org.pysymphony.compiler.frontend.semantics.ModuleId;
import org.pysymphony.compiler.frontend.semantics.ScopeBuilder;
import org.pysymphony.compiler.frontend.semantics.SymbolTable;

/**
 * Stage 1: catalogs the file and reports duplicate definitions. Duplicates at module level
 * are errors; duplicates inside functions and classes are warnings.
 */
public class SymbolTableStage implements IAuditStage {

    @Override
    public String name() {
        return "symbol-table";
    }

    @Override
    public void run(AuditContext context, DiagnosticsEngine diagnostics) {
        SymbolTable table = ScopeBuilder.build(new ModuleId(context.displayPath()), context.store());
        context.setTable(table);
        for (DuplicateDefinition duplicate : table.duplicates()) {
            if (duplicate.isTopLevel()) {
                diagnostics.reportError(ErrorKind.DUPLICATE_DEFINITION,
                        "Duplicate top-level definition of '" + duplicate.name() + "'",
                        context.displayPath(), duplicate.lines());
            } else {
                diagnostics.reportWarning(ErrorKind.DUPLICATE_DEFINITION,
                        "Duplicate definition of '" + duplicate.name() + "' in " + duplicate.scope(),
                        context.displayPath(), duplicate.lines());
            }
        }
    }
}
