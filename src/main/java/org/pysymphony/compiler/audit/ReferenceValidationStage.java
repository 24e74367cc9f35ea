package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.frontend.semantics.ImportLinker;
import org.pysymphony.compiler.frontend.semantics.ReferenceResolver;

/**
 * Stage 2: every name must resolve to a binding of the file or to a builtin, and attribute
 * chains on local classes must name existing members. Imports are treated as external, so
 * chains through them are not checked.
 */
public class ReferenceValidationStage implements IAuditStage {

    @Override
    public String name() {
        return "reference-validation";
    }

    @Override
    public void run(AuditContext context, DiagnosticsEngine diagnostics) {
        new ReferenceResolver(context.table(), ImportLinker.external()).validate(diagnostics);
    }
}
