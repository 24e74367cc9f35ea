package org.pysymphony.compiler.audit.checks;

import org.pysymphony.compiler.audit.AuditContext;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.semantics.DynamicImports;

public class DynamicImportCheck implements IPatternCheck {

    @Override
    public void inspect(int index, Node node, AuditContext context, DiagnosticsEngine diagnostics) {
        if (DynamicImports.isDynamicImport(context.table(), index)) {
            diagnostics.reportWarning(ErrorKind.DYNAMIC_IMPORT,
                    "Dynamic import '" + context.store().text(index) + "' cannot be followed statically",
                    context.displayPath(), node.line());
        }
    }
}
