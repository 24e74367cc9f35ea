package org.pysymphony.compiler.audit.checks;

import org.pysymphony.compiler.audit.AuditContext;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;

/**
 * Relative imports only work while the file stays inside its package.
 */
public class RelativeImportCheck implements IPatternCheck {

    @Override
    public void inspect(int index, Node node, AuditContext context, DiagnosticsEngine diagnostics) {
        ImportFromNode importFrom = (ImportFromNode) node;
        if (importFrom.isRelative()) {
            diagnostics.reportWarning(ErrorKind.RELATIVE_IMPORT,
                    "Relative import of '" + ".".repeat(importFrom.level()) + importFrom.module()
                            + "' may break once the file is moved",
                    context.displayPath(), importFrom.line());
        }
    }
}
