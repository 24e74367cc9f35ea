package org.pysymphony.compiler.audit.checks;

import org.pysymphony.compiler.audit.AuditContext;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;

/**
 * The names bound by {@code from m import *} are unknown, so uses of them are reported
 * as unresolved by the reference stage. This warning names the cause.
 */
public class WildcardImportCheck implements IPatternCheck {

    @Override
    public void inspect(int index, Node node, AuditContext context, DiagnosticsEngine diagnostics) {
        ImportFromNode importFrom = (ImportFromNode) node;
        if (importFrom.isWildcard()) {
            diagnostics.reportWarning(ErrorKind.WILDCARD_IMPORT,
                    "Wildcard import from '" + ".".repeat(importFrom.level()) + importFrom.module()
                            + "' binds names that cannot be checked",
                    context.displayPath(), importFrom.line());
        }
    }
}
