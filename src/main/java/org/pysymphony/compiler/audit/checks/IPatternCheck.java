package org.pysymphony.compiler.audit.checks;

import org.pysymphony.compiler.audit.AuditContext;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.frontend.parser.ast.Node;

/**
 * A whole-file pattern check of the audit. Each check is responsible for the node classes it
 * is registered for and must not depend on other checks.
 */
public interface IPatternCheck {

    /**
     * Inspects a single node before its children are traversed.
     * @param index The store index of the node.
     * @param node The node to inspect.
     * @param context The file under audit, with its symbol table.
     * @param diagnostics The engine for reporting findings.
     */
    void inspect(int index, Node node, AuditContext context, DiagnosticsEngine diagnostics);
}
