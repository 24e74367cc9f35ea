package org.pysymphony.compiler.audit.checks;

import org.pysymphony.compiler.audit.AuditContext;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.parser.ast.ClassDefNode;
import org.pysymphony.compiler.frontend.parser.ast.FunctionDefNode;
import org.pysymphony.compiler.frontend.parser.ast.IfNode;
import org.pysymphony.compiler.frontend.parser.ast.LambdaNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.TryNode;
import org.pysymphony.compiler.frontend.semantics.EntryBlocks;

/**
 * Flags module-level imports nested in an {@code if} or {@code try} statement. Such imports
 * are taken unconditionally by the merger, which may not match what the program does at run
 * time. Imports inside the entry block and inside functions or classes are not flagged.
 */
public class ConditionalImportCheck implements IPatternCheck {

    @Override
    public void inspect(int index, Node node, AuditContext context, DiagnosticsEngine diagnostics) {
        NodeStore store = context.store();
        boolean guarded = false;
        for (int ancestor = store.parentOf(index); ancestor >= 0; ancestor = store.parentOf(ancestor)) {
            Node parent = store.get(ancestor);
            if (parent instanceof FunctionDefNode || parent instanceof ClassDefNode || parent instanceof LambdaNode) {
                return;
            }
            if (parent instanceof IfNode && EntryBlocks.isEntryBlock(store, ancestor)) {
                return;
            }
            if (parent instanceof IfNode || parent instanceof TryNode) {
                guarded = true;
            }
        }
        if (guarded) {
            diagnostics.reportWarning(ErrorKind.CONDITIONAL_IMPORT,
                    "Import '" + store.text(index) + "' only runs under a condition or inside a try block",
                    context.displayPath(), node.line());
        }
    }
}
