package org.pysymphony.compiler.audit.checks;

import org.pysymphony.compiler.audit.AuditContext;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.semantics.EntryBlocks;

import java.util.List;

/**
 * A file may have at most one top-level {@code if __name__ == "__main__"} block.
 * All offending blocks are reported in a single error.
 */
public class EntryBlockCheck implements IPatternCheck {

    @Override
    public void inspect(int index, Node node, AuditContext context, DiagnosticsEngine diagnostics) {
        List<Integer> blocks = EntryBlocks.find(context.store());
        if (blocks.size() > 1) {
            List<Integer> lines = blocks.stream().map(block -> context.store().get(block).line()).toList();
            diagnostics.reportError(ErrorKind.MULTIPLE_ENTRY_BLOCKS,
                    "Found " + blocks.size() + " top-level entry blocks, expected at most one",
                    context.displayPath(), lines);
        }
    }
}
