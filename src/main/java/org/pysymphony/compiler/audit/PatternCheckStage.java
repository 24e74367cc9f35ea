package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.audit.checks.IPatternCheck;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NodeWalker;

import java.util.List;

/**
 * Stage 3: one pre-order traversal that hands each node to the checks registered for its class.
 */
public class PatternCheckStage implements IAuditStage {

    private final PatternCheckRegistry registry;

    public PatternCheckStage(PatternCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "pattern-checks";
    }

    @Override
    public void run(AuditContext context, DiagnosticsEngine diagnostics) {
        NodeStore store = context.store();
        NodeWalker walker = new NodeWalker(store) {
            @Override
            public void walk(int index) {
                if (index < 0) {
                    return;
                }
                List<IPatternCheck> checks = registry.resolveChecks(store.get(index).getClass());
                for (IPatternCheck check : checks) {
                    check.inspect(index, store.get(index), context, diagnostics);
                }
                super.walk(index);
            }
        };
        walker.walk(store.root());
    }
}
