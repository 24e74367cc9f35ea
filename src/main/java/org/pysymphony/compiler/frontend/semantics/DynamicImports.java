package org.pysymphony.compiler.frontend.semantics;

import org.pysymphony.compiler.frontend.parser.ast.AttributeNode;
import org.pysymphony.compiler.frontend.parser.ast.CallNode;
import org.pysymphony.compiler.frontend.parser.ast.NameNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NodeWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds calls that load modules at run time: {@code __import__(...)},
 * {@code importlib.import_module(...)} and {@code import_module(...)} imported from importlib.
 */
public final class DynamicImports {

    private static final String IMPORTLIB = "importlib";
    private static final String IMPORT_MODULE = "import_module";

    private DynamicImports() {
    }

    /**
     * @param table A cataloged module.
     * @return The indices of the dynamic import calls, in source order.
     */
    public static List<Integer> find(SymbolTable table) {
        List<Integer> calls = new ArrayList<>();
        NodeWalker walker = new NodeWalker(table.store()) {
            @Override
            public Void visitCall(int index, CallNode node) {
                if (isDynamicImport(table, index)) {
                    calls.add(index);
                }
                walkChildren(index);
                return null;
            }
        };
        walker.walk(table.store().root());
        return calls;
    }

    public static boolean isDynamicImport(SymbolTable table, int callIndex) {
        NodeStore store = table.store();
        CallNode call = store.getAs(callIndex, CallNode.class);
        if (call == null) {
            return false;
        }
        Node function = store.get(call.function());
        if (function instanceof NameNode name) {
            Resolution resolution = ReferenceResolver.resolve(name.id(), table.scopeOf(call.function()));
            if (name.id().equals("__import__")) {
                return resolution.kind() == Resolution.Kind.BUILTIN;
            }
            Symbol symbol = resolution.symbol();
            return symbol != null && symbol.kind() == Symbol.Kind.IMPORT_ALIAS
                    && IMPORTLIB.equals(symbol.importBinding().module())
                    && IMPORT_MODULE.equals(symbol.importBinding().importedName());
        }
        if (function instanceof AttributeNode attribute && attribute.attr().equals(IMPORT_MODULE)
                && store.get(attribute.value()) instanceof NameNode receiver) {
            Symbol symbol = ReferenceResolver.resolve(receiver.id(), table.scopeOf(attribute.value())).symbol();
            return symbol != null && symbol.kind() == Symbol.Kind.IMPORT_ALIAS
                    && !symbol.importBinding().isFromImport()
                    && IMPORTLIB.equals(symbol.importBinding().module());
        }
        return false;
    }
}
