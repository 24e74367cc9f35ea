package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.semantics.SymbolTable;

/**
 * State shared by the stages of one audit run. The symbol table is set by the
 * {@link SymbolTableStage} and read by every later stage.
 */
public final class AuditContext {

    private final String displayPath;
    private final NodeStore store;
    private SymbolTable table;

    public AuditContext(String displayPath, NodeStore store) {
        this.displayPath = displayPath;
        this.store = store;
    }

    public String displayPath() {
        return displayPath;
    }

    public NodeStore store() {
        return store;
    }

    /**
     * @return The catalog of the audited file.
     * @throws IllegalStateException if the symbol table stage has not run yet.
     */
    public SymbolTable table() {
        if (table == null) {
            throw new IllegalStateException("Symbol table of " + displayPath + " has not been built");
        }
        return table;
    }

    void setTable(SymbolTable table) {
        this.table = table;
    }
}
