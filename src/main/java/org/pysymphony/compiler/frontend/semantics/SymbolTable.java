package org.pysymphony.compiler.frontend.semantics;

import org.pysymphony.compiler.frontend.parser.ast.ClassDefNode;
import org.pysymphony.compiler.frontend.parser.ast.FunctionDefNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The scope tree and symbols of one module, as produced by {@link ScopeBuilder}.
 * Every node is mapped to the scope it is evaluated in, so {@link #scopeOf(int)} is O(1).
 */
public final class SymbolTable {

    /**
     * A {@code nonlocal} declaration without a binding in any enclosing function.
     */
    public record DanglingNonlocal(String name, int line) {
    }

    private final ModuleId moduleId;
    private final NodeStore store;
    private final Scope moduleScope;
    private final List<Scope> scopes;
    private final Scope[] scopeByNode;
    private final Map<Integer, Symbol> symbolByNode;
    private final Map<Integer, List<Symbol>> importSymbols;
    private final List<Symbol> symbols;
    private final List<DuplicateDefinition> duplicates;
    private final List<DanglingNonlocal> danglingNonlocals;
    private final List<Integer> wildcardImports;
    private final List<Integer> futureImports;

    SymbolTable(ModuleId moduleId, NodeStore store, Scope moduleScope, List<Scope> scopes, Scope[] scopeByNode,
                Map<Integer, Symbol> symbolByNode, Map<Integer, List<Symbol>> importSymbols, List<Symbol> symbols,
                List<DuplicateDefinition> duplicates, List<DanglingNonlocal> danglingNonlocals,
                List<Integer> wildcardImports, List<Integer> futureImports) {
        this.moduleId = moduleId;
        this.store = store;
        this.moduleScope = moduleScope;
        this.scopes = List.copyOf(scopes);
        this.scopeByNode = scopeByNode;
        this.symbolByNode = Map.copyOf(symbolByNode);
        this.importSymbols = Map.copyOf(importSymbols);
        this.symbols = List.copyOf(symbols);
        this.duplicates = List.copyOf(duplicates);
        this.danglingNonlocals = List.copyOf(danglingNonlocals);
        this.wildcardImports = List.copyOf(wildcardImports);
        this.futureImports = List.copyOf(futureImports);
    }

    public ModuleId moduleId() {
        return moduleId;
    }

    public NodeStore store() {
        return store;
    }

    public Scope moduleScope() {
        return moduleScope;
    }

    public List<Scope> scopes() {
        return scopes;
    }

    /**
     * @param nodeIndex Any node of this module.
     * @return The scope the node is evaluated in. Decorators, defaults and bases of a
     * definition belong to the enclosing scope; parameters and bodies to the new one.
     */
    public Scope scopeOf(int nodeIndex) {
        return scopeByNode[nodeIndex];
    }

    /**
     * Finds the symbol bound by a def/class node, a stored name, a parameter or an except handler.
     */
    public Optional<Symbol> symbolAt(int bindingNode) {
        return Optional.ofNullable(symbolByNode.get(bindingNode));
    }

    /**
     * @return The aliases bound by an import statement, in statement order.
     */
    public List<Symbol> importedBy(int importNode) {
        return importSymbols.getOrDefault(importNode, List.of());
    }

    /**
     * @return All symbols of all scopes in creation order.
     */
    public List<Symbol> symbols() {
        return symbols;
    }

    public List<Symbol> moduleSymbols() {
        return List.copyOf(moduleScope.symbols());
    }

    public Optional<Symbol> lookupModuleSymbol(String name) {
        return Optional.ofNullable(moduleScope.lookupLocal(name));
    }

    public List<DuplicateDefinition> duplicates() {
        return duplicates;
    }

    public List<DanglingNonlocal> danglingNonlocals() {
        return danglingNonlocals;
    }

    /**
     * @return The {@code from m import *} statements at any depth.
     */
    public List<Integer> wildcardImports() {
        return wildcardImports;
    }

    /**
     * @return The {@code from __future__ import ...} statements.
     */
    public List<Integer> futureImports() {
        return futureImports;
    }

    /**
     * Returns the nodes whose evaluation makes up a module-level or member definition:
     * the whole def for functions; decorators, bases and non-definition body statements for
     * classes, because members are separate definitions; the binding statement otherwise.
     * @param symbol A symbol of this module.
     * @return The extent roots, empty for symbols without a statement-level extent.
     */
    public List<Integer> extentOf(Symbol symbol) {
        Node node = store.get(symbol.node());
        if (symbol.kind() == Symbol.Kind.FUNCTION && node instanceof FunctionDefNode) {
            return List.of(symbol.node());
        }
        if (symbol.kind() == Symbol.Kind.CLASS && node instanceof ClassDefNode classDef) {
            List<Integer> extent = new ArrayList<>(classDef.decorators());
            extent.addAll(classDef.bases());
            for (int statement : classDef.body()) {
                Node member = store.get(statement);
                if (!(member instanceof FunctionDefNode) && !(member instanceof ClassDefNode)) {
                    extent.add(statement);
                }
            }
            return Collections.unmodifiableList(extent);
        }
        if (symbol.isModuleLevel()) {
            return List.of(symbol.statement());
        }
        if (symbol.isMember()) {
            return List.of(enclosingStatement(symbol.node(), symbol.scope().ownerNode()));
        }
        return List.of();
    }

    /**
     * Walks up from {@code nodeIndex} to the statement directly inside {@code container}'s body.
     */
    public int enclosingStatement(int nodeIndex, int container) {
        int currentNode = nodeIndex;
        int parent = store.parentOf(currentNode);
        while (parent >= 0 && parent != container) {
            currentNode = parent;
            parent = store.parentOf(currentNode);
        }
        return currentNode;
    }
}
