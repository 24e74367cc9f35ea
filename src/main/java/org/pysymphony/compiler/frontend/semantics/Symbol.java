package org.pysymphony.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One named definition. Symbols are created by the {@link ScopeBuilder}; afterwards only the
 * qualified name changes, written once by the conflict resolver. Identity is object identity.
 */
public final class Symbol {

    public enum Kind {
        FUNCTION,
        CLASS,
        VARIABLE,
        IMPORT_ALIAS,
        PARAMETER
    }

    private final String name;
    private final Kind kind;
    private final Scope scope;
    private final int node;
    private final ModuleId module;
    private final int line;
    private final int statement;
    private final int guard;
    private final ImportBinding importBinding;
    private final List<Integer> bindings = new ArrayList<>();
    private final Set<String> references = new LinkedHashSet<>();
    private Scope body;
    private String qualifiedName;

    Symbol(String name, Kind kind, Scope scope, int node, ModuleId module, int line, int statement, int guard,
           ImportBinding importBinding) {
        this.name = name;
        this.kind = kind;
        this.scope = scope;
        this.node = node;
        this.module = module;
        this.line = line;
        this.statement = statement;
        this.guard = guard;
        this.importBinding = importBinding;
        this.bindings.add(node);
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public Scope scope() {
        return scope;
    }

    /**
     * @return The node of the first binding: the def/class node, the bound name, the parameter,
     * the import statement or the except handler.
     */
    public int node() {
        return node;
    }

    public ModuleId module() {
        return module;
    }

    public int line() {
        return line;
    }

    /**
     * @return The top-level statement of the module that contains the first binding.
     */
    public int statement() {
        return statement;
    }

    /**
     * @return The outermost compound statement of the owning scope around the first binding, or -1.
     */
    public int guard() {
        return guard;
    }

    /**
     * @return The import this alias was bound from; null unless {@link Kind#IMPORT_ALIAS}.
     */
    public ImportBinding importBinding() {
        return importBinding;
    }

    /**
     * @return Every node that binds this symbol, including rebindings and writes through
     * {@code global}/{@code nonlocal} declarations.
     */
    public List<Integer> bindings() {
        return Collections.unmodifiableList(bindings);
    }

    /**
     * @return The bare names read by this definition, before resolution.
     */
    public Set<String> references() {
        return Collections.unmodifiableSet(references);
    }

    /**
     * @return The scope opened by a function or class definition, or null.
     */
    public Scope body() {
        return body;
    }

    public boolean isModuleLevel() {
        return scope.kind() == Scope.Kind.MODULE;
    }

    /**
     * @return true for definitions directly inside a class body.
     */
    public boolean isMember() {
        return scope.kind() == Scope.Kind.CLASS;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    /**
     * @return The name this symbol is emitted under: its qualified name if one was assigned.
     */
    public String emittedName() {
        return qualifiedName != null ? qualifiedName : name;
    }

    /**
     * Attaches the globally unique name. May be called once.
     * @throws IllegalStateException if a qualified name was already assigned.
     */
    public void assignQualifiedName(String newName) {
        if (qualifiedName != null) {
            throw new IllegalStateException("Qualified name of " + id() + " is already set to " + qualifiedName);
        }
        this.qualifiedName = newName;
    }

    /**
     * @return The id of this symbol; members are prefixed with their class names.
     */
    public SymbolId id() {
        StringBuilder path = new StringBuilder(name);
        for (Scope s = scope; s != null && s.kind() != Scope.Kind.MODULE; s = s.parent()) {
            path.insert(0, s.name() + ".");
        }
        return new SymbolId(module, path.toString());
    }

    void addBinding(int bindingNode) {
        if (!bindings.contains(bindingNode)) {
            bindings.add(bindingNode);
        }
    }

    void addReference(String reference) {
        references.add(reference);
    }

    void setBody(Scope body) {
        this.body = body;
    }

    @Override
    public String toString() {
        return kind + " " + id();
    }
}
