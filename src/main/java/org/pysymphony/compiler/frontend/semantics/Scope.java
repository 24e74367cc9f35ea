package org.pysymphony.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One lexical region: the module, a class body, a function body or a comprehension.
 * A scope owns its children; the parent reference is only used for upward lookup.
 * Symbols are kept in insertion order and are unique per name.
 */
public final class Scope {

    public enum Kind {
        MODULE,
        CLASS,
        FUNCTION,
        COMPREHENSION
    }

    private final int id;
    private final Kind kind;
    private final Scope parent;
    private final int ownerNode;
    private final String name;
    private final List<Scope> children = new ArrayList<>();
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Set<String> globalNames = new LinkedHashSet<>();
    private final Set<String> nonlocalNames = new LinkedHashSet<>();
    private final Set<String> instanceAttributes = new LinkedHashSet<>();
    private String selfName;

    Scope(int id, Kind kind, Scope parent, int ownerNode, String name) {
        this.id = id;
        this.kind = kind;
        this.parent = parent;
        this.ownerNode = ownerNode;
        this.name = name;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public int id() {
        return id;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return The enclosing scope, or null for the module scope.
     */
    public Scope parent() {
        return parent;
    }

    /**
     * @return The index of the node that opened this scope (module, def, class, lambda or comprehension).
     */
    public int ownerNode() {
        return ownerNode;
    }

    public String name() {
        return name;
    }

    public List<Scope> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Looks up a name defined directly in this scope.
     * @return The symbol, or null.
     */
    public Symbol lookupLocal(String symbolName) {
        return symbols.get(symbolName);
    }

    public Collection<Symbol> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public boolean isDeclaredGlobal(String symbolName) {
        return globalNames.contains(symbolName);
    }

    public boolean isDeclaredNonlocal(String symbolName) {
        return nonlocalNames.contains(symbolName);
    }

    /**
     * @return For class scopes, the attributes assigned through the first parameter of its methods.
     */
    public Set<String> instanceAttributes() {
        return Collections.unmodifiableSet(instanceAttributes);
    }

    /**
     * @return For methods, the name of the first positional parameter; otherwise null.
     */
    public String selfName() {
        return selfName;
    }

    /**
     * @return The nearest enclosing scope (including this one) that is not a comprehension.
     */
    public Scope nearestNonComprehension() {
        Scope scope = this;
        while (scope.kind == Kind.COMPREHENSION && scope.parent != null) {
            scope = scope.parent;
        }
        return scope;
    }

    void define(Symbol symbol) {
        symbols.put(symbol.name(), symbol);
    }

    void declareGlobal(String symbolName) {
        globalNames.add(symbolName);
    }

    void declareNonlocal(String symbolName) {
        nonlocalNames.add(symbolName);
    }

    void addInstanceAttribute(String attribute) {
        instanceAttributes.add(attribute);
    }

    void setSelfName(String selfName) {
        this.selfName = selfName;
    }

    @Override
    public String toString() {
        return kind + " " + name;
    }
}
