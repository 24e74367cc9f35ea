package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.semantics.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The selected definitions of a merge and the edges between them. Nodes keep the order in
 * which they were first reached from the entry module.
 */
public final class DependencyGraph {

    private final Set<Symbol> nodes = new LinkedHashSet<>();
    private final Map<Symbol, List<DependencyEdge>> outgoing = new LinkedHashMap<>();
    private final Set<DependencyEdge> edges = new LinkedHashSet<>();

    /**
     * @return true if the symbol was not part of the graph yet.
     */
    public boolean addNode(Symbol symbol) {
        outgoing.computeIfAbsent(symbol, s -> new ArrayList<>());
        return nodes.add(symbol);
    }

    /**
     * Adds an edge; self edges (recursion) carry no ordering information and are dropped.
     */
    public void addEdge(Symbol dependent, Symbol dependency, DependencyEdge.Kind kind) {
        if (dependent == dependency) {
            return;
        }
        DependencyEdge edge = new DependencyEdge(dependent, dependency, kind);
        if (edges.add(edge)) {
            outgoing.computeIfAbsent(dependent, s -> new ArrayList<>()).add(edge);
        }
    }

    public boolean contains(Symbol symbol) {
        return nodes.contains(symbol);
    }

    public Set<Symbol> nodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public Set<DependencyEdge> edges() {
        return Collections.unmodifiableSet(edges);
    }

    public List<DependencyEdge> dependenciesOf(Symbol symbol) {
        return Collections.unmodifiableList(outgoing.getOrDefault(symbol, List.of()));
    }

    public int size() {
        return nodes.size();
    }
}
