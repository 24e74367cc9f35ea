package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.api.CircularDependencyException;
import org.pysymphony.compiler.frontend.semantics.Symbol;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Orders the definition units of a merge so that every dependency is emitted before its
 * dependents.
 *
 * <p>Symbol edges are lifted to the statements the symbols are emitted from: a member's
 * edges count for its class, which keeps each class ahead of everything its methods need and
 * its own members inside it. The order is a depth-first postorder; roots and neighbours are
 * taken in discovery order so that unrelated units keep the order they were reached in.</p>
 */
public class TopologicalOrderer {

    private enum Mark {
        VISITING,
        VISITED
    }

    /**
     * @param unit A merge unit whose closure has been computed.
     * @return The definition units in emission order.
     * @throws CircularDependencyException if two units need each other; the exception names
     *                                     one symbol per unit on the cycle.
     */
    public List<StatementRef> order(MergeUnit unit) throws CircularDependencyException {
        Map<StatementRef, Set<StatementRef>> dependencies = liftEdges(unit);
        Map<StatementRef, Mark> marks = new HashMap<>();
        List<StatementRef> ordered = new ArrayList<>();
        List<StatementRef> path = new ArrayList<>();
        for (StatementRef root : unit.definitionUnits()) {
            visit(root, dependencies, marks, path, ordered, unit);
        }
        return ordered;
    }

    private void visit(StatementRef node, Map<StatementRef, Set<StatementRef>> dependencies,
                       Map<StatementRef, Mark> marks, List<StatementRef> path, List<StatementRef> ordered,
                       MergeUnit unit) throws CircularDependencyException {
        Mark mark = marks.get(node);
        if (mark == Mark.VISITED) {
            return;
        }
        if (mark == Mark.VISITING) {
            List<String> cycle = new ArrayList<>();
            for (StatementRef member : path.subList(path.indexOf(node), path.size())) {
                cycle.add(describe(member, unit));
            }
            cycle.add(describe(node, unit));
            throw new CircularDependencyException(cycle);
        }
        marks.put(node, Mark.VISITING);
        path.add(node);
        for (StatementRef dependency : dependencies.getOrDefault(node, Set.of())) {
            visit(dependency, dependencies, marks, path, ordered, unit);
        }
        path.remove(path.size() - 1);
        marks.put(node, Mark.VISITED);
        ordered.add(node);
    }

    private static Map<StatementRef, Set<StatementRef>> liftEdges(MergeUnit unit) {
        Map<StatementRef, Set<StatementRef>> dependencies = new LinkedHashMap<>();
        for (Symbol symbol : unit.graph().nodes()) {
            Optional<StatementRef> from = unit.unitOf(symbol);
            if (from.isEmpty()) {
                continue;
            }
            for (DependencyEdge edge : unit.graph().dependenciesOf(symbol)) {
                Optional<StatementRef> to = unit.unitOf(edge.dependency());
                if (to.isPresent() && !to.get().equals(from.get())) {
                    dependencies.computeIfAbsent(from.get(), k -> new LinkedHashSet<>()).add(to.get());
                }
            }
        }
        return dependencies;
    }

    private static String describe(StatementRef statement, MergeUnit unit) {
        List<Symbol> owned = unit.ownedSymbols(statement);
        return owned.isEmpty() ? statement.toString() : owned.get(0).id().toString();
    }
}
