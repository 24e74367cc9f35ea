package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.module.ModuleSet;
import org.pysymphony.compiler.frontend.semantics.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The working set of one merge run: the selected definitions and their edges, the statements
 * they are emitted from, the external imports they need, the statements preserved for their
 * side effects and the retained entry block.
 *
 * <p>Filled by the {@link DependencyGraphBuilder}; afterwards only the qualified names of its
 * symbols change, written once by the {@link ConflictResolver}.</p>
 */
public final class MergeUnit {

    private final ModuleSet modules;
    private final DependencyGraph graph = new DependencyGraph();
    private final ReferenceSites sites = new ReferenceSites();
    private final Map<StatementRef, List<Symbol>> definitionUnits = new LinkedHashMap<>();
    private final Set<StatementRef> preservedStatements = new LinkedHashSet<>();
    private final Map<String, ExternalImport> externalImports = new LinkedHashMap<>();
    private final Set<StatementRef> futureImports = new LinkedHashSet<>();
    private final Set<String> builtinUses = new LinkedHashSet<>();
    private StatementRef entryBlock;
    private StatementRef docstring;

    public MergeUnit(ModuleSet modules) {
        this.modules = modules;
    }

    public ModuleSet modules() {
        return modules;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public ReferenceSites sites() {
        return sites;
    }

    /**
     * @return The statements that emit selected definitions, in discovery order.
     */
    public List<StatementRef> definitionUnits() {
        return List.copyOf(definitionUnits.keySet());
    }

    /**
     * @return The module-level symbols whose first binding is in {@code unit}.
     */
    public List<Symbol> ownedSymbols(StatementRef unit) {
        return Collections.unmodifiableList(definitionUnits.getOrDefault(unit, List.of()));
    }

    /**
     * @return The definition unit a selected symbol is emitted in; members map to their class's unit.
     */
    public Optional<StatementRef> unitOf(Symbol symbol) {
        StatementRef unit = new StatementRef(modules.get(symbol.module()), symbol.statement());
        return definitionUnits.containsKey(unit) ? Optional.of(unit) : Optional.empty();
    }

    public boolean isDefinitionUnit(StatementRef statement) {
        return definitionUnits.containsKey(statement);
    }

    /**
     * @return Statements kept for their effect, in emission order.
     */
    public List<StatementRef> preservedStatements() {
        return List.copyOf(preservedStatements);
    }

    public boolean isPreserved(StatementRef statement) {
        return preservedStatements.contains(statement);
    }

    public List<ExternalImport> externalImports() {
        return List.copyOf(externalImports.values());
    }

    public List<StatementRef> futureImports() {
        return List.copyOf(futureImports);
    }

    /**
     * @return Builtin names read by the selected code; a definition of the same name would
     * shadow them once everything shares one module.
     */
    public Set<String> builtinUses() {
        return Collections.unmodifiableSet(builtinUses);
    }

    public Optional<StatementRef> entryBlock() {
        return Optional.ofNullable(entryBlock);
    }

    public Optional<StatementRef> docstring() {
        return Optional.ofNullable(docstring);
    }

    /**
     * @return Every module-level symbol bound by an emitted statement, definitions first.
     */
    public List<Symbol> emittedDefinitions() {
        Set<Symbol> result = new LinkedHashSet<>();
        definitionUnits.values().forEach(result::addAll);
        for (StatementRef statement : preservedStatements) {
            addOwned(statement, result);
        }
        if (entryBlock != null) {
            addOwned(entryBlock, result);
        }
        return new ArrayList<>(result);
    }

    private void addOwned(StatementRef statement, Set<Symbol> result) {
        for (Symbol symbol : statement.module().table().moduleSymbols()) {
            if (symbol.statement() == statement.statement()) {
                result.add(symbol);
            }
        }
    }

    /**
     * @return The symbols that are emitted under a new name.
     */
    public Map<Symbol, String> renames() {
        Map<Symbol, String> renames = new LinkedHashMap<>();
        for (Symbol symbol : emittedDefinitions()) {
            if (symbol.qualifiedName() != null) {
                renames.put(symbol, symbol.qualifiedName());
            }
        }
        for (ExternalImport external : externalImports.values()) {
            for (Symbol alias : external.aliases()) {
                if (alias.qualifiedName() != null) {
                    renames.put(alias, alias.qualifiedName());
                }
            }
        }
        return renames;
    }

    // === Filled by the DependencyGraphBuilder ===

    void addDefinitionUnit(StatementRef unit, List<Symbol> owned) {
        definitionUnits.putIfAbsent(unit, List.copyOf(owned));
    }

    void addPreservedStatement(StatementRef statement) {
        preservedStatements.add(statement);
    }

    void reorderPreservedStatements(List<StatementRef> ordered) {
        preservedStatements.clear();
        preservedStatements.addAll(ordered);
    }

    ExternalImport addExternalImport(Symbol alias) {
        ExternalImport external = externalImports.computeIfAbsent(ExternalImport.keyOf(alias),
                key -> new ExternalImport(alias.importBinding(), alias.name()));
        if (!external.aliases().contains(alias)) {
            external.addAlias(alias);
        }
        return external;
    }

    void addFutureImport(StatementRef statement) {
        futureImports.add(statement);
    }

    void addBuiltinUse(String name) {
        builtinUses.add(name);
    }

    void setEntryBlock(StatementRef entryBlock) {
        this.entryBlock = entryBlock;
    }

    void setDocstring(StatementRef docstring) {
        this.docstring = docstring;
    }
}
