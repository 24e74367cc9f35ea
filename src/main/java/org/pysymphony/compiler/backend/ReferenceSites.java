package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.parser.ast.ImportAlias;
import org.pysymphony.compiler.frontend.semantics.ModuleId;
import org.pysymphony.compiler.frontend.semantics.Symbol;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The places in the selected source text that denote a definition, recorded while the
 * closure is computed so that emission only has to look them up.
 * <ul>
 *   <li>name sites: name nodes and the def/class/except nodes that bind a module-level symbol</li>
 *   <li>chain sites: attribute chains through internal module aliases, emitted as one name</li>
 *   <li>string sites: entries of the entry module's {@code __all__}</li>
 *   <li>declaration sites: {@code global} statements naming module-level symbols</li>
 *   <li>import rewrites: internal imports nested in emitted code, with the aliases that stay</li>
 * </ul>
 */
public final class ReferenceSites {

    private final Map<ModuleId, Map<Integer, Symbol>> names = new HashMap<>();
    private final Map<ModuleId, Map<Integer, Symbol>> chains = new HashMap<>();
    private final Map<ModuleId, Map<Integer, Symbol>> strings = new HashMap<>();
    private final Map<ModuleId, Map<Integer, List<Symbol>>> declarations = new HashMap<>();
    private final Map<ModuleId, Map<Integer, List<ImportAlias>>> importRewrites = new HashMap<>();

    void addName(ModuleId module, int node, Symbol target) {
        names.computeIfAbsent(module, m -> new HashMap<>()).putIfAbsent(node, target);
    }

    void addChain(ModuleId module, int attributeNode, Symbol target) {
        chains.computeIfAbsent(module, m -> new HashMap<>()).put(attributeNode, target);
    }

    void addString(ModuleId module, int constantNode, Symbol target) {
        strings.computeIfAbsent(module, m -> new HashMap<>()).put(constantNode, target);
    }

    void addDeclaration(ModuleId module, int globalNode, List<Symbol> targets) {
        declarations.computeIfAbsent(module, m -> new HashMap<>()).put(globalNode, targets);
    }

    void addImportRewrite(ModuleId module, int importNode, List<ImportAlias> retained) {
        importRewrites.computeIfAbsent(module, m -> new HashMap<>()).put(importNode, List.copyOf(retained));
    }

    public Optional<Symbol> name(ModuleId module, int node) {
        return lookup(names, module, node);
    }

    public Optional<Symbol> chain(ModuleId module, int attributeNode) {
        return lookup(chains, module, attributeNode);
    }

    public Optional<Symbol> string(ModuleId module, int constantNode) {
        return lookup(strings, module, constantNode);
    }

    /**
     * @return One entry per declared name; null where the name is not a module-level definition.
     */
    public Optional<List<Symbol>> declaration(ModuleId module, int globalNode) {
        return lookup(declarations, module, globalNode);
    }

    public Optional<List<ImportAlias>> importRewrite(ModuleId module, int importNode) {
        return lookup(importRewrites, module, importNode);
    }

    private static <T> Optional<T> lookup(Map<ModuleId, Map<Integer, T>> sites, ModuleId module, int node) {
        Map<Integer, T> byNode = sites.get(module);
        return byNode == null ? Optional.empty() : Optional.ofNullable(byNode.get(node));
    }
}
