package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.module.ProjectLinker;
import org.pysymphony.compiler.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gives every emitted module-level name a unique spelling with as few renames as possible.
 *
 * <p>Definitions are partitioned by bare name. Only partitions with more than one member, or
 * whose name other selected code reads as a builtin, are renamed; each member gets its module's
 * dotted path joined with underscores plus its bare name ({@code test_pkg_module1_nn}), with a
 * numeric suffix if that is taken too. Members of a class are never renamed on their own.</p>
 *
 * <p>External imports are resolved after definitions: an import keeps its bound name unless a
 * definition or an earlier import already uses it, otherwise it is rebound as
 * {@code <name>_ext}, {@code <name>_ext2}, and so on.</p>
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final ProjectLinker linker;

    public ConflictResolver(ProjectLinker linker) {
        this.linker = linker;
    }

    /**
     * Assigns qualified names to the colliding symbols of a merge unit.
     * @param unit The merge unit; its symbols are updated in place.
     * @return The number of renamed symbols.
     */
    public int resolve(MergeUnit unit) {
        Map<String, List<Symbol>> byName = new LinkedHashMap<>();
        for (Symbol symbol : unit.emittedDefinitions()) {
            if (symbol.kind() == Symbol.Kind.IMPORT_ALIAS && linker.isInternal(symbol)) {
                continue;
            }
            byName.computeIfAbsent(symbol.name(), name -> new ArrayList<>()).add(symbol);
        }
        Set<String> taken = new HashSet<>(byName.keySet());
        int renamed = 0;
        for (Map.Entry<String, List<Symbol>> partition : byName.entrySet()) {
            List<Symbol> symbols = partition.getValue();
            boolean shadowsBuiltin = unit.builtinUses().contains(partition.getKey());
            if (symbols.size() < 2 && !shadowsBuiltin) {
                continue;
            }
            for (Symbol symbol : symbols) {
                String qualified = unique(qualify(unit, symbol), taken);
                symbol.assignQualifiedName(qualified);
                renamed++;
                log.debug("Renamed {} to {}", symbol.id(), qualified);
            }
        }

        Set<String> used = new HashSet<>();
        byName.values().forEach(symbols -> symbols.forEach(symbol -> used.add(symbol.emittedName())));
        used.addAll(unit.builtinUses());
        for (ExternalImport external : unit.externalImports()) {
            String name = external.boundName();
            if (used.contains(name)) {
                String base = name + "_ext";
                name = base;
                for (int counter = 2; used.contains(name); counter++) {
                    name = base + counter;
                }
                for (Symbol alias : external.aliases()) {
                    alias.assignQualifiedName(name);
                }
                renamed++;
                log.debug("Rebound external import '{}' as {}", external.binding().render(external.boundName()), name);
            }
            used.add(name);
        }
        if (renamed > 0) {
            log.info("Resolved name collisions by renaming {} definition(s)", renamed);
        }
        return renamed;
    }

    private static String qualify(MergeUnit unit, Symbol symbol) {
        String module = unit.modules().get(symbol.module()).name();
        return module.replace('.', '_') + "_" + symbol.name();
    }

    private static String unique(String candidate, Set<String> taken) {
        String name = candidate;
        for (int counter = 2; taken.contains(name); counter++) {
            name = candidate + counter;
        }
        taken.add(name);
        return name;
    }
}
