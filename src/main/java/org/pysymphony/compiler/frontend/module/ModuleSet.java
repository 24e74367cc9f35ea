package org.pysymphony.compiler.frontend.module;

import org.pysymphony.compiler.frontend.semantics.ModuleId;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The internal modules of one merge, keyed by dotted name in discovery order. The entry
 * module comes first.
 */
public final class ModuleSet {

    private final Path projectRoot;
    private final Map<String, ModuleDescriptor> modules;
    private final Map<ModuleId, ModuleDescriptor> byId = new LinkedHashMap<>();
    private final Set<String> namespacePackages;

    public ModuleSet(Path projectRoot, Map<String, ModuleDescriptor> modules, Set<String> namespacePackages) {
        if (modules.isEmpty()) {
            throw new IllegalArgumentException("A module set needs at least the entry module");
        }
        this.projectRoot = projectRoot;
        this.modules = Collections.unmodifiableMap(new LinkedHashMap<>(modules));
        this.namespacePackages = Set.copyOf(namespacePackages);
        modules.values().forEach(module -> byId.put(module.id(), module));
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public ModuleDescriptor entry() {
        return modules.values().iterator().next();
    }

    public Collection<ModuleDescriptor> modules() {
        return modules.values();
    }

    public Optional<ModuleDescriptor> get(String dottedName) {
        return Optional.ofNullable(modules.get(dottedName));
    }

    /**
     * @throws IllegalArgumentException if the module is not part of this set.
     */
    public ModuleDescriptor get(ModuleId id) {
        ModuleDescriptor descriptor = byId.get(id);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown module: " + id);
        }
        return descriptor;
    }

    /**
     * @return true for a loaded module or a directory package without {@code __init__.py}.
     */
    public boolean isInternal(String dottedName) {
        return modules.containsKey(dottedName) || namespacePackages.contains(dottedName);
    }

    public boolean isNamespacePackage(String dottedName) {
        return namespacePackages.contains(dottedName);
    }

    public int size() {
        return modules.size();
    }
}
