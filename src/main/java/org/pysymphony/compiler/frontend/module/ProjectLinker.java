package org.pysymphony.compiler.frontend.module;

import org.pysymphony.compiler.frontend.semantics.ImportBinding;
import org.pysymphony.compiler.frontend.semantics.ImportLinker;
import org.pysymphony.compiler.frontend.semantics.LinkTarget;
import org.pysymphony.compiler.frontend.semantics.ModuleId;
import org.pysymphony.compiler.frontend.semantics.Symbol;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Links import aliases to the modules and definitions of a {@link ModuleSet}. Re-exports
 * (a package importing a name that a client then imports from the package) are followed to
 * the defining module; a re-exported external import resolves to the re-exporting alias.
 */
public final class ProjectLinker implements ImportLinker {

    private final ModuleSet modules;

    public ProjectLinker(ModuleSet modules) {
        this.modules = modules;
    }

    /**
     * @return true if the alias was bound from a module under the project root.
     */
    public boolean isInternal(Symbol alias) {
        return isInternal(alias.module(), alias.importBinding());
    }

    /**
     * @param importer The module containing the import.
     * @param binding  One entry of an import statement.
     * @return true if the entry loads a module under the project root.
     */
    public boolean isInternal(ModuleId importer, ImportBinding binding) {
        return binding.isRelative() || sourceModule(importer, binding).map(modules::isInternal).orElse(false);
    }

    @Override
    public Optional<LinkTarget> link(Symbol alias) {
        return link(alias, new HashSet<>());
    }

    private Optional<LinkTarget> link(Symbol alias, Set<Symbol> seen) {
        if (alias.kind() != Symbol.Kind.IMPORT_ALIAS || !seen.add(alias)) {
            return Optional.empty();
        }
        ImportBinding binding = alias.importBinding();
        Optional<String> source = sourceModule(alias.module(), binding);
        if (source.isPresent() && source.get().isEmpty() && binding.isFromImport()) {
            // from . import name, at the top of the project
            return moduleTarget(binding.importedName());
        }
        if (source.isEmpty() || !modules.isInternal(source.get())) {
            return Optional.empty();
        }
        if (!binding.isFromImport()) {
            String target = binding.asName() == null ? source.get().split("\\.")[0] : source.get();
            return moduleTarget(target);
        }
        return member(moduleTarget(source.get()).orElse(null), binding.importedName(), seen);
    }

    @Override
    public Optional<LinkTarget> member(LinkTarget module, String attribute) {
        return member(module, attribute, new HashSet<>());
    }

    private Optional<LinkTarget> member(LinkTarget module, String attribute, Set<Symbol> seen) {
        if (module == null || !module.isModule()) {
            return Optional.empty();
        }
        String childName = ModuleNames.child(module.moduleName(), attribute);
        if (modules.isInternal(childName)) {
            return moduleTarget(childName);
        }
        if (module.table() == null) {
            return Optional.empty();
        }
        Optional<Symbol> symbol = module.table().lookupModuleSymbol(attribute);
        if (symbol.isEmpty()) {
            return Optional.empty();
        }
        if (symbol.get().kind() == Symbol.Kind.IMPORT_ALIAS) {
            Optional<LinkTarget> reexported = link(symbol.get(), seen);
            if (reexported.isPresent()) {
                return reexported;
            }
        }
        return Optional.of(new LinkTarget(module.moduleName(), module.table(), symbol.get()));
    }

    private Optional<LinkTarget> moduleTarget(String dottedName) {
        if (modules.isNamespacePackage(dottedName)) {
            return Optional.of(new LinkTarget(dottedName, null, null));
        }
        return modules.get(dottedName).map(descriptor -> new LinkTarget(dottedName, descriptor.table(), null));
    }

    /**
     * @return The absolute module named by the alias's import statement.
     */
    private Optional<String> sourceModule(ModuleId importerId, ImportBinding binding) {
        ModuleDescriptor importer = modules.get(importerId);
        return ModuleNames.absolute(importer.packageName(), binding.level(), binding.module());
    }
}
