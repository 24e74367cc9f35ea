package org.pysymphony.compiler.frontend.module;

import org.pysymphony.compiler.api.CompilationException;
import org.pysymphony.compiler.api.UnsupportedConstructException;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.io.SourceLoader;
import org.pysymphony.compiler.frontend.parser.Parser;
import org.pysymphony.compiler.frontend.parser.ast.ImportAlias;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportNode;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NodeWalker;
import org.pysymphony.compiler.frontend.semantics.DynamicImports;
import org.pysymphony.compiler.frontend.semantics.ModuleId;
import org.pysymphony.compiler.frontend.semantics.ScopeBuilder;
import org.pysymphony.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the entry module and, transitively, every internal module it imports.
 *
 * <p>Each module is read, parsed and cataloged exactly once. Imports are followed at any
 * nesting depth, including imports inside functions and conditionals. An import is internal
 * when its top-level package or module exists under the project root; everything else is left
 * to the interpreter's module path.</p>
 */
public final class DependencyScanner {

    private static final Logger log = LoggerFactory.getLogger(DependencyScanner.class);

    private final Path projectRoot;
    private final Map<String, ModuleDescriptor> modules = new LinkedHashMap<>();
    private final Set<String> namespacePackages = new LinkedHashSet<>();
    private final Deque<ModuleDescriptor> pending = new ArrayDeque<>();

    /**
     * @param projectRoot The directory absolute imports are resolved against.
     */
    public DependencyScanner(Path projectRoot) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    /**
     * Scans the entry file and all its transitive internal imports.
     *
     * @param entryFile The script to merge.
     * @return The loaded modules, entry first.
     * @throws CompilationException on parse failures, wildcard or dynamic imports, and internal
     *                              imports that cannot be found.
     * @throws IOException          if a module file cannot be read.
     */
    public ModuleSet scan(Path entryFile) throws CompilationException, IOException {
        Path entry = entryFile.toAbsolutePath().normalize();
        if (!entry.startsWith(projectRoot)) {
            throw new IOException("Entry file " + entry + " is not inside the project root " + projectRoot);
        }
        load(entry);
        while (!pending.isEmpty()) {
            ModuleDescriptor module = pending.poll();
            for (int importNode : collectImports(module.store())) {
                followImport(module, importNode);
            }
        }
        log.debug("Scanned {} internal module(s) and {} namespace package(s) under {}", modules.size(),
                namespacePackages.size(), projectRoot);
        return new ModuleSet(projectRoot, modules, namespacePackages);
    }

    private void followImport(ModuleDescriptor importer, int importNode) throws CompilationException, IOException {
        NodeStore store = importer.store();
        int line = store.get(importNode).line();
        if (store.get(importNode) instanceof ImportNode importStatement) {
            for (ImportAlias alias : importStatement.names()) {
                loadDotted(alias.name(), false, importer, line);
            }
            return;
        }
        ImportFromNode from = (ImportFromNode) store.get(importNode);
        if (from.isFuture()) {
            return;
        }
        if (from.isWildcard()) {
            throw new UnsupportedConstructException("Wildcard import 'from " + ".".repeat(from.level())
                    + from.module() + " import *' is not supported", importer.id().path(), line);
        }
        String source = ModuleNames.absolute(importer.packageName(), from.level(), from.module())
                .orElseThrow(() -> unresolved("Relative import climbs above the project root", importer, line));
        if (!loadDotted(source, from.isRelative(), importer, line)) {
            return;
        }
        for (ImportAlias alias : from.names()) {
            // the name may be a submodule or a definition of the package
            loadModule(ModuleNames.child(source, alias.name()));
        }
    }

    /**
     * Loads every package along a dotted name.
     * @return true if the name is internal.
     */
    private boolean loadDotted(String dottedName, boolean mustExist, ModuleDescriptor importer, int line)
            throws CompilationException, IOException {
        if (dottedName.isEmpty()) {
            return true;
        }
        List<String> prefixes = ModuleNames.prefixes(dottedName);
        for (int i = 0; i < prefixes.size(); i++) {
            if (!loadModule(prefixes.get(i))) {
                if (i == 0 && !mustExist) {
                    return false;
                }
                throw unresolved("Cannot find internal module '" + dottedName + "'", importer, line);
            }
        }
        return true;
    }

    /**
     * @return true if the module exists (now loaded) or is a namespace package.
     */
    private boolean loadModule(String dottedName) throws CompilationException, IOException {
        if (modules.containsKey(dottedName) || namespacePackages.contains(dottedName)) {
            return true;
        }
        Path directory = projectRoot.resolve(dottedName.replace('.', '/'));
        Path init = directory.resolve("__init__.py");
        Path file = projectRoot.resolve(dottedName.replace('.', '/') + ".py");
        if (Files.isRegularFile(init)) {
            load(init);
        } else if (Files.isRegularFile(file)) {
            load(file);
        } else if (Files.isDirectory(directory)) {
            namespacePackages.add(dottedName);
        } else {
            return false;
        }
        return true;
    }

    private void load(Path file) throws CompilationException, IOException {
        ModuleId id = new ModuleId(projectRoot.relativize(file).toString().replace('\\', '/'));
        SourceLoader.LoadResult loaded = SourceLoader.loadFile(file);
        NodeStore store = Parser.parse(loaded.content(), id.path());
        SymbolTable table = ScopeBuilder.build(id, store);
        if (!table.wildcardImports().isEmpty()) {
            ImportFromNode wildcard = (ImportFromNode) store.get(table.wildcardImports().get(0));
            throw new UnsupportedConstructException("Wildcard import 'from " + ".".repeat(wildcard.level())
                    + wildcard.module() + " import *' is not supported", id.path(), wildcard.line());
        }
        List<Integer> dynamicImports = DynamicImports.find(table);
        if (!dynamicImports.isEmpty()) {
            throw new UnsupportedConstructException("Dynamic import '" + store.text(dynamicImports.get(0))
                    + "' is not supported", id.path(), store.get(dynamicImports.get(0)).line());
        }
        ModuleDescriptor descriptor = new ModuleDescriptor(id, id.dottedName(), file, store, table);
        modules.put(descriptor.name(), descriptor);
        pending.add(descriptor);
        log.debug("Loaded module {} from {}", descriptor.name(), id.path());
    }

    private static List<Integer> collectImports(NodeStore store) {
        List<Integer> imports = new ArrayList<>();
        NodeWalker walker = new NodeWalker(store) {
            @Override
            public Void visitImport(int index, ImportNode node) {
                imports.add(index);
                return null;
            }

            @Override
            public Void visitImportFrom(int index, ImportFromNode node) {
                imports.add(index);
                return null;
            }
        };
        walker.walk(store.root());
        return imports;
    }

    private static CompilationException unresolved(String message, ModuleDescriptor importer, int line) {
        return new CompilationException(ErrorKind.UNRESOLVED_REFERENCE, message, importer.id().path(), List.of(line));
    }
}
