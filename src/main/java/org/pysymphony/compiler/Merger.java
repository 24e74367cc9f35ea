package org.pysymphony.compiler;

import org.pysymphony.compiler.api.CompilationException;
import org.pysymphony.compiler.api.SemanticErrorException;
import org.pysymphony.compiler.backend.ConflictResolver;
import org.pysymphony.compiler.backend.DependencyGraphBuilder;
import org.pysymphony.compiler.backend.Emitter;
import org.pysymphony.compiler.backend.MergeUnit;
import org.pysymphony.compiler.backend.StatementRef;
import org.pysymphony.compiler.backend.TopologicalOrderer;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.module.DependencyScanner;
import org.pysymphony.compiler.frontend.module.ModuleDescriptor;
import org.pysymphony.compiler.frontend.module.ModuleSet;
import org.pysymphony.compiler.frontend.module.ProjectLinker;
import org.pysymphony.compiler.frontend.semantics.DuplicateDefinition;
import org.pysymphony.compiler.frontend.semantics.ReferenceResolver;
import org.pysymphony.compiler.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges a multi-module program into a single module.
 *
 * <p>Phases:</p>
 * <ol>
 *   <li>Scan: load, parse and catalog the entry module and its internal imports.</li>
 *   <li>Validate: duplicate definitions and unresolved references in any loaded module abort
 *       the merge.</li>
 *   <li>Select: compute the minimal closure of definitions ({@link DependencyGraphBuilder}).</li>
 *   <li>Rename: resolve name collisions ({@link ConflictResolver}).</li>
 *   <li>Order: topologically sort the definitions ({@link TopologicalOrderer}).</li>
 *   <li>Emit: render and write the merged module ({@link Emitter}).</li>
 * </ol>
 * A merger holds no state between runs.
 */
public class Merger {

    private static final Logger log = LoggerFactory.getLogger(Merger.class);

    public static final String DEFAULT_OUTPUT_SUFFIX = "_merged";

    private final String outputSuffix;

    public Merger() {
        this(DEFAULT_OUTPUT_SUFFIX);
    }

    /**
     * @param outputSuffix Appended to the entry file's stem to name the output file.
     */
    public Merger(String outputSuffix) {
        this.outputSuffix = outputSuffix;
    }

    /**
     * Merges the program starting at {@code entryFile} and writes the result beside it.
     *
     * @param entryFile   The script to merge.
     * @param projectRoot The directory absolute imports are resolved against.
     * @return The written file and merge statistics.
     * @throws CompilationException on any fatal problem of the sources.
     * @throws IOException          if a source cannot be read or the output cannot be written.
     */
    public MergeResult merge(Path entryFile, Path projectRoot) throws CompilationException, IOException {
        ModuleSet modules = new DependencyScanner(projectRoot).scan(entryFile);
        log.info("Scanned {} module(s) reachable from {}", modules.size(), modules.entry().id());

        ProjectLinker linker = new ProjectLinker(modules);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        validate(modules, linker, diagnostics);
        if (diagnostics.hasErrors()) {
            throw new SemanticErrorException(diagnostics.errors());
        }
        diagnostics.warnings().forEach(warning -> log.warn("{}", warning));

        MergeUnit unit = new DependencyGraphBuilder(modules, linker).build();
        new ConflictResolver(linker).resolve(unit);
        List<StatementRef> order = new TopologicalOrderer().order(unit);
        String merged = new Emitter().emit(unit, order);

        Path output = outputPathFor(entryFile, outputSuffix);
        Files.writeString(output, merged, StandardCharsets.UTF_8);
        log.info("Wrote {} definition(s) from {} module(s) to {}", unit.graph().size(), modules.size(), output);

        Map<String, String> renames = new LinkedHashMap<>();
        unit.renames().forEach((symbol, name) -> renames.put(symbol.id().toString(), name));
        return new MergeResult(output, merged, unit.graph().size(), modules.size(), renames, diagnostics.warnings());
    }

    /**
     * @return {@code <dir>/<stem><suffix>.py} for {@code <dir>/<stem>.py}.
     */
    public static Path outputPathFor(Path entryFile, String suffix) {
        String fileName = entryFile.getFileName().toString();
        String stem = fileName.endsWith(".py") ? fileName.substring(0, fileName.length() - 3) : fileName;
        return entryFile.resolveSibling(stem + suffix + ".py");
    }

    private static void validate(ModuleSet modules, ProjectLinker linker, DiagnosticsEngine diagnostics) {
        for (ModuleDescriptor module : modules.modules()) {
            String path = module.id().path();
            for (DuplicateDefinition duplicate : module.table().duplicates()) {
                String message = "'" + duplicate.name() + "' is defined more than once in " + duplicate.scope();
                if (duplicate.isTopLevel()) {
                    diagnostics.reportError(ErrorKind.DUPLICATE_DEFINITION, message, path, duplicate.lines());
                } else {
                    diagnostics.reportWarning(ErrorKind.DUPLICATE_DEFINITION, message, path, duplicate.lines());
                }
            }
            new ReferenceResolver(module.table(), linker).validate(diagnostics);
            for (Symbol symbol : module.table().symbols()) {
                if (symbol.kind() == Symbol.Kind.IMPORT_ALIAS && linker.isInternal(symbol)
                        && linker.link(symbol).isEmpty()) {
                    diagnostics.reportError(ErrorKind.UNRESOLVED_REFERENCE, "Cannot import '" + symbol.name()
                            + "' from internal module '" + ".".repeat(symbol.importBinding().level())
                            + Objects.toString(symbol.importBinding().module(), "") + "'", path, symbol.line());
                }
            }
        }
        log.debug("Validated {} module(s): {}", modules.size(), diagnostics.summary());
    }
}
