package org.pysymphony.compiler.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles the merged module from already decided structure:
 * <ol>
 *   <li>the entry module's docstring</li>
 *   <li>{@code from __future__} imports</li>
 *   <li>external imports, once each</li>
 *   <li>definition units in the given order, each preceded by {@code # From <module-path>}</li>
 *   <li>statements kept for their effect, deduplicated</li>
 *   <li>the entry block</li>
 * </ol>
 */
public class Emitter {

    private static final Logger log = LoggerFactory.getLogger(Emitter.class);

    static final String PROVENANCE_PREFIX = "# From ";

    /**
     * @param unit  The resolved merge unit.
     * @param order The definition units in emission order.
     * @return The text of the merged module.
     */
    public String emit(MergeUnit unit, List<StatementRef> order) {
        RenameRewriter rewriter = new RenameRewriter(unit.sites());
        StringBuilder out = new StringBuilder();

        unit.docstring().ifPresent(docstring -> out.append(rewriter.render(docstring)).append("\n\n"));

        Set<String> header = new LinkedHashSet<>();
        for (StatementRef future : unit.futureImports()) {
            header.add(rewriter.render(future));
        }
        boolean hasFutures = !header.isEmpty();
        header.forEach(line -> out.append(line).append('\n'));

        Set<String> imports = new LinkedHashSet<>();
        for (ExternalImport external : unit.externalImports()) {
            imports.add(external.render());
        }
        if (hasFutures && !imports.isEmpty()) {
            out.append('\n');
        }
        imports.forEach(line -> out.append(line).append('\n'));

        for (StatementRef definition : order) {
            separate(out);
            out.append(PROVENANCE_PREFIX).append(definition.module().id().path()).append('\n');
            out.append(rewriter.render(definition)).append('\n');
        }

        Set<String> preserved = new LinkedHashSet<>();
        for (StatementRef statement : unit.preservedStatements()) {
            preserved.add(rewriter.render(statement));
        }
        if (!preserved.isEmpty()) {
            separate(out);
            preserved.forEach(text -> out.append(text).append('\n'));
        }

        unit.entryBlock().ifPresent(entryBlock -> {
            separate(out);
            out.append(rewriter.render(entryBlock)).append('\n');
        });
        log.debug("Emitted {} definition unit(s), {} import(s), {} preserved statement(s)", order.size(),
                imports.size(), preserved.size());
        return out.toString();
    }

    private static void separate(StringBuilder out) {
        if (out.length() > 0) {
            out.append("\n\n");
        }
    }
}
