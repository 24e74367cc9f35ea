package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.api.ParseFailureException;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.io.SourceLoader;
import org.pysymphony.compiler.frontend.parser.Parser;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Static audit of a single source file. The stages always run to completion so that every
 * problem of the file ends up in one report:
 * <ol>
 *   <li>{@link SymbolTableStage}: catalog and duplicate definitions.</li>
 *   <li>{@link ReferenceValidationStage}: unresolved names and attribute chains.</li>
 *   <li>{@link PatternCheckStage}: whole-file checks from a {@link PatternCheckRegistry}.</li>
 * </ol>
 * A file that cannot be parsed yields a report with a single parse failure error.
 */
public class Auditor {

    private static final Logger log = LoggerFactory.getLogger(Auditor.class);

    private final List<IAuditStage> stages;
    private AuditReport report;

    public Auditor() {
        this(PatternCheckRegistry.initializeWithDefaults());
    }

    public Auditor(PatternCheckRegistry registry) {
        this.stages = List.of(new SymbolTableStage(), new ReferenceValidationStage(), new PatternCheckStage(registry));
    }

    /**
     * Audits source text.
     * @param sourceText The file content.
     * @param displayPath The name used in the report.
     * @return {@code true} if the file has no errors.
     */
    public boolean audit(String sourceText, String displayPath) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            NodeStore store = Parser.parse(sourceText, displayPath);
            AuditContext context = new AuditContext(displayPath, store);
            for (IAuditStage stage : stages) {
                stage.run(context, diagnostics);
                log.debug("Audit stage '{}' of {} done, {} finding(s) so far", stage.name(), displayPath,
                        diagnostics.getDiagnostics().size());
            }
        } catch (ParseFailureException e) {
            diagnostics.reportError(ErrorKind.PARSE_FAILURE, e.getDetail(), displayPath, e.getLine());
        }
        report = new AuditReport(displayPath, diagnostics.errors(), diagnostics.warnings());
        log.info("Audit of {} {}: {} error(s), {} warning(s)", displayPath, report.passed() ? "passed" : "failed",
                report.errors().size(), report.warnings().size());
        return report.passed();
    }

    /**
     * Reads and audits a file.
     * @param file The file to audit.
     * @return {@code true} if the file has no errors.
     * @throws IOException if the file cannot be read.
     */
    public boolean audit(Path file) throws IOException {
        return audit(SourceLoader.loadFile(file).content(), file.toString());
    }

    /**
     * @return The report of the most recent run.
     * @throws IllegalStateException if nothing has been audited yet.
     */
    public AuditReport getReport() {
        if (report == null) {
            throw new IllegalStateException("No audit has been run");
        }
        return report;
    }
}
