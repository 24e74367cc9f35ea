package org.pysymphony.compiler.audit;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.pysymphony.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The findings of one audit run. Errors block, warnings only inform; both use the
 * {@link Diagnostic} shape.
 *
 * @param file     The display path of the audited file.
 * @param errors   Blocking findings in report order.
 * @param warnings Informational findings in report order.
 */
public record AuditReport(String file, List<Diagnostic> errors, List<Diagnostic> warnings) {

    static final String ERRORS_HEADING = "=== Errors ===";
    static final String WARNINGS_HEADING = "=== Warnings ===";

    public AuditReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean passed() {
        return errors.isEmpty();
    }

    /**
     * Renders the report for a terminal, errors first.
     * @return The multi-line text rendering.
     */
    public String toText() {
        StringBuilder text = new StringBuilder();
        text.append("Audit of ").append(file).append(": ").append(passed() ? "PASSED" : "FAILED")
                .append(" (").append(errors.size()).append(" error(s), ")
                .append(warnings.size()).append(" warning(s))").append('\n');
        appendSection(text, ERRORS_HEADING, errors);
        appendSection(text, WARNINGS_HEADING, warnings);
        return text.toString();
    }

    /**
     * @return {@code {"file", "passed", "errors": [...], "warnings": [...]}} as pretty printed JSON.
     */
    public String toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("file", file);
        root.addProperty("passed", passed());
        root.add("errors", toJsonArray(errors));
        root.add("warnings", toJsonArray(warnings));
        return new GsonBuilder().setPrettyPrinting().create().toJson(root);
    }

    private static void appendSection(StringBuilder text, String heading, List<Diagnostic> diagnostics) {
        text.append(heading).append('\n');
        if (diagnostics.isEmpty()) {
            text.append("(none)").append('\n');
        }
        for (Diagnostic diagnostic : diagnostics) {
            text.append(formatLine(diagnostic)).append('\n');
        }
    }

    static String formatLine(Diagnostic diagnostic) {
        String line = "[" + diagnostic.kind() + "] " + diagnostic.message();
        return diagnostic.lines().isEmpty() ? line : line + " (line " + diagnostic.linesText() + ")";
    }

    private static JsonArray toJsonArray(List<Diagnostic> diagnostics) {
        JsonArray array = new JsonArray();
        for (Diagnostic diagnostic : diagnostics) {
            JsonObject entry = new JsonObject();
            entry.addProperty("kind", diagnostic.kind().name());
            entry.addProperty("message", diagnostic.message());
            JsonArray lines = new JsonArray();
            diagnostic.lines().forEach(lines::add);
            entry.add("lines", lines);
            array.add(entry);
        }
        return array;
    }
}
