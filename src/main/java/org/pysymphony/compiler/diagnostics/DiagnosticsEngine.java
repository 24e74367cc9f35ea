package org.pysymphony.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Collects diagnostics produced while analyzing one or more modules.
 * Instances are not shared between pipeline runs.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     * @param kind The problem classification.
     * @param message The message.
     * @param fileName The source file.
     * @param lines The offending line numbers.
     */
    public void reportError(ErrorKind kind, String message, String fileName, int... lines) {
        reportError(kind, message, fileName, box(lines));
    }

    /**
     * Reports an error carrying several line numbers.
     */
    public void reportError(ErrorKind kind, String message, String fileName, List<Integer> lines) {
        report(new Diagnostic(Diagnostic.Type.ERROR, kind, message, fileName, sorted(lines)));
    }

    /**
     * Reports a warning.
     * @param kind The problem classification.
     * @param message The message.
     * @param fileName The source file.
     * @param lines The offending line numbers.
     */
    public void reportWarning(ErrorKind kind, String message, String fileName, int... lines) {
        reportWarning(kind, message, fileName, box(lines));
    }

    /**
     * Reports a warning carrying several line numbers.
     */
    public void reportWarning(ErrorKind kind, String message, String fileName, List<Integer> lines) {
        report(new Diagnostic(Diagnostic.Type.WARNING, kind, message, fileName, sorted(lines)));
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * @return true if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return All diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }

    /**
     * Builds a one-diagnostic-per-line summary.
     * @return The summary, or an empty string if nothing was reported.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining(System.lineSeparator()));
    }

    private static List<Integer> box(int[] lines) {
        return IntStream.of(lines).boxed().toList();
    }

    private static List<Integer> sorted(List<Integer> lines) {
        return lines.stream().distinct().sorted().toList();
    }
}
