package org.pysymphony.compiler.api;

import org.pysymphony.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the input modules contain duplicate definitions or unresolved references.
 * All findings are carried, not only the first one.
 */
public class SemanticErrorException extends CompilationException {

    private final List<Diagnostic> diagnostics;

    public SemanticErrorException(List<Diagnostic> diagnostics) {
        super(diagnostics.get(0).kind(), describe(diagnostics), diagnostics.get(0).fileName(), diagnostics.get(0).lines());
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String describe(List<Diagnostic> diagnostics) {
        String first = diagnostics.get(0).message();
        if (diagnostics.size() == 1) {
            return first;
        }
        return first + " (and " + (diagnostics.size() - 1) + " more)" + System.lineSeparator()
                + diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining(System.lineSeparator()));
    }
}
