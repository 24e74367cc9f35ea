package org.pysymphony.compiler;

import org.pysymphony.compiler.diagnostics.Diagnostic;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The outcome of a successful merge.
 *
 * @param outputFile      The written file.
 * @param source          The merged module text.
 * @param definitionCount Number of selected definitions, class members included.
 * @param moduleCount     Number of internal modules that were scanned.
 * @param renames         Original symbol id to emitted name, for every renamed definition or import.
 * @param warnings        Non-fatal findings of the source validation.
 */
public record MergeResult(Path outputFile, String source, int definitionCount, int moduleCount,
                          Map<String, String> renames, List<Diagnostic> warnings) {
}
