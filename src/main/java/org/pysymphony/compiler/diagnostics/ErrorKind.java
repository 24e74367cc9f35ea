package org.pysymphony.compiler.diagnostics;

/**
 * Classifies every problem the merge and audit pipelines can report.
 * The same kinds are used for fatal merge failures and for audit findings.
 */
public enum ErrorKind {
    PARSE_FAILURE("Parse failure"),
    UNSUPPORTED_CONSTRUCT("Unsupported construct"),
    DUPLICATE_DEFINITION("Duplicate definition"),
    UNRESOLVED_REFERENCE("Unresolved reference"),
    CIRCULAR_DEPENDENCY("Circular dependency"),
    MULTIPLE_ENTRY_BLOCKS("Multiple entry blocks"),
    RELATIVE_IMPORT("Relative import"),
    CONDITIONAL_IMPORT("Conditional import"),
    DYNAMIC_IMPORT("Dynamic import"),
    WILDCARD_IMPORT("Wildcard import");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The human readable name used in messages and reports.
     */
    public String displayName() {
        return displayName;
    }
}
