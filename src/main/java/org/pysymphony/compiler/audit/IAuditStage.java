package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;

/**
 * One pass of the audit pipeline. A stage reports its findings and never throws for
 * problems of the audited source.
 */
public interface IAuditStage {

    /**
     * @return A short name for logging.
     */
    String name();

    /**
     * Runs this stage over the audited file.
     * @param context The file under audit and the results of earlier stages.
     * @param diagnostics The engine for reporting findings.
     */
    void run(AuditContext context, DiagnosticsEngine diagnostics);
}
