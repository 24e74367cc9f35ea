package org.pysymphony.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.pysymphony.cli.CommandLineInterface;
import org.pysymphony.compiler.audit.AuditReport;
import org.pysymphony.compiler.audit.Auditor;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "audit",
    description = "Statically check a single-file program for duplicate definitions, unresolved names and risky patterns"
)
public class AuditCommand implements Callable<Integer> {

    enum Format { text, json }

    @Parameters(index = "0", description = "The file to audit")
    private Path file;

    @Option(
        names = {"--format"},
        defaultValue = "text",
        description = "Report format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private Format format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: Failed to load configuration: " + e.getMessage());
            return 1;
        }
        if (!Files.isRegularFile(file)) {
            err.println("Error: File not found: " + file);
            return 1;
        }

        Auditor auditor = new Auditor();
        boolean passed;
        try {
            passed = auditor.audit(file);
        } catch (IOException e) {
            err.println("Error: Failed to read " + file + ": " + e.getMessage());
            return 1;
        }

        AuditReport report = auditor.getReport();
        if (format == Format.json) {
            out.println(report.toJson());
        } else {
            out.print(report.toText());
        }
        return passed ? 0 : 2;
    }
}
