package org.pysymphony.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.pysymphony.cli.CommandLineInterface;
import org.pysymphony.compiler.MergeResult;
import org.pysymphony.compiler.Merger;
import org.pysymphony.compiler.api.CompilationException;
import org.pysymphony.compiler.audit.Auditor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Merges the program reachable from an entry script into one file written next to it.
 * <p>
 * By default the merged file is audited afterwards; an audit failure exits with status 2
 * but leaves the written file in place for inspection.
 */
@Command(
    name = "merge",
    description = "Merge an entry script and the project modules it imports into a single file"
)
public class MergeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    @Parameters(index = "0", description = "The entry script")
    private Path entryFile;

    @Parameters(index = "1", arity = "0..1",
        description = "Root directory for absolute imports (default: directory of the entry script)")
    private Path projectRoot;

    @Option(
        names = {"--suffix"},
        description = "Appended to the entry file name to name the output (default: pysymphony.merge.output-suffix)"
    )
    private String suffix;

    @Option(
        names = {"--verify"},
        negatable = true,
        description = "Audit the merged file (default: pysymphony.merge.verify)"
    )
    private Boolean verify;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: Failed to load configuration: " + e.getMessage());
            return 1;
        }
        String outputSuffix = suffix != null ? suffix : config.getString("pysymphony.merge.output-suffix");
        boolean audit = verify != null ? verify : config.getBoolean("pysymphony.merge.verify");

        if (!Files.isRegularFile(entryFile)) {
            err.println("Error: Entry file not found: " + entryFile);
            return 1;
        }
        Path entry = entryFile.toAbsolutePath().normalize();
        Path root = (projectRoot != null ? projectRoot.toAbsolutePath() : entry.getParent()).normalize();

        MergeResult result;
        try {
            result = new Merger(outputSuffix).merge(entry, root);
        } catch (CompilationException e) {
            log.debug("Merge of {} failed", entry, e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: I/O failure while merging " + entry + ": " + e.getMessage());
            return 1;
        }

        out.printf("Merged %d definition(s) from %d module(s) into %s%n",
            result.definitionCount(), result.moduleCount(), result.outputFile());
        result.renames().forEach((original, renamed) -> out.printf("  renamed %s -> %s%n", original, renamed));
        result.warnings().forEach(warning -> out.println("  warning: " + warning.message() + " ("
            + warning.fileName() + ":" + warning.linesText() + ")"));

        if (!audit) {
            return 0;
        }
        Auditor auditor = new Auditor();
        if (!auditor.audit(result.source(), result.outputFile().toString())) {
            err.print(auditor.getReport().toText());
            return 2;
        }
        out.println("Audit of merged file passed");
        return 0;
    }
}
