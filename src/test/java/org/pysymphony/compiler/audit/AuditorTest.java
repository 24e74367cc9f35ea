package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.diagnostics.Diagnostic;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AuditorTest {

    private Auditor auditor;

    @BeforeEach
    void setUp() {
        auditor = new Auditor();
    }

    private AuditReport audit(String source) {
        auditor.audit(source, "sample.py");
        return auditor.getReport();
    }

    private static List<ErrorKind> kinds(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::kind).toList();
    }

    @Test
    void cleanFilePasses() {
        boolean passed = auditor.audit("""
                import os


                class Greeter:
                    def __init__(self, name):
                        self.name = name

                    def greet(self):
                        return "Hello " + self.name


                def main():
                    print(Greeter(os.getcwd()).greet())


                if __name__ == "__main__":
                    main()
                """, "clean.py");

        assertThat(passed).isTrue();
        assertThat(auditor.getReport().errors()).isEmpty();
        assertThat(auditor.getReport().warnings()).isEmpty();
    }

    @Test
    void allProblemsOfAFileAreReportedTogether() {
        AuditReport report = audit("""
                def helper():
                    return missing_one


                def helper():
                    return missing_two + missing_one
                """);

        assertThat(report.passed()).isFalse();
        assertThat(report.errors()).extracting(Diagnostic::message)
                .contains("Duplicate top-level definition of 'helper'",
                        "Undefined name 'missing_one'",
                        "Undefined name 'missing_two'");
        Diagnostic duplicate = report.errors().stream()
                .filter(d -> d.kind() == ErrorKind.DUPLICATE_DEFINITION).findFirst().orElseThrow();
        assertThat(duplicate.lines()).containsExactly(1, 5);
        Diagnostic undefined = report.errors().stream()
                .filter(d -> d.message().equals("Undefined name 'missing_one'")).findFirst().orElseThrow();
        assertThat(undefined.lines()).containsExactly(2, 6);
    }

    @Test
    void repeatedTopLevelImportIsAnError() {
        AuditReport report = audit("""
                import os
                import sys
                import os

                print(os.getcwd(), sys.argv)
                """);

        assertThat(report.passed()).isFalse();
        assertThat(report.errors()).hasSize(1);
        Diagnostic duplicate = report.errors().get(0);
        assertThat(duplicate.kind()).isEqualTo(ErrorKind.DUPLICATE_DEFINITION);
        assertThat(duplicate.message()).isEqualTo("Duplicate top-level definition of 'os'");
        assertThat(duplicate.lines()).containsExactly(1, 3);
    }

    @Test
    void importFallbackInsideOneTryIsNotADuplicate() {
        AuditReport report = audit("""
                try:
                    import simplejson as json
                except ImportError:
                    import json

                print(json.dumps(1))
                """);

        assertThat(kinds(report.errors())).doesNotContain(ErrorKind.DUPLICATE_DEFINITION);
    }

    @Test
    void nestedDuplicateIsOnlyAWarning() {
        AuditReport report = audit("""
                class Box:
                    def size(self):
                        return 1

                    def size(self):
                        return 2
                """);

        assertThat(report.passed()).isTrue();
        assertThat(kinds(report.warnings())).containsExactly(ErrorKind.DUPLICATE_DEFINITION);
    }

    @Test
    void unknownAttributeOfLocalClassIsAnError() {
        AuditReport report = audit("""
                class Settings:
                    debug = False


                print(Settings.verbose)
                """);

        assertThat(report.errors()).extracting(Diagnostic::message)
                .containsExactly("Unresolved attribute 'verbose' of 'Settings'");
    }

    @Test
    void multipleEntryBlocksAreAnError() {
        AuditReport report = audit("""
                if __name__ == "__main__":
                    print(1)

                if "__main__" == __name__:
                    print(2)
                """);

        assertThat(report.errors()).hasSize(1);
        Diagnostic error = report.errors().get(0);
        assertThat(error.kind()).isEqualTo(ErrorKind.MULTIPLE_ENTRY_BLOCKS);
        assertThat(error.lines()).containsExactly(1, 4);
    }

    @Test
    void riskyImportPatternsAreWarnings() {
        AuditReport report = audit("""
                import importlib
                from .sibling import value
                from os.path import *

                try:
                    import ujson as json
                except ImportError:
                    import json

                plugin = importlib.import_module("plugins." + str(value))
                print(json, plugin)
                """);

        assertThat(report.passed()).isTrue();
        assertThat(kinds(report.warnings())).contains(
                ErrorKind.RELATIVE_IMPORT,
                ErrorKind.WILDCARD_IMPORT,
                ErrorKind.CONDITIONAL_IMPORT,
                ErrorKind.DYNAMIC_IMPORT);
        assertThat(report.warnings()).filteredOn(d -> d.kind() == ErrorKind.CONDITIONAL_IMPORT)
                .extracting(Diagnostic::line)
                .containsExactly(6, 8);
    }

    @Test
    void importsInFunctionsAndEntryBlockAreNotConditional() {
        AuditReport report = audit("""
                def load():
                    if True:
                        import json
                        return json


                if __name__ == "__main__":
                    import sys
                    print(load(), sys.argv)
                """);

        assertThat(kinds(report.warnings())).doesNotContain(ErrorKind.CONDITIONAL_IMPORT);
    }

    @Test
    void unparsableFileYieldsSingleParseFailure() {
        boolean passed = auditor.audit("def broken(:\n    pass\n", "broken.py");

        AuditReport report = auditor.getReport();
        assertThat(passed).isFalse();
        assertThat(report.errors()).hasSize(1);
        assertThat(report.errors().get(0).kind()).isEqualTo(ErrorKind.PARSE_FAILURE);
        assertThat(report.errors().get(0).lines()).containsExactly(1);
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    void auditsFilesFromDisk(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("tool.py");
        Files.writeString(file, "print(undefined_thing)\n");

        assertThat(auditor.audit(file)).isFalse();
        assertThat(auditor.getReport().file()).isEqualTo(file.toString());
    }

    @Test
    void reportIsUnavailableBeforeFirstAudit() {
        assertThatThrownBy(() -> auditor.getReport()).isInstanceOf(IllegalStateException.class);
    }
}
