package org.pysymphony.cli.commands;

import org.pysymphony.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the merge command, run through the configured command line.
 */
@Tag("integration")
public class MergeCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("merge", "audit");
    }

    @Test
    void testMergeWritesOutputAndVerifiesIt() throws Exception {
        Files.writeString(tempDir.resolve("helpers.py"), "def greet(name):\n    return 'hi ' + name\n");
        Path entry = tempDir.resolve("app.py");
        Files.writeString(entry, "from helpers import greet\n\nif __name__ == '__main__':\n    print(greet('you'))\n");

        int exitCode = execute("merge", entry.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        Path merged = tempDir.resolve("app_merged.py");
        assertThat(merged).exists();
        assertThat(Files.readString(merged)).contains("def greet(name):").doesNotContain("from helpers");
        assertThat(out.toString())
            .contains("definition(s) from 2 module(s)")
            .contains("Audit of merged file passed");
    }

    @Test
    void testRenamesAreListed() throws Exception {
        Files.writeString(tempDir.resolve("left.py"), "def size():\n    return 1\n");
        Files.writeString(tempDir.resolve("right.py"), "def size():\n    return 2\n");
        Path entry = tempDir.resolve("main.py");
        Files.writeString(entry, "import left\nimport right\nprint(left.size() + right.size())\n");

        int exitCode = execute("merge", entry.toString(), "--suffix", "_single", "--no-verify");

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        assertThat(tempDir.resolve("main_single.py")).exists();
        assertThat(out.toString())
            .contains("renamed left.py::size -> left_size")
            .contains("renamed right.py::size -> right_size")
            .doesNotContain("Audit of merged file");
    }

    @Test
    void testExplicitProjectRoot() throws Exception {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Path scripts = Files.createDirectories(tempDir.resolve("scripts"));
        Files.writeString(src.resolve("tools.py"), "def answer():\n    return 42\n");
        Path entry = scripts.resolve("run.py");
        Files.writeString(entry, "from tools import answer\nprint(answer())\n");

        int exitCode = execute("merge", entry.toString(), src.toString());

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        assertThat(scripts.resolve("run_merged.py")).exists();
    }

    @Test
    void testMergeFailureReturnsOne() throws Exception {
        Files.writeString(tempDir.resolve("util.py"), "def f():\n    return 1\n\n\ndef f():\n    return 2\n");
        Path entry = tempDir.resolve("main.py");
        Files.writeString(entry, "from util import f\nprint(f())\n");

        int exitCode = execute("merge", entry.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: ").contains("util.py");
        assertThat(tempDir.resolve("main_merged.py")).doesNotExist();
    }

    @Test
    void testNonexistentEntryReturnsOne() {
        int exitCode = execute("merge", tempDir.resolve("missing.py").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Entry file not found");
    }

    @Test
    void testMissingConfigFileReturnsOne() throws Exception {
        Path entry = tempDir.resolve("main.py");
        Files.writeString(entry, "print(1)\n");

        int exitCode = execute("-c", tempDir.resolve("absent.conf").toString(), "merge", entry.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Failed to load configuration");
    }

    @Test
    void testSuffixFromConfigFile() throws Exception {
        Path configFile = tempDir.resolve("custom.conf");
        Files.writeString(configFile, "pysymphony.merge.output-suffix = \"_bundle\"\n");
        Path entry = tempDir.resolve("main.py");
        Files.writeString(entry, "print(1)\n");

        int exitCode = execute("--config", configFile.toString(), "merge", entry.toString());

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        assertThat(tempDir.resolve("main_bundle.py")).exists();
    }
}
