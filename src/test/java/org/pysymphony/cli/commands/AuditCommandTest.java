package org.pysymphony.cli.commands;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
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

@Tag("integration")
public class AuditCommandTest {

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
    void testHelpOutput() {
        execute("audit", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("audit").contains("--format");
    }

    @Test
    void testCleanFileExitsZero() throws Exception {
        Path file = tempDir.resolve("clean.py");
        Files.writeString(file, "def main():\n    print('ok')\n\n\nif __name__ == '__main__':\n    main()\n");

        int exitCode = execute("audit", file.toString());

        assertThat(exitCode).describedAs("stdout: %s", out.toString()).isEqualTo(0);
        assertThat(out.toString()).contains("PASSED").contains("=== Errors ===").contains("(none)");
    }

    @Test
    void testErrorsExitTwo() throws Exception {
        Path file = tempDir.resolve("bad.py");
        Files.writeString(file, "print(nowhere)\n");

        int exitCode = execute("audit", file.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(out.toString()).contains("FAILED").contains("[UNRESOLVED_REFERENCE] Undefined name 'nowhere' (line 1)");
    }

    @Test
    void testJsonFormat() throws Exception {
        Path file = tempDir.resolve("rel.py");
        Files.writeString(file, "from .sibling import thing\nprint(thing)\n");

        int exitCode = execute("audit", "--format", "json", file.toString());

        assertThat(exitCode).isEqualTo(0);
        JsonObject root = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(root.get("passed").getAsBoolean()).isTrue();
        assertThat(root.getAsJsonArray("warnings").get(0).getAsJsonObject().get("kind").getAsString())
            .isEqualTo("RELATIVE_IMPORT");
    }

    @Test
    void testUnknownFormatIsRejected() throws Exception {
        Path file = tempDir.resolve("x.py");
        Files.writeString(file, "print(1)\n");

        int exitCode = execute("audit", "--format", "xml", file.toString());

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--format");
    }

    @Test
    void testNonexistentFileReturnsOne() {
        int exitCode = execute("audit", tempDir.resolve("nope.py").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("File not found");
    }
}
