package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.module.DependencyScanner;
import org.pysymphony.compiler.frontend.module.ModuleSet;
import org.pysymphony.compiler.frontend.module.ProjectLinker;
import org.pysymphony.compiler.frontend.semantics.Symbol;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests collision detection and minimal renaming over real merge units.
 */
@Tag("integration")
class ConflictResolverTest {

    @TempDir
    Path tempDir;

    private void write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private MergeUnit resolve(String entrySource) throws Exception {
        write("main.py", entrySource);
        ModuleSet modules = new DependencyScanner(tempDir).scan(tempDir.resolve("main.py"));
        ProjectLinker linker = new ProjectLinker(modules);
        MergeUnit unit = new DependencyGraphBuilder(modules, linker).build();
        new ConflictResolver(linker).resolve(unit);
        return unit;
    }

    private static Map<String, String> emittedNames(MergeUnit unit) {
        return unit.emittedDefinitions().stream()
                .collect(Collectors.toMap(symbol -> symbol.id().toString(), Symbol::emittedName, (a, b) -> a));
    }

    @Test
    void uniqueNamesAreNeverRenamed() throws Exception {
        write("util.py", "def one():\n    return 1\n\ndef two():\n    return one() + 1\n");

        MergeUnit unit = resolve("from util import two\nprint(two())\n");

        assertThat(unit.renames()).isEmpty();
        assertThat(emittedNames(unit)).containsEntry("util.py::one", "one").containsEntry("util.py::two", "two");
    }

    @Test
    void collidingNamesGetModuleQualifiedNames() throws Exception {
        write("alpha.py", "LIMIT = 1\n");
        write("beta.py", "LIMIT = 2\n");

        MergeUnit unit = resolve("""
                from alpha import LIMIT as A
                from beta import LIMIT as B
                LIMIT = A + B
                print(LIMIT)
                """);

        assertThat(emittedNames(unit))
                .containsEntry("alpha.py::LIMIT", "alpha_LIMIT")
                .containsEntry("beta.py::LIMIT", "beta_LIMIT")
                .containsEntry("main.py::LIMIT", "main_LIMIT");
    }

    @Test
    void qualifiedNameAlreadyTaken_getsNumericSuffix() throws Exception {
        write("a.py", "def f():\n    return 1\n\ndef a_f():\n    return f()\n");
        write("b.py", "def f():\n    return 2\n");

        MergeUnit unit = resolve("from a import a_f\nfrom b import f\nprint(a_f(), f())\n");

        assertThat(emittedNames(unit))
                .containsEntry("a.py::a_f", "a_f")
                .containsEntry("a.py::f", "a_f2")
                .containsEntry("b.py::f", "b_f");
    }

    @Test
    void externalImportsWithTheSameBoundNameAreSuffixed() throws Exception {
        write("first.py", "import json\n\ndef dump(x):\n    return json.dumps(x)\n");
        write("second.py", "import simplejson as json\n\ndef load(s):\n    return json.loads(s)\n");

        MergeUnit unit = resolve("from first import dump\nfrom second import load\nprint(load(dump(1)))\n");

        assertThat(unit.externalImports()).extracting(ExternalImport::render)
                .containsExactly("import json", "import simplejson as json_ext");
    }
}
