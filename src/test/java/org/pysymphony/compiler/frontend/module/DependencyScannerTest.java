package org.pysymphony.compiler.frontend.module;

import org.pysymphony.compiler.api.CompilationException;
import org.pysymphony.compiler.api.ParseFailureException;
import org.pysymphony.compiler.api.UnsupportedConstructException;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the scanner that loads the entry module and every internal module it imports.
 */
class DependencyScannerTest {

    @TempDir
    Path tempDir;

    private Path write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @Tag("integration")
    void singleFileProducesSingleModule() throws Exception {
        Path main = write("main.py", "print('hi')\n");

        ModuleSet modules = new DependencyScanner(tempDir).scan(main);

        assertThat(modules.size()).isEqualTo(1);
        assertThat(modules.entry().name()).isEqualTo("main");
        assertThat(modules.entry().id().path()).isEqualTo("main.py");
    }

    @Test
    @Tag("integration")
    void externalImportsAreNotLoaded() throws Exception {
        Path main = write("main.py", "import os\nfrom collections import deque\n");

        ModuleSet modules = new DependencyScanner(tempDir).scan(main);

        assertThat(modules.size()).isEqualTo(1);
        assertThat(modules.isInternal("os")).isFalse();
    }

    @Test
    @Tag("integration")
    void packageImportLoadsEveryPackageAlongThePath() throws Exception {
        write("pkg/__init__.py", "");
        write("pkg/util.py", "def helper():\n    return 1\n");
        Path main = write("main.py", "from pkg.util import helper\nhelper()\n");

        ModuleSet modules = new DependencyScanner(tempDir).scan(main);

        assertThat(modules.modules()).extracting(ModuleDescriptor::name).containsExactly("main", "pkg", "pkg.util");
        assertThat(modules.get("pkg").orElseThrow().isPackage()).isTrue();
        assertThat(modules.get("pkg.util").orElseThrow().id().path()).isEqualTo("pkg/util.py");
    }

    @Test
    @Tag("integration")
    void directoryWithoutInitIsANamespacePackage() throws Exception {
        write("tools/strings.py", "def shout(s):\n    return s.upper()\n");
        Path main = write("main.py", "import tools.strings\n");

        ModuleSet modules = new DependencyScanner(tempDir).scan(main);

        assertThat(modules.isNamespacePackage("tools")).isTrue();
        assertThat(modules.get("tools.strings")).isPresent();
    }

    @Test
    @Tag("integration")
    void nestedAndRelativeImportsAreFollowed() throws Exception {
        write("pkg/__init__.py", "");
        write("pkg/a.py", "def run():\n    from .b import value\n    return value\n");
        write("pkg/b.py", "value = 42\n");
        Path main = write("main.py", "def start():\n    import pkg.a\n    return pkg.a.run()\n");

        ModuleSet modules = new DependencyScanner(tempDir).scan(main);

        assertThat(modules.get("pkg.a")).isPresent();
        assertThat(modules.get("pkg.b")).isPresent();
    }

    @Test
    @Tag("integration")
    void fromImportOfSubmoduleLoadsIt() throws Exception {
        write("pkg/__init__.py", "");
        write("pkg/sub.py", "X = 1\n");
        Path main = write("main.py", "from pkg import sub\nprint(sub.X)\n");

        ModuleSet modules = new DependencyScanner(tempDir).scan(main);

        assertThat(modules.get("pkg.sub")).isPresent();
    }

    @Test
    @Tag("integration")
    void wildcardImportIsUnsupported() throws Exception {
        write("shapes.py", "class Square:\n    pass\n");
        Path main = write("main.py", "from shapes import *\n");

        assertThatThrownBy(() -> new DependencyScanner(tempDir).scan(main))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("Wildcard import")
                .hasMessageContaining("main.py:1");
    }

    @Test
    @Tag("integration")
    void dynamicImportIsUnsupported() throws Exception {
        write("plugin.py", "import importlib\n\ndef load(name):\n    return importlib.import_module(name)\n");
        Path main = write("main.py", "from plugin import load\nload('x')\n");

        assertThatThrownBy(() -> new DependencyScanner(tempDir).scan(main))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("Dynamic import")
                .hasMessageContaining("plugin.py:4");
    }

    @Test
    @Tag("integration")
    void missingRelativeModuleIsReported() throws Exception {
        write("pkg/__init__.py", "");
        write("pkg/a.py", "from .missing import thing\n");
        Path main = write("main.py", "import pkg.a\n");

        assertThatThrownBy(() -> new DependencyScanner(tempDir).scan(main))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Cannot find internal module 'pkg.missing'")
                .satisfies(e -> assertThat(((CompilationException) e).getKind())
                        .isEqualTo(ErrorKind.UNRESOLVED_REFERENCE));
    }

    @Test
    @Tag("integration")
    void syntaxErrorInImportedModuleNamesThatModule() throws Exception {
        write("broken.py", "def f(:\n    pass\n");
        Path main = write("main.py", "import broken\n");

        assertThatThrownBy(() -> new DependencyScanner(tempDir).scan(main))
                .isInstanceOf(ParseFailureException.class)
                .hasMessageContaining("broken.py:1");
    }

    @Test
    @Tag("unit")
    void entryOutsideTheRootIsRejected() throws Exception {
        Path main = write("main.py", "x = 1\n");
        Path root = Files.createDirectories(tempDir.resolve("elsewhere"));

        assertThatThrownBy(() -> new DependencyScanner(root).scan(main)).isInstanceOf(IOException.class);
    }
}
