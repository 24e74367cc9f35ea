package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.api.CircularDependencyException;
import org.pysymphony.compiler.frontend.module.DependencyScanner;
import org.pysymphony.compiler.frontend.module.ModuleSet;
import org.pysymphony.compiler.frontend.module.ProjectLinker;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class TopologicalOrdererTest {

    @TempDir
    Path tempDir;

    private void write(String relativePath, String content) throws IOException {
        Files.writeString(tempDir.resolve(relativePath), content);
    }

    private MergeUnit build(String entrySource) throws Exception {
        write("main.py", entrySource);
        ModuleSet modules = new DependencyScanner(tempDir).scan(tempDir.resolve("main.py"));
        return new DependencyGraphBuilder(modules, new ProjectLinker(modules)).build();
    }

    private static List<String> names(MergeUnit unit, List<StatementRef> order) {
        return order.stream()
                .map(ref -> unit.ownedSymbols(ref).get(0).name())
                .collect(Collectors.toList());
    }

    @Test
    void dependenciesComeBeforeDependents() throws Exception {
        write("lib.py", """
                def top():
                    return middle() * 2

                def middle():
                    return bottom() + 1

                def bottom():
                    return 1
                """);

        MergeUnit unit = build("from lib import top\nprint(top())\n");
        List<StatementRef> order = new TopologicalOrderer().order(unit);

        assertThat(names(unit, order)).containsExactly("bottom", "middle", "top");
    }

    @Test
    void everyDefinitionUnitIsOrderedOnce() throws Exception {
        write("lib.py", """
                def shared():
                    return 0

                def left():
                    return shared()

                def right():
                    return shared()
                """);

        MergeUnit unit = build("from lib import left, right\nprint(left(), right())\n");
        List<StatementRef> order = new TopologicalOrderer().order(unit);

        assertThat(order).hasSameSizeAs(unit.definitionUnits()).doesNotHaveDuplicates();
        List<String> names = names(unit, order);
        assertThat(names.indexOf("shared")).isLessThan(names.indexOf("left"));
        assertThat(names.indexOf("shared")).isLessThan(names.indexOf("right"));
    }

    @Test
    void methodReferencesBetweenClassesFormACycle() throws Exception {
        write("shapes.py", """
                class Square:
                    def split(self):
                        return Triangle()

                class Triangle:
                    def join(self):
                        return Square()
                """);

        MergeUnit unit = build("from shapes import Square\nprint(Square().split())\n");

        assertThatThrownBy(() -> new TopologicalOrderer().order(unit))
                .isInstanceOf(CircularDependencyException.class)
                .satisfies(e -> {
                    List<String> cycle = ((CircularDependencyException) e).getCycle();
                    assertThat(cycle).contains("shapes.py::Square", "shapes.py::Triangle");
                    assertThat(cycle.get(0)).isEqualTo(cycle.get(cycle.size() - 1));
                });
    }
}
