package org.pysymphony.compiler.frontend.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ModuleNamesTest {

    @Test
    void absoluteImportIsReturnedAsWritten() {
        assertThat(ModuleNames.absolute("pkg", 0, "os.path")).contains("os.path");
    }

    @Test
    void relativeImportsClimbOnePackagePerExtraDot() {
        assertThat(ModuleNames.absolute("a.b", 1, "c")).contains("a.b.c");
        assertThat(ModuleNames.absolute("a.b", 2, "c")).contains("a.c");
        assertThat(ModuleNames.absolute("a.b", 2, "")).contains("a");
    }

    @Test
    void climbingAboveTheRootIsEmpty() {
        assertThat(ModuleNames.absolute("a", 3, "x")).isEmpty();
    }

    @Test
    void prefixesListEveryParentPackage() {
        assertThat(ModuleNames.prefixes("a.b.c")).containsExactly("a", "a.b", "a.b.c");
    }
}
