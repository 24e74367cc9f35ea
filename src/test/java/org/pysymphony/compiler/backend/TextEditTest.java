package org.pysymphony.compiler.backend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TextEditTest {

    @Test
    void editsAreAppliedInPositionOrderWithinTheSlice() {
        String source = "xx a + b yy";

        String edited = TextEdit.apply(source, 3, 8, List.of(new TextEdit(7, 8, "beta"), new TextEdit(3, 4, "alpha")));

        assertThat(edited).isEqualTo("alpha + beta");
    }

    @Test
    void longerEditAtSameStartWinsOverNestedOne() {
        String source = "mod.func()";

        String edited = TextEdit.apply(source, 0, source.length(),
                List.of(new TextEdit(0, 3, "renamed_mod"), new TextEdit(0, 8, "mod_func")));

        assertThat(edited).isEqualTo("mod_func()");
    }

    @Test
    void noEditsReturnsTheSlice() {
        assertThat(TextEdit.apply("abcdef", 1, 4, List.of())).isEqualTo("bcd");
    }
}
