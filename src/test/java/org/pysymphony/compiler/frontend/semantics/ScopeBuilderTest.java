package org.pysymphony.compiler.frontend.semantics;

import org.pysymphony.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ScopeBuilder}: symbol kinds, scoping rules and the duplicate policy.
 */
@Tag("unit")
class ScopeBuilderTest {

    private static final ModuleId MODULE = new ModuleId("pkg/m.py");

    private static SymbolTable build(String source) throws Exception {
        return ScopeBuilder.build(MODULE, Parser.parse(source, MODULE.path()));
    }

    @Test
    void moduleLevelDefinitions_getTheirKinds() throws Exception {
        SymbolTable table = build("""
                import os
                from collections import OrderedDict as OD
                LIMIT = 3
                def helper(a):
                    return a
                class Thing:
                    pass
                """);

        assertThat(table.moduleSymbols()).extracting(Symbol::name, Symbol::kind).containsExactly(
                org.assertj.core.groups.Tuple.tuple("os", Symbol.Kind.IMPORT_ALIAS),
                org.assertj.core.groups.Tuple.tuple("OD", Symbol.Kind.IMPORT_ALIAS),
                org.assertj.core.groups.Tuple.tuple("LIMIT", Symbol.Kind.VARIABLE),
                org.assertj.core.groups.Tuple.tuple("helper", Symbol.Kind.FUNCTION),
                org.assertj.core.groups.Tuple.tuple("Thing", Symbol.Kind.CLASS));
        Symbol od = table.lookupModuleSymbol("OD").orElseThrow();
        assertThat(od.importBinding().module()).isEqualTo("collections");
        assertThat(od.importBinding().importedName()).isEqualTo("OrderedDict");
        assertThat(table.lookupModuleSymbol("helper").orElseThrow().line()).isEqualTo(4);
    }

    @Test
    void parametersAndLocals_stayInTheFunctionScope() throws Exception {
        SymbolTable table = build("def f(a, *args, key=None, **kw):\n    local = a\n    return local\n");

        Symbol f = table.lookupModuleSymbol("f").orElseThrow();
        assertThat(f.body().symbols()).extracting(Symbol::name).containsExactly("a", "args", "key", "kw", "local");
        assertThat(table.lookupModuleSymbol("local")).isEmpty();
    }

    @Test
    void methods_areMembersOfTheirClass() throws Exception {
        SymbolTable table = build("class A:\n    def run(self):\n        self.state = 1\n");

        Symbol cls = table.lookupModuleSymbol("A").orElseThrow();
        Symbol run = cls.body().lookupLocal("run");
        assertThat(run.isMember()).isTrue();
        assertThat(run.id().toString()).isEqualTo("pkg/m.py::A.run");
        assertThat(cls.body().instanceAttributes()).containsExactly("state");
    }

    @Test
    void comprehensionVariables_doNotLeakButWalrusTargetsDo() throws Exception {
        SymbolTable table = build("values = [i * 2 for i in range(3)]\nif (n := len(values)) > 1:\n    pass\n");

        assertThat(table.lookupModuleSymbol("i")).isEmpty();
        assertThat(table.lookupModuleSymbol("n")).isPresent();
    }

    @Test
    void globalWriteInFunction_bindsModuleSymbol() throws Exception {
        SymbolTable table = build("def bump():\n    global counter\n    counter = 1\n");

        assertThat(table.lookupModuleSymbol("counter")).isPresent();
        assertThat(table.lookupModuleSymbol("bump").orElseThrow().body().lookupLocal("counter")).isNull();
    }

    @Test
    void nonlocalWithoutEnclosingBinding_isDangling() throws Exception {
        SymbolTable table = build("def f():\n    nonlocal missing\n    missing = 1\n");

        assertThat(table.danglingNonlocals()).extracting(SymbolTable.DanglingNonlocal::name).containsExactly("missing");
    }

    @Test
    void duplicateTopLevelFunction_isRecordedWithAllLines() throws Exception {
        SymbolTable table = build("def f():\n    return 1\n\ndef f():\n    return 2\n");

        assertThat(table.duplicates()).hasSize(1);
        DuplicateDefinition duplicate = table.duplicates().get(0);
        assertThat(duplicate.name()).isEqualTo("f");
        assertThat(duplicate.isTopLevel()).isTrue();
        assertThat(duplicate.lines()).containsExactly(1, 4);
    }

    @Test
    void functionRedefinedAsVariable_isADuplicate() throws Exception {
        SymbolTable table = build("def size():\n    return 1\nsize = 3\n");

        assertThat(table.duplicates()).extracting(DuplicateDefinition::name).containsExactly("size");
    }

    @Test
    void ordinaryRebindings_areNotDuplicates() throws Exception {
        SymbolTable table = build("""
                x = 1
                x = x + 1
                try:
                    import json
                except ImportError:
                    json = None
                def load():
                    import os
                    import os
                    return os
                class P:
                    @property
                    def value(self):
                        return 1
                    @value.setter
                    def value(self, v):
                        pass
                """);

        assertThat(table.duplicates()).isEmpty();
    }

    @Test
    void repeatedTopLevelImport_isADuplicate() throws Exception {
        SymbolTable table = build("import os\nimport sys\nimport os\n");

        assertThat(table.duplicates()).hasSize(1);
        DuplicateDefinition duplicate = table.duplicates().get(0);
        assertThat(duplicate.name()).isEqualTo("os");
        assertThat(duplicate.isTopLevel()).isTrue();
        assertThat(duplicate.lines()).containsExactly(1, 3);
    }

    @Test
    void duplicateMethod_isRecordedForTheClassScope() throws Exception {
        SymbolTable table = build("class A:\n    def m(self):\n        pass\n    def m(self):\n        pass\n");

        assertThat(table.duplicates()).hasSize(1);
        assertThat(table.duplicates().get(0).isTopLevel()).isFalse();
        assertThat(table.duplicates().get(0).lines()).containsExactly(2, 4);
    }

    @Test
    void wildcardAndFutureImports_areRecorded() throws Exception {
        SymbolTable table = build("from __future__ import annotations\nfrom os.path import *\n");

        assertThat(table.futureImports()).hasSize(1);
        assertThat(table.wildcardImports()).hasSize(1);
    }

    @Test
    void references_collectNamesReadByADefinition() throws Exception {
        SymbolTable table = build("def f():\n    return helper(LIMIT)\n");

        assertThat(table.lookupModuleSymbol("f").orElseThrow().references()).contains("helper", "LIMIT");
    }
}
