package org.pysymphony.compiler.frontend.semantics;

import org.pysymphony.compiler.diagnostics.Diagnostic;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ReferenceResolver}: scope-chain lookup and attribute chain validation.
 */
@Tag("unit")
class ReferenceResolverTest {

    private static SymbolTable build(String path, String source) throws Exception {
        return ScopeBuilder.build(new ModuleId(path), Parser.parse(source, path));
    }

    private static List<Diagnostic> validate(String source) throws Exception {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new ReferenceResolver(build("m.py", source), ImportLinker.external()).validate(diagnostics);
        return diagnostics.errors();
    }

    @Test
    void definedNamesBuiltinsAndModuleImplicits_resolve() throws Exception {
        assertThat(validate("""
                import sys
                def main(argv):
                    total = len(argv)
                    print(total, __name__, sys.argv)
                    return [x for x in range(total)]
                main(sys.argv)
                """)).isEmpty();
    }

    @Test
    void undefinedName_isReportedOncePerNameWithAllLines() throws Exception {
        List<Diagnostic> errors = validate("a = missing\nb = missing + 1\nc = other\n");

        assertThat(errors).extracting(Diagnostic::message)
                .containsExactly("Undefined name 'missing'", "Undefined name 'other'");
        assertThat(errors.get(0).kind()).isEqualTo(ErrorKind.UNRESOLVED_REFERENCE);
        assertThat(errors.get(0).lines()).containsExactly(1, 2);
        assertThat(errors.get(1).lines()).containsExactly(3);
    }

    @Test
    void classBody_isNotVisibleFromMethods() throws Exception {
        List<Diagnostic> errors = validate("class A:\n    size = 1\n    def get(self):\n        return size\n");

        assertThat(errors).extracting(Diagnostic::message).containsExactly("Undefined name 'size'");
    }

    @Test
    void laterModuleDefinition_isVisibleInsideFunctions() throws Exception {
        assertThat(validate("def first():\n    return second()\ndef second():\n    return 1\n")).isEmpty();
    }

    @Test
    void missingClassAttribute_isReported() throws Exception {
        List<Diagnostic> errors = validate("""
                class Config:
                    DEBUG = False
                    def __init__(self):
                        self.level = 1
                print(Config.DEBUG, Config.VERBOSE)
                cfg = Config()
                print(cfg.level, cfg.nothing)
                """);

        assertThat(errors).extracting(Diagnostic::message).containsExactly(
                "Unresolved attribute 'VERBOSE' of 'Config'",
                "Unresolved attribute 'nothing' of 'cfg'");
    }

    @Test
    void attributesOfOpenClasses_areNotChecked() throws Exception {
        assertThat(validate("""
                import enum
                class Color(enum.Enum):
                    RED = 1
                class Dynamic:
                    def __getattr__(self, name):
                        return name
                print(Color.BLUE, Dynamic.anything)
                """)).isEmpty();
    }

    @Test
    void inheritedMembers_areFoundThroughLocalBases() throws Exception {
        assertThat(validate("""
                class Base(object):
                    def hello(self):
                        return 1
                class Child(Base):
                    pass
                print(Child.hello)
                """)).isEmpty();
    }

    @Test
    void danglingNonlocal_isReported() throws Exception {
        List<Diagnostic> errors = validate("def f():\n    nonlocal x\n    x = 1\n");

        assertThat(errors).extracting(Diagnostic::message).containsExactly("No binding for nonlocal 'x' found");
    }

    @Test
    void moduleChain_isValidatedThroughTheLinker() throws Exception {
        SymbolTable lib = build("lib.py", "def present():\n    return 1\n");
        SymbolTable main = build("main.py", "import lib\nlib.present()\nlib.absent()\n");
        ImportLinker linker = mock(ImportLinker.class);
        LinkTarget libModule = new LinkTarget("lib", lib, null);
        Symbol alias = main.lookupModuleSymbol("lib").orElseThrow();
        when(linker.link(alias)).thenReturn(Optional.of(libModule));
        when(linker.member(any(), eq("present")))
                .thenReturn(Optional.of(new LinkTarget("lib", lib, lib.lookupModuleSymbol("present").orElseThrow())));

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        int problems = new ReferenceResolver(main, linker).validate(diagnostics);

        assertThat(problems).isEqualTo(1);
        assertThat(diagnostics.errors()).extracting(Diagnostic::message)
                .containsExactly("Module 'lib' has no attribute 'absent'");
        assertThat(diagnostics.errors().get(0).lines()).containsExactly(3);
    }

    @Test
    void globalDeclaration_resolvesToModuleScope() throws Exception {
        SymbolTable table = build("m.py", "count = 0\ndef inc():\n    global count\n    count += 1\n");
        Scope function = table.lookupModuleSymbol("inc").orElseThrow().body();

        Resolution resolution = ReferenceResolver.resolve("count", function);

        assertThat(resolution.kind()).isEqualTo(Resolution.Kind.LOCAL);
        assertThat(resolution.symbol()).isSameAs(table.lookupModuleSymbol("count").orElseThrow());
    }
}
