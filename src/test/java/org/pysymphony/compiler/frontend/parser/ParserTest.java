package org.pysymphony.compiler.frontend.parser;

import org.pysymphony.compiler.api.ParseFailureException;
import org.pysymphony.compiler.frontend.parser.ast.AssignNode;
import org.pysymphony.compiler.frontend.parser.ast.AttributeNode;
import org.pysymphony.compiler.frontend.parser.ast.ClassDefNode;
import org.pysymphony.compiler.frontend.parser.ast.ExprContext;
import org.pysymphony.compiler.frontend.parser.ast.FunctionDefNode;
import org.pysymphony.compiler.frontend.parser.ast.IfNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportNode;
import org.pysymphony.compiler.frontend.parser.ast.NameNode;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NodeWalker;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ParserTest {

    private static List<NameNode> names(NodeStore store) {
        List<NameNode> names = new ArrayList<>();
        new NodeWalker(store) {
            @Override
            public Void visitName(int index, NameNode node) {
                names.add(node);
                return null;
            }
        }.walk(store.root());
        return names;
    }

    @Test
    void functionDefinition_hasParametersAndBody() throws Exception {
        NodeStore store = Parser.parse("def add(a, b=1):\n    return a + b\n", "m.py");

        assertThat(store.module().body()).hasSize(1);
        FunctionDefNode def = store.getAs(store.module().body().get(0), FunctionDefNode.class);
        assertThat(def).isNotNull();
        assertThat(def.name()).isEqualTo("add");
        assertThat(def.parameters()).hasSize(2);
        assertThat(def.body()).hasSize(1);
        assertThat(store.text(def.nameSpan())).isEqualTo("add");
    }

    @Test
    void decoratedDefinition_spanStartsAtDecorator() throws Exception {
        String source = "@cache\ndef f():\n    pass\n";
        NodeStore store = Parser.parse(source, "m.py");

        int def = store.module().body().get(0);
        assertThat(store.get(def)).isInstanceOf(FunctionDefNode.class);
        assertThat(store.text(def)).startsWith("@cache").endsWith("pass");
    }

    @Test
    void classDefinition_hasBasesAndMembers() throws Exception {
        NodeStore store = Parser.parse("class B(A):\n    x = 1\n    def m(self):\n        return self.x\n", "m.py");

        ClassDefNode cls = store.getAs(store.module().body().get(0), ClassDefNode.class);
        assertThat(cls.name()).isEqualTo("B");
        assertThat(cls.bases()).hasSize(1);
        assertThat(cls.body()).hasSize(2);
    }

    @Test
    void assignmentTargets_areStoreContext() throws Exception {
        NodeStore store = Parser.parse("a, b = c\n", "m.py");

        assertThat(store.get(store.module().body().get(0))).isInstanceOf(AssignNode.class);
        assertThat(names(store)).extracting(NameNode::id, NameNode::ctx).containsExactlyInAnyOrder(
                org.assertj.core.groups.Tuple.tuple("a", ExprContext.STORE),
                org.assertj.core.groups.Tuple.tuple("b", ExprContext.STORE),
                org.assertj.core.groups.Tuple.tuple("c", ExprContext.LOAD));
    }

    @Test
    void attributeChain_spanCoversWholeChain() throws Exception {
        NodeStore store = Parser.parse("value = pkg.mod.func\n", "m.py");

        AssignNode assign = store.getAs(store.module().body().get(0), AssignNode.class);
        AttributeNode chain = store.getAs(assign.value(), AttributeNode.class);
        assertThat(chain.attr()).isEqualTo("func");
        assertThat(store.text(assign.value())).isEqualTo("pkg.mod.func");
    }

    @Test
    void imports_recordModulesAliasesAndLevels() throws Exception {
        NodeStore store = Parser.parse("import os.path as p, sys\nfrom ..pkg import a as b, c\nfrom . import d\n", "m.py");

        ImportNode plain = store.getAs(store.module().body().get(0), ImportNode.class);
        assertThat(plain.names()).extracting(alias -> alias.boundName()).containsExactly("p", "sys");

        ImportFromNode relative = store.getAs(store.module().body().get(1), ImportFromNode.class);
        assertThat(relative.level()).isEqualTo(2);
        assertThat(relative.module()).isEqualTo("pkg");
        assertThat(relative.names()).extracting(alias -> alias.boundName()).containsExactly("b", "c");

        ImportFromNode here = store.getAs(store.module().body().get(2), ImportFromNode.class);
        assertThat(here.level()).isEqualTo(1);
        assertThat(here.isRelative()).isTrue();
    }

    @Test
    void elifChain_isNestedIf() throws Exception {
        NodeStore store = Parser.parse("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n", "m.py");

        IfNode outer = store.getAs(store.module().body().get(0), IfNode.class);
        assertThat(outer.orElse()).hasSize(1);
        IfNode inner = store.getAs(outer.orElse().get(0), IfNode.class);
        assertThat(inner.orElse()).hasSize(1);
    }

    @Test
    void comprehensionsLambdasAndFStrings_exposeTheirNames() throws Exception {
        NodeStore store = Parser.parse("r = [f(x) for x in xs if x]\ng = lambda y: y + z\ns = f'{first} {second!r:>10}'\n", "m.py");

        assertThat(names(store)).extracting(NameNode::id)
                .contains("r", "f", "x", "xs", "g", "y", "z", "s", "first", "second");
    }

    @Test
    void nodesAreAddedAfterTheirChildren() throws Exception {
        NodeStore store = Parser.parse("def f():\n    return g()\n", "m.py");

        int def = store.module().body().get(0);
        for (int child : store.get(def).children()) {
            assertThat(child).isLessThan(def);
            assertThat(store.parentOf(child)).isEqualTo(def);
        }
        assertThat(store.root()).isEqualTo(store.size() - 1);
    }

    @Test
    void syntaxError_reportsFileAndLine() {
        assertThatThrownBy(() -> Parser.parse("x = 1\ndef broken(:\n    pass\n", "bad.py"))
                .isInstanceOf(ParseFailureException.class)
                .hasMessageContaining("bad.py:2")
                .satisfies(e -> assertThat(((ParseFailureException) e).getLine()).isEqualTo(2));
    }

    @Test
    void unexpectedIndent_isAParseFailure() {
        assertThatThrownBy(() -> Parser.parse("x = 1\n    y = 2\n", "bad.py"))
                .isInstanceOf(ParseFailureException.class)
                .hasMessageContaining("unexpected indent");
    }
}
