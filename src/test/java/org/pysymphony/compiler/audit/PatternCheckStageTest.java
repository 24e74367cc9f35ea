package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.audit.checks.IPatternCheck;
import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.frontend.parser.Parser;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportNode;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class PatternCheckStageTest {

    @Mock
    private IPatternCheck importCheck;

    @Mock
    private IPatternCheck fromCheck;

    @Test
    void registeredChecksSeeEveryNodeOfTheirClass() throws Exception {
        NodeStore store = Parser.parse("import os\n\ndef f():\n    import sys\n    return sys, os\n", "a.py");
        PatternCheckRegistry registry = new PatternCheckRegistry();
        registry.register(ImportNode.class, importCheck);
        registry.register(ImportFromNode.class, fromCheck);
        AuditContext context = new AuditContext("a.py", store);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        new PatternCheckStage(registry).run(context, diagnostics);

        verify(importCheck, times(2)).inspect(anyInt(), any(ImportNode.class), eq(context), eq(diagnostics));
        verify(fromCheck, never()).inspect(anyInt(), any(), any(), any());
    }

    @Test
    void checksForTheSameClassRunInRegistrationOrder() {
        IPatternCheck first = mock(IPatternCheck.class);
        IPatternCheck second = mock(IPatternCheck.class);
        PatternCheckRegistry registry = new PatternCheckRegistry();
        registry.register(ImportNode.class, first);
        registry.register(ImportNode.class, second);

        assertThat(registry.resolveChecks(ImportNode.class)).containsExactly(first, second);
        assertThat(registry.resolveChecks(ImportFromNode.class)).isEmpty();
    }

    @Test
    void defaultRegistryWatchesImportsCallsAndTheModule() {
        PatternCheckRegistry registry = PatternCheckRegistry.initializeWithDefaults();

        assertThat(registry.resolveChecks(ImportFromNode.class)).hasSize(3);
        assertThat(registry.resolveChecks(ImportNode.class)).hasSize(1);
    }
}
