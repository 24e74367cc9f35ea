package org.pysymphony.compiler.audit;

import org.pysymphony.compiler.audit.checks.ConditionalImportCheck;
import org.pysymphony.compiler.audit.checks.DynamicImportCheck;
import org.pysymphony.compiler.audit.checks.EntryBlockCheck;
import org.pysymphony.compiler.audit.checks.IPatternCheck;
import org.pysymphony.compiler.audit.checks.RelativeImportCheck;
import org.pysymphony.compiler.audit.checks.WildcardImportCheck;
import org.pysymphony.compiler.frontend.parser.ast.CallNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportNode;
import org.pysymphony.compiler.frontend.parser.ast.ModuleNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry mapping node classes to the pattern checks that inspect them. Several checks may
 * watch the same node class; they run in registration order.
 */
public final class PatternCheckRegistry {

    private final Map<Class<? extends Node>, List<IPatternCheck>> checks = new HashMap<>();

    /**
     * Registers a check for the given node class.
     *
     * @param nodeType The concrete node class.
     * @param check    The check instance.
     * @param <T>      Concrete node type parameter.
     */
    public <T extends Node> void register(Class<T> nodeType, IPatternCheck check) {
        checks.computeIfAbsent(nodeType, k -> new ArrayList<>()).add(check);
    }

    /**
     * @param nodeType The node class to look up.
     * @return The registered checks, empty if there are none.
     */
    public List<IPatternCheck> resolveChecks(Class<? extends Node> nodeType) {
        return checks.getOrDefault(nodeType, List.of());
    }

    /**
     * Creates a registry pre-populated with the shipped checks.
     *
     * @return A fully initialized registry.
     */
    public static PatternCheckRegistry initializeWithDefaults() {
        PatternCheckRegistry registry = new PatternCheckRegistry();

        registry.register(ModuleNode.class, new EntryBlockCheck());

        RelativeImportCheck relative = new RelativeImportCheck();
        registry.register(ImportFromNode.class, relative);

        ConditionalImportCheck conditional = new ConditionalImportCheck();
        registry.register(ImportNode.class, conditional);
        registry.register(ImportFromNode.class, conditional);

        registry.register(ImportFromNode.class, new WildcardImportCheck());
        registry.register(CallNode.class, new DynamicImportCheck());

        return registry;
    }
}
