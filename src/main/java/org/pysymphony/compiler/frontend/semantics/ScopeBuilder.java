package org.pysymphony.compiler.frontend.semantics;

import org.pysymphony.compiler.frontend.parser.ast.AnnAssignNode;
import org.pysymphony.compiler.frontend.parser.ast.AttributeNode;
import org.pysymphony.compiler.frontend.parser.ast.CallNode;
import org.pysymphony.compiler.frontend.parser.ast.ClassDefNode;
import org.pysymphony.compiler.frontend.parser.ast.ComprehensionForNode;
import org.pysymphony.compiler.frontend.parser.ast.ComprehensionNode;
import org.pysymphony.compiler.frontend.parser.ast.ExceptHandlerNode;
import org.pysymphony.compiler.frontend.parser.ast.ExprContext;
import org.pysymphony.compiler.frontend.parser.ast.ForNode;
import org.pysymphony.compiler.frontend.parser.ast.FunctionDefNode;
import org.pysymphony.compiler.frontend.parser.ast.GlobalNode;
import org.pysymphony.compiler.frontend.parser.ast.IfNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportAlias;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportNode;
import org.pysymphony.compiler.frontend.parser.ast.LambdaNode;
import org.pysymphony.compiler.frontend.parser.ast.ModuleNode;
import org.pysymphony.compiler.frontend.parser.ast.NameNode;
import org.pysymphony.compiler.frontend.parser.ast.NamedExprNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NodeWalker;
import org.pysymphony.compiler.frontend.parser.ast.NonlocalNode;
import org.pysymphony.compiler.frontend.parser.ast.ParameterNode;
import org.pysymphony.compiler.frontend.parser.ast.TryNode;
import org.pysymphony.compiler.frontend.parser.ast.WhileNode;
import org.pysymphony.compiler.frontend.parser.ast.WithNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds the {@link SymbolTable} of one module in a single traversal. All mutable state of the
 * walk lives in the builder instance, so a builder is used for exactly one module.
 *
 * <p>Function, class, lambda and comprehension headers open a child scope before their body is
 * visited; parameters and comprehension targets go into the new scope. Names declared
 * {@code global} or {@code nonlocal} are attached to the outer symbol instead of creating a
 * local one.</p>
 */
public class ScopeBuilder extends NodeWalker {

    private static final Logger log = LoggerFactory.getLogger(ScopeBuilder.class);

    private record WidenedWrite(Scope scope, String name, Symbol.Kind kind, int node, int line, boolean global,
                                int statement) {
    }

    private final ModuleId moduleId;
    private final List<Scope> scopes = new ArrayList<>();
    private final Scope[] scopeByNode;
    private final Map<Integer, Symbol> symbolByNode = new HashMap<>();
    private final Map<Integer, List<Symbol>> importSymbols = new HashMap<>();
    private final List<Symbol> symbols = new ArrayList<>();
    private final Map<Scope, Map<String, TreeSet<Integer>>> duplicateLines = new LinkedHashMap<>();
    private final List<WidenedWrite> widenedWrites = new ArrayList<>();
    private final List<SymbolTable.DanglingNonlocal> danglingNonlocals = new ArrayList<>();
    private final List<Integer> wildcardImports = new ArrayList<>();
    private final List<Integer> futureImports = new ArrayList<>();

    private Scope moduleScope;
    private Scope current;
    private int topLevelStatement = -1;
    private int guard = -1;

    /**
     * @param moduleId The module being cataloged.
     * @param store The parsed module.
     */
    public ScopeBuilder(ModuleId moduleId, NodeStore store) {
        super(store);
        this.moduleId = moduleId;
        this.scopeByNode = new Scope[store.size()];
    }

    /**
     * Catalogs one module.
     * @param moduleId The module id.
     * @param store The parsed module.
     * @return The finished symbol table.
     */
    public static SymbolTable build(ModuleId moduleId, NodeStore store) {
        return new ScopeBuilder(moduleId, store).build();
    }

    /**
     * Runs the traversal.
     * @return The finished symbol table.
     */
    public SymbolTable build() {
        walk(store.root());
        attachWidenedWrites();
        collectReferences();
        List<DuplicateDefinition> duplicates = new ArrayList<>();
        duplicateLines.forEach((scope, byName) -> byName.forEach(
                (name, lines) -> duplicates.add(new DuplicateDefinition(name, scope, new ArrayList<>(lines)))));
        log.debug("Cataloged {}: {} scopes, {} symbols, {} duplicates", moduleId, scopes.size(), symbols.size(),
                duplicates.size());
        return new SymbolTable(moduleId, store, moduleScope, scopes, scopeByNode, symbolByNode, importSymbols,
                symbols, duplicates, danglingNonlocals, wildcardImports, futureImports);
    }

    @Override
    public void walk(int index) {
        if (index >= 0) {
            scopeByNode[index] = current;
            store.accept(index, this);
        }
    }

    // === Scope-opening constructs ===

    @Override
    public Void visitModule(int index, ModuleNode node) {
        moduleScope = openScope(Scope.Kind.MODULE, index, "<module>");
        current = moduleScope;
        scopeByNode[index] = moduleScope;
        for (int statement : node.body()) {
            topLevelStatement = statement;
            guard = -1;
            walk(statement);
        }
        return null;
    }

    @Override
    public Void visitFunctionDef(int index, FunctionDefNode node) {
        walkAll(node.decorators());
        walkParameterHeaders(node.parameters());
        walk(node.returns());
        Symbol symbol = declare(node.name(), Symbol.Kind.FUNCTION, index, node.nameSpan().line(), null);
        Scope function = openScope(Scope.Kind.FUNCTION, index, node.name());
        if (symbol != null && symbol.body() == null) {
            symbol.setBody(function);
        }
        if (current.kind() == Scope.Kind.CLASS && !node.parameters().isEmpty()) {
            ParameterNode first = store.getAs(node.parameters().get(0), ParameterNode.class);
            if (first != null && first.kind() == ParameterNode.Kind.POSITIONAL) {
                function.setSelfName(first.name());
            }
        }
        Scope outer = current;
        int outerGuard = guard;
        current = function;
        guard = -1;
        prescanDeclarations(node.body(), function);
        bindParameters(node.parameters());
        walkAll(node.body());
        current = outer;
        guard = outerGuard;
        return null;
    }

    @Override
    public Void visitLambda(int index, LambdaNode node) {
        walkParameterHeaders(node.parameters());
        Scope lambda = openScope(Scope.Kind.FUNCTION, index, "<lambda>");
        Scope outer = current;
        current = lambda;
        bindParameters(node.parameters());
        walk(node.body());
        current = outer;
        return null;
    }

    @Override
    public Void visitClassDef(int index, ClassDefNode node) {
        walkAll(node.decorators());
        walkAll(node.bases());
        Symbol symbol = declare(node.name(), Symbol.Kind.CLASS, index, node.nameSpan().line(), null);
        Scope classScope = openScope(Scope.Kind.CLASS, index, node.name());
        if (symbol != null && symbol.body() == null) {
            symbol.setBody(classScope);
        }
        Scope outer = current;
        int outerGuard = guard;
        current = classScope;
        guard = -1;
        walkAll(node.body());
        current = outer;
        guard = outerGuard;
        return null;
    }

    @Override
    public Void visitComprehension(int index, ComprehensionNode node) {
        List<Integer> generators = node.generators();
        ComprehensionForNode first = (ComprehensionForNode) store.get(generators.get(0));
        walk(first.iterable());
        Scope comprehension = openScope(Scope.Kind.COMPREHENSION, index, "<" + node.kind().name().toLowerCase() + "comp>");
        Scope outer = current;
        current = comprehension;
        for (int i = 0; i < generators.size(); i++) {
            int generatorIndex = generators.get(i);
            ComprehensionForNode generator = (ComprehensionForNode) store.get(generatorIndex);
            scopeByNode[generatorIndex] = comprehension;
            walk(generator.target());
            if (i > 0) {
                walk(generator.iterable());
            }
            walkAll(generator.conditions());
        }
        walk(node.element());
        walk(node.value());
        current = outer;
        return null;
    }

    // === Bindings ===

    @Override
    public Void visitName(int index, NameNode node) {
        if (node.ctx() == ExprContext.STORE) {
            declare(node.id(), Symbol.Kind.VARIABLE, index, node.line(), null);
        }
        return null;
    }

    @Override
    public Void visitNamedExpr(int index, NamedExprNode node) {
        walk(node.value());
        NameNode target = (NameNode) store.get(node.target());
        scopeByNode[node.target()] = current;
        Scope outer = current;
        current = current.nearestNonComprehension();
        declare(target.id(), Symbol.Kind.VARIABLE, node.target(), target.line(), null);
        current = outer;
        return null;
    }

    @Override
    public Void visitAttribute(int index, AttributeNode node) {
        if (node.ctx() == ExprContext.STORE && current.kind() == Scope.Kind.FUNCTION && current.selfName() != null
                && store.get(node.value()) instanceof NameNode receiver && receiver.id().equals(current.selfName())) {
            current.parent().addInstanceAttribute(node.attr());
        }
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitAnnAssign(int index, AnnAssignNode node) {
        walk(node.annotation());
        walk(node.value());
        boolean binds = node.value() >= 0 || current.kind() == Scope.Kind.CLASS
                || !(store.get(node.target()) instanceof NameNode);
        if (binds) {
            walk(node.target());
        } else {
            scopeByNode[node.target()] = current;
        }
        return null;
    }

    @Override
    public Void visitExceptHandler(int index, ExceptHandlerNode node) {
        walk(node.type());
        if (node.name() != null) {
            declare(node.name(), Symbol.Kind.VARIABLE, index, node.nameSpan().line(), null);
        }
        walkAll(node.body());
        return null;
    }

    @Override
    public Void visitImport(int index, ImportNode node) {
        List<Symbol> bound = new ArrayList<>();
        for (ImportAlias alias : node.names()) {
            ImportBinding binding = new ImportBinding(alias.name(), null, 0, alias.asName());
            Symbol symbol = declare(alias.boundName(), Symbol.Kind.IMPORT_ALIAS, index, alias.span().line(), binding);
            if (symbol != null) {
                bound.add(symbol);
            }
        }
        importSymbols.put(index, bound);
        return null;
    }

    @Override
    public Void visitImportFrom(int index, ImportFromNode node) {
        if (node.isFuture()) {
            futureImports.add(index);
            return null;
        }
        if (node.isWildcard()) {
            wildcardImports.add(index);
            return null;
        }
        List<Symbol> bound = new ArrayList<>();
        for (ImportAlias alias : node.names()) {
            ImportBinding binding = new ImportBinding(node.module(), alias.name(), node.level(), alias.asName());
            Symbol symbol = declare(alias.boundName(), Symbol.Kind.IMPORT_ALIAS, index, alias.span().line(), binding);
            if (symbol != null) {
                bound.add(symbol);
            }
        }
        importSymbols.put(index, bound);
        return null;
    }

    @Override
    public Void visitGlobal(int index, GlobalNode node) {
        return null;
    }

    @Override
    public Void visitNonlocal(int index, NonlocalNode node) {
        return null;
    }

    // === Guards: alternatives inside one compound statement may bind the same name ===

    @Override
    public Void visitIf(int index, IfNode node) {
        return guarded(index);
    }

    @Override
    public Void visitTry(int index, TryNode node) {
        return guarded(index);
    }

    @Override
    public Void visitFor(int index, ForNode node) {
        return guarded(index);
    }

    @Override
    public Void visitWhile(int index, WhileNode node) {
        return guarded(index);
    }

    @Override
    public Void visitWith(int index, WithNode node) {
        return guarded(index);
    }

    private Void guarded(int index) {
        int outerGuard = guard;
        if (guard < 0) {
            guard = index;
        }
        walkChildren(index);
        guard = outerGuard;
        return null;
    }

    // === Helpers ===

    private Scope openScope(Scope.Kind kind, int ownerNode, String name) {
        Scope scope = new Scope(scopes.size(), kind, current, ownerNode, name);
        scopes.add(scope);
        return scope;
    }

    private void walkParameterHeaders(List<Integer> parameters) {
        for (int parameter : parameters) {
            ParameterNode node = (ParameterNode) store.get(parameter);
            walk(node.annotation());
            walk(node.defaultValue());
        }
    }

    private void bindParameters(List<Integer> parameters) {
        for (int parameter : parameters) {
            ParameterNode node = (ParameterNode) store.get(parameter);
            scopeByNode[parameter] = current;
            declare(node.name(), Symbol.Kind.PARAMETER, parameter, node.line(), null);
        }
    }

    /**
     * Records {@code global}/{@code nonlocal} declarations of a function body before it is
     * visited, since a declaration applies to the whole scope.
     */
    private void prescanDeclarations(List<Integer> statements, Scope scope) {
        for (int statement : statements) {
            Node node = store.get(statement);
            if (node instanceof GlobalNode global) {
                global.names().forEach(scope::declareGlobal);
            } else if (node instanceof NonlocalNode nonlocal) {
                nonlocal.names().forEach(scope::declareNonlocal);
            } else if (!(node instanceof FunctionDefNode) && !(node instanceof ClassDefNode)) {
                prescanDeclarations(statementChildren(node), scope);
            }
        }
    }

    private List<Integer> statementChildren(Node node) {
        if (node instanceof IfNode n) {
            return concat(n.body(), n.orElse());
        }
        if (node instanceof ForNode n) {
            return concat(n.body(), n.orElse());
        }
        if (node instanceof WhileNode n) {
            return concat(n.body(), n.orElse());
        }
        if (node instanceof WithNode n) {
            return n.body();
        }
        if (node instanceof TryNode n) {
            List<Integer> result = new ArrayList<>(n.body());
            for (int handler : n.handlers()) {
                result.addAll(((ExceptHandlerNode) store.get(handler)).body());
            }
            result.addAll(n.orElse());
            result.addAll(n.finalBody());
            return result;
        }
        return List.of();
    }

    private static List<Integer> concat(List<Integer> first, List<Integer> second) {
        List<Integer> result = new ArrayList<>(first);
        result.addAll(second);
        return result;
    }

    /**
     * Binds a name in the current scope, or records a write through a scope-widening declaration.
     * @return The symbol the name is bound to, or null for widened writes.
     */
    private Symbol declare(String name, Symbol.Kind kind, int node, int line, ImportBinding importBinding) {
        if (current.kind() != Scope.Kind.MODULE && current.isDeclaredGlobal(name)) {
            widenedWrites.add(new WidenedWrite(current, name, kind, node, line, true, topLevelStatement));
            return null;
        }
        if (current.isDeclaredNonlocal(name)) {
            widenedWrites.add(new WidenedWrite(current, name, kind, node, line, false, topLevelStatement));
            return null;
        }
        return define(current, name, kind, node, line, importBinding, topLevelStatement, guard);
    }

    private Symbol define(Scope scope, String name, Symbol.Kind kind, int node, int line, ImportBinding importBinding,
                          int statement, int bindingGuard) {
        Symbol existing = scope.lookupLocal(name);
        if (existing == null) {
            Symbol symbol = new Symbol(name, kind, scope, node, moduleId, line, statement, bindingGuard, importBinding);
            scope.define(symbol);
            symbols.add(symbol);
            symbolByNode.put(node, symbol);
            return symbol;
        }
        if (!isRebinding(existing, kind, node, bindingGuard, importBinding)) {
            Map<String, TreeSet<Integer>> byName = duplicateLines.computeIfAbsent(scope, s -> new LinkedHashMap<>());
            TreeSet<Integer> lines = byName.computeIfAbsent(name, n -> new TreeSet<>());
            lines.add(existing.line());
            lines.add(line);
        }
        existing.addBinding(node);
        symbolByNode.putIfAbsent(node, existing);
        return existing;
    }

    /**
     * Decides whether a second binding of a name in one scope is an ordinary rebinding rather
     * than a duplicate definition.
     */
    private boolean isRebinding(Symbol existing, Symbol.Kind kind, int node, int bindingGuard,
                                ImportBinding importBinding) {
        if (existing.name().equals("_")) {
            return true;
        }
        if (isPlainBinding(existing.kind()) && isPlainBinding(kind)) {
            return true;
        }
        if (existing.guard() >= 0 && existing.guard() == bindingGuard) {
            return true;
        }
        if (existing.kind() == Symbol.Kind.IMPORT_ALIAS && importBinding != null
                && existing.scope().kind() != Scope.Kind.MODULE
                && existing.importBinding().targetKey().equals(importBinding.targetKey())) {
            return true;
        }
        if (kind == Symbol.Kind.FUNCTION && store.get(node) instanceof FunctionDefNode def) {
            if (isAccessorOrOverload(def, existing.name())) {
                return true;
            }
            return store.get(existing.node()) instanceof FunctionDefNode first
                    && isAccessorOrOverload(first, existing.name());
        }
        return false;
    }

    private static boolean isPlainBinding(Symbol.Kind kind) {
        return kind == Symbol.Kind.VARIABLE || kind == Symbol.Kind.PARAMETER;
    }

    /**
     * @return true for {@code @name.setter/getter/deleter} and {@code @overload} definitions.
     */
    private boolean isAccessorOrOverload(FunctionDefNode def, String name) {
        for (int decorator : def.decorators()) {
            Node node = store.get(decorator);
            if (node instanceof CallNode call) {
                node = store.get(call.function());
            }
            if (node instanceof AttributeNode attribute) {
                if (attribute.attr().equals("overload")) {
                    return true;
                }
                if (store.get(attribute.value()) instanceof NameNode receiver && receiver.id().equals(name)) {
                    return true;
                }
            } else if (node instanceof NameNode decoratorName && decoratorName.id().equals("overload")) {
                return true;
            }
        }
        return false;
    }

    private void attachWidenedWrites() {
        for (WidenedWrite write : widenedWrites) {
            if (write.global()) {
                Symbol target = moduleScope.lookupLocal(write.name());
                if (target == null) {
                    define(moduleScope, write.name(), write.kind(), write.node(), write.line(), null,
                            write.statement(), -1);
                } else {
                    target.addBinding(write.node());
                    symbolByNode.putIfAbsent(write.node(), target);
                }
                continue;
            }
            Symbol target = null;
            for (Scope scope = write.scope().parent(); scope != null && target == null; scope = scope.parent()) {
                if (scope.kind() == Scope.Kind.FUNCTION) {
                    target = scope.lookupLocal(write.name());
                }
            }
            if (target != null) {
                target.addBinding(write.node());
                symbolByNode.putIfAbsent(write.node(), target);
            } else {
                danglingNonlocals.add(new SymbolTable.DanglingNonlocal(write.name(), write.line()));
            }
        }
    }

    /**
     * Fills the raw reference footprint of module-level definitions and class members.
     */
    private void collectReferences() {
        SymbolTable partial = new SymbolTable(moduleId, store, moduleScope, scopes, scopeByNode, symbolByNode,
                importSymbols, symbols, List.of(), List.of(), List.of(), List.of());
        for (Symbol symbol : symbols) {
            if (!symbol.isModuleLevel() && !symbol.isMember()) {
                continue;
            }
            NodeWalker collector = new NodeWalker(store) {
                @Override
                public Void visitName(int index, NameNode node) {
                    if (node.ctx() != ExprContext.STORE) {
                        symbol.addReference(node.id());
                    }
                    return null;
                }
            };
            collector.walkAll(partial.extentOf(symbol));
        }
    }
}
