package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.api.CompilationException;
import org.pysymphony.compiler.api.UnsupportedConstructException;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.module.ModuleDescriptor;
import org.pysymphony.compiler.frontend.module.ModuleSet;
import org.pysymphony.compiler.frontend.module.ProjectLinker;
import org.pysymphony.compiler.frontend.parser.ast.AnnAssignNode;
import org.pysymphony.compiler.frontend.parser.ast.AssignNode;
import org.pysymphony.compiler.frontend.parser.ast.AttributeNode;
import org.pysymphony.compiler.frontend.parser.ast.AugAssignNode;
import org.pysymphony.compiler.frontend.parser.ast.ClassDefNode;
import org.pysymphony.compiler.frontend.parser.ast.CollectionNode;
import org.pysymphony.compiler.frontend.parser.ast.ConstantNode;
import org.pysymphony.compiler.frontend.parser.ast.ExceptHandlerNode;
import org.pysymphony.compiler.frontend.parser.ast.ExprContext;
import org.pysymphony.compiler.frontend.parser.ast.ExprStmtNode;
import org.pysymphony.compiler.frontend.parser.ast.FunctionDefNode;
import org.pysymphony.compiler.frontend.parser.ast.GlobalNode;
import org.pysymphony.compiler.frontend.parser.ast.IfNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportAlias;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportNode;
import org.pysymphony.compiler.frontend.parser.ast.KeywordStatementNode;
import org.pysymphony.compiler.frontend.parser.ast.NameNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NodeWalker;
import org.pysymphony.compiler.frontend.parser.ast.TryNode;
import org.pysymphony.compiler.frontend.semantics.EntryBlocks;
import org.pysymphony.compiler.frontend.semantics.ImportBinding;
import org.pysymphony.compiler.frontend.semantics.LinkTarget;
import org.pysymphony.compiler.frontend.semantics.ModuleId;
import org.pysymphony.compiler.frontend.semantics.ReferenceResolver;
import org.pysymphony.compiler.frontend.semantics.Resolution;
import org.pysymphony.compiler.frontend.semantics.Scope;
import org.pysymphony.compiler.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the minimal set of definitions the entry module needs.
 *
 * <p>The closure starts from the entry module's executable top-level code and its first
 * {@code if __name__ == "__main__"} block and follows every name and attribute chain that
 * reaches a module-level definition, in the entry module or through internal imports. Selecting
 * a class selects its members. A module that contributes a definition also contributes its
 * top-level statements that run for their effect, which may select further definitions; the
 * walk runs until nothing new is reached.</p>
 *
 * <p>While walking, every site that will need renaming or collapsing is recorded in the
 * {@link ReferenceSites} of the resulting {@link MergeUnit}.</p>
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final ModuleSet modules;
    private final ProjectLinker linker;
    private final Map<ModuleId, ReferenceResolver> resolvers = new HashMap<>();
    private final Map<ModuleId, Map<Integer, List<Symbol>>> ownedByStatement = new HashMap<>();
    private final Deque<Symbol> pendingSymbols = new ArrayDeque<>();
    private final Deque<StatementRef> pendingStatements = new ArrayDeque<>();
    private final Set<Symbol> processed = new HashSet<>();
    private final Set<ModuleId> contributing = new LinkedHashSet<>();
    private final MergeUnit unit;

    public DependencyGraphBuilder(ModuleSet modules, ProjectLinker linker) {
        this.modules = modules;
        this.linker = linker;
        this.unit = new MergeUnit(modules);
        for (ModuleDescriptor module : modules.modules()) {
            resolvers.put(module.id(), new ReferenceResolver(module.table(), linker));
        }
    }

    /**
     * Runs the closure.
     * @return The filled merge unit.
     * @throws CompilationException if selected code uses an internal module object as a value, or
     *                              needs a definition that only exists in a skipped entry block.
     */
    public MergeUnit build() throws CompilationException {
        seedEntry(modules.entry());
        while (!pendingSymbols.isEmpty() || !pendingStatements.isEmpty()) {
            if (!pendingSymbols.isEmpty()) {
                process(pendingSymbols.poll());
            } else {
                StatementRef statement = pendingStatements.poll();
                walk(statement.module(), List.of(statement.statement()), null);
            }
        }
        orderPreservedStatements();
        log.debug("Selected {} definition(s) in {} unit(s) from {} module(s); {} external import(s)",
                unit.graph().size(), unit.definitionUnits().size(), contributing.size(),
                unit.externalImports().size());
        return unit;
    }

    // === Seeds ===

    private void seedEntry(ModuleDescriptor entry) throws CompilationException {
        NodeStore store = entry.store();
        List<Integer> body = store.module().body();
        List<Integer> entryBlocks = EntryBlocks.find(store);
        contributing.add(entry.id());
        for (int i = 0; i < body.size(); i++) {
            int statement = body.get(i);
            StatementRef ref = new StatementRef(entry, statement);
            Node node = store.get(statement);
            if (i == 0 && isDocstring(store, node)) {
                unit.setDocstring(ref);
            } else if (node instanceof ImportFromNode from && from.isFuture()) {
                unit.addFutureImport(ref);
            } else if (isImport(node) || node instanceof FunctionDefNode || node instanceof ClassDefNode) {
                // selected only when referenced
                continue;
            } else if (entryBlocks.contains(statement)) {
                if (statement == entryBlocks.get(0)) {
                    unit.setEntryBlock(ref);
                    pendingStatements.add(ref);
                } else {
                    log.warn("Skipping additional entry block of {} at line {}", entry.id(), ref.line());
                }
            } else if (isDefinitionStatement(node, owned(entry, statement))) {
                selectUnit(ref);
                recordExports(entry, statement);
            } else {
                preserve(ref);
            }
        }
        for (ModuleDescriptor module : modules.modules()) {
            for (int future : module.table().futureImports()) {
                if (module != entry) {
                    unit.addFutureImport(new StatementRef(module, future));
                }
            }
        }
    }

    /**
     * Records the string entries of the entry module's {@code __all__} that name its definitions.
     */
    private void recordExports(ModuleDescriptor entry, int statement) {
        NodeStore store = entry.store();
        if (!(store.get(statement) instanceof AssignNode assign)
                || assign.targets().size() != 1
                || !(store.get(assign.targets().get(0)) instanceof NameNode target)
                || !target.id().equals("__all__")
                || !(store.get(assign.value()) instanceof CollectionNode names)) {
            return;
        }
        for (int element : names.elements()) {
            if (store.get(element) instanceof ConstantNode constant && constant.isString()) {
                entry.table().lookupModuleSymbol(constant.value())
                        .ifPresent(symbol -> unit.sites().addString(entry.id(), element, symbol));
            }
        }
    }

    /**
     * Adds the top-level statements a module runs for their effect, once it contributes code.
     */
    private void contribute(ModuleDescriptor module) {
        if (!contributing.add(module.id())) {
            return;
        }
        NodeStore store = module.store();
        List<Integer> body = store.module().body();
        for (int i = 0; i < body.size(); i++) {
            int statement = body.get(i);
            Node node = store.get(statement);
            if (i == 0 && isDocstring(store, node) || isImport(node) || node instanceof FunctionDefNode
                    || node instanceof ClassDefNode || EntryBlocks.isEntryBlock(store, statement) || isInert(node)
                    || isDefinitionStatement(node, owned(module, statement))) {
                continue;
            }
            preserve(new StatementRef(module, statement));
        }
    }

    // === Selection ===

    private void select(Symbol symbol, Symbol dependent) throws CompilationException {
        ModuleDescriptor module = modules.get(symbol.module());
        if (symbol.isMember()) {
            Symbol owner = classOf(module, symbol.scope());
            select(owner, dependent);
            return;
        }
        if (!symbol.isModuleLevel()) {
            return;
        }
        unit.graph().addNode(symbol);
        if (dependent != null) {
            unit.graph().addEdge(dependent, symbol, DependencyEdge.Kind.REFERENCE);
        }
        StatementRef ref = new StatementRef(module, symbol.statement());
        Node statement = module.store().get(symbol.statement());
        if (symbol.kind() == Symbol.Kind.IMPORT_ALIAS && linker.isInternal(symbol)) {
            throw new CompilationException(ErrorKind.UNRESOLVED_REFERENCE, "Cannot resolve the import of '"
                    + symbol.name() + "'", module.id().path(), List.of(symbol.line()));
        }
        if (symbol.kind() == Symbol.Kind.IMPORT_ALIAS && isImport(statement)) {
            unit.addExternalImport(symbol);
            contribute(module);
            return;
        }
        if (EntryBlocks.isEntryBlock(module.store(), symbol.statement())) {
            if (unit.entryBlock().filter(ref::equals).isEmpty()) {
                throw new CompilationException(ErrorKind.UNRESOLVED_REFERENCE, "'" + symbol.name()
                        + "' is only defined inside an entry block that is not merged", module.id().path(),
                        List.of(symbol.line()));
            }
            return;
        }
        if (isDefinitionStatement(statement, owned(module, symbol.statement()))) {
            selectUnit(ref);
        } else {
            preserve(ref);
        }
    }

    private void selectUnit(StatementRef ref) {
        if (unit.isDefinitionUnit(ref)) {
            return;
        }
        List<Symbol> owned = owned(ref.module(), ref.statement());
        unit.addDefinitionUnit(ref, owned);
        contribute(ref.module());
        for (Symbol symbol : owned) {
            unit.graph().addNode(symbol);
            pendingSymbols.add(symbol);
        }
    }

    private void preserve(StatementRef ref) {
        if (unit.isPreserved(ref)) {
            return;
        }
        unit.addPreservedStatement(ref);
        pendingStatements.add(ref);
        contribute(ref.module());
    }

    /**
     * Walks the code a selected definition evaluates, then selects its members.
     */
    private void process(Symbol symbol) throws CompilationException {
        if (!processed.add(symbol)) {
            return;
        }
        ModuleDescriptor module = modules.get(symbol.module());
        List<Integer> roots;
        if (symbol.isModuleLevel() && symbol.node() != symbol.statement()) {
            roots = List.of(symbol.statement());
        } else {
            roots = module.table().extentOf(symbol);
        }
        if (symbol.kind() == Symbol.Kind.CLASS && symbol.isModuleLevel()
                && module.store().get(symbol.node()) instanceof ClassDefNode) {
            // a class extent leaves out its own header, so its name site is recorded here
            unit.sites().addName(module.id(), symbol.node(), symbol);
        }
        walk(module, roots, symbol);
        if (symbol.kind() == Symbol.Kind.CLASS && symbol.body() != null) {
            for (Symbol member : symbol.body().symbols()) {
                unit.graph().addNode(member);
                unit.graph().addEdge(member, symbol, DependencyEdge.Kind.MEMBER_OF);
                pendingSymbols.add(member);
            }
        }
    }

    private void walk(ModuleDescriptor module, List<Integer> roots, Symbol dependent) throws CompilationException {
        ReferenceCollector collector = new ReferenceCollector(module, dependent);
        collector.walkAll(roots);
        if (collector.failure != null) {
            throw collector.failure;
        }
    }

    // === Reference collection ===

    /**
     * Records the definitions a piece of code refers to. Failures are kept and rethrown by
     * {@link #walk}, since visitor methods cannot throw checked exceptions.
     */
    private final class ReferenceCollector extends NodeWalker {

        private final ModuleDescriptor module;
        private final ReferenceResolver resolver;
        private final Symbol dependent;
        private CompilationException failure;

        ReferenceCollector(ModuleDescriptor module, Symbol dependent) {
            super(module.store());
            this.module = module;
            this.resolver = resolvers.get(module.id());
            this.dependent = dependent;
        }

        @Override
        public void walk(int index) {
            if (failure == null) {
                super.walk(index);
            }
        }

        @Override
        public Void visitName(int index, NameNode node) {
            Resolution resolution = resolver.resolve(index);
            if (resolution.kind() == Resolution.Kind.BUILTIN && node.ctx() == ExprContext.LOAD) {
                unit.addBuiltinUse(node.id());
                return null;
            }
            Symbol symbol = resolution.symbol();
            if (symbol == null) {
                return null;
            }
            try {
                if (symbol.kind() == Symbol.Kind.IMPORT_ALIAS && linker.isInternal(symbol)) {
                    if (node.ctx() == ExprContext.LOAD) {
                        Symbol target = linkedSymbol(symbol, node.line());
                        unit.sites().addName(module.id(), index, target);
                        select(target, dependent);
                    }
                } else if (symbol.isModuleLevel()) {
                    unit.sites().addName(module.id(), index, symbol);
                    select(symbol, dependent);
                }
            } catch (CompilationException e) {
                failure = e;
            }
            return null;
        }

        @Override
        public Void visitAttribute(int index, AttributeNode node) {
            try {
                if (node.ctx() == ExprContext.LOAD && collapseChain(index)) {
                    return null;
                }
            } catch (CompilationException e) {
                failure = e;
                return null;
            }
            walkChildren(index);
            return null;
        }

        /**
         * Collapses {@code alias.sub.name} to the definition it reaches when the head is an
         * internal module alias.
         * @return true if the chain was recorded and its parts need no further walking.
         */
        private boolean collapseChain(int attributeNode) throws CompilationException {
            List<Integer> chain = new ArrayList<>();
            int head = attributeNode;
            while (store.get(head) instanceof AttributeNode attribute) {
                chain.add(0, head);
                head = attribute.value();
            }
            if (!(store.get(head) instanceof NameNode)) {
                return false;
            }
            Symbol alias = resolver.resolve(head).symbol();
            if (alias == null || alias.kind() != Symbol.Kind.IMPORT_ALIAS || !linker.isInternal(alias)) {
                return false;
            }
            Optional<LinkTarget> current = linker.link(alias);
            if (current.isEmpty()) {
                throw unresolvedImport(alias, store.get(head).line());
            }
            if (!current.get().isModule()) {
                return false;
            }
            for (int link : chain) {
                AttributeNode attribute = (AttributeNode) store.get(link);
                Optional<LinkTarget> next = linker.member(current.get(), attribute.attr());
                if (next.isEmpty()) {
                    throw new CompilationException(ErrorKind.UNRESOLVED_REFERENCE, "Module '"
                            + current.get().moduleName() + "' has no attribute '" + attribute.attr() + "'",
                            module.id().path(), List.of(attribute.attrSpan().line()));
                }
                if (!next.get().isModule()) {
                    Symbol target = next.get().symbol();
                    unit.sites().addChain(module.id(), link, target);
                    select(target, dependent);
                    return true;
                }
                current = next;
            }
            throw new UnsupportedConstructException("Module '" + current.get().moduleName()
                    + "' is used as a value; only attribute access to its definitions can be merged",
                    module.id().path(), store.get(attributeNode).line());
        }

        private Symbol linkedSymbol(Symbol alias, int line) throws CompilationException {
            Optional<LinkTarget> target = linker.link(alias);
            if (target.isEmpty()) {
                throw unresolvedImport(alias, line);
            }
            if (target.get().isModule()) {
                throw new UnsupportedConstructException("Module '" + target.get().moduleName()
                        + "' is used as a value; only attribute access to its definitions can be merged",
                        module.id().path(), line);
            }
            return target.get().symbol();
        }

        private CompilationException unresolvedImport(Symbol alias, int line) {
            ImportBinding binding = alias.importBinding();
            String source = ".".repeat(binding.level()) + binding.module();
            String message = binding.isFromImport()
                    ? "Cannot import name '" + binding.importedName() + "' from '" + source + "'"
                    : "Cannot find internal module '" + source + "'";
            return new CompilationException(ErrorKind.UNRESOLVED_REFERENCE, message, module.id().path(), List.of(line));
        }

        @Override
        public Void visitFunctionDef(int index, FunctionDefNode node) {
            recordBinding(index);
            walkChildren(index);
            return null;
        }

        @Override
        public Void visitClassDef(int index, ClassDefNode node) {
            recordBinding(index);
            walkChildren(index);
            return null;
        }

        @Override
        public Void visitExceptHandler(int index, ExceptHandlerNode node) {
            recordBinding(index);
            walkChildren(index);
            return null;
        }

        private void recordBinding(int index) {
            module.table().symbolAt(index)
                    .filter(Symbol::isModuleLevel)
                    .ifPresent(symbol -> unit.sites().addName(module.id(), index, symbol));
        }

        @Override
        public Void visitGlobal(int index, GlobalNode node) {
            List<Symbol> targets = new ArrayList<>();
            for (String name : node.names()) {
                targets.add(module.table().lookupModuleSymbol(name).orElse(null));
            }
            unit.sites().addDeclaration(module.id(), index, targets);
            return null;
        }

        @Override
        public Void visitImport(int index, ImportNode node) {
            List<ImportAlias> retained = new ArrayList<>();
            for (ImportAlias alias : node.names()) {
                if (!linker.isInternal(module.id(), new ImportBinding(alias.name(), null, 0, alias.asName()))) {
                    retained.add(alias);
                }
            }
            if (retained.size() != node.names().size()) {
                unit.sites().addImportRewrite(module.id(), index, retained);
            }
            return null;
        }

        @Override
        public Void visitImportFrom(int index, ImportFromNode node) {
            if (!node.isFuture() && linker.isInternal(module.id(),
                    new ImportBinding(node.module(), "", node.level(), null))) {
                unit.sites().addImportRewrite(module.id(), index, List.of());
            }
            return null;
        }
    }

    // === Helpers ===

    private List<Symbol> owned(ModuleDescriptor module, int statement) {
        Map<Integer, List<Symbol>> byStatement = ownedByStatement.computeIfAbsent(module.id(), id -> {
            Map<Integer, List<Symbol>> map = new HashMap<>();
            for (Symbol symbol : module.table().moduleSymbols()) {
                map.computeIfAbsent(symbol.statement(), s -> new ArrayList<>()).add(symbol);
            }
            return map;
        });
        return byStatement.getOrDefault(statement, List.of());
    }

    private static Symbol classOf(ModuleDescriptor module, Scope classScope) {
        return module.table().symbolAt(classScope.ownerNode()).orElseThrow(() ->
                new IllegalStateException("No symbol for class scope " + classScope + " in " + module.id()));
    }

    /**
     * A statement that binds module-level names and is only emitted when one of them is needed.
     * Loops and {@code with} blocks are kept for their effect instead.
     */
    private static boolean isDefinitionStatement(Node node, List<Symbol> owned) {
        return !owned.isEmpty() && (node instanceof FunctionDefNode || node instanceof ClassDefNode
                || node instanceof AssignNode || node instanceof AnnAssignNode || node instanceof AugAssignNode
                || node instanceof IfNode || node instanceof TryNode || isImport(node));
    }

    private static boolean isImport(Node node) {
        return node instanceof ImportNode || node instanceof ImportFromNode;
    }

    private static boolean isDocstring(NodeStore store, Node node) {
        return node instanceof ExprStmtNode statement && store.get(statement.value()) instanceof ConstantNode constant
                && constant.isString();
    }

    private static boolean isInert(Node node) {
        return node instanceof KeywordStatementNode keyword && keyword.keyword().equals("pass")
                || node instanceof AnnAssignNode annotation && annotation.value() < 0;
    }

    private void orderPreservedStatements() {
        List<ModuleId> moduleOrder = new ArrayList<>(contributing);
        ModuleId entry = modules.entry().id();
        moduleOrder.remove(entry);
        moduleOrder.add(entry);
        List<StatementRef> ordered = new ArrayList<>(unit.preservedStatements());
        ordered.sort(Comparator.comparingInt((StatementRef ref) -> moduleOrder.indexOf(ref.module().id()))
                .thenComparingInt(ref -> ref.span().start()));
        unit.reorderPreservedStatements(ordered);
    }
}
