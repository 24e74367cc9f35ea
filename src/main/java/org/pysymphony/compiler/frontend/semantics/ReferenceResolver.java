package org.pysymphony.compiler.frontend.semantics;

import org.pysymphony.compiler.diagnostics.DiagnosticsEngine;
import org.pysymphony.compiler.diagnostics.ErrorKind;
import org.pysymphony.compiler.frontend.parser.ast.AssignNode;
import org.pysymphony.compiler.frontend.parser.ast.AttributeNode;
import org.pysymphony.compiler.frontend.parser.ast.CallNode;
import org.pysymphony.compiler.frontend.parser.ast.ClassDefNode;
import org.pysymphony.compiler.frontend.parser.ast.ExprContext;
import org.pysymphony.compiler.frontend.parser.ast.KeywordNode;
import org.pysymphony.compiler.frontend.parser.ast.NameNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NodeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves name uses of one module against its scope tree and validates attribute chains.
 * <p>
 * Bare names follow the scope chain outward, then the builtins. Attribute chains are only
 * checked where the head is known locally: a class, an instance created by calling a local
 * class, or (through the {@link ImportLinker}) an internal module. Anything that reaches an
 * external import is accepted as is.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    /**
     * The object an attribute chain has reached so far.
     */
    private record ChainTarget(SymbolTable table, Symbol classSymbol, LinkTarget module) {

        static ChainTarget ofClass(SymbolTable table, Symbol classSymbol) {
            return new ChainTarget(table, classSymbol, null);
        }

        static ChainTarget ofModule(LinkTarget module) {
            return new ChainTarget(module.table(), null, module);
        }
    }

    private final SymbolTable table;
    private final ImportLinker linker;

    /**
     * @param table The module's catalog.
     * @param linker Import linking; {@link ImportLinker#external()} for stand-alone files.
     */
    public ReferenceResolver(SymbolTable table, ImportLinker linker) {
        this.table = table;
        this.linker = linker;
    }

    public SymbolTable table() {
        return table;
    }

    public ImportLinker linker() {
        return linker;
    }

    /**
     * Resolves the name read or deleted at a {@link NameNode}.
     * @param nameNode Index of a name node of this module.
     * @return The resolution.
     */
    public Resolution resolve(int nameNode) {
        NameNode node = (NameNode) table.store().get(nameNode);
        return resolve(node.id(), table.scopeOf(nameNode));
    }

    /**
     * Resolves a bare name as seen from {@code from}. Class scopes are only consulted when the
     * lookup starts in them; function and comprehension bodies inside a class do not see its
     * members.
     * @param name The bare name.
     * @param from The scope the name is used in.
     * @return The resolution.
     */
    public static Resolution resolve(String name, Scope from) {
        for (Scope scope = from; scope != null; scope = scope.parent()) {
            if (scope.kind() == Scope.Kind.CLASS && scope != from) {
                continue;
            }
            if (scope.kind() != Scope.Kind.MODULE && scope.isDeclaredGlobal(name)) {
                Scope module = scope;
                while (module.parent() != null) {
                    module = module.parent();
                }
                Symbol symbol = module.lookupLocal(name);
                return symbol != null ? Resolution.local(symbol) : fallback(name);
            }
            Symbol symbol = scope.lookupLocal(name);
            if (symbol != null) {
                return Resolution.local(symbol);
            }
            if (scope.kind() == Scope.Kind.CLASS && Builtins.isClassImplicit(name)) {
                return Resolution.builtin();
            }
            if (scope.kind() == Scope.Kind.FUNCTION && Builtins.isFunctionImplicit(name)) {
                return Resolution.builtin();
            }
        }
        return fallback(name);
    }

    private static Resolution fallback(String name) {
        if (Builtins.isBuiltin(name) || Builtins.isModuleImplicit(name)) {
            return Resolution.builtin();
        }
        return Resolution.unresolved();
    }

    /**
     * Reports every unresolved bare name, invalid attribute chain and dangling {@code nonlocal}
     * of the module as {@link ErrorKind#UNRESOLVED_REFERENCE} errors. Identical messages are
     * reported once with all their lines.
     * @param diagnostics The engine to report to.
     * @return The number of distinct problems reported.
     */
    public int validate(DiagnosticsEngine diagnostics) {
        Map<String, TreeSet<Integer>> problems = new LinkedHashMap<>();
        NodeStore store = table.store();
        NodeWalker walker = new NodeWalker(store) {
            @Override
            public Void visitName(int index, NameNode node) {
                if (node.ctx() != ExprContext.STORE && !resolve(index).isResolved()) {
                    problems.computeIfAbsent("Undefined name '" + node.id() + "'", k -> new TreeSet<>())
                            .add(node.line());
                }
                return null;
            }

            @Override
            public Void visitAttribute(int index, AttributeNode node) {
                if (node.ctx() == ExprContext.LOAD && isOutermost(index)) {
                    checkChain(index).ifPresent(problem ->
                            problems.computeIfAbsent(problem, k -> new TreeSet<>()).add(node.attrSpan().line()));
                }
                walkChildren(index);
                return null;
            }
        };
        walker.walk(store.root());
        for (SymbolTable.DanglingNonlocal dangling : table.danglingNonlocals()) {
            problems.computeIfAbsent("No binding for nonlocal '" + dangling.name() + "' found",
                    k -> new TreeSet<>()).add(dangling.line());
        }
        String fileName = table.moduleId().path();
        problems.forEach((message, lines) ->
                diagnostics.reportError(ErrorKind.UNRESOLVED_REFERENCE, message, fileName, lines.stream().toList()));
        log.debug("Validated references of {}: {} problem(s)", fileName, problems.size());
        return problems.size();
    }

    private boolean isOutermost(int attributeNode) {
        int parent = table.store().parentOf(attributeNode);
        return !(parent >= 0 && table.store().get(parent) instanceof AttributeNode outer
                && outer.value() == attributeNode && outer.ctx() == ExprContext.LOAD);
    }

    /**
     * @return The index of the chain's head expression; {@code chain} receives the attributes
     * from the head outward.
     */
    private int unwind(int attributeNode, Deque<AttributeNode> chain) {
        int current = attributeNode;
        while (table.store().get(current) instanceof AttributeNode attribute) {
            chain.addFirst(attribute);
            current = attribute.value();
        }
        return current;
    }

    /**
     * @return A problem message, or empty if the chain is valid or cannot be checked.
     */
    private Optional<String> checkChain(int attributeNode) {
        Deque<AttributeNode> chain = new ArrayDeque<>();
        int head = unwind(attributeNode, chain);
        if (!(table.store().get(head) instanceof NameNode)) {
            return Optional.empty();
        }
        Resolution resolution = resolve(head);
        if (resolution.symbol() == null) {
            return Optional.empty();
        }
        Optional<ChainTarget> target = describe(table, resolution.symbol());
        StringBuilder path = new StringBuilder(resolution.symbol().name());
        for (AttributeNode attribute : chain) {
            if (target.isEmpty() || Builtins.isDunder(attribute.attr())) {
                return Optional.empty();
            }
            ChainTarget current = target.get();
            if (current.module() != null) {
                Optional<LinkTarget> member = linker.member(current.module(), attribute.attr());
                if (member.isEmpty()) {
                    return Optional.of("Module '" + current.module().moduleName() + "' has no attribute '"
                            + attribute.attr() + "'");
                }
                target = member.get().isModule()
                        ? Optional.of(ChainTarget.ofModule(member.get()))
                        : describe(member.get().table(), member.get().symbol());
            } else {
                if (isOpen(current.table(), current.classSymbol(), new HashSet<>())) {
                    return Optional.empty();
                }
                Optional<ChainTarget> member = findMember(current.table(), current.classSymbol(), attribute.attr(),
                        new HashSet<>());
                if (member == null) {
                    return Optional.of("Unresolved attribute '" + attribute.attr() + "' of '" + path + "'");
                }
                target = member;
            }
            path.append('.').append(attribute.attr());
        }
        return Optional.empty();
    }

    /**
     * Turns a symbol into a chain target when its shape is known.
     */
    private Optional<ChainTarget> describe(SymbolTable owner, Symbol symbol) {
        switch (symbol.kind()) {
            case CLASS:
                return Optional.of(ChainTarget.ofClass(owner, symbol));
            case IMPORT_ALIAS: {
                Optional<LinkTarget> link = linker.link(symbol);
                if (link.isEmpty()) {
                    return Optional.empty();
                }
                return link.get().isModule()
                        ? Optional.of(ChainTarget.ofModule(link.get()))
                        : describe(link.get().table(), link.get().symbol());
            }
            case VARIABLE:
                return instanceOf(owner, symbol);
            default:
                return Optional.empty();
        }
    }

    /**
     * A variable bound exactly once, by {@code name = LocalClass(...)}, is an instance of that class.
     */
    private Optional<ChainTarget> instanceOf(SymbolTable owner, Symbol variable) {
        if (variable.bindings().size() != 1) {
            return Optional.empty();
        }
        NodeStore store = owner.store();
        int parent = store.parentOf(variable.node());
        if (parent < 0 || !(store.get(parent) instanceof AssignNode assign)
                || !assign.targets().contains(variable.node())
                || !(store.get(assign.value()) instanceof CallNode call)
                || !(store.get(call.function()) instanceof NameNode callee)) {
            return Optional.empty();
        }
        Symbol cls = resolve(callee.id(), owner.scopeOf(call.function())).symbol();
        if (cls == null) {
            return Optional.empty();
        }
        Optional<ChainTarget> described = describe(owner, cls);
        return described.filter(target -> target.classSymbol() != null);
    }

    /**
     * @return The target for the member, empty when the member exists but its shape is unknown,
     * or null when the class and its local bases do not define it.
     */
    private Optional<ChainTarget> findMember(SymbolTable owner, Symbol cls, String attribute, Set<Symbol> seen) {
        if (!seen.add(cls) || cls.body() == null) {
            return Optional.empty();
        }
        Symbol member = cls.body().lookupLocal(attribute);
        if (member != null) {
            return member.kind() == Symbol.Kind.CLASS
                    ? Optional.of(ChainTarget.ofClass(owner, member))
                    : Optional.empty();
        }
        if (cls.body().instanceAttributes().contains(attribute)) {
            return Optional.empty();
        }
        ClassDefNode def = (ClassDefNode) owner.store().get(cls.node());
        for (int base : def.bases()) {
            Optional<ChainTarget> baseTarget = baseClass(owner, base);
            if (baseTarget.isPresent()) {
                Optional<ChainTarget> found = findMember(baseTarget.get().table(), baseTarget.get().classSymbol(),
                        attribute, seen);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * A class accepts any attribute when it is decorated, takes class keywords such as a
     * metaclass, defines {@code __getattr__}/{@code __getattribute__}, or has a base that is
     * not a local class or {@code object}.
     */
    private boolean isOpen(SymbolTable owner, Symbol cls, Set<Symbol> seen) {
        if (!seen.add(cls) || cls.body() == null) {
            return false;
        }
        ClassDefNode def = (ClassDefNode) owner.store().get(cls.node());
        if (!def.decorators().isEmpty()) {
            return true;
        }
        if (cls.body().lookupLocal("__getattr__") != null || cls.body().lookupLocal("__getattribute__") != null) {
            return true;
        }
        for (int base : def.bases()) {
            Node node = owner.store().get(base);
            if (node instanceof KeywordNode) {
                return true;
            }
            if (node instanceof NameNode name && name.id().equals("object")
                    && resolve(name.id(), owner.scopeOf(base)).kind() == Resolution.Kind.BUILTIN) {
                continue;
            }
            Optional<ChainTarget> baseTarget = baseClass(owner, base);
            if (baseTarget.isEmpty() || isOpen(baseTarget.get().table(), baseTarget.get().classSymbol(), seen)) {
                return true;
            }
        }
        return false;
    }

    private Optional<ChainTarget> baseClass(SymbolTable owner, int base) {
        if (!(owner.store().get(base) instanceof NameNode name)) {
            return Optional.empty();
        }
        Symbol symbol = resolve(name.id(), owner.scopeOf(base)).symbol();
        if (symbol == null || symbol.kind() == Symbol.Kind.VARIABLE) {
            return Optional.empty();
        }
        return describe(owner, symbol).filter(target -> target.classSymbol() != null);
    }
}
