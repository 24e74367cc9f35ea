package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.module.ModuleDescriptor;
import org.pysymphony.compiler.frontend.parser.ast.AttributeNode;
import org.pysymphony.compiler.frontend.parser.ast.ClassDefNode;
import org.pysymphony.compiler.frontend.parser.ast.ConstantNode;
import org.pysymphony.compiler.frontend.parser.ast.ExceptHandlerNode;
import org.pysymphony.compiler.frontend.parser.ast.FunctionDefNode;
import org.pysymphony.compiler.frontend.parser.ast.GlobalNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportAlias;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportNode;
import org.pysymphony.compiler.frontend.parser.ast.NameNode;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NodeWalker;
import org.pysymphony.compiler.frontend.parser.ast.Span;
import org.pysymphony.compiler.frontend.semantics.ModuleId;
import org.pysymphony.compiler.frontend.semantics.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders one top-level statement with its recorded sites replaced: renamed names, collapsed
 * module attribute chains, rewritten {@code __all__} entries and {@code global} declarations,
 * and nested internal imports. The original node store is only read.
 */
public final class RenameRewriter {

    private final ReferenceSites sites;

    public RenameRewriter(ReferenceSites sites) {
        this.sites = sites;
    }

    /**
     * @param statement A top-level statement.
     * @return The statement's source text with all edits applied.
     */
    public String render(StatementRef statement) {
        ModuleDescriptor module = statement.module();
        NodeStore store = module.store();
        List<TextEdit> edits = new ArrayList<>();
        new EditCollector(module, edits).walk(statement.statement());
        Span span = statement.span();
        return TextEdit.apply(store.source(), span.start(), span.end(), edits);
    }

    private final class EditCollector extends NodeWalker {

        private final ModuleDescriptor module;
        private final ModuleId id;
        private final List<TextEdit> edits;

        EditCollector(ModuleDescriptor module, List<TextEdit> edits) {
            super(module.store());
            this.module = module;
            this.id = module.id();
            this.edits = edits;
        }

        @Override
        public Void visitName(int index, NameNode node) {
            sites.name(id, index).ifPresent(target -> rename(node.span(), node.id(), target));
            return null;
        }

        @Override
        public Void visitAttribute(int index, AttributeNode node) {
            Optional<Symbol> target = sites.chain(id, index);
            if (target.isPresent()) {
                edits.add(new TextEdit(node.span().start(), node.span().end(), target.get().emittedName()));
                return null;
            }
            walkChildren(index);
            return null;
        }

        @Override
        public Void visitFunctionDef(int index, FunctionDefNode node) {
            sites.name(id, index).ifPresent(target -> rename(node.nameSpan(), node.name(), target));
            walkChildren(index);
            return null;
        }

        @Override
        public Void visitClassDef(int index, ClassDefNode node) {
            sites.name(id, index).ifPresent(target -> rename(node.nameSpan(), node.name(), target));
            walkChildren(index);
            return null;
        }

        @Override
        public Void visitExceptHandler(int index, ExceptHandlerNode node) {
            if (node.name() != null) {
                sites.name(id, index).ifPresent(target -> rename(node.nameSpan(), node.name(), target));
            }
            walkChildren(index);
            return null;
        }

        @Override
        public Void visitConstant(int index, ConstantNode node) {
            sites.string(id, index).filter(target -> !target.emittedName().equals(node.value()))
                    .ifPresent(target -> {
                        String text = store.text(node.span());
                        int offset = text.indexOf(node.value());
                        if (offset >= 0) {
                            int start = node.span().start() + offset;
                            edits.add(new TextEdit(start, start + node.value().length(), target.emittedName()));
                        }
                    });
            return null;
        }

        @Override
        public Void visitGlobal(int index, GlobalNode node) {
            sites.declaration(id, index).ifPresent(targets -> {
                for (int i = 0; i < targets.size(); i++) {
                    if (targets.get(i) != null) {
                        rename(node.nameSpans().get(i), node.names().get(i), targets.get(i));
                    }
                }
            });
            return null;
        }

        @Override
        public Void visitImport(int index, ImportNode node) {
            Optional<List<ImportAlias>> retained = sites.importRewrite(id, index);
            if (retained.isPresent()) {
                String replacement = retained.get().isEmpty() ? "pass"
                        : "import " + retained.get().stream().map(alias -> store.text(alias.span()))
                                .collect(Collectors.joining(", "));
                edits.add(new TextEdit(node.span().start(), node.span().end(), replacement));
                return null;
            }
            renameAliases(index, node.names());
            return null;
        }

        @Override
        public Void visitImportFrom(int index, ImportFromNode node) {
            if (sites.importRewrite(id, index).isPresent()) {
                edits.add(new TextEdit(node.span().start(), node.span().end(), "pass"));
                return null;
            }
            renameAliases(index, node.names());
            return null;
        }

        /**
         * Rebinds external imports inside emitted statements whose module-level alias was renamed.
         */
        private void renameAliases(int index, List<ImportAlias> aliases) {
            List<Symbol> bound = module.table().importedBy(index);
            for (ImportAlias alias : aliases) {
                for (Symbol symbol : bound) {
                    if (symbol.isModuleLevel() && symbol.name().equals(alias.boundName())
                            && symbol.qualifiedName() != null) {
                        edits.add(new TextEdit(alias.span().start(), alias.span().end(),
                                alias.name() + " as " + symbol.qualifiedName()));
                    }
                }
            }
        }

        private void rename(Span span, String original, Symbol target) {
            if (!target.emittedName().equals(original)) {
                edits.add(new TextEdit(span.start(), span.end(), target.emittedName()));
            }
        }
    }
}
