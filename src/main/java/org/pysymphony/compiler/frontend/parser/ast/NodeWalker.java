package org.pysymphony.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Depth-first traversal over a {@link NodeStore}. Every visit method walks the node's
 * children in source order; subclasses override the kinds they care about and call
 * {@link #walkChildren(int)} where they still want the default descent.
 */
public abstract class NodeWalker implements NodeVisitor<Void> {

    protected final NodeStore store;

    protected NodeWalker(NodeStore store) {
        this.store = store;
    }

    /**
     * Visits the node at {@code index}; absent children (-1) are ignored.
     */
    public void walk(int index) {
        if (index >= 0) {
            store.accept(index, this);
        }
    }

    public void walkAll(List<Integer> indices) {
        for (int index : indices) {
            walk(index);
        }
    }

    protected void walkChildren(int index) {
        walkAll(store.get(index).children());
    }

    @Override
    public Void visitModule(int index, ModuleNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitFunctionDef(int index, FunctionDefNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitParameter(int index, ParameterNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitClassDef(int index, ClassDefNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitReturn(int index, ReturnNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitDelete(int index, DeleteNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitAssign(int index, AssignNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitAugAssign(int index, AugAssignNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitAnnAssign(int index, AnnAssignNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitFor(int index, ForNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitWhile(int index, WhileNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitIf(int index, IfNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitWith(int index, WithNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitWithItem(int index, WithItemNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitRaise(int index, RaiseNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitTry(int index, TryNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitExceptHandler(int index, ExceptHandlerNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitAssert(int index, AssertNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitImport(int index, ImportNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitImportFrom(int index, ImportFromNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitGlobal(int index, GlobalNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitNonlocal(int index, NonlocalNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitExprStmt(int index, ExprStmtNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitKeywordStatement(int index, KeywordStatementNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitName(int index, NameNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitAttribute(int index, AttributeNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitSubscript(int index, SubscriptNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitSlice(int index, SliceNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitStarred(int index, StarredNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitCall(int index, CallNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitKeyword(int index, KeywordNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitOperation(int index, OperationNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitIfExp(int index, IfExpNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitLambda(int index, LambdaNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitNamedExpr(int index, NamedExprNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitAwait(int index, AwaitNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitYield(int index, YieldNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitConstant(int index, ConstantNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitFormattedString(int index, FormattedStringNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitCollection(int index, CollectionNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitDict(int index, DictNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitComprehension(int index, ComprehensionNode node) {
        walkChildren(index);
        return null;
    }

    @Override
    public Void visitComprehensionFor(int index, ComprehensionForNode node) {
        walkChildren(index);
        return null;
    }
}
