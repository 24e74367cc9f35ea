package org.pysymphony.compiler.frontend.parser.ast;

/**
 * One method per node kind. Adding a node kind breaks every visitor until it handles it.
 *
 * @param <R> The result type.
 */
public interface NodeVisitor<R> {

    R visitModule(int index, ModuleNode node);

    R visitFunctionDef(int index, FunctionDefNode node);

    R visitParameter(int index, ParameterNode node);

    R visitClassDef(int index, ClassDefNode node);

    R visitReturn(int index, ReturnNode node);

    R visitDelete(int index, DeleteNode node);

    R visitAssign(int index, AssignNode node);

    R visitAugAssign(int index, AugAssignNode node);

    R visitAnnAssign(int index, AnnAssignNode node);

    R visitFor(int index, ForNode node);

    R visitWhile(int index, WhileNode node);

    R visitIf(int index, IfNode node);

    R visitWith(int index, WithNode node);

    R visitWithItem(int index, WithItemNode node);

    R visitRaise(int index, RaiseNode node);

    R visitTry(int index, TryNode node);

    R visitExceptHandler(int index, ExceptHandlerNode node);

    R visitAssert(int index, AssertNode node);

    R visitImport(int index, ImportNode node);

    R visitImportFrom(int index, ImportFromNode node);

    R visitGlobal(int index, GlobalNode node);

    R visitNonlocal(int index, NonlocalNode node);

    R visitExprStmt(int index, ExprStmtNode node);

    R visitKeywordStatement(int index, KeywordStatementNode node);

    R visitName(int index, NameNode node);

    R visitAttribute(int index, AttributeNode node);

    R visitSubscript(int index, SubscriptNode node);

    R visitSlice(int index, SliceNode node);

    R visitStarred(int index, StarredNode node);

    R visitCall(int index, CallNode node);

    R visitKeyword(int index, KeywordNode node);

    R visitOperation(int index, OperationNode node);

    R visitIfExp(int index, IfExpNode node);

    R visitLambda(int index, LambdaNode node);

    R visitNamedExpr(int index, NamedExprNode node);

    R visitAwait(int index, AwaitNode node);

    R visitYield(int index, YieldNode node);

    R visitConstant(int index, ConstantNode node);

    R visitFormattedString(int index, FormattedStringNode node);

    R visitCollection(int index, CollectionNode node);

    R visitDict(int index, DictNode node);

    R visitComprehension(int index, ComprehensionNode node);

    R visitComprehensionFor(int index, ComprehensionForNode node);
}
