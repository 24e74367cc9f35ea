package org.pysymphony.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed syntactic construct. Nodes live in a {@link NodeStore} and refer to their
 * children by store index, never by reference; {@code -1} marks an absent optional child.
 * The set of node kinds is closed, and {@link NodeVisitor} has one method per kind so that
 * every consumer handles every kind.
 */
public sealed interface Node extends SourceLocatable permits
        ModuleNode, FunctionDefNode, ParameterNode, ClassDefNode, ReturnNode, DeleteNode, AssignNode,
        AugAssignNode, AnnAssignNode, ForNode, WhileNode, IfNode, WithNode, WithItemNode, RaiseNode, TryNode,
        ExceptHandlerNode, AssertNode, ImportNode, ImportFromNode, GlobalNode, NonlocalNode, ExprStmtNode,
        KeywordStatementNode, NameNode, AttributeNode, SubscriptNode, SliceNode, StarredNode, CallNode,
        KeywordNode, OperationNode, IfExpNode, LambdaNode, NamedExprNode, AwaitNode, YieldNode, ConstantNode,
        FormattedStringNode, CollectionNode, DictNode, ComprehensionNode, ComprehensionForNode {

    /**
     * @return The indices of all direct children in source order.
     */
    List<Integer> children();

    /**
     * Dispatches to the visitor method for this node kind.
     * @param index The store index of this node.
     * @param visitor The visitor.
     * @return The visitor's result.
     */
    <R> R accept(int index, NodeVisitor<R> visitor);

    /**
     * Flattens child indices and index lists into one list, skipping absent children.
     * @param parts {@link Integer} indices and {@code List<Integer>} index lists.
     * @return The flattened indices.
     */
    @SuppressWarnings("unchecked")
    static List<Integer> childrenOf(Object... parts) {
        List<Integer> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Integer index) {
                if (index >= 0) {
                    result.add(index);
                }
            } else if (part instanceof List<?> list) {
                for (Integer index : (List<Integer>) list) {
                    if (index >= 0) {
                        result.add(index);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }
}
