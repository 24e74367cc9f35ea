package org.pysymphony.compiler.frontend.semantics;

import org.pysymphony.compiler.frontend.parser.ast.ConstantNode;
import org.pysymphony.compiler.frontend.parser.ast.IfNode;
import org.pysymphony.compiler.frontend.parser.ast.NameNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.OperationNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognises top-level {@code if __name__ == "__main__":} blocks, in either operand order.
 */
public final class EntryBlocks {

    private EntryBlocks() {
    }

    /**
     * @param store A parsed module.
     * @return The indices of the module's top-level entry blocks in source order.
     */
    public static List<Integer> find(NodeStore store) {
        List<Integer> blocks = new ArrayList<>();
        for (int statement : store.module().body()) {
            if (isEntryBlock(store, statement)) {
                blocks.add(statement);
            }
        }
        return blocks;
    }

    public static boolean isEntryBlock(NodeStore store, int statement) {
        if (!(store.get(statement) instanceof IfNode ifNode)
                || !(store.get(ifNode.test()) instanceof OperationNode test)
                || !test.operator().equals("==") || test.operands().size() != 2) {
            return false;
        }
        Node left = store.get(test.operands().get(0));
        Node right = store.get(test.operands().get(1));
        return isNameOperand(left) && isMainLiteral(right) || isMainLiteral(left) && isNameOperand(right);
    }

    private static boolean isNameOperand(Node node) {
        return node instanceof NameNode name && name.id().equals("__name__");
    }

    private static boolean isMainLiteral(Node node) {
        return node instanceof ConstantNode constant && constant.isString() && constant.value().equals("__main__");
    }
}
