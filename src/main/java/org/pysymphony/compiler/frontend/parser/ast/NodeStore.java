package org.pysymphony.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The immutable arena holding all nodes of one parsed file. Nodes are addressed by index;
 * the store also keeps each node's parent index so that upward queries never rescan the tree.
 * A store is safe to share between the merge and audit pipelines.
 */
public final class NodeStore {

    private final String path;
    private final String source;
    private final List<Node> nodes;
    private final int[] parents;
    private final int root;

    private NodeStore(String path, String source, List<Node> nodes, int root) {
        this.path = path;
        this.source = source;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.root = root;
        this.parents = new int[nodes.size()];
        Arrays.fill(parents, -1);
        for (int i = 0; i < this.nodes.size(); i++) {
            for (int child : this.nodes.get(i).children()) {
                parents[child] = i;
            }
        }
    }

    public String path() {
        return path;
    }

    public String source() {
        return source;
    }

    /**
     * @return The index of the {@link ModuleNode}.
     */
    public int root() {
        return root;
    }

    public ModuleNode module() {
        return (ModuleNode) nodes.get(root);
    }

    public int size() {
        return nodes.size();
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    /**
     * Returns the node at {@code index} if it has the given kind.
     * @return The node, or null for -1 or a node of another kind.
     */
    public <T extends Node> T getAs(int index, Class<T> type) {
        if (index < 0) {
            return null;
        }
        Node node = nodes.get(index);
        return type.isInstance(node) ? type.cast(node) : null;
    }

    /**
     * @return The parent index, or -1 for the root.
     */
    public int parentOf(int index) {
        return parents[index];
    }

    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return nodes.get(index).accept(index, visitor);
    }

    /**
     * @return The source text covered by {@code span}.
     */
    public String text(Span span) {
        return source.substring(span.start(), span.end());
    }

    public String text(int index) {
        return text(nodes.get(index).span());
    }

    /**
     * Mutable staging area used by the parser. Nodes may be replaced until {@link #build} freezes them.
     */
    public static final class Builder {
        private final List<Node> nodes = new ArrayList<>();

        public int add(Node node) {
            nodes.add(node);
            return nodes.size() - 1;
        }

        public Node get(int index) {
            return nodes.get(index);
        }

        public void set(int index, Node node) {
            nodes.set(index, node);
        }

        public NodeStore build(String path, String source, int root) {
            return new NodeStore(path, source, nodes, root);
        }
    }
}
