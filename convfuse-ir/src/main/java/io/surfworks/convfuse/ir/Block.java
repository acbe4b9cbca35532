package io.surfworks.convfuse.ir;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.convfuse.ir.Types.Type;

/**
 * An ordered sequence of nodes with inputs and outputs.
 *
 * <p>Block inputs are the outputs of a hidden {@code prim::Param} node and
 * block outputs are the inputs of a hidden {@code prim::Return} node, so
 * both take part in the use-def graph like any other value.
 */
public final class Block {

    private final Graph graph;
    private final Node owningNode;
    private final List<Node> nodes = new ArrayList<>();
    private final Node paramNode;
    private final Node returnNode;

    Block(Graph graph, Node owningNode) {
        this.graph = graph;
        this.owningNode = owningNode;
        this.paramNode = new Node(graph, Symbols.PARAM);
        this.returnNode = new Node(graph, Symbols.RETURN);
        paramNode.setOwningBlock(this);
        returnNode.setOwningBlock(this);
    }

    public Graph owningGraph() {
        return graph;
    }

    /**
     * Returns the node owning this block, or null for the graph's top-level block.
     */
    public Node owningNode() {
        return owningNode;
    }

    /**
     * Returns a snapshot of the nodes in order.
     *
     * <p>The snapshot stays valid while the block is mutated; callers should
     * skip entries that have been {@link Node#isDestroyed() destroyed} since.
     */
    public List<Node> nodes() {
        return List.copyOf(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<Value> inputs() {
        return paramNode.outputs();
    }

    public List<Value> outputs() {
        return returnNode.inputs();
    }

    public Node paramNode() {
        return paramNode;
    }

    public Node returnNode() {
        return returnNode;
    }

    public Value addInput(String name, Type type) {
        Value v = paramNode.addOutput();
        v.setDebugName(name);
        v.setType(type);
        return v;
    }

    public void registerOutput(Value value) {
        returnNode.addInput(value);
    }

    public Node appendNode(Node node) {
        if (node.owningBlock() != null) {
            throw new IllegalStateException("Node " + node.kind() + " is already attached");
        }
        nodes.add(node);
        node.setOwningBlock(this);
        return node;
    }

    int indexOf(Node node) {
        int idx = nodes.indexOf(node);
        if (idx < 0) {
            throw new IllegalArgumentException("Node " + node.kind() + " is not in this block");
        }
        return idx;
    }

    void insertBefore(Node node, Node anchor) {
        nodes.add(indexOf(anchor), node);
        node.setOwningBlock(this);
    }

    void insertAfter(Node node, Node anchor) {
        nodes.add(indexOf(anchor) + 1, node);
        node.setOwningBlock(this);
    }

    void remove(Node node) {
        nodes.remove(indexOf(node));
        node.setOwningBlock(null);
    }

    /**
     * Tears down every node of this block; used when the owning node is destroyed.
     */
    void destroyContents() {
        returnNode.removeAllInputs();
        for (Node node : nodes) {
            node.removeAllInputs();
            for (Block nested : node.blocks()) {
                nested.destroyContents();
            }
        }
        for (int i = nodes.size() - 1; i >= 0; i--) {
            Node node = nodes.get(i);
            node.setOwningBlock(null);
            node.markDestroyed();
        }
        nodes.clear();
    }
}
