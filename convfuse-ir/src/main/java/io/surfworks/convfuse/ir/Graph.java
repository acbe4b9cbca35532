package io.surfworks.convfuse.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Types.Type;

/**
 * A mutable, block-structured dataflow graph.
 *
 * <p>New nodes are created detached with {@link #create} and attached at the
 * current insert point with {@link #insertNode}. The insert point defaults to
 * the end of the top-level block and can be moved for a scope with
 * {@link #insertPointBefore(Node)}.
 *
 * <p>Graphs are not thread-safe; a pass owns the graph for its whole run.
 */
public final class Graph {

    private final Block block;
    private int nextValueId;
    private Block insertBlock;
    private Node insertAnchor;

    public Graph() {
        this.block = new Block(this, null);
        this.insertBlock = block;
    }

    public Block block() {
        return block;
    }

    public List<Value> inputs() {
        return block.inputs();
    }

    public List<Value> outputs() {
        return block.outputs();
    }

    public Value addInput(String name, Type type) {
        return block.addInput(name, type);
    }

    public void registerOutput(Value value) {
        block.registerOutput(value);
    }

    int nextValueId() {
        return nextValueId++;
    }

    // ==================== Node creation ====================

    /**
     * Creates a detached node with the given number of outputs.
     */
    public Node create(Symbol kind, int numOutputs) {
        Node node = new Node(this, kind);
        for (int i = 0; i < numOutputs; i++) {
            node.addOutput();
        }
        return node;
    }

    /**
     * Creates a detached node with the given inputs and number of outputs.
     */
    public Node create(Symbol kind, List<Value> inputs, int numOutputs) {
        Node node = create(kind, numOutputs);
        for (Value v : inputs) {
            node.addInput(v);
        }
        return node;
    }

    /**
     * Attaches a detached node at the current insert point.
     */
    public Node insertNode(Node node) {
        if (insertAnchor != null) {
            node.insertBefore(insertAnchor);
        } else {
            insertBlock.appendNode(node);
        }
        return node;
    }

    /**
     * Creates a single-output node and inserts it at the current insert point.
     *
     * @return the new node's output
     */
    public Value insert(Symbol kind, List<Value> inputs) {
        return insertNode(create(kind, inputs, 1)).output();
    }

    /**
     * Inserts a {@code prim::Constant} node holding the literal.
     *
     * @return the constant's output, typed after the literal
     */
    public Value insertConstant(Literal literal) {
        Node node = create(Symbols.CONSTANT, 1);
        node.setLiteral(literal);
        node.output().setType(literal.type());
        insertNode(node);
        return node.output();
    }

    /**
     * Creates a detached constant node; the caller attaches it.
     */
    public Node createConstant(Literal literal) {
        Node node = create(Symbols.CONSTANT, 1);
        node.setLiteral(literal);
        node.output().setType(literal.type());
        return node;
    }

    // ==================== Insert points ====================

    /**
     * Moves the insert point to just before {@code node} until the returned guard is closed.
     */
    public InsertPoint insertPointBefore(Node node) {
        if (node.owningBlock() == null) {
            throw new IllegalArgumentException("Cannot insert before detached node " + node.kind());
        }
        InsertPoint guard = new InsertPoint(this, insertBlock, insertAnchor);
        insertBlock = node.owningBlock();
        insertAnchor = node;
        return guard;
    }

    /**
     * Moves the insert point to the end of {@code target} until the returned guard is closed.
     */
    public InsertPoint insertPointAtEnd(Block target) {
        InsertPoint guard = new InsertPoint(this, insertBlock, insertAnchor);
        insertBlock = target;
        insertAnchor = null;
        return guard;
    }

    void restoreInsertPoint(Block previousBlock, Node previousAnchor) {
        this.insertBlock = previousBlock;
        this.insertAnchor = previousAnchor;
    }

    // ==================== Queries ====================

    /**
     * Returns every attached node, depth-first, nested blocks right after their owner.
     */
    public List<Node> allNodes() {
        List<Node> result = new ArrayList<>();
        collect(block, result);
        return result;
    }

    private static void collect(Block b, List<Node> out) {
        for (Node n : b.nodes()) {
            out.add(n);
            for (Block nested : n.blocks()) {
                collect(nested, out);
            }
        }
    }

    /**
     * Returns the attached nodes of the given kind, in {@link #allNodes()} order.
     */
    public List<Node> findAll(Symbol kind) {
        return allNodes().stream().filter(n -> n.kind().equals(kind)).toList();
    }

    // ==================== Verification ====================

    /**
     * Checks use-def consistency and that every input is defined before use
     * in the same or an enclosing block.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void lint() {
        Deque<Set<Value>> scopes = new ArrayDeque<>();
        lintBlock(block, scopes);
    }

    private void lintBlock(Block b, Deque<Set<Value>> scopes) {
        Set<Value> scope = new HashSet<>(b.inputs());
        scopes.push(scope);
        for (Node n : b.nodes()) {
            if (n.isDestroyed() || n.owningBlock() != b) {
                throw new IllegalStateException("Block contains a stale node: " + n.kind());
            }
            lintInputs(n, scopes);
            for (Block nested : n.blocks()) {
                lintBlock(nested, scopes);
            }
            for (Value out : n.outputs()) {
                lintUses(out);
                scope.add(out);
            }
        }
        for (Value in : b.inputs()) {
            lintUses(in);
        }
        lintInputs(b.returnNode(), scopes);
        scopes.pop();
    }

    private static void lintInputs(Node n, Deque<Set<Value>> scopes) {
        for (int i = 0; i < n.inputs().size(); i++) {
            Value v = n.input(i);
            if (v.node().isDestroyed()) {
                throw new IllegalStateException(
                        n.kind() + " input " + i + " (%" + v.name() + ") is produced by a destroyed node");
            }
            boolean visible = false;
            for (Set<Value> s : scopes) {
                if (s.contains(v)) {
                    visible = true;
                    break;
                }
            }
            if (!visible) {
                throw new IllegalStateException(
                        n.kind() + " input " + i + " (%" + v.name() + ") is not defined before its use");
            }
            if (!v.uses().contains(new Use(n, i))) {
                throw new IllegalStateException(
                        "%" + v.name() + " is missing the use by " + n.kind() + " input " + i);
            }
        }
    }

    private static void lintUses(Value v) {
        for (Use use : v.uses()) {
            Node user = use.user();
            if (user.isDestroyed()) {
                throw new IllegalStateException("%" + v.name() + " is used by destroyed node " + user.kind());
            }
            if (use.offset() >= user.inputs().size() || user.input(use.offset()) != v) {
                throw new IllegalStateException(
                        "%" + v.name() + " records a stale use at " + user.kind() + " input " + use.offset());
            }
        }
    }

    @Override
    public String toString() {
        return GraphPrinter.print(this);
    }
}
