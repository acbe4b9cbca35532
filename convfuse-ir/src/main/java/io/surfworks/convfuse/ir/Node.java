package io.surfworks.convfuse.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.surfworks.convfuse.ir.Literals.Literal;

/**
 * An operation instance: a kind, ordered inputs, ordered outputs and
 * optionally nested blocks.
 *
 * <p>Lifecycle: a node is created detached by {@link Graph#create}, attached
 * with {@link Graph#insertNode} (or {@link #insertBefore}), and finally
 * {@link #destroy() destroyed}. Destruction is a two-phase operation: every
 * output must have lost all of its uses and every input must have been
 * removed with {@link #removeAllInputs()} beforehand. This lets callers
 * delete a set of nodes that reference each other without ever leaving a
 * dangling use behind.
 */
public final class Node {

    private final Graph graph;
    private final Symbol kind;
    private final List<Value> inputs = new ArrayList<>();
    private final List<Value> outputs = new ArrayList<>();
    private final List<Block> blocks = new ArrayList<>();
    private Literal literal;
    private Block owningBlock;
    private boolean destroyed;

    Node(Graph graph, Symbol kind) {
        this.graph = graph;
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public Symbol kind() {
        return kind;
    }

    public Graph owningGraph() {
        return graph;
    }

    /**
     * Returns the block this node is attached to, or null while detached.
     */
    public Block owningBlock() {
        return owningBlock;
    }

    void setOwningBlock(Block block) {
        this.owningBlock = block;
    }

    // ==================== Inputs ====================

    public List<Value> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public Value input(int i) {
        return inputs.get(i);
    }

    public Value addInput(Value value) {
        checkAlive();
        checkSameGraph(value);
        value.addUse(new Use(this, inputs.size()));
        inputs.add(value);
        return value;
    }

    public void replaceInput(int i, Value replacement) {
        checkAlive();
        checkSameGraph(replacement);
        Value old = inputs.get(i);
        old.removeUse(this, i);
        inputs.set(i, replacement);
        replacement.addUse(new Use(this, i));
    }

    /**
     * Replaces every occurrence of {@code from} among this node's inputs.
     */
    public void replaceInputWith(Value from, Value to) {
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i) == from) {
                replaceInput(i, to);
            }
        }
    }

    public void removeInput(int i) {
        checkAlive();
        Value old = inputs.remove(i);
        old.removeUse(this, i);
        for (int j = i; j < inputs.size(); j++) {
            inputs.get(j).shiftUse(this, j + 1, j);
        }
    }

    public void removeAllInputs() {
        for (int i = inputs.size() - 1; i >= 0; i--) {
            Value old = inputs.remove(i);
            old.removeUse(this, i);
        }
    }

    // ==================== Outputs ====================

    public List<Value> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public Value output(int i) {
        return outputs.get(i);
    }

    /**
     * Returns the only output of this node.
     *
     * @throws IllegalStateException if the node doesn't have exactly one output
     */
    public Value output() {
        if (outputs.size() != 1) {
            throw new IllegalStateException(kind + " has " + outputs.size() + " outputs, expected 1");
        }
        return outputs.get(0);
    }

    public Value addOutput() {
        checkAlive();
        Value v = new Value(graph.nextValueId(), this, outputs.size());
        outputs.add(v);
        return v;
    }

    /**
     * Returns true if any output of this node is used.
     */
    public boolean hasUses() {
        for (Value v : outputs) {
            if (v.hasUses()) {
                return true;
            }
        }
        return false;
    }

    // ==================== Blocks ====================

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public Block addBlock() {
        checkAlive();
        Block block = new Block(graph, this);
        blocks.add(block);
        return block;
    }

    // ==================== Constants ====================

    public boolean isConstant() {
        return kind.equals(Symbols.CONSTANT);
    }

    /**
     * Returns the literal held by a {@code prim::Constant} node.
     *
     * @throws IllegalStateException if this is not a constant node
     */
    public Literal literal() {
        if (!isConstant()) {
            throw new IllegalStateException(kind + " is not a constant");
        }
        return literal;
    }

    void setLiteral(Literal value) {
        this.literal = value;
    }

    // ==================== Placement ====================

    /**
     * Attaches this detached node to {@code anchor}'s block, right before it.
     */
    public Node insertBefore(Node anchor) {
        checkDetached();
        anchor.owningBlock().insertBefore(this, anchor);
        return this;
    }

    /**
     * Attaches this detached node to {@code anchor}'s block, right after it.
     */
    public Node insertAfter(Node anchor) {
        checkDetached();
        anchor.owningBlock().insertAfter(this, anchor);
        return this;
    }

    /**
     * Returns true if this node comes before {@code other} in the same block.
     */
    public boolean isBefore(Node other) {
        if (owningBlock == null || owningBlock != other.owningBlock) {
            throw new IllegalArgumentException("Nodes are not in the same block: " + kind + ", " + other.kind);
        }
        return owningBlock.indexOf(this) < owningBlock.indexOf(other);
    }

    // ==================== Destruction ====================

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Detaches and destroys this node, including any nested blocks.
     *
     * @throws IllegalStateException if an output still has uses or an input is still attached
     */
    public void destroy() {
        checkAlive();
        for (Value out : outputs) {
            if (out.hasUses()) {
                throw new IllegalStateException(String.format(
                        "Cannot destroy %s: output %%%s still has %d use(s)",
                        kind, out.name(), out.uses().size()));
            }
        }
        if (!inputs.isEmpty()) {
            throw new IllegalStateException(String.format(
                    "Cannot destroy %s: %d input(s) still attached, remove them first",
                    kind, inputs.size()));
        }
        for (Block block : blocks) {
            block.destroyContents();
        }
        if (owningBlock != null) {
            owningBlock.remove(this);
        }
        destroyed = true;
    }

    void markDestroyed() {
        destroyed = true;
    }

    private void checkAlive() {
        if (destroyed) {
            throw new IllegalStateException("Node " + kind + " has been destroyed");
        }
    }

    private void checkDetached() {
        checkAlive();
        if (owningBlock != null) {
            throw new IllegalStateException("Node " + kind + " is already attached to a block");
        }
    }

    private void checkSameGraph(Value value) {
        if (value.owningGraph() != graph) {
            throw new IllegalArgumentException("Value %" + value.name() + " belongs to another graph");
        }
    }

    @Override
    public String toString() {
        return GraphPrinter.printNode(this);
    }
}
