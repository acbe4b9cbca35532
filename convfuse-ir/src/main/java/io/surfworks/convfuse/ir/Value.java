package io.surfworks.convfuse.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.surfworks.convfuse.ir.Types.Type;

/**
 * A typed edge of the use-def graph.
 *
 * <p>A value is owned by the node that outputs it (block inputs are owned by
 * the block's {@code prim::Param} node) and referenced by any number of
 * consuming nodes, which are tracked in its use list.
 */
public final class Value {

    private final int id;
    private final Node node;
    private final int offset;
    private final List<Use> uses = new ArrayList<>();
    private String debugName;
    private Type type;

    Value(int id, Node node, int offset) {
        this.id = id;
        this.node = node;
        this.offset = offset;
        this.type = Types.TensorType.unknown();
    }

    public int id() {
        return id;
    }

    /**
     * Returns the node producing this value.
     */
    public Node node() {
        return node;
    }

    /**
     * Returns the output index of this value within its producing node.
     */
    public int offset() {
        return offset;
    }

    public Type type() {
        return type;
    }

    public Value setType(Type newType) {
        this.type = Objects.requireNonNull(newType, "type cannot be null");
        return this;
    }

    public String debugName() {
        return debugName;
    }

    public Value setDebugName(String name) {
        this.debugName = name;
        return this;
    }

    public List<Use> uses() {
        return Collections.unmodifiableList(uses);
    }

    public boolean hasUses() {
        return !uses.isEmpty();
    }

    public Graph owningGraph() {
        return node.owningGraph();
    }

    /**
     * Redirects every use of this value to {@code replacement}.
     *
     * @param replacement the value that takes over all uses
     * @throws IllegalArgumentException if the replacement belongs to another graph or is this value
     */
    public void replaceAllUsesWith(Value replacement) {
        if (replacement == this) {
            throw new IllegalArgumentException("Cannot replace %" + name() + " with itself");
        }
        if (replacement.owningGraph() != owningGraph()) {
            throw new IllegalArgumentException("Replacement %" + replacement.name() + " belongs to another graph");
        }
        List<Use> snapshot = new ArrayList<>(uses);
        for (Use use : snapshot) {
            use.user().replaceInput(use.offset(), replacement);
        }
    }

    /**
     * Returns the debug name if set, otherwise the numeric id.
     */
    public String name() {
        return debugName != null ? debugName : String.valueOf(id);
    }

    void addUse(Use use) {
        uses.add(use);
    }

    void removeUse(Node user, int inputOffset) {
        for (int i = 0; i < uses.size(); i++) {
            Use u = uses.get(i);
            if (u.user() == user && u.offset() == inputOffset) {
                uses.remove(i);
                return;
            }
        }
        throw new IllegalStateException("No use of %" + name() + " at " + user.kind() + " input " + inputOffset);
    }

    void shiftUse(Node user, int from, int to) {
        for (int i = 0; i < uses.size(); i++) {
            Use u = uses.get(i);
            if (u.user() == user && u.offset() == from) {
                uses.set(i, new Use(user, to));
                return;
            }
        }
        throw new IllegalStateException("No use of %" + name() + " at " + user.kind() + " input " + from);
    }

    @Override
    public String toString() {
        return "%" + name() + " : " + type.toIrString();
    }
}
