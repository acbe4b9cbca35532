package io.surfworks.convfuse.ir.rewrite;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Value;

/**
 * A structural occurrence of a match pattern in a graph.
 *
 * <p>Captures the anchor node, the matched nodes in pattern order and the
 * graph value bound to every named pattern value (parameters and node outputs).
 */
public final class Match {

    private final String patternName;
    private final Node anchor;
    private final List<Node> nodes;
    private final Map<String, Value> values;

    Match(String patternName, Node anchor, List<Node> nodes, Map<String, Value> values) {
        this.patternName = patternName;
        this.anchor = anchor;
        this.nodes = List.copyOf(nodes);
        this.values = Collections.unmodifiableMap(values);
    }

    public String patternName() {
        return patternName;
    }

    /**
     * Returns the node producing the matched output.
     */
    public Node anchor() {
        return anchor;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public Map<String, Value> values() {
        return values;
    }

    /**
     * Returns the graph value bound to a pattern value.
     *
     * @throws IllegalArgumentException if the pattern has no value of that name
     */
    public Value value(String name) {
        Value v = values.get(name);
        if (v == null) {
            throw new IllegalArgumentException("Pattern '" + patternName + "' has no value %" + name);
        }
        return v;
    }

    /**
     * Returns the literal behind a bound value if it is a {@code prim::Constant} output.
     */
    public Optional<Literal> constant(String name) {
        Node producer = value(name).node();
        if (!producer.isConstant()) {
            return Optional.empty();
        }
        return Optional.ofNullable(producer.literal());
    }

    public boolean includes(Node node) {
        return nodes.contains(node);
    }

    @Override
    public String toString() {
        return String.format("Match[pattern=%s, anchor=%s, nodes=%d]", patternName, anchor.kind(), nodes.size());
    }
}
