package io.surfworks.convfuse.ir.rewrite;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Symbol;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Types.Type;

/**
 * A small structural graph used as the match or replacement side of a rewrite.
 *
 * <p>Pattern graphs are built from data, never parsed from text. Every value
 * is named; parameters are free and bind to whatever graph value sits in
 * their position, nodes match graph nodes of the same kind and arity.
 *
 * <p>Example, matching {@code relu(run(input, packed))}:
 * <pre>{@code
 * PatternGraph.Builder b = PatternGraph.builder();
 * PatternValue input = b.param("input");
 * PatternValue packed = b.param("packed");
 * PatternValue run = b.node("conv_out", RUN, input, packed);
 * PatternGraph pattern = b.build(b.node("res", Symbols.RELU, run));
 * }</pre>
 */
public final class PatternGraph {

    private final Map<String, PatternValue> parameters;
    private final List<PatternNode> nodes;
    private final PatternValue output;

    private PatternGraph(Map<String, PatternValue> parameters, List<PatternNode> nodes, PatternValue output) {
        this.parameters = Collections.unmodifiableMap(parameters);
        this.nodes = List.copyOf(nodes);
        this.output = output;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the parameters by name, in declaration order.
     */
    public Map<String, PatternValue> parameters() {
        return parameters;
    }

    /**
     * Returns the nodes in creation order, which is a topological order.
     */
    public List<PatternNode> nodes() {
        return nodes;
    }

    public PatternValue output() {
        return output;
    }

    /**
     * Returns the names of the parameters reachable from the output.
     */
    public Set<String> usedParameterNames() {
        Set<String> used = new HashSet<>();
        Set<PatternNode> reachable = reachableNodes();
        for (PatternNode node : reachable) {
            for (PatternValue in : node.inputs()) {
                if (in.isParameter()) {
                    used.add(in.name());
                }
            }
        }
        if (output.isParameter()) {
            used.add(output.name());
        }
        return used;
    }

    /**
     * Returns the nodes the output depends on.
     */
    public Set<PatternNode> reachableNodes() {
        Set<PatternNode> seen = new HashSet<>();
        List<PatternValue> work = new ArrayList<>();
        work.add(output);
        while (!work.isEmpty()) {
            PatternValue v = work.remove(work.size() - 1);
            PatternNode producer = v.producer();
            if (producer != null && seen.add(producer)) {
                work.addAll(producer.inputs());
            }
        }
        return seen;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("graph(");
        boolean first = true;
        for (PatternValue p : parameters.values()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(p);
            if (p.type() != null) {
                sb.append(" : ").append(p.type().toIrString());
            }
        }
        sb.append("):\n");
        for (PatternNode node : nodes) {
            PatternValue out = node.output();
            sb.append("  ").append(out);
            if (out.type() != null) {
                sb.append(" : ").append(out.type().toIrString());
            }
            sb.append(" = ").append(node.kind().toQualString());
            if (node.isConstant() && node.literal() != null && !node.literal().isNone()) {
                sb.append("[value=").append(node.literal().toIrString()).append("]");
            }
            sb.append("(");
            for (int i = 0; i < node.inputs().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(node.inputs().get(i));
            }
            sb.append(")\n");
        }
        sb.append("  return (").append(output).append(")\n");
        return sb.toString();
    }

    /**
     * Builder for pattern graphs. Values must be created before they are used,
     * so nodes end up in topological order.
     */
    public static final class Builder {

        private final Map<String, PatternValue> parameters = new LinkedHashMap<>();
        private final List<PatternNode> nodes = new ArrayList<>();
        private final Set<String> names = new HashSet<>();
        private boolean built;

        private Builder() {}

        public PatternValue param(String name) {
            return param(name, null);
        }

        public PatternValue param(String name, Type type) {
            claim(name);
            PatternValue value = new PatternValue(name, type, null);
            parameters.put(name, value);
            return value;
        }

        public PatternValue node(String name, Symbol kind, PatternValue... inputs) {
            return node(name, null, kind, Arrays.asList(inputs));
        }

        public PatternValue node(String name, Type type, Symbol kind, PatternValue... inputs) {
            return node(name, type, kind, Arrays.asList(inputs));
        }

        public PatternValue node(String name, Type type, Symbol kind, List<PatternValue> inputs) {
            Objects.requireNonNull(kind, "kind cannot be null");
            if (kind.equals(Symbols.CONSTANT)) {
                throw new PatternAuthoringException("Use constant() for prim::Constant pattern nodes");
            }
            return add(new PatternNode(kind, checkInputs(inputs), null, claim(name), type));
        }

        /**
         * Adds a {@code prim::Constant} node. In a match pattern it matches a
         * constant with an equal literal.
         */
        public PatternValue constant(String name, Type type, Literal literal) {
            Objects.requireNonNull(literal, "literal cannot be null");
            return add(new PatternNode(Symbols.CONSTANT, List.of(), literal, claim(name), type));
        }

        public PatternValue constant(String name, Literal literal) {
            return constant(name, null, literal);
        }

        public PatternGraph build(PatternValue output) {
            if (built) {
                throw new PatternAuthoringException("Builder already used");
            }
            if (!owns(output)) {
                throw new PatternAuthoringException("Output " + output + " does not belong to this pattern");
            }
            built = true;
            return new PatternGraph(new LinkedHashMap<>(parameters), nodes, output);
        }

        private PatternValue add(PatternNode node) {
            if (built) {
                throw new PatternAuthoringException("Builder already used");
            }
            nodes.add(node);
            return node.output();
        }

        private List<PatternValue> checkInputs(List<PatternValue> inputs) {
            for (PatternValue in : inputs) {
                if (!owns(in)) {
                    throw new PatternAuthoringException("Input " + in + " does not belong to this pattern");
                }
            }
            return inputs;
        }

        private boolean owns(PatternValue v) {
            if (v == null) {
                return false;
            }
            if (v.isParameter()) {
                return parameters.get(v.name()) == v;
            }
            return nodes.contains(v.producer());
        }

        private String claim(String name) {
            if (name == null || name.isEmpty()) {
                throw new PatternAuthoringException("Pattern values must be named");
            }
            if (!names.add(name)) {
                throw new PatternAuthoringException("Duplicate pattern value name: %" + name);
            }
            return name;
        }
    }
}
