package io.surfworks.convfuse.ir.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.convfuse.ir.Block;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Value;

/**
 * Executes a {@link Graph} with an {@link OperatorRegistry}.
 *
 * <p>The interpreter binds graph inputs, walks nodes in block order,
 * evaluates {@code prim::Constant} and {@code prim::If} itself and dispatches
 * every other node to its kernel.
 *
 * <p>Example usage:
 * <pre>{@code
 * GraphInterpreter interpreter = new GraphInterpreter(OperatorRegistry.withStandardOperators());
 * List<Tensor> outputs = interpreter.runTensors(graph, input);
 * }</pre>
 */
public final class GraphInterpreter {

    private final OperatorRegistry registry;

    /**
     * Create an interpreter using the given registry.
     *
     * @param registry The kernels to execute operators with
     */
    public GraphInterpreter(OperatorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Execute the graph with the given inputs.
     *
     * @param graph  The graph to execute
     * @param inputs Input values (count must match the graph inputs)
     * @return Output values, one per graph output
     * @throws IllegalArgumentException if the input count doesn't match
     * @throws UnsupportedOperationException if an operator has no kernel
     */
    public List<Literal> run(Graph graph, List<Literal> inputs) {
        if (inputs.size() != graph.inputs().size()) {
            throw new IllegalArgumentException(
                    "Expected " + graph.inputs().size() + " inputs, got " + inputs.size());
        }
        Map<Value, Literal> env = new HashMap<>();
        for (int i = 0; i < inputs.size(); i++) {
            env.put(graph.inputs().get(i), inputs.get(i));
        }
        return runBlock(graph.block(), env);
    }

    /**
     * Execute a graph whose inputs and outputs are all tensors.
     */
    public List<Tensor> runTensors(Graph graph, Tensor... inputs) {
        List<Literal> literals = new ArrayList<>(inputs.length);
        for (Tensor t : inputs) {
            literals.add(Literals.of(t));
        }
        List<Tensor> outputs = new ArrayList<>();
        for (Literal out : run(graph, literals)) {
            outputs.add(out.toTensor());
        }
        return outputs;
    }

    private List<Literal> runBlock(Block block, Map<Value, Literal> env) {
        for (Node node : block.nodes()) {
            List<Literal> outputs = runNode(node, env);
            if (outputs.size() != node.outputs().size()) {
                throw new IllegalStateException(
                        "Operation " + node.kind() + " returned " + outputs.size() +
                        " outputs but expected " + node.outputs().size());
            }
            for (int i = 0; i < outputs.size(); i++) {
                env.put(node.output(i), outputs.get(i));
            }
        }
        List<Literal> results = new ArrayList<>();
        for (Value v : block.outputs()) {
            results.add(lookup(env, v, block.returnNode()));
        }
        return results;
    }

    private List<Literal> runNode(Node node, Map<Value, Literal> env) {
        if (node.isConstant()) {
            return List.of(node.literal());
        }
        if (node.kind().equals(Symbols.IF)) {
            boolean condition = lookup(env, node.input(0), node).toBool();
            Block taken = node.blocks().get(condition ? 0 : 1);
            return runBlock(taken, env);
        }

        List<Literal> inputs = new ArrayList<>(node.inputs().size());
        for (Value v : node.inputs()) {
            inputs.add(lookup(env, v, node));
        }
        return registry.dispatch(node, inputs);
    }

    private static Literal lookup(Map<Value, Literal> env, Value v, Node user) {
        Literal literal = env.get(v);
        if (literal == null) {
            throw new IllegalStateException(
                    "Value %" + v.name() + " has not been computed when executing " + user.kind());
        }
        return literal;
    }

    /**
     * Get the registry used by this interpreter.
     */
    public OperatorRegistry registry() {
        return registry;
    }
}
