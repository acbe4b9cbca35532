package io.surfworks.convfuse.ir.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Value;
import io.surfworks.convfuse.ir.runtime.OperatorRegistry;

/**
 * Evaluates a single node at compile time when all of its inputs are constants.
 */
public final class NodeEvaluator {

    private static final Logger LOG = Logger.getLogger(NodeEvaluator.class.getName());

    private final OperatorRegistry registry;

    public NodeEvaluator(OperatorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Runs the node's kernel if every input is produced by a {@code prim::Constant}.
     *
     * <p>The returned list holds whatever the kernel produced; callers check
     * the arity they expect.
     *
     * @return the kernel outputs, or empty if an input is not constant, the
     *         operator has no kernel, or the kernel failed
     */
    public Optional<List<Literal>> runNodeIfInputsAreConstant(Node node) {
        if (!node.blocks().isEmpty() || !registry.supports(node.kind())) {
            return Optional.empty();
        }
        List<Literal> inputs = new ArrayList<>(node.inputs().size());
        for (Value v : node.inputs()) {
            Node producer = v.node();
            if (!producer.isConstant() || producer.literal() == null) {
                return Optional.empty();
            }
            inputs.add(producer.literal());
        }
        try {
            return Optional.of(registry.dispatch(node, inputs));
        } catch (RuntimeException e) {
            LOG.fine("Evaluating " + node.kind() + " failed: " + e.getMessage());
            return Optional.empty();
        }
    }

    public OperatorRegistry registry() {
        return registry;
    }
}
