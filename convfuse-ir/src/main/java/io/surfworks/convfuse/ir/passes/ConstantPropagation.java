package io.surfworks.convfuse.ir.passes;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.InsertPoint;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Types.ClassType;
import io.surfworks.convfuse.ir.Types.TensorType;
import io.surfworks.convfuse.ir.Value;

/**
 * Replaces pure nodes whose inputs are all constants by constants holding their result.
 *
 * <p>Nodes that produce custom objects are left alone: packing them into
 * constants is the job of a dedicated folding pass that knows how to detach
 * them from their producer. Nodes with nested blocks and operators without a
 * registered pure kernel are skipped too. Dead code is removed afterwards.
 */
public final class ConstantPropagation implements GraphPass {

    private static final Logger LOG = Logger.getLogger(ConstantPropagation.class.getName());

    private final NodeEvaluator evaluator;

    public ConstantPropagation(NodeEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public String name() {
        return "ConstantPropagation";
    }

    @Override
    public int run(Graph graph) {
        int[] folded = {0};
        BlockWalker.walk(graph, node -> {
            if (tryFold(graph, node)) {
                folded[0]++;
            }
        });
        new DeadCodeElimination().run(graph);
        if (folded[0] > 0) {
            LOG.fine("Folded " + folded[0] + " node(s) into constants");
        }
        return folded[0];
    }

    private boolean tryFold(Graph graph, Node node) {
        if (node.isConstant() || node.outputs().isEmpty() || !node.blocks().isEmpty()) {
            return false;
        }
        if (!evaluator.registry().isPure(node.kind())) {
            return false;
        }
        for (Value out : node.outputs()) {
            if (out.type() instanceof ClassType) {
                return false;
            }
        }

        Optional<List<Literal>> result = evaluator.runNodeIfInputsAreConstant(node);
        if (result.isEmpty()) {
            return false;
        }
        List<Literal> outputs = result.get();
        if (outputs.size() != node.outputs().size()) {
            throw new IllegalStateException(node.kind() + " evaluated to " + outputs.size()
                    + " values but has " + node.outputs().size() + " outputs");
        }

        try (InsertPoint ignored = graph.insertPointBefore(node)) {
            for (int i = 0; i < outputs.size(); i++) {
                Value original = node.output(i);
                Literal literal = outputs.get(i);
                Value constant = graph.insertConstant(literal);
                if (!(original.type() instanceof TensorType)) {
                    constant.setType(original.type());
                }
                original.replaceAllUsesWith(constant);
            }
        }
        node.removeAllInputs();
        node.destroy();
        return true;
    }
}
