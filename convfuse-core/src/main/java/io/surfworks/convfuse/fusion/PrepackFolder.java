package io.surfworks.convfuse.fusion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Block;
import io.surfworks.convfuse.ir.CustomObject;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.InsertPoint;
import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Literals.ObjectLiteral;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Value;
import io.surfworks.convfuse.ir.passes.BlockVisitor;
import io.surfworks.convfuse.ir.passes.BlockWalker;
import io.surfworks.convfuse.ir.passes.DeadCodeElimination;
import io.surfworks.convfuse.ir.passes.GraphPass;
import io.surfworks.convfuse.ir.passes.NodeEvaluator;
import io.surfworks.convfuse.packed.PrepackedOps;

/**
 * Evaluates prepack nodes whose inputs are all constants and replaces them
 * with a constant holding the packed context.
 *
 * <p>The context produced by evaluation belongs to this compilation, so the
 * constant holds its weak form. Folded prepacks are removed once their block
 * has been walked: inputs are detached from all of them first, then they are
 * destroyed, then the block is swept for constants that only fed them.
 */
public final class PrepackFolder implements GraphPass {

    private static final Logger LOG = Logger.getLogger(PrepackFolder.class.getName());

    private final NodeEvaluator evaluator;
    private final DeadCodeElimination dce = new DeadCodeElimination();

    public PrepackFolder(NodeEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public String name() {
        return "PrepackFolder";
    }

    /**
     * @throws IllegalStateException if a prepack evaluates to anything but a single packed object
     */
    @Override
    public int run(Graph graph) {
        Map<Block, List<Node>> folded = new HashMap<>();
        int[] count = {0};
        BlockWalker.walk(graph, new BlockVisitor() {
            @Override
            public void visitNode(Node node) {
                if (node.kind().equals(PrepackedOps.CONV2D_PREPACK) && fold(graph, node)) {
                    folded.computeIfAbsent(node.owningBlock(), b -> new ArrayList<>()).add(node);
                    count[0]++;
                }
            }

            @Override
            public void exitBlock(Block block) {
                List<Node> nodes = folded.remove(block);
                if (nodes == null) {
                    return;
                }
                for (Node n : nodes) {
                    n.removeAllInputs();
                }
                for (Node n : nodes) {
                    n.destroy();
                }
                dce.run(block);
            }
        });
        if (count[0] > 0) {
            LOG.fine("Folded " + count[0] + " prepack node(s) into constants");
        }
        return count[0];
    }

    private boolean fold(Graph graph, Node prepack) {
        Optional<List<Literal>> outputs = evaluator.runNodeIfInputsAreConstant(prepack);
        if (outputs.isEmpty()) {
            return false;
        }
        if (outputs.get().size() != 1) {
            throw new IllegalStateException(PrepackedOps.CONV2D_PREPACK + " evaluated to "
                    + outputs.get().size() + " values, expected a single packed context");
        }
        Literal result = outputs.get().get(0);
        if (!(result instanceof ObjectLiteral object)) {
            throw new IllegalStateException(PrepackedOps.CONV2D_PREPACK + " evaluated to "
                    + result.toIrString() + ", expected a packed context");
        }
        CustomObject weak = object.value().toWeakReference();

        Value packed = prepack.output();
        try (InsertPoint ignored = graph.insertPointBefore(prepack)) {
            Value constant = graph.insertConstant(Literals.of(weak)).setType(packed.type());
            packed.replaceAllUsesWith(constant);
        }
        return true;
    }
}
