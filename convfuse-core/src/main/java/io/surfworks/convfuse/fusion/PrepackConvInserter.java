package io.surfworks.convfuse.fusion;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Block;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.InsertPoint;
import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.ListLiteral;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Types;
import io.surfworks.convfuse.ir.Types.TensorType;
import io.surfworks.convfuse.ir.Value;
import io.surfworks.convfuse.ir.passes.BlockVisitor;
import io.surfworks.convfuse.ir.passes.BlockWalker;
import io.surfworks.convfuse.ir.passes.DeadCodeElimination;
import io.surfworks.convfuse.ir.passes.GraphPass;
import io.surfworks.convfuse.packed.PostOps;
import io.surfworks.convfuse.packed.PrepackedOps;

/**
 * Splits every eligible {@code aten::conv2d} into a prepack node, which
 * packs the weight and bias, and a run node, which applies the packed
 * convolution to the activation.
 *
 * <p>For
 * <pre>
 *   %y = aten::conv2d(%x, %w, %b, %stride, %padding, %dilation, %groups)
 * </pre>
 * the pass inserts, right before the convolution,
 * <pre>
 *   %size : int[] = prim::Constant[value=[1, 3, 8, 8]]()
 *   %attr : str = prim::Constant[value="none"]()
 *   %scalars : Scalar?[] = prim::Constant[value=[]]()
 *   %algorithm : str? = prim::Constant()
 *   %packed = mkldnn_prepacked::conv2d_prepack(%w, %b, %stride, %padding, %dilation, %groups,
 *                                              %size, %attr, %scalars, %algorithm)
 *   %y.1 = mkldnn_prepacked::conv2d_run(%x, %packed)
 * </pre>
 * and redirects the uses of {@code %y}. The old convolution is then removed
 * by dead-code elimination, which runs on each block once it has been walked.
 */
public final class PrepackConvInserter implements GraphPass {

    private static final Logger LOG = Logger.getLogger(PrepackConvInserter.class.getName());

    private final ConvEligibility eligibility;
    private final DeadCodeElimination dce = new DeadCodeElimination();

    public PrepackConvInserter(ConvEligibility eligibility) {
        this.eligibility = eligibility;
    }

    @Override
    public String name() {
        return "PrepackConvInserter";
    }

    @Override
    public int run(Graph graph) {
        int[] inserted = {0};
        BlockWalker.walk(graph, new BlockVisitor() {
            @Override
            public void visitNode(Node node) {
                if (node.kind().equals(Symbols.CONV2D) && insertFor(graph, node)) {
                    inserted[0]++;
                }
            }

            @Override
            public void exitBlock(Block block) {
                dce.run(block);
            }
        });
        return inserted[0];
    }

    private boolean insertFor(Graph graph, Node conv) {
        if (conv.inputs().size() != 7) {
            LOG.fine(() -> "Skipping " + conv.output() + ": expected 7 operands, got " + conv.inputs().size());
            return false;
        }
        if (!eligibility.isEligible(conv)) {
            return false;
        }
        Optional<List<Long>> inputSize = conv.input(0).type() instanceof TensorType t
                ? t.concreteSizes()
                : Optional.empty();
        if (inputSize.isEmpty()) {
            LOG.fine(() -> "Skipping " + conv.output() + ": activation sizes are not concrete");
            return false;
        }

        try (InsertPoint ignored = graph.insertPointBefore(conv)) {
            Value size = graph.insertConstant(Literals.intList(inputSize.get()));
            Value attr = graph.insertConstant(Literals.of(PostOps.NONE));
            Value scalars = graph.insertConstant(
                    new ListLiteral(List.of(), Types.optionalOf(Types.NUMBER)));
            Value algorithm = graph.insertConstant(Literals.NONE)
                    .setType(Types.optionalOf(Types.STRING));

            Node prepack = graph.create(PrepackedOps.CONV2D_PREPACK, List.of(
                    conv.input(1), conv.input(2), conv.input(3), conv.input(4), conv.input(5), conv.input(6),
                    size, attr, scalars, algorithm), 1);
            prepack.output().setType(PrepackedOps.CONV_OP_CONTEXT_TYPE);
            graph.insertNode(prepack);

            Node run = graph.create(PrepackedOps.CONV2D_RUN, List.of(conv.input(0), prepack.output()), 1);
            run.output().setType(conv.output().type());
            graph.insertNode(run);

            conv.output().replaceAllUsesWith(run.output());
        }
        LOG.fine(() -> "Inserted prepack/run pair for convolution of " + conv.input(0));
        return true;
    }
}
