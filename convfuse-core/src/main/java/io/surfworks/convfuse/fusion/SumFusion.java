package io.surfworks.convfuse.fusion;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.FloatLiteral;
import io.surfworks.convfuse.ir.Literals.IntLiteral;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Types;
import io.surfworks.convfuse.ir.Types.TensorType;
import io.surfworks.convfuse.ir.passes.GraphPass;
import io.surfworks.convfuse.ir.rewrite.Match;
import io.surfworks.convfuse.ir.rewrite.MatchFilter;
import io.surfworks.convfuse.ir.rewrite.PatternGraph;
import io.surfworks.convfuse.ir.rewrite.PatternValue;
import io.surfworks.convfuse.ir.rewrite.RewritePattern;
import io.surfworks.convfuse.ir.rewrite.SubgraphRewriter;
import io.surfworks.convfuse.packed.PostOps;
import io.surfworks.convfuse.packed.PrepackedOps;

import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.ALGORITHM_PLACEHOLDER;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.ATTR_PLACEHOLDER;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.BIAS;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.DILATION;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.GROUPS;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.INPUT;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.INPUT_SIZE;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.PADDING;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.SCALARS_PLACEHOLDER;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.STRIDE;
import static io.surfworks.convfuse.fusion.PostOpPatternTemplates.WEIGHT;

/**
 * Folds a residual addition into a packed convolution.
 *
 * <p>Three rewrites run in order:
 * <ol>
 *   <li>{@code add(conv2d_run(...), accumu, alpha)} becomes
 *       {@code conv2d_sum_run(input, accumu, prepack(..., "sum", [alpha], ...))};</li>
 *   <li>{@code add(accumu, conv2d_run(...), alpha)} becomes the same when alpha is 1;</li>
 *   <li>{@code relu(conv2d_sum_run(...))} with attribute {@code "sum"} becomes a
 *       sum run with attribute {@code "sum_relu"}.</li>
 * </ol>
 *
 * <p>The matcher sees {@code add} as an ordinary operator, so when both
 * operands of an add are packed convolution results either one could be taken
 * for the accumulator. The first two rewrites therefore only accept a match
 * when the accumulator slot is not itself produced by a run or sum-run node.
 */
public final class SumFusion implements GraphPass {

    private static final Logger LOG = Logger.getLogger(SumFusion.class.getName());

    static final String ACCUMU = "accumu";
    static final String ALPHA = "alpha";
    static final String RUN_OUTPUT = "x";

    private static final MatchFilter NO_POST_OP =
            PostOpPatternTemplates.attributeIs(ATTR_PLACEHOLDER, PostOps.NONE);
    private static final MatchFilter SUM_ATTR =
            PostOpPatternTemplates.attributeIs(ATTR_PLACEHOLDER, PostOps.SUM);

    private final SubgraphRewriter accumulatorOnRight = new SubgraphRewriter()
            .registerRewritePattern(new RewritePattern("conv2d_sum_v1", addPattern(false), sumReplacement()));
    private final SubgraphRewriter accumulatorOnLeft = new SubgraphRewriter()
            .registerRewritePattern(new RewritePattern("conv2d_sum_v2", addPattern(true), sumReplacement()));
    private final SubgraphRewriter sumRelu = new SubgraphRewriter()
            .registerRewritePattern(new RewritePattern("conv2d_sum_relu", sumReluPattern(), sumReluReplacement()));

    @Override
    public String name() {
        return "SumFusion";
    }

    @Override
    public int run(Graph graph) {
        int v1 = accumulatorOnRight.runOnGraph(graph, SumFusion::accumulatorOnRight);
        int v2 = accumulatorOnLeft.runOnGraph(graph, SumFusion::accumulatorOnLeft);
        int relu = sumRelu.runOnGraph(graph, SumFusion::attributeIsSum);
        if (v1 + v2 + relu > 0) {
            LOG.fine(String.format("Fused %d add(conv, accumu), %d add(accumu, conv) and %d sum+relu", v1, v2, relu));
        }
        return v1 + v2 + relu;
    }

    static boolean accumulatorOnRight(Match match) {
        return !producedByRun(match.anchor(), 1) && accumulatorFits(match) && NO_POST_OP.test(match);
    }

    static boolean accumulatorOnLeft(Match match) {
        return !producedByRun(match.anchor(), 0) && accumulatorFits(match)
                && isOne(match.constant(ALPHA)) && NO_POST_OP.test(match);
    }

    static boolean attributeIsSum(Match match) {
        return SUM_ATTR.test(match);
    }

    private static boolean producedByRun(Node add, int operand) {
        return PrepackedOps.isRun(add.input(operand).node().kind());
    }

    /**
     * The accumulator must be a tensor, and of the run's size when both sizes are known:
     * the sum run neither adds scalars nor broadcasts.
     */
    static boolean accumulatorFits(Match match) {
        if (!(match.value(ACCUMU).type() instanceof TensorType accumu)) {
            return false;
        }
        if (!(match.value(RUN_OUTPUT).type() instanceof TensorType conv)) {
            return true;
        }
        Optional<List<Long>> accumuSizes = accumu.concreteSizes();
        Optional<List<Long>> convSizes = conv.concreteSizes();
        return accumuSizes.isEmpty() || convSizes.isEmpty() || accumuSizes.get().equals(convSizes.get());
    }

    private static boolean isOne(Optional<Literal> alpha) {
        if (alpha.isEmpty()) {
            return false;
        }
        Literal literal = alpha.get();
        return (literal instanceof IntLiteral i && i.value() == 1)
                || (literal instanceof FloatLiteral f && f.value() == 1.0);
    }

    // ==================== Patterns ====================

    private static Map<String, PatternValue> convParameters(PatternGraph.Builder b) {
        Map<String, PatternValue> params = new LinkedHashMap<>();
        for (String name : new String[] {INPUT, WEIGHT, BIAS, ACCUMU, STRIDE, PADDING, DILATION, GROUPS,
                INPUT_SIZE, ATTR_PLACEHOLDER, SCALARS_PLACEHOLDER, ALGORITHM_PLACEHOLDER}) {
            params.put(name, b.param(name));
        }
        return params;
    }

    private static PatternValue prepack(PatternGraph.Builder b, Map<String, PatternValue> p,
                                        PatternValue attr, PatternValue scalars, boolean typed) {
        return b.node("packed_weight", typed ? PrepackedOps.CONV_OP_CONTEXT_TYPE : null, PrepackedOps.CONV2D_PREPACK,
                p.get(WEIGHT), p.get(BIAS), p.get(STRIDE), p.get(PADDING), p.get(DILATION), p.get(GROUPS),
                p.get(INPUT_SIZE), attr, scalars, p.get(ALGORITHM_PLACEHOLDER));
    }

    static PatternGraph addPattern(boolean accumulatorFirst) {
        PatternGraph.Builder b = PatternGraph.builder();
        Map<String, PatternValue> p = convParameters(b);
        PatternValue alpha = b.param(ALPHA);
        PatternValue packed = prepack(b, p, p.get(ATTR_PLACEHOLDER), p.get(SCALARS_PLACEHOLDER), false);
        PatternValue x = b.node(RUN_OUTPUT, PrepackedOps.CONV2D_RUN, p.get(INPUT), packed);
        PatternValue res = accumulatorFirst
                ? b.node("res", Symbols.ADD, p.get(ACCUMU), x, alpha)
                : b.node("res", Symbols.ADD, x, p.get(ACCUMU), alpha);
        return b.build(res);
    }

    static PatternGraph sumReplacement() {
        PatternGraph.Builder b = PatternGraph.builder();
        Map<String, PatternValue> p = convParameters(b);
        PatternValue alpha = b.param(ALPHA);
        PatternValue attr = b.constant("attr", Types.STRING, Literals.of(PostOps.SUM));
        PatternValue scalars = b.node("scalars", PostOpPatternTemplates.SCALAR_LIST, Symbols.LIST_CONSTRUCT, alpha);
        PatternValue packed = prepack(b, p, attr, scalars, true);
        return b.build(b.node("res", PrepackedOps.CONV2D_SUM_RUN, p.get(INPUT), p.get(ACCUMU), packed));
    }

    static PatternGraph sumReluPattern() {
        PatternGraph.Builder b = PatternGraph.builder();
        Map<String, PatternValue> p = convParameters(b);
        PatternValue packed = prepack(b, p, p.get(ATTR_PLACEHOLDER), p.get(SCALARS_PLACEHOLDER), false);
        PatternValue x = b.node(RUN_OUTPUT, PrepackedOps.CONV2D_SUM_RUN, p.get(INPUT), p.get(ACCUMU), packed);
        return b.build(b.node("res", Symbols.RELU, x));
    }

    static PatternGraph sumReluReplacement() {
        PatternGraph.Builder b = PatternGraph.builder();
        Map<String, PatternValue> p = convParameters(b);
        PatternValue attr = b.constant("attr", Types.STRING, Literals.of(PostOps.SUM_RELU));
        PatternValue packed = prepack(b, p, attr, p.get(SCALARS_PLACEHOLDER), true);
        return b.build(b.node("res", PrepackedOps.CONV2D_SUM_RUN, p.get(INPUT), p.get(ACCUMU), packed));
    }
}
