package io.surfworks.convfuse.fusion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.Literals.BoolLiteral;
import io.surfworks.convfuse.ir.Literals.ListLiteral;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.passes.GraphPass;
import io.surfworks.convfuse.ir.rewrite.Match;
import io.surfworks.convfuse.ir.rewrite.PatternGraph;
import io.surfworks.convfuse.ir.rewrite.PatternValue;
import io.surfworks.convfuse.ir.rewrite.RewritePattern;
import io.surfworks.convfuse.ir.rewrite.SubgraphRewriter;

/**
 * Rewrites non-transposed 2-D {@code aten::_convolution} calls into
 * {@code aten::conv2d}, so the prepack inserter only has one convolution
 * form to deal with.
 *
 * <p>Both the 12-operand form and the 13-operand form (trailing
 * {@code allow_tf32}) are handled.
 */
public final class ConvolutionNormalizer implements GraphPass {

    private static final List<String> OPERANDS = List.of(
            "input", "weight", "bias", "stride", "padding", "dilation", "transposed",
            "output_padding", "groups", "benchmark", "deterministic", "cudnn_enabled");

    private final SubgraphRewriter rewriter = new SubgraphRewriter()
            .registerRewritePattern(pattern("convolution_to_conv2d", false))
            .registerRewritePattern(pattern("convolution_tf32_to_conv2d", true));

    @Override
    public String name() {
        return "ConvolutionNormalizer";
    }

    @Override
    public int run(Graph graph) {
        return rewriter.runOnGraph(graph, ConvolutionNormalizer::isConv2d);
    }

    private static RewritePattern pattern(String name, boolean allowTf32) {
        List<String> operands = new ArrayList<>(OPERANDS);
        if (allowTf32) {
            operands.add("allow_tf32");
        }

        PatternGraph.Builder match = PatternGraph.builder();
        List<PatternValue> matchInputs = new ArrayList<>();
        for (String operand : operands) {
            matchInputs.add(match.param(operand));
        }
        PatternGraph matchGraph = match.build(match.node("res", null, Symbols.CONVOLUTION, matchInputs));

        PatternGraph.Builder replacement = PatternGraph.builder();
        List<PatternValue> params = new ArrayList<>();
        for (String operand : operands) {
            params.add(replacement.param(operand));
        }
        PatternGraph replacementGraph = replacement.build(replacement.node("res", Symbols.CONV2D,
                params.get(0), params.get(1), params.get(2), params.get(3),
                params.get(4), params.get(5), params.get(8)));

        return new RewritePattern(name, matchGraph, replacementGraph);
    }

    /**
     * Accepts matches whose {@code transposed} flag is the constant false and
     * whose stride, padding and dilation are constant pairs.
     */
    static boolean isConv2d(Match match) {
        Optional<Literal> transposed = match.constant("transposed");
        if (transposed.isEmpty() || !(transposed.get() instanceof BoolLiteral b) || b.value()) {
            return false;
        }
        return isPair(match, "stride") && isPair(match, "padding") && isPair(match, "dilation");
    }

    private static boolean isPair(Match match, String name) {
        Optional<Literal> value = match.constant(name);
        return value.isPresent() && value.get() instanceof ListLiteral list && list.values().size() == 2;
    }
}
