package io.surfworks.convfuse.fusion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Literals.StringLiteral;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Types;
import io.surfworks.convfuse.ir.Types.Type;
import io.surfworks.convfuse.ir.rewrite.MatchFilter;
import io.surfworks.convfuse.ir.rewrite.PatternAuthoringException;
import io.surfworks.convfuse.ir.rewrite.PatternGraph;
import io.surfworks.convfuse.ir.rewrite.PatternValue;
import io.surfworks.convfuse.ir.rewrite.RewritePattern;
import io.surfworks.convfuse.packed.PostOps;
import io.surfworks.convfuse.packed.PrepackedOps;

/**
 * Builds the match and replacement pattern graphs for a {@link PostOpRule}.
 *
 * <p>For a rule {@code op} with operands {@code a, b} the match is
 * <pre>
 *   %packed_weight_bias = conv2d_prepack(%weight, %bias, %stride, %padding, %dilation, %groups,
 *                                        %input_size, %attr_placeholder, %scalars_placeholder,
 *                                        %algorithm_placeholder)
 *   %conv2d_res = conv2d_run(%input, %packed_weight_bias)
 *   %res = aten::op(%conv2d_res, %a, %b)
 * </pre>
 * and the replacement is
 * <pre>
 *   %attr : str = prim::Constant[value="op"]()
 *   %scalars : Scalar?[] = prim::ListConstruct(%a, %b)
 *   %algorithm : str? = prim::Constant()
 *   %packed_weight_bias = conv2d_prepack(%weight, %bias, %stride, %padding, %dilation, %groups,
 *                                        %input_size, %attr, %scalars, %algorithm)
 *   %res = conv2d_run(%input, %packed_weight_bias)
 * </pre>
 * When the rule has an algorithm operand it takes the place of the
 * {@code None} algorithm constant.
 */
public final class PostOpPatternTemplates {

    static final String INPUT = "input";
    static final String WEIGHT = "weight";
    static final String BIAS = "bias";
    static final String STRIDE = "stride";
    static final String PADDING = "padding";
    static final String DILATION = "dilation";
    static final String GROUPS = "groups";
    static final String INPUT_SIZE = "input_size";
    static final String ATTR_PLACEHOLDER = "attr_placeholder";
    static final String SCALARS_PLACEHOLDER = "scalars_placeholder";
    static final String ALGORITHM_PLACEHOLDER = "algorithm_placeholder";

    static final Type SCALAR_LIST = Types.listOf(Types.optionalOf(Types.NUMBER));
    static final Type OPTIONAL_STRING = Types.optionalOf(Types.STRING);

    /** Names the templates use themselves; rule operands may not reuse them. */
    static final Set<String> RESERVED_NAMES = Set.of(
            INPUT, WEIGHT, BIAS, STRIDE, PADDING, DILATION, GROUPS, INPUT_SIZE,
            ATTR_PLACEHOLDER, SCALARS_PLACEHOLDER, ALGORITHM_PLACEHOLDER,
            "packed_weight_bias", "conv2d_res", "res", "attr", "scalars", "algorithm");

    private PostOpPatternTemplates() {}

    /**
     * The pattern that fuses the rule's operator into a preceding packed convolution.
     *
     * @throws PatternAuthoringException for the {@code none} sentinel
     */
    public static RewritePattern rewritePattern(PostOpRule rule) {
        if (rule.isSentinel()) {
            throw new PatternAuthoringException("The '" + PostOps.NONE + "' entry has no rewrite");
        }
        return new RewritePattern("conv2d_" + rule.name(), matchPattern(rule), replacementPattern(rule));
    }

    /**
     * Filter the rewrite runs with: the prepack must not carry a post-op yet,
     * and the rule's own filter must accept the match.
     */
    public static MatchFilter filterFor(PostOpRule rule) {
        return attributeIs(ATTR_PLACEHOLDER, PostOps.NONE).and(rule.filterOrAlways());
    }

    /**
     * Accepts matches where the named value is the constant string {@code expected}.
     */
    public static MatchFilter attributeIs(String valueName, String expected) {
        return match -> {
            Optional<Literal> value = match.constant(valueName);
            return value.isPresent()
                    && value.get() instanceof StringLiteral s
                    && s.value().equals(expected);
        };
    }

    public static PatternGraph matchPattern(PostOpRule rule) {
        PatternGraph.Builder b = PatternGraph.builder();
        Map<String, PatternValue> params = declareParameters(b, rule);

        PatternValue packed = b.node("packed_weight_bias", PrepackedOps.CONV2D_PREPACK,
                params.get(WEIGHT), params.get(BIAS), params.get(STRIDE), params.get(PADDING),
                params.get(DILATION), params.get(GROUPS), params.get(INPUT_SIZE),
                params.get(ATTR_PLACEHOLDER), params.get(SCALARS_PLACEHOLDER), params.get(ALGORITHM_PLACEHOLDER));
        PatternValue conv = b.node("conv2d_res", PrepackedOps.CONV2D_RUN, params.get(INPUT), packed);

        List<PatternValue> opInputs = new ArrayList<>();
        opInputs.add(conv);
        for (String operand : rule.operands()) {
            opInputs.add(params.get(operand));
        }
        return b.build(b.node("res", null, rule.opKind(), opInputs));
    }

    public static PatternGraph replacementPattern(PostOpRule rule) {
        PatternGraph.Builder b = PatternGraph.builder();
        Map<String, PatternValue> params = declareParameters(b, rule);

        PatternValue attr = b.constant("attr", Types.STRING, Literals.of(rule.name()));
        OperandList operands = appendOperandList(b, rule, params);
        PatternValue packed = b.node("packed_weight_bias", PrepackedOps.CONV_OP_CONTEXT_TYPE,
                PrepackedOps.CONV2D_PREPACK,
                params.get(WEIGHT), params.get(BIAS), params.get(STRIDE), params.get(PADDING),
                params.get(DILATION), params.get(GROUPS), params.get(INPUT_SIZE),
                attr, operands.scalars(), operands.algorithm());
        return b.build(b.node("res", PrepackedOps.CONV2D_RUN, params.get(INPUT), packed));
    }

    /**
     * The scalar list and algorithm values a replacement passes to the prepack.
     */
    record OperandList(PatternValue scalars, PatternValue algorithm) {}

    static OperandList appendOperandList(PatternGraph.Builder b, PostOpRule rule, Map<String, PatternValue> params) {
        List<PatternValue> scalars = new ArrayList<>();
        for (String operand : rule.scalarOperands()) {
            scalars.add(params.get(operand));
        }
        PatternValue list = b.node("scalars", SCALAR_LIST, Symbols.LIST_CONSTRUCT, scalars);
        PatternValue algorithm = rule.hasAlgorithm()
                ? params.get(rule.algorithmOperand())
                : b.constant("algorithm", OPTIONAL_STRING, Literals.NONE);
        return new OperandList(list, algorithm);
    }

    private static Map<String, PatternValue> declareParameters(PatternGraph.Builder b, PostOpRule rule) {
        Map<String, PatternValue> params = new LinkedHashMap<>();
        params.put(INPUT, b.param(INPUT));
        params.put(WEIGHT, b.param(WEIGHT));
        params.put(BIAS, b.param(BIAS));
        params.put(STRIDE, b.param(STRIDE, Types.listOf(Types.INT)));
        params.put(PADDING, b.param(PADDING, Types.listOf(Types.INT)));
        params.put(DILATION, b.param(DILATION, Types.listOf(Types.INT)));
        params.put(GROUPS, b.param(GROUPS, Types.INT));
        params.put(INPUT_SIZE, b.param(INPUT_SIZE, Types.listOf(Types.INT)));
        params.put(ATTR_PLACEHOLDER, b.param(ATTR_PLACEHOLDER, Types.STRING));
        params.put(SCALARS_PLACEHOLDER, b.param(SCALARS_PLACEHOLDER, SCALAR_LIST));
        params.put(ALGORITHM_PLACEHOLDER, b.param(ALGORITHM_PLACEHOLDER, OPTIONAL_STRING));
        for (String operand : rule.scalarOperands()) {
            params.put(operand, b.param(operand));
        }
        if (rule.hasAlgorithm()) {
            params.put(rule.algorithmOperand(), b.param(rule.algorithmOperand(), Types.STRING));
        }
        return params;
    }
}
