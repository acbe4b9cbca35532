package io.surfworks.convfuse.packed;

import java.util.List;

import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.runtime.OperatorRegistry;
import io.surfworks.convfuse.ir.runtime.StandardOperators;
import io.surfworks.convfuse.ir.runtime.Tensor;

/**
 * Kernels for the {@code mkldnn_prepacked} operators.
 *
 * <p>{@code conv2d_prepack} is pure, so constant propagation and prepack
 * folding may evaluate it at compile time. The run kernels accept both the
 * live and the frozen context.
 */
public final class PrepackedOperators {

    private PrepackedOperators() {}

    /**
     * Returns a registry with the standard operators and the prepacked ones.
     */
    public static OperatorRegistry registry() {
        OperatorRegistry registry = OperatorRegistry.withStandardOperators();
        registerAll(registry);
        return registry;
    }

    public static void registerAll(OperatorRegistry registry) {
        registry.register(PrepackedOps.CONV2D_PREPACK, PrepackedOperators::prepack);
        registry.register(PrepackedOps.CONV2D_RUN, PrepackedOperators::run);
        registry.register(PrepackedOps.CONV2D_SUM_RUN, PrepackedOperators::sumRun);
    }

    private static List<Literal> prepack(Node node, List<Literal> in) {
        if (in.size() != 10) {
            throw new IllegalArgumentException(PrepackedOps.CONV2D_PREPACK + " expects 10 operands, got " + in.size());
        }
        ConvPackedWeights payload = new ConvPackedWeights(
                in.get(0).toTensor(),
                StandardOperators.optionalTensor(in.get(1)),
                in.get(2).toLongList(),
                in.get(3).toLongList(),
                in.get(4).toLongList(),
                in.get(5).toLong(),
                in.get(6).toLongList(),
                in.get(7).toStr(),
                in.get(8).toList(),
                in.get(9).isNone() ? null : in.get(9).toStr());
        return List.of(Literals.of(new LiveConvOpContext(payload, node.owningGraph())));
    }

    private static List<Literal> run(Node node, List<Literal> in) {
        Tensor input = in.get(0).toTensor();
        return List.of(Literals.of(context(in.get(1)).run(input)));
    }

    private static List<Literal> sumRun(Node node, List<Literal> in) {
        Tensor input = in.get(0).toTensor();
        Tensor accumu = in.get(1).toTensor();
        return List.of(Literals.of(context(in.get(2)).sumRun(input, accumu)));
    }

    private static ConvOpContext context(Literal literal) {
        if (literal.toObject() instanceof ConvOpContext context) {
            return context;
        }
        throw new IllegalArgumentException("Expected a " + PrepackedOps.CONV_OP_CONTEXT_CLASS
                + " but got " + literal.toIrString());
    }
}
