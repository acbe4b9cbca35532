package io.surfworks.convfuse.packed;

import java.util.List;
import java.util.Map;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.runtime.ReferenceKernels;
import io.surfworks.convfuse.ir.runtime.Tensor;

/**
 * Fusion attributes understood by packed convolutions and the computation
 * each one appends to the convolution result.
 *
 * <p>{@link #SUM} and {@link #SUM_RELU} need an accumulator and are only valid
 * for {@code conv2d_sum_run}; every other attribute is an elementwise post-op
 * applied by {@code conv2d_run}.
 */
public final class PostOps {

    public static final String NONE = "none";
    public static final String RELU = "relu";
    public static final String SUM = "sum";
    public static final String SUM_RELU = "sum_relu";
    public static final String SIGMOID = "sigmoid";
    public static final String TANH = "tanh";
    public static final String HARDTANH = "hardtanh";
    public static final String LEAKY_RELU = "leaky_relu";
    public static final String GELU = "gelu";

    // attribute -> number of scalar operands
    private static final Map<String, Integer> ARITY = Map.of(
            NONE, 0,
            RELU, 0,
            SIGMOID, 0,
            TANH, 0,
            HARDTANH, 2,
            LEAKY_RELU, 1,
            GELU, 0,
            SUM, 1,
            SUM_RELU, 1);

    private PostOps() {}

    public static boolean isKnown(String attr) {
        return ARITY.containsKey(attr);
    }

    public static boolean isSum(String attr) {
        return SUM.equals(attr) || SUM_RELU.equals(attr);
    }

    /**
     * Checks that the scalar operands and algorithm fit the attribute.
     *
     * @throws IllegalArgumentException if the attribute is unknown or the operands don't fit it
     */
    public static void validate(String attr, List<Literal> scalars, String algorithm) {
        Integer arity = ARITY.get(attr);
        if (arity == null) {
            throw new IllegalArgumentException("Unknown fusion attribute: " + attr);
        }
        if (scalars.size() != arity) {
            throw new IllegalArgumentException("Fusion attribute '" + attr + "' takes " + arity
                    + " scalar operand(s), got " + scalars.size());
        }
        for (Literal scalar : scalars) {
            if (scalar.isNone()) {
                throw new IllegalArgumentException("Fusion attribute '" + attr + "' has a None scalar operand");
            }
        }
        if (GELU.equals(attr)) {
            String approximate = algorithm == null ? NONE : algorithm;
            if (!NONE.equals(approximate) && !TANH.equals(approximate)) {
                throw new IllegalArgumentException("gelu: unknown approximation '" + approximate + "'");
            }
        } else if (algorithm != null) {
            throw new IllegalArgumentException("Fusion attribute '" + attr + "' takes no algorithm, got " + algorithm);
        }
    }

    /**
     * Applies an elementwise post-op to a convolution result.
     */
    public static Tensor applyEltwise(String attr, Tensor conv, List<Literal> scalars, String algorithm) {
        switch (attr) {
            case NONE:
                return conv;
            case RELU:
                return ReferenceKernels.relu(conv);
            case SIGMOID:
                return ReferenceKernels.sigmoid(conv);
            case TANH:
                return ReferenceKernels.tanh(conv);
            case HARDTANH:
                return ReferenceKernels.hardtanh(conv, scalars.get(0).toDouble(), scalars.get(1).toDouble());
            case LEAKY_RELU:
                return ReferenceKernels.leakyRelu(conv, scalars.get(0).toDouble());
            case GELU:
                return ReferenceKernels.gelu(conv, algorithm == null ? NONE : algorithm);
            default:
                throw new IllegalArgumentException("'" + attr + "' is not an elementwise fusion attribute");
        }
    }

    /**
     * Adds the accumulator to a convolution result: {@code conv + alpha * accumu},
     * followed by relu for {@link #SUM_RELU}.
     */
    public static Tensor applySum(String attr, Tensor conv, Tensor accumu, List<Literal> scalars) {
        if (!isSum(attr)) {
            throw new IllegalArgumentException("'" + attr + "' is not a sum fusion attribute");
        }
        Tensor sum = ReferenceKernels.add(conv, accumu, scalars.get(0).toDouble());
        return SUM_RELU.equals(attr) ? ReferenceKernels.relu(sum) : sum;
    }
}
