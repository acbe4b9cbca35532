package io.surfworks.convfuse.packed;

import io.surfworks.convfuse.ir.Symbol;
import io.surfworks.convfuse.ir.Types;
import io.surfworks.convfuse.ir.Types.ClassType;

/**
 * Operator kinds and the packed-context type produced by the fusion pass.
 */
public final class PrepackedOps {

    public static final String NAMESPACE = "mkldnn_prepacked";

    /** {@code conv2d_prepack(weight, bias, stride, padding, dilation, groups, input_size, attr, scalars, algorithm)} */
    public static final Symbol CONV2D_PREPACK = new Symbol(NAMESPACE, "conv2d_prepack");

    /** {@code conv2d_run(input, packed)} */
    public static final Symbol CONV2D_RUN = new Symbol(NAMESPACE, "conv2d_run");

    /** {@code conv2d_sum_run(input, accumu, packed)} */
    public static final Symbol CONV2D_SUM_RUN = new Symbol(NAMESPACE, "conv2d_sum_run");

    public static final String CONV_OP_CONTEXT_CLASS = "mkldnn.ConvOpContext";

    public static final ClassType CONV_OP_CONTEXT_TYPE = Types.classType(CONV_OP_CONTEXT_CLASS);

    private PrepackedOps() {}

    /**
     * Returns true for the two node kinds that execute a packed convolution.
     */
    public static boolean isRun(Symbol kind) {
        return CONV2D_RUN.equals(kind) || CONV2D_SUM_RUN.equals(kind);
    }
}
