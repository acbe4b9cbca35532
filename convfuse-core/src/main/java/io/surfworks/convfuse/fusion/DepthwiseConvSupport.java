package io.surfworks.convfuse.fusion;

import java.util.List;
import java.util.Optional;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.ScalarType;
import io.surfworks.convfuse.ir.Types.TensorType;
import io.surfworks.convfuse.ir.Value;

/**
 * Claims the float 3x3 depthwise convolutions the vectorized depthwise kernel
 * supports: padding 1, dilation 1, stride 1 or 2 and {@code groups == C == O}.
 *
 * <p>Sizes and hyperparameters must be statically known, anything else is
 * not claimed.
 */
public final class DepthwiseConvSupport implements VectorizedConvSupport {

    @Override
    public boolean claims(Node conv) {
        if (conv.inputs().size() != 7) {
            return false;
        }
        Optional<List<Long>> input = floatSizes(conv.input(0));
        Optional<List<Long>> weight = floatSizes(conv.input(1));
        if (input.isEmpty() || weight.isEmpty() || input.get().size() != 4 || weight.get().size() != 4) {
            return false;
        }
        Optional<List<Long>> stride = constantInts(conv.input(3));
        Optional<List<Long>> padding = constantInts(conv.input(4));
        Optional<List<Long>> dilation = constantInts(conv.input(5));
        Optional<Literal> groups = constant(conv.input(6));
        if (stride.isEmpty() || padding.isEmpty() || dilation.isEmpty() || groups.isEmpty()) {
            return false;
        }

        long channels = input.get().get(1);
        List<Long> w = weight.get();
        return groups.get().toLong() == channels
                && w.get(0) == channels
                && w.get(1) == 1
                && w.get(2) == 3
                && w.get(3) == 3
                && allEqual(padding.get(), 1)
                && allEqual(dilation.get(), 1)
                && (allEqual(stride.get(), 1) || allEqual(stride.get(), 2));
    }

    private static Optional<List<Long>> floatSizes(Value v) {
        if (!(v.type() instanceof TensorType t) || t.dtype() != ScalarType.FLOAT) {
            return Optional.empty();
        }
        return t.concreteSizes();
    }

    private static Optional<Literal> constant(Value v) {
        Node producer = v.node();
        if (!producer.isConstant() || producer.literal() == null || producer.literal().isNone()) {
            return Optional.empty();
        }
        return Optional.of(producer.literal());
    }

    private static Optional<List<Long>> constantInts(Value v) {
        return constant(v).map(Literal::toLongList);
    }

    private static boolean allEqual(List<Long> values, long expected) {
        if (values.isEmpty()) {
            return false;
        }
        for (long v : values) {
            if (v != expected) {
                return false;
            }
        }
        return true;
    }
}
