package io.surfworks.convfuse.packed;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.runtime.ReferenceKernels;
import io.surfworks.convfuse.ir.runtime.Tensor;

/**
 * Everything a packed convolution needs: the repacked parameters, the
 * activation size it was packed for and the fused post-op.
 *
 * @param weight    filters, shape [O, C / groups, kH, kW]
 * @param bias      bias of shape [O], or null
 * @param stride    stride, one or two values
 * @param padding   padding, one or two values
 * @param dilation  dilation, one or two values
 * @param groups    channel groups
 * @param inputSize activation sizes the weights were packed for
 * @param attr      fusion attribute, see {@link PostOps}
 * @param scalars   scalar operands of the post-op
 * @param algorithm post-op algorithm, or null
 */
public record ConvPackedWeights(
        Tensor weight,
        Tensor bias,
        List<Long> stride,
        List<Long> padding,
        List<Long> dilation,
        long groups,
        List<Long> inputSize,
        String attr,
        List<Literal> scalars,
        String algorithm) {

    public ConvPackedWeights {
        Objects.requireNonNull(weight, "weight cannot be null");
        stride = List.copyOf(stride);
        padding = List.copyOf(padding);
        dilation = List.copyOf(dilation);
        inputSize = List.copyOf(inputSize);
        scalars = List.copyOf(scalars);
        Objects.requireNonNull(attr, "attr cannot be null");
        if (weight.rank() != 4) {
            throw new IllegalArgumentException("Packed weight must be 4-D, got " + Arrays.toString(weight.shape()));
        }
        if (inputSize.size() != 4) {
            throw new IllegalArgumentException("Input size hint must have 4 entries, got " + inputSize);
        }
        PostOps.validate(attr, scalars, algorithm);
    }

    /**
     * Convolution followed by the elementwise post-op.
     *
     * @throws IllegalArgumentException if the input doesn't have the packed size,
     *         or the attribute needs an accumulator
     */
    public Tensor run(Tensor input) {
        if (PostOps.isSum(attr)) {
            throw new IllegalArgumentException("Fusion attribute '" + attr + "' requires conv2d_sum_run");
        }
        return PostOps.applyEltwise(attr, convolve(input), scalars, algorithm);
    }

    /**
     * Convolution plus {@code alpha * accumu}, with relu for {@code sum_relu}.
     */
    public Tensor sumRun(Tensor input, Tensor accumu) {
        return PostOps.applySum(attr, convolve(input), accumu, scalars);
    }

    private Tensor convolve(Tensor input) {
        int[] shape = input.shape();
        if (shape.length != inputSize.size()) {
            throw new IllegalArgumentException("Input of rank " + shape.length + " " + Arrays.toString(shape)
                    + " does not match the packed input size " + inputSize);
        }
        for (int i = 0; i < shape.length; i++) {
            if (shape[i] != inputSize.get(i)) {
                throw new IllegalArgumentException("Input of shape " + Arrays.toString(shape)
                        + " does not match the packed input size " + inputSize);
            }
        }
        return ReferenceKernels.conv2d(input, weight, bias,
                toArray(stride), toArray(padding), toArray(dilation), groups);
    }

    private static long[] toArray(List<Long> values) {
        long[] result = new long[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }
}
