package io.surfworks.convfuse.ir.runtime;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * Straightforward reference implementations of the tensor operators the
 * interpreter supports. They favor readability over speed and are used to
 * check that rewritten graphs compute the same values as the originals.
 */
public final class ReferenceKernels {

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2_OVER_PI = Math.sqrt(2.0 / Math.PI);

    private ReferenceKernels() {}

    // ==================== Convolution ====================

    /**
     * 2-D convolution over an NCHW input.
     *
     * @param input    activation, shape [N, C, H, W]
     * @param weight   filters, shape [O, C / groups, kH, kW]
     * @param bias     per-output-channel bias of shape [O], or null
     * @param stride   one or two values
     * @param padding  one or two values, applied symmetrically
     * @param dilation one or two values
     * @param groups   number of channel groups
     * @return the output, shape [N, O, outH, outW], in the input's layout
     */
    public static Tensor conv2d(Tensor input, Tensor weight, Tensor bias,
                                long[] stride, long[] padding, long[] dilation, long groups) {
        if (input.rank() != 4 || weight.rank() != 4) {
            throw new IllegalArgumentException("conv2d expects 4-D input and weight, got "
                    + Arrays.toString(input.shape()) + " and " + Arrays.toString(weight.shape()));
        }
        int[] s = expand2(stride, "stride");
        int[] p = expand2(padding, "padding");
        int[] d = expand2(dilation, "dilation");
        int g = Math.toIntExact(groups);

        int n = input.dim(0);
        int c = input.dim(1);
        int h = input.dim(2);
        int w = input.dim(3);
        int o = weight.dim(0);
        int cPerGroup = weight.dim(1);
        int kh = weight.dim(2);
        int kw = weight.dim(3);

        if (g <= 0 || c % g != 0 || o % g != 0 || cPerGroup * g != c) {
            throw new IllegalArgumentException(String.format(
                    "conv2d: %d input channels, weight %s and groups=%d are inconsistent",
                    c, Arrays.toString(weight.shape()), g));
        }
        if (bias != null && (bias.rank() != 1 || bias.dim(0) != o)) {
            throw new IllegalArgumentException("conv2d: bias must have shape [" + o + "], got "
                    + Arrays.toString(bias.shape()));
        }

        int outH = (h + 2 * p[0] - d[0] * (kh - 1) - 1) / s[0] + 1;
        int outW = (w + 2 * p[1] - d[1] * (kw - 1) - 1) / s[1] + 1;
        if (outH <= 0 || outW <= 0) {
            throw new IllegalArgumentException("conv2d: kernel is larger than the padded input");
        }

        float[] in = input.toFloatArray();
        float[] wt = weight.toFloatArray();
        float[] bs = bias == null ? null : bias.toFloatArray();
        float[] out = new float[n * o * outH * outW];
        int oPerGroup = o / g;

        for (int b = 0; b < n; b++) {
            for (int oc = 0; oc < o; oc++) {
                int group = oc / oPerGroup;
                int icStart = group * cPerGroup;
                for (int oy = 0; oy < outH; oy++) {
                    for (int ox = 0; ox < outW; ox++) {
                        float sum = bs == null ? 0f : bs[oc];
                        for (int ic = 0; ic < cPerGroup; ic++) {
                            for (int ky = 0; ky < kh; ky++) {
                                int iy = oy * s[0] - p[0] + ky * d[0];
                                if (iy < 0 || iy >= h) continue;
                                for (int kx = 0; kx < kw; kx++) {
                                    int ix = ox * s[1] - p[1] + kx * d[1];
                                    if (ix < 0 || ix >= w) continue;
                                    float x = in[((b * c + icStart + ic) * h + iy) * w + ix];
                                    float k = wt[((oc * cPerGroup + ic) * kh + ky) * kw + kx];
                                    sum += x * k;
                                }
                            }
                        }
                        out[((b * o + oc) * outH + oy) * outW + ox] = sum;
                    }
                }
            }
        }
        return Tensor.create(out, new int[] {n, o, outH, outW}, input.layout(), input.device());
    }

    private static int[] expand2(long[] values, String name) {
        if (values.length == 1) {
            int v = Math.toIntExact(values[0]);
            return new int[] {v, v};
        }
        if (values.length == 2) {
            return new int[] {Math.toIntExact(values[0]), Math.toIntExact(values[1])};
        }
        throw new IllegalArgumentException("conv2d: " + name + " must have 1 or 2 values, got "
                + Arrays.toString(values));
    }

    // ==================== Elementwise ====================

    public static Tensor relu(Tensor t) {
        return map(t, x -> x > 0 ? x : 0);
    }

    public static Tensor sigmoid(Tensor t) {
        return map(t, x -> 1.0 / (1.0 + Math.exp(-x)));
    }

    public static Tensor tanh(Tensor t) {
        return map(t, Math::tanh);
    }

    public static Tensor hardtanh(Tensor t, double minVal, double maxVal) {
        if (minVal > maxVal) {
            throw new IllegalArgumentException("hardtanh: min_val " + minVal + " > max_val " + maxVal);
        }
        return map(t, x -> Math.min(maxVal, Math.max(minVal, x)));
    }

    public static Tensor leakyRelu(Tensor t, double negativeSlope) {
        return map(t, x -> x >= 0 ? x : x * negativeSlope);
    }

    /**
     * GELU with {@code approximate} either {@code "none"} (erf form) or {@code "tanh"}.
     */
    public static Tensor gelu(Tensor t, String approximate) {
        switch (approximate) {
            case "none":
                return map(t, x -> 0.5 * x * (1.0 + erf(x / SQRT_2)));
            case "tanh":
                return map(t, x -> 0.5 * x * (1.0 + Math.tanh(SQRT_2_OVER_PI * (x + 0.044715 * x * x * x))));
            default:
                throw new IllegalArgumentException("gelu: unknown approximation '" + approximate + "'");
        }
    }

    /**
     * Computes {@code self + alpha * other} for tensors of the same shape.
     */
    public static Tensor add(Tensor self, Tensor other, double alpha) {
        if (!Arrays.equals(self.shape(), other.shape())) {
            throw new IllegalArgumentException("add: shapes " + Arrays.toString(self.shape())
                    + " and " + Arrays.toString(other.shape()) + " differ");
        }
        float[] a = self.toFloatArray();
        float[] b = other.toFloatArray();
        float[] out = new float[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (float) (a[i] + alpha * b[i]);
        }
        return self.withData(out);
    }

    /**
     * Computes {@code self + alpha * other} for a scalar {@code other}.
     */
    public static Tensor add(Tensor self, double other, double alpha) {
        double shift = alpha * other;
        return map(self, x -> x + shift);
    }

    private static Tensor map(Tensor t, DoubleUnaryOperator f) {
        float[] data = t.toFloatArray();
        for (int i = 0; i < data.length; i++) {
            data[i] = (float) f.applyAsDouble(data[i]);
        }
        return t.withData(data);
    }

    /**
     * Error function, Abramowitz and Stegun 7.1.26 (absolute error below 1.5e-7).
     */
    static double erf(double x) {
        double sign = Math.signum(x);
        double ax = Math.abs(x);
        double t = 1.0 / (1.0 + 0.3275911 * ax);
        double poly = t * (0.254829592 + t * (-0.284496736 + t * (1.421413741
                + t * (-1.453152027 + t * 1.061405429))));
        return sign * (1.0 - poly * Math.exp(-ax * ax));
    }
}
