package io.surfworks.convfuse.ir.runtime;

import io.surfworks.convfuse.ir.MemoryFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReferenceKernels")
class ReferenceKernelsTest {

    private static final long[] ONE = {1};
    private static final long[] ZERO = {0};

    @Nested
    @DisplayName("conv2d")
    class Conv2d {

        @Test
        @DisplayName("a 1x1 identity filter returns the input plus bias")
        void identityFilter() {
            Tensor input = Tensor.random(7, 1, 2, 3, 3);
            Tensor weight = Tensor.fromFloatArray(new float[] {1, 0, 0, 1}, 2, 2, 1, 1);
            Tensor bias = Tensor.fromFloatArray(new float[] {0.5f, -0.5f}, 2);

            Tensor out = ReferenceKernels.conv2d(input, weight, bias, ONE, ZERO, ONE, 1);

            assertArrayEquals(new int[] {1, 2, 3, 3}, out.shape());
            assertEquals(input.get(0, 0, 1, 2) + 0.5f, out.get(0, 0, 1, 2), 1e-6f);
            assertEquals(input.get(0, 1, 2, 0) - 0.5f, out.get(0, 1, 2, 0), 1e-6f);
        }

        @Test
        @DisplayName("a 3x3 box filter with padding sums each neighbourhood")
        void boxFilterWithPadding() {
            Tensor input = Tensor.full(1f, 1, 1, 4, 4);
            Tensor weight = Tensor.full(1f, 1, 1, 3, 3);

            Tensor out = ReferenceKernels.conv2d(input, weight, null, ONE, ONE, ONE, 1);

            assertArrayEquals(new int[] {1, 1, 4, 4}, out.shape());
            assertEquals(4f, out.get(0, 0, 0, 0), 1e-6f);
            assertEquals(6f, out.get(0, 0, 0, 1), 1e-6f);
            assertEquals(9f, out.get(0, 0, 1, 1), 1e-6f);
        }

        @Test
        @DisplayName("stride 2 halves the spatial size")
        void strided() {
            Tensor out = ReferenceKernels.conv2d(Tensor.random(1, 1, 3, 8, 8), Tensor.random(2, 4, 3, 3, 3), null,
                    new long[] {2, 2}, ONE, ONE, 1);
            assertArrayEquals(new int[] {1, 4, 4, 4}, out.shape());
        }

        @Test
        @DisplayName("depthwise groups convolve each channel separately")
        void depthwise() {
            Tensor input = Tensor.random(3, 1, 2, 4, 4);
            Tensor weight = Tensor.fromFloatArray(new float[] {2, 3}, 2, 1, 1, 1);

            Tensor out = ReferenceKernels.conv2d(input, weight, null, ONE, ZERO, ONE, 2);

            assertEquals(2 * input.get(0, 0, 1, 1), out.get(0, 0, 1, 1), 1e-6f);
            assertEquals(3 * input.get(0, 1, 3, 2), out.get(0, 1, 3, 2), 1e-6f);
        }

        @Test
        @DisplayName("the output keeps the input layout")
        void keepsLayout() {
            Tensor input = Tensor.random(4, 1, 3, 4, 4).withLayout(MemoryFormat.CHANNELS_LAST);
            Tensor out = ReferenceKernels.conv2d(input, Tensor.random(5, 2, 3, 1, 1), null, ONE, ZERO, ONE, 1);
            assertEquals(MemoryFormat.CHANNELS_LAST, out.layout());
        }

        @Test
        @DisplayName("inconsistent groups are rejected")
        void badGroups() {
            assertThrows(IllegalArgumentException.class, () -> ReferenceKernels.conv2d(
                    Tensor.zeros(1, 3, 4, 4), Tensor.zeros(4, 3, 1, 1), null, ONE, ZERO, ONE, 2));
        }
    }

    @Nested
    @DisplayName("Elementwise")
    class Elementwise {

        private final Tensor t = Tensor.fromFloatArray(new float[] {-2f, -0.5f, 0f, 0.5f, 2f}, 5);

        @Test
        void relu() {
            assertArrayEquals(new float[] {0f, 0f, 0f, 0.5f, 2f}, ReferenceKernels.relu(t).toFloatArray());
        }

        @Test
        void hardtanh() {
            assertArrayEquals(new float[] {-1f, -0.5f, 0f, 0.5f, 1f},
                    ReferenceKernels.hardtanh(t, -1, 1).toFloatArray());
            assertThrows(IllegalArgumentException.class, () -> ReferenceKernels.hardtanh(t, 1, -1));
        }

        @Test
        void leakyRelu() {
            assertArrayEquals(new float[] {-0.2f, -0.05f, 0f, 0.5f, 2f},
                    ReferenceKernels.leakyRelu(t, 0.1).toFloatArray(), 1e-6f);
        }

        @Test
        void sigmoidAndTanh() {
            assertEquals(0.5f, ReferenceKernels.sigmoid(t).getFlat(2), 1e-6f);
            assertEquals((float) Math.tanh(2), ReferenceKernels.tanh(t).getFlat(4), 1e-6f);
        }

        @ParameterizedTest
        @ValueSource(strings = {"none", "tanh"})
        @DisplayName("both gelu approximations agree closely")
        void gelu(String approximate) {
            Tensor out = ReferenceKernels.gelu(t, approximate);
            assertEquals(0f, out.getFlat(2), 1e-6f);
            assertEquals(1.9545f, out.getFlat(4), 1e-3f);
        }

        @Test
        void geluRejectsUnknownApproximation() {
            assertThrows(IllegalArgumentException.class, () -> ReferenceKernels.gelu(t, "exact"));
        }

        @Test
        void erf() {
            assertEquals(0.0, ReferenceKernels.erf(0), 1e-7);
            assertEquals(0.8427007929, ReferenceKernels.erf(1), 1e-6);
            assertEquals(-0.8427007929, ReferenceKernels.erf(-1), 1e-6);
        }

        @Test
        void add() {
            Tensor sum = ReferenceKernels.add(t, t, 2.0);
            assertEquals(6f, sum.getFlat(4), 1e-6f);
            assertEquals(3f, ReferenceKernels.add(t, 0.5, 2.0).getFlat(4), 1e-6f);
            assertThrows(IllegalArgumentException.class, () -> ReferenceKernels.add(t, Tensor.zeros(4), 1.0));
        }
    }
}
