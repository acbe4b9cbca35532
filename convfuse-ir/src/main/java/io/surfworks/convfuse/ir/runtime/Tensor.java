package io.surfworks.convfuse.ir.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

import io.surfworks.convfuse.ir.Device;
import io.surfworks.convfuse.ir.MemoryFormat;
import io.surfworks.convfuse.ir.ScalarType;
import io.surfworks.convfuse.ir.Types.TensorType;

/**
 * Immutable float tensor used by the reference interpreter.
 *
 * <p>Data is always held in logical row-major order. The {@link MemoryFormat}
 * tag only describes the physical layout the tensor claims to have, which is
 * what the static {@link TensorType} reports through its strides.
 */
public final class Tensor {

    private final float[] data;
    private final int[] shape;
    private final MemoryFormat layout;
    private final Device device;

    private Tensor(float[] data, int[] shape, MemoryFormat layout, Device device) {
        this.data = data;
        this.shape = shape;
        this.layout = layout;
        this.device = device;
    }

    /**
     * Creates a contiguous CPU tensor from a copy of the given data.
     *
     * @param data  values in row-major order
     * @param shape dimension sizes
     * @throws IllegalArgumentException if the data length doesn't match the shape
     */
    public static Tensor fromFloatArray(float[] data, int... shape) {
        long count = count(shape);
        if (count != data.length) {
            throw new IllegalArgumentException(
                    "Data length " + data.length + " doesn't match shape " + Arrays.toString(shape));
        }
        return new Tensor(data.clone(), shape.clone(), MemoryFormat.CONTIGUOUS, Device.cpu());
    }

    public static Tensor zeros(int... shape) {
        return full(0f, shape);
    }

    public static Tensor full(float value, int... shape) {
        float[] data = new float[(int) count(shape)];
        Arrays.fill(data, value);
        return new Tensor(data, shape.clone(), MemoryFormat.CONTIGUOUS, Device.cpu());
    }

    /**
     * Creates a tensor of uniformly distributed values in [-1, 1) from a fixed seed.
     */
    public static Tensor random(long seed, int... shape) {
        Random random = new Random(seed);
        float[] data = new float[(int) count(shape)];
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextFloat() * 2f - 1f;
        }
        return new Tensor(data, shape.clone(), MemoryFormat.CONTIGUOUS, Device.cpu());
    }

    public Tensor withLayout(MemoryFormat newLayout) {
        Objects.requireNonNull(newLayout, "layout cannot be null");
        if (newLayout == MemoryFormat.CHANNELS_LAST && shape.length != 4) {
            throw new IllegalArgumentException("channels_last requires a 4-D tensor, got rank " + shape.length);
        }
        return new Tensor(data, shape, newLayout, device);
    }

    public Tensor withDevice(Device newDevice) {
        return new Tensor(data, shape, layout, Objects.requireNonNull(newDevice, "device cannot be null"));
    }

    /**
     * Creates a tensor with the same shape, layout and device but new data.
     */
    Tensor withData(float[] newData) {
        if (newData.length != data.length) {
            throw new IllegalArgumentException("Data length " + newData.length + " != " + data.length);
        }
        return new Tensor(newData, shape, layout, device);
    }

    static Tensor create(float[] data, int[] shape, MemoryFormat layout, Device device) {
        return new Tensor(data, shape, layout, device);
    }

    public int[] shape() {
        return shape.clone();
    }

    public int dim(int i) {
        return shape[i];
    }

    public int rank() {
        return shape.length;
    }

    public long elementCount() {
        return data.length;
    }

    public MemoryFormat layout() {
        return layout;
    }

    public Device device() {
        return device;
    }

    public float get(int... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                    "Expected " + shape.length + " indices, got " + indices.length);
        }
        int flat = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                        "Index " + indices[i] + " out of bounds for dimension " + i + " of size " + shape[i]);
            }
            flat = flat * shape[i] + indices[i];
        }
        return data[flat];
    }

    public float getFlat(int index) {
        return data[index];
    }

    public float[] toFloatArray() {
        return data.clone();
    }

    /**
     * Returns the static type describing this tensor.
     */
    public TensorType type() {
        List<Long> sizes = new ArrayList<>(shape.length);
        for (int s : shape) {
            sizes.add((long) s);
        }
        return new TensorType(ScalarType.FLOAT, sizes, layout.strides(sizes), device);
    }

    /**
     * Compares element values with an absolute and relative tolerance.
     */
    public boolean allClose(Tensor other, float atol, float rtol) {
        if (!Arrays.equals(shape, other.shape)) {
            return false;
        }
        for (int i = 0; i < data.length; i++) {
            float a = data[i];
            float b = other.data[i];
            if (Math.abs(a - b) > atol + rtol * Math.abs(b)) {
                return false;
            }
        }
        return true;
    }

    private static long count(int[] shape) {
        long count = 1;
        for (int d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
            count *= d;
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("Tensor[shape=%s, layout=%s, device=%s]",
                Arrays.toString(shape), layout, device);
    }
}
