package io.surfworks.convfuse.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Value types of the graph IR.
 *
 * <p>Tensor types carry whatever shape, layout and placement information is
 * known statically. Every piece is optional: the eligibility analysis of the
 * fusion pass treats missing information as "not eligible".
 */
public final class Types {

    private Types() {}

    public static final IntType INT = new IntType();
    public static final FloatType FLOAT = new FloatType();
    public static final BoolType BOOL = new BoolType();
    public static final StringType STRING = new StringType();
    public static final NoneType NONE = new NoneType();
    public static final NumberType NUMBER = new NumberType();

    /** Prefix the IR text puts in front of custom class names. */
    public static final String CLASS_PREFIX = "__torch__.torch.classes.";

    public static ListType listOf(Type element) {
        return new ListType(element);
    }

    public static OptionalType optionalOf(Type element) {
        return new OptionalType(element);
    }

    public static ClassType classType(String name) {
        return new ClassType(name);
    }

    /**
     * Base interface for all IR types.
     */
    public sealed interface Type permits TensorType, IntType, FloatType, BoolType, StringType,
            NoneType, NumberType, ListType, OptionalType, ClassType {
        String toIrString();
    }

    /**
     * Tensor type with optional dtype, sizes, strides and device.
     *
     * @param dtype   element type, or null if unknown
     * @param sizes   dimension sizes, or null if the rank is unknown; individual entries may be null
     * @param strides element strides, or null if unknown
     * @param device  device placement, or null if unknown
     */
    public record TensorType(ScalarType dtype, List<Long> sizes, List<Long> strides, Device device)
            implements Type {

        private static final TensorType UNKNOWN = new TensorType(null, null, null, null);

        public TensorType {
            sizes = sizes == null ? null : Collections.unmodifiableList(new ArrayList<>(sizes));
            strides = strides == null ? null : List.copyOf(strides);
            if (sizes != null && strides != null && sizes.size() != strides.size()) {
                throw new IllegalArgumentException(
                        "sizes and strides must have the same rank: " + sizes + " vs " + strides);
            }
        }

        /**
         * Returns the tensor type with nothing known about it.
         */
        public static TensorType unknown() {
            return UNKNOWN;
        }

        /**
         * Creates a contiguous tensor type on the CPU.
         */
        public static TensorType of(ScalarType dtype, long... sizes) {
            List<Long> dims = new ArrayList<>(sizes.length);
            for (long s : sizes) {
                dims.add(s);
            }
            return new TensorType(dtype, dims, MemoryFormat.CONTIGUOUS.strides(dims), Device.cpu());
        }

        public TensorType withDevice(Device newDevice) {
            return new TensorType(dtype, sizes, strides, newDevice);
        }

        public TensorType withStrides(List<Long> newStrides) {
            return new TensorType(dtype, sizes, newStrides, device);
        }

        /**
         * Returns a copy whose strides lay the data out in the given memory format.
         *
         * @throws IllegalStateException if the sizes are not fully known
         */
        public TensorType withMemoryFormat(MemoryFormat format) {
            List<Long> concrete = concreteSizes()
                    .orElseThrow(() -> new IllegalStateException("Sizes are not concrete: " + toIrString()));
            return withStrides(format.strides(concrete));
        }

        /**
         * Returns the sizes if the rank and every dimension are known.
         */
        public Optional<List<Long>> concreteSizes() {
            if (sizes == null || sizes.contains(null)) {
                return Optional.empty();
            }
            return Optional.of(sizes);
        }

        public Optional<Device> deviceIfKnown() {
            return Optional.ofNullable(device);
        }

        public Optional<Integer> rank() {
            return sizes == null ? Optional.empty() : Optional.of(sizes.size());
        }

        /**
         * Returns true if sizes and strides are known and describe a tensor
         * that is contiguous in the given memory format.
         */
        public boolean isContiguous(MemoryFormat format) {
            Optional<List<Long>> concrete = concreteSizes();
            if (concrete.isEmpty() || strides == null) {
                return false;
            }
            return format.matches(concrete.get(), strides);
        }

        @Override
        public String toIrString() {
            if (sizes == null && strides == null && device == null) {
                return dtype == null ? "Tensor" : dtype.irName();
            }
            StringBuilder sb = new StringBuilder(dtype == null ? "Tensor" : dtype.irName());
            sb.append("(");
            List<String> parts = new ArrayList<>();
            if (sizes != null) {
                for (Long s : sizes) {
                    parts.add(s == null ? "*" : String.valueOf(s));
                }
            }
            if (strides != null) {
                parts.add("strides=" + strides.toString());
            }
            if (device != null) {
                parts.add("device=" + device.toIrString());
            }
            sb.append(String.join(", ", parts));
            sb.append(")");
            return sb.toString();
        }
    }

    public record IntType() implements Type {
        @Override
        public String toIrString() {
            return "int";
        }
    }

    public record FloatType() implements Type {
        @Override
        public String toIrString() {
            return "float";
        }
    }

    public record BoolType() implements Type {
        @Override
        public String toIrString() {
            return "bool";
        }
    }

    public record StringType() implements Type {
        @Override
        public String toIrString() {
            return "str";
        }
    }

    public record NoneType() implements Type {
        @Override
        public String toIrString() {
            return "NoneType";
        }
    }

    /**
     * Either an int or a float ({@code Scalar} in operator signatures).
     */
    public record NumberType() implements Type {
        @Override
        public String toIrString() {
            return "Scalar";
        }
    }

    public record ListType(Type element) implements Type {
        public ListType {
            Objects.requireNonNull(element, "element cannot be null");
        }

        @Override
        public String toIrString() {
            return element.toIrString() + "[]";
        }
    }

    public record OptionalType(Type element) implements Type {
        public OptionalType {
            Objects.requireNonNull(element, "element cannot be null");
        }

        @Override
        public String toIrString() {
            return element.toIrString() + "?";
        }
    }

    /**
     * A backend-defined object type, such as a packed convolution context.
     *
     * @param name the class name without the {@link #CLASS_PREFIX}
     */
    public record ClassType(String name) implements Type {
        public ClassType {
            Objects.requireNonNull(name, "name cannot be null");
        }

        @Override
        public String toIrString() {
            return CLASS_PREFIX + name;
        }
    }
}
