package io.surfworks.convfuse.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.convfuse.ir.Types.Type;
import io.surfworks.convfuse.ir.runtime.Tensor;

/**
 * Literal values: the payload of {@code prim::Constant} nodes and the values
 * the interpreter passes between operators.
 */
public final class Literals {

    private Literals() {}

    public static final NoneLiteral NONE = new NoneLiteral();

    public static IntLiteral of(long value) {
        return new IntLiteral(value);
    }

    public static FloatLiteral of(double value) {
        return new FloatLiteral(value);
    }

    public static BoolLiteral of(boolean value) {
        return new BoolLiteral(value);
    }

    public static StringLiteral of(String value) {
        return new StringLiteral(value);
    }

    public static TensorLiteral of(Tensor value) {
        return new TensorLiteral(value);
    }

    public static ObjectLiteral of(CustomObject value) {
        return new ObjectLiteral(value);
    }

    public static ListLiteral intList(long... values) {
        Literal[] items = new Literal[values.length];
        for (int i = 0; i < values.length; i++) {
            items[i] = new IntLiteral(values[i]);
        }
        return new ListLiteral(List.of(items), Types.INT);
    }

    public static ListLiteral intList(List<Long> values) {
        return new ListLiteral(values.stream().<Literal>map(IntLiteral::new).toList(), Types.INT);
    }

    /**
     * Base interface for literal values.
     */
    public sealed interface Literal permits NoneLiteral, BoolLiteral, IntLiteral, FloatLiteral,
            StringLiteral, ListLiteral, TensorLiteral, ObjectLiteral {

        Type type();

        String toIrString();

        default boolean isNone() {
            return false;
        }

        default long toLong() {
            throw new IllegalStateException("Expected an int literal but got " + toIrString());
        }

        default double toDouble() {
            throw new IllegalStateException("Expected a number literal but got " + toIrString());
        }

        default boolean toBool() {
            throw new IllegalStateException("Expected a bool literal but got " + toIrString());
        }

        default String toStr() {
            throw new IllegalStateException("Expected a string literal but got " + toIrString());
        }

        default List<Literal> toList() {
            throw new IllegalStateException("Expected a list literal but got " + toIrString());
        }

        default Tensor toTensor() {
            throw new IllegalStateException("Expected a tensor literal but got " + toIrString());
        }

        default CustomObject toObject() {
            throw new IllegalStateException("Expected an object literal but got " + toIrString());
        }

        /**
         * Returns the list elements as longs.
         */
        default List<Long> toLongList() {
            return toList().stream().map(Literal::toLong).toList();
        }
    }

    public record NoneLiteral() implements Literal {
        @Override
        public Type type() {
            return Types.NONE;
        }

        @Override
        public String toIrString() {
            return "None";
        }

        @Override
        public boolean isNone() {
            return true;
        }
    }

    public record BoolLiteral(boolean value) implements Literal {
        @Override
        public Type type() {
            return Types.BOOL;
        }

        @Override
        public String toIrString() {
            return String.valueOf(value);
        }

        @Override
        public boolean toBool() {
            return value;
        }
    }

    public record IntLiteral(long value) implements Literal {
        @Override
        public Type type() {
            return Types.INT;
        }

        @Override
        public String toIrString() {
            return String.valueOf(value);
        }

        @Override
        public long toLong() {
            return value;
        }

        @Override
        public double toDouble() {
            return value;
        }

        @Override
        public boolean toBool() {
            return value != 0;
        }
    }

    public record FloatLiteral(double value) implements Literal {
        @Override
        public Type type() {
            return Types.FLOAT;
        }

        @Override
        public String toIrString() {
            return String.valueOf(value);
        }

        @Override
        public double toDouble() {
            return value;
        }
    }

    public record StringLiteral(String value) implements Literal {
        public StringLiteral {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Type type() {
            return Types.STRING;
        }

        @Override
        public String toIrString() {
            return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }

        @Override
        public String toStr() {
            return value;
        }
    }

    /**
     * A list literal.
     *
     * @param values      the elements
     * @param elementType the declared element type (elements may be None when it is optional)
     */
    public record ListLiteral(List<Literal> values, Type elementType) implements Literal {
        public ListLiteral {
            values = List.copyOf(values);
            Objects.requireNonNull(elementType, "elementType cannot be null");
        }

        @Override
        public Type type() {
            return Types.listOf(elementType);
        }

        @Override
        public String toIrString() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(values.get(i).toIrString());
            }
            sb.append("]");
            return sb.toString();
        }

        @Override
        public List<Literal> toList() {
            return values;
        }
    }

    public record TensorLiteral(Tensor value) implements Literal {
        public TensorLiteral {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Type type() {
            return value.type();
        }

        @Override
        public String toIrString() {
            return "<Tensor>";
        }

        @Override
        public Tensor toTensor() {
            return value;
        }
    }

    public record ObjectLiteral(CustomObject value) implements Literal {
        public ObjectLiteral {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public Type type() {
            return value.type();
        }

        @Override
        public String toIrString() {
            return "<" + value.className() + ">";
        }

        @Override
        public CustomObject toObject() {
            return value;
        }
    }
}
