package io.surfworks.convfuse.ir;

/**
 * Element types of tensor values, named the way the IR text prints them.
 */
public enum ScalarType {
    FLOAT("Float", 4),
    DOUBLE("Double", 8),
    HALF("Half", 2),
    BFLOAT16("BFloat16", 2),
    INT("Int", 4),
    LONG("Long", 8),
    BOOL("Bool", 1);

    private final String irName;
    private final int byteSize;

    ScalarType(String irName, int byteSize) {
        this.irName = irName;
        this.byteSize = byteSize;
    }

    public String irName() {
        return irName;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT || this == DOUBLE || this == HALF || this == BFLOAT16;
    }

    /**
     * Looks up a scalar type by its IR name ({@code Float}, {@code Long}, ...).
     *
     * @return the scalar type, or null if the name is not a tensor element type
     */
    public static ScalarType fromIrName(String name) {
        for (ScalarType t : values()) {
            if (t.irName.equals(name)) {
                return t;
            }
        }
        return null;
    }
}
