package io.surfworks.convfuse.ir;

/**
 * Operator kinds the IR and its standard passes know about.
 */
public final class Symbols {

    private Symbols() {}

    // ==================== Structural ====================

    public static final Symbol PARAM = Symbol.prim("Param");
    public static final Symbol RETURN = Symbol.prim("Return");
    public static final Symbol CONSTANT = Symbol.prim("Constant");
    public static final Symbol LIST_CONSTRUCT = Symbol.prim("ListConstruct");
    public static final Symbol IF = Symbol.prim("If");
    public static final Symbol PRINT = Symbol.prim("Print");
    public static final Symbol RAISE_EXCEPTION = Symbol.prim("RaiseException");

    // ==================== Tensor operators ====================

    public static final Symbol CONV2D = Symbol.aten("conv2d");
    public static final Symbol CONVOLUTION = Symbol.aten("_convolution");
    public static final Symbol ADD = Symbol.aten("add");
    public static final Symbol RELU = Symbol.aten("relu");
    public static final Symbol SIGMOID = Symbol.aten("sigmoid");
    public static final Symbol TANH = Symbol.aten("tanh");
    public static final Symbol HARDTANH = Symbol.aten("hardtanh");
    public static final Symbol LEAKY_RELU = Symbol.aten("leaky_relu");
    public static final Symbol GELU = Symbol.aten("gelu");
}
