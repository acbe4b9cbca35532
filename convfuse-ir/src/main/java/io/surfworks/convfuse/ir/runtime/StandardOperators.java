package io.surfworks.convfuse.ir.runtime;

import java.util.List;
import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Literals;
import io.surfworks.convfuse.ir.Literals.ListLiteral;
import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbols;
import io.surfworks.convfuse.ir.Types;
import io.surfworks.convfuse.ir.Types.ListType;
import io.surfworks.convfuse.ir.Types.Type;

/**
 * Kernels for the {@code prim} and {@code aten} operators the reference
 * interpreter understands. Tensor math is delegated to {@link ReferenceKernels}.
 */
public final class StandardOperators {

    private static final Logger LOG = Logger.getLogger(StandardOperators.class.getName());

    private StandardOperators() {}

    public static void registerAll(OperatorRegistry registry) {
        registry.register(Symbols.LIST_CONSTRUCT, StandardOperators::listConstruct);
        registry.registerImpure(Symbols.PRINT, StandardOperators::print);

        registry.register(Symbols.CONV2D, StandardOperators::conv2d);
        registry.register(Symbols.CONVOLUTION, StandardOperators::convolution);
        registry.register(Symbols.ADD, StandardOperators::add);

        registry.register(Symbols.RELU, (node, in) -> tensor(ReferenceKernels.relu(in.get(0).toTensor())));
        registry.register(Symbols.SIGMOID, (node, in) -> tensor(ReferenceKernels.sigmoid(in.get(0).toTensor())));
        registry.register(Symbols.TANH, (node, in) -> tensor(ReferenceKernels.tanh(in.get(0).toTensor())));
        registry.register(Symbols.HARDTANH, (node, in) -> tensor(ReferenceKernels.hardtanh(
                in.get(0).toTensor(),
                in.size() > 1 ? in.get(1).toDouble() : -1.0,
                in.size() > 2 ? in.get(2).toDouble() : 1.0)));
        registry.register(Symbols.LEAKY_RELU, (node, in) -> tensor(ReferenceKernels.leakyRelu(
                in.get(0).toTensor(),
                in.size() > 1 ? in.get(1).toDouble() : 0.01)));
        registry.register(Symbols.GELU, (node, in) -> tensor(ReferenceKernels.gelu(
                in.get(0).toTensor(),
                in.size() > 1 ? in.get(1).toStr() : "none")));
    }

    /**
     * Converts an int-list literal to an array.
     */
    public static long[] longs(Literal list) {
        List<Long> values = list.toLongList();
        long[] result = new long[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    /**
     * Returns the tensor held by a literal, or null for None.
     */
    public static Tensor optionalTensor(Literal literal) {
        return literal.isNone() ? null : literal.toTensor();
    }

    private static List<Literal> tensor(Tensor t) {
        return List.of(Literals.of(t));
    }

    // ==================== prim ====================

    private static List<Literal> listConstruct(Node node, List<Literal> inputs) {
        Type elementType;
        if (node.output().type() instanceof ListType list) {
            elementType = list.element();
        } else if (inputs.stream().allMatch(l -> l instanceof Literals.IntLiteral)) {
            elementType = Types.INT;
        } else if (inputs.stream().allMatch(l -> l instanceof Literals.IntLiteral || l instanceof Literals.FloatLiteral)) {
            elementType = Types.NUMBER;
        } else if (inputs.stream().allMatch(l -> l instanceof Literals.TensorLiteral)) {
            elementType = Types.TensorType.unknown();
        } else {
            throw new IllegalArgumentException("prim::ListConstruct: cannot infer the element type of " + inputs);
        }
        return List.of(new ListLiteral(inputs, elementType));
    }

    private static List<Literal> print(Node node, List<Literal> inputs) {
        StringBuilder sb = new StringBuilder();
        for (Literal l : inputs) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(l.toIrString());
        }
        LOG.info(sb.toString());
        return List.of();
    }

    // ==================== aten ====================

    private static List<Literal> conv2d(Node node, List<Literal> in) {
        // conv2d(input, weight, bias, stride, padding, dilation, groups)
        if (in.size() != 7) {
            throw new IllegalArgumentException("aten::conv2d expects 7 operands, got " + in.size());
        }
        return tensor(ReferenceKernels.conv2d(
                in.get(0).toTensor(),
                in.get(1).toTensor(),
                optionalTensor(in.get(2)),
                longs(in.get(3)),
                longs(in.get(4)),
                longs(in.get(5)),
                in.get(6).toLong()));
    }

    private static List<Literal> convolution(Node node, List<Literal> in) {
        // _convolution(input, weight, bias, stride, padding, dilation, transposed,
        //              output_padding, groups, benchmark, deterministic, cudnn_enabled[, allow_tf32])
        if (in.size() != 12 && in.size() != 13) {
            throw new IllegalArgumentException("aten::_convolution expects 12 or 13 operands, got " + in.size());
        }
        if (in.get(6).toBool()) {
            throw new UnsupportedOperationException("aten::_convolution: transposed convolution is not supported");
        }
        return tensor(ReferenceKernels.conv2d(
                in.get(0).toTensor(),
                in.get(1).toTensor(),
                optionalTensor(in.get(2)),
                longs(in.get(3)),
                longs(in.get(4)),
                longs(in.get(5)),
                in.get(8).toLong()));
    }

    private static List<Literal> add(Node node, List<Literal> in) {
        // add(self, other, alpha)
        Literal self = in.get(0);
        Literal other = in.get(1);
        Literal alphaLiteral = in.size() > 2 ? in.get(2) : Literals.of(1L);

        if (self instanceof Literals.TensorLiteral) {
            double alpha = alphaLiteral.toDouble();
            if (other instanceof Literals.TensorLiteral) {
                return tensor(ReferenceKernels.add(self.toTensor(), other.toTensor(), alpha));
            }
            return tensor(ReferenceKernels.add(self.toTensor(), other.toDouble(), alpha));
        }
        if (self instanceof Literals.IntLiteral && other instanceof Literals.IntLiteral
                && alphaLiteral instanceof Literals.IntLiteral) {
            return List.of(Literals.of(self.toLong() + alphaLiteral.toLong() * other.toLong()));
        }
        return List.of(Literals.of(self.toDouble() + alphaLiteral.toDouble() * other.toDouble()));
    }
}
