package io.surfworks.convfuse.fusion;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.convfuse.config.FusionConfig;
import io.surfworks.convfuse.ir.MemoryFormat;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Types.TensorType;
import io.surfworks.convfuse.ir.Value;

/**
 * Decides whether an {@code aten::conv2d} node may be turned into a
 * prepack/run pair.
 *
 * <p>A convolution is eligible when
 * <ol>
 *   <li>the activation is contiguous in the preferred memory format,</li>
 *   <li>so is the weight,</li>
 *   <li>the vectorized depthwise path does not claim it, and</li>
 *   <li>every tensor operand is known to live on the CPU.</li>
 * </ol>
 * Missing layout or device information makes a node ineligible.
 */
public final class ConvEligibility {

    private static final Logger LOG = Logger.getLogger(ConvEligibility.class.getName());

    private final MemoryFormat memoryFormat;
    private final VectorizedConvSupport vectorized;

    public ConvEligibility(MemoryFormat memoryFormat, VectorizedConvSupport vectorized) {
        this.memoryFormat = memoryFormat;
        this.vectorized = vectorized;
    }

    public static ConvEligibility forConfig(FusionConfig config) {
        VectorizedConvSupport vectorized = config.leaveDepthwiseToVectorizedPath()
                ? new DepthwiseConvSupport()
                : VectorizedConvSupport.NONE;
        return new ConvEligibility(config.preferredMemoryFormat(), vectorized);
    }

    public boolean isEligible(Node conv) {
        Optional<String> reason = rejectionReason(conv);
        reason.ifPresent(r -> LOG.fine(() -> "Leaving " + conv.output() + " = " + conv.kind() + " alone: " + r));
        return reason.isEmpty();
    }

    /**
     * Returns why the node is not eligible, or empty if it is.
     */
    public Optional<String> rejectionReason(Node conv) {
        if (conv.inputs().size() < 2) {
            return Optional.of("expected activation and weight operands");
        }
        if (!isContiguous(conv.input(0))) {
            return Optional.of("activation is not " + layoutName() + " contiguous");
        }
        if (!isContiguous(conv.input(1))) {
            return Optional.of("weight is not " + layoutName() + " contiguous");
        }
        if (vectorized.claims(conv)) {
            return Optional.of("claimed by the vectorized depthwise path");
        }
        for (Value operand : conv.inputs()) {
            if (operand.type() instanceof TensorType tensor) {
                if (tensor.device() == null) {
                    return Optional.of(operand + " has no known device");
                }
                if (!tensor.device().isCpu()) {
                    return Optional.of(operand + " is on " + tensor.device().toIrString());
                }
            }
        }
        return Optional.empty();
    }

    private boolean isContiguous(Value v) {
        return v.type() instanceof TensorType tensor && tensor.isContiguous(memoryFormat);
    }

    private String layoutName() {
        return memoryFormat.name().toLowerCase(Locale.ROOT);
    }
}
