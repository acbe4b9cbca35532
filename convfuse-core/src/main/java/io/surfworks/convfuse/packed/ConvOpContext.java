package io.surfworks.convfuse.packed;

import io.surfworks.convfuse.ir.CustomObject;
import io.surfworks.convfuse.ir.runtime.Tensor;

/**
 * A packed convolution, as produced by {@code conv2d_prepack}.
 *
 * <p>The live form is what evaluating a prepack node returns and stays tied to
 * the graph that produced it. The frozen form shares the same payload and is
 * what gets embedded as a constant once the prepack has been folded. Both run
 * the same way, so run kernels never need to know which one they hold.
 */
public sealed interface ConvOpContext extends CustomObject permits LiveConvOpContext, FrozenConvOpContext {

    ConvPackedWeights payload();

    @Override
    default String className() {
        return PrepackedOps.CONV_OP_CONTEXT_CLASS;
    }

    @Override
    default FrozenConvOpContext toWeakReference() {
        return new FrozenConvOpContext(payload());
    }

    default Tensor run(Tensor input) {
        return payload().run(input);
    }

    default Tensor sumRun(Tensor input, Tensor accumu) {
        return payload().sumRun(input, accumu);
    }
}
