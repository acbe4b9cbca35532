package io.surfworks.convfuse.fusion;

import io.surfworks.convfuse.ir.Node;

/**
 * Tells whether a convolution is handled by a separate vectorized code path,
 * in which case the fusion pass leaves it alone.
 */
@FunctionalInterface
public interface VectorizedConvSupport {

    VectorizedConvSupport NONE = conv -> false;

    /**
     * @param conv an {@code aten::conv2d} node
     * @return true if the vectorized path claims the convolution
     */
    boolean claims(Node conv);
}
