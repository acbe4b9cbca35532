package io.surfworks.convfuse.packed;

import java.util.Objects;

/**
 * Packed convolution embedded in a graph as a constant. Holds no reference to
 * the graph it was packed in.
 */
public record FrozenConvOpContext(ConvPackedWeights payload) implements ConvOpContext {

    public FrozenConvOpContext {
        Objects.requireNonNull(payload, "payload cannot be null");
    }

    @Override
    public FrozenConvOpContext toWeakReference() {
        return this;
    }

    @Override
    public boolean isWeakReference() {
        return true;
    }

    @Override
    public String toString() {
        return "FrozenConvOpContext[attr=" + payload.attr() + "]";
    }
}
