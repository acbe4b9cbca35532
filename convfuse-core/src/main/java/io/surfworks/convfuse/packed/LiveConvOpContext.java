package io.surfworks.convfuse.packed;

import java.util.Objects;

import io.surfworks.convfuse.ir.Graph;

/**
 * Packed convolution owned by the graph whose prepack node produced it.
 *
 * @param payload the packed parameters
 * @param owner   the producing graph
 */
public record LiveConvOpContext(ConvPackedWeights payload, Graph owner) implements ConvOpContext {

    public LiveConvOpContext {
        Objects.requireNonNull(payload, "payload cannot be null");
        Objects.requireNonNull(owner, "owner cannot be null");
    }

    @Override
    public boolean isWeakReference() {
        return false;
    }

    @Override
    public String toString() {
        return "LiveConvOpContext[attr=" + payload.attr() + "]";
    }
}
