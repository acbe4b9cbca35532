package io.surfworks.convfuse.ir.runtime;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbol;

/**
 * Dispatches graph nodes to their operator kernels.
 *
 * <p>Kernels registered with {@link #register} are pure: their result depends
 * only on their inputs, so constant propagation may evaluate them at compile
 * time. Kernels with side effects are registered with {@link #registerImpure}.
 */
public final class OperatorRegistry {

    private final Map<Symbol, OperatorKernel> kernels = new ConcurrentHashMap<>();
    private final Set<Symbol> impure = ConcurrentHashMap.newKeySet();

    /**
     * Creates a registry with no kernels.
     */
    public OperatorRegistry() {
    }

    /**
     * Creates a registry holding the {@link StandardOperators}.
     */
    public static OperatorRegistry withStandardOperators() {
        OperatorRegistry registry = new OperatorRegistry();
        StandardOperators.registerAll(registry);
        return registry;
    }

    /**
     * Register a pure kernel for an operator kind, replacing any previous one.
     */
    public OperatorRegistry register(Symbol kind, OperatorKernel kernel) {
        kernels.put(kind, kernel);
        impure.remove(kind);
        return this;
    }

    /**
     * Register a kernel with side effects for an operator kind.
     */
    public OperatorRegistry registerImpure(Symbol kind, OperatorKernel kernel) {
        kernels.put(kind, kernel);
        impure.add(kind);
        return this;
    }

    /**
     * Execute a node.
     *
     * @param node   The node to execute
     * @param inputs Input values
     * @return Output values
     * @throws UnsupportedOperationException if no kernel is registered
     */
    public List<Literal> dispatch(Node node, List<Literal> inputs) {
        OperatorKernel kernel = kernels.get(node.kind());
        if (kernel == null) {
            throw new UnsupportedOperationException("No kernel registered for operator: " + node.kind());
        }
        return kernel.execute(node, inputs);
    }

    public boolean supports(Symbol kind) {
        return kernels.containsKey(kind);
    }

    /**
     * Returns true if a kernel is registered for the kind and has no side effects.
     */
    public boolean isPure(Symbol kind) {
        return kernels.containsKey(kind) && !impure.contains(kind);
    }

    /**
     * Get the set of operator kinds with a registered kernel.
     */
    public Set<Symbol> supportedKinds() {
        return Set.copyOf(kernels.keySet());
    }
}
