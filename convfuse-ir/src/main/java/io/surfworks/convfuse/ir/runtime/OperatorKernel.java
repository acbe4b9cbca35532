package io.surfworks.convfuse.ir.runtime;

import java.util.List;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Node;

/**
 * Interface for operator kernels.
 * Each kernel implements execution logic for one operator kind.
 */
@FunctionalInterface
public interface OperatorKernel {

    /**
     * Execute the operator.
     *
     * @param node   The node being executed, for its kind, arity and output types
     * @param inputs Input values, one per node input
     * @return Output values, one per node output
     */
    List<Literal> execute(Node node, List<Literal> inputs);
}
