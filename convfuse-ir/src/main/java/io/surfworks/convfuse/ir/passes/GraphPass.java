package io.surfworks.convfuse.ir.passes;

import io.surfworks.convfuse.ir.Graph;

/**
 * A transformation that mutates a graph in place.
 */
public interface GraphPass {

    /**
     * Name used in logs, traces and reports.
     */
    String name();

    /**
     * Runs the pass.
     *
     * @param graph the graph to transform
     * @return the number of rewrites performed, 0 if the graph is unchanged
     */
    int run(Graph graph);
}
