package io.surfworks.convfuse.ir.passes;

import io.surfworks.convfuse.ir.Block;
import io.surfworks.convfuse.ir.Node;

/**
 * Callbacks for {@link BlockWalker}.
 */
public interface BlockVisitor {

    /**
     * Called for each live node, after the node's nested blocks have been walked.
     */
    void visitNode(Node node);

    /**
     * Called once all nodes of a block have been visited.
     */
    default void exitBlock(Block block) {
    }
}
