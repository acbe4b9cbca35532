package io.surfworks.convfuse.ir.passes;

import io.surfworks.convfuse.ir.Block;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.Node;

/**
 * Depth-first traversal shared by the mutating passes.
 *
 * <p>For each node of a block, in order, the node's nested blocks are walked
 * first and then the node itself is visited. When the block is exhausted the
 * visitor's {@link BlockVisitor#exitBlock} runs, so per-block cleanup always
 * happens after every nested level has been cleaned.
 *
 * <p>Nodes destroyed by the visitor while the walk is in progress are skipped.
 */
public final class BlockWalker {

    private BlockWalker() {}

    public static void walk(Graph graph, BlockVisitor visitor) {
        walk(graph.block(), visitor);
    }

    public static void walk(Block block, BlockVisitor visitor) {
        for (Node node : block.nodes()) {
            if (node.isDestroyed()) {
                continue;
            }
            for (Block nested : node.blocks()) {
                walk(nested, visitor);
            }
            if (!node.isDestroyed()) {
                visitor.visitNode(node);
            }
        }
        visitor.exitBlock(block);
    }
}
