package io.surfworks.convfuse.ir.passes;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Block;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Symbol;
import io.surfworks.convfuse.ir.Symbols;

/**
 * Removes nodes whose outputs are unused and that have no side effects.
 *
 * <p>Blocks are swept back to front so a node whose only consumer was just
 * removed is removed in the same sweep. Nested blocks are swept before their
 * owner is considered.
 */
public final class DeadCodeElimination implements GraphPass {

    private static final Logger LOG = Logger.getLogger(DeadCodeElimination.class.getName());

    private static final Set<Symbol> SIDE_EFFECTS = Set.of(Symbols.PRINT, Symbols.RAISE_EXCEPTION);

    @Override
    public String name() {
        return "DeadCodeElimination";
    }

    @Override
    public int run(Graph graph) {
        return run(graph.block());
    }

    /**
     * Sweeps one block and everything nested in it.
     *
     * @return the number of nodes removed
     */
    public int run(Block block) {
        int removed = 0;
        List<Node> nodes = block.nodes();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            Node node = nodes.get(i);
            if (node.isDestroyed()) {
                continue;
            }
            for (Block nested : node.blocks()) {
                removed += run(nested);
            }
            if (!node.hasUses() && !hasSideEffects(node)) {
                node.removeAllInputs();
                node.destroy();
                removed++;
            }
        }
        if (removed > 0) {
            LOG.fine("Removed " + removed + " dead node(s)");
        }
        return removed;
    }

    /**
     * Returns true if the node, or any node nested in it, has side effects.
     */
    public static boolean hasSideEffects(Node node) {
        if (SIDE_EFFECTS.contains(node.kind())) {
            return true;
        }
        for (Block nested : node.blocks()) {
            for (Node inner : nested.nodes()) {
                if (hasSideEffects(inner)) {
                    return true;
                }
            }
        }
        return false;
    }
}
