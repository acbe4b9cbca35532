package io.surfworks.convfuse.fusion;

import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.passes.GraphPass;
import io.surfworks.convfuse.ir.rewrite.SubgraphRewriter;

/**
 * Folds elementwise operators that follow a packed convolution into the
 * prepack's fusion attribute, one rewrite per entry of the rule table.
 */
public final class EltwiseFusion implements GraphPass {

    private static final Logger LOG = Logger.getLogger(EltwiseFusion.class.getName());

    private final PostOpRuleTable table;

    public EltwiseFusion(PostOpRuleTable table) {
        this.table = table;
    }

    @Override
    public String name() {
        return "EltwiseFusion";
    }

    @Override
    public int run(Graph graph) {
        int total = 0;
        for (PostOpRule rule : table.fusionRules()) {
            SubgraphRewriter rewriter = new SubgraphRewriter();
            rewriter.registerRewritePattern(PostOpPatternTemplates.rewritePattern(rule));
            int fused = rewriter.runOnGraph(graph, PostOpPatternTemplates.filterFor(rule));
            if (fused > 0) {
                LOG.fine("Fused " + fused + " " + rule.opKind() + " node(s) into packed convolutions");
            }
            total += fused;
        }
        return total;
    }
}
