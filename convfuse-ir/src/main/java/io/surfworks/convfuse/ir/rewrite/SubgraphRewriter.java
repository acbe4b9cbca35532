package io.surfworks.convfuse.ir.rewrite;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.InsertPoint;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Types.TensorType;
import io.surfworks.convfuse.ir.Value;

/**
 * Finds occurrences of registered match patterns and substitutes their replacements.
 *
 * <p>For each registered pattern, in registration order, the rewriter scans
 * the whole graph once (nested blocks included) and collects every match whose
 * filters all accept it and which shares no node with a match accepted
 * earlier in the same scan. The collected matches are then applied one after
 * another:
 * <ol>
 *   <li>the replacement nodes are inserted right before the anchor;</li>
 *   <li>uses of the anchor's output are redirected to the replacement output;</li>
 *   <li>the matched nodes lose their inputs and are destroyed.</li>
 * </ol>
 *
 * <p>Example usage:
 * <pre>{@code
 * SubgraphRewriter rewriter = new SubgraphRewriter();
 * rewriter.registerRewritePattern(new RewritePattern("conv_relu", match, replacement));
 * int rewrites = rewriter.runOnGraph(graph, attributeIsNone);
 * }</pre>
 */
public final class SubgraphRewriter {

    private static final Logger LOG = Logger.getLogger(SubgraphRewriter.class.getName());

    private final List<RewritePattern> patterns = new ArrayList<>();
    private final List<Match> lastMatches = new ArrayList<>();

    public SubgraphRewriter registerRewritePattern(RewritePattern pattern) {
        patterns.add(pattern);
        return this;
    }

    public SubgraphRewriter registerRewritePattern(String name, PatternGraph match, PatternGraph replacement) {
        return registerRewritePattern(new RewritePattern(name, match, replacement));
    }

    public List<RewritePattern> patterns() {
        return List.copyOf(patterns);
    }

    /**
     * Applies every registered pattern to the graph.
     *
     * @param filters predicates that must all accept a match for it to be applied
     * @return the number of matches replaced
     */
    public int runOnGraph(Graph graph, MatchFilter... filters) {
        lastMatches.clear();
        int total = 0;
        for (RewritePattern pattern : patterns) {
            List<Match> matches = findMatches(graph, pattern, filters);
            Map<Value, Value> rewrittenValues = new HashMap<>();
            for (Match match : matches) {
                apply(graph, pattern, match, rewrittenValues);
            }
            lastMatches.addAll(matches);
            total += matches.size();
            if (!matches.isEmpty()) {
                LOG.fine("Rewrite '" + pattern.name() + "' replaced " + matches.size() + " match(es)");
            }
        }
        return total;
    }

    /**
     * Returns the matches applied by the last {@link #runOnGraph} call.
     */
    public List<Match> lastMatches() {
        return List.copyOf(lastMatches);
    }

    /**
     * Collects the non-overlapping, filter-accepted matches of one pattern.
     */
    static List<Match> findMatches(Graph graph, RewritePattern pattern, MatchFilter... filters) {
        List<Match> accepted = new ArrayList<>();
        Set<Node> claimed = new HashSet<>();
        for (Node candidate : graph.allNodes()) {
            if (!candidate.kind().equals(pattern.anchor().kind())) {
                continue;
            }
            Optional<Match> found = SubgraphMatcher.match(pattern, candidate);
            if (found.isEmpty()) {
                continue;
            }
            Match match = found.get();
            if (overlaps(match, claimed)) {
                LOG.fine(() -> "Rewrite '" + pattern.name() + "': skipping overlapping " + match);
                continue;
            }
            if (!acceptedByAll(match, filters)) {
                LOG.fine(() -> "Rewrite '" + pattern.name() + "': filter rejected " + match);
                continue;
            }
            claimed.addAll(match.nodes());
            accepted.add(match);
        }
        return accepted;
    }

    private static boolean overlaps(Match match, Set<Node> claimed) {
        for (Node n : match.nodes()) {
            if (claimed.contains(n)) {
                return true;
            }
        }
        return false;
    }

    private static boolean acceptedByAll(Match match, MatchFilter... filters) {
        for (MatchFilter filter : filters) {
            if (!filter.test(match)) {
                return false;
            }
        }
        return true;
    }

    private static void apply(Graph graph, RewritePattern pattern, Match match, Map<Value, Value> rewrittenValues) {
        Node anchor = match.anchor();
        Value anchorOutput = anchor.output();
        PatternGraph replacement = pattern.replacement();

        Map<PatternValue, Value> created = new HashMap<>();
        try (InsertPoint ignored = graph.insertPointBefore(anchor)) {
            for (PatternNode pn : replacement.nodes()) {
                Value out;
                if (pn.isConstant()) {
                    out = graph.insertConstant(pn.literal());
                } else {
                    List<Value> inputs = new ArrayList<>();
                    for (PatternValue in : pn.inputs()) {
                        inputs.add(resolve(in, match, created, rewrittenValues));
                    }
                    out = graph.insertNode(graph.create(pn.kind(), inputs, 1)).output();
                    out.setType(TensorType.unknown());
                }
                if (pn.output() == replacement.output()) {
                    out.setType(anchorOutput.type());
                } else if (pn.output().type() != null) {
                    out.setType(pn.output().type());
                }
                created.put(pn.output(), out);
            }
        }

        Value result = resolve(replacement.output(), match, created, rewrittenValues);
        anchorOutput.replaceAllUsesWith(result);
        rewrittenValues.put(anchorOutput, result);

        for (Node n : match.nodes()) {
            n.removeAllInputs();
        }
        for (int i = match.nodes().size() - 1; i >= 0; i--) {
            match.nodes().get(i).destroy();
        }
    }

    private static Value resolve(PatternValue pv, Match match, Map<PatternValue, Value> created,
                                 Map<Value, Value> rewrittenValues) {
        if (!pv.isParameter()) {
            return created.get(pv);
        }
        Value v = match.value(pv.name());
        Value replaced = rewrittenValues.get(v);
        while (replaced != null) {
            v = replaced;
            replaced = rewrittenValues.get(v);
        }
        return v;
    }
}
