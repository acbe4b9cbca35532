package io.surfworks.convfuse.ir.rewrite;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.surfworks.convfuse.ir.Block;
import io.surfworks.convfuse.ir.Node;
import io.surfworks.convfuse.ir.Use;
import io.surfworks.convfuse.ir.Value;

/**
 * Matches a pattern graph backwards from a candidate anchor node.
 *
 * <p>A match requires:
 * <ul>
 *   <li>every pattern node to map to a distinct graph node of the same kind,
 *       input count and output count, in the anchor's block and without
 *       nested blocks;</li>
 *   <li>constant pattern nodes to map to constants with an equal literal;</li>
 *   <li>each parameter to bind one graph value, consistently across uses;</li>
 *   <li>outputs of non-anchor matched nodes to be used only inside the match;</li>
 *   <li>no parameter to be bound to a value produced inside the match.</li>
 * </ul>
 */
public final class SubgraphMatcher {

    private final RewritePattern pattern;
    private final Node anchor;
    private final Map<PatternNode, Node> nodeMap = new LinkedHashMap<>();
    private final Map<Node, PatternNode> reverseNodeMap = new HashMap<>();
    private final Map<PatternValue, Value> valueMap = new HashMap<>();

    private SubgraphMatcher(RewritePattern pattern, Node anchor) {
        this.pattern = pattern;
        this.anchor = anchor;
    }

    /**
     * Attempts to match {@code pattern} with {@code anchor} producing its output.
     *
     * @return the match, or empty if the structure doesn't fit
     */
    public static Optional<Match> match(RewritePattern pattern, Node anchor) {
        Objects.requireNonNull(anchor, "anchor cannot be null");
        if (anchor.isDestroyed() || anchor.owningBlock() == null) {
            return Optional.empty();
        }
        return new SubgraphMatcher(pattern, anchor).run();
    }

    private Optional<Match> run() {
        PatternNode root = pattern.anchor();
        if (!matchNode(root, anchor)) {
            return Optional.empty();
        }
        if (!intermediatesStayInside() || !parametersBoundOutside()) {
            return Optional.empty();
        }

        Map<String, Value> values = new LinkedHashMap<>();
        for (Map.Entry<PatternValue, Value> e : valueMap.entrySet()) {
            values.put(e.getKey().name(), e.getValue());
        }
        List<Node> nodes = new ArrayList<>();
        for (PatternNode pn : pattern.match().nodes()) {
            nodes.add(nodeMap.get(pn));
        }
        return Optional.of(new Match(pattern.name(), anchor, nodes, values));
    }

    private boolean matchValue(PatternValue pv, Value gv) {
        Value bound = valueMap.get(pv);
        if (bound != null) {
            return bound == gv;
        }

        if (pv.isParameter()) {
            valueMap.put(pv, gv);
            return true;
        }

        PatternNode producer = pv.producer();
        Node graphProducer = gv.node();
        if (graphProducer.owningBlock() == null || graphProducer.owningBlock().paramNode() == graphProducer) {
            return false;
        }
        if (!matchNode(producer, graphProducer)) {
            return false;
        }
        valueMap.put(pv, gv);
        return true;
    }

    private boolean matchNode(PatternNode pn, Node n) {
        Node mapped = nodeMap.get(pn);
        if (mapped != null) {
            return mapped == n;
        }
        if (reverseNodeMap.containsKey(n)) {
            return false;
        }

        if (!n.kind().equals(pn.kind())) {
            return false;
        }
        Block block = anchor.owningBlock();
        if (n.owningBlock() != block || !n.blocks().isEmpty()) {
            return false;
        }
        if (n.inputs().size() != pn.inputs().size() || n.outputs().size() != 1) {
            return false;
        }
        if (pn.isConstant() && !Objects.equals(pn.literal(), n.literal())) {
            return false;
        }

        nodeMap.put(pn, n);
        reverseNodeMap.put(n, pn);
        valueMap.put(pn.output(), n.output());

        for (int i = 0; i < pn.inputs().size(); i++) {
            if (!matchValue(pn.inputs().get(i), n.input(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean intermediatesStayInside() {
        for (Node n : nodeMap.values()) {
            if (n == anchor) {
                continue;
            }
            for (Value out : n.outputs()) {
                for (Use use : out.uses()) {
                    if (!reverseNodeMap.containsKey(use.user())) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private boolean parametersBoundOutside() {
        Set<Node> matched = new HashSet<>(nodeMap.values());
        for (Map.Entry<PatternValue, Value> e : valueMap.entrySet()) {
            if (e.getKey().isParameter() && matched.contains(e.getValue().node())) {
                return false;
            }
        }
        return true;
    }
}
