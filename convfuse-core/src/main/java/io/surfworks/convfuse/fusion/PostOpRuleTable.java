package io.surfworks.convfuse.fusion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import io.surfworks.convfuse.ir.Literals.Literal;
import io.surfworks.convfuse.ir.Literals.StringLiteral;
import io.surfworks.convfuse.ir.rewrite.MatchFilter;
import io.surfworks.convfuse.ir.rewrite.PatternAuthoringException;
import io.surfworks.convfuse.packed.PostOps;

/**
 * The post-ops that can be fused into a packed convolution, ordered by name.
 *
 * <p>The {@code "none"} entry is the sentinel for "no post-op" and never
 * produces a rewrite.
 */
public final class PostOpRuleTable {

    /** Accepts gelu only with an approximation the packed kernel implements. */
    static final MatchFilter GELU_APPROXIMATION = match -> {
        Optional<Literal> approximate = match.constant("approximate");
        return approximate.isPresent()
                && approximate.get() instanceof StringLiteral s
                && (s.value().equals(PostOps.NONE) || s.value().equals(PostOps.TANH));
    };

    public static final PostOpRuleTable DEFAULT = new PostOpRuleTable(List.of(
            PostOpRule.of(PostOps.NONE),
            PostOpRule.of(PostOps.RELU),
            PostOpRule.of(PostOps.SIGMOID),
            PostOpRule.of(PostOps.TANH),
            PostOpRule.of(PostOps.HARDTANH, "min_val", "max_val"),
            PostOpRule.of(PostOps.LEAKY_RELU, "negative_slope"),
            PostOpRule.withAlgorithm(PostOps.GELU, "approximate", GELU_APPROXIMATION)));

    private final Map<String, PostOpRule> rules;

    /**
     * @throws PatternAuthoringException if two rules share a name, a rule names an
     *         attribute the packed kernels don't know, or {@code none} or {@code relu} is missing
     */
    public PostOpRuleTable(List<PostOpRule> rules) {
        Map<String, PostOpRule> byName = new TreeMap<>();
        for (PostOpRule rule : rules) {
            if (byName.put(rule.name(), rule) != null) {
                throw new PatternAuthoringException("Duplicate post-op rule '" + rule.name() + "'");
            }
            if (!PostOps.isKnown(rule.name()) || PostOps.isSum(rule.name())) {
                throw new PatternAuthoringException("'" + rule.name() + "' is not an elementwise fusion attribute");
            }
        }
        if (!byName.containsKey(PostOps.NONE) || !byName.containsKey(PostOps.RELU)) {
            throw new PatternAuthoringException("Post-op table needs the '" + PostOps.NONE
                    + "' and '" + PostOps.RELU + "' entries");
        }
        this.rules = Collections.unmodifiableMap(byName);
    }

    public Optional<PostOpRule> get(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    /**
     * All rules, sentinel included, ordered by name.
     */
    public List<PostOpRule> rules() {
        return List.copyOf(rules.values());
    }

    /**
     * Rules that generate a rewrite, ordered by name.
     */
    public List<PostOpRule> fusionRules() {
        List<PostOpRule> result = new ArrayList<>();
        for (PostOpRule rule : rules.values()) {
            if (!rule.isSentinel()) {
                result.add(rule);
            }
        }
        return result;
    }
}
