package io.surfworks.convfuse.ir.rewrite;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A match pattern paired with the replacement that substitutes each match.
 *
 * <p>Both sides must declare exactly the same parameters, every match
 * parameter must be used by the match, and every node on either side must
 * contribute to its output. Violations are authoring bugs and throw
 * {@link PatternAuthoringException} at construction.
 *
 * @param name        name used in logs and reports
 * @param match       the subgraph to find; its output is produced by the anchor node
 * @param replacement the subgraph inserted in place of each match
 */
public record RewritePattern(String name, PatternGraph match, PatternGraph replacement) {

    public RewritePattern {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(match, "match cannot be null");
        Objects.requireNonNull(replacement, "replacement cannot be null");

        Set<String> matchParams = new TreeSet<>(match.parameters().keySet());
        Set<String> replacementParams = new TreeSet<>(replacement.parameters().keySet());
        if (!matchParams.equals(replacementParams)) {
            throw new PatternAuthoringException(String.format(
                    "Rewrite '%s': match parameters %s differ from replacement parameters %s",
                    name, matchParams, replacementParams));
        }

        if (match.output().isParameter()) {
            throw new PatternAuthoringException("Rewrite '" + name + "': match output must be produced by a node");
        }

        Set<String> unused = new TreeSet<>(matchParams);
        unused.removeAll(match.usedParameterNames());
        if (!unused.isEmpty()) {
            throw new PatternAuthoringException(String.format(
                    "Rewrite '%s': match parameters %s are never used, they could not be bound", name, unused));
        }

        if (match.reachableNodes().size() != match.nodes().size()) {
            throw new PatternAuthoringException("Rewrite '" + name + "': match has nodes that don't reach its output");
        }
        if (replacement.reachableNodes().size() != replacement.nodes().size()) {
            throw new PatternAuthoringException(
                    "Rewrite '" + name + "': replacement has nodes that don't reach its output");
        }
    }

    /**
     * Returns the node the anchor must match.
     */
    public PatternNode anchor() {
        return match.output().producer();
    }
}
