package io.surfworks.convfuse.fusion;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.surfworks.convfuse.ir.Symbol;
import io.surfworks.convfuse.ir.rewrite.MatchFilter;
import io.surfworks.convfuse.ir.rewrite.PatternAuthoringException;
import io.surfworks.convfuse.packed.PostOps;

/**
 * One entry of the post-op fusion table: an {@code aten} operator that may
 * follow a packed convolution and be folded into it.
 *
 * @param name             operator name, also the fusion attribute
 * @param scalarOperands   names of the operator's scalar operands, in order
 * @param algorithmOperand name of the operator's string algorithm operand, or null
 * @param filter           extra condition a match has to satisfy, or null
 */
public record PostOpRule(String name, List<String> scalarOperands, String algorithmOperand, MatchFilter filter) {

    public PostOpRule {
        Objects.requireNonNull(name, "name cannot be null");
        scalarOperands = List.copyOf(scalarOperands);

        Set<String> seen = new HashSet<>();
        for (String operand : operands(scalarOperands, algorithmOperand)) {
            if (!seen.add(operand)) {
                throw new PatternAuthoringException("Post-op '" + name + "' declares operand '" + operand + "' twice");
            }
            if (PostOpPatternTemplates.RESERVED_NAMES.contains(operand)) {
                throw new PatternAuthoringException(
                        "Post-op '" + name + "' operand '" + operand + "' shadows a template parameter");
            }
        }
        if (PostOps.NONE.equals(name) && (!scalarOperands.isEmpty() || algorithmOperand != null || filter != null)) {
            throw new PatternAuthoringException("The '" + PostOps.NONE + "' entry takes no operands");
        }
    }

    public static PostOpRule of(String name, String... scalarOperands) {
        return new PostOpRule(name, List.of(scalarOperands), null, null);
    }

    public static PostOpRule withAlgorithm(String name, String algorithmOperand, MatchFilter filter) {
        return new PostOpRule(name, List.of(), algorithmOperand, filter);
    }

    /**
     * Operator this rule fuses, {@code aten::<name>}.
     */
    public Symbol opKind() {
        return Symbol.aten(name);
    }

    public boolean isSentinel() {
        return PostOps.NONE.equals(name);
    }

    public boolean hasAlgorithm() {
        return algorithmOperand != null;
    }

    /**
     * Returns the rule's own filter, {@link MatchFilter#ALWAYS} when it has none.
     */
    public MatchFilter filterOrAlways() {
        return filter == null ? MatchFilter.ALWAYS : filter;
    }

    /**
     * All operand names the operator takes after the convolution result.
     */
    public List<String> operands() {
        return operands(scalarOperands, algorithmOperand);
    }

    private static List<String> operands(List<String> scalars, String algorithm) {
        if (algorithm == null) {
            return scalars;
        }
        List<String> all = new ArrayList<>(scalars);
        all.add(algorithm);
        return List.copyOf(all);
    }
}
