package io.surfworks.convfuse.ir.rewrite;

/**
 * Predicate evaluated on each structural match before it is accepted.
 */
@FunctionalInterface
public interface MatchFilter {

    MatchFilter ALWAYS = match -> true;

    boolean test(Match match);

    default MatchFilter and(MatchFilter other) {
        return match -> test(match) && other.test(match);
    }
}
