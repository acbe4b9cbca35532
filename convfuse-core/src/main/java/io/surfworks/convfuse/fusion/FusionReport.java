package io.surfworks.convfuse.fusion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rewrite counts of one pipeline run, per step, in execution order.
 */
public final class FusionReport {

    private final Map<String, Integer> steps = new LinkedHashMap<>();

    void record(String step, int rewrites) {
        steps.merge(step, rewrites, Integer::sum);
    }

    public Map<String, Integer> steps() {
        return Collections.unmodifiableMap(steps);
    }

    /**
     * Returns the rewrites performed by a step, 0 if it did not run.
     */
    public int count(String step) {
        return steps.getOrDefault(step, 0);
    }

    public int totalRewrites() {
        int total = 0;
        for (int n : steps.values()) {
            total += n;
        }
        return total;
    }

    @Override
    public String toString() {
        return "FusionReport" + steps;
    }
}
