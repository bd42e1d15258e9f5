package org.sdmodel.graph;

import java.time.Duration;

/**
 * Bounds on loop enumeration.
 *
 * The number of simple cycles can grow exponentially with the density of a diagram.
 * A bounded search returns a subset of the loops: this is a deliberate trade of
 * completeness for running time, not an error. Callers that need every loop of a
 * large model must leave the bounds open and accept the cost.
 *
 * @param maxLength  Longest cycle to report, in nodes
 * @param maxLoops   Stop after this many loops
 * @param maxSteps   Stop after this many search steps (edge inspections)
 * @param timeBudget Stop once this much wall-clock time has passed; null for none
 */
public record LoopSearchLimits(int maxLength, int maxLoops, long maxSteps, Duration timeBudget) {

    public LoopSearchLimits {
        if (maxLength < 1 || maxLoops < 1 || maxSteps < 1) {
            throw new IllegalArgumentException("Loop search limits must be positive");
        }
        if (timeBudget != null && timeBudget.isNegative()) {
            throw new IllegalArgumentException("Time budget must not be negative");
        }
    }

    public static LoopSearchLimits unbounded() {
        return new LoopSearchLimits(Integer.MAX_VALUE, Integer.MAX_VALUE, Long.MAX_VALUE, null);
    }

    public LoopSearchLimits withMaxLength(int length) {
        return new LoopSearchLimits(length, maxLoops, maxSteps, timeBudget);
    }

    public LoopSearchLimits withMaxLoops(int loops) {
        return new LoopSearchLimits(maxLength, loops, maxSteps, timeBudget);
    }

    public LoopSearchLimits withMaxSteps(long steps) {
        return new LoopSearchLimits(maxLength, maxLoops, steps, timeBudget);
    }

    public LoopSearchLimits withTimeBudget(Duration budget) {
        return new LoopSearchLimits(maxLength, maxLoops, maxSteps, budget);
    }

    public boolean isLengthBounded() {
        return maxLength != Integer.MAX_VALUE;
    }
}
