package org.sdmodel.graph;

import java.util.List;

/**
 * Counts and extremes over a set of loops.
 */
public record LoopSummary(int reinforcingLoops, int balancingLoops, int shortestLoop, int longestLoop) {

    public static LoopSummary of(List<Loop> loops) {
        int reinforcing = 0;
        int shortest = 0;
        int longest = 0;
        for (Loop loop : loops) {
            if (loop.type() == LoopType.REINFORCING) {
                reinforcing++;
            }
            shortest = shortest == 0 ? loop.length() : Math.min(shortest, loop.length());
            longest = Math.max(longest, loop.length());
        }
        return new LoopSummary(reinforcing, loops.size() - reinforcing, shortest, longest);
    }
}
