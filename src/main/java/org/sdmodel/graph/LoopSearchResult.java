package org.sdmodel.graph;

import java.util.List;

/**
 * Loops found by a search, in report order, and whether the search stopped early.
 *
 * @param loops     Loops sorted by {@link Loop#REPORT_ORDER}
 * @param stoppedBy Why the search ended before exhausting the graph, or {@code COMPLETE}
 * @param steps     Search steps spent
 */
public record LoopSearchResult(List<Loop> loops, StopReason stoppedBy, long steps) {

    public enum StopReason {
        COMPLETE,
        MAX_LOOPS,
        MAX_STEPS,
        TIME_BUDGET
    }

    public LoopSearchResult {
        loops = List.copyOf(loops);
    }

    public boolean isTruncated() {
        return stoppedBy != StopReason.COMPLETE;
    }

    public int totalLoops() {
        return loops.size();
    }

    public LoopSummary summary() {
        return LoopSummary.of(loops);
    }
}
