package org.sdmodel.graph;

import org.sdmodel.graph.LoopSearchResult.StopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates every simple directed cycle of a {@link SignedGraph} and classifies it.
 *
 * Nodes are taken as cycle starts in name order. For a start {@code s} the search is
 * confined to the strongly connected component of {@code s} within the nodes that
 * sort after it, so each cycle is produced exactly once, beginning at its smallest
 * node. The search runs on an explicit stack and is exposed as a lazy iterator: each
 * call to {@link #loops()} starts a fresh, independent pass, and a caller may stop
 * pulling at any point.
 *
 * The edge used between two nodes is the one whose arrow came first in the sketch.
 */
public final class LoopEnumerator {

    private static final Logger LOG = LoggerFactory.getLogger(LoopEnumerator.class);

    private static final int CLOCK_CHECK_INTERVAL = 1024;

    /**
     * Absolute {@link System#nanoTime()} deadline for a budget, saturating at
     * {@link Long#MAX_VALUE} for budgets too large to represent.
     */
    static long deadlineFor(Duration budget) {
        if (budget == null) {
            return Long.MAX_VALUE;
        }
        try {
            return Math.addExact(System.nanoTime(), budget.toNanos());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private final SignedGraph graph;
    private final LoopSearchLimits limits;
    private final List<String> order;
    private final Map<String, Integer> rank = new HashMap<>();
    private final Map<String, List<String>> predecessors = new HashMap<>();

    public LoopEnumerator(SignedGraph graph) {
        this(graph, LoopSearchLimits.unbounded());
    }

    public LoopEnumerator(SignedGraph graph, LoopSearchLimits limits) {
        this.graph = graph;
        this.limits = limits;
        this.order = new ArrayList<>(graph.nodes());
        for (int i = 0; i < order.size(); i++) {
            rank.put(order.get(i), i);
        }
        for (String node : order) {
            for (String next : graph.successors(node)) {
                predecessors.computeIfAbsent(next, k -> new ArrayList<>()).add(node);
            }
        }
    }

    // ==================== Entry points ====================

    /**
     * Enumerate and sort loops within the limits.
     */
    public static LoopSearchResult findLoops(SignedGraph graph, LoopSearchLimits limits) {
        return new LoopEnumerator(graph, limits).findLoops();
    }

    public LoopSearchResult findLoops() {
        Search search = loops();
        List<Loop> found = new ArrayList<>();
        StopReason reason = null;
        while (search.hasNext()) {
            if (found.size() >= limits.maxLoops()) {
                reason = StopReason.MAX_LOOPS;
                break;
            }
            found.add(search.next());
        }
        if (reason == null) {
            reason = search.stopReason();
        }
        found.sort(Loop.REPORT_ORDER);

        if (reason != StopReason.COMPLETE) {
            LOG.warn("Loop search stopped early ({}) after {} loops and {} steps; the result is partial",
                    reason, found.size(), search.steps());
        } else {
            LOG.debug("Found {} loops in {} steps", found.size(), search.steps());
        }
        return new LoopSearchResult(found, reason, search.steps());
    }

    /**
     * A fresh lazy pass over the loops, in discovery order (by smallest node).
     */
    public Search loops() {
        return new Search();
    }

    public Stream<Loop> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(loops(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    // ==================== Search ====================

    private record Frame(String node, Iterator<String> successors) {
    }

    /**
     * One pass of the enumeration. Stops yielding when the graph is exhausted or a step
     * or time limit is hit; {@link #stopReason()} tells which.
     */
    public final class Search implements Iterator<Loop> {

        private final long deadline;
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final List<String> path = new ArrayList<>();
        private final Set<String> onPath = new HashSet<>();

        private int startIndex = -1;
        private String start;
        private Set<String> component = Set.of();
        private Loop pending;
        private boolean finished;
        private StopReason stopReason = StopReason.COMPLETE;
        private long steps;

        private Search() {
            this.deadline = deadlineFor(limits.timeBudget());
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !finished) {
                pending = advance();
                finished = pending == null;
            }
            return pending != null;
        }

        @Override
        public Loop next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Loop loop = pending;
            pending = null;
            return loop;
        }

        public StopReason stopReason() {
            return stopReason;
        }

        public long steps() {
            return steps;
        }

        private Loop advance() {
            while (true) {
                if (frames.isEmpty() && !nextStart()) {
                    return null;
                }

                Frame top = frames.peek();
                if (!top.successors().hasNext()) {
                    frames.pop();
                    path.remove(path.size() - 1);
                    onPath.remove(top.node());
                    continue;
                }

                String next = top.successors().next();
                if (!withinBudget()) {
                    frames.clear();
                    startIndex = order.size();
                    return null;
                }

                if (next.equals(start)) {
                    return toLoop(path);
                }
                if (component.contains(next) && !onPath.contains(next) && path.size() < limits.maxLength()) {
                    push(next);
                }
            }
        }

        private boolean nextStart() {
            while (++startIndex < order.size()) {
                start = order.get(startIndex);
                component = componentOf(start, startIndex);
                if (component.size() > 1 || graph.hasEdge(start, start)) {
                    push(start);
                    return true;
                }
            }
            return false;
        }

        private void push(String node) {
            frames.push(new Frame(node, graph.successors(node).iterator()));
            path.add(node);
            onPath.add(node);
        }

        private boolean withinBudget() {
            steps++;
            if (steps > limits.maxSteps()) {
                stopReason = StopReason.MAX_STEPS;
                return false;
            }
            if (steps % CLOCK_CHECK_INTERVAL == 0 && System.nanoTime() > deadline) {
                stopReason = StopReason.TIME_BUDGET;
                return false;
            }
            return true;
        }
    }

    // ==================== Helpers ====================

    /**
     * Nodes that lie on a cycle with {@code start} using only nodes ranked at or after it:
     * the intersection of what it reaches and what reaches it.
     */
    private Set<String> componentOf(String start, int minRank) {
        Set<String> forward = reach(start, minRank, true);
        Set<String> backward = reach(start, minRank, false);
        forward.retainAll(backward);
        return forward;
    }

    private Set<String> reach(String start, int minRank, boolean forward) {
        Set<String> seen = new HashSet<>();
        Deque<String> todo = new ArrayDeque<>();
        seen.add(start);
        todo.push(start);
        while (!todo.isEmpty()) {
            String node = todo.pop();
            Iterable<String> around = forward ? graph.successors(node) : predecessors.getOrDefault(node, List.of());
            for (String other : around) {
                if (rank.get(other) >= minRank && seen.add(other)) {
                    todo.push(other);
                }
            }
        }
        return seen;
    }

    private Loop toLoop(List<String> cycle) {
        List<SignedEdge> edges = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            edges.add(graph.representativeEdge(cycle.get(i), cycle.get((i + 1) % cycle.size())));
        }
        return Loop.of(new ArrayList<>(cycle), edges);
    }
}
