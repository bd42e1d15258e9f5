package org.sdmodel;

import org.sdmodel.graph.LoopSearchLimits;
import org.sdmodel.topology.PolarityConvention;

import java.time.Duration;
import java.util.Map;

/**
 * Settings for an analysis run.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 * - SD_LOOPS_NEGATIVE_MARKER: connection discriminator that means "negative" (default 45)
 * - SD_LOOPS_MAX_LOOP_LENGTH: longest loop to report, in variables (default unbounded)
 * - SD_LOOPS_MAX_LOOPS: stop after this many loops (default unbounded)
 * - SD_LOOPS_TIME_BUDGET_MS: wall-clock budget of the loop search (default none)
 */
public record AnalysisOptions(PolarityConvention polarity, LoopSearchLimits limits) {

    public static final String NEGATIVE_MARKER_ENV = "SD_LOOPS_NEGATIVE_MARKER";
    public static final String MAX_LOOP_LENGTH_ENV = "SD_LOOPS_MAX_LOOP_LENGTH";
    public static final String MAX_LOOPS_ENV = "SD_LOOPS_MAX_LOOPS";
    public static final String TIME_BUDGET_ENV = "SD_LOOPS_TIME_BUDGET_MS";

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(PolarityConvention.defaults(), LoopSearchLimits.unbounded());
    }

    public static AnalysisOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Read options from a variable map; unset or blank variables keep their defaults.
     *
     * @throws IllegalArgumentException when a numeric variable is not a positive number
     */
    public static AnalysisOptions fromEnvironment(Map<String, String> env) {
        String marker = env.get(NEGATIVE_MARKER_ENV);
        PolarityConvention polarity = marker == null || marker.isBlank()
                ? PolarityConvention.defaults()
                : PolarityConvention.withNegativeMarker(marker);

        LoopSearchLimits limits = LoopSearchLimits.unbounded();
        Long maxLength = positive(env, MAX_LOOP_LENGTH_ENV);
        if (maxLength != null) {
            limits = limits.withMaxLength((int) Math.min(maxLength, Integer.MAX_VALUE));
        }
        Long maxLoops = positive(env, MAX_LOOPS_ENV);
        if (maxLoops != null) {
            limits = limits.withMaxLoops((int) Math.min(maxLoops, Integer.MAX_VALUE));
        }
        Long budgetMs = positive(env, TIME_BUDGET_ENV);
        if (budgetMs != null) {
            limits = limits.withTimeBudget(Duration.ofMillis(budgetMs));
        }
        return new AnalysisOptions(polarity, limits);
    }

    public AnalysisOptions withLimits(LoopSearchLimits newLimits) {
        return new AnalysisOptions(polarity, newLimits);
    }

    private static Long positive(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long parsed = Long.parseLong(value.strip());
            if (parsed < 1) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }
}
