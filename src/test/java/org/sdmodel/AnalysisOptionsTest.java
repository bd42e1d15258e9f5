package org.sdmodel;

import org.junit.jupiter.api.Test;
import org.sdmodel.graph.LoopSearchLimits;
import org.sdmodel.graph.LoopSearchResult;
import org.sdmodel.topology.Polarity;
import org.sdmodel.topology.PolarityConvention;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisOptionsTest {

    @Test
    void emptyEnvironmentGivesDefaults() {
        AnalysisOptions options = AnalysisOptions.fromEnvironment(Map.of());
        assertEquals(AnalysisOptions.defaults(), options);
        assertEquals(LoopSearchLimits.unbounded(), options.limits());
        assertEquals(PolarityConvention.DEFAULT_NEGATIVE_MARKER, options.polarity().negativeMarker());
    }

    @Test
    void readsEveryVariable() {
        AnalysisOptions options = AnalysisOptions.fromEnvironment(Map.of(
                AnalysisOptions.NEGATIVE_MARKER_ENV, " 1 ",
                AnalysisOptions.MAX_LOOP_LENGTH_ENV, "8",
                AnalysisOptions.MAX_LOOPS_ENV, "500",
                AnalysisOptions.TIME_BUDGET_ENV, "2000"));

        assertEquals(Polarity.NEGATIVE, options.polarity().polarityOf("1"));
        assertEquals(Polarity.POSITIVE, options.polarity().polarityOf("45"));
        assertEquals(8, options.limits().maxLength());
        assertEquals(500, options.limits().maxLoops());
        assertEquals(Duration.ofSeconds(2), options.limits().timeBudget());
        assertTrue(options.limits().isLengthBounded());
    }

    @Test
    void blankValuesAreIgnored() {
        AnalysisOptions options = AnalysisOptions.fromEnvironment(Map.of(
                AnalysisOptions.NEGATIVE_MARKER_ENV, "",
                AnalysisOptions.MAX_LOOPS_ENV, "  "));
        assertEquals(AnalysisOptions.defaults(), options);
    }

    @Test
    void hugeTimeBudgetStillRunsTheSearch() {
        AnalysisOptions options = AnalysisOptions.fromEnvironment(
                Map.of(AnalysisOptions.TIME_BUDGET_ENV, String.valueOf(Long.MAX_VALUE)));
        SketchAnalyzer analyzer = new SketchAnalyzer(options);
        LoopSearchResult result = analyzer.findLoops(
                analyzer.classifyTopology(analyzer.parse(ModelFixtures.load(ModelFixtures.WORKFORCE))));

        assertEquals(3, result.totalLoops());
        assertFalse(result.isTruncated());
    }

    @Test
    void invalidNumbersAreRejected() {
        IllegalArgumentException notANumber = assertThrows(IllegalArgumentException.class,
                () -> AnalysisOptions.fromEnvironment(Map.of(AnalysisOptions.MAX_LOOPS_ENV, "many")));
        assertTrue(notANumber.getMessage().contains(AnalysisOptions.MAX_LOOPS_ENV));

        assertThrows(IllegalArgumentException.class,
                () -> AnalysisOptions.fromEnvironment(Map.of(AnalysisOptions.TIME_BUDGET_ENV, "0")));
    }
}
