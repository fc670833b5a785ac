package org.smchecker.dataflow.analysis;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

public class AnalysisOptionsTest {

    @Test
    public void defaults() {
        AnalysisOptions options = AnalysisOptions.defaults();
        assertThat(options.getMaxPaths(), is(AnalysisOptions.DEFAULT_MAX_PATHS));
        assertThat(options.getMaxStepsPerPath(), is(AnalysisOptions.DEFAULT_MAX_STEPS_PER_PATH));
        assertThat(options.getParallelism(), is(1));
        assertThat(options.isMergeJoinPoints(), is(true));
    }

    @Test
    public void readFromKeyValuePairs() {
        AnalysisOptions options =
                AnalysisOptions.fromMap(
                        ImmutableMap.of(
                                AnalysisOptions.MAX_PATHS, "50",
                                AnalysisOptions.PARALLELISM, " 2 ",
                                AnalysisOptions.MERGE_JOIN_POINTS, "false",
                                "unrelated", "x"));
        assertThat(
                options,
                is(
                        AnalysisOptions.builder()
                                .maxPaths(50)
                                .parallelism(2)
                                .mergeJoinPoints(false)
                                .build()));
    }

    @Test
    public void malformedValuesNameTheirKey() {
        try {
            AnalysisOptions.fromMap(ImmutableMap.of(AnalysisOptions.MAX_STEPS_PER_PATH, "many"));
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString(AnalysisOptions.MAX_STEPS_PER_PATH));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void budgetsMustBePositive() {
        AnalysisOptions.builder().maxPaths(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void mergeSwitchMustBeABoolean() {
        AnalysisOptions.fromMap(ImmutableMap.of(AnalysisOptions.MERGE_JOIN_POINTS, "yes"));
    }
}
