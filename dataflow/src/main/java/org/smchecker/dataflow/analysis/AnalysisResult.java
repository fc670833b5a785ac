package org.smchecker.dataflow.analysis;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * An {@link AnalysisResult} represents the result of a path-sensitive analysis run: whether every
 * feasible path was explored, where exploration was cut off, and the final stores of the paths
 * that reached an exit block. Note that it does not keep track of custom results computed by the
 * transfer function, such as diagnostics.
 *
 * @param <S> the store type
 */
public class AnalysisResult<S extends PathStore<S>> {

    /** The stores of the paths that reached an exit block, in the order they got there. */
    protected final ImmutableList<S> exitStores;

    /** The truncated continuations, in {@link Truncation#ORDER}. */
    protected final ImmutableList<Truncation> truncations;

    protected final ExplorationStatistics statistics;

    /**
     * Initialize with the outcome of a run.
     *
     * @param exitStores the final stores of the paths that completed
     * @param truncations the continuations cut off by a budget
     * @param statistics counters of the run
     */
    public AnalysisResult(
            List<S> exitStores, List<Truncation> truncations, ExplorationStatistics statistics) {
        this.exitStores = ImmutableList.copyOf(exitStores);
        this.truncations = ImmutableList.sortedCopyOf(Truncation.ORDER, truncations);
        this.statistics = statistics;
    }

    /**
     * @return {@link Coverage#INCOMPLETE} if any continuation was truncated, {@link
     *     Coverage#COMPLETE} otherwise
     */
    public Coverage getCoverage() {
        return truncations.isEmpty() ? Coverage.COMPLETE : Coverage.INCOMPLETE;
    }

    public boolean isComplete() {
        return getCoverage() == Coverage.COMPLETE;
    }

    /** @return the final stores of the paths that reached an exit block */
    public ImmutableList<S> getExitStores() {
        return exitStores;
    }

    public ImmutableList<Truncation> getTruncations() {
        return truncations;
    }

    public ExplorationStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return getCoverage() + " (" + statistics + ")";
    }
}
