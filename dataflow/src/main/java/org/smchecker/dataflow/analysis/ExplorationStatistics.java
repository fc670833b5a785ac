package org.smchecker.dataflow.analysis;

import java.util.concurrent.atomic.AtomicInteger;

/** Counters collected while exploring one graph. */
public final class ExplorationStatistics {

    private final int pathsStarted;
    private final int pathsCompleted;
    private final int edgesPruned;
    private final int merges;
    private final int truncations;

    public ExplorationStatistics(
            int pathsStarted, int pathsCompleted, int edgesPruned, int merges, int truncations) {
        this.pathsStarted = pathsStarted;
        this.pathsCompleted = pathsCompleted;
        this.edgesPruned = edgesPruned;
        this.merges = merges;
        this.truncations = truncations;
    }

    /** @return the number of paths started: the initial one plus one per extra successor */
    public int getPathsStarted() {
        return pathsStarted;
    }

    /** @return the number of paths that reached an exit block */
    public int getPathsCompleted() {
        return pathsCompleted;
    }

    /** @return the number of edges not taken because their guard contradicted a fact */
    public int getEdgesPruned() {
        return edgesPruned;
    }

    /** @return the number of times two paths were merged at a join block */
    public int getMerges() {
        return merges;
    }

    public int getTruncations() {
        return truncations;
    }

    @Override
    public String toString() {
        return String.format(
                "%d paths started, %d completed, %d edges pruned, %d merges, %d truncated",
                pathsStarted, pathsCompleted, edgesPruned, merges, truncations);
    }

    /** Thread-safe counters, turned into an {@link ExplorationStatistics} at the end of a run. */
    static final class Counters {
        final AtomicInteger pathsStarted = new AtomicInteger();
        final AtomicInteger pathsCompleted = new AtomicInteger();
        final AtomicInteger edgesPruned = new AtomicInteger();
        final AtomicInteger merges = new AtomicInteger();
        final AtomicInteger truncations = new AtomicInteger();

        ExplorationStatistics snapshot() {
            return new ExplorationStatistics(
                    pathsStarted.get(),
                    pathsCompleted.get(),
                    edgesPruned.get(),
                    merges.get(),
                    truncations.get());
        }
    }
}
