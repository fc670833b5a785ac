package org.smchecker.dataflow.analysis;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A continuation the explorer gave up on because a budget ran out. Whatever lies beyond a
 * truncation was not analyzed, so a result with truncations does not prove the absence of
 * defects.
 */
public final class Truncation {

    /** Why exploration stopped. */
    public enum Reason {
        /** The run already started as many paths as {@link AnalysisOptions#getMaxPaths()}. */
        PATH_BUDGET,
        /** The path visited {@link AnalysisOptions#getMaxStepsPerPath()} blocks. */
        STEP_BUDGET
    }

    /** Orders truncations by block, then reason, then path. */
    public static final Comparator<Truncation> ORDER =
            Comparator.comparingInt(Truncation::getBlockId)
                    .thenComparing(Truncation::getReason)
                    .thenComparing(t -> t.getPath().toString());

    private final Reason reason;
    private final int blockId;
    private final ImmutableList<Integer> path;

    public Truncation(Reason reason, int blockId, ImmutableList<Integer> path) {
        this.reason = reason;
        this.blockId = blockId;
        this.path = path;
    }

    public Reason getReason() {
        return reason;
    }

    /** @return the block that was not explored */
    public int getBlockId() {
        return blockId;
    }

    /** @return the path that led to the truncation */
    public ImmutableList<Integer> getPath() {
        return path;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof Truncation)) {
            return false;
        }
        Truncation other = (Truncation) obj;
        return reason == other.reason && blockId == other.blockId && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, blockId, path);
    }

    @Override
    public String toString() {
        return reason + " at block " + blockId + " [path: " + path + "]";
    }
}
