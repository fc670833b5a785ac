package org.smchecker.framework.flow;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.cfg.node.Node;

/**
 * The symbolic identity of a value produced by an allocator, named after the assignment that
 * produced it. On one path, the same allocation yields the same tracked value until the variable
 * is assigned again.
 *
 * <p>An allocation site executed again on the same path (in a loop) yields a new generation, so
 * the values of different iterations are kept apart.
 */
public final class TrackedValue implements Comparable<TrackedValue> {

    /** The variable the value was first assigned to. */
    private final String variable;

    private final int blockId;

    private final int nodeIndex;

    private final int generation;

    public TrackedValue(String variable, int blockId, int nodeIndex, int generation) {
        this.variable = variable;
        this.blockId = blockId;
        this.nodeIndex = nodeIndex;
        this.generation = generation;
    }

    /** The value assigned to {@code variable} by the effect {@code site}. */
    static TrackedValue at(String variable, Node site, int generation) {
        return new TrackedValue(
                variable,
                site.getBlock() == null ? -1 : site.getBlock().getId(),
                site.getIndex(),
                generation);
    }

    public String getVariable() {
        return variable;
    }

    public int getBlockId() {
        return blockId;
    }

    public int getNodeIndex() {
        return nodeIndex;
    }

    public int getGeneration() {
        return generation;
    }

    /** Whether this value and {@code other} come from the same assignment. */
    public boolean isSameSite(TrackedValue other) {
        return variable.equals(other.variable)
                && blockId == other.blockId
                && nodeIndex == other.nodeIndex;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof TrackedValue)) {
            return false;
        }
        TrackedValue other = (TrackedValue) obj;
        return isSameSite(other) && generation == other.generation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, blockId, nodeIndex, generation);
    }

    @Override
    public int compareTo(TrackedValue o) {
        int c = Integer.compare(blockId, o.blockId);
        if (c == 0) {
            c = Integer.compare(nodeIndex, o.nodeIndex);
        }
        if (c == 0) {
            c = variable.compareTo(o.variable);
        }
        if (c == 0) {
            c = Integer.compare(generation, o.generation);
        }
        return c;
    }

    /** Unique per value: facts keyed by tracked values are ordered by this text. */
    @Override
    public String toString() {
        String site = variable + "@" + blockId + "." + nodeIndex;
        return generation == 0 ? site : site + "#" + generation;
    }
}
