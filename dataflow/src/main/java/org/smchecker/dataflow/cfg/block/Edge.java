package org.smchecker.dataflow.cfg.block;

import org.checkerframework.checker.nullness.qual.Nullable;

/** A possible transfer of control between two blocks, optionally guarded by a condition. */
public final class Edge {

    private final Block source;
    private final Block target;
    private final @Nullable Guard guard;

    Edge(Block source, Block target, @Nullable Guard guard) {
        this.source = source;
        this.target = target;
        this.guard = guard;
    }

    public Block getSource() {
        return source;
    }

    public Block getTarget() {
        return target;
    }

    /** @return the guard of this edge, or {@code null} for an unconditional edge */
    public @Nullable Guard getGuard() {
        return guard;
    }

    public boolean isConditional() {
        return guard != null;
    }

    @Override
    public String toString() {
        String arrow = source.getId() + " -> " + target.getId();
        if (guard == null) {
            return arrow;
        }
        return arrow + " [" + guard + "]";
    }
}
