package org.smchecker.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.cfg.block.Guard;

/**
 * Decides whether a path may take an edge, given what the path already knows about branch
 * conditions.
 *
 * <p>An edge is infeasible exactly when its guard resolves to a condition whose outcome the path
 * has already fixed to the opposite value. Conditions the path knows nothing about never prune an
 * edge, so both sides of a fresh branch are explored. This is what keeps a path that took {@code
 * if (flag)} once from later taking the else side of a second {@code if (flag)}.
 */
public class FeasibilityChecker {

    /**
     * @param facts the facts of the path
     * @param key the condition the guard resolves to on this path
     * @param guard the guard of the edge, or {@code null} for an unconditional edge
     * @return true if the path may take the edge
     */
    public boolean isFeasible(Facts facts, ConditionKey key, @Nullable Guard guard) {
        if (guard == null) {
            return true;
        }
        return facts.get(key).admits(guard.getValue());
    }

    /** Convenience overload resolving the guard through {@code store}. */
    public <S extends PathStore<S>> boolean isFeasible(S store, @Nullable Guard guard) {
        if (guard == null) {
            return true;
        }
        return isFeasible(store.getFacts(), store.conditionKey(guard.getVariable()), guard);
    }
}
