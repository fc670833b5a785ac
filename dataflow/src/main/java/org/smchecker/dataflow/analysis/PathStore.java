package org.smchecker.dataflow.analysis;

/**
 * A store holds what a path-sensitive analysis knows at one point of one path.
 *
 * <p>Stores are treated as values: the explorer hands the same store to several successors when a
 * path forks, so an implementation must never change a store after it has been returned from a
 * transfer function. Every update returns a new store.
 *
 * @param <S> the type of the store, usually the implementing class itself, e.g. in {@code T
 *     extends PathStore<T>}
 */
public interface PathStore<S extends PathStore<S>> {

    /** @return the condition outcomes accumulated on this path */
    Facts getFacts();

    /** @return a store equal to this one but with {@code facts} */
    S withFacts(Facts facts);

    /**
     * Resolve a guarded variable to the condition it stands for on this path. A variable bound to
     * a tracked value resolves to that value; anything else resolves to the variable itself.
     *
     * @param variable the variable of a guard
     * @return the condition key
     */
    ConditionKey conditionKey(String variable);

    /**
     * Whether two paths reaching the same block can continue as one without losing precision.
     * Implementations answer true only when the facts are equal as well: the merged path keeps
     * the witness of one of the two, and every edge it takes must be feasible on that witness.
     *
     * <p><em>Important</em>: This method must be symmetric and must not change either store.
     */
    boolean isMergeableWith(S other);

    /**
     * Merge this store with a mergeable one.
     *
     * <p><em>Important</em>: Only called after {@link #isMergeableWith} returned true. Does not
     * change {@code this} or {@code other}.
     */
    S merge(S other);
}
