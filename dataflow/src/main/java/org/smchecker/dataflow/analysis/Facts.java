package org.smchecker.dataflow.analysis;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The condition outcomes accumulated along one path. Instances are immutable; every update returns
 * a new instance, so a path can hand its facts to several successors without copying.
 *
 * <p>Only known facts are stored. A key that is absent reads as {@link FactValue#UNKNOWN}.
 */
public final class Facts {

    private static final Facts EMPTY = new Facts(ImmutableSortedMap.<ConditionKey, Boolean>of());

    private final ImmutableSortedMap<ConditionKey, Boolean> known;

    private Facts(ImmutableSortedMap<ConditionKey, Boolean> known) {
        this.known = known;
    }

    public static Facts empty() {
        return EMPTY;
    }

    public FactValue get(ConditionKey key) {
        Boolean value = known.get(key);
        if (value == null) {
            return FactValue.UNKNOWN;
        }
        return FactValue.of(value);
    }

    /**
     * Record that the condition {@code key} is {@code value}.
     *
     * @throws IllegalStateException if the opposite value is already recorded; callers must check
     *     feasibility first
     */
    public Facts with(ConditionKey key, boolean value) {
        FactValue current = get(key);
        if (current == FactValue.of(value)) {
            return this;
        }
        if (current.isKnown()) {
            throw new IllegalStateException(
                    "Fact " + key + " is already " + current + ", cannot record " + value);
        }
        return new Facts(
                ImmutableSortedMap.<ConditionKey, Boolean>naturalOrder()
                        .putAll(known)
                        .put(key, value)
                        .build());
    }

    /** Forget what is known about {@code key}. */
    public Facts without(ConditionKey key) {
        if (!known.containsKey(key)) {
            return this;
        }
        ImmutableSortedMap.Builder<ConditionKey, Boolean> builder =
                ImmutableSortedMap.naturalOrder();
        for (Map.Entry<ConditionKey, Boolean> e : known.entrySet()) {
            if (!e.getKey().equals(key)) {
                builder.put(e);
            }
        }
        return new Facts(builder.build());
    }

    public int size() {
        return known.size();
    }

    public boolean isEmpty() {
        return known.isEmpty();
    }

    public ImmutableSortedMap<ConditionKey, Boolean> asMap() {
        return known;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof Facts)) {
            return false;
        }
        return known.equals(((Facts) obj).known);
    }

    @Override
    public int hashCode() {
        return known.hashCode();
    }

    @Override
    public String toString() {
        return known.toString();
    }
}
