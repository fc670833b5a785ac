package org.smchecker.dataflow.cfg.block;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The condition attached to one edge of a two-way branch. A guard tests the truth of a single
 * variable the way C does: {@code if (flag)} and {@code if (ptr)} produce a then edge guarded by
 * {@code isTrue("flag")} / {@code isTrue("ptr")}, and an else edge guarded by the complement.
 *
 * <p>The variable is either a named input of the function or a variable assigned in the graph.
 * Whether the guard also refers to a tracked value is decided per path, by the store.
 */
public final class Guard {

    private final String variable;

    /** The truth value {@link #variable} must have for control to flow along the edge. */
    private final boolean value;

    private Guard(String variable, boolean value) {
        this.variable = Objects.requireNonNull(variable, "variable");
        this.value = value;
    }

    /** {@code variable != 0}, {@code variable != NULL}. */
    public static Guard isTrue(String variable) {
        return new Guard(variable, true);
    }

    /** {@code variable == 0}, {@code !variable}. */
    public static Guard isFalse(String variable) {
        return new Guard(variable, false);
    }

    public String getVariable() {
        return variable;
    }

    public boolean getValue() {
        return value;
    }

    /** @return the guard of the other edge of the same branch */
    public Guard complement() {
        return new Guard(variable, !value);
    }

    /** @return true if {@code other} tests the same variable for the opposite value */
    public boolean isComplementOf(Guard other) {
        return variable.equals(other.variable) && value != other.value;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof Guard)) {
            return false;
        }
        Guard other = (Guard) obj;
        return variable.equals(other.variable) && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * variable.hashCode() + (value ? 1 : 0);
    }

    @Override
    public String toString() {
        return value ? variable : "!" + variable;
    }
}
