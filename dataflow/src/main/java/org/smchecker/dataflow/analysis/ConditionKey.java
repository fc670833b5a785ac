package org.smchecker.dataflow.analysis;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The identity of a branch condition, used to key {@link Facts}. Two guards that resolve to the
 * same key on a path test the same condition, so their outcomes are correlated.
 *
 * <p>A key is either a named variable (a function input, or a variable not bound to anything the
 * store tracks), or a tracked value. Keying null checks by the tracked value rather than by the
 * variable means that reassigning the variable yields a fresh key, so stale facts never apply to
 * the new value.
 */
public final class ConditionKey implements Comparable<ConditionKey> {

    private final @Nullable String variable;
    private final @Nullable Object value;

    private ConditionKey(@Nullable String variable, @Nullable Object value) {
        this.variable = variable;
        this.value = value;
    }

    /** The key for a condition on a plain variable. */
    public static ConditionKey ofVariable(String variable) {
        return new ConditionKey(Objects.requireNonNull(variable, "variable"), null);
    }

    /**
     * The key for a condition on a tracked value. {@code value} must implement {@code equals},
     * {@code hashCode} and a deterministic {@code toString}.
     */
    public static ConditionKey ofValue(Object value) {
        return new ConditionKey(null, Objects.requireNonNull(value, "value"));
    }

    /** @return the variable of this key, or {@code null} if it is keyed by a tracked value */
    public @Nullable String getVariable() {
        return variable;
    }

    /** @return the tracked value of this key, or {@code null} if it is keyed by a variable */
    public @Nullable Object getValue() {
        return value;
    }

    public boolean isVariable() {
        return variable != null;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof ConditionKey)) {
            return false;
        }
        ConditionKey other = (ConditionKey) obj;
        return Objects.equals(variable, other.variable) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, value);
    }

    /**
     * Variables come before values. Variables are ordered by name. Values are ordered by their
     * text, then by class name, then by their own order if they are {@link Comparable}.
     *
     * @throws IllegalArgumentException if two unequal values cannot be told apart
     */
    @Override
    @SuppressWarnings("unchecked")
    public int compareTo(ConditionKey o) {
        if (variable != null || o.variable != null) {
            if (variable == null) {
                return 1;
            }
            if (o.variable == null) {
                return -1;
            }
            return variable.compareTo(o.variable);
        }
        Object mine = Objects.requireNonNull(value);
        Object theirs = Objects.requireNonNull(o.value);
        int c = mine.toString().compareTo(theirs.toString());
        if (c == 0) {
            c = mine.getClass().getName().compareTo(theirs.getClass().getName());
        }
        if (c == 0 && mine instanceof Comparable) {
            c = ((Comparable<Object>) mine).compareTo(theirs);
        }
        if (c == 0 && !mine.equals(theirs)) {
            throw new IllegalArgumentException(
                    "Condition keys " + this + " and " + o + " are unequal but indistinguishable");
        }
        return c;
    }

    @Override
    public String toString() {
        return variable != null ? variable : "<" + value + ">";
    }
}
