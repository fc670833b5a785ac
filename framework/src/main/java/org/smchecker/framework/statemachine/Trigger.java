package org.smchecker.framework.statemachine;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An event that can move a tracked value from one state to another: the value is passed to a
 * function, is found to be true or false by a branch, is dereferenced, or is still alive when the
 * function returns.
 */
public final class Trigger {

    /** The kinds of triggers. */
    public enum Kind {
        /** The value is passed as an argument to the function named by the trigger. */
        CALL,
        /** A branch found the value to be true (non-null). */
        ASSUME_TRUE,
        /** A branch found the value to be false (null). */
        ASSUME_FALSE,
        /** The value is dereferenced. */
        DEREFERENCE,
        /** The path reached a function exit with the value still tracked. */
        EXIT
    }

    public static final Trigger ASSUME_TRUE = new Trigger(Kind.ASSUME_TRUE, null);
    public static final Trigger ASSUME_FALSE = new Trigger(Kind.ASSUME_FALSE, null);
    public static final Trigger DEREFERENCE = new Trigger(Kind.DEREFERENCE, null);
    public static final Trigger EXIT = new Trigger(Kind.EXIT, null);

    private final Kind kind;

    /** The called function for {@link Kind#CALL}, {@code null} otherwise. */
    private final @Nullable String function;

    private Trigger(Kind kind, @Nullable String function) {
        this.kind = kind;
        this.function = function;
    }

    /** The trigger for passing the value to {@code function}. */
    public static Trigger call(String function) {
        return new Trigger(Kind.CALL, Objects.requireNonNull(function, "function"));
    }

    /** The trigger for a branch that found the value to be {@code value}. */
    public static Trigger assume(boolean value) {
        return value ? ASSUME_TRUE : ASSUME_FALSE;
    }

    public Kind getKind() {
        return kind;
    }

    public @Nullable String getFunction() {
        return function;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof Trigger)) {
            return false;
        }
        Trigger other = (Trigger) obj;
        return kind == other.kind && Objects.equals(function, other.function);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, function);
    }

    @Override
    public String toString() {
        switch (kind) {
            case CALL:
                return function + "()";
            case ASSUME_TRUE:
                return "assume-true";
            case ASSUME_FALSE:
                return "assume-false";
            case DEREFERENCE:
                return "dereference";
            default:
                return "exit";
        }
    }
}
