package org.smchecker.framework.statemachine;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A state of a {@link StateMachine}. States are compared by name and kind. */
public final class State {

    /** What reaching a state means for the value in it. */
    public enum Kind {
        /** An ordinary state. */
        NORMAL,
        /** A defect: entering this state is reported. */
        BAD,
        /** The value is no longer tracked; no transition leaves this state. */
        STOP
    }

    private final String name;
    private final Kind kind;

    public State(String name, Kind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static State normal(String name) {
        return new State(name, Kind.NORMAL);
    }

    public static State bad(String name) {
        return new State(name, Kind.BAD);
    }

    public static State stop(String name) {
        return new State(name, Kind.STOP);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isBad() {
        return kind == Kind.BAD;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof State)) {
            return false;
        }
        State other = (State) obj;
        return name.equals(other.name) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + kind.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
