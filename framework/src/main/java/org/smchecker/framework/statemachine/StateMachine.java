package org.smchecker.framework.statemachine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A finite state machine describing the lifecycle of one kind of tracked value, for example heap
 * memory obtained from {@code malloc}.
 *
 * <p>A machine tracks the results of its allocator functions. A value enters the machine in the
 * start state and moves along the transition table as triggers fire on it. A (state, trigger)
 * pair without an entry leaves the state unchanged. Entering a {@link State.Kind#BAD} state is a
 * defect; the value is then moved to the stop state so the same value is reported once.
 *
 * <p>Instances are immutable and can be shared between analyses running at the same time.
 */
public final class StateMachine {

    private final String name;
    private final ImmutableList<State> states;
    private final State startState;
    private final State stopState;
    private final ImmutableSet<String> allocators;
    private final ImmutableTable<State, Trigger, State> transitions;

    private StateMachine(Builder builder, State startState, State stopState) {
        this.name = builder.name;
        this.states = ImmutableList.copyOf(builder.states.values());
        this.startState = startState;
        this.stopState = stopState;
        this.allocators = ImmutableSet.copyOf(builder.allocators);
        this.transitions = builder.transitions.build();
    }

    /**
     * Start describing a machine.
     *
     * @param name the name of the machine, used in diagnostics
     * @return a builder for the machine
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /** @return all states, in declaration order */
    public ImmutableList<State> getStates() {
        return states;
    }

    /** @return the state a freshly allocated value starts in */
    public State getStartState() {
        return startState;
    }

    /** @return the state a value is moved to after it entered a bad state */
    public State getStopState() {
        return stopState;
    }

    /** @return the functions whose results this machine tracks */
    public ImmutableSet<String> getAllocators() {
        return allocators;
    }

    public boolean isAllocator(String function) {
        return allocators.contains(function);
    }

    /**
     * Look up the transition for {@code trigger} in {@code state}.
     *
     * @return the next state, or {@code null} if the trigger does not change {@code state}
     */
    public @Nullable State transition(State state, Trigger trigger) {
        return transitions.get(state, trigger);
    }

    public ImmutableTable<State, Trigger, State> getTransitions() {
        return transitions;
    }

    @Override
    public String toString() {
        return "StateMachine(" + name + ", " + states + ")";
    }

    /** Builder for {@link StateMachine}. States must be declared before they are used. */
    public static final class Builder {
        private final String name;
        private final Map<String, State> states = new LinkedHashMap<>();
        private final Set<String> allocators = new LinkedHashSet<>();
        private final ImmutableTable.Builder<State, Trigger, State> transitions =
                ImmutableTable.builder();
        private final Set<String> declaredTransitions = new LinkedHashSet<>();
        private @Nullable State startState;
        private @Nullable State stopState;

        private Builder(String name) {
            checkArgument(!name.isEmpty(), "state machine name must not be empty");
            this.name = name;
        }

        /** Declare a state. */
        public Builder state(State state) {
            checkArgument(
                    !states.containsKey(state.getName()),
                    "%s: state '%s' declared twice",
                    name,
                    state.getName());
            states.put(state.getName(), state);
            if (state.getKind() == State.Kind.STOP) {
                checkArgument(stopState == null, "%s: more than one stop state", name);
                stopState = state;
            }
            return this;
        }

        /** Declare the state allocated values start in. */
        public Builder start(State state) {
            checkArgument(
                    state.getKind() == State.Kind.NORMAL,
                    "%s: start state '%s' must be a normal state",
                    name,
                    state);
            if (!states.containsKey(state.getName())) {
                state(state);
            }
            startState = state;
            return this;
        }

        /** Declare a function whose return value the machine tracks. */
        public Builder allocator(String function) {
            allocators.add(function);
            return this;
        }

        /** Add the transition {@code from --trigger--> to}. */
        public Builder transition(State from, Trigger trigger, State to) {
            checkDeclared(from);
            checkDeclared(to);
            checkArgument(
                    from.getKind() != State.Kind.STOP,
                    "%s: no transition may leave the stop state '%s'",
                    name,
                    from);
            checkArgument(
                    declaredTransitions.add(from.getName() + "/" + trigger),
                    "%s: transition from '%s' on %s declared twice",
                    name,
                    from,
                    trigger);
            transitions.put(from, trigger, to);
            return this;
        }

        private void checkDeclared(State state) {
            checkArgument(
                    state.equals(states.get(state.getName())),
                    "%s: state '%s' is not declared",
                    name,
                    state);
        }

        public StateMachine build() {
            checkState(startState != null, "%s: no start state", name);
            checkState(stopState != null, "%s: no stop state", name);
            checkState(!allocators.isEmpty(), "%s: no allocator function", name);
            return new StateMachine(this, startState, stopState);
        }
    }
}
