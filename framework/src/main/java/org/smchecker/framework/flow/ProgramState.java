package org.smchecker.framework.flow;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.analysis.ConditionKey;
import org.smchecker.dataflow.analysis.Facts;
import org.smchecker.dataflow.analysis.PathStore;
import org.smchecker.framework.statemachine.State;

/**
 * The abstract state of one path: which tracked value each variable holds, the state of every
 * tracked value in every machine that tracks it, and the facts the path knows about branch
 * conditions.
 *
 * <p>Program states are immutable. Every update returns a new instance, so a state can be handed
 * to both successors of a branch.
 */
public final class ProgramState implements PathStore<ProgramState> {

    private static final ProgramState EMPTY =
            new ProgramState(
                    ImmutableMap.<String, TrackedValue>of(),
                    ImmutableTable.<String, TrackedValue, State>of(),
                    Facts.empty());

    /** Variable to the tracked value it currently holds. */
    private final ImmutableMap<String, TrackedValue> bindings;

    /** (machine name, tracked value) to the state of the value in that machine. */
    private final ImmutableTable<String, TrackedValue, State> states;

    private final Facts facts;

    private ProgramState(
            ImmutableMap<String, TrackedValue> bindings,
            ImmutableTable<String, TrackedValue, State> states,
            Facts facts) {
        this.bindings = bindings;
        this.states = states;
        this.facts = facts;
    }

    public static ProgramState empty() {
        return EMPTY;
    }

    /** @return the tracked value {@code variable} holds, or {@code null} if it holds none */
    public @Nullable TrackedValue getBinding(String variable) {
        return bindings.get(variable);
    }

    public ImmutableMap<String, TrackedValue> getBindings() {
        return bindings;
    }

    /** @return the state of {@code value} in the machine {@code machine}, or {@code null} */
    public @Nullable State getState(String machine, TrackedValue value) {
        return states.get(machine, value);
    }

    public ImmutableTable<String, TrackedValue, State> getStates() {
        return states;
    }

    /** @return the values some machine still tracks, ordered by allocation site */
    public ImmutableSortedSet<TrackedValue> getTrackedValues() {
        return ImmutableSortedSet.copyOf(states.columnKeySet());
    }

    /** @return the machines tracking {@code value}, with its state in each */
    public Map<String, State> getStates(TrackedValue value) {
        return states.column(value);
    }

    /** Let {@code variable} hold {@code value}. */
    public ProgramState bind(String variable, TrackedValue value) {
        ImmutableMap.Builder<String, TrackedValue> b = ImmutableMap.builder();
        for (Map.Entry<String, TrackedValue> e : bindings.entrySet()) {
            if (!e.getKey().equals(variable)) {
                b.put(e);
            }
        }
        b.put(variable, value);
        return new ProgramState(b.build(), states, facts);
    }

    /** Let {@code variable} hold no tracked value. The value it held keeps its states. */
    public ProgramState unbind(String variable) {
        if (!bindings.containsKey(variable)) {
            return this;
        }
        ImmutableMap.Builder<String, TrackedValue> b = ImmutableMap.builder();
        for (Map.Entry<String, TrackedValue> e : bindings.entrySet()) {
            if (!e.getKey().equals(variable)) {
                b.put(e);
            }
        }
        return new ProgramState(b.build(), states, facts);
    }

    /** Set the state of {@code value} in {@code machine}. */
    public ProgramState withState(String machine, TrackedValue value, State state) {
        if (state.equals(states.get(machine, value))) {
            return this;
        }
        ImmutableTable.Builder<String, TrackedValue, State> b = ImmutableTable.builder();
        boolean replaced = false;
        for (Table.Cell<String, TrackedValue, State> c : states.cellSet()) {
            if (c.getRowKey().equals(machine) && c.getColumnKey().equals(value)) {
                b.put(machine, value, state);
                replaced = true;
            } else {
                b.put(c);
            }
        }
        if (!replaced) {
            b.put(machine, value, state);
        }
        return new ProgramState(bindings, b.build(), facts);
    }

    /** Stop tracking {@code value} in every machine. Bindings to it are kept. */
    public ProgramState forget(TrackedValue value) {
        if (!states.containsColumn(value)) {
            return this;
        }
        ImmutableTable.Builder<String, TrackedValue, State> b = ImmutableTable.builder();
        for (Table.Cell<String, TrackedValue, State> c : states.cellSet()) {
            if (!c.getColumnKey().equals(value)) {
                b.put(c);
            }
        }
        return new ProgramState(bindings, b.build(), facts);
    }

    /**
     * Whether {@code value} occurs anywhere in this state: bound to a variable or tracked by a
     * machine.
     */
    public boolean mentions(TrackedValue value) {
        return bindings.containsValue(value) || states.containsColumn(value);
    }

    @Override
    public Facts getFacts() {
        return facts;
    }

    @Override
    public ProgramState withFacts(Facts newFacts) {
        if (newFacts.equals(facts)) {
            return this;
        }
        return new ProgramState(bindings, states, newFacts);
    }

    /**
     * A condition on a variable that holds a tracked value is a condition on that value, so
     * aliases share facts and reassignment starts afresh.
     */
    @Override
    public ConditionKey conditionKey(String variable) {
        TrackedValue value = bindings.get(variable);
        return value == null ? ConditionKey.ofVariable(variable) : ConditionKey.ofValue(value);
    }

    @Override
    public boolean isMergeableWith(ProgramState other) {
        return states.equals(other.states)
                && bindings.equals(other.bindings)
                && facts.equals(other.facts);
    }

    /** Mergeable states are equal, so either one stands for both. */
    @Override
    public ProgramState merge(ProgramState other) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof ProgramState)) {
            return false;
        }
        ProgramState other = (ProgramState) obj;
        return bindings.equals(other.bindings)
                && states.equals(other.states)
                && facts.equals(other.facts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bindings, states, facts);
    }

    @Override
    public String toString() {
        return "ProgramState{bindings="
                + bindings
                + ", states="
                + states
                + ", facts="
                + facts
                + "}";
    }
}
