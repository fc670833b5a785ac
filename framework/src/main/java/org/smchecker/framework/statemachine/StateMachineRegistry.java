package org.smchecker.framework.statemachine;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The state machines a checker runs. The machines are independent of each other: every one of
 * them tracks the results of its own allocators, and a value can be in a state of several
 * machines at once.
 */
public final class StateMachineRegistry {

    private final ImmutableList<StateMachine> machines;

    /**
     * @param machines the machines, with distinct names
     * @throws IllegalArgumentException if two machines have the same name
     */
    public StateMachineRegistry(List<StateMachine> machines) {
        Set<String> names = new HashSet<>();
        for (StateMachine m : machines) {
            if (!names.add(m.getName())) {
                throw new IllegalArgumentException(
                        "Duplicate state machine name: " + m.getName());
            }
        }
        this.machines = ImmutableList.copyOf(machines);
    }

    public static StateMachineRegistry of(StateMachine... machines) {
        return new StateMachineRegistry(Arrays.asList(machines));
    }

    public ImmutableList<StateMachine> getMachines() {
        return machines;
    }

    public @Nullable StateMachine getMachine(String name) {
        for (StateMachine m : machines) {
            if (m.getName().equals(name)) {
                return m;
            }
        }
        return null;
    }

    /** @return the machines that track the result of {@code function}, in registration order */
    public ImmutableList<StateMachine> machinesAllocatingWith(String function) {
        ImmutableList.Builder<StateMachine> result = ImmutableList.builder();
        for (StateMachine m : machines) {
            if (m.isAllocator(function)) {
                result.add(m);
            }
        }
        return result.build();
    }

    @Override
    public String toString() {
        return "StateMachineRegistry" + machines;
    }
}
