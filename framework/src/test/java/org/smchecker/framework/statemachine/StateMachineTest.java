package org.smchecker.framework.statemachine;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import org.junit.Test;
import org.smchecker.framework.checker.malloc.MallocStateMachine;

public class StateMachineTest {

    private static final State OPEN = State.normal("open");
    private static final State CLOSED = State.normal("closed");
    private static final State DONE = State.stop("done");

    private static StateMachine.Builder files() {
        return StateMachine.builder("file")
                .start(OPEN)
                .state(CLOSED)
                .state(DONE)
                .allocator("fopen");
    }

    @Test
    public void mallocTransitions() {
        StateMachine malloc = MallocStateMachine.create();
        Trigger free = Trigger.call("free");

        assertThat(malloc.getStartState(), is(MallocStateMachine.UNCHECKED));
        assertThat(malloc.isAllocator("malloc"), is(true));
        assertThat(malloc.isAllocator("free"), is(false));
        assertThat(
                malloc.transition(MallocStateMachine.UNCHECKED, Trigger.assume(true)),
                is(MallocStateMachine.NON_NULL));
        assertThat(
                malloc.transition(MallocStateMachine.UNCHECKED, Trigger.assume(false)),
                is(MallocStateMachine.NULL));
        assertThat(
                malloc.transition(MallocStateMachine.NON_NULL, free),
                is(MallocStateMachine.FREED));
        assertThat(
                malloc.transition(MallocStateMachine.FREED, free),
                is(MallocStateMachine.DOUBLE_FREE));
        assertThat(
                malloc.transition(MallocStateMachine.NON_NULL, Trigger.EXIT),
                is(MallocStateMachine.LEAK));
        assertThat(malloc.transition(MallocStateMachine.FREED, Trigger.EXIT), is(nullValue()));
        assertThat(
                malloc.transition(MallocStateMachine.NON_NULL, Trigger.call("use")),
                is(nullValue()));
        assertThat(MallocStateMachine.LEAK.isBad(), is(true));
    }

    @Test
    public void triggersCompareByKindAndFunction() {
        assertThat(Trigger.call("free"), is(Trigger.call("free")));
        assertThat(Trigger.call("free").equals(Trigger.call("fclose")), is(false));
        assertThat(Trigger.assume(true), is(Trigger.ASSUME_TRUE));
        assertThat(Trigger.call("free").toString(), is("free()"));
    }

    @Test
    public void builtMachinesKeepTheirDeclarations() {
        StateMachine m = files().transition(OPEN, Trigger.call("fclose"), CLOSED).build();
        assertThat(m.getStates().size(), is(3));
        assertThat(m.getStopState(), is(DONE));
        assertThat(m.transition(OPEN, Trigger.call("fclose")), is(CLOSED));
    }

    @Test(expected = IllegalArgumentException.class)
    public void undeclaredStatesAreRejected() {
        files().transition(OPEN, Trigger.EXIT, State.bad("unclosed"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void theStopStateHasNoTransitions() {
        files().transition(DONE, Trigger.EXIT, OPEN);
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateTransitionsAreRejected() {
        files().transition(OPEN, Trigger.EXIT, CLOSED).transition(OPEN, Trigger.EXIT, DONE);
    }

    @Test(expected = IllegalStateException.class)
    public void aStopStateIsRequired() {
        StateMachine.builder("nostop").start(OPEN).allocator("fopen").build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void registryNamesAreUnique() {
        StateMachineRegistry.of(MallocStateMachine.create(), MallocStateMachine.create());
    }

    @Test
    public void registryFindsMachinesByAllocator() {
        StateMachine malloc = MallocStateMachine.create();
        StateMachine file = files().build();
        StateMachineRegistry registry = StateMachineRegistry.of(malloc, file);

        assertThat(registry.getMachine("file"), is(file));
        assertThat(registry.getMachine("socket"), is(nullValue()));
        assertThat(registry.machinesAllocatingWith("fopen").size(), is(1));
        assertThat(registry.machinesAllocatingWith("fopen").get(0), is(file));
        assertThat(registry.machinesAllocatingWith("free").isEmpty(), is(true));
    }
}
