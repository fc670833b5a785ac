package org.smchecker.framework.checker.malloc;

import org.smchecker.framework.statemachine.State;
import org.smchecker.framework.statemachine.StateMachine;
import org.smchecker.framework.statemachine.Trigger;

/**
 * The lifecycle of memory obtained from {@code malloc}.
 *
 * <pre>
 *               ptr != NULL                 free(ptr)
 *   unchecked ---------------> non-null ---------------> freed
 *       |                          |                       |
 *       | ptr == NULL              | exit                  | free(ptr): double-free
 *       v                          v                       | *ptr: use-after-free
 *     null                       leak
 * </pre>
 *
 * Freeing or dereferencing an unchecked pointer, and freeing or dereferencing a null pointer, are
 * defects too.
 */
public final class MallocStateMachine {

    public static final String NAME = "malloc";

    public static final State UNCHECKED = State.normal("unchecked");
    public static final State NULL = State.normal("null");
    public static final State NON_NULL = State.normal("non-null");
    public static final State FREED = State.normal("freed");
    public static final State STOP = State.stop("stop");

    public static final State DOUBLE_FREE = State.bad("double-free");
    public static final State FREE_OF_NULL = State.bad("free-of-null");
    public static final State FREE_OF_UNCHECKED = State.bad("free-of-unchecked");
    public static final State NULL_DEREF = State.bad("null-deref");
    public static final State UNCHECKED_DEREF = State.bad("unchecked-deref");
    public static final State USE_AFTER_FREE = State.bad("use-after-free");
    public static final State LEAK = State.bad("leak");

    private MallocStateMachine() {
        throw new AssertionError("Class MallocStateMachine cannot be instantiated.");
    }

    public static StateMachine create() {
        Trigger free = Trigger.call("free");
        return StateMachine.builder(NAME)
                .start(UNCHECKED)
                .state(NULL)
                .state(NON_NULL)
                .state(FREED)
                .state(STOP)
                .state(DOUBLE_FREE)
                .state(FREE_OF_NULL)
                .state(FREE_OF_UNCHECKED)
                .state(NULL_DEREF)
                .state(UNCHECKED_DEREF)
                .state(USE_AFTER_FREE)
                .state(LEAK)
                .allocator("malloc")
                .transition(UNCHECKED, Trigger.ASSUME_TRUE, NON_NULL)
                .transition(UNCHECKED, Trigger.ASSUME_FALSE, NULL)
                .transition(UNCHECKED, free, FREE_OF_UNCHECKED)
                .transition(UNCHECKED, Trigger.DEREFERENCE, UNCHECKED_DEREF)
                .transition(NULL, free, FREE_OF_NULL)
                .transition(NULL, Trigger.DEREFERENCE, NULL_DEREF)
                .transition(NON_NULL, free, FREED)
                .transition(NON_NULL, Trigger.EXIT, LEAK)
                .transition(FREED, free, DOUBLE_FREE)
                .transition(FREED, Trigger.DEREFERENCE, USE_AFTER_FREE)
                .build();
    }
}
