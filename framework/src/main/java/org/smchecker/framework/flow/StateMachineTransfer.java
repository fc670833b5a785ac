package org.smchecker.framework.flow;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smchecker.dataflow.analysis.ConditionKey;
import org.smchecker.dataflow.analysis.PathTransferFunction;
import org.smchecker.dataflow.analysis.TransferInput;
import org.smchecker.dataflow.cfg.ControlFlowGraph;
import org.smchecker.dataflow.cfg.block.Block;
import org.smchecker.dataflow.cfg.block.Edge;
import org.smchecker.dataflow.cfg.block.Guard;
import org.smchecker.dataflow.cfg.node.AbstractNodeVisitor;
import org.smchecker.dataflow.cfg.node.AssignmentNode;
import org.smchecker.dataflow.cfg.node.CallNode;
import org.smchecker.dataflow.cfg.node.DereferenceNode;
import org.smchecker.dataflow.cfg.node.LiteralNode;
import org.smchecker.dataflow.cfg.node.LocalVariableNode;
import org.smchecker.dataflow.cfg.node.Node;
import org.smchecker.dataflow.cfg.node.ReturnNode;
import org.smchecker.framework.diagnostic.Diagnostic;
import org.smchecker.framework.diagnostic.DiagnosticSink;
import org.smchecker.framework.statemachine.State;
import org.smchecker.framework.statemachine.StateMachine;
import org.smchecker.framework.statemachine.StateMachineRegistry;
import org.smchecker.framework.statemachine.Trigger;

/**
 * The transfer function that drives the state machines of a {@link StateMachineRegistry} along a
 * path.
 *
 * <ul>
 *   <li>{@code v = f(...)}, {@code f} an allocator: {@code v} holds a fresh {@link TrackedValue}
 *       in the start state of every machine allocating with {@code f}.
 *   <li>{@code v = w}: {@code v} holds the value of {@code w}, if any.
 *   <li>any assignment to {@code v}: the value {@code v} held before is orphaned (it keeps its
 *       states, so it can still leak), and the facts about {@code v} are forgotten.
 *   <li>{@code f(v)}: fires {@link Trigger#call(String)} on the value of {@code v}.
 *   <li>{@code *v}: fires {@link Trigger#DEREFERENCE}.
 *   <li>a branch on {@code v}: fires {@link Trigger#ASSUME_TRUE} or {@link Trigger#ASSUME_FALSE}.
 *   <li>{@code return v}: the value escapes to the caller and is no longer tracked.
 *   <li>the exit of the function: fires {@link Trigger#EXIT} on every value still tracked.
 * </ul>
 *
 * A value entering a bad state is reported to the {@link DiagnosticSink} and moved to the stop
 * state of its machine.
 */
public class StateMachineTransfer
        extends AbstractNodeVisitor<ProgramState, TransferInput<ProgramState>>
        implements PathTransferFunction<ProgramState> {

    private static final Logger logger = LoggerFactory.getLogger(StateMachineTransfer.class);

    protected final StateMachineRegistry registry;

    protected final DiagnosticSink sink;

    public StateMachineTransfer(StateMachineRegistry registry, DiagnosticSink sink) {
        this.registry = registry;
        this.sink = sink;
    }

    public DiagnosticSink getSink() {
        return sink;
    }

    @Override
    public ProgramState initialStore(ControlFlowGraph cfg) {
        return ProgramState.empty();
    }

    /** Operands on their own have no effect. */
    @Override
    public ProgramState visitNode(Node n, TransferInput<ProgramState> in) {
        return in.getStore();
    }

    @Override
    public ProgramState visitCall(CallNode n, TransferInput<ProgramState> in) {
        return evaluateCall(n, n, in.getStore(), in);
    }

    @Override
    public ProgramState visitDereference(DereferenceNode n, TransferInput<ProgramState> in) {
        return fire(in.getStore(), n.getOperand().getName(), Trigger.DEREFERENCE, n, in);
    }

    @Override
    public ProgramState visitAssignment(AssignmentNode n, TransferInput<ProgramState> in) {
        String target = n.getTarget().getName();
        Node expression = n.getExpression();
        ProgramState store = in.getStore();

        @Nullable TrackedValue assigned = null;
        ImmutableList<StateMachine> allocating = ImmutableList.of();
        if (expression instanceof CallNode) {
            CallNode call = (CallNode) expression;
            store = evaluateCall(call, n, store, in);
            allocating = registry.machinesAllocatingWith(call.getFunctionName());
            if (!allocating.isEmpty()) {
                assigned = freshValue(target, n, store);
            }
        } else if (expression instanceof LocalVariableNode) {
            assigned = store.getBinding(((LocalVariableNode) expression).getName());
        } else {
            store = evaluateOperand(expression, n, store, in);
        }

        store = store.unbind(target);
        store = store.withFacts(store.getFacts().without(ConditionKey.ofVariable(target)));
        if (assigned != null) {
            for (StateMachine m : allocating) {
                store = store.withState(m.getName(), assigned, m.getStartState());
            }
            store = store.bind(target, assigned);
        }
        return store;
    }

    @Override
    public ProgramState visitReturn(ReturnNode n, TransferInput<ProgramState> in) {
        Node result = n.getResult();
        if (result == null) {
            return in.getStore();
        }
        ProgramState store = evaluateOperand(result, n, in.getStore(), in);
        if (result instanceof LocalVariableNode) {
            TrackedValue escaping = store.getBinding(((LocalVariableNode) result).getName());
            if (escaping != null) {
                logger.debug("{} escapes through {}", escaping, n);
                store = store.forget(escaping);
            }
        }
        return store;
    }

    @Override
    public ProgramState visitEdge(Edge edge, TransferInput<ProgramState> in) {
        Guard guard = edge.getGuard();
        if (guard == null) {
            throw new BugInCF("visitEdge called for unguarded edge " + edge);
        }
        ProgramState store = in.getStore();
        TrackedValue value = store.getBinding(guard.getVariable());
        if (value == null) {
            return store;
        }
        String location = "branch '" + guard + "' of " + describe(in.getBlock());
        return fire(
                store, value, guard.getVariable(), Trigger.assume(guard.getValue()), location, in);
    }

    @Override
    public void visitExit(TransferInput<ProgramState> in) {
        ProgramState store = in.getStore();
        String location = "exit of " + describe(in.getBlock());
        for (TrackedValue value : store.getTrackedValues()) {
            store = fire(store, value, variableOf(store, value), Trigger.EXIT, location, in);
        }
    }

    /** Fire the triggers of a call on its arguments, nested calls first. */
    protected ProgramState evaluateCall(
            CallNode call, Node effect, ProgramState store, TransferInput<ProgramState> in) {
        Trigger trigger = Trigger.call(call.getFunctionName());
        for (Node arg : call.getArguments()) {
            if (arg instanceof LocalVariableNode) {
                store = fire(store, ((LocalVariableNode) arg).getName(), trigger, effect, in);
            } else {
                store = evaluateOperand(arg, effect, store, in);
            }
        }
        return store;
    }

    /** Apply the effects hidden in an operand: nested calls and dereferences. */
    protected ProgramState evaluateOperand(
            Node operand, Node effect, ProgramState store, TransferInput<ProgramState> in) {
        if (operand instanceof CallNode) {
            return evaluateCall((CallNode) operand, effect, store, in);
        } else if (operand instanceof DereferenceNode) {
            String variable = ((DereferenceNode) operand).getOperand().getName();
            return fire(store, variable, Trigger.DEREFERENCE, effect, in);
        } else if (operand instanceof LocalVariableNode || operand instanceof LiteralNode) {
            return store;
        }
        throw new BugInCF("Unexpected operand " + operand + " of " + effect);
    }

    private ProgramState fire(
            ProgramState store,
            String variable,
            Trigger trigger,
            Node effect,
            TransferInput<ProgramState> in) {
        TrackedValue value = store.getBinding(variable);
        if (value == null) {
            return store;
        }
        String location = "'" + effect + "' in " + describe(in.getBlock());
        return fire(store, value, variable, trigger, location, in);
    }

    /**
     * Fire {@code trigger} on {@code value} in every machine tracking it.
     *
     * @param variable the variable through which the value is used, for the diagnostic
     * @param location where the trigger happens, for the diagnostic
     */
    protected ProgramState fire(
            ProgramState store,
            TrackedValue value,
            String variable,
            Trigger trigger,
            String location,
            TransferInput<ProgramState> in) {
        for (Map.Entry<String, State> e : store.getStates(value).entrySet()) {
            StateMachine machine = registry.getMachine(e.getKey());
            if (machine == null) {
                throw new BugInCF("No state machine named " + e.getKey() + " in " + registry);
            }
            State next = machine.transition(e.getValue(), trigger);
            if (next == null) {
                continue;
            }
            if (next.isBad()) {
                Diagnostic d =
                        new Diagnostic(
                                machine.getName(),
                                variable,
                                value,
                                next.getName(),
                                location,
                                in.getBlock().getId(),
                                in.getWitness().toList());
                sink.report(d);
                next = machine.getStopState();
            }
            logger.debug(
                    "{}: {} {} -> {} on {}", machine.getName(), value, e.getValue(), next, trigger);
            store = store.withState(machine.getName(), value, next);
        }
        return store;
    }

    /**
     * A new value for the allocation {@code site}. If the site already produced a value this path
     * still knows about, the new value is the next generation.
     */
    private static TrackedValue freshValue(String variable, Node site, ProgramState store) {
        TrackedValue candidate = TrackedValue.at(variable, site, 0);
        int generation = -1;
        for (TrackedValue v : store.getTrackedValues()) {
            if (v.isSameSite(candidate)) {
                generation = Math.max(generation, v.getGeneration());
            }
        }
        for (TrackedValue v : store.getBindings().values()) {
            if (v.isSameSite(candidate)) {
                generation = Math.max(generation, v.getGeneration());
            }
        }
        return generation < 0 ? candidate : TrackedValue.at(variable, site, generation + 1);
    }

    /** A variable holding {@code value}, or the variable it was allocated to if none does. */
    private static String variableOf(ProgramState store, TrackedValue value) {
        @Nullable String holder = null;
        for (Map.Entry<String, TrackedValue> e : store.getBindings().entrySet()) {
            if (e.getValue().equals(value)
                    && (holder == null || e.getKey().compareTo(holder) < 0)) {
                holder = e.getKey();
            }
        }
        return holder == null ? value.getVariable() : holder;
    }

    private static String describe(Block b) {
        return "block " + b.getId() + " (" + b.getLabel() + ")";
    }
}
