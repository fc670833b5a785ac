package org.smchecker.dataflow.cfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.cfg.block.BlockImpl;
import org.smchecker.dataflow.cfg.block.Guard;
import org.smchecker.dataflow.cfg.node.AssignmentNode;
import org.smchecker.dataflow.cfg.node.CallNode;
import org.smchecker.dataflow.cfg.node.DereferenceNode;
import org.smchecker.dataflow.cfg.node.LiteralNode;
import org.smchecker.dataflow.cfg.node.LocalVariableNode;
import org.smchecker.dataflow.cfg.node.Node;
import org.smchecker.dataflow.cfg.node.ReturnNode;

/**
 * Builds a {@link ControlFlowGraph}. This is the interface a front end uses to hand a function to
 * the analysis. Blocks are referred to by label; the first block added is the entry block.
 *
 * <pre>{@code
 * ControlFlowGraph cfg =
 *         new CFGBuilder("test", "flag")
 *                 .block("entry")
 *                 .block("alloc", assign("ptr", call("malloc", literal("1024"))))
 *                 .block("done", ret())
 *                 .branch("entry", "flag", "alloc", "done")
 *                 .jump("alloc", "done")
 *                 .build();
 * }</pre>
 *
 * The builder only rejects what it cannot represent (unknown or duplicate labels). Everything else
 * is checked by {@link CFGValidator} before an analysis runs.
 */
public class CFGBuilder {

    private final String functionName;
    private final List<String> parameters;
    private final Map<String, BlockImpl> blocks = new LinkedHashMap<>();
    private final List<BlockImpl> extraEntries = new ArrayList<>();
    private boolean built = false;

    /**
     * Start a graph for a function.
     *
     * @param functionName the name of the function
     * @param parameters the named inputs of the function
     */
    public CFGBuilder(String functionName, String... parameters) {
        this.functionName = functionName;
        this.parameters = new ArrayList<>(Arrays.asList(parameters));
    }

    /** Declare another named input of the function. */
    public CFGBuilder parameter(String name) {
        parameters.add(name);
        return this;
    }

    /**
     * Add a block with the given effects. The first block added is the entry block.
     *
     * @param label the label of the new block, unique in this graph
     * @param effects the effects of the block, in execution order
     * @return this builder
     */
    public CFGBuilder block(String label, Node... effects) {
        checkNotBuilt();
        if (blocks.containsKey(label)) {
            throw new MalformedCFGException("duplicate block label '%s'", label);
        }
        BlockImpl b = new BlockImpl(blocks.size(), label);
        for (Node effect : effects) {
            b.addNode(effect);
        }
        blocks.put(label, b);
        return this;
    }

    /**
     * Mark an additional block as entry. Only useful to hand malformed graphs to the validator.
     */
    public CFGBuilder alsoEntry(String label) {
        extraEntries.add(lookup(label));
        return this;
    }

    /** Add an unconditional edge. */
    public CFGBuilder jump(String from, String to) {
        return edge(from, to, null);
    }

    /**
     * Add a two-way branch on the truth of {@code variable}.
     *
     * @param from the branching block
     * @param variable the tested variable
     * @param thenLabel the successor when {@code variable} is true (non-zero, non-null)
     * @param elseLabel the successor when {@code variable} is false (zero, null)
     * @return this builder
     */
    public CFGBuilder branch(String from, String variable, String thenLabel, String elseLabel) {
        edge(from, thenLabel, Guard.isTrue(variable));
        return edge(from, elseLabel, Guard.isFalse(variable));
    }

    /** Add a single edge with an arbitrary guard. */
    public CFGBuilder edge(String from, String to, @Nullable Guard guard) {
        checkNotBuilt();
        lookup(from).addSuccessor(lookup(to), guard);
        return this;
    }

    /** @return the graph; the builder cannot be used afterwards */
    public ControlFlowGraph build() {
        checkNotBuilt();
        built = true;
        List<BlockImpl> all = new ArrayList<>(blocks.values());
        List<BlockImpl> entries = new ArrayList<>();
        if (!all.isEmpty()) {
            entries.add(all.get(0));
        }
        entries.addAll(extraEntries);
        return new ControlFlowGraph(functionName, parameters, all, entries);
    }

    private BlockImpl lookup(String label) {
        BlockImpl b = blocks.get(label);
        if (b == null) {
            throw new MalformedCFGException("no block labeled '%s' in %s", label, functionName);
        }
        return b;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("CFGBuilder for " + functionName + " already built");
        }
    }

    // Factories for effects and operands.

    public static LocalVariableNode var(String name) {
        return new LocalVariableNode(name);
    }

    public static LiteralNode literal(String text) {
        return new LiteralNode(text);
    }

    public static CallNode call(String function, Node... args) {
        return new CallNode(function, Arrays.asList(args));
    }

    /** A call whose arguments are all variables. */
    public static CallNode callWith(String function, String... variables) {
        List<Node> args = new ArrayList<>();
        for (String v : variables) {
            args.add(var(v));
        }
        return new CallNode(function, args);
    }

    public static AssignmentNode assign(String variable, Node expression) {
        return new AssignmentNode(var(variable), expression);
    }

    public static DereferenceNode deref(String variable) {
        return new DereferenceNode(var(variable));
    }

    public static ReturnNode ret() {
        return new ReturnNode(null);
    }

    public static ReturnNode ret(Node result) {
        return new ReturnNode(result);
    }
}
