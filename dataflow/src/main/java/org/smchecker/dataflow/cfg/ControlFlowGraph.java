package org.smchecker.dataflow.cfg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.cfg.block.Block;
import org.smchecker.dataflow.cfg.block.Edge;
import org.smchecker.dataflow.cfg.node.AssignmentNode;
import org.smchecker.dataflow.cfg.node.Node;

/**
 * A control flow graph (CFG) for one function, as produced by a front end. The graph consists of
 * basic blocks connected by possibly guarded edges; the first block is the entry block.
 *
 * <p>Graphs are created with a {@link CFGBuilder} and are not modified afterwards. Nothing here
 * checks that the graph is well formed; see {@link CFGValidator}.
 */
public class ControlFlowGraph {

    /** The name of the function this graph represents. */
    protected final String functionName;

    /** The named inputs of the function. */
    protected final ImmutableList<String> parameters;

    /** All blocks, indexed by their id. */
    protected final ImmutableList<Block> blocks;

    /** Blocks that claim to be an entry; a well formed graph has exactly one. */
    protected final ImmutableList<Block> entryBlocks;

    /** Lazily computed reverse post-order numbering of the reachable blocks. */
    private @Nullable ImmutableMap<Block, Integer> depthFirstOrder;

    ControlFlowGraph(
            String functionName,
            List<String> parameters,
            List<? extends Block> blocks,
            List<? extends Block> entryBlocks) {
        this.functionName = functionName;
        this.parameters = ImmutableList.copyOf(parameters);
        this.blocks = ImmutableList.copyOf(blocks);
        this.entryBlocks = ImmutableList.copyOf(entryBlocks);
    }

    public String getFunctionName() {
        return functionName;
    }

    public ImmutableList<String> getParameters() {
        return parameters;
    }

    /** @return the entry block of this graph, or {@code null} if the graph has none */
    public @Nullable Block getEntryBlock() {
        return entryBlocks.isEmpty() ? null : entryBlocks.get(0);
    }

    public ImmutableList<Block> getEntryBlocks() {
        return entryBlocks;
    }

    /** @return all blocks of this graph, ordered by id */
    public ImmutableList<Block> getAllBlocks() {
        return blocks;
    }

    public Block getBlock(int id) {
        return blocks.get(id);
    }

    /** @return the block with the given label, or {@code null} if there is none */
    public @Nullable Block getBlock(String label) {
        for (Block b : blocks) {
            if (b.getLabel().equals(label)) {
                return b;
            }
        }
        return null;
    }

    /** @return the blocks without successors */
    public ImmutableList<Block> getExitBlocks() {
        ImmutableList.Builder<Block> exits = ImmutableList.builder();
        for (Block b : blocks) {
            if (b.isExit()) {
                exits.add(b);
            }
        }
        return exits.build();
    }

    /** @return all edges of this graph, grouped by source block */
    public ImmutableList<Edge> getEdges() {
        ImmutableList.Builder<Edge> edges = ImmutableList.builder();
        for (Block b : blocks) {
            edges.addAll(b.getSuccessors());
        }
        return edges.build();
    }

    /** @return the variables that are the target of some assignment in this graph */
    public ImmutableSet<String> getAssignedVariables() {
        Set<String> assigned = new LinkedHashSet<>();
        for (Block b : blocks) {
            for (Node n : b.getContents()) {
                if (n instanceof AssignmentNode) {
                    assigned.add(((AssignmentNode) n).getTarget().getName());
                }
            }
        }
        return ImmutableSet.copyOf(assigned);
    }

    /** @return the set of blocks reachable from the entry block, including the entry block */
    public Set<Block> getReachableBlocks() {
        Set<Block> visited = new HashSet<>();
        Block entry = getEntryBlock();
        if (entry == null) {
            return visited;
        }
        Deque<Block> worklist = new ArrayDeque<>();
        worklist.add(entry);
        visited.add(entry);
        while (!worklist.isEmpty()) {
            Block cur = worklist.poll();
            for (Edge e : cur.getSuccessors()) {
                if (visited.add(e.getTarget())) {
                    worklist.add(e.getTarget());
                }
            }
        }
        return visited;
    }

    /**
     * Number the reachable blocks in reverse post-order: every block gets a smaller number than
     * its successors, except along back edges. Used to order the worklist so that join blocks are
     * visited after their predecessors.
     *
     * @return a map from reachable block to its reverse post-order index
     */
    public synchronized ImmutableMap<Block, Integer> getDepthFirstOrder() {
        if (depthFirstOrder != null) {
            return depthFirstOrder;
        }
        List<Block> postOrder = new ArrayList<>();
        Map<Block, Boolean> visited = new IdentityHashMap<>();
        Block entry = getEntryBlock();
        if (entry != null) {
            // Iterative DFS; the second visit of a block on the stack emits it in post-order.
            Deque<Block> stack = new ArrayDeque<>();
            Deque<Boolean> expanded = new ArrayDeque<>();
            stack.push(entry);
            expanded.push(false);
            while (!stack.isEmpty()) {
                Block cur = stack.pop();
                boolean done = expanded.pop();
                if (done) {
                    postOrder.add(cur);
                    continue;
                }
                if (visited.containsKey(cur)) {
                    continue;
                }
                visited.put(cur, true);
                stack.push(cur);
                expanded.push(true);
                List<Edge> succs = cur.getSuccessors();
                for (int i = succs.size() - 1; i >= 0; i--) {
                    Block next = succs.get(i).getTarget();
                    if (!visited.containsKey(next)) {
                        stack.push(next);
                        expanded.push(false);
                    }
                }
            }
        }
        ImmutableMap.Builder<Block, Integer> order = ImmutableMap.builder();
        int n = postOrder.size();
        for (int i = 0; i < n; i++) {
            order.put(postOrder.get(i), n - 1 - i);
        }
        depthFirstOrder = order.build();
        return depthFirstOrder;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(functionName).append(parameters.toString().replace('[', '(').replace(']', ')'));
        sb.append(System.lineSeparator());
        for (Block b : blocks) {
            sb.append("  ").append(b).append(": ").append(b.getContents());
            sb.append(" -> ").append(b.getSuccessors()).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
