package org.smchecker.dataflow.cfg;

import java.util.List;
import java.util.Set;
import org.smchecker.dataflow.cfg.block.Block;
import org.smchecker.dataflow.cfg.block.Edge;
import org.smchecker.dataflow.cfg.block.Guard;
import org.smchecker.dataflow.cfg.node.Node;
import org.smchecker.dataflow.cfg.node.ReturnNode;

/**
 * Structural checks run on a {@link ControlFlowGraph} before it is explored. A graph that passes
 * has exactly one entry block, at least one exit block, only reachable blocks, and branches of
 * the shape the explorer relies on:
 *
 * <ul>
 *   <li>a block with one successor reaches it through an unguarded edge;
 *   <li>a block with two successors has two guarded edges with complementary guards on the same
 *       variable;
 *   <li>no block has more than two successors;
 *   <li>every guarded variable is a parameter or is assigned somewhere in the graph.
 * </ul>
 */
public final class CFGValidator {

    private CFGValidator() {
        throw new AssertionError("Class CFGValidator cannot be instantiated.");
    }

    /**
     * Validate {@code cfg}.
     *
     * @param cfg the graph to check
     * @throws MalformedCFGException describing the first problem found
     */
    public static void validate(ControlFlowGraph cfg) {
        List<Block> entries = cfg.getEntryBlocks();
        if (entries.isEmpty()) {
            throw new MalformedCFGException("%s: graph has no entry block", cfg.getFunctionName());
        }
        if (entries.size() > 1) {
            throw new MalformedCFGException(
                    "%s: graph has %d entry blocks, expected exactly one: %s",
                    cfg.getFunctionName(), entries.size(), entries);
        }

        Set<Block> reachable = cfg.getReachableBlocks();
        for (Block b : cfg.getAllBlocks()) {
            if (!reachable.contains(b)) {
                throw new MalformedCFGException(
                        "%s: %s is not reachable from the entry block", cfg.getFunctionName(), b);
            }
        }
        if (cfg.getExitBlocks().isEmpty()) {
            throw new MalformedCFGException("%s: graph has no exit block", cfg.getFunctionName());
        }

        Set<String> known = cfg.getAssignedVariables();
        for (Block b : cfg.getAllBlocks()) {
            validateContents(cfg, b);
            validateSuccessors(cfg, b, known);
        }
    }

    private static void validateContents(ControlFlowGraph cfg, Block b) {
        List<Node> contents = b.getContents();
        for (int i = 0; i < contents.size() - 1; i++) {
            if (contents.get(i) instanceof ReturnNode) {
                throw new MalformedCFGException(
                        "%s: '%s' in %s is followed by further effects",
                        cfg.getFunctionName(), contents.get(i), b);
            }
        }
    }

    private static void validateSuccessors(ControlFlowGraph cfg, Block b, Set<String> known) {
        List<Edge> succs = b.getSuccessors();
        for (Edge e : succs) {
            Block target = e.getTarget();
            if (target.getId() >= cfg.getAllBlocks().size()
                    || cfg.getBlock(target.getId()) != target) {
                throw new MalformedCFGException(
                        "%s: edge %s leaves the graph", cfg.getFunctionName(), e);
            }
            Guard guard = e.getGuard();
            if (guard != null
                    && !cfg.getParameters().contains(guard.getVariable())
                    && !known.contains(guard.getVariable())) {
                throw new MalformedCFGException(
                        "%s: guard of edge %s refers to '%s', which is neither a parameter nor"
                                + " assigned in the graph",
                        cfg.getFunctionName(), e, guard.getVariable());
            }
        }

        switch (succs.size()) {
            case 0:
                break;
            case 1:
                if (succs.get(0).isConditional()) {
                    throw new MalformedCFGException(
                            "%s: single successor edge %s must not be guarded",
                            cfg.getFunctionName(), succs.get(0));
                }
                break;
            case 2:
                Guard first = succs.get(0).getGuard();
                Guard second = succs.get(1).getGuard();
                if (first == null || second == null || !first.isComplementOf(second)) {
                    throw new MalformedCFGException(
                            "%s: branch in %s needs two complementary guards on one variable,"
                                    + " found %s",
                            cfg.getFunctionName(), b, succs);
                }
                break;
            default:
                throw new MalformedCFGException(
                        "%s: %s has %d successors, at most two are supported",
                        cfg.getFunctionName(), b, succs.size());
        }
    }
}
