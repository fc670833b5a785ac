package org.smchecker.dataflow.analysis;

import org.smchecker.dataflow.cfg.ControlFlowGraph;
import org.smchecker.dataflow.cfg.block.Edge;
import org.smchecker.dataflow.cfg.node.NodeVisitor;

/**
 * Interface of a transfer function for the path-sensitive analysis.
 *
 * <p>A transfer function consists of the following components:
 *
 * <ul>
 *   <li>A method {@code initialStore} that determines the store a path starts with at the entry
 *       block.
 *   <li>A function for every {@link org.smchecker.dataflow.cfg.node.Node} type that takes the
 *       store before an effect and returns the store after it.
 *   <li>A method {@code visitEdge} applied after a path takes a guarded edge, once the guard's
 *       outcome has been recorded as a fact. This is where a null check refines the state of the
 *       value it tests.
 *   <li>A method {@code visitExit} applied when a path reaches a block without successors.
 * </ul>
 *
 * <p><em>Important</em>: Stores passed in are shared with other paths and must not be modified.
 * Implementations may be called from several threads at once when the analysis runs in parallel.
 *
 * @param <S> the store type used in the analysis
 */
public interface PathTransferFunction<S extends PathStore<S>>
        extends NodeVisitor<S, TransferInput<S>> {

    /**
     * Return the store a path starts with.
     *
     * @param cfg the graph that is about to be explored
     * @return the initial store
     */
    S initialStore(ControlFlowGraph cfg);

    /**
     * Apply a guarded edge the path has just taken.
     *
     * @param edge the edge taken; its guard is not {@code null}
     * @param in the store after recording the guard as a fact; its block is the source of the edge
     * @return the store at the start of the target block
     */
    S visitEdge(Edge edge, TransferInput<S> in);

    /**
     * Called once per path that reaches an exit block, after the effects of that block.
     *
     * @param in the final store of the path
     */
    void visitExit(TransferInput<S> in);
}
