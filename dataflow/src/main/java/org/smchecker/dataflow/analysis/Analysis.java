package org.smchecker.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.cfg.ControlFlowGraph;

/**
 * General path-sensitive analysis interface. An analysis explores the paths of a control flow
 * graph, driving a transfer function along each of them and pruning the edges a path cannot take.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the transfer function type that is used to approximate runtime behavior
 */
public interface Analysis<S extends PathStore<S>, T extends PathTransferFunction<S>> {

    /**
     * Get the status of the analysis that whether it is currently running.
     *
     * @return true if the analysis is running currently
     */
    boolean isRunning();

    /**
     * Perform the actual analysis. The graph is validated first.
     *
     * @param cfg the control flow graph
     * @throws org.smchecker.dataflow.cfg.MalformedCFGException if {@code cfg} is not well formed
     */
    void performAnalysis(ControlFlowGraph cfg);

    /**
     * The result of running the analysis. This is only available once the analysis finished
     * running.
     *
     * @return the result of running the analysis
     */
    AnalysisResult<S> getResult();

    /**
     * Get the transfer function of this analysis.
     *
     * @return the transfer function of this analysis
     */
    @Nullable T getTransferFunction();

    /** @return the options this analysis was created with */
    AnalysisOptions getOptions();
}
