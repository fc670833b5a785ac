package org.smchecker.framework.checker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smchecker.dataflow.analysis.AnalysisOptions;
import org.smchecker.dataflow.analysis.PathSensitiveAnalysis;
import org.smchecker.dataflow.cfg.ControlFlowGraph;
import org.smchecker.framework.diagnostic.DiagnosticSink;
import org.smchecker.framework.flow.ProgramState;
import org.smchecker.framework.flow.StateMachineTransfer;
import org.smchecker.framework.statemachine.StateMachineRegistry;

/**
 * Checks functions against the state machines of a {@link StateMachineRegistry}.
 *
 * <p>Every call to {@link #check(ControlFlowGraph)} runs a fresh {@link PathSensitiveAnalysis}
 * with a fresh {@link DiagnosticSink}, so a checker can check several functions at the same
 * time. Subclasses can override {@link #createTransferFunction(DiagnosticSink)} to customize how
 * effects drive the machines.
 */
public class StateMachineChecker {

    private static final Logger logger = LoggerFactory.getLogger(StateMachineChecker.class);

    protected final StateMachineRegistry registry;

    protected final AnalysisOptions options;

    public StateMachineChecker(StateMachineRegistry registry, AnalysisOptions options) {
        this.registry = registry;
        this.options = options;
    }

    public StateMachineRegistry getRegistry() {
        return registry;
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    /**
     * Check one function.
     *
     * @param cfg the control flow graph of the function
     * @return the diagnostics and the coverage of the check
     * @throws org.smchecker.dataflow.cfg.MalformedCFGException if {@code cfg} is not well formed
     */
    public CheckerResult check(ControlFlowGraph cfg) {
        DiagnosticSink sink = new DiagnosticSink();
        StateMachineTransfer transfer = createTransferFunction(sink);
        PathSensitiveAnalysis<ProgramState, StateMachineTransfer> analysis =
                new PathSensitiveAnalysis<>(transfer, options);
        analysis.performAnalysis(cfg);

        CheckerResult result =
                new CheckerResult(
                        cfg.getFunctionName(), sink.getDiagnostics(), analysis.getResult());
        logger.info(
                "{}: {} diagnostic(s) from {} report(s), coverage {}",
                cfg.getFunctionName(),
                result.getDiagnostics().size(),
                sink.getReportCount(),
                result.getCoverage());
        return result;
    }

    /** Create the transfer function for one run, reporting into {@code sink}. */
    protected StateMachineTransfer createTransferFunction(DiagnosticSink sink) {
        return new StateMachineTransfer(registry, sink);
    }
}
